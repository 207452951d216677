package com.work.txpipeline.service.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.txpipeline.chain.TxReceipt;
import com.work.txpipeline.core.exception.InvalidTransitionException;
import com.work.txpipeline.domain.Allocation;
import com.work.txpipeline.domain.BuiltCall;
import com.work.txpipeline.domain.FeeParams;
import com.work.txpipeline.domain.IntentRegistration;
import com.work.txpipeline.domain.IntentRequest;
import com.work.txpipeline.domain.IntentStatus;
import com.work.txpipeline.repository.entity.TxIntentEntity;
import com.work.txpipeline.repository.entity.TxSendEntity;
import com.work.txpipeline.support.InMemoryTxLedgerRepository;
import com.work.txpipeline.support.PipelineFixture;
import com.work.txpipeline.support.metrics.NoopPipelineMetrics;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class IntentLedgerTest {

    private static final String SIGNER = "0x00000000000000000000000000000000000000b1";

    private final InMemoryTxLedgerRepository repository = new InMemoryTxLedgerRepository();
    private final IntentLedger ledger = new IntentLedger(repository, new ObjectMapper(), PipelineFixture.defaultProperties(), new NoopPipelineMetrics());

    private static IntentRequest request(String key, Map<String, Object> metadata) {
        return new IntentRequest(key, SIGNER, new BuiltCall(PipelineFixture.TO, BigInteger.TEN, null, null), metadata);
    }

    private TxSendEntity send(long intentId, long nonce, String hash) {
        TxSendEntity s = new TxSendEntity();
        s.setIntentId(intentId);
        s.setChainId(8453L);
        s.setSigningAddress(SIGNER);
        s.setNonce(nonce);
        s.setMaxFeePerGas(100L);
        s.setMaxPriorityFeePerGas(10L);
        s.setGasLimit(21_000L);
        s.setTxHash(hash);
        s.setSentAt(Instant.now());
        return s;
    }

    private long sentIntent(String key) {
        TxIntentEntity intent = ledger.register(request(key, null)).getIntent();
        ledger.recordAllocation(intent, null, new Allocation(0L, new FeeParams(100L, 10L), 21_000L));
        ledger.recordSent(intent.getId(), send(intent.getId(), 0L, "0xs1-" + key));
        return intent.getId();
    }

    @Test
    public void duplicate_register_returns_first_intent_unchanged() {
        Map<String, Object> first = new HashMap<>();
        first.put("source", "first");
        Map<String, Object> second = new HashMap<>();
        second.put("source", "second");

        IntentRegistration a = ledger.register(request("trade-42", first));
        IntentRegistration b = ledger.register(request("trade-42", second));

        assertFalse(a.isDuplicate());
        assertTrue(b.isDuplicate());
        assertEquals(a.getIntent().getId(), b.getIntent().getId());
        assertTrue(b.getIntent().getIntentMetadata().contains("first"));
        assertFalse(b.getIntent().getIntentMetadata().contains("second"));
    }

    @Test
    public void concurrent_register_creates_exactly_one_intent() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IntentRegistration>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return ledger.register(request("race-1", null));
            }));
        }
        start.countDown();
        Set<Long> ids = new HashSet<>();
        int created = 0;
        for (Future<IntentRegistration> f : futures) {
            IntentRegistration r = f.get(10, TimeUnit.SECONDS);
            ids.add(r.getIntent().getId());
            if (!r.isDuplicate()) {
                created++;
            }
        }
        pool.shutdownNow();
        assertEquals(1, ids.size());
        assertEquals(1, created);
    }

    @Test
    public void illegal_transition_is_rejected() {
        long id = ledger.register(request("k-illegal", null)).getIntent().getId();
        assertThrows(InvalidTransitionException.class, () -> ledger.transition(id, IntentStatus.CREATED, IntentStatus.SENT, null));
        assertThrows(InvalidTransitionException.class, () -> ledger.transition(id, IntentStatus.ALLOCATED, IntentStatus.SENT, null));
        assertEquals(IntentStatus.CREATED, IntentLedger.statusOf(ledger.require(id)));
    }

    @Test
    public void terminal_intent_is_never_moved() {
        long id = ledger.register(request("k-terminal", null)).getIntent().getId();
        assertTrue(ledger.markFailed(id, "gas estimation failed"));
        assertFalse(ledger.markFailed(id, "other reason"));
        assertThrows(InvalidTransitionException.class, () -> ledger.transition(id, IntentStatus.FAILED, IntentStatus.CREATED, null));
        assertEquals("gas estimation failed", ledger.require(id).getLastError());
    }

    @Test
    public void cancel_only_before_allocation() {
        long created = ledger.register(request("k-cancel", null)).getIntent().getId();
        ledger.cancel(created);
        assertEquals(IntentStatus.FAILED, IntentLedger.statusOf(ledger.require(created)));

        long sent = sentIntent("k-cancel-sent");
        assertThrows(InvalidTransitionException.class, () -> ledger.cancel(sent));
    }

    @Test
    public void recorded_send_is_idempotent_per_hash() {
        long id = sentIntent("k-idem");
        TxSendEntity again = ledger.recordSent(id, send(id, 0L, "0xs1-k-idem"));
        assertEquals(1, ledger.listSends(id).size());
        assertEquals("0xs1-k-idem", again.getTxHash());
    }

    @Test
    public void mined_send_becomes_head_of_replacement_chain() {
        long id = sentIntent("k-chain");
        TxSendEntity s1 = ledger.latestSend(id);
        TxSendEntity s2 = send(id, 0L, "0xs2");
        ledger.recordReplacement(id, s1, s2, new Allocation(0L, new FeeParams(110L, 11L), 21_000L));
        TxSendEntity s2Stored = ledger.latestSend(id);
        TxSendEntity s3 = send(id, 0L, "0xs3");
        ledger.recordReplacement(id, s2Stored, s3, new Allocation(0L, new FeeParams(121L, 13L), 21_000L));

        // s2 上链（s3 被丢弃）
        IntentStatus status = ledger.recordReceipt(id, ledger.listSends(id).get(1),
                new TxReceipt("0xs2", 1, 100L, 21_000L, 50L));

        assertEquals(IntentStatus.CONFIRMED, status);
        Map<String, String> next = new HashMap<>();
        for (TxSendEntity s : ledger.listSends(id)) {
            next.put(s.getTxHash(), s.getReplacedBy());
        }
        assertEquals("0xs2", next.get("0xs1-k-chain"));
        assertEquals("0xs2", next.get("0xs3"));
        assertNull(next.get("0xs2"));
        // 沿 replaced_by 从任一 Send 出发都在有限步内结束
        for (String start : next.keySet()) {
            Set<String> seen = new HashSet<>();
            String cur = start;
            while (cur != null) {
                assertTrue(seen.add(cur), "cycle at " + cur);
                cur = next.get(cur);
            }
        }
        assertEquals(2, ledger.require(id).getReplacementCount().intValue());
        assertTrue(ledger.listPendingSends(10).isEmpty());
    }

    @Test
    public void reverted_receipt_fails_intent_with_reason() {
        long id = sentIntent("k-revert");
        IntentStatus status = ledger.recordReceipt(id, ledger.latestSend(id), new TxReceipt("0xs1-k-revert", 0, 77L, 30_000L, 50L));
        assertEquals(IntentStatus.FAILED, status);
        assertEquals("transaction reverted in block 77", ledger.require(id).getLastError());
        assertEquals(Integer.valueOf(0), ledger.view(id).getSends().get(0).getReceiptStatus());
    }

    @Test
    public void register_rejects_value_and_data_that_cannot_be_encoded() {
        BuiltCall badValue = new BuiltCall(PipelineFixture.TO, null, null, 21_000L);
        badValue.setValue("12x");
        BuiltCall negative = new BuiltCall(PipelineFixture.TO, null, null, 21_000L);
        negative.setValue("-1");
        BuiltCall badData = new BuiltCall(PipelineFixture.TO, BigInteger.ONE, "0xzz", null);
        BuiltCall oddData = new BuiltCall(PipelineFixture.TO, BigInteger.ONE, "0xabc", null);

        assertThrows(IllegalArgumentException.class, () -> ledger.register(new IntentRequest("k-bad-value", SIGNER, badValue, null)));
        assertThrows(IllegalArgumentException.class, () -> ledger.register(new IntentRequest("k-negative", SIGNER, negative, null)));
        assertThrows(IllegalArgumentException.class, () -> ledger.register(new IntentRequest("k-bad-data", SIGNER, badData, null)));
        assertThrows(IllegalArgumentException.class, () -> ledger.register(new IntentRequest("k-odd-data", SIGNER, oddData, null)));

        assertNull(ledger.findByKey("k-bad-value"));
        assertNull(ledger.findByKey("k-bad-data"));
        assertNull(repository.findNextNonce(8453L, SIGNER));
    }

    @Test
    public void unresolved_broadcast_stays_allocated_until_a_send_is_recorded() {
        TxIntentEntity intent = ledger.register(request("k-unresolved", null)).getIntent();
        ledger.recordAllocation(intent, null, new Allocation(0L, new FeeParams(100L, 10L), 21_000L));

        assertTrue(ledger.recordUnconfirmedBroadcast(intent.getId(), "network unavailable"));
        TxIntentEntity kept = ledger.require(intent.getId());
        assertEquals(IntentStatus.ALLOCATED, IntentLedger.statusOf(kept));
        assertEquals("network unavailable", kept.getLastError());
        assertEquals(0L, kept.getAllocatedNonce().longValue());

        ledger.recordSent(intent.getId(), send(intent.getId(), 0L, "0xs1-k-unresolved"));
        TxIntentEntity sent = ledger.require(intent.getId());
        assertEquals(IntentStatus.SENT, IntentLedger.statusOf(sent));
        assertNull(sent.getLastError());
        assertFalse(ledger.recordUnconfirmedBroadcast(intent.getId(), "network unavailable"));
    }

    @Test
    public void replacing_an_already_replaced_send_writes_nothing() {
        long id = sentIntent("k-stale");
        TxSendEntity s1 = ledger.latestSend(id);
        ledger.recordReplacement(id, s1, send(id, 0L, "0xs2-stale"), new Allocation(0L, new FeeParams(110L, 11L), 21_000L));

        assertThrows(InvalidTransitionException.class, () -> ledger.requireLiveSend(id, s1));
        assertThrows(InvalidTransitionException.class,
                () -> ledger.recordReplacement(id, s1, send(id, 0L, "0xs3-stale"), new Allocation(0L, new FeeParams(125L, 13L), 21_000L)));

        assertEquals(1, ledger.require(id).getReplacementCount().intValue());
        assertEquals(2, ledger.listSends(id).size());
        assertEquals("0xs2-stale", repository.findSend(s1.getTxHash()).getReplacedBy());
        assertNull(repository.findSend("0xs3-stale"));
        assertEquals("0xs2-stale", ledger.requireLiveSend(id, ledger.latestSend(id)).getTxHash());
    }
}
