package com.work.txpipeline.service.reconcile;

import com.work.txpipeline.chain.ChainConnector;
import com.work.txpipeline.chain.FeeSuggestion;
import com.work.txpipeline.chain.MockChainConnector;
import com.work.txpipeline.chain.TxReceipt;
import com.work.txpipeline.core.exception.ChainRpcException;
import com.work.txpipeline.domain.Allocation;
import com.work.txpipeline.domain.BuiltCall;
import com.work.txpipeline.domain.FeeParams;
import com.work.txpipeline.domain.IntentRequest;
import com.work.txpipeline.domain.IntentStatus;
import com.work.txpipeline.domain.IntentStatusView;
import com.work.txpipeline.repository.entity.TxIntentEntity;
import com.work.txpipeline.repository.entity.TxSendEntity;
import com.work.txpipeline.service.broadcast.SignedTransaction;
import com.work.txpipeline.support.PipelineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReceiptReconcilerTest {

    private final MockChainConnector chain = new MockChainConnector();
    private PipelineFixture f;
    private String address;

    private PipelineFixture start(PipelineFixture fixture) {
        return start(fixture, chain);
    }

    private PipelineFixture start(PipelineFixture fixture, ChainConnector connector) {
        f = fixture.build(connector, null);
        f.reconciler.start();
        address = f.importDefaultWallet();
        return f;
    }

    @AfterEach
    public void tearDown() {
        if (f != null && f.reconciler != null) {
            f.reconciler.stop();
        }
    }

    private IntentRequest request(String key) {
        return new IntentRequest(key, address, new BuiltCall(PipelineFixture.TO, BigInteger.ONE, null, null), null);
    }

    @Test
    public void mined_transaction_confirms_intent() {
        PipelineFixture f = start(new PipelineFixture());
        IntentStatusView sent = f.pipeline.registerIntent(request("rc-1"));
        chain.mine(sent.getTxHash());

        assertEquals(1, f.reconciler.reconcileSends());

        IntentStatusView view = f.pipeline.getIntentStatus(sent.getId());
        assertEquals(IntentStatus.CONFIRMED, view.getStatus());
        assertEquals(Integer.valueOf(1), view.getSends().get(0).getReceiptStatus());
        assertTrue(f.ledger.listPendingSends(10).isEmpty());
    }

    @Test
    public void reverted_transaction_fails_intent() {
        PipelineFixture f = start(new PipelineFixture());
        IntentStatusView sent = f.pipeline.registerIntent(request("rc-2"));
        chain.markReverting(sent.getTxHash());
        long block = chain.mine(sent.getTxHash()).getBlockNumber();

        f.reconciler.reconcileSends();

        IntentStatusView view = f.pipeline.getIntentStatus(sent.getId());
        assertEquals(IntentStatus.FAILED, view.getStatus());
        assertEquals("transaction reverted in block " + block, view.getReason());
    }

    @Test
    public void fresh_transaction_is_left_alone() {
        PipelineFixture fixture = new PipelineFixture();
        fixture.props.setStuckThreshold(Duration.ofMinutes(10));
        PipelineFixture f = start(fixture);
        IntentStatusView sent = f.pipeline.registerIntent(request("rc-3"));

        assertEquals(0, f.reconciler.reconcileSends());

        IntentStatusView view = f.pipeline.getIntentStatus(sent.getId());
        assertEquals(IntentStatus.SENT, view.getStatus());
        assertEquals(1, view.getSends().size());
    }

    @Test
    public void stuck_transaction_is_replaced_and_replacement_confirms() {
        PipelineFixture f = start(new PipelineFixture());
        IntentStatusView sent = f.pipeline.registerIntent(request("rc-4"));
        String s1 = sent.getTxHash();

        f.reconciler.reconcileSends();

        IntentStatusView replaced = f.pipeline.getIntentStatus(sent.getId());
        assertEquals(IntentStatus.SENT, replaced.getStatus());
        assertEquals(2, replaced.getSends().size());
        IntentStatusView.SendView first = replaced.getSends().get(0);
        IntentStatusView.SendView second = replaced.getSends().get(1);
        String s2 = second.getTxHash();
        assertEquals(s2, first.getReplacedBy());
        assertEquals(first.getNonce(), second.getNonce());
        assertTrue(second.getMaxFeePerGas() * 10 >= first.getMaxFeePerGas() * 11);
        assertTrue(second.getMaxPriorityFeePerGas() * 10 >= first.getMaxPriorityFeePerGas() * 11);
        assertFalse(chain.isPending(s1));

        chain.mine(s2);
        assertEquals(1, f.reconciler.reconcileSends());

        IntentStatusView done = f.pipeline.getIntentStatus(sent.getId());
        assertEquals(IntentStatus.CONFIRMED, done.getStatus());
        assertEquals(s2, done.getTxHash());
        assertEquals(s2, done.getSends().get(0).getReplacedBy());
        assertNull(done.getSends().get(1).getReplacedBy());
        assertTrue(f.ledger.listPendingSends(10).isEmpty());
    }

    @Test
    public void exhausted_replacements_fail_intent() {
        PipelineFixture fixture = new PipelineFixture();
        fixture.props.setMaxReplacements(1);
        PipelineFixture f = start(fixture);
        IntentStatusView sent = f.pipeline.registerIntent(request("rc-5"));

        assertEquals(0, f.reconciler.reconcileSends());
        assertEquals(1, f.reconciler.reconcileSends());

        IntentStatusView view = f.pipeline.getIntentStatus(sent.getId());
        assertEquals(IntentStatus.FAILED, view.getStatus());
        assertEquals("no receipt for nonce 0 after 1 replacements", view.getReason());
        assertEquals(1, view.getReplacementCount());
    }

    @Test
    public void nonce_consumed_outside_ledger_fails_intent() {
        PipelineFixture f = start(new PipelineFixture());
        IntentStatusView sent = f.pipeline.registerIntent(request("rc-6"));
        chain.setChainNonce(address, 1L);

        assertEquals(1, f.reconciler.reconcileSends());

        IntentStatusView view = f.pipeline.getIntentStatus(sent.getId());
        assertEquals(IntentStatus.FAILED, view.getStatus());
        assertEquals(ReceiptReconciler.NONCE_CONSUMED_REASON, view.getReason());
        assertEquals(1, view.getSends().size());
    }

    private long orphan(PipelineFixture f, String key) throws InterruptedException {
        long id = f.ledger.register(request(key)).getIntent().getId();
        f.allocator.allocate(id, address);
        Thread.sleep(5L);
        return id;
    }

    private SignedTransaction rebuild(PipelineFixture f, long id) {
        TxIntentEntity intent = f.ledger.require(id);
        Allocation allocation = new Allocation(intent.getAllocatedNonce(),
                new FeeParams(intent.getMaxFeePerGas(), intent.getMaxPriorityFeePerGas()),
                intent.getGasLimit());
        return f.broadcaster.sign(intent, allocation, f.ledger.builtCall(intent));
    }

    @Test
    public void orphan_never_broadcast_is_sent() throws Exception {
        PipelineFixture fixture = new PipelineFixture();
        fixture.props.setAllocatedOrphanTimeout(Duration.ZERO);
        PipelineFixture f = start(fixture);
        long id = orphan(f, "orphan-1");

        assertEquals(1, f.reconciler.recoverOrphanAllocations());

        IntentStatusView view = f.pipeline.getIntentStatus(id);
        assertEquals(IntentStatus.SENT, view.getStatus());
        assertTrue(chain.isPending(view.getTxHash()));
    }

    @Test
    public void orphan_already_in_mempool_is_adopted() throws Exception {
        PipelineFixture fixture = new PipelineFixture();
        fixture.props.setAllocatedOrphanTimeout(Duration.ZERO);
        PipelineFixture f = start(fixture);
        long id = orphan(f, "orphan-2");
        SignedTransaction signed = rebuild(f, id);
        chain.sendRawTransaction(Numeric.toHexString(signed.getRaw()));

        f.reconciler.recoverOrphanAllocations();

        IntentStatusView view = f.pipeline.getIntentStatus(id);
        assertEquals(IntentStatus.SENT, view.getStatus());
        assertEquals(signed.getTxHash(), view.getTxHash());
        assertEquals(1, view.getSends().size());
    }

    @Test
    public void orphan_already_mined_is_confirmed() throws Exception {
        PipelineFixture fixture = new PipelineFixture();
        fixture.props.setAllocatedOrphanTimeout(Duration.ZERO);
        PipelineFixture f = start(fixture);
        long id = orphan(f, "orphan-3");
        SignedTransaction signed = rebuild(f, id);
        chain.sendRawTransaction(Numeric.toHexString(signed.getRaw()));
        chain.mine(signed.getTxHash());

        f.reconciler.recoverOrphanAllocations();

        IntentStatusView view = f.pipeline.getIntentStatus(id);
        assertEquals(IntentStatus.CONFIRMED, view.getStatus());
        assertEquals(signed.getTxHash(), view.getTxHash());
    }

    @Test
    public void orphan_whose_nonce_was_used_elsewhere_fails() throws Exception {
        PipelineFixture fixture = new PipelineFixture();
        fixture.props.setAllocatedOrphanTimeout(Duration.ZERO);
        PipelineFixture f = start(fixture);
        long id = orphan(f, "orphan-4");
        chain.setChainNonce(address, 1L);

        f.reconciler.recoverOrphanAllocations();

        IntentStatusView view = f.pipeline.getIntentStatus(id);
        assertEquals(IntentStatus.FAILED, view.getStatus());
        assertEquals(ReceiptReconciler.NONCE_CONSUMED_REASON, view.getReason());
    }

    @Test
    public void recent_allocation_is_not_treated_as_orphan() {
        PipelineFixture f = start(new PipelineFixture());
        long id = f.ledger.register(request("orphan-5")).getIntent().getId();
        f.allocator.allocate(id, address);

        assertEquals(0, f.reconciler.recoverOrphanAllocations());
        assertEquals(IntentStatus.ALLOCATED, f.pipeline.getIntentStatus(id).getStatus());
    }

    @Test
    public void send_is_stuck_once_the_chain_moves_enough_blocks() {
        PipelineFixture fixture = new PipelineFixture();
        fixture.props.setStuckThreshold(Duration.ofMinutes(10));
        fixture.props.setStuckBlocks(2L);
        PipelineFixture f = start(fixture);
        IntentStatusView sent = f.pipeline.registerIntent(request("rc-blocks"));
        TxSendEntity first = f.ledger.latestSend(sent.getId());
        assertEquals(1L, first.getSentBlock().longValue());

        f.reconciler.reconcileSends();
        chain.mineEmptyBlock();
        f.reconciler.reconcileSends();
        assertEquals(1, f.pipeline.getIntentStatus(sent.getId()).getSends().size());

        chain.mineEmptyBlock();
        f.reconciler.reconcileSends();

        IntentStatusView view = f.pipeline.getIntentStatus(sent.getId());
        assertEquals(IntentStatus.SENT, view.getStatus());
        assertEquals(1, view.getReplacementCount());
        assertEquals(2, view.getSends().size());
        assertEquals(3L, f.ledger.latestSend(sent.getId()).getSentBlock().longValue());
        assertFalse(chain.isPending(first.getTxHash()));
    }

    @Test
    public void accepted_send_with_lost_acknowledgement_is_confirmed_after_mining() throws Exception {
        AckDroppingChain connector = new AckDroppingChain(chain);
        PipelineFixture fixture = new PipelineFixture();
        fixture.props.setAllocatedOrphanTimeout(Duration.ZERO);
        PipelineFixture f = start(fixture, connector);

        IntentStatusView submitted = f.pipeline.registerIntent(request("lost-ack-1"));

        assertEquals(IntentStatus.ALLOCATED, submitted.getStatus());
        assertEquals("network unavailable", submitted.getReason());
        String hash = rebuild(f, submitted.getId()).getTxHash();
        assertTrue(chain.isPending(hash));

        chain.mine(hash);
        connector.dropAcks = false;
        Thread.sleep(5L);
        assertEquals(1, f.reconciler.recoverOrphanAllocations());

        IntentStatusView view = f.pipeline.getIntentStatus(submitted.getId());
        assertEquals(IntentStatus.CONFIRMED, view.getStatus());
        assertNull(view.getReason());
        assertEquals(hash, view.getTxHash());
        assertEquals(1, view.getSends().size());
    }

    @Test
    public void accepted_send_with_lost_acknowledgement_is_adopted_while_pending() throws Exception {
        AckDroppingChain connector = new AckDroppingChain(chain);
        PipelineFixture fixture = new PipelineFixture();
        fixture.props.setAllocatedOrphanTimeout(Duration.ZERO);
        PipelineFixture f = start(fixture, connector);
        IntentStatusView submitted = f.pipeline.registerIntent(request("lost-ack-2"));
        String hash = rebuild(f, submitted.getId()).getTxHash();

        connector.dropAcks = false;
        Thread.sleep(5L);
        f.reconciler.recoverOrphanAllocations();

        IntentStatusView adopted = f.pipeline.getIntentStatus(submitted.getId());
        assertEquals(IntentStatus.SENT, adopted.getStatus());
        assertEquals(hash, adopted.getTxHash());

        chain.mine(hash);
        assertEquals(1, f.reconciler.reconcileSends());
        assertEquals(IntentStatus.CONFIRMED, f.pipeline.getIntentStatus(submitted.getId()).getStatus());
    }

    @Test
    public void unsignable_orphan_fails_without_stopping_the_batch() throws Exception {
        PipelineFixture fixture = new PipelineFixture();
        fixture.props.setAllocatedOrphanTimeout(Duration.ZERO);
        PipelineFixture f = start(fixture);
        String signer = address.toLowerCase();
        TxIntentEntity broken = new TxIntentEntity();
        broken.setIntentKey("orphan-broken");
        broken.setStatus(IntentStatus.CREATED.name());
        broken.setSigningAddress(signer);
        broken.setChainId(8453L);
        broken.setBuiltCall("{\"to\":\"" + PipelineFixture.TO + "\",\"value\":\"12x\",\"data\":\"0x\",\"gasLimitHint\":21000}");
        broken.setCreatedAt(Instant.now());
        broken.setUpdatedAt(Instant.now());
        long brokenId = f.repository.insertIntent(broken).getId();
        Thread.sleep(2L);
        long goodId = orphan(f, "orphan-good");
        f.allocator.allocate(brokenId, signer);
        assertEquals(2L, f.repository.findNextNonce(8453L, signer).longValue());
        Thread.sleep(5L);

        assertEquals(2, f.reconciler.recoverOrphanAllocations());

        IntentStatusView failed = f.pipeline.getIntentStatus(brokenId);
        assertEquals(IntentStatus.FAILED, failed.getStatus());
        assertEquals("invalid parameters", failed.getReason());
        assertEquals(1L, f.repository.findNextNonce(8453L, signer).longValue());
        IntentStatusView good = f.pipeline.getIntentStatus(goodId);
        assertEquals(IntentStatus.SENT, good.getStatus());
        assertTrue(chain.isPending(good.getTxHash()));
    }

    /**
     * 节点收下交易，但回给调用方的响应丢失。
     */
    private static final class AckDroppingChain implements ChainConnector {

        private final MockChainConnector delegate;
        volatile boolean dropAcks = true;

        AckDroppingChain(MockChainConnector delegate) {
            this.delegate = delegate;
        }

        @Override
        public long getPendingNonce(String address) {
            return delegate.getPendingNonce(address);
        }

        @Override
        public long getLatestNonce(String address) {
            return delegate.getLatestNonce(address);
        }

        @Override
        public FeeSuggestion suggestFees() {
            return delegate.suggestFees();
        }

        @Override
        public long estimateGas(String from, BuiltCall call) {
            return delegate.estimateGas(from, call);
        }

        @Override
        public String sendRawTransaction(String signedTxHex) {
            if (!dropAcks) {
                return delegate.sendRawTransaction(signedTxHex);
            }
            try {
                delegate.sendRawTransaction(signedTxHex);
            } catch (ChainRpcException e) {
                // 重试时节点回 already known，同样被丢弃
            }
            throw new ChainRpcException("read timed out", true);
        }

        @Override
        public TxReceipt getTransactionReceipt(String txHash) {
            return delegate.getTransactionReceipt(txHash);
        }

        @Override
        public long getLatestBlockNumber() {
            return delegate.getLatestBlockNumber();
        }
    }
}
