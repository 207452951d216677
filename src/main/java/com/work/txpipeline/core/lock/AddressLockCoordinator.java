package com.work.txpipeline.core.lock;

import com.work.txpipeline.core.exception.AddressLockTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;
import static com.work.txpipeline.core.support.ValidationUtils.requirePositive;

/**
 * 签名地址维度的互斥协调器：nonce 的读取、推进与分配记录必须在同一把锁内完成。
 *
 * <p>地址锁只覆盖分配这一步，不覆盖广播和等待 receipt；替换另有按 Intent 的锁。</p>
 */
public class AddressLockCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AddressLockCoordinator.class);

    private final AddressLockManager lockManager;
    private final Duration lockTtl;
    private final Duration waitTimeout;

    public AddressLockCoordinator(AddressLockManager lockManager, Duration lockTtl, Duration waitTimeout) {
        this.lockManager = requireNonNull(lockManager, "lockManager");
        this.lockTtl = requirePositive(lockTtl, "lockTtl");
        this.waitTimeout = requireNonNull(waitTimeout, "waitTimeout");
    }

    @FunctionalInterface
    public interface LockCallback<T> {
        T doInLock(String lockOwner);
    }

    public <T> T executeWithLock(long chainId, String address, LockCallback<T> action) {
        return execute(chainId + ":" + address.toLowerCase(), action);
    }

    /**
     * 同一 Intent 的替换串行执行：读最新 Send、加价、广播、落库都在这把锁内。
     * 与地址锁是不同的键，持有它时仍可再取地址锁。
     */
    public <T> T executeWithIntentLock(long intentId, LockCallback<T> action) {
        return execute("intent:" + intentId, action);
    }

    private <T> T execute(String lockKey, LockCallback<T> action) {
        requireNonNull(action, "action");
        String lockOwner = buildLockOwner();
        acquire(lockKey, lockOwner);
        try {
            return action.doInLock(lockOwner);
        } finally {
            releaseSafely(lockKey, lockOwner);
        }
    }

    private void acquire(String lockKey, String owner) {
        long deadline = System.nanoTime() + waitTimeout.toNanos();
        while (true) {
            if (lockManager.tryLock(lockKey, owner, lockTtl)) {
                return;
            }
            if (System.nanoTime() >= deadline) {
                throw new AddressLockTimeoutException("address lock contention: " + lockKey);
            }
            try {
                Thread.sleep(ThreadLocalRandom.current().nextLong(5, 50));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new AddressLockTimeoutException("interrupted while waiting for address lock: " + lockKey);
            }
        }
    }

    private void releaseSafely(String lockKey, String owner) {
        try {
            lockManager.unlock(lockKey, owner);
        } catch (RuntimeException e) {
            // 锁会在 ttl 后自动过期
            log.warn("address lock release failed key={} owner={} err={}", lockKey, owner, e.toString());
        }
    }

    /**
     * 生成“机器名 + 线程 ID + UUID”的锁持有者标识，便于排查日志。
     */
    private String buildLockOwner() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (Exception ex) {
            host = "unknown";
        }
        return host + "-" + Thread.currentThread().getId() + "-" + UUID.randomUUID();
    }
}
