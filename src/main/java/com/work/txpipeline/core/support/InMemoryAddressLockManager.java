package com.work.txpipeline.core.support;

import com.work.txpipeline.core.lock.AddressLockManager;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 单进程部署用的租约表：每个 (chainId, address) 键同一时刻只有一个租约，到期后可被抢占。
 *
 * <p>不支持重入，同一 owner 重复加锁同样会失败。</p>
 */
public class InMemoryAddressLockManager implements AddressLockManager {

    private final ConcurrentMap<String, Lease> leases = new ConcurrentHashMap<>();

    @Override
    public boolean tryLock(String lockKey, String lockOwner, Duration ttl) {
        long now = System.nanoTime();
        Lease lease = new Lease(lockOwner, now + ttl.toNanos());
        Lease held = leases.putIfAbsent(lockKey, lease);
        if (held == null) {
            return true;
        }
        return held.expiredAt(now) && leases.replace(lockKey, held, lease);
    }

    @Override
    public void unlock(String lockKey, String lockOwner) {
        Lease held = leases.get(lockKey);
        if (held != null && held.owner.equals(lockOwner)) {
            leases.remove(lockKey, held);
        }
    }

    int size() {
        return leases.size();
    }

    private static final class Lease {
        private final String owner;
        private final long deadlineNanos;

        private Lease(String owner, long deadlineNanos) {
            this.owner = owner;
            this.deadlineNanos = deadlineNanos;
        }

        private boolean expiredAt(long nowNanos) {
            return nowNanos - deadlineNanos >= 0;
        }
    }
}
