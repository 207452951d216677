package com.work.txpipeline.core.lock;

import java.time.Duration;

/**
 * 提供 per-(chain, signing address) 的分布式锁能力。默认实现使用内存 ConcurrentHashMap，
 * 多实例部署时启用 Redis 实现。
 */
public interface AddressLockManager {

    /**
     * 尝试获取锁。
     *
     * @param lockKey   chainId:address，或替换交易使用的 intent:id
     * @param lockOwner 当前线程/节点的标识
     * @param ttl       锁超时时间
     * @return true 表示加锁成功
     */
    boolean tryLock(String lockKey, String lockOwner, Duration ttl);

    /**
     * 释放锁（锁已超时或转移时为 no-op）。
     */
    void unlock(String lockKey, String lockOwner);
}
