package com.work.txpipeline.core.lock.impl;

import com.work.txpipeline.core.exception.TxPipelineException;
import com.work.txpipeline.core.lock.AddressLockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonEmpty;
import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;
import static com.work.txpipeline.core.support.ValidationUtils.requirePositive;

/**
 * 基于 Redis 的分布式锁：SET NX PX 加锁，Lua 脚本校验 owner 后删除。
 */
public class RedisAddressLockManager implements AddressLockManager {

    private static final String LOCK_KEY_PREFIX = "txpipeline:lock:";
    private static final Logger LOGGER = LoggerFactory.getLogger(RedisAddressLockManager.class);

    // 只有锁的 owner 匹配时才删除
    private static final String UNLOCK_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('del', KEYS[1]) " +
            "else " +
            "    return 0 " +
            "end";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> unlockScript;

    public RedisAddressLockManager(StringRedisTemplate redisTemplate) {
        this.redisTemplate = requireNonNull(redisTemplate, "redisTemplate");
        this.unlockScript = new DefaultRedisScript<>();
        this.unlockScript.setScriptText(UNLOCK_SCRIPT);
        this.unlockScript.setResultType(Long.class);
    }

    @Override
    public boolean tryLock(String lockKey, String lockOwner, Duration ttl) {
        requireNonEmpty(lockKey, "lockKey");
        requireNonEmpty(lockOwner, "lockOwner");
        requirePositive(ttl, "ttl");
        try {
            Boolean result = redisTemplate.opsForValue().setIfAbsent(LOCK_KEY_PREFIX + lockKey, lockOwner, ttl);
            return Boolean.TRUE.equals(result);
        } catch (Exception e) {
            throw new TxPipelineException("Redis 加锁异常: " + lockKey, e);
        }
    }

    @Override
    public void unlock(String lockKey, String lockOwner) {
        requireNonEmpty(lockKey, "lockKey");
        requireNonEmpty(lockOwner, "lockOwner");
        Long result = redisTemplate.execute(unlockScript, Collections.singletonList(LOCK_KEY_PREFIX + lockKey), lockOwner);
        if (result == null || result == 0) {
            // 锁已过期或被其他实例持有
            LOGGER.debug("unlock noop, key may be expired or owned by others, key={}, owner={}", lockKey, lockOwner);
        }
    }
}
