package com.work.txpipeline.core.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;
import static com.work.txpipeline.core.support.ValidationUtils.requirePositive;

/**
 * 有界重试：每个网络边界（gas/fee/nonce 查询、广播、receipt 查询）都经过这里。
 *
 * <p>退避：base * 2^(attempt-1)，上限 maxBackoff。超过 maxAttempts 后抛出最后一次的异常。
 * 只有 retryable 判定为 true 的异常才会重试，其余立即抛出。</p>
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration baseBackoff;
    private final Duration maxBackoff;
    private final Predicate<RuntimeException> retryable;

    public RetryPolicy(int maxAttempts, Duration baseBackoff, Duration maxBackoff, Predicate<RuntimeException> retryable) {
        this.maxAttempts = requirePositive(maxAttempts, "maxAttempts");
        this.baseBackoff = requireNonNull(baseBackoff, "baseBackoff");
        this.maxBackoff = requireNonNull(maxBackoff, "maxBackoff");
        this.retryable = requireNonNull(retryable, "retryable");
    }

    /**
     * 相同的次数与退避参数，换一套可重试判定（例如广播边界只重试 OTHER 类错误）。
     */
    public RetryPolicy withRetryable(Predicate<RuntimeException> retryable) {
        return new RetryPolicy(maxAttempts, baseBackoff, maxBackoff, retryable);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        requireNonNull(action, "action");
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e) || attempt >= maxAttempts) {
                    throw e;
                }
                Duration backoff = backoff(attempt);
                log.warn("retrying op={} attempt={}/{} backoff={} err={}", operation, attempt, maxAttempts, backoff, e.toString());
                pause(backoff);
            }
        }
    }

    public Duration backoff(int attempt) {
        long base = baseBackoff.toMillis();
        long max = maxBackoff.toMillis();
        long pow = 1L << Math.min(10, Math.max(0, attempt - 1));
        return Duration.ofMillis(Math.min(max, base * pow));
    }

    /**
     * 按第 attempt 次的退避时长休眠；被中断时恢复中断标记并立即返回。
     */
    public void pauseBeforeRetry(int attempt) {
        pause(backoff(attempt));
    }

    private static void pause(Duration d) {
        if (d.isZero() || d.isNegative()) {
            return;
        }
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
