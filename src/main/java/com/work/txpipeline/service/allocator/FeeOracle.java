package com.work.txpipeline.service.allocator;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.txpipeline.chain.ChainConnector;
import com.work.txpipeline.chain.FeeSuggestion;
import com.work.txpipeline.config.TxPipelineProperties;
import com.work.txpipeline.core.support.RetryPolicy;
import com.work.txpipeline.domain.FeeParams;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonNull;

/**
 * 费用报价：priority 限定在 [min, max]，maxFee = min(cap, baseFee * surge + priority)。
 * 节点建议值短时间缓存，避免每笔分配都打一次 RPC。
 */
@Component
public class FeeOracle {

    private static final String KEY = "latest";

    private final ChainConnector chain;
    private final TxPipelineProperties props;
    private final RetryPolicy retryPolicy;
    private final Cache<String, FeeSuggestion> cache;

    public FeeOracle(ChainConnector chain, TxPipelineProperties props, RetryPolicy rpcRetryPolicy) {
        this.chain = requireNonNull(chain, "chain");
        this.props = requireNonNull(props, "props");
        this.retryPolicy = requireNonNull(rpcRetryPolicy, "rpcRetryPolicy");
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(props.getFeeCacheTtl())
                .maximumSize(1)
                .build();
    }

    public FeeParams quote() {
        FeeSuggestion suggestion = cache.get(KEY, k -> retryPolicy.execute("suggestFees", chain::suggestFees));
        return price(suggestion);
    }

    FeeParams price(FeeSuggestion s) {
        long priority = Math.max(props.getMinPriorityFeeWei(), Math.min(props.getMaxPriorityFeeWei(), s.getPriorityFeePerGas()));
        long surgedBase = BigDecimal.valueOf(s.getBaseFeePerGas())
                .multiply(BigDecimal.valueOf(props.getSurgeMultiplier()))
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
        long maxFee = Math.min(props.getMaxFeeCapWei(), surgedBase + priority);
        // cap 低于 priority 时以 priority 为准，保证 maxFee >= priority
        return new FeeParams(Math.max(maxFee, priority), priority);
    }

    public void invalidate() {
        cache.invalidateAll();
    }
}
