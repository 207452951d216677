package com.work.txpipeline.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static com.work.txpipeline.core.support.ValidationUtils.requireNonNegative;

/**
 * EIP-1559 费用参数（wei）。
 */
public final class FeeParams {

    private final long maxFeePerGas;
    private final long maxPriorityFeePerGas;

    public FeeParams(long maxFeePerGas, long maxPriorityFeePerGas) {
        this.maxFeePerGas = requireNonNegative(maxFeePerGas, "maxFeePerGas");
        this.maxPriorityFeePerGas = requireNonNegative(maxPriorityFeePerGas, "maxPriorityFeePerGas");
        if (maxPriorityFeePerGas > maxFeePerGas) {
            throw new IllegalArgumentException("maxPriorityFeePerGas 不能大于 maxFeePerGas");
        }
    }

    public long getMaxFeePerGas() {
        return maxFeePerGas;
    }

    public long getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }

    /**
     * 两项费用各自乘以 factor 并向上取整；factor > 1 时至少加 1 wei。
     */
    public FeeParams bumped(double factor) {
        return new FeeParams(bump(maxFeePerGas, factor), bump(maxPriorityFeePerGas, factor));
    }

    /**
     * 两项费用都不低于 other。
     */
    public boolean covers(FeeParams other) {
        return maxFeePerGas >= other.maxFeePerGas && maxPriorityFeePerGas >= other.maxPriorityFeePerGas;
    }

    static long bump(long value, double factor) {
        long bumped = BigDecimal.valueOf(value)
                .multiply(BigDecimal.valueOf(factor))
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
        if (factor > 1.0d && bumped <= value) {
            return value + 1;
        }
        return bumped;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeeParams)) {
            return false;
        }
        FeeParams that = (FeeParams) o;
        return maxFeePerGas == that.maxFeePerGas && maxPriorityFeePerGas == that.maxPriorityFeePerGas;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(maxFeePerGas) * 31 + Long.hashCode(maxPriorityFeePerGas);
    }

    @Override
    public String toString() {
        return "FeeParams{maxFee=" + maxFeePerGas + ", priority=" + maxPriorityFeePerGas + "}";
    }
}
