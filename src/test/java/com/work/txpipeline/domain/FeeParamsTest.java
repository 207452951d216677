package com.work.txpipeline.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FeeParamsTest {

    @Test
    public void bump_rounds_up() {
        FeeParams bumped = new FeeParams(10, 3).bumped(1.10);
        assertEquals(11, bumped.getMaxFeePerGas());
        // 3 * 1.1 = 3.3
        assertEquals(4, bumped.getMaxPriorityFeePerGas());
    }

    @Test
    public void bump_adds_at_least_one_wei() {
        FeeParams bumped = new FeeParams(1, 0).bumped(1.10);
        assertEquals(2, bumped.getMaxFeePerGas());
        assertEquals(1, bumped.getMaxPriorityFeePerGas());
    }

    @Test
    public void covers_requires_both_fields() {
        FeeParams base = new FeeParams(100, 10);
        assertTrue(new FeeParams(110, 11).covers(base));
        assertFalse(new FeeParams(110, 9).covers(base));
        assertFalse(new FeeParams(99, 10).covers(base));
    }

    @Test
    public void priority_cannot_exceed_max_fee() {
        assertThrows(IllegalArgumentException.class, () -> new FeeParams(1, 2));
    }
}
