package com.work.txpipeline.core.support;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryAddressLockManagerTest {

    private static final String KEY = "8453:0x00000000000000000000000000000000000000aa";

    @Test
    public void second_lease_on_same_key_is_refused_even_for_same_owner() {
        InMemoryAddressLockManager manager = new InMemoryAddressLockManager();

        assertTrue(manager.tryLock(KEY, "worker-1", Duration.ofSeconds(10)));
        assertFalse(manager.tryLock(KEY, "worker-2", Duration.ofSeconds(10)));
        assertFalse(manager.tryLock(KEY, "worker-1", Duration.ofSeconds(10)));
        assertTrue(manager.tryLock("1:0x00000000000000000000000000000000000000aa", "worker-2", Duration.ofSeconds(10)));
    }

    @Test
    public void only_the_holder_can_unlock() {
        InMemoryAddressLockManager manager = new InMemoryAddressLockManager();
        manager.tryLock(KEY, "worker-1", Duration.ofSeconds(10));

        manager.unlock(KEY, "worker-2");
        assertFalse(manager.tryLock(KEY, "worker-2", Duration.ofSeconds(10)));

        manager.unlock(KEY, "worker-1");
        assertEquals(0, manager.size());
        assertTrue(manager.tryLock(KEY, "worker-2", Duration.ofSeconds(10)));
    }

    @Test
    public void expired_lease_can_be_taken_over_and_old_holder_cannot_release_it() throws Exception {
        InMemoryAddressLockManager manager = new InMemoryAddressLockManager();
        manager.tryLock(KEY, "worker-1", Duration.ofMillis(5));
        Thread.sleep(20L);

        assertTrue(manager.tryLock(KEY, "worker-2", Duration.ofSeconds(10)));
        manager.unlock(KEY, "worker-1");
        assertFalse(manager.tryLock(KEY, "worker-3", Duration.ofSeconds(10)));
        assertEquals(1, manager.size());
    }
}
