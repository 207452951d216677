package com.work.txpipeline.core.lock;

import com.work.txpipeline.core.exception.AddressLockTimeoutException;
import com.work.txpipeline.core.support.InMemoryAddressLockManager;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AddressLockCoordinatorTest {

    private static final String ADDRESS = "0x00000000000000000000000000000000000000AA";

    @Test
    public void lock_key_is_chain_and_lowercase_address() {
        InMemoryAddressLockManager manager = new InMemoryAddressLockManager();
        AddressLockCoordinator c = new AddressLockCoordinator(manager, Duration.ofSeconds(10), Duration.ofMillis(100));
        Boolean otherGotLock = c.executeWithLock(8453L, ADDRESS,
                o -> manager.tryLock("8453:" + ADDRESS.toLowerCase(), "other", Duration.ofSeconds(1)));
        assertFalse(otherGotLock);
        assertTrue(manager.tryLock("8453:" + ADDRESS.toLowerCase(), "other", Duration.ofSeconds(1)));
    }

    @Test
    public void lock_is_released_when_callback_throws() {
        InMemoryAddressLockManager manager = new InMemoryAddressLockManager();
        AddressLockCoordinator c = new AddressLockCoordinator(manager, Duration.ofSeconds(10), Duration.ofMillis(100));
        assertThrows(IllegalStateException.class, () -> c.executeWithLock(1L, ADDRESS, o -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals("done", c.executeWithLock(1L, ADDRESS, o -> "done"));
    }

    @Test
    public void contention_times_out() {
        InMemoryAddressLockManager manager = new InMemoryAddressLockManager();
        manager.tryLock("1:" + ADDRESS.toLowerCase(), "someone-else", Duration.ofSeconds(30));
        AddressLockCoordinator c = new AddressLockCoordinator(manager, Duration.ofSeconds(10), Duration.ofMillis(80));

        assertThrows(AddressLockTimeoutException.class, () -> c.executeWithLock(1L, ADDRESS, o -> "never"));
    }

    @Test
    public void intent_lock_is_separate_from_address_lock() {
        InMemoryAddressLockManager manager = new InMemoryAddressLockManager();
        AddressLockCoordinator c = new AddressLockCoordinator(manager, Duration.ofSeconds(10), Duration.ofMillis(80));

        String nested = c.executeWithIntentLock(7L, o -> c.executeWithLock(1L, ADDRESS, inner -> "both"));
        assertEquals("both", nested);

        Boolean sameIntent = c.executeWithIntentLock(7L, o -> manager.tryLock("intent:7", "other", Duration.ofSeconds(1)));
        assertFalse(sameIntent);
        assertTrue(manager.tryLock("intent:7", "someone-else", Duration.ofSeconds(30)));
        assertThrows(AddressLockTimeoutException.class,
                () -> c.executeWithIntentLock(7L, o -> "never"));
    }
}
