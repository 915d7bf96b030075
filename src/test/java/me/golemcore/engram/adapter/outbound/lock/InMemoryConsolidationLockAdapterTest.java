package me.golemcore.engram.adapter.outbound.lock;

import me.golemcore.engram.domain.model.ConsolidationLease;
import me.golemcore.engram.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryConsolidationLockAdapterTest {

    private static final String THREAD = "thread-1";
    private static final Duration LEASE = Duration.ofSeconds(60);

    private MutableClock clock;
    private InMemoryConsolidationLockAdapter adapter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        adapter = new InMemoryConsolidationLockAdapter(clock);
    }

    @Test
    void shouldRejectSecondAcquireWhileHeld() {
        Optional<ConsolidationLease> first = adapter.tryAcquire(THREAD, LEASE);
        Optional<ConsolidationLease> second = adapter.tryAcquire(THREAD, LEASE);

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
    }

    @Test
    void shouldLockThreadsIndependently() {
        assertTrue(adapter.tryAcquire(THREAD, LEASE).isPresent());
        assertTrue(adapter.tryAcquire("thread-2", LEASE).isPresent());
    }

    @Test
    void shouldAllowAcquireAfterRelease() {
        ConsolidationLease lease = adapter.tryAcquire(THREAD, LEASE).orElseThrow();

        adapter.release(lease);

        assertTrue(adapter.tryAcquire(THREAD, LEASE).isPresent());
    }

    @Test
    void shouldTakeOverExpiredLease() {
        ConsolidationLease stale = adapter.tryAcquire(THREAD, LEASE).orElseThrow();
        clock.advance(LEASE.plusSeconds(1));

        ConsolidationLease fresh = adapter.tryAcquire(THREAD, LEASE).orElseThrow();

        assertNotEquals(stale.getToken(), fresh.getToken());
    }

    @Test
    void shouldIgnoreReleaseOfStaleLease() {
        ConsolidationLease stale = adapter.tryAcquire(THREAD, LEASE).orElseThrow();
        clock.advance(LEASE.plusSeconds(1));
        adapter.tryAcquire(THREAD, LEASE).orElseThrow();

        adapter.release(stale);

        assertTrue(adapter.tryAcquire(THREAD, LEASE).isEmpty());
    }

    @Test
    void shouldHoldLeaseUntilExpiry() {
        adapter.tryAcquire(THREAD, LEASE).orElseThrow();
        clock.advance(LEASE.minusSeconds(1));

        assertTrue(adapter.tryAcquire(THREAD, LEASE).isEmpty());
    }

    @Test
    void shouldIgnoreNullRelease() {
        assertDoesNotThrow(() -> adapter.release(null));
    }
}
