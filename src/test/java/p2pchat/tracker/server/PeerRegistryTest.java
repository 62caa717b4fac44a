package p2pchat.tracker.server;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import p2pchat.MutableClock;
import p2pchat.tracker.model.PeerRecord;

class PeerRegistryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(300);

    private MutableClock clock;
    private PeerRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        registry = new PeerRegistry(clock);
    }

    @Test
    void reRegistrationOverwritesAddress() {
        registry.upsert("alice", "10.0.0.1", 6001);
        clock.advance(Duration.ofSeconds(10));
        int count = registry.upsert("alice", "10.0.0.2", 7001);

        assertEquals(1, count);
        var records = registry.snapshot();
        assertEquals(1, records.size());
        var alice = records.get(0);
        assertEquals("10.0.0.2", alice.ip());
        assertEquals(7001, alice.port());
        assertEquals(clock.instant(), alice.lastHeartbeat());
        assertEquals(clock.instant(), alice.registeredAt());
    }

    @Test
    void touchUnknownPeerCreatesNothing() {
        assertFalse(registry.touch("ghost"));
        assertTrue(registry.snapshot().isEmpty());
    }

    @Test
    void touchRefreshesHeartbeatOnly() {
        registry.upsert("alice", "10.0.0.1", 6001);
        var registeredAt = clock.instant();
        clock.advance(Duration.ofSeconds(90));

        assertTrue(registry.touch("alice"));
        var alice = registry.snapshot().get(0);
        assertEquals(clock.instant(), alice.lastHeartbeat());
        assertEquals(registeredAt, alice.registeredAt());
    }

    @Test
    void removeReportsWhetherPeerExisted() {
        registry.upsert("alice", "10.0.0.1", 6001);
        assertTrue(registry.remove("alice"));
        assertFalse(registry.remove("alice"));
    }

    @Test
    void snapshotIsDetachedFromRegistry() {
        registry.upsert("alice", "10.0.0.1", 6001);
        var snapshot = registry.snapshot();
        snapshot.clear();
        registry.upsert("bob", "10.0.0.2", 6002);

        assertTrue(snapshot.isEmpty());
        assertEquals(2, registry.snapshot().size());
    }

    @Test
    void sweepRemovesOnlyExpiredPeers() {
        registry.upsert("alice", "10.0.0.1", 6001);
        clock.advance(Duration.ofSeconds(200));
        registry.upsert("bob", "10.0.0.2", 6002);
        clock.advance(Duration.ofSeconds(101));

        var removed = registry.sweep(clock.instant(), TIMEOUT);

        assertEquals(java.util.List.of("alice"), removed);
        assertEquals(java.util.List.of("bob"), registry.snapshot().stream().map(PeerRecord::peerId).toList());
    }

    @Test
    void peerAtExactlyTheTimeoutSurvives() {
        registry.upsert("alice", "10.0.0.1", 6001);
        clock.advance(TIMEOUT);
        assertTrue(registry.sweep(clock.instant(), TIMEOUT).isEmpty());
    }

    @Test
    void heartbeatAfterEvictionFails() {
        registry.upsert("alice", "10.0.0.1", 6001);
        clock.advance(TIMEOUT.plusSeconds(1));
        registry.sweep(clock.instant(), TIMEOUT);

        assertFalse(registry.touch("alice"));
        assertEquals(0, registry.size());
    }

    @Test
    void concurrentRegistrationsAreNotLost() throws Exception {
        int peers = 64;
        var pool = Executors.newFixedThreadPool(16);
        var start = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<Integer>>();
            for (int i = 0; i < peers; i++) {
                final int n = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.upsert("peer-" + n, "10.0.0." + (n % 250), 6000 + n);
                }));
            }
            start.countDown();
            for (var future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(peers, registry.size());
    }
}
