package p2pchat.tracker.server;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import p2pchat.tracker.model.PeerRecord;

/**
 * In-memory table of registered peers.
 *
 * Every operation holds the same monitor, so operations are linearizable with
 * respect to each other. Records are immutable; callers only ever receive
 * copies and never see the backing map.
 */
public class PeerRegistry {

    private final Map<String, PeerRecord> peers = new HashMap<>();
    private final Object lock = new Object();
    private final Clock clock;

    public PeerRegistry() {
        this(Clock.systemUTC());
    }

    public PeerRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Inserts or overwrites the record for {@code peerId}. Re-registration is
     * last-writer-wins: address and both timestamps are replaced.
     *
     * @return number of registered peers after the update
     */
    public int upsert(String peerId, String ip, int port) {
        final var now = clock.instant();
        synchronized (lock) {
            peers.put(peerId, new PeerRecord(peerId, ip, port, now, now));
            return peers.size();
        }
    }

    /**
     * Refreshes the heartbeat of a known peer.
     *
     * @return false if the peer is unknown, in which case nothing changes
     */
    public boolean touch(String peerId) {
        final var now = clock.instant();
        synchronized (lock) {
            final var current = peers.get(peerId);
            if (current == null) {
                return false;
            }
            peers.put(peerId, current.withHeartbeat(now));
            return true;
        }
    }

    public boolean remove(String peerId) {
        synchronized (lock) {
            return peers.remove(peerId) != null;
        }
    }

    /**
     * Point-in-time copy of all records. Iteration order is unspecified.
     */
    public List<PeerRecord> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(peers.values());
        }
    }

    public int size() {
        synchronized (lock) {
            return peers.size();
        }
    }

    /**
     * Removes every record whose last heartbeat is older than {@code timeout}
     * relative to {@code now}.
     *
     * @return ids of the removed peers
     */
    public List<String> sweep(Instant now, Duration timeout) {
        final var cutoff = now.minus(timeout);
        final var removed = new ArrayList<String>();
        synchronized (lock) {
            final Iterator<PeerRecord> it = peers.values().iterator();
            while (it.hasNext()) {
                final var record = it.next();
                if (record.lastHeartbeat().isBefore(cutoff)) {
                    it.remove();
                    removed.add(record.peerId());
                }
            }
        }
        return removed;
    }

    public Clock getClock() {
        return clock;
    }
}
