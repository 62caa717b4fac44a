package p2pchat.tracker.model;

import java.time.Instant;

/**
 * A peer known to the tracker. Identity is {@code peerId}; a newer REGISTER
 * replaces the whole record.
 */
public record PeerRecord(String peerId, String ip, int port, Instant lastHeartbeat, Instant registeredAt) {

    public PeerRecord withHeartbeat(Instant now) {
        return new PeerRecord(peerId, ip, port, now, registeredAt);
    }
}
