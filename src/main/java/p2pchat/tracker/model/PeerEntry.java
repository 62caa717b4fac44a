package p2pchat.tracker.model;

import com.google.gson.annotations.SerializedName;

/**
 * Wire view of a peer as returned by GET_PEERS. Also what a chat peer keeps
 * in its local cache.
 */
public record PeerEntry(
    @SerializedName("peer_id") String peerId,
    String ip,
    int port
) {

    public static PeerEntry of(PeerRecord record) {
        return new PeerEntry(record.peerId(), record.ip(), record.port());
    }
}
