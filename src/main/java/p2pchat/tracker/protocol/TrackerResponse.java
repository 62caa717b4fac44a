package p2pchat.tracker.protocol;

import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import p2pchat.tracker.model.PeerEntry;

/**
 * The single JSON object written back for every tracker request. Fields that
 * do not apply to a response are left null and omitted on the wire.
 */
public record TrackerResponse(
	String status,
	String message,
	List<PeerEntry> peers,
	@SerializedName("peer_count") Integer peerCount
) {

	public static final String SUCCESS = "success";
	public static final String ERROR = "error";

	private static final Gson GSON = new Gson();

	public static TrackerResponse success(String message) {
		return new TrackerResponse(SUCCESS, message, null, null);
	}

	public static TrackerResponse registered(int peerCount) {
		return new TrackerResponse(SUCCESS, "Peer registered successfully", null, peerCount);
	}

	public static TrackerResponse peers(List<PeerEntry> peers) {
		return new TrackerResponse(SUCCESS, null, List.copyOf(peers), peers.size());
	}

	public static TrackerResponse error(String message) {
		return new TrackerResponse(ERROR, message, null, null);
	}

	public boolean isSuccess() {
		return SUCCESS.equals(status);
	}

	public List<PeerEntry> peersOrEmpty() {
		return peers != null ? peers : List.of();
	}

	public String toJson() {
		return GSON.toJson(this);
	}

	public static TrackerResponse fromJson(String json) {
		final var response = GSON.fromJson(json, TrackerResponse.class);
		if (response == null || response.status() == null) {
			throw new JsonParseException("Tracker response has no status: " + json);
		}
		return response;
	}
}
