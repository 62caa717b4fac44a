package p2pchat.peer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import p2pchat.tracker.model.PeerEntry;

/**
 * This peer's copy of the tracker's last GET_PEERS answer. Replaced
 * wholesale on refresh and never repaired on failed deliveries, so it can be
 * stale.
 */
public class PeerCache {

	private final String selfId;
	private Map<String, PeerEntry> peers = new LinkedHashMap<>();

	public PeerCache(String selfId) {
		this.selfId = selfId;
	}

	/**
	 * Replaces the cache with {@code snapshot}, dropping this peer's own entry.
	 */
	public synchronized void replace(Collection<PeerEntry> snapshot) {
		final var next = new LinkedHashMap<String, PeerEntry>();
		for (PeerEntry entry : snapshot) {
			if (!selfId.equals(entry.peerId())) {
				next.put(entry.peerId(), entry);
			}
		}
		peers = next;
	}

	public synchronized Optional<PeerEntry> find(String peerId) {
		return Optional.ofNullable(peers.get(peerId));
	}

	public synchronized List<PeerEntry> snapshot() {
		return new ArrayList<>(peers.values());
	}

	public synchronized int size() {
		return peers.size();
	}
}
