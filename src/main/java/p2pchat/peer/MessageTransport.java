package p2pchat.peer;

import p2pchat.peer.protocol.ChatMessage;
import p2pchat.tracker.model.PeerEntry;

/**
 * Outbound delivery of a single message to a single peer.
 */
public interface MessageTransport {

	/**
	 * @throws DeliveryException if the peer cannot be reached in time
	 */
	void deliver(PeerEntry peer, ChatMessage message);
}
