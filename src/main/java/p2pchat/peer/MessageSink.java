package p2pchat.peer;

/**
 * Receives every message accepted by the inbound listener. Called from
 * listener worker threads, so implementations must be thread-safe.
 */
@FunctionalInterface
public interface MessageSink {

	void onMessage(ReceivedMessage message);
}
