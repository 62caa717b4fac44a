package p2pchat.peer;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import p2pchat.peer.protocol.ChatMessage;
import p2pchat.tracker.model.PeerEntry;

/**
 * Opens a new connection per message, writes it, half-closes and closes.
 * Only the connect is timed. Payloads are capped at the receiver's limit,
 * so the write lands in the socket send buffer without blocking.
 */
public class SocketMessageTransport implements MessageTransport {

	private static final Logger logger = LoggerFactory.getLogger(SocketMessageTransport.class);

	private final int connectTimeoutMs;

	public SocketMessageTransport(Duration connectTimeout) {
		this.connectTimeoutMs = (int) connectTimeout.toMillis();
	}

	@Override
	public void deliver(PeerEntry peer, ChatMessage message) {
		final var payload = message.toJson().getBytes(StandardCharsets.UTF_8);
		if (payload.length > InboundListener.MAX_MESSAGE_BYTES) {
			throw new DeliveryException("Message too large: " + payload.length + " bytes, limit is " + InboundListener.MAX_MESSAGE_BYTES);
		}
		try (Socket socket = new Socket()) {
			socket.connect(new InetSocketAddress(peer.ip(), peer.port()), connectTimeoutMs);
			final var out = socket.getOutputStream();
			out.write(payload);
			out.flush();
			socket.shutdownOutput();
			logger.debug("Delivered {} message to {} at {}:{}", message.type(), peer.peerId(), peer.ip(), peer.port());
		} catch (IOException e) {
			throw new DeliveryException(
				"Could not deliver to " + peer.peerId() + " at " + peer.ip() + ":" + peer.port() + ": " + e.getMessage(), e);
		}
	}
}
