package p2pchat.tracker;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import p2pchat.tracker.model.PeerEntry;
import p2pchat.tracker.protocol.TrackerCommand;
import p2pchat.tracker.protocol.TrackerResponse;

/**
 * Client side of the tracker protocol. Every call opens a fresh connection,
 * sends one command line and reads one response. Connect and read are bounded
 * by the configured timeouts.
 */
public class TrackerClient {

	private static final Logger logger = LoggerFactory.getLogger(TrackerClient.class);

	private final String host;
	private final int port;
	private final int connectTimeoutMs;
	private final int readTimeoutMs;

	public TrackerClient(String host, int port, Duration connectTimeout, Duration readTimeout) {
		this.host = host;
		this.port = port;
		this.connectTimeoutMs = (int) connectTimeout.toMillis();
		this.readTimeoutMs = (int) readTimeout.toMillis();
	}

	/**
	 * @return number of peers registered at the tracker, including this one
	 */
	public int register(String peerId, String ip, int listenPort) {
		final var response = expectSuccess(send(TrackerCommand.register(peerId, ip, listenPort)));
		return response.peerCount() != null ? response.peerCount() : 0;
	}

	public void unregister(String peerId) {
		expectSuccess(send(TrackerCommand.unregister(peerId)));
	}

	/**
	 * @throws TrackerRejectedException if the tracker no longer knows this peer
	 */
	public void heartbeat(String peerId) {
		expectSuccess(send(TrackerCommand.heartbeat(peerId)));
	}

	public List<PeerEntry> getPeers() {
		return expectSuccess(send(TrackerCommand.getPeers())).peersOrEmpty();
	}

	/**
	 * Sends a raw command and returns whatever the tracker answered, error
	 * responses included.
	 */
	public TrackerResponse send(TrackerCommand command) {
		final var line = command.toLine();
		try (Socket socket = new Socket()) {
			socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
			socket.setSoTimeout(readTimeoutMs);

			final var out = socket.getOutputStream();
			out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
			out.flush();
			socket.shutdownOutput();

			final var reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
			final var body = reader.readLine();
			if (body == null || body.isBlank()) {
				throw new TrackerUnreachableException("Tracker closed the connection without a response to " + command.verb());
			}

			logger.debug("Tracker {}:{} answered {} with {}", host, port, command.verb(), body);
			return TrackerResponse.fromJson(body);
		} catch (IOException e) {
			throw new TrackerUnreachableException(
				"Tracker " + host + ":" + port + " unreachable during " + command.verb() + ": " + e.getMessage(), e);
		} catch (JsonParseException e) {
			throw new TrackerUnreachableException("Invalid response from tracker: " + e.getMessage(), e);
		}
	}

	private static TrackerResponse expectSuccess(TrackerResponse response) {
		if (!response.isSuccess()) {
			throw new TrackerRejectedException(response.message());
		}
		return response;
	}

	public String getHost() {
		return host;
	}

	public int getPort() {
		return port;
	}
}
