package p2pchat.tracker.server;

import java.io.BufferedReader;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import p2pchat.tracker.model.PeerEntry;
import p2pchat.tracker.protocol.MalformedCommandException;
import p2pchat.tracker.protocol.TrackerCommand;
import p2pchat.tracker.protocol.TrackerResponse;
import p2pchat.util.NetworkUtils;

/**
 * Serves one tracker connection: reads a single command line, applies it to
 * the registry and writes exactly one JSON response before closing.
 */
public class TrackerProtocolHandler {

    private static final Logger logger = LoggerFactory.getLogger(TrackerProtocolHandler.class);

    private final PeerRegistry registry;
    private final int maxLineLength;
    private final long requestTimeoutNanos;

    /**
     * @param requestTimeout how long a client gets to send its whole command line
     */
    public TrackerProtocolHandler(PeerRegistry registry, int maxLineLength, Duration requestTimeout) {
        this.registry = registry;
        this.maxLineLength = maxLineLength;
        this.requestTimeoutNanos = requestTimeout.toNanos();
    }

    public void handleConnection(Socket socket) {
        try (socket) {
            final var remote = socket.getRemoteSocketAddress();
            TrackerResponse response;
            try {
                final var in = new DeadlineInputStream(socket, System.nanoTime() + requestTimeoutNanos);
                final var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
                final var line = readCommandLine(reader);
                logger.debug("Received from {}: {}", remote, line);
                response = handle(line);
            } catch (MalformedCommandException e) {
                response = TrackerResponse.error(e.getMessage());
            } catch (SocketTimeoutException e) {
                logger.warn("Timed out waiting for a command from {}", remote);
                response = TrackerResponse.error("Timed out waiting for command");
            }
            writeResponse(socket.getOutputStream(), response);
        } catch (IOException e) {
            logger.warn("Error handling tracker connection: {}", e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error handling tracker connection", e);
        }
    }

    /**
     * Applies one request line to the registry. Never throws for bad input;
     * every problem is reported as an error response.
     */
    public TrackerResponse handle(String line) {
        try {
            return dispatch(TrackerCommand.parse(line));
        } catch (MalformedCommandException e) {
            logger.debug("Rejected command '{}': {}", line, e.getMessage());
            return TrackerResponse.error(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Failed to process command '{}'", line, e);
            return TrackerResponse.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    public TrackerResponse dispatch(TrackerCommand command) {
        return switch (command.verb()) {
            case REGISTER -> register(command);
            case UNREGISTER -> unregister(command);
            case GET_PEERS -> getPeers();
            case HEARTBEAT -> heartbeat(command);
        };
    }

    private TrackerResponse register(TrackerCommand command) {
        final var peerId = command.arg(0);
        final var ip = command.arg(1);
        final var port = parsePort(command.arg(2));

        final var peerCount = registry.upsert(peerId, ip, port);
        logger.info("Registered peer: {} ({}:{}), total active peers: {}", peerId, ip, port, peerCount);
        return TrackerResponse.registered(peerCount);
    }

    private TrackerResponse unregister(TrackerCommand command) {
        final var peerId = command.arg(0);
        if (!registry.remove(peerId)) {
            return TrackerResponse.error("Peer not found");
        }
        logger.info("Unregistered peer: {}, total active peers: {}", peerId, registry.size());
        return TrackerResponse.success("Peer unregistered successfully");
    }

    private TrackerResponse getPeers() {
        final var peers = registry.snapshot().stream()
            .map(PeerEntry::of)
            .toList();
        logger.debug("Sending peer list ({} peers)", peers.size());
        return TrackerResponse.peers(peers);
    }

    private TrackerResponse heartbeat(TrackerCommand command) {
        final var peerId = command.arg(0);
        if (!registry.touch(peerId)) {
            logger.debug("Heartbeat from unknown peer {}", peerId);
            return TrackerResponse.error("Peer not found");
        }
        return TrackerResponse.success("Heartbeat received");
    }

    private static int parsePort(String value) {
        final int port;
        try {
            port = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new MalformedCommandException("Invalid port: " + value);
        }
        if (!NetworkUtils.isValidPort(port)) {
            throw new MalformedCommandException("Invalid port: " + value);
        }
        return port;
    }

    /**
     * Reads up to the first newline or end of stream, whichever comes first.
     */
    String readCommandLine(Reader reader) throws IOException {
        final var line = new StringBuilder();
        int c;
        while ((c = reader.read()) != -1 && c != '\n') {
            if (line.length() >= maxLineLength) {
                throw new MalformedCommandException("Command too long");
            }
            line.append((char) c);
        }
        if (line.length() > 0 && line.charAt(line.length() - 1) == '\r') {
            line.setLength(line.length() - 1);
        }
        return line.toString();
    }

    private static void writeResponse(OutputStream out, TrackerResponse response) throws IOException {
        out.write((response.toJson() + "\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    /**
     * Socket input where every read waits only for the time left until a fixed
     * deadline, so a client trickling bytes cannot hold the worker past it.
     */
    private static final class DeadlineInputStream extends FilterInputStream {

        private final Socket socket;
        private final long deadlineNanos;

        DeadlineInputStream(Socket socket, long deadlineNanos) throws IOException {
            super(socket.getInputStream());
            this.socket = socket;
            this.deadlineNanos = deadlineNanos;
        }

        @Override
        public int read() throws IOException {
            armTimeout();
            return super.read();
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            armTimeout();
            return super.read(buffer, offset, length);
        }

        private void armTimeout() throws IOException {
            final long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
            if (remainingMs <= 0) {
                throw new SocketTimeoutException("Request deadline exceeded");
            }
            socket.setSoTimeout((int) Math.min(remainingMs, Integer.MAX_VALUE));
        }
    }
}
