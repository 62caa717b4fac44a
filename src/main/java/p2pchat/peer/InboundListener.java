package p2pchat.peer;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import p2pchat.peer.protocol.ChatMessage;
import p2pchat.util.Threads;

/**
 * Accepts direct connections from other peers. Each connection carries one
 * message, which is parsed and handed to every registered {@link MessageSink}.
 */
public class InboundListener {

    private static final Logger logger = LoggerFactory.getLogger(InboundListener.class);

    static final int MAX_MESSAGE_BYTES = 64 * 1024;

    private final int port;
    private final int readTimeoutMs;
    private final List<MessageSink> sinks;
    private final Clock clock;
    private final ExecutorService executorService = Executors.newCachedThreadPool(Threads.daemon("PeerInbound"));

    private ServerSocket serverSocket;
    private volatile boolean running = false;

    public InboundListener(int port, Duration readTimeout, List<MessageSink> sinks) {
        this(port, readTimeout, sinks, Clock.systemUTC());
    }

    public InboundListener(int port, Duration readTimeout, List<MessageSink> sinks, Clock clock) {
        this.port = port;
        this.readTimeoutMs = (int) readTimeout.toMillis();
        this.sinks = List.copyOf(sinks);
        this.clock = clock;
    }

    /**
     * Binds the listening socket and starts accepting.
     *
     * @throws IllegalStateException if the port cannot be bound
     */
    public synchronized void start() {
        if (running) {
            return;
        }

        try {
            // Bind to IPv4 only (0.0.0.0), matching the addresses peers advertise
            serverSocket = new ServerSocket(port, 50, InetAddress.getByAddress(new byte[] { 0, 0, 0, 0 }));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind inbound listener on port " + port, e);
        }
        running = true;
        logger.info("Listening for P2P connections on port {}", serverSocket.getLocalPort());

        final var acceptThread = new Thread(this::acceptLoop, "PeerInbound-Accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
    }

    private void acceptLoop() {
        while (running && !serverSocket.isClosed()) {
            try {
                final Socket socket = serverSocket.accept();
                executorService.submit(() -> handleConnection(socket));
            } catch (IOException e) {
                if (running) {
                    logger.warn("Error accepting P2P connection: {}", e.getMessage());
                }
            }
        }
    }

    private void handleConnection(Socket socket) {
        final var remote = String.valueOf(socket.getRemoteSocketAddress());
        try (socket) {
            socket.setSoTimeout(readTimeoutMs);
            logger.debug("Incoming P2P connection from {}", remote);

            final var in = socket.getInputStream();
            final var bytes = in.readNBytes(MAX_MESSAGE_BYTES + 1);
            if (bytes.length > MAX_MESSAGE_BYTES) {
                logger.warn("Dropping oversized message from {}", remote);
                return;
            }
            if (bytes.length == 0) {
                logger.debug("Empty P2P connection from {}", remote);
                return;
            }

            final var message = ChatMessage.fromJson(new String(bytes, StandardCharsets.UTF_8).trim());
            dispatch(new ReceivedMessage(message, remote, clock.instant()));
        } catch (JsonParseException e) {
            logger.warn("Dropping malformed message from {}: {}", remote, e.getMessage());
        } catch (IOException e) {
            logger.warn("Error reading P2P message from {}: {}", remote, e.getMessage());
        }
    }

    private void dispatch(ReceivedMessage received) {
        for (MessageSink sink : sinks) {
            try {
                sink.onMessage(received);
            } catch (RuntimeException e) {
                logger.error("Message sink {} failed", sink.getClass().getSimpleName(), e);
            }
        }
    }

    public int getLocalPort() {
        return serverSocket != null ? serverSocket.getLocalPort() : -1;
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            logger.warn("Error closing inbound listener: {}", e.getMessage());
        }
        executorService.shutdownNow();
    }
}
