package p2pchat.tracker.server;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import p2pchat.config.TrackerProperties;
import p2pchat.util.Threads;

/**
 * TCP front end of the tracker. Each accepted connection is served on its own
 * worker thread; a separate scheduler sweeps peers whose heartbeat expired.
 */
@Component
@ConditionalOnProperty(name = "app.mode", havingValue = "tracker", matchIfMissing = false)
public class TrackerServer {

    private static final Logger logger = LoggerFactory.getLogger(TrackerServer.class);

    private final TrackerProperties properties;
    private final PeerRegistry registry;
    private final TrackerProtocolHandler handler;
    private final ExecutorService connectionExecutor = Executors.newCachedThreadPool(Threads.daemon("TrackerConnection"));
    private final ScheduledExecutorService sweepScheduler = Executors.newSingleThreadScheduledExecutor(Threads.daemon("TrackerSweeper"));

    private ServerSocket serverSocket;
    private volatile boolean running = false;

    @Autowired
    public TrackerServer(TrackerProperties properties) {
        this(properties, new PeerRegistry());
    }

    public TrackerServer(TrackerProperties properties, PeerRegistry registry) {
        this.properties = properties;
        this.registry = registry;
        this.handler = new TrackerProtocolHandler(registry, properties.getMaxLineLength(), properties.getReadTimeout());
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }

        try {
            serverSocket = new ServerSocket(properties.getPort(), properties.getBacklog(),
                InetAddress.getByName(properties.getHost()));
        } catch (IOException e) {
            throw new IllegalStateException(
                "Failed to bind tracker on " + properties.getHost() + ":" + properties.getPort(), e);
        }
        running = true;
        logger.info("Peer tracker listening on {}:{}", properties.getHost(), serverSocket.getLocalPort());

        final var acceptThread = new Thread(this::acceptLoop, "TrackerServer-Accept");
        acceptThread.setDaemon(true);
        acceptThread.start();

        final var interval = properties.getSweepInterval().toMillis();
        sweepScheduler.scheduleAtFixedRate(this::sweepExpiredPeers, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void acceptLoop() {
        while (running && !serverSocket.isClosed()) {
            try {
                final Socket socket = serverSocket.accept();
                logger.debug("Connection from {}", socket.getRemoteSocketAddress());
                connectionExecutor.submit(() -> handler.handleConnection(socket));
            } catch (IOException e) {
                if (running) {
                    logger.warn("Error accepting connection: {}", e.getMessage());
                }
            }
        }
    }

    /**
     * One sweeper pass. Runs on the scheduler; exceptions are logged so the
     * next run is still scheduled.
     */
    List<String> sweepExpiredPeers() {
        try {
            final var removed = registry.sweep(registry.getClock().instant(), properties.getLivenessTimeout());
            for (String peerId : removed) {
                logger.info("Removing inactive peer: {}", peerId);
            }
            if (!removed.isEmpty()) {
                logger.info("Total active peers: {}", registry.size());
            }
            return removed;
        } catch (RuntimeException e) {
            logger.error("Peer sweep failed", e);
            return List.of();
        }
    }

    public PeerRegistry getRegistry() {
        return registry;
    }

    public int getLocalPort() {
        return serverSocket != null ? serverSocket.getLocalPort() : -1;
    }

    public boolean isRunning() {
        return running;
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        sweepScheduler.shutdownNow();
        try {
            serverSocket.close();
        } catch (IOException e) {
            logger.warn("Error closing tracker socket: {}", e.getMessage());
        }
        connectionExecutor.shutdown();
        try {
            if (!connectionExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                connectionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            connectionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Peer tracker stopped");
    }
}
