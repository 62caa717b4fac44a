package p2pchat.tracker;

import static org.junit.jupiter.api.Assertions.*;

import java.net.ServerSocket;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import p2pchat.config.TrackerProperties;
import p2pchat.tracker.model.PeerEntry;
import p2pchat.tracker.server.TrackerServer;

class TrackerClientTest {

    private TrackerServer server;
    private TrackerClient client;

    @BeforeEach
    void setUp() {
        var properties = new TrackerProperties();
        properties.setHost("127.0.0.1");
        properties.setPort(0);
        server = new TrackerServer(properties);
        server.start();
        client = new TrackerClient("127.0.0.1", server.getLocalPort(), Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void registerHeartbeatAndListPeers() {
        assertEquals(1, client.register("alice", "127.0.0.1", 6001));
        assertEquals(2, client.register("bob", "127.0.0.1", 6002));
        client.heartbeat("alice");

        var peers = client.getPeers();
        assertEquals(2, peers.size());
        assertTrue(peers.contains(new PeerEntry("bob", "127.0.0.1", 6002)));
    }

    @Test
    void heartbeatForUnknownPeerIsRejected() {
        var e = assertThrows(TrackerRejectedException.class, () -> client.heartbeat("ghost"));
        assertEquals("Peer not found", e.getMessage());
    }

    @Test
    void unregisterTwiceIsRejectedTheSecondTime() {
        client.register("alice", "127.0.0.1", 6001);
        client.unregister("alice");
        assertThrows(TrackerRejectedException.class, () -> client.unregister("alice"));
        assertTrue(client.getPeers().isEmpty());
    }

    @Test
    void closedPortSurfacesAsUnreachable() throws Exception {
        int port;
        try (var socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        var offline = new TrackerClient("127.0.0.1", port, Duration.ofMillis(500), Duration.ofMillis(500));
        assertThrows(TrackerUnreachableException.class, offline::getPeers);
    }

    @Test
    void silentTrackerTimesOut() throws Exception {
        try (var silent = new ServerSocket(0)) {
            var stalled = new TrackerClient("127.0.0.1", silent.getLocalPort(), Duration.ofMillis(500), Duration.ofMillis(300));
            assertThrows(TrackerUnreachableException.class, () -> stalled.heartbeat("alice"));
        }
    }
}
