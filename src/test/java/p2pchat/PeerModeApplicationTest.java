package p2pchat;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.ApplicationContext;
import org.springframework.http.HttpStatus;

import p2pchat.cli.ConsoleRunner;
import p2pchat.service.ChatService;
import p2pchat.tracker.server.TrackerServer;

/**
 * Peer context with no tracker running: startup must still succeed.
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "app.mode=peer",
        "chat.peer-id=alice",
        "chat.listen-port=0",
        "chat.advertised-ip=127.0.0.1",
        "chat.tracker-host=127.0.0.1",
        "chat.tracker-port=1",
        "chat.connect-timeout=500ms",
        "chat.read-timeout=500ms",
        "chat.heartbeat-interval=1h",
        "chat.console.enabled=false"
    })
class PeerModeApplicationTest {

    @Autowired
    private ChatService chatService;

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private ApplicationContext context;

    @Test
    void startsWithoutTracker() {
        assertFalse(chatService.isRegistered());
        assertTrue(chatService.getListenPort() > 0);
        assertTrue(context.getBeansOfType(TrackerServer.class).isEmpty());
        assertTrue(context.getBeansOfType(ConsoleRunner.class).isEmpty());
    }

    @Test
    void emptyPeerList() {
        Map<?, ?> body = rest.getForObject("/api/peers", Map.class);
        assertEquals(0, body.get("count"));
    }

    @Test
    void refreshWithoutTrackerIsUnavailable() {
        var response = rest.postForEntity("/api/peers/refresh", null, Map.class);
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
    }

    @Test
    void directMessageToUnknownPeerIsNotFound() {
        var response = rest.postForEntity("/api/messages/direct",
            Map.of("peerId", "bob", "content", "hi"), Map.class);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("Peer bob not found", response.getBody().get("message"));
    }

    @Test
    void directMessageWithoutContentIsRejected() {
        var response = rest.postForEntity("/api/messages/direct", Map.of("peerId", "bob"), Map.class);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void historyStartsEmpty() {
        Map<?, ?> body = rest.getForObject("/api/messages", Map.class);
        assertEquals(0, body.get("count"));
    }
}
