package p2pchat.tracker.server;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@ConditionalOnProperty(name = "app.mode", havingValue = "tracker", matchIfMissing = false)
public class TrackerController {

    private final PeerRegistry registry;

    public TrackerController(TrackerServer trackerServer) {
        this.registry = trackerServer.getRegistry();
    }

    /**
     * Registered peers with their liveness timestamps (admin view)
     * GET /api/tracker/peers
     */
    @GetMapping("/api/tracker/peers")
    public ResponseEntity<Map<String, Object>> getPeers() {
        List<Map<String, Object>> peerList = registry.snapshot().stream()
            .map(peer -> {
                Map<String, Object> map = new HashMap<>();
                map.put("peerId", peer.peerId());
                map.put("ip", peer.ip());
                map.put("port", peer.port());
                map.put("lastHeartbeat", peer.lastHeartbeat().toString());
                map.put("registeredAt", peer.registeredAt().toString());
                return map;
            })
            .toList();

        Map<String, Object> response = new HashMap<>();
        response.put("peers", peerList);
        response.put("count", peerList.size());

        return ResponseEntity.ok(response);
    }
}
