package p2pchat.controller;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import p2pchat.peer.DeliveryException;
import p2pchat.peer.UnknownPeerException;
import p2pchat.service.ChatService;
import p2pchat.service.MessageHistory;
import p2pchat.tracker.TrackerRejectedException;
import p2pchat.tracker.TrackerUnreachableException;
import p2pchat.tracker.model.PeerEntry;

@RestController
@RequestMapping("/api")
@ConditionalOnProperty(name = "app.mode", havingValue = "peer", matchIfMissing = true)
public class ChatController {

	private final ChatService chatService;
	private final MessageHistory history;

	public ChatController(ChatService chatService, MessageHistory history) {
		this.chatService = chatService;
		this.history = history;
	}

	/**
	 * Cached peer list, as of the last refresh
	 * GET /api/peers
	 */
	@GetMapping("/peers")
	public ResponseEntity<Map<String, Object>> getPeers() {
		return ResponseEntity.ok(peerListResponse(chatService.knownPeers()));
	}

	/**
	 * Re-fetch the peer list from the tracker
	 * POST /api/peers/refresh
	 */
	@PostMapping("/peers/refresh")
	public ResponseEntity<Map<String, Object>> refreshPeers() {
		return ResponseEntity.ok(peerListResponse(chatService.refreshPeers()));
	}

	/**
	 * Send a direct message
	 * POST /api/messages/direct
	 * Body: { "peerId": "bob", "content": "hi" }
	 */
	@PostMapping("/messages/direct")
	public ResponseEntity<Map<String, Object>> sendDirect(@RequestBody Map<String, String> body) {
		String peerId = body.get("peerId");
		String content = body.get("content");
		if (peerId == null || peerId.isBlank() || content == null || content.isBlank()) {
			return ResponseEntity.status(HttpStatus.BAD_REQUEST)
				.body(Map.of("status", "error", "message", "Missing required fields: peerId and content"));
		}

		chatService.sendDirect(peerId, content);
		return ResponseEntity.ok(Map.of("status", "success", "peerId", peerId));
	}

	/**
	 * Broadcast to every cached peer. Always 200; per-peer outcomes are in the body.
	 * POST /api/messages/broadcast
	 * Body: { "content": "hello all" }
	 */
	@PostMapping("/messages/broadcast")
	public ResponseEntity<Map<String, Object>> broadcast(@RequestBody Map<String, String> body) {
		String content = body.get("content");
		if (content == null || content.isBlank()) {
			return ResponseEntity.status(HttpStatus.BAD_REQUEST)
				.body(Map.of("status", "error", "message", "Missing required field: content"));
		}

		var report = chatService.broadcast(content);
		Map<String, Object> response = new HashMap<>();
		response.put("status", "success");
		response.put("delivered", report.deliveredCount());
		response.put("results", report.results());
		return ResponseEntity.ok(response);
	}

	/**
	 * Received message history, oldest first
	 * GET /api/messages
	 */
	@GetMapping("/messages")
	public ResponseEntity<Map<String, Object>> getMessages() {
		List<Map<String, Object>> messages = history.all().stream()
			.map(received -> {
				Map<String, Object> map = new HashMap<>();
				map.put("type", received.message().type().name().toLowerCase(Locale.ROOT));
				map.put("from", received.message().from());
				map.put("content", received.message().content());
				map.put("receivedAt", received.receivedAt().toString());
				return map;
			})
			.toList();

		Map<String, Object> response = new HashMap<>();
		response.put("messages", messages);
		response.put("count", messages.size());
		return ResponseEntity.ok(response);
	}

	@ExceptionHandler(UnknownPeerException.class)
	public ResponseEntity<Map<String, Object>> handleUnknownPeer(UnknownPeerException e) {
		return ResponseEntity.status(HttpStatus.NOT_FOUND)
			.body(Map.of("status", "error", "message", e.getMessage()));
	}

	@ExceptionHandler(DeliveryException.class)
	public ResponseEntity<Map<String, Object>> handleDeliveryFailure(DeliveryException e) {
		return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
			.body(Map.of("status", "error", "message", e.getMessage()));
	}

	@ExceptionHandler({ TrackerUnreachableException.class, TrackerRejectedException.class })
	public ResponseEntity<Map<String, Object>> handleTrackerFailure(RuntimeException e) {
		return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
			.body(Map.of("status", "error", "message", e.getMessage()));
	}

	private static Map<String, Object> peerListResponse(List<PeerEntry> peers) {
		List<Map<String, Object>> peerList = peers.stream()
			.map(peer -> {
				Map<String, Object> map = new HashMap<>();
				map.put("peerId", peer.peerId());
				map.put("ip", peer.ip());
				map.put("port", peer.port());
				return map;
			})
			.toList();

		Map<String, Object> response = new HashMap<>();
		response.put("peers", peerList);
		response.put("count", peerList.size());
		return response;
	}
}
