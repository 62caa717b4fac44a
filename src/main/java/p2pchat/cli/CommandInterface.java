package p2pchat.cli;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import p2pchat.peer.DeliveryException;
import p2pchat.peer.UnknownPeerException;
import p2pchat.service.ChatService;
import p2pchat.service.MessageHistory;
import p2pchat.tracker.TrackerRejectedException;
import p2pchat.tracker.TrackerUnreachableException;
import p2pchat.tracker.model.PeerEntry;

/**
 * Turns console lines into {@link ChatService} calls and renders the outcome
 * as text. Failures come back as output, never as exceptions.
 */
@Component
@ConditionalOnProperty(name = "app.mode", havingValue = "peer", matchIfMissing = true)
public class CommandInterface {

	static final int HISTORY_LINES = 20;

	private final ChatService chatService;
	private final MessageHistory history;

	public CommandInterface(ChatService chatService, MessageHistory history) {
		this.chatService = chatService;
		this.history = history;
	}

	public CommandResult execute(String line) {
		if (line == null || line.isBlank()) {
			return CommandResult.of("");
		}

		final var invocation = ChatCommand.Invocation.parse(line);
		if (invocation.isEmpty()) {
			return CommandResult.of("Unknown command. Type /help for available commands");
		}

		final var argument = invocation.get().argument();
		return switch (invocation.get().command()) {
			case PEERS -> CommandResult.of(peers());
			case MSG -> CommandResult.of(message(argument));
			case BROADCAST -> CommandResult.of(broadcast(argument));
			case REFRESH -> CommandResult.of(refresh());
			case HISTORY -> CommandResult.of(history());
			case HELP -> CommandResult.of(help());
			case QUIT -> CommandResult.quit("Exiting...");
		};
	}

	private String peers() {
		final var out = new StringBuilder();
		try {
			chatService.refreshPeers();
		} catch (TrackerUnreachableException | TrackerRejectedException e) {
			out.append("Could not refresh peer list: ").append(e.getMessage()).append(System.lineSeparator());
		}

		final List<PeerEntry> peers = chatService.knownPeers();
		if (peers.isEmpty()) {
			return out.append("No peers available").toString();
		}
		out.append("Available peers:");
		for (PeerEntry peer : peers) {
			out.append(System.lineSeparator())
				.append("  ").append(peer.peerId()).append(" - ").append(peer.ip()).append(':').append(peer.port());
		}
		return out.toString();
	}

	private String refresh() {
		try {
			final var peers = chatService.refreshPeers();
			return "Updated peer list: " + peers.size() + " peers available";
		} catch (TrackerUnreachableException | TrackerRejectedException e) {
			return "Could not refresh peer list: " + e.getMessage();
		}
	}

	private String message(String argument) {
		final var parts = argument.split("\\s+", 2);
		if (parts.length < 2 || parts[0].isEmpty() || parts[1].isBlank()) {
			return "Usage: " + ChatCommand.MSG.getUsage();
		}

		final var targetId = parts[0];
		try {
			chatService.sendDirect(targetId, parts[1]);
			return "Sent direct message to " + targetId;
		} catch (UnknownPeerException e) {
			return "Peer " + targetId + " not found. Try /refresh";
		} catch (DeliveryException e) {
			return "Failed to deliver to " + targetId + ": " + e.getMessage();
		}
	}

	private String broadcast(String content) {
		if (content.isBlank()) {
			return "Usage: " + ChatCommand.BROADCAST.getUsage();
		}

		final var report = chatService.broadcast(content);
		final var out = new StringBuilder()
			.append("Broadcast sent to ").append(report.deliveredCount())
			.append(" of ").append(report.results().size()).append(" peers");
		report.failures().forEach(failure -> out.append(System.lineSeparator())
			.append("  failed: ").append(failure.peerId()).append(" (").append(failure.error()).append(')'));
		return out.toString();
	}

	private String history() {
		final var recent = history.recent(HISTORY_LINES);
		if (recent.isEmpty()) {
			return "No message history";
		}
		return "Message history:" + System.lineSeparator() + recent.stream()
			.map(received -> "  [%s] %s: %s".formatted(
				received.message().type().name().toLowerCase(Locale.ROOT),
				received.message().from(),
				received.message().content()))
			.collect(Collectors.joining(System.lineSeparator()));
	}

	static String help() {
		final var out = new StringBuilder("Chat Commands:");
		for (ChatCommand command : ChatCommand.values()) {
			out.append(System.lineSeparator())
				.append("  %-26s - %s".formatted(command.getUsage(), command.getDescription()));
		}
		return out.toString();
	}
}
