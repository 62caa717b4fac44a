package p2pchat.cli;

import java.util.Arrays;
import java.util.Optional;

/**
 * Console verbs. Each line typed by the user starts with one of these.
 */
public enum ChatCommand {
	PEERS("/peers", "/peers", "Refresh and list available peers"),
	MSG("/msg", "/msg <peer_id> <message>", "Send direct message"),
	BROADCAST("/broadcast", "/broadcast <message>", "Broadcast to all peers"),
	REFRESH("/refresh", "/refresh", "Refresh peer list"),
	HISTORY("/history", "/history", "Show message history"),
	HELP("/help", "/help", "Show this help"),
	QUIT("/quit", "/quit", "Exit chat");

	private final String keyword;
	private final String usage;
	private final String description;

	ChatCommand(String keyword, String usage, String description) {
		this.keyword = keyword;
		this.usage = usage;
		this.description = description;
	}

	public String getKeyword() {
		return keyword;
	}

	public String getUsage() {
		return usage;
	}

	public String getDescription() {
		return description;
	}

	public static Optional<ChatCommand> fromKeyword(String keyword) {
		return Arrays.stream(values())
			.filter(command -> command.keyword.equalsIgnoreCase(keyword))
			.findFirst();
	}

	/**
	 * A console line split into its verb and the raw remainder.
	 */
	public record Invocation(ChatCommand command, String argument) {

		public static Optional<Invocation> parse(String line) {
			final var trimmed = line.trim();
			final var split = trimmed.split("\\s+", 2);
			return fromKeyword(split[0])
				.map(command -> new Invocation(command, split.length > 1 ? split[1].trim() : ""));
		}
	}
}
