package p2pchat.tracker.protocol;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * A parsed tracker request line, e.g. {@code REGISTER alice 10.0.0.5 6001}.
 * Parsing happens once at the connection boundary; handlers switch on
 * {@link Verb}.
 */
public record TrackerCommand(Verb verb, List<String> args) {

	public enum Verb {
		REGISTER(3, "REGISTER <peer_id> <ip> <port>"),
		UNREGISTER(1, "UNREGISTER <peer_id>"),
		GET_PEERS(0, "GET_PEERS"),
		HEARTBEAT(1, "HEARTBEAT <peer_id>");

		private final int arity;
		private final String usage;

		Verb(int arity, String usage) {
			this.arity = arity;
			this.usage = usage;
		}

		public int getArity() {
			return arity;
		}

		public String getUsage() {
			return usage;
		}
	}

	public TrackerCommand {
		args = List.copyOf(args);
	}

	public static TrackerCommand parse(String line) {
		if (line == null || line.isBlank()) {
			throw new MalformedCommandException("Empty command");
		}

		final var parts = line.trim().split("\\s+");
		final Verb verb;
		try {
			verb = Verb.valueOf(parts[0].toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new MalformedCommandException("Unknown command");
		}

		final var args = Arrays.asList(parts).subList(1, parts.length);
		if (args.size() != verb.getArity()) {
			throw new MalformedCommandException("Invalid format. Use: " + verb.getUsage());
		}

		return new TrackerCommand(verb, args);
	}

	public static TrackerCommand register(String peerId, String ip, int port) {
		return new TrackerCommand(Verb.REGISTER, List.of(peerId, ip, String.valueOf(port)));
	}

	public static TrackerCommand unregister(String peerId) {
		return new TrackerCommand(Verb.UNREGISTER, List.of(peerId));
	}

	public static TrackerCommand getPeers() {
		return new TrackerCommand(Verb.GET_PEERS, List.of());
	}

	public static TrackerCommand heartbeat(String peerId) {
		return new TrackerCommand(Verb.HEARTBEAT, List.of(peerId));
	}

	public String arg(int index) {
		return args.get(index);
	}

	/**
	 * Renders the command as a request line, without the terminator.
	 */
	public String toLine() {
		if (args.isEmpty()) {
			return verb.name();
		}
		return verb.name() + " " + String.join(" ", args);
	}
}
