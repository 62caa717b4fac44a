package p2pchat.cli;

public record CommandResult(String output, boolean quit) {

	public static CommandResult of(String output) {
		return new CommandResult(output, false);
	}

	public static CommandResult quit(String output) {
		return new CommandResult(output, true);
	}
}
