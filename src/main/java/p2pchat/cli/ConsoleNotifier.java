package p2pchat.cli;

import java.io.PrintStream;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import p2pchat.peer.MessageSink;
import p2pchat.peer.ReceivedMessage;
import p2pchat.peer.protocol.ChatMessage;

/**
 * Prints incoming messages to the terminal and redraws the prompt.
 */
@Component
@ConditionalOnExpression("'${app.mode:peer}' == 'peer' and ${chat.console.enabled:true}")
public class ConsoleNotifier implements MessageSink {

	static final String PROMPT = "> ";

	private final PrintStream out;

	@Autowired
	public ConsoleNotifier() {
		this(System.out);
	}

	public ConsoleNotifier(PrintStream out) {
		this.out = out;
	}

	@Override
	public void onMessage(ReceivedMessage received) {
		final var message = received.message();
		final var label = message.type() == ChatMessage.Type.DIRECT ? "Direct message" : "Broadcast";
		synchronized (out) {
			out.println();
			out.println("[%s] %s: %s".formatted(message.from(), label, message.content()));
			out.print(PROMPT);
			out.flush();
		}
	}
}
