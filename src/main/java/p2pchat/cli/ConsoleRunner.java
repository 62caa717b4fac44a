package p2pchat.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import p2pchat.service.ChatService;

/**
 * Interactive prompt on stdin. Runs on the main thread; receiving and
 * heartbeats continue on their own threads while it waits for input.
 */
@Component
@ConditionalOnExpression("'${app.mode:peer}' == 'peer' and ${chat.console.enabled:true}")
public class ConsoleRunner implements CommandLineRunner {

	private static final Logger logger = LoggerFactory.getLogger(ConsoleRunner.class);

	private final CommandInterface commands;
	private final ChatService chatService;
	private final ConfigurableApplicationContext context;

	public ConsoleRunner(CommandInterface commands, ChatService chatService, ConfigurableApplicationContext context) {
		this.commands = commands;
		this.chatService = chatService;
		this.context = context;
	}

	@Override
	public void run(String... args) throws IOException {
		System.out.println("=".repeat(60));
		System.out.println("P2P Chat - peer " + chatService.getPeerId() + " listening on "
			+ chatService.getAdvertisedIp() + ":" + chatService.getListenPort());
		System.out.println("=".repeat(60));
		System.out.println(CommandInterface.help());

		final var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		while (true) {
			System.out.print(ConsoleNotifier.PROMPT);
			System.out.flush();
			final var line = in.readLine();
			if (line == null) {
				break;
			}

			final var result = commands.execute(line);
			if (!result.output().isEmpty()) {
				System.out.println(result.output());
			}
			if (result.quit()) {
				break;
			}
		}

		logger.info("Console closed, shutting down");
		context.close();
	}
}
