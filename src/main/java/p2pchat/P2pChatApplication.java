package p2pchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for both roles. {@code app.mode=tracker} starts the discovery
 * tracker; anything else starts a chat peer.
 */
@SpringBootApplication
public class P2pChatApplication {

	public static void main(String[] args) {
		SpringApplication.run(P2pChatApplication.class, args);
	}
}
