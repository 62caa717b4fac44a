package p2pchat.config;

import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import lombok.Data;

@Configuration
@ConfigurationProperties(prefix = "chat")
@ConditionalOnProperty(name = "app.mode", havingValue = "peer", matchIfMissing = true)
@Data
public class ChatProperties {

    /**
     * Identifier this peer registers under. Must not contain whitespace.
     */
    private String peerId;

    /**
     * Port the inbound listener binds for direct messages from other peers
     */
    private int listenPort = 6000;

    /**
     * IP sent to the tracker. Detected from the local interfaces when unset.
     */
    private String advertisedIp;

    private String trackerHost = "127.0.0.1";

    private int trackerPort = 5000;

    /**
     * Period of the heartbeat task. Keep it below the tracker's liveness timeout.
     */
    private Duration heartbeatInterval = Duration.ofSeconds(60);

    private Duration connectTimeout = Duration.ofSeconds(2);

    private Duration readTimeout = Duration.ofSeconds(3);

    /**
     * Number of received messages kept in memory
     */
    private int historySize = 100;

    private Console console = new Console();

    @Data
    public static class Console {
        private boolean enabled = true;
    }

    @PostConstruct
    public void validate() {
        if (peerId == null || peerId.isBlank() || peerId.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalStateException(
                "chat.peer-id must be set and must not contain whitespace (configured value: '" + peerId + "')");
        }
        if (listenPort < 0 || listenPort > 65535) {
            throw new IllegalStateException("chat.listen-port must be between 0 and 65535, got " + listenPort);
        }
        if (trackerPort < 1 || trackerPort > 65535) {
            throw new IllegalStateException("chat.tracker-port must be between 1 and 65535, got " + trackerPort);
        }
        TrackerProperties.requirePositive("chat.heartbeat-interval", heartbeatInterval);
        TrackerProperties.requirePositive("chat.connect-timeout", connectTimeout);
        TrackerProperties.requirePositive("chat.read-timeout", readTimeout);
        if (historySize <= 0) {
            throw new IllegalStateException("chat.history-size must be positive");
        }
    }
}
