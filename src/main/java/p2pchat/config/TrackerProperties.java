package p2pchat.config;

import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import lombok.Data;

@Configuration
@ConfigurationProperties(prefix = "tracker")
@ConditionalOnProperty(name = "app.mode", havingValue = "tracker", matchIfMissing = false)
@Data
public class TrackerProperties {

    /**
     * Address the tracker socket binds to
     */
    private String host = "0.0.0.0";

    /**
     * TCP port peers send commands to (0 picks an ephemeral port)
     */
    private int port = 5000;

    private int backlog = 50;

    /**
     * A peer without a heartbeat for this long is swept from the registry
     */
    private Duration livenessTimeout = Duration.ofSeconds(300);

    /**
     * How often the sweeper runs. Must be shorter than the liveness timeout.
     */
    private Duration sweepInterval = Duration.ofSeconds(60);

    /**
     * Time a client gets to send its whole command line
     */
    private Duration readTimeout = Duration.ofSeconds(5);

    private int maxLineLength = 4096;

    @PostConstruct
    public void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("tracker.port must be between 0 and 65535, got " + port);
        }
        requirePositive("tracker.liveness-timeout", livenessTimeout);
        requirePositive("tracker.sweep-interval", sweepInterval);
        requirePositive("tracker.read-timeout", readTimeout);
        if (sweepInterval.compareTo(livenessTimeout) >= 0) {
            throw new IllegalStateException(
                "tracker.sweep-interval (" + sweepInterval + ") must be shorter than tracker.liveness-timeout ("
                    + livenessTimeout + ")");
        }
        if (maxLineLength <= 0) {
            throw new IllegalStateException("tracker.max-line-length must be positive");
        }
    }

    static void requirePositive(String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException(key + " must be a positive duration, got " + value);
        }
    }
}
