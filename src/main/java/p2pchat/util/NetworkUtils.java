package p2pchat.util;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.experimental.UtilityClass;

@UtilityClass
public class NetworkUtils {

	private static final Logger logger = LoggerFactory.getLogger(NetworkUtils.class);

	private static final String LOOPBACK_V4 = "127.0.0.1";

	/**
	 * Best guess at the IPv4 address other peers can reach us on. Starts from
	 * the host name; if that resolves to loopback, asks the routing table which
	 * interface would be used for an outbound datagram (no packet is sent).
	 * Falls back to {@code 127.0.0.1}.
	 */
	public static String detectLocalIp() {
		String candidate;
		try {
			candidate = InetAddress.getLocalHost().getHostAddress();
		} catch (IOException e) {
			candidate = LOOPBACK_V4;
		}

		if (!candidate.startsWith("127.")) {
			return candidate;
		}

		try (DatagramSocket socket = new DatagramSocket()) {
			socket.connect(new InetSocketAddress("8.8.8.8", 80));
			final var local = socket.getLocalAddress();
			if (local != null && !local.isAnyLocalAddress() && local.getAddress().length == 4) {
				return local.getHostAddress();
			}
		} catch (IOException | RuntimeException e) {
			logger.debug("No outbound route for address detection: {}", e.getMessage());
		}
		return LOOPBACK_V4;
	}

	public static boolean isValidPort(int port) {
		return port >= 1 && port <= 65535;
	}
}
