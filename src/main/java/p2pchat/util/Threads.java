package p2pchat.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.experimental.UtilityClass;

@UtilityClass
public class Threads {

	/**
	 * Thread factory producing named daemon threads ({@code prefix-1},
	 * {@code prefix-2}, ...), so background workers never hold the JVM open.
	 */
	public static ThreadFactory daemon(String prefix) {
		final var counter = new AtomicInteger();
		return runnable -> {
			final var thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
