package p2pchat.tracker;

import lombok.experimental.StandardException;

/**
 * The tracker answered with {@code status=error}.
 */
@SuppressWarnings("serial")
@StandardException
public class TrackerRejectedException extends RuntimeException {
}
