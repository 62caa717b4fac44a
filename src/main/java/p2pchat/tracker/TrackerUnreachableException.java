package p2pchat.tracker;

import lombok.experimental.StandardException;

/**
 * The tracker could not be reached, timed out, or answered with something
 * that is not a tracker response.
 */
@SuppressWarnings("serial")
@StandardException
public class TrackerUnreachableException extends RuntimeException {
}
