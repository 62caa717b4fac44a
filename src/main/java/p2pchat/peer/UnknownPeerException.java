package p2pchat.peer;

import lombok.experimental.StandardException;

/**
 * The peer id is not in the local cache. Raised before any network call.
 */
@SuppressWarnings("serial")
@StandardException
public class UnknownPeerException extends RuntimeException {
}
