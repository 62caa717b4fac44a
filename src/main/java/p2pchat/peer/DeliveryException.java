package p2pchat.peer;

import lombok.experimental.StandardException;

/**
 * A message could not be handed to the remote peer: connection refused,
 * timed out or reset.
 */
@SuppressWarnings("serial")
@StandardException
public class DeliveryException extends RuntimeException {
}
