package p2pchat.tracker.protocol;

import lombok.experimental.StandardException;

@SuppressWarnings("serial")
@StandardException
public class MalformedCommandException extends RuntimeException {
}
