package p2pchat.service;

/**
 * Outcome of handing one message to one peer.
 */
public record DeliveryResult(String peerId, boolean delivered, String error) {

	public static DeliveryResult delivered(String peerId) {
		return new DeliveryResult(peerId, true, null);
	}

	public static DeliveryResult failed(String peerId, String error) {
		return new DeliveryResult(peerId, false, error);
	}
}
