package p2pchat.service;

import java.util.List;

/**
 * Per-peer outcomes of one broadcast. A broadcast never fails as a whole.
 */
public record BroadcastReport(List<DeliveryResult> results) {

	public BroadcastReport {
		results = List.copyOf(results);
	}

	public long deliveredCount() {
		return results.stream().filter(DeliveryResult::delivered).count();
	}

	public List<DeliveryResult> failures() {
		return results.stream().filter(result -> !result.delivered()).toList();
	}
}
