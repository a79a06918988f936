package dev.kyriji.bmcnetwork.objects;

public class ReconcileResult {
	private final boolean shouldRequeue;
	private final long requeueAfterMs;
	private final String reason;

	private ReconcileResult(boolean shouldRequeue, long requeueAfterMs, String reason) {
		this.shouldRequeue = shouldRequeue;
		this.requeueAfterMs = requeueAfterMs;
		this.reason = reason;
	}

	public static ReconcileResult done() {
		return new ReconcileResult(false, 0, null);
	}

	public static ReconcileResult requeueAfter(long milliseconds, String reason) {
		return new ReconcileResult(true, milliseconds, reason);
	}

	public boolean shouldRequeue() {
		return shouldRequeue;
	}

	public long getRequeueAfterMs() {
		return requeueAfterMs;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public String toString() {
		return "ReconcileResult{" +
			   "shouldRequeue=" + shouldRequeue +
			   ", requeueAfterMs=" + requeueAfterMs +
			   (reason != null ? ", reason='" + reason + '\'' : "") +
			   '}';
	}
}
