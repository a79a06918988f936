package dev.kyriji.bmcnetwork.enums;

public enum PluginErrorType {
	API_CALL(true),
	INTERNAL(true),
	PARAMETER(false),
	NOT_IMPLEMENTED(false),
	CAPACITY_EXHAUSTED(true);

	private final boolean retryable;

	PluginErrorType(boolean retryable) {
		this.retryable = retryable;
	}

	public boolean isRetryable() {
		return retryable;
	}
}
