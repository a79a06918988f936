package dev.kyriji.bmcnetwork.exceptions;

import dev.kyriji.bmcnetwork.enums.PluginErrorType;

public class PluginException extends RuntimeException {
	private final PluginErrorType type;

	public PluginException(PluginErrorType type, String message) {
		super(message);
		this.type = type;
	}

	public PluginException(PluginErrorType type, String message, Throwable cause) {
		super(message, cause);
		this.type = type;
	}

	public static PluginException parameter(String message) {
		return new PluginException(PluginErrorType.PARAMETER, message);
	}

	public static PluginException apiCall(String message, Throwable cause) {
		return new PluginException(PluginErrorType.API_CALL, message, cause);
	}

	public static PluginException insufficientPorts(String message) {
		return new PluginException(PluginErrorType.CAPACITY_EXHAUSTED, message);
	}

	public PluginErrorType getType() {
		return type;
	}

	public boolean isRetryable() {
		return type.isRetryable();
	}

	@Override
	public String toString() {
		return "PluginException{type=" + type + ", message='" + getMessage() + "'}";
	}
}
