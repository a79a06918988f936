package dev.kyriji.bmcnetwork.enums;

public enum SyncStatus {
	PENDING("pending"),
	DONE("done");

	private final String value;

	SyncStatus(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	public static SyncStatus fromValue(String value) {
		if (value == null) return null;
		for (SyncStatus status : values()) {
			if (status.value.equalsIgnoreCase(value)) return status;
		}
		return null;
	}
}
