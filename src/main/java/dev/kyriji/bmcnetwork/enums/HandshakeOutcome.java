package dev.kyriji.bmcnetwork.enums;

public enum HandshakeOutcome {
	SKIPPED,
	WAITING,
	FAILED,
	COMPLETED
}
