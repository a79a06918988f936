package dev.kyriji.bmcnetwork.enums;

public enum NetworkAction {
	CREATE,
	UPDATE,
	WAIT_FOR_PREVIOUS_SERVICE,
	DISABLE,
	ENABLE,
	KEEP_DISABLED,
	CHECK_READINESS
}
