package dev.kyriji.bmcnetwork.enums;

public enum RequestType {
	SYNC,
	DELETE
}
