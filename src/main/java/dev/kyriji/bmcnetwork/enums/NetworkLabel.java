package dev.kyriji.bmcnetwork.enums;

public enum NetworkLabel {

	NETWORK_TYPE(getPrefix() + "network-type"),
	NETWORK_CONF(getPrefix() + "network-conf"),
	NETWORK_STATUS(getPrefix() + "network-status"),
	NETWORK_DISABLED(getPrefix() + "network-disabled"),
	GAME_SERVER(getPrefix() + "game-server"),
	POD_NAME(getPrefix() + "pod-name"),
	CONFIG_HASH(getPrefix() + "network-config-hash"),
	NETWORK_OWNER(getPrefix() + "network-owner"),
	MANAGED_BY(getPrefix() + "managed-by"),
	SYNC_STATUS(getPrefix() + "sync-status"),
	SELECTOR_DISABLED(getPrefix() + "svc-selector-disabled"),
	LOAD_BALANCER_ID(getPrefix() + "load-balancer-id"),
	LOAD_BALANCER_PORT(getPrefix() + "load-balancer-port"),
	;

	public static final String MANAGED_BY_VALUE = "bmc-network";

	private final String label;

	NetworkLabel(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	public static String getPrefix() {
		return "kyriji.dev/";
	}
}
