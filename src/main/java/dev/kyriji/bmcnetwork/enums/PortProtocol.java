package dev.kyriji.bmcnetwork.enums;

import java.util.List;

public enum PortProtocol {
	TCP,
	UDP,
	TCPUDP;

	/**
	 * Kubernetes protocols a Service port list needs for this protocol. TCPUDP maps one allocated
	 * port to a TCP and a UDP Service port.
	 */
	public List<String> getServiceProtocols() {
		return switch (this) {
			case TCP -> List.of("TCP");
			case UDP -> List.of("UDP");
			case TCPUDP -> List.of("TCP", "UDP");
		};
	}

	public static PortProtocol fromString(String value) {
		if (value == null || value.isBlank()) return TCP;
		for (PortProtocol protocol : values()) {
			if (protocol.name().equalsIgnoreCase(value.trim())) return protocol;
		}
		return null;
	}
}
