package dev.kyriji.bmcnetwork.objects;

import dev.kyriji.bmcnetwork.enums.PortProtocol;

import java.util.Objects;

public class Backend {
	private final int targetPort;
	private final PortProtocol protocol;

	public Backend(int targetPort, PortProtocol protocol) {
		this.targetPort = targetPort;
		this.protocol = protocol;
	}

	public int getTargetPort() {
		return targetPort;
	}

	public PortProtocol getProtocol() {
		return protocol;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Backend backend)) return false;
		return targetPort == backend.targetPort && protocol == backend.protocol;
	}

	@Override
	public int hashCode() {
		return Objects.hash(targetPort, protocol);
	}

	@Override
	public String toString() {
		return targetPort + "/" + protocol;
	}
}
