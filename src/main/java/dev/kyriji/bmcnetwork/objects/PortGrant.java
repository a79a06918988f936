package dev.kyriji.bmcnetwork.objects;

import java.util.List;
import java.util.Objects;

public class PortGrant {
	private final String loadBalancerId;
	private final List<Integer> ports;

	public PortGrant(String loadBalancerId, List<Integer> ports) {
		this.loadBalancerId = loadBalancerId;
		this.ports = List.copyOf(ports);
	}

	public String getLoadBalancerId() {
		return loadBalancerId;
	}

	public List<Integer> getPorts() {
		return ports;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof PortGrant that)) return false;
		return Objects.equals(loadBalancerId, that.loadBalancerId) && Objects.equals(ports, that.ports);
	}

	@Override
	public int hashCode() {
		return Objects.hash(loadBalancerId, ports);
	}

	@Override
	public String toString() {
		return loadBalancerId + ports;
	}
}
