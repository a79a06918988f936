package dev.kyriji.bmcnetwork.objects;

import java.util.List;
import java.util.Objects;

public class Allocation {
	private final String ownerKey;
	private final String memberKey;
	private final String loadBalancerId;
	private final List<Integer> ports;

	public Allocation(String ownerKey, String memberKey, String loadBalancerId, List<Integer> ports) {
		this.ownerKey = ownerKey;
		this.memberKey = memberKey;
		this.loadBalancerId = loadBalancerId;
		this.ports = List.copyOf(ports);
	}

	public static Allocation of(String ownerKey, String memberKey, PortGrant grant) {
		return new Allocation(ownerKey, memberKey, grant.getLoadBalancerId(), grant.getPorts());
	}

	public String getOwnerKey() {
		return ownerKey;
	}

	public String getMemberKey() {
		return memberKey;
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
		if (!(o instanceof Allocation that)) return false;
		return Objects.equals(ownerKey, that.ownerKey) &&
			   Objects.equals(memberKey, that.memberKey) &&
			   Objects.equals(loadBalancerId, that.loadBalancerId) &&
			   Objects.equals(ports, that.ports);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ownerKey, memberKey, loadBalancerId, ports);
	}

	@Override
	public String toString() {
		return "Allocation{" +
			   "ownerKey='" + ownerKey + '\'' +
			   ", memberKey='" + memberKey + '\'' +
			   ", loadBalancerId='" + loadBalancerId + '\'' +
			   ", ports=" + ports +
			   '}';
	}
}
