package dev.kyriji.bmcnetwork.network;

import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import dev.kyriji.bmcnetwork.objects.NetworkPort;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeAddress;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class NetworkAddresses {

	private NetworkAddresses() {
	}

	public static List<NetworkAddress> internal(Pod pod, Service service) {
		String podIp = pod.getStatus() != null ? pod.getStatus().getPodIP() : null;
		if (podIp == null || podIp.isEmpty()) return List.of();

		List<NetworkPort> ports = new ArrayList<>();
		for (ServicePort port : servicePorts(service)) {
			int target = port.getTargetPort() != null && port.getTargetPort().getIntVal() != null
				? port.getTargetPort().getIntVal()
				: port.getPort();
			ports.add(new NetworkPort(port.getName(), port.getProtocol(), target));
		}
		return List.of(NetworkAddress.ofIp(podIp, ports));
	}

	/**
	 * Service ports as seen from outside, using the Service port or the node port.
	 */
	public static List<NetworkPort> externalPorts(Service service, boolean nodePorts) {
		List<NetworkPort> ports = new ArrayList<>();
		for (ServicePort port : servicePorts(service)) {
			int value = nodePorts ? (port.getNodePort() == null ? 0 : port.getNodePort()) : port.getPort();
			ports.add(new NetworkPort(port.getName(), port.getProtocol(), value));
		}
		return ports;
	}

	/**
	 * Distinct Service port numbers in declaration order, which is the allocation order.
	 */
	public static List<Integer> allocatedPorts(Service service) {
		Set<Integer> ports = new LinkedHashSet<>();
		for (ServicePort port : servicePorts(service)) {
			if (port.getPort() != null) ports.add(port.getPort());
		}
		return new ArrayList<>(ports);
	}

	public static String ingressIp(Service service) {
		if (service.getStatus() == null || service.getStatus().getLoadBalancer() == null) return null;
		var ingress = service.getStatus().getLoadBalancer().getIngress();
		if (ingress == null || ingress.isEmpty()) return null;
		String ip = ingress.get(0).getIp();
		return ip == null || ip.isEmpty() ? null : ip;
	}

	/**
	 * Address a node is reached on from outside: its ExternalIP, else its InternalIP.
	 */
	public static String nodeAddress(Node node) {
		if (node == null || node.getStatus() == null || node.getStatus().getAddresses() == null) return null;

		String internal = null;
		for (NodeAddress address : node.getStatus().getAddresses()) {
			if ("ExternalIP".equals(address.getType())) return address.getAddress();
			if ("InternalIP".equals(address.getType())) internal = address.getAddress();
		}
		return internal;
	}

	private static List<ServicePort> servicePorts(Service service) {
		if (service.getSpec() == null || service.getSpec().getPorts() == null) return List.of();
		return service.getSpec().getPorts();
	}
}
