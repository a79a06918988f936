package dev.kyriji.bmcnetwork.providers.kubernetes;

import dev.kyriji.bmcnetwork.allocation.AllocationIndex;
import dev.kyriji.bmcnetwork.allocation.PortPool;
import dev.kyriji.bmcnetwork.config.PluginOptions;
import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.enums.NetworkState;
import dev.kyriji.bmcnetwork.enums.PortProtocol;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.interfaces.NetworkPlugin;
import dev.kyriji.bmcnetwork.network.NetworkAddresses;
import dev.kyriji.bmcnetwork.network.PodNetwork;
import dev.kyriji.bmcnetwork.objects.Allocation;
import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import dev.kyriji.bmcnetwork.objects.NetworkConfParam;
import dev.kyriji.bmcnetwork.objects.NetworkPort;
import dev.kyriji.bmcnetwork.objects.NetworkStatus;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerPort;
import io.fabric8.kubernetes.api.model.ContainerPortBuilder;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exposes game ports directly on the node through container host ports drawn from one cluster-wide
 * pool.
 *
 * Host ports are part of the pod spec and cannot change once the pod exists, so ports are granted by
 * {@link #preparePod(Pod)} before the pod is created. The controller hooks only adopt ports already
 * present on the pod and publish the node address.
 */
public class HostPortPlugin implements NetworkPlugin {
	public static final String NAME = "Kubernetes-HostPort";
	public static final String ALIAS = "HostPort";
	public static final String OPTIONS_PREFIX = "HOSTPORT";

	/** {@code <container>:<port>[/<protocol>],...}, the port may be {@value #SAME_AS_HOST} */
	public static final String CONTAINER_PORTS = "ContainerPorts";
	public static final String SAME_AS_HOST = "SameAsHost";

	// host ports sit behind no load balancer, the whole pool is one bitmap
	static final String POOL_ID = "node";

	private final PortPool pool;
	private final AllocationIndex index;
	private KubernetesClient client;

	public HostPortPlugin(PluginOptions options) {
		options.validate(65535, false);
		this.pool = new PortPool(options.getMinPort(), options.getMaxPort(), options.getBlockPorts());
		this.index = new AllocationIndex(pool);
	}

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public String getAlias() {
		return ALIAS;
	}

	@Override
	public void init(KubernetesClient client) {
		this.client = client;

		int restored = 0;
		for (Pod pod : client.pods().inAnyNamespace().list().getItems()) {
			if (!isHostPortPod(pod)) continue;
			if (adopt(pod)) restored++;
		}
		System.out.println("[" + NAME + "] Rebuilt " + restored + " host port allocations");
	}

	/**
	 * Grants host ports to a pod that is about to be created and writes them into its container ports.
	 * A pod that already holds a grant gets the same ports again.
	 *
	 * @return a patched copy of the pod
	 * @throws PluginException PARAMETER for an unreadable port list, CAPACITY_EXHAUSTED when the pool is full
	 */
	public Pod preparePod(Pod pod) {
		PodNetwork network = new PodNetwork(pod);
		Map<String, List<RequestedPort>> requested = parseContainerPorts(network);
		int count = requested.values().stream().mapToInt(List::size).sum();
		if (count == 0) return network.getPod();

		Allocation allocation = index.lookupOrAllocate(network.getKey(), List.of(POOL_ID), count)
				.orElseThrow(() -> PluginException.insufficientPorts("insufficient ports: " + count
					+ " host ports requested by " + network.getKey() + ", " + index.freeCount(POOL_ID) + " free"));

		int next = 0;
		for (Container container : network.getPod().getSpec().getContainers()) {
			List<RequestedPort> ports = requested.get(container.getName());
			if (ports == null) continue;

			List<ContainerPort> containerPorts = container.getPorts() == null ? new ArrayList<>() : new ArrayList<>(container.getPorts());
			for (RequestedPort port : ports) {
				int hostPort = allocation.getPorts().get(next++);
				int containerPort = port.sameAsHost ? hostPort : port.containerPort;
				for (String protocol : port.protocol.getServiceProtocols()) {
					containerPorts.add(new ContainerPortBuilder()
							.withContainerPort(containerPort)
							.withHostPort(hostPort)
							.withProtocol(protocol)
							.build());
				}
			}
			container.setPorts(containerPorts);
		}

		System.out.println("[" + NAME + "] Granted host ports " + allocation.getPorts() + " to " + network.getKey());
		return network.getPod();
	}

	@Override
	public Pod onPodAdded(Pod pod) {
		adopt(pod);

		PodNetwork network = new PodNetwork(pod);
		if (network.getStatus() == null) {
			network.setStatus(NetworkStatus.initial(NAME, NetworkState.NOT_READY));
		}
		return network.getPod();
	}

	@Override
	public Pod onPodUpdated(Pod pod) {
		adopt(pod);

		PodNetwork network = new PodNetwork(pod);
		NetworkStatus status = network.getStatus();
		if (status == null) {
			network.setStatus(NetworkStatus.initial(NAME, NetworkState.NOT_READY));
			return network.getPod();
		}

		List<NetworkPort> internalPorts = new ArrayList<>();
		List<NetworkPort> externalPorts = new ArrayList<>();
		for (Container container : pod.getSpec().getContainers()) {
			if (container.getPorts() == null) continue;
			for (ContainerPort port : container.getPorts()) {
				if (port.getHostPort() == null || !pool.inRange(port.getHostPort())) continue;

				String name = container.getName() + "-" + port.getContainerPort();
				String protocol = port.getProtocol() == null ? "TCP" : port.getProtocol();
				internalPorts.add(new NetworkPort(name, protocol, port.getContainerPort()));
				externalPorts.add(new NetworkPort(name, protocol, port.getHostPort()));
			}
		}

		String podIp = pod.getStatus() == null ? null : pod.getStatus().getPodIP();
		String nodeIp = nodeIp(pod);
		if (internalPorts.isEmpty() || podIp == null || podIp.isEmpty() || nodeIp == null) {
			status.transitionTo(NetworkState.NOT_READY);
		} else {
			status.publishReady(
				List.of(NetworkAddress.ofIp(podIp, internalPorts)),
				List.of(NetworkAddress.ofIp(nodeIp, externalPorts)));
		}

		status.setNetworkType(NAME);
		network.setStatus(status);
		return network.getPod();
	}

	@Override
	public void onPodDeleted(Pod pod) {
		String key = pod.getMetadata().getNamespace() + "/" + pod.getMetadata().getName();
		for (Allocation allocation : index.release(key)) {
			System.out.println("[" + NAME + "] Released host ports " + allocation.getPorts() + " of " + key);
		}
	}

	/**
	 * Records host ports the pod already declares, for pods granted before a restart or written by hand.
	 *
	 * @return whether an allocation was recorded
	 */
	private boolean adopt(Pod pod) {
		String key = pod.getMetadata().getNamespace() + "/" + pod.getMetadata().getName();
		if (index.lookup(key).isPresent()) return false;

		List<Integer> hostPorts = declaredHostPorts(pod);
		if (hostPorts.isEmpty()) return false;

		return index.restore(new Allocation(key, key, POOL_ID, hostPorts)).isPresent();
	}

	private List<Integer> declaredHostPorts(Pod pod) {
		Set<Integer> ports = new LinkedHashSet<>();
		if (pod.getSpec() == null || pod.getSpec().getContainers() == null) return List.of();

		for (Container container : pod.getSpec().getContainers()) {
			if (container.getPorts() == null) continue;
			for (ContainerPort port : container.getPorts()) {
				if (port.getHostPort() != null && pool.inRange(port.getHostPort())) ports.add(port.getHostPort());
			}
		}
		return new ArrayList<>(ports);
	}

	private String nodeIp(Pod pod) {
		String nodeName = pod.getSpec() == null ? null : pod.getSpec().getNodeName();
		if (nodeName == null || nodeName.isEmpty()) return null;

		Node node;
		try {
			node = client.nodes().withName(nodeName).get();
		} catch (KubernetesClientException e) {
			throw PluginException.apiCall("failed to get node " + nodeName, e);
		}
		return NetworkAddresses.nodeAddress(node);
	}

	private Map<String, List<RequestedPort>> parseContainerPorts(PodNetwork network) {
		Set<String> containers = new LinkedHashSet<>();
		for (Container container : network.getPod().getSpec().getContainers()) {
			containers.add(container.getName());
		}

		Map<String, List<RequestedPort>> requested = new LinkedHashMap<>();
		for (NetworkConfParam param : network.getConfParams()) {
			if (!CONTAINER_PORTS.equals(param.getName())) continue;

			String value = param.getValue() == null ? "" : param.getValue();
			String[] parts = value.split(":");
			if (parts.length != 2 || !containers.contains(parts[0].trim())) {
				throw PluginException.parameter("invalid " + CONTAINER_PORTS + " " + value + " on " + network.getKey()
					+ ", expected <container>:<port>[/<protocol>] naming one of " + containers);
			}

			List<RequestedPort> ports = new ArrayList<>();
			for (String item : parts[1].split(",")) {
				ports.add(RequestedPort.parse(item.trim(), network.getKey()));
			}
			requested.put(parts[0].trim(), ports);
		}
		return requested;
	}

	private static boolean isHostPortPod(Pod pod) {
		Map<String, String> annotations = pod.getMetadata().getAnnotations();
		if (annotations == null) return false;
		String networkType = annotations.get(NetworkLabel.NETWORK_TYPE.getLabel());
		return NAME.equals(networkType) || ALIAS.equals(networkType);
	}

	public AllocationIndex getIndex() {
		return index;
	}

	private static class RequestedPort {
		private final int containerPort;
		private final boolean sameAsHost;
		private final PortProtocol protocol;

		private RequestedPort(int containerPort, boolean sameAsHost, PortProtocol protocol) {
			this.containerPort = containerPort;
			this.sameAsHost = sameAsHost;
			this.protocol = protocol;
		}

		static RequestedPort parse(String item, String podKey) {
			String[] parts = item.split("/");
			PortProtocol protocol = PortProtocol.fromString(parts.length > 1 ? parts[1] : null);
			if (parts.length > 2 || protocol == null) {
				throw PluginException.parameter("invalid container port " + item + " on " + podKey);
			}

			if (SAME_AS_HOST.equals(parts[0])) {
				return new RequestedPort(0, true, protocol);
			}
			int port;
			try {
				port = Integer.parseInt(parts[0]);
			} catch (NumberFormatException e) {
				throw PluginException.parameter("invalid container port " + item + " on " + podKey);
			}
			if (port <= 0 || port > 65535) {
				throw PluginException.parameter("container port " + port + " on " + podKey + " is out of range");
			}
			return new RequestedPort(port, false, protocol);
		}
	}
}
