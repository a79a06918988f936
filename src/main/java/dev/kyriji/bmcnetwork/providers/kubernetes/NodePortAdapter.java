package dev.kyriji.bmcnetwork.providers.kubernetes;

import dev.kyriji.bmcnetwork.config.NetworkConfigSchema;
import dev.kyriji.bmcnetwork.config.PluginOptions;
import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.enums.PortProtocol;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.interfaces.LoadBalancerAdapter;
import dev.kyriji.bmcnetwork.interfaces.TrafficToggle;
import dev.kyriji.bmcnetwork.network.NetworkAddresses;
import dev.kyriji.bmcnetwork.network.SelectorToggle;
import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import dev.kyriji.bmcnetwork.objects.NetworkPort;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.util.List;

/**
 * Plain NodePort Service. Kubernetes picks the node ports, so nothing is drawn from a pool.
 */
public class NodePortAdapter implements LoadBalancerAdapter {
	public static final String NAME = "Kubernetes-NodePort";
	public static final String ALIAS = "NodePort";
	public static final String OPTIONS_PREFIX = "NODEPORT";

	private final PluginOptions options;
	private final TrafficToggle toggle = new SelectorToggle();
	private final NetworkConfigSchema schema = NetworkConfigSchema.builder()
			.requirePortProtocols()
			.protocols(PortProtocol.TCP, PortProtocol.UDP, PortProtocol.TCPUDP)
			.build();

	public NodePortAdapter(PluginOptions options) {
		this.options = options;
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
	public NetworkConfigSchema getConfigSchema() {
		return schema;
	}

	@Override
	public PluginOptions getOptions() {
		return options;
	}

	@Override
	public boolean isPooled() {
		return false;
	}

	@Override
	public String getServiceType() {
		return "NodePort";
	}

	@Override
	public TrafficToggle getTrafficToggle() {
		return toggle;
	}

	@Override
	public String getLoadBalancerIdAnnotation() {
		return NetworkLabel.LOAD_BALANCER_ID.getLabel();
	}

	@Override
	public List<NetworkAddress> resolveExternalAddresses(KubernetesClient client, Pod pod, Service service) {
		List<NetworkPort> ports = NetworkAddresses.externalPorts(service, true);
		if (ports.isEmpty() || ports.stream().anyMatch(port -> port.getPort() == 0)) return List.of();

		String nodeName = pod.getSpec() == null ? null : pod.getSpec().getNodeName();
		if (nodeName == null || nodeName.isEmpty()) return List.of();

		Node node;
		try {
			node = client.nodes().withName(nodeName).get();
		} catch (KubernetesClientException e) {
			throw PluginException.apiCall("failed to get node " + nodeName, e);
		}
		String nodeIp = NetworkAddresses.nodeAddress(node);
		if (nodeIp == null) return List.of();

		return List.of(NetworkAddress.ofIp(nodeIp, ports));
	}
}
