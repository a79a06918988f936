package dev.kyriji.bmcnetwork.network;

import dev.kyriji.bmcnetwork.config.NetworkConfigSchema;
import dev.kyriji.bmcnetwork.config.PluginOptions;
import dev.kyriji.bmcnetwork.enums.PortProtocol;
import dev.kyriji.bmcnetwork.interfaces.LoadBalancerAdapter;
import dev.kyriji.bmcnetwork.interfaces.TrafficToggle;
import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.List;
import java.util.Map;

/**
 * LoadBalancer adapter whose readiness is switched by the test.
 */
class StubAdapter implements LoadBalancerAdapter {
	static final String NAME = "Stub-LB";
	static final String LB_ID_ANNOTATION = "stub.example.com/lb-id";

	private final PluginOptions options;
	private final TrafficToggle toggle = new ServiceTypeToggle();
	private final NetworkConfigSchema schema = NetworkConfigSchema.builder()
			.loadBalancerIds("LbIds")
			.protocols(PortProtocol.TCP, PortProtocol.UDP, PortProtocol.TCPUDP)
			.build();
	private volatile String readyIp;

	StubAdapter(int minPort, int maxPort) {
		this.options = new PluginOptions("STUB", true, minPort, maxPort, List.of(), Map.of());
	}

	void becomeReady(String ip) {
		this.readyIp = ip;
	}

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public String getAlias() {
		return "Stub";
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
	public String getServiceType() {
		return "LoadBalancer";
	}

	@Override
	public TrafficToggle getTrafficToggle() {
		return toggle;
	}

	@Override
	public String getLoadBalancerIdAnnotation() {
		return LB_ID_ANNOTATION;
	}

	@Override
	public List<NetworkAddress> resolveExternalAddresses(KubernetesClient client, Pod pod, Service service) {
		if (readyIp == null) return List.of();
		return List.of(NetworkAddress.ofIp(readyIp, NetworkAddresses.externalPorts(service, false)));
	}
}
