package dev.kyriji.bmcnetwork.providers.jdcloud;

import com.google.gson.Gson;
import dev.kyriji.bmcnetwork.config.NetworkConfig;
import dev.kyriji.bmcnetwork.config.NetworkConfigSchema;
import dev.kyriji.bmcnetwork.config.OptionType;
import dev.kyriji.bmcnetwork.config.PluginOptions;
import dev.kyriji.bmcnetwork.enums.PortProtocol;
import dev.kyriji.bmcnetwork.interfaces.LoadBalancerAdapter;
import dev.kyriji.bmcnetwork.interfaces.TrafficToggle;
import dev.kyriji.bmcnetwork.network.NetworkAddresses;
import dev.kyriji.bmcnetwork.network.ServiceContext;
import dev.kyriji.bmcnetwork.network.ServiceTypeToggle;
import dev.kyriji.bmcnetwork.objects.Backend;
import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JD Cloud NLB. The listener layout is handed to the JD cloud controller as a JSON spec annotation.
 */
public class JdCloudNlbAdapter implements LoadBalancerAdapter {
	public static final String NAME = "JdCloud-NLB";
	public static final String ALIAS = "NLB-Network";
	public static final String OPTIONS_PREFIX = "JDCLOUD_NLB";

	public static final String NLB_IDS = "NlbIds";
	public static final String NLB_ID_ANNOTATION = "service.beta.kubernetes.io/jdcloud-loadbalancer-id";
	public static final String NLB_SPEC_ANNOTATION = "service.beta.kubernetes.io/jdcloud-load-balancer-spec";
	public static final String ALGORITHM = "service.beta.kubernetes.io/jdcloud-lb-algorithm";
	public static final String IDLE_TIME = "service.beta.kubernetes.io/jdcloud-lb-idle-time";
	public static final String ALLOCATE_NODE_PORTS = "AllocateLoadBalancerNodePorts";

	private static final int MAX_PORTS = 200;
	private static final int DEFAULT_IDLE_TIME = 600;
	private static final String DEFAULT_ALGORITHM = "RoundRobin";
	private static final Gson GSON = new Gson();

	private final PluginOptions options;
	private final TrafficToggle toggle = new ServiceTypeToggle();
	private final NetworkConfigSchema schema = NetworkConfigSchema.builder()
			.loadBalancerIds(NLB_IDS)
			.option(ALGORITHM, OptionType.STRING)
			.option(IDLE_TIME, OptionType.INTEGER)
			.option(ALLOCATE_NODE_PORTS, OptionType.BOOLEAN)
			.protocols(PortProtocol.TCP, PortProtocol.UDP)
			.build();

	public JdCloudNlbAdapter(PluginOptions options) {
		options.validate(MAX_PORTS, false);
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
	public String getServiceType() {
		return "LoadBalancer";
	}

	@Override
	public TrafficToggle getTrafficToggle() {
		return toggle;
	}

	@Override
	public String getLoadBalancerIdAnnotation() {
		return NLB_ID_ANNOTATION;
	}

	@Override
	public Map<String, String> getServiceAnnotations(ServiceContext context) {
		NetworkConfig config = context.getConfig();
		String algorithm = config.getOption(ALGORITHM, DEFAULT_ALGORITHM);
		int idleTime = Integer.parseInt(config.getOption(IDLE_TIME, Integer.toString(DEFAULT_IDLE_TIME)));

		NlbSpec spec = new NlbSpec();
		spec.loadBalancerId = context.getAllocation().getLoadBalancerId();
		for (Backend backend : config.getBackends()) {
			NlbListener listener = new NlbListener();
			listener.protocol = backend.getProtocol().name();
			listener.connectionIdleTimeSeconds = idleTime;
			listener.backend = new NlbListenerBackend();
			listener.backend.algorithm = algorithm;
			spec.listeners.add(listener);
		}
		return Map.of(NLB_SPEC_ANNOTATION, GSON.toJson(spec));
	}

	@Override
	public void customizeService(ServiceBuilder builder, ServiceContext context) {
		boolean allocateNodePorts = Boolean.parseBoolean(context.getConfig().getOption(ALLOCATE_NODE_PORTS, "true"));
		builder.editSpec()
				.withAllocateLoadBalancerNodePorts(allocateNodePorts)
				.endSpec();
	}

	@Override
	public List<NetworkAddress> resolveExternalAddresses(KubernetesClient client, Pod pod, Service service) {
		String ip = NetworkAddresses.ingressIp(service);
		if (ip == null) return List.of();
		return List.of(NetworkAddress.ofIp(ip, NetworkAddresses.externalPorts(service, false)));
	}

	static class NlbSpec {
		String version = "v1";
		String loadBalancerId;
		String loadBalancerType = "nlb";
		boolean internal = false;
		List<NlbListener> listeners = new ArrayList<>();
	}

	static class NlbListener {
		String protocol;
		int connectionIdleTimeSeconds;
		NlbListenerBackend backend;
	}

	static class NlbListenerBackend {
		boolean proxyProtocol = false;
		String algorithm;
	}
}
