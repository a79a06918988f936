package dev.kyriji.bmcnetwork.providers.hwcloud;

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
import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Huawei Cloud ELB through the CCE cloud controller: a LoadBalancer Service pinned to an existing ELB
 * by its id annotation.
 */
public class HwCloudElbAdapter implements LoadBalancerAdapter {
	public static final String NAME = "HwCloud-ELB";
	public static final String ALIAS = "ELB-Network";
	public static final String OPTIONS_PREFIX = "HWCLOUD_ELB";

	public static final String ELB_IDS = "ElbIds";
	public static final String ELB_ID_ANNOTATION = "kubernetes.io/elb.id";
	public static final String ELB_CLASS = "ElbClass";
	public static final String ELB_CONN_LIMIT = "ElbConnLimit";
	public static final String EXTERNAL_TRAFFIC_POLICY = "ExternalTrafficPolicyType";
	public static final String PUBLISH_NOT_READY_ADDRESSES = "PublishNotReadyAddresses";

	private static final int MAX_PORTS = 200;
	private static final String CLASS_DEDICATED = "dedicated";

	// config key -> Service annotation
	private static final Map<String, String> ANNOTATION_OPTIONS = new LinkedHashMap<>();
	private static final Map<String, OptionType> OPTION_TYPES = new LinkedHashMap<>();

	static {
		option("ElbAvailableZone", "kubernetes.io/elb.availability-zones", OptionType.STRING);
		option(ELB_CONN_LIMIT, "kubernetes.io/elb.connection-limit", OptionType.INTEGER);
		option("ElbSubnetId", "kubernetes.io/elb.subnet-id", OptionType.STRING);
		option("ElbEipId", "kubernetes.io/elb.eip-id", OptionType.STRING);
		option("ElbKeepd", "kubernetes.io/elb.keep-eip", OptionType.BOOLEAN);
		option("ElbEipAutoCreateOption", "kubernetes.io/elb.eip-auto-create-option", OptionType.JSON);
		option("ElbLbAlgorithm", "kubernetes.io/elb.lb-algorithm", OptionType.STRING);
		option("ElbSessionAffinityFlag", "kubernetes.io/elb.session-affinity-flag", OptionType.ON_OFF);
		option("ElbSessionAffinityOption", "kubernetes.io/elb.session-affinity-option", OptionType.JSON);
		option("ElbTransparentClientIP", "kubernetes.io/elb.enable-transparent-client-ip", OptionType.BOOLEAN);
		option("ElbXForwardedHost", "kubernetes.io/elb.x-forwarded-host", OptionType.BOOLEAN);
		option("ElbTlsRef", "kubernetes.io/elb.default-tls-container-ref", OptionType.STRING);
		option("ElbIdleTimeout", "kubernetes.io/elb.idle-timeout", OptionType.INTEGER);
		option("ElbRequestTimeout", "kubernetes.io/elb.request-timeout", OptionType.INTEGER);
		option("ElbResponseTimeout", "kubernetes.io/elb.response-timeout", OptionType.INTEGER);
		option("ElbEnableCrossVPC", "kubernetes.io/elb.enable-cross-vpc", OptionType.BOOLEAN);
		option("ElbL4FlavorID", "kubernetes.io/elb.l4-flavor-id", OptionType.STRING);
		option("ElbL7FlavorID", "kubernetes.io/elb.l7-flavor-id", OptionType.STRING);
		option("LBHealthCheckFlag", "kubernetes.io/elb.health-check-flag", OptionType.ON_OFF);
		option("LBHealthCheckOption", "kubernetes.io/elb.health-check-option", OptionType.JSON);
	}

	private static void option(String key, String annotation, OptionType type) {
		ANNOTATION_OPTIONS.put(key, annotation);
		OPTION_TYPES.put(key, type);
	}

	private final PluginOptions options;
	private final String defaultElbClass;
	private final TrafficToggle toggle = new ServiceTypeToggle();
	private final NetworkConfigSchema schema;

	public HwCloudElbAdapter(PluginOptions options) {
		options.validate(MAX_PORTS, true);
		this.options = options;
		this.defaultElbClass = options.get("CLASS", CLASS_DEDICATED);

		NetworkConfigSchema.Builder builder = NetworkConfigSchema.builder()
				.loadBalancerIds(ELB_IDS)
				.option(ELB_CLASS, OptionType.STRING)
				.option(EXTERNAL_TRAFFIC_POLICY, OptionType.STRING)
				.option(PUBLISH_NOT_READY_ADDRESSES, OptionType.BOOLEAN)
				.protocols(PortProtocol.TCP, PortProtocol.UDP, PortProtocol.TCPUDP);
		OPTION_TYPES.forEach(builder::option);
		this.schema = builder.build();
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
		return ELB_ID_ANNOTATION;
	}

	@Override
	public Map<String, String> getServiceAnnotations(ServiceContext context) {
		NetworkConfig config = context.getConfig();
		Map<String, String> annotations = new HashMap<>();

		String elbClass = config.getOption(ELB_CLASS, defaultElbClass);
		annotations.put("kubernetes.io/elb.class", elbClass);
		annotations.put("kubernetes.io/elb.lb-algorithm", "ROUND_ROBIN");
		annotations.put("kubernetes.io/elb.session-affinity-flag", "off");
		annotations.put("kubernetes.io/elb.health-check-flag", "on");

		ANNOTATION_OPTIONS.forEach((key, annotation) -> {
			String value = config.getOption(key);
			if (value != null) annotations.put(annotation, value);
		});

		// connection limits only exist on shared load balancers
		if (CLASS_DEDICATED.equals(elbClass)) {
			annotations.remove(ANNOTATION_OPTIONS.get(ELB_CONN_LIMIT));
		}
		return annotations;
	}

	@Override
	public void customizeService(ServiceBuilder builder, ServiceContext context) {
		NetworkConfig config = context.getConfig();
		builder.editSpec()
				.withExternalTrafficPolicy(config.getOption(EXTERNAL_TRAFFIC_POLICY, "Local"))
				.withPublishNotReadyAddresses(Boolean.parseBoolean(config.getOption(PUBLISH_NOT_READY_ADDRESSES, "false")))
				.endSpec();
	}

	@Override
	public List<NetworkAddress> resolveExternalAddresses(KubernetesClient client, Pod pod, Service service) {
		String ip = NetworkAddresses.ingressIp(service);
		if (ip == null) return List.of();
		return List.of(NetworkAddress.ofIp(ip, NetworkAddresses.externalPorts(service, false)));
	}
}
