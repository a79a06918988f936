package dev.kyriji.bmcnetwork.providers.aws;

import dev.kyriji.bmcnetwork.config.NetworkConfigSchema;
import dev.kyriji.bmcnetwork.config.OptionType;
import dev.kyriji.bmcnetwork.config.PluginOptions;
import dev.kyriji.bmcnetwork.crd.Listener;
import dev.kyriji.bmcnetwork.crd.TargetGroup;
import dev.kyriji.bmcnetwork.crd.TargetGroupBinding;
import dev.kyriji.bmcnetwork.crd.TargetGroupSpec;
import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.enums.PortProtocol;
import dev.kyriji.bmcnetwork.enums.SyncStatus;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.interfaces.LoadBalancerAdapter;
import dev.kyriji.bmcnetwork.interfaces.TrafficToggle;
import dev.kyriji.bmcnetwork.network.CrossResourceHandshake;
import dev.kyriji.bmcnetwork.network.NetworkAddresses;
import dev.kyriji.bmcnetwork.network.SelectorToggle;
import dev.kyriji.bmcnetwork.network.ServiceContext;
import dev.kyriji.bmcnetwork.objects.Allocation;
import dev.kyriji.bmcnetwork.objects.Backend;
import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import dev.kyriji.bmcnetwork.utils.KubeResources;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * AWS Network Load Balancer. The Service stays ClusterIP; every allocated port gets an ACK TargetGroup
 * whose Listener and TargetGroupBinding are created by the handshake once AWS assigned the ARN.
 */
public class AwsNlbAdapter implements LoadBalancerAdapter {
	public static final String NAME = "AmazonWebServices-NLB";
	public static final String ALIAS = "AWS-NLB";
	public static final String OPTIONS_PREFIX = "AWS_NLB";

	public static final String NLB_ARNS = "NlbARNs";
	public static final String NLB_VPC_ID = "NlbVPCId";
	public static final String NLB_HEALTH_CHECK = "NlbHealthCheck";

	private static final int MAX_PORTS = 50;

	private final PluginOptions options;
	private final long pollIntervalMs;
	private final long pollTimeoutMs;
	private final TrafficToggle toggle = new SelectorToggle();
	private final NetworkConfigSchema schema = NetworkConfigSchema.builder()
			.loadBalancerIds(NLB_ARNS)
			.mandatoryOption(NLB_VPC_ID, OptionType.STRING)
			.healthCheck(NLB_HEALTH_CHECK)
			.protocols(PortProtocol.TCP, PortProtocol.UDP)
			.build();
	private CrossResourceHandshake<TargetGroup> handshake;

	public AwsNlbAdapter(PluginOptions options, long pollIntervalMs, long pollTimeoutMs) {
		options.validate(MAX_PORTS, false);
		this.options = options;
		this.pollIntervalMs = pollIntervalMs;
		this.pollTimeoutMs = pollTimeoutMs;
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
		return "ClusterIP";
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
	public void init(KubernetesClient client) {
		handshake = new CrossResourceHandshake<>(client, new AwsTargetGroupLink(), pollIntervalMs, pollTimeoutMs);
		handshake.start();
	}

	@Override
	public void syncChainedResources(KubernetesClient client, ServiceContext context) {
		Allocation allocation = context.getAllocation();
		List<Backend> backends = context.getConfig().getBackends();

		Set<String> current = new HashSet<>();
		for (int i = 0; i < allocation.getPorts().size(); i++) {
			TargetGroup targetGroup = buildTargetGroup(context, backends.get(i), allocation.getPorts().get(i));
			KubeResources.createOrUpdate(client, targetGroup);
			current.add(targetGroup.getMetadata().getName());
		}

		// ports the pool took back may already belong to another pod
		deleteStale(client, TargetGroup.class, context, current);
		deleteStale(client, Listener.class, context, current);
		deleteStale(client, TargetGroupBinding.class, context, current);
	}

	@Override
	public void ensureChainedResources(KubernetesClient client, ServiceContext context, Service service) {
		Allocation allocation = context.getAllocation();
		if (allocation == null) return;

		// 1. A target group went missing, recreate the whole chain
		List<TargetGroup> targetGroups = listOwned(client, TargetGroup.class, context.getNamespace(), context.getPodName());
		if (targetGroups.size() < allocation.getPorts().size()) {
			System.out.println("[" + NAME + "] Recreating target groups of " + context.getNamespace() + "/" + context.getPodName());
			syncChainedResources(client, context);
			return;
		}

		// 2. A finished target group lost its binding, send it through the handshake again
		Set<String> bound = new HashSet<>();
		for (TargetGroupBinding binding : listOwned(client, TargetGroupBinding.class, context.getNamespace(), context.getPodName())) {
			bound.add(binding.getMetadata().getName());
		}

		for (TargetGroup targetGroup : targetGroups) {
			String name = targetGroup.getMetadata().getName();
			String syncStatus = targetGroup.getMetadata().getLabels().get(NetworkLabel.SYNC_STATUS.getLabel());
			if (SyncStatus.fromValue(syncStatus) != SyncStatus.DONE || bound.contains(name)) continue;

			System.out.println("[" + NAME + "] Binding of " + context.getNamespace() + "/" + name + " is missing, restarting its handshake");
			client.resources(TargetGroup.class)
					.inNamespace(context.getNamespace())
					.withName(name)
					.edit(live -> {
						live.getMetadata().getLabels().put(NetworkLabel.SYNC_STATUS.getLabel(), SyncStatus.PENDING.getValue());
						return live;
					});
		}
	}

	@Override
	public List<NetworkAddress> resolveExternalAddresses(KubernetesClient client, Pod pod, Service service) {
		List<Integer> ports = NetworkAddresses.allocatedPorts(service);
		int bindings = listOwned(client, TargetGroupBinding.class, pod.getMetadata().getNamespace(), pod.getMetadata().getName()).size();
		if (ports.isEmpty() || bindings < ports.size()) return List.of();

		String arn = service.getMetadata().getAnnotations().get(getLoadBalancerIdAnnotation());
		String endpoint = endpointOf(arn);
		if (endpoint == null) {
			System.err.println("[" + NAME + "] Cannot derive an endpoint from load balancer ARN " + arn);
			return List.of();
		}

		return List.of(NetworkAddress.ofEndpoint(endpoint, NetworkAddresses.externalPorts(service, false)));
	}

	/**
	 * {@code arn:aws:elasticloadbalancing:<region>:<account>:loadbalancer/net/<name>/<id>} becomes
	 * {@code <name>-<id>.elb.<region>.amazonaws.com}.
	 */
	static String endpointOf(String arn) {
		if (arn == null) return null;
		String[] parts = arn.split(":");
		if (parts.length != 6) return null;

		String region = parts[3];
		String loadBalancer = parts[5];
		String prefix = "loadbalancer/net/";
		if (loadBalancer.startsWith(prefix)) {
			loadBalancer = loadBalancer.substring(prefix.length());
		}
		return loadBalancer.replace("/", "-") + ".elb." + region + ".amazonaws.com";
	}

	private TargetGroup buildTargetGroup(ServiceContext context, Backend backend, int port) {
		String name = context.getPodName() + "-" + port;
		Map<String, String> healthCheck = context.getConfig().getHealthCheck();

		Map<String, String> labels = new HashMap<>();
		labels.put(NetworkLabel.MANAGED_BY.getLabel(), NetworkLabel.MANAGED_BY_VALUE);
		labels.put(NetworkLabel.POD_NAME.getLabel(), context.getPodName());
		labels.put(NetworkLabel.SYNC_STATUS.getLabel(), SyncStatus.PENDING.getValue());

		TargetGroupSpec spec = new TargetGroupSpec();
		spec.setName(name);
		spec.setProtocol(backend.getProtocol().name());
		spec.setPort((long) backend.getTargetPort());
		spec.setTargetType("ip");
		spec.setVpcID(context.getConfig().getOption(NLB_VPC_ID));
		spec.setHealthCheckEnabled(parseBoolean(healthCheck.get("healthCheckEnabled")));
		spec.setHealthCheckIntervalSeconds(parseLong(healthCheck.get("healthCheckIntervalSeconds")));
		spec.setHealthCheckPath(healthCheck.get("healthCheckPath"));
		spec.setHealthCheckPort(healthCheck.get("healthCheckPort"));
		spec.setHealthCheckProtocol(healthCheck.get("healthCheckProtocol"));
		spec.setHealthCheckTimeoutSeconds(parseLong(healthCheck.get("healthCheckTimeoutSeconds")));
		spec.setHealthyThresholdCount(parseLong(healthCheck.get("healthyThresholdCount")));
		spec.setUnhealthyThresholdCount(parseLong(healthCheck.get("unhealthyThresholdCount")));

		TargetGroup targetGroup = new TargetGroup();
		targetGroup.setMetadata(new ObjectMetaBuilder()
				.withName(name)
				.withNamespace(context.getNamespace())
				.withLabels(labels)
				.withAnnotations(Map.of(
					NetworkLabel.LOAD_BALANCER_ID.getLabel(), context.getAllocation().getLoadBalancerId(),
					NetworkLabel.LOAD_BALANCER_PORT.getLabel(), Integer.toString(port)))
				.withOwnerReferences(context.getOwnerReferences())
				.build());
		targetGroup.setSpec(spec);
		return targetGroup;
	}

	private <T extends HasMetadata> List<T> listOwned(KubernetesClient client, Class<T> type, String namespace, String podName) {
		return client.resources(type).inNamespace(namespace)
				.withLabel(NetworkLabel.POD_NAME.getLabel(), podName)
				.withLabel(NetworkLabel.MANAGED_BY.getLabel(), NetworkLabel.MANAGED_BY_VALUE)
				.list()
				.getItems();
	}

	private <T extends HasMetadata> void deleteStale(KubernetesClient client, Class<T> type, ServiceContext context, Set<String> current) {
		for (T resource : listOwned(client, type, context.getNamespace(), context.getPodName())) {
			if (current.contains(resource.getMetadata().getName())) continue;

			try {
				client.resource(resource).delete();
			} catch (KubernetesClientException e) {
				throw PluginException.apiCall("failed to delete " + KubeResources.describe(resource), e);
			}
			System.out.println("[" + NAME + "] Deleted " + KubeResources.describe(resource) + " of a released port");
		}
	}

	// invalid health check values are left to the AWS defaults
	private static Boolean parseBoolean(String value) {
		if (value == null) return null;
		if (value.equalsIgnoreCase("true")) return true;
		if (value.equalsIgnoreCase("false")) return false;
		return null;
	}

	private static Long parseLong(String value) {
		if (value == null) return null;
		try {
			return Long.parseLong(value);
		} catch (NumberFormatException e) {
			return null;
		}
	}

	public CrossResourceHandshake<TargetGroup> getHandshake() {
		return handshake;
	}
}
