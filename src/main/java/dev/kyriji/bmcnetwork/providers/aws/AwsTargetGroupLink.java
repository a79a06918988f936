package dev.kyriji.bmcnetwork.providers.aws;

import dev.kyriji.bmcnetwork.crd.Listener;
import dev.kyriji.bmcnetwork.crd.ListenerSpec;
import dev.kyriji.bmcnetwork.crd.TargetGroup;
import dev.kyriji.bmcnetwork.crd.TargetGroupBinding;
import dev.kyriji.bmcnetwork.crd.TargetGroupBindingSpec;
import dev.kyriji.bmcnetwork.crd.TargetGroupStatus;
import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.interfaces.HandshakeLink;
import dev.kyriji.bmcnetwork.utils.KubeResources;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class AwsTargetGroupLink implements HandshakeLink<TargetGroup> {
	static final String CONDITION_SYNCED = "ACK.ResourceSynced";
	static final String CONDITION_TERMINAL = "ACK.Terminal";
	static final String CONDITION_RECOVERABLE = "ACK.Recoverable";

	@Override
	public Class<TargetGroup> getResourceType() {
		return TargetGroup.class;
	}

	@Override
	public Optional<String> resolveIdentifier(TargetGroup targetGroup) {
		TargetGroupStatus status = targetGroup.getStatus();
		if (status == null || status.getAckResourceMetadata() == null) return Optional.empty();
		if (!hasCondition(status, CONDITION_SYNCED)) return Optional.empty();

		String arn = status.getAckResourceMetadata().getArn();
		return arn == null || arn.isBlank() ? Optional.empty() : Optional.of(arn);
	}

	@Override
	public Optional<String> findFailure(TargetGroup targetGroup) {
		TargetGroupStatus status = targetGroup.getStatus();
		if (status == null || status.getConditions() == null) return Optional.empty();

		for (TargetGroupStatus.Condition condition : status.getConditions()) {
			boolean failed = CONDITION_TERMINAL.equals(condition.getType()) || CONDITION_RECOVERABLE.equals(condition.getType());
			if (failed && "True".equals(condition.getStatus())) {
				return Optional.of(condition.getType() + ": " + condition.getMessage());
			}
		}
		return Optional.empty();
	}

	@Override
	public void completeBinding(KubernetesClient client, TargetGroup targetGroup, String targetGroupArn) {
		Map<String, String> annotations = targetGroup.getMetadata().getAnnotations();
		String lbArn = annotations == null ? null : annotations.get(NetworkLabel.LOAD_BALANCER_ID.getLabel());
		String portStr = annotations == null ? null : annotations.get(NetworkLabel.LOAD_BALANCER_PORT.getLabel());
		String podName = targetGroup.getMetadata().getLabels().get(NetworkLabel.POD_NAME.getLabel());
		if (lbArn == null || portStr == null || podName == null) {
			throw PluginException.parameter(KubeResources.describe(targetGroup) + " is missing its load balancer annotations");
		}

		int port;
		try {
			port = Integer.parseInt(portStr);
		} catch (NumberFormatException e) {
			throw PluginException.parameter(KubeResources.describe(targetGroup) + " has an invalid port annotation " + portStr);
		}

		// 1. Listener forwarding the load balancer port to the target group
		ListenerSpec listenerSpec = new ListenerSpec();
		listenerSpec.setLoadBalancerARN(lbArn);
		listenerSpec.setPort((long) port);
		listenerSpec.setProtocol(targetGroup.getSpec().getProtocol());
		listenerSpec.setDefaultActions(List.of(new ListenerSpec.Action("forward", targetGroupArn)));

		Listener listener = new Listener();
		listener.setMetadata(dependentMetadata(targetGroup, podName));
		listener.setSpec(listenerSpec);
		KubeResources.createOrUpdate(client, listener);

		// 2. Binding registering the Service endpoints in the target group
		TargetGroupBindingSpec bindingSpec = new TargetGroupBindingSpec();
		bindingSpec.setTargetGroupARN(targetGroupArn);
		bindingSpec.setTargetType("ip");
		bindingSpec.setServiceRef(new TargetGroupBindingSpec.ServiceReference(podName, port));

		TargetGroupBinding binding = new TargetGroupBinding();
		binding.setMetadata(dependentMetadata(targetGroup, podName));
		binding.setSpec(bindingSpec);
		KubeResources.createOrUpdate(client, binding);
	}

	private ObjectMeta dependentMetadata(TargetGroup targetGroup, String podName) {
		return new ObjectMetaBuilder()
				.withName(targetGroup.getMetadata().getName())
				.withNamespace(targetGroup.getMetadata().getNamespace())
				.withOwnerReferences(targetGroup.getMetadata().getOwnerReferences())
				.addToLabels(NetworkLabel.MANAGED_BY.getLabel(), NetworkLabel.MANAGED_BY_VALUE)
				.addToLabels(NetworkLabel.POD_NAME.getLabel(), podName)
				.build();
	}

	private boolean hasCondition(TargetGroupStatus status, String type) {
		if (status.getConditions() == null) return false;
		for (TargetGroupStatus.Condition condition : status.getConditions()) {
			if (type.equals(condition.getType()) && "True".equals(condition.getStatus())) return true;
		}
		return false;
	}
}
