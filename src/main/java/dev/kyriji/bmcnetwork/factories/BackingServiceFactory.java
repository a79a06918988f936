package dev.kyriji.bmcnetwork.factories;

import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.interfaces.LoadBalancerAdapter;
import dev.kyriji.bmcnetwork.network.ServiceContext;
import dev.kyriji.bmcnetwork.objects.Allocation;
import dev.kyriji.bmcnetwork.objects.Backend;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.ServicePortBuilder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class BackingServiceFactory {

	public Service buildService(LoadBalancerAdapter adapter, ServiceContext context) {
		String podName = context.getPodName();

		// 1. Labels identify the Service for rebuild after a restart
		Map<String, String> labels = new HashMap<>();
		labels.put(NetworkLabel.MANAGED_BY.getLabel(), NetworkLabel.MANAGED_BY_VALUE);
		labels.put(NetworkLabel.NETWORK_TYPE.getLabel(), adapter.getName());

		// 2. Annotations carry the allocation record and the config hash
		Map<String, String> annotations = new HashMap<>(context.getConfig().getAnnotations());
		annotations.putAll(adapter.getServiceAnnotations(context));
		annotations.put(NetworkLabel.CONFIG_HASH.getLabel(), context.getConfigHash());
		annotations.put(NetworkLabel.NETWORK_OWNER.getLabel(), context.getOwnerKey());
		if (context.getAllocation() != null) {
			annotations.put(adapter.getLoadBalancerIdAnnotation(), context.getAllocation().getLoadBalancerId());
		}

		ServiceBuilder builder = new ServiceBuilder()
				.withNewMetadata()
					.withName(podName)
					.withNamespace(context.getNamespace())
					.withLabels(labels)
					.withAnnotations(annotations)
					.withOwnerReferences(context.getOwnerReferences())
				.endMetadata()
				.withNewSpec()
					.withType(adapter.getServiceType())
					.withSelector(Map.of(NetworkLabel.POD_NAME.getLabel(), podName))
					.withPorts(buildPorts(context))
				.endSpec();

		// 3. Cloud specific fields
		adapter.customizeService(builder, context);
		return builder.build();
	}

	public List<ServicePort> buildPorts(ServiceContext context) {
		List<Backend> backends = context.getConfig().getBackends();
		Allocation allocation = context.getAllocation();
		List<ServicePort> ports = new ArrayList<>();

		for (int i = 0; i < backends.size(); i++) {
			Backend backend = backends.get(i);
			int port = allocation != null ? allocation.getPorts().get(i) : backend.getTargetPort();

			for (String protocol : backend.getProtocol().getServiceProtocols()) {
				ports.add(new ServicePortBuilder()
						.withName(backend.getTargetPort() + "-" + protocol.toLowerCase())
						.withPort(port)
						.withProtocol(protocol)
						.withTargetPort(new IntOrString(backend.getTargetPort()))
						.build());
			}
		}
		return ports;
	}

	/**
	 * Merges the desired Service into the live one, keeping fields other controllers own
	 * (cluster IP, node ports, foreign annotations).
	 */
	public Service mergeInto(Service existing, Service desired) {
		return new ServiceBuilder(existing)
				.editMetadata()
					.addToLabels(desired.getMetadata().getLabels())
					.addToAnnotations(desired.getMetadata().getAnnotations())
					.withOwnerReferences(desired.getMetadata().getOwnerReferences())
				.endMetadata()
				.editSpec()
					.withType(desired.getSpec().getType())
					.withSelector(desired.getSpec().getSelector())
					.withPorts(desired.getSpec().getPorts())
					.withAllocateLoadBalancerNodePorts(desired.getSpec().getAllocateLoadBalancerNodePorts())
					.withExternalTrafficPolicy(desired.getSpec().getExternalTrafficPolicy())
					.withPublishNotReadyAddresses(desired.getSpec().getPublishNotReadyAddresses())
				.endSpec()
				.build();
	}

	public static OwnerReference buildOwnerReference(HasMetadata owner) {
		return new OwnerReferenceBuilder()
				.withApiVersion(owner.getApiVersion())
				.withKind(owner.getKind())
				.withName(owner.getMetadata().getName())
				.withUid(owner.getMetadata().getUid())
				.withController(true)
				.withBlockOwnerDeletion(true)
				.build();
	}
}
