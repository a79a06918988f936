package dev.kyriji.bmcnetwork.network;

import dev.kyriji.bmcnetwork.interfaces.TrafficToggle;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.ServicePortBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts traffic by turning the Service into a ClusterIP, which detaches it from the load balancer
 * while the annotations keep the allocation.
 */
public class ServiceTypeToggle implements TrafficToggle {
	private static final String DISABLED_TYPE = "ClusterIP";

	@Override
	public boolean isDisabled(Service service) {
		return DISABLED_TYPE.equals(service.getSpec().getType());
	}

	@Override
	public Service disable(Service service) {
		List<ServicePort> ports = new ArrayList<>();
		if (service.getSpec().getPorts() != null) {
			for (ServicePort port : service.getSpec().getPorts()) {
				ports.add(new ServicePortBuilder(port).withNodePort(null).build());
			}
		}

		return new ServiceBuilder(service)
				.editSpec()
					.withType(DISABLED_TYPE)
					.withPorts(ports)
					.withAllocateLoadBalancerNodePorts(null)
					.withExternalTrafficPolicy(null)
				.endSpec()
				.build();
	}
}
