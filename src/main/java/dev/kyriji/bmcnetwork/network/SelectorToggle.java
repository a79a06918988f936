package dev.kyriji.bmcnetwork.network;

import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.interfaces.TrafficToggle;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;

import java.util.HashMap;
import java.util.Map;

/**
 * Cuts traffic by parking the pod-name selector under a key no pod carries.
 */
public class SelectorToggle implements TrafficToggle {

	@Override
	public boolean isDisabled(Service service) {
		Map<String, String> selector = service.getSpec().getSelector();
		return selector != null && selector.containsKey(NetworkLabel.SELECTOR_DISABLED.getLabel());
	}

	@Override
	public Service disable(Service service) {
		return moveSelector(service, NetworkLabel.POD_NAME.getLabel(), NetworkLabel.SELECTOR_DISABLED.getLabel());
	}

	private Service moveSelector(Service service, String from, String to) {
		Map<String, String> selector = service.getSpec().getSelector() == null
			? new HashMap<>()
			: new HashMap<>(service.getSpec().getSelector());

		String podName = selector.remove(from);
		if (podName == null) return service;
		selector.put(to, podName);

		return new ServiceBuilder(service)
				.editSpec()
					.withSelector(selector)
				.endSpec()
				.build();
	}
}
