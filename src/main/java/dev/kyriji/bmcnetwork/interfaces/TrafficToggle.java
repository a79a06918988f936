package dev.kyriji.bmcnetwork.interfaces;

import io.fabric8.kubernetes.api.model.Service;

public interface TrafficToggle {

	boolean isDisabled(Service service);

	/**
	 * @return a copy of the Service that keeps its ports but routes no traffic to the pod
	 */
	Service disable(Service service);
}
