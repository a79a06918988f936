package dev.kyriji.bmcnetwork.logic;

import dev.kyriji.bmcnetwork.enums.NetworkAction;
import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.interfaces.TrafficToggle;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;

import java.util.Map;

/**
 * Decides the next step for one pod from the live backing Service. Has no side effects; the plugin
 * executes the returned action.
 */
public class NetworkLogic {

	public NetworkAction decide(Pod pod, Service service, String desiredHash, boolean podDisabled, TrafficToggle toggle) {
		// 1. Nothing exists yet
		if (service == null) {
			return NetworkAction.CREATE;
		}

		// 2. Service of an earlier pod with the same name, wait for garbage collection
		if (isOwnedByOtherPod(pod, service)) {
			return NetworkAction.WAIT_FOR_PREVIOUS_SERVICE;
		}

		// 3. Configuration drift, read from the cluster object and never from memory
		Map<String, String> annotations = service.getMetadata().getAnnotations();
		String storedHash = annotations == null ? null : annotations.get(NetworkLabel.CONFIG_HASH.getLabel());
		if (!desiredHash.equals(storedHash)) {
			return NetworkAction.UPDATE;
		}

		// 4. Traffic toggle
		boolean serviceDisabled = toggle.isDisabled(service);
		if (podDisabled) {
			return serviceDisabled ? NetworkAction.KEEP_DISABLED : NetworkAction.DISABLE;
		}
		if (serviceDisabled) {
			return NetworkAction.ENABLE;
		}

		// 5. Ready once the load balancer reports an address
		return NetworkAction.CHECK_READINESS;
	}

	private boolean isOwnedByOtherPod(Pod pod, Service service) {
		String podUid = pod.getMetadata().getUid();
		if (podUid == null || service.getMetadata().getOwnerReferences() == null) return false;

		for (OwnerReference owner : service.getMetadata().getOwnerReferences()) {
			if ("Pod".equals(owner.getKind())
				&& pod.getMetadata().getName().equals(owner.getName())
				&& !podUid.equals(owner.getUid())) {
				return true;
			}
		}
		return false;
	}
}
