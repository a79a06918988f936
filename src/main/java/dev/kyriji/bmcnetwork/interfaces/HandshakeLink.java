package dev.kyriji.bmcnetwork.interfaces;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.Optional;

/**
 * One chained binding: an intermediate resource reconciled by an external controller, and the
 * dependent resources created once it exposes its cloud-side identifier.
 */
public interface HandshakeLink<T extends HasMetadata> {

	Class<T> getResourceType();

	Optional<String> resolveIdentifier(T resource);

	/**
	 * @return the failure reported by the external controller, if any
	 */
	Optional<String> findFailure(T resource);

	void completeBinding(KubernetesClient client, T resource, String identifier);
}
