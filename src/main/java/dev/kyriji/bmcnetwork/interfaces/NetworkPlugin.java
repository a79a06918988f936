package dev.kyriji.bmcnetwork.interfaces;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * Lifecycle hooks the pod controller calls for every pod whose network-type annotation names this
 * plugin. All three are idempotent; failures surface as {@link dev.kyriji.bmcnetwork.exceptions.PluginException}.
 */
public interface NetworkPlugin {

	String getName();

	String getAlias();

	/**
	 * Called once before any pod is handed to the plugin. Rebuilds in-memory allocation state from the
	 * cluster.
	 */
	void init(KubernetesClient client);

	Pod onPodAdded(Pod pod);

	Pod onPodUpdated(Pod pod);

	void onPodDeleted(Pod pod);
}
