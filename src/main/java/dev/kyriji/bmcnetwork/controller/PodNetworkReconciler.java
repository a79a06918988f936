package dev.kyriji.bmcnetwork.controller;

import dev.kyriji.bmcnetwork.controllers.ProviderManager;
import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.enums.NetworkState;
import dev.kyriji.bmcnetwork.enums.PluginErrorType;
import dev.kyriji.bmcnetwork.enums.RequestType;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.interfaces.NetworkPlugin;
import dev.kyriji.bmcnetwork.network.PodNetwork;
import dev.kyriji.bmcnetwork.objects.NetworkStatus;
import dev.kyriji.bmcnetwork.objects.ReconcileRequest;
import dev.kyriji.bmcnetwork.objects.ReconcileResult;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Hands one pod to its network plugin and writes the returned labels and annotations back.
 */
public class PodNetworkReconciler {
	private final KubernetesClient client;
	private final ProviderManager providers;
	private final long requeueDelayMs;
	private final long parameterErrorDelayMs;

	public PodNetworkReconciler(KubernetesClient client, ProviderManager providers, long requeueDelayMs, long parameterErrorDelayMs) {
		this.client = client;
		this.providers = providers;
		this.requeueDelayMs = requeueDelayMs;
		this.parameterErrorDelayMs = parameterErrorDelayMs;
	}

	public ReconcileResult reconcile(ReconcileRequest request) {
		try {
			if (request.getType() == RequestType.DELETE) {
				return reconcileDeletion(request);
			}

			// 1. Fetch the pod, it may already be gone
			Pod pod = client.pods().inNamespace(request.getNamespace()).withName(request.getName()).get();
			if (pod == null || pod.getMetadata().getDeletionTimestamp() != null) {
				return ReconcileResult.done();
			}

			// 2. Find its plugin
			NetworkPlugin plugin = providers.findPlugin(pod);
			if (plugin == null) {
				System.err.println("No network plugin registered for " + request.getKey() + " (network type "
					+ networkType(pod) + ")");
				return ReconcileResult.done();
			}

			// 3. Run the plugin on a private copy
			Pod copy = new PodBuilder(pod).build();
			boolean firstSeen = new PodNetwork(pod).getStatus() == null;
			Pod result = firstSeen ? plugin.onPodAdded(copy) : plugin.onPodUpdated(copy);

			// 4. Persist what the plugin changed
			if (metadataChanged(pod, result)) {
				writeBack(request, result);
			}

			// 5. Keep polling until the load balancer reports an address
			if (firstSeen) {
				return ReconcileResult.requeueAfter(0, "initial network status recorded");
			}
			PodNetwork network = new PodNetwork(result);
			NetworkStatus status = network.getStatus();
			if (status != null && status.getCurrentNetworkState() != NetworkState.READY && !network.isDisabled()) {
				return ReconcileResult.requeueAfter(requeueDelayMs, "network " + status.getCurrentNetworkState());
			}
			return ReconcileResult.done();

		} catch (PluginException e) {
			System.err.println("Failed to reconcile network of " + request.getKey() + ": " + e);
			if (e.getType() == PluginErrorType.CAPACITY_EXHAUSTED) {
				markNotReady(request);
			}
			long delay = e.isRetryable() ? requeueDelayMs : parameterErrorDelayMs;
			return ReconcileResult.requeueAfter(delay, e.getType().name());
		} catch (KubernetesClientException e) {
			System.err.println("Kubernetes API error reconciling " + request.getKey() + ": " + e.getMessage());
			return ReconcileResult.requeueAfter(requeueDelayMs, "API error " + e.getCode());
		} catch (Exception e) {
			System.err.println("Error reconciling " + request + ": " + e.getMessage());
			e.printStackTrace();
			return ReconcileResult.requeueAfter(requeueDelayMs * 2, "unexpected error");
		}
	}

	private ReconcileResult reconcileDeletion(ReconcileRequest request) {
		Pod pod = request.getFinalState();
		if (pod == null) return ReconcileResult.done();

		NetworkPlugin plugin = providers.findPlugin(pod);
		if (plugin == null) return ReconcileResult.done();

		plugin.onPodDeleted(pod);
		return ReconcileResult.done();
	}

	/**
	 * The Service no longer matches the configuration, so addresses published earlier are stale.
	 */
	private void markNotReady(ReconcileRequest request) {
		try {
			Pod pod = client.pods().inNamespace(request.getNamespace()).withName(request.getName()).get();
			if (pod == null) return;

			PodNetwork network = new PodNetwork(pod);
			NetworkStatus status = network.getStatus();
			if (status == null || status.getCurrentNetworkState() == NetworkState.NOT_READY) return;

			status.transitionTo(NetworkState.NOT_READY);
			network.setStatus(status);
			writeBack(request, network.getPod());
			System.out.println("Marked network of " + request.getKey() + " NotReady until ports are available");
		} catch (KubernetesClientException e) {
			System.err.println("Failed to mark network of " + request.getKey() + " NotReady: " + e.getMessage());
		}
	}

	private void writeBack(ReconcileRequest request, Pod result) {
		Map<String, String> labels = nonNull(result.getMetadata().getLabels());
		Map<String, String> annotations = nonNull(result.getMetadata().getAnnotations());

		client.pods()
				.inNamespace(request.getNamespace())
				.withName(request.getName())
				.edit(pod -> new PodBuilder(pod)
						.editMetadata()
							.addToLabels(labels)
							.addToAnnotations(annotations)
						.endMetadata()
						.build());
	}

	private boolean metadataChanged(Pod before, Pod after) {
		return !Objects.equals(nonNull(before.getMetadata().getLabels()), nonNull(after.getMetadata().getLabels()))
			|| !Objects.equals(nonNull(before.getMetadata().getAnnotations()), nonNull(after.getMetadata().getAnnotations()));
	}

	private Map<String, String> nonNull(Map<String, String> map) {
		return map == null ? new HashMap<>() : map;
	}

	private String networkType(Pod pod) {
		Map<String, String> annotations = pod.getMetadata().getAnnotations();
		return annotations == null ? null : annotations.get(NetworkLabel.NETWORK_TYPE.getLabel());
	}
}
