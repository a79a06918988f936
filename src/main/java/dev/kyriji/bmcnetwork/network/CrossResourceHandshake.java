package dev.kyriji.bmcnetwork.network;

import dev.kyriji.bmcnetwork.enums.HandshakeOutcome;
import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.enums.SyncStatus;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.interfaces.HandshakeLink;
import dev.kyriji.bmcnetwork.utils.KubeResources;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Second phase of a chained binding. Watches intermediate resources labelled
 * {@code sync-status=pending}; once one exposes its cloud identifier the dependent resources are
 * applied and the label flips to {@code done}. The label is the only state, so a restart resumes
 * where it stopped.
 */
public class CrossResourceHandshake<T extends HasMetadata> {
	private static final long RESYNC_PERIOD_MS = 10 * 60 * 1000L;

	private final KubernetesClient client;
	private final HandshakeLink<T> link;
	private final long pollIntervalMs;
	private final long pollTimeoutMs;
	private final Set<String> polling = ConcurrentHashMap.newKeySet();
	private final ScheduledExecutorService scheduler;
	private SharedIndexInformer<T> informer;

	public CrossResourceHandshake(KubernetesClient client, HandshakeLink<T> link, long pollIntervalMs, long pollTimeoutMs) {
		this.client = client;
		this.link = link;
		this.pollIntervalMs = pollIntervalMs;
		this.pollTimeoutMs = pollTimeoutMs;
		this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "handshake-" + link.getResourceType().getSimpleName().toLowerCase());
			t.setDaemon(true);
			return t;
		});
	}

	public void start() {
		informer = client.resources(link.getResourceType()).inAnyNamespace()
				.withLabel(NetworkLabel.MANAGED_BY.getLabel(), NetworkLabel.MANAGED_BY_VALUE)
				.inform(new ResourceEventHandler<T>() {
					@Override
					public void onAdd(T resource) {
						handle(resource);
					}

					@Override
					public void onUpdate(T oldResource, T newResource) {
						handle(newResource);
					}

					@Override
					public void onDelete(T resource, boolean deletedFinalStateUnknown) {
						polling.remove(key(resource));
					}
				}, RESYNC_PERIOD_MS);

		System.out.println("Watching " + link.getResourceType().getSimpleName() + " resources for pending bindings");
	}

	/**
	 * Handles one observed state. A resource whose identifier is not there yet is polled in the
	 * background until the deadline.
	 */
	public HandshakeOutcome handle(T resource) {
		HandshakeOutcome outcome = attempt(resource);
		if (outcome == HandshakeOutcome.WAITING) {
			schedulePoll(resource);
		}
		return outcome;
	}

	private HandshakeOutcome attempt(T resource) {
		if (!isPending(resource)) return HandshakeOutcome.SKIPPED;

		String name = KubeResources.describe(resource);
		Optional<String> failure = link.findFailure(resource);
		if (failure.isPresent()) {
			// left for the external controller to retry
			System.err.println(name + " reports a failure, not binding: " + failure.get());
			return HandshakeOutcome.FAILED;
		}

		Optional<String> identifier = link.resolveIdentifier(resource);
		if (identifier.isEmpty()) return HandshakeOutcome.WAITING;

		try {
			System.out.println("Binding " + name + " with identifier " + identifier.get());
			link.completeBinding(client, resource, identifier.get());
			markDone(resource);
			return HandshakeOutcome.COMPLETED;
		} catch (PluginException | KubernetesClientException e) {
			System.err.println("Failed to complete binding of " + name + ": " + e.getMessage());
			return HandshakeOutcome.FAILED;
		}
	}

	private void markDone(T resource) {
		client.resources(link.getResourceType())
				.inNamespace(resource.getMetadata().getNamespace())
				.withName(resource.getMetadata().getName())
				.edit(current -> {
					Map<String, String> labels = current.getMetadata().getLabels() == null
						? new HashMap<>()
						: new HashMap<>(current.getMetadata().getLabels());
					labels.put(NetworkLabel.SYNC_STATUS.getLabel(), SyncStatus.DONE.getValue());
					current.getMetadata().setLabels(labels);
					return current;
				});
	}

	private void schedulePoll(T resource) {
		String key = key(resource);
		if (!polling.add(key)) return;

		long deadline = System.currentTimeMillis() + pollTimeoutMs;
		scheduler.schedule(() -> poll(resource.getMetadata().getNamespace(), resource.getMetadata().getName(), deadline),
			pollIntervalMs, TimeUnit.MILLISECONDS);
	}

	private void poll(String namespace, String name, long deadline) {
		String key = namespace + "/" + name;
		if (!polling.contains(key)) return;

		try {
			T latest = client.resources(link.getResourceType()).inNamespace(namespace).withName(name).get();
			HandshakeOutcome outcome = latest == null ? HandshakeOutcome.SKIPPED : attempt(latest);

			if (outcome != HandshakeOutcome.WAITING) {
				polling.remove(key);
				return;
			}
		} catch (KubernetesClientException e) {
			System.err.println("Failed to poll " + link.getResourceType().getSimpleName() + " " + key + ": " + e.getMessage());
		}

		if (System.currentTimeMillis() >= deadline) {
			polling.remove(key);
			System.err.println("Gave up waiting for " + link.getResourceType().getSimpleName() + " " + key
				+ " to report its identifier, waiting for the next event");
			return;
		}

		scheduler.schedule(() -> poll(namespace, name, deadline), pollIntervalMs, TimeUnit.MILLISECONDS);
	}

	private boolean isPending(T resource) {
		Map<String, String> labels = resource.getMetadata().getLabels();
		if (labels == null) return false;
		return SyncStatus.fromValue(labels.get(NetworkLabel.SYNC_STATUS.getLabel())) == SyncStatus.PENDING;
	}

	private String key(T resource) {
		return resource.getMetadata().getNamespace() + "/" + resource.getMetadata().getName();
	}

	public boolean isPolling(String namespace, String name) {
		return polling.contains(namespace + "/" + name);
	}

	public void stop() {
		if (informer != null) {
			informer.stop();
		}
		scheduler.shutdownNow();
		polling.clear();
	}
}
