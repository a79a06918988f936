package dev.kyriji.bmcnetwork.controller;

import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.objects.ReconcileRequest;
import dev.kyriji.bmcnetwork.objects.ReconcileResult;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.fabric8.kubernetes.client.informers.SharedInformerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

public class InformerManager {
	private final SharedInformerFactory informerFactory;
	private final ReconciliationQueue queue;
	private final PodNetworkReconciler reconciler;
	private final int workers;
	private final long resyncPeriodMs;
	private final AtomicBoolean running = new AtomicBoolean(false);
	private final List<Thread> workerThreads = new ArrayList<>();
	private SharedIndexInformer<Pod> podInformer;

	public InformerManager(KubernetesClient client, ReconciliationQueue queue, PodNetworkReconciler reconciler, int workers, long resyncPeriodMs) {
		this.informerFactory = client.informers();
		this.queue = queue;
		this.reconciler = reconciler;
		this.workers = workers;
		this.resyncPeriodMs = resyncPeriodMs;
	}

	public void setupInformers() {
		podInformer = informerFactory.sharedIndexInformerFor(Pod.class, resyncPeriodMs);

		podInformer.addEventHandler(new ResourceEventHandler<Pod>() {
			@Override
			public void onAdd(Pod pod) {
				if (hasNetwork(pod)) {
					queue.enqueue(ReconcileRequest.forPod(pod));
				}
			}

			@Override
			public void onUpdate(Pod oldPod, Pod newPod) {
				if (hasNetwork(newPod)) {
					queue.enqueue(ReconcileRequest.forPod(newPod));
				}
			}

			@Override
			public void onDelete(Pod pod, boolean deletedFinalStateUnknown) {
				if (hasNetwork(pod)) {
					queue.enqueue(ReconcileRequest.forDeletedPod(pod));
				}
			}
		});

		System.out.println("Informer configured for Pods with a network type");
	}

	static boolean hasNetwork(Pod pod) {
		Map<String, String> annotations = pod.getMetadata().getAnnotations();
		if (annotations == null) return false;
		String networkType = annotations.get(NetworkLabel.NETWORK_TYPE.getLabel());
		return networkType != null && !networkType.isEmpty();
	}

	public void start() {
		System.out.println("Starting informers...");
		informerFactory.startAllRegisteredInformers();

		// Wait for informers to sync
		System.out.println("Waiting for informers to sync...");
		int maxWaitSeconds = 30;
		int waitedSeconds = 0;
		while (!podInformer.hasSynced() && waitedSeconds < maxWaitSeconds) {
			try {
				Thread.sleep(1000);
				waitedSeconds++;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}
		}

		if (waitedSeconds >= maxWaitSeconds) {
			System.err.println("Warning: Informers did not sync within " + maxWaitSeconds + " seconds");
		} else {
			System.out.println("Informers synced successfully in " + waitedSeconds + " seconds");
		}

		startReconciliationWorkers();
	}

	private void startReconciliationWorkers() {
		running.set(true);
		for (int i = 0; i < workers; i++) {
			Thread thread = new Thread(this::runWorker, "network-reconciler-" + i);
			thread.setDaemon(false);
			thread.start();
			workerThreads.add(thread);
		}
		System.out.println("Started " + workers + " reconciliation workers");
	}

	private void runWorker() {
		while (running.get()) {
			try {
				ReconcileRequest request = queue.dequeue();
				ReconcileResult result = reconciler.reconcile(request);

				// the queue keeps the pod to itself until it is completed or its requeue fires
				if (!result.shouldRequeue()) {
					queue.markComplete(request);
				} else {
					queue.requeue(request, result.getRequeueAfterMs());
				}

			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			} catch (Exception e) {
				System.err.println("Error in reconciliation loop: " + e.getMessage());
				e.printStackTrace();
			}
		}
		System.out.println(Thread.currentThread().getName() + " stopped");
	}

	public void shutdown() {
		System.out.println("Shutting down InformerManager...");
		running.set(false);

		for (Thread thread : workerThreads) {
			thread.interrupt();
		}
		for (Thread thread : workerThreads) {
			try {
				thread.join(5000);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}

		informerFactory.stopAllRegisteredInformers();
		queue.shutdown();
		System.out.println("InformerManager shutdown complete");
	}
}
