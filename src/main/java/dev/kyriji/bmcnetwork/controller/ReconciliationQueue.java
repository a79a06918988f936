package dev.kyriji.bmcnetwork.controller;

import dev.kyriji.bmcnetwork.enums.RequestType;
import dev.kyriji.bmcnetwork.objects.ReconcileRequest;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Work queue keyed by pod ({@code namespace/name}). A pod is in one of three places at a time: waiting
 * in the queue, held by a worker, or parked until its requeue delay runs out. Events for a pod merge
 * into whatever request is already waiting for it, so a pod is never handed to two workers at once.
 *
 * Merging keeps the most recent request, except that a deletion is never replaced by a sync.
 */
public class ReconciliationQueue {
	private final BlockingQueue<String> keys = new LinkedBlockingQueue<>();
	private final Map<String, ReconcileRequest> waiting = new HashMap<>();
	private final Set<String> processing = new HashSet<>();
	// events that arrived while a worker held the pod
	private final Map<String, ReconcileRequest> dirty = new HashMap<>();
	private final Map<String, ReconcileRequest> parked = new HashMap<>();
	private final ScheduledThreadPoolExecutor scheduler;

	public ReconciliationQueue() {
		this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
			Thread t = new Thread(r, "network-requeue-scheduler");
			t.setDaemon(true);
			return t;
		});
		// parked pods are picked up again by the informer resync after a restart
		this.scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
	}

	/**
	 * @return false when the request was merged into one already waiting for the same pod
	 */
	public synchronized boolean enqueue(ReconcileRequest request) {
		String key = request.getKey();

		ReconcileRequest queued = waiting.get(key);
		if (queued != null) {
			waiting.put(key, merge(queued, request));
			return false;
		}

		if (processing.contains(key)) {
			ReconcileRequest pending = dirty.get(key);
			dirty.put(key, pending == null ? request : merge(pending, request));
			return pending == null;
		}

		// a fresh event beats the requeue delay
		ReconcileRequest delayed = parked.remove(key);
		if (delayed != null) {
			request = merge(delayed, request);
		}

		waiting.put(key, request);
		keys.offer(key);
		return true;
	}

	public ReconcileRequest dequeue() throws InterruptedException {
		while (true) {
			String key = keys.take();
			synchronized (this) {
				ReconcileRequest request = waiting.remove(key);
				if (request == null) continue;

				processing.add(key);
				return request;
			}
		}
	}

	/**
	 * Parks the pod for the given delay. An event arriving while it is parked, or one that arrived
	 * while it was being processed, queues it right away instead.
	 */
	public synchronized void requeue(ReconcileRequest request, long delayMs) {
		String key = request.getKey();
		processing.remove(key);

		ReconcileRequest pending = dirty.remove(key);
		if (pending != null) {
			enqueue(merge(request.renew(), pending));
			return;
		}

		ReconcileRequest renewed = request.renew();
		parked.put(key, renewed);
		scheduler.schedule(() -> release(key, renewed), delayMs, TimeUnit.MILLISECONDS);
	}

	private synchronized void release(String key, ReconcileRequest renewed) {
		// already pulled forward by a newer event
		if (parked.get(key) != renewed) return;

		parked.remove(key);
		enqueue(renewed);
	}

	public synchronized void markComplete(ReconcileRequest request) {
		String key = request.getKey();
		processing.remove(key);

		ReconcileRequest pending = dirty.remove(key);
		if (pending != null) {
			enqueue(pending);
		}
	}

	private static ReconcileRequest merge(ReconcileRequest current, ReconcileRequest incoming) {
		if (current.getType() == RequestType.DELETE && incoming.getType() != RequestType.DELETE) {
			return current;
		}
		return incoming;
	}

	public int size() {
		return keys.size();
	}

	/**
	 * Pods that are waiting, being processed or parked.
	 */
	public synchronized int inFlightCount() {
		Set<String> all = new HashSet<>(waiting.keySet());
		all.addAll(processing);
		all.addAll(parked.keySet());
		return all.size();
	}

	public void shutdown() {
		scheduler.shutdown();
		try {
			if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
				scheduler.shutdownNow();
			}
		} catch (InterruptedException e) {
			scheduler.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}
