package dev.kyriji.bmcnetwork.objects;

import dev.kyriji.bmcnetwork.enums.RequestType;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.Objects;

public class ReconcileRequest {
	private final String namespace;
	private final String name;
	private final RequestType type;
	// last known state, only set for deletions since the pod can no longer be fetched
	private final Pod finalState;
	private final long timestamp;

	public ReconcileRequest(String namespace, String name, RequestType type, Pod finalState) {
		this.namespace = namespace;
		this.name = name;
		this.type = type;
		this.finalState = finalState;
		this.timestamp = System.currentTimeMillis();
	}

	public static ReconcileRequest forPod(Pod pod) {
		return new ReconcileRequest(
			pod.getMetadata().getNamespace(),
			pod.getMetadata().getName(),
			RequestType.SYNC,
			null
		);
	}

	public static ReconcileRequest forDeletedPod(Pod pod) {
		return new ReconcileRequest(
			pod.getMetadata().getNamespace(),
			pod.getMetadata().getName(),
			RequestType.DELETE,
			pod
		);
	}

	public ReconcileRequest renew() {
		return new ReconcileRequest(namespace, name, type, finalState);
	}

	public String getNamespace() {
		return namespace;
	}

	public String getName() {
		return name;
	}

	public String getKey() {
		return namespace + "/" + name;
	}

	public RequestType getType() {
		return type;
	}

	public Pod getFinalState() {
		return finalState;
	}

	public long getTimestamp() {
		return timestamp;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ReconcileRequest that)) return false;
		return Objects.equals(namespace, that.namespace) &&
			   Objects.equals(name, that.name) &&
			   type == that.type;
	}

	@Override
	public int hashCode() {
		return Objects.hash(namespace, name, type);
	}

	@Override
	public String toString() {
		return "ReconcileRequest{" +
			   "namespace='" + namespace + '\'' +
			   ", name='" + name + '\'' +
			   ", type=" + type +
			   '}';
	}
}
