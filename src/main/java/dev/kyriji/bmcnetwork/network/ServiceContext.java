package dev.kyriji.bmcnetwork.network;

import dev.kyriji.bmcnetwork.config.NetworkConfig;
import dev.kyriji.bmcnetwork.objects.Allocation;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.List;

/**
 * Everything needed to build one pod's backing objects.
 */
public class ServiceContext {
	private final Pod pod;
	private final NetworkConfig config;
	private final Allocation allocation;
	private final String configHash;
	private final String ownerKey;
	private final List<OwnerReference> ownerReferences;

	public ServiceContext(Pod pod, NetworkConfig config, Allocation allocation, String configHash,
						  String ownerKey, List<OwnerReference> ownerReferences) {
		this.pod = pod;
		this.config = config;
		this.allocation = allocation;
		this.configHash = configHash;
		this.ownerKey = ownerKey;
		this.ownerReferences = List.copyOf(ownerReferences);
	}

	public Pod getPod() {
		return pod;
	}

	public String getPodName() {
		return pod.getMetadata().getName();
	}

	public String getNamespace() {
		return pod.getMetadata().getNamespace();
	}

	public NetworkConfig getConfig() {
		return config;
	}

	/**
	 * @return the port allocation, or null for adapters that do not use the pool
	 */
	public Allocation getAllocation() {
		return allocation;
	}

	public String getConfigHash() {
		return configHash;
	}

	public String getOwnerKey() {
		return ownerKey;
	}

	public List<OwnerReference> getOwnerReferences() {
		return ownerReferences;
	}
}
