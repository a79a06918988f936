package dev.kyriji.bmcnetwork.interfaces;

import dev.kyriji.bmcnetwork.config.NetworkConfigSchema;
import dev.kyriji.bmcnetwork.config.PluginOptions;
import dev.kyriji.bmcnetwork.enums.NetworkState;
import dev.kyriji.bmcnetwork.network.ServiceContext;
import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.List;
import java.util.Map;

/**
 * Cloud specific parameters of the generic load balancer engine.
 */
public interface LoadBalancerAdapter {

	String getName();

	String getAlias();

	NetworkConfigSchema getConfigSchema();

	PluginOptions getOptions();

	/**
	 * Whether Service ports are drawn from the port pool. Unpooled adapters expose the target ports.
	 */
	default boolean isPooled() {
		return true;
	}

	String getServiceType();

	TrafficToggle getTrafficToggle();

	/**
	 * Annotation recording the load balancer id on the backing Service. Rebuild reads it back.
	 */
	String getLoadBalancerIdAnnotation();

	default NetworkState getInitialState() {
		return NetworkState.NOT_READY;
	}

	default Map<String, String> getServiceAnnotations(ServiceContext context) {
		return Map.of();
	}

	default void customizeService(ServiceBuilder builder, ServiceContext context) {
	}

	default void init(KubernetesClient client) {
	}

	/**
	 * Creates or updates the resources chained behind the Service. Runs after every Service write.
	 */
	default void syncChainedResources(KubernetesClient client, ServiceContext context) {
	}

	/**
	 * Repairs chained resources that went missing. Runs on passes that do not write the Service and must
	 * not write anything when the chain is intact.
	 */
	default void ensureChainedResources(KubernetesClient client, ServiceContext context, Service service) {
	}

	/**
	 * @return the external addresses, or an empty list while the load balancer has not reported any
	 */
	List<NetworkAddress> resolveExternalAddresses(KubernetesClient client, Pod pod, Service service);
}
