package dev.kyriji.bmcnetwork.network;

import dev.kyriji.bmcnetwork.allocation.AllocationIndex;
import dev.kyriji.bmcnetwork.allocation.PortPool;
import dev.kyriji.bmcnetwork.config.ConfigNormalizer;
import dev.kyriji.bmcnetwork.config.NetworkConfig;
import dev.kyriji.bmcnetwork.config.PluginOptions;
import dev.kyriji.bmcnetwork.crd.GameServer;
import dev.kyriji.bmcnetwork.enums.NetworkAction;
import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.enums.NetworkState;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.factories.BackingServiceFactory;
import dev.kyriji.bmcnetwork.interfaces.LoadBalancerAdapter;
import dev.kyriji.bmcnetwork.interfaces.NetworkPlugin;
import dev.kyriji.bmcnetwork.logic.NetworkLogic;
import dev.kyriji.bmcnetwork.objects.Allocation;
import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import dev.kyriji.bmcnetwork.objects.NetworkStatus;
import dev.kyriji.bmcnetwork.utils.KubeResources;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.util.List;
import java.util.Map;

/**
 * Generic network plugin: port allocation, backing Service reconciliation and status publishing, with
 * the cloud specific parts supplied by a {@link LoadBalancerAdapter}. Each instance owns its own pool
 * and index.
 */
public class LoadBalancerPlugin implements NetworkPlugin {
	private final LoadBalancerAdapter adapter;
	private final ConfigNormalizer normalizer;
	private final AllocationIndex index;
	private final NetworkLogic logic;
	private final BackingServiceFactory serviceFactory;
	private KubernetesClient client;

	public LoadBalancerPlugin(LoadBalancerAdapter adapter) {
		this.adapter = adapter;
		this.normalizer = new ConfigNormalizer(adapter.getName(), adapter.getConfigSchema());
		this.logic = new NetworkLogic();
		this.serviceFactory = new BackingServiceFactory();

		if (adapter.isPooled()) {
			PluginOptions options = adapter.getOptions();
			this.index = new AllocationIndex(new PortPool(options.getMinPort(), options.getMaxPort(), options.getBlockPorts()));
		} else {
			this.index = null;
		}
	}

	@Override
	public String getName() {
		return adapter.getName();
	}

	@Override
	public String getAlias() {
		return adapter.getAlias();
	}

	@Override
	public void init(KubernetesClient client) {
		this.client = client;
		rebuild();
		adapter.init(client);
	}

	/**
	 * Replays the allocations recorded on existing backing Services into the pool and index.
	 */
	private void rebuild() {
		if (index == null) return;

		List<Service> services = client.services().inAnyNamespace()
				.withLabel(NetworkLabel.MANAGED_BY.getLabel(), NetworkLabel.MANAGED_BY_VALUE)
				.withLabel(NetworkLabel.NETWORK_TYPE.getLabel(), adapter.getName())
				.list()
				.getItems();

		int restored = 0;
		for (Service service : services) {
			Map<String, String> annotations = service.getMetadata().getAnnotations();
			String lbId = annotations == null ? null : annotations.get(adapter.getLoadBalancerIdAnnotation());
			if (lbId == null || lbId.isEmpty()) continue;

			String memberKey = service.getMetadata().getNamespace() + "/" + service.getMetadata().getName();
			String ownerKey = annotations.getOrDefault(NetworkLabel.NETWORK_OWNER.getLabel(), memberKey);
			List<Integer> ports = NetworkAddresses.allocatedPorts(service);

			if (index.restore(new Allocation(ownerKey, memberKey, lbId, ports)).isPresent()) {
				restored++;
			}
		}

		System.out.println("[" + getName() + "] Rebuilt " + restored + " allocations from " + services.size() + " services");
	}

	@Override
	public Pod onPodAdded(Pod pod) {
		PodNetwork network = new PodNetwork(pod);
		if (network.getStatus() == null) {
			network.setStatus(NetworkStatus.initial(getName(), adapter.getInitialState()));
		}
		return network.getPod();
	}

	@Override
	public Pod onPodUpdated(Pod pod) {
		PodNetwork network = new PodNetwork(pod);

		// 1. First pass only records the initial state
		NetworkStatus status = network.getStatus();
		if (status == null) {
			network.setStatus(NetworkStatus.initial(getName(), adapter.getInitialState()));
			return network.getPod();
		}

		// 2. Parse the configuration once, mandatory keys abort the pass
		NetworkConfig config = normalizer.parse(network.getConfParams());
		network.ensurePodNameLabel();
		Pod current = network.getPod();
		String hash = config.hash();

		// 3. Decide from the live Service
		Service service = getService(network.getNamespace(), network.getName());
		NetworkAction action = logic.decide(current, service, hash, network.isDisabled(), adapter.getTrafficToggle());

		switch (action) {
			case CREATE, UPDATE, ENABLE -> {
				syncBackingResources(network, config, hash, service);
				status.transitionTo(NetworkState.NOT_READY);
			}
			case WAIT_FOR_PREVIOUS_SERVICE -> {
				System.out.println("[" + getName() + "] Waiting for the previous service of " + network.getKey() + " to be deleted");
				status.transitionTo(NetworkState.NOT_READY);
			}
			case DISABLE -> {
				updateService(adapter.getTrafficToggle().disable(service));
				System.out.println("[" + getName() + "] Disabled traffic to " + network.getKey());
				status.transitionTo(NetworkState.NOT_READY);
			}
			case KEEP_DISABLED -> status.transitionTo(NetworkState.NOT_READY);
			case CHECK_READINESS -> {
				adapter.ensureChainedResources(client, buildContext(network, config, hash, lookupAllocation(network)), service);

				List<NetworkAddress> external = adapter.resolveExternalAddresses(client, current, service);
				List<NetworkAddress> internal = NetworkAddresses.internal(current, service);
				if (external.isEmpty() || internal.isEmpty()) {
					status.transitionTo(NetworkState.NOT_READY);
				} else {
					status.publishReady(internal, external);
				}
			}
		}

		status.setNetworkType(getName());
		network.setStatus(status);
		return network.getPod();
	}

	@Override
	public void onPodDeleted(Pod pod) {
		if (index == null) return;

		// The recorded allocation decides, the annotations may have changed since it was granted
		PodNetwork network = new PodNetwork(pod);
		Allocation allocation = index.lookup(network.getKey()).orElse(null);
		if (allocation == null) return;

		// 1. Ephemeral allocations die with the pod
		String ownerKey = allocation.getOwnerKey();
		if (ownerKey.equals(allocation.getMemberKey())) {
			logRelease(ownerKey, index.release(ownerKey));
			return;
		}

		// 2. Fixed allocations die with the owning GameServer
		String gameServerName = ownerKey.substring(ownerKey.indexOf('/') + 1);
		GameServer gameServer = getGameServer(network.getNamespace(), gameServerName);
		if (gameServer != null && gameServer.getMetadata().getDeletionTimestamp() == null) {
			return;
		}

		logRelease(ownerKey, index.release(ownerKey));
	}

	private void syncBackingResources(PodNetwork network, NetworkConfig config, String hash, Service existing) {
		Allocation allocation = null;
		if (index != null) {
			String ownerKey = ownerKey(network, config);
			int count = config.getBackends().size();
			allocation = index.lookupOrAllocate(ownerKey, network.getKey(), config.getLoadBalancerIds(), count)
					.orElseThrow(() -> PluginException.insufficientPorts("insufficient ports: no load balancer in "
						+ config.getLoadBalancerIds() + " has " + count + " free ports for " + network.getKey()));
		}

		ServiceContext context = buildContext(network, config, hash, allocation);
		Service desired = serviceFactory.buildService(adapter, context);
		if (network.isDisabled()) {
			desired = adapter.getTrafficToggle().disable(desired);
		}

		if (existing == null) {
			createService(desired);
			System.out.println("[" + getName() + "] Created service " + network.getKey()
				+ (allocation != null ? " on " + allocation.getLoadBalancerId() + " ports " + allocation.getPorts() : ""));
		} else {
			updateService(serviceFactory.mergeInto(existing, desired));
			System.out.println("[" + getName() + "] Updated service " + network.getKey());
		}

		adapter.syncChainedResources(client, context);
	}

	private ServiceContext buildContext(PodNetwork network, NetworkConfig config, String hash, Allocation allocation) {
		return new ServiceContext(network.getPod(), config, allocation, hash, ownerKey(network, config), ownerReferences(network, config));
	}

	private Allocation lookupAllocation(PodNetwork network) {
		return index == null ? null : index.lookup(network.getKey()).orElse(null);
	}

	private String ownerKey(PodNetwork network, NetworkConfig config) {
		String gameServerName = network.getGameServerName();
		if (config.isFixed() && gameServerName != null) {
			return network.getNamespace() + "/" + gameServerName;
		}
		return network.getKey();
	}

	private List<OwnerReference> ownerReferences(PodNetwork network, NetworkConfig config) {
		String gameServerName = network.getGameServerName();
		if (config.isFixed() && gameServerName != null) {
			GameServer gameServer = getGameServer(network.getNamespace(), gameServerName);
			if (gameServer != null) {
				return List.of(BackingServiceFactory.buildOwnerReference(gameServer));
			}
		}
		return List.of(BackingServiceFactory.buildOwnerReference(network.getPod()));
	}

	private Service getService(String namespace, String name) {
		try {
			return client.services().inNamespace(namespace).withName(name).get();
		} catch (KubernetesClientException e) {
			throw PluginException.apiCall("failed to get service " + namespace + "/" + name, e);
		}
	}

	private GameServer getGameServer(String namespace, String name) {
		try {
			return client.resources(GameServer.class).inNamespace(namespace).withName(name).get();
		} catch (KubernetesClientException e) {
			if (KubeResources.isNotFound(e)) return null;
			throw PluginException.apiCall("failed to get game server " + namespace + "/" + name, e);
		}
	}

	private void createService(Service service) {
		try {
			client.services().resource(service).create();
		} catch (KubernetesClientException e) {
			throw PluginException.apiCall("failed to create " + KubeResources.describe(service), e);
		}
	}

	private void updateService(Service service) {
		try {
			client.services().resource(service).update();
		} catch (KubernetesClientException e) {
			throw PluginException.apiCall("failed to update " + KubeResources.describe(service), e);
		}
	}

	private void logRelease(String ownerKey, List<Allocation> released) {
		for (Allocation allocation : released) {
			System.out.println("[" + getName() + "] Released " + allocation.getLoadBalancerId() + " ports "
				+ allocation.getPorts() + " of " + allocation.getMemberKey() + " (owner " + ownerKey + ")");
		}
	}

	public AllocationIndex getIndex() {
		return index;
	}
}
