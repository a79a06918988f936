package dev.kyriji.bmcnetwork.providers.tencent;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import dev.kyriji.bmcnetwork.config.ConfigNormalizer;
import dev.kyriji.bmcnetwork.config.NetworkConfig;
import dev.kyriji.bmcnetwork.config.NetworkConfigSchema;
import dev.kyriji.bmcnetwork.enums.NetworkState;
import dev.kyriji.bmcnetwork.enums.PluginErrorType;
import dev.kyriji.bmcnetwork.enums.PortProtocol;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.interfaces.NetworkPlugin;
import dev.kyriji.bmcnetwork.network.PodNetwork;
import dev.kyriji.bmcnetwork.objects.Backend;
import dev.kyriji.bmcnetwork.objects.NetworkAddress;
import dev.kyriji.bmcnetwork.objects.NetworkPort;
import dev.kyriji.bmcnetwork.objects.NetworkStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tencent Cloud CLB. The port mapping is requested through pod annotations and fulfilled out of band by
 * the Tencent cloud controller, which reports the result back on the pod.
 */
public class TencentClbPlugin implements NetworkPlugin {
	public static final String NAME = "TencentCloud-CLB";
	public static final String ALIAS = "Tencent-CLB";
	public static final String OPTIONS_PREFIX = "TENCENT_CLB";

	public static final String PORT_MAPPING = "networking.cloud.tencent.com/clb-port-mapping";
	public static final String ENABLE_PORT_MAPPING = "networking.cloud.tencent.com/enable-clb-port-mapping";
	public static final String PORT_MAPPING_RESULT = "networking.cloud.tencent.com/clb-port-mapping-result";
	public static final String PORT_MAPPING_STATUS = "networking.cloud.tencent.com/clb-port-mapping-status";

	private static final Gson GSON = new Gson();
	private static final Type MAPPING_LIST_TYPE = new TypeToken<List<PortMapping>>() {}.getType();

	private final ConfigNormalizer normalizer;

	public TencentClbPlugin() {
		this.normalizer = new ConfigNormalizer(NAME, NetworkConfigSchema.builder()
				.requirePortProtocols()
				.protocols(PortProtocol.TCP, PortProtocol.UDP)
				.build());
	}

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public String getAlias() {
		return ALIAS;
	}

	@Override
	public void init(KubernetesClient client) {
		System.out.println("[" + NAME + "] Initialized");
	}

	@Override
	public Pod onPodAdded(Pod pod) {
		return reconcile(pod);
	}

	@Override
	public Pod onPodUpdated(Pod pod) {
		if (pod.getMetadata().getDeletionTimestamp() != null) return pod;
		return reconcile(pod);
	}

	@Override
	public void onPodDeleted(Pod pod) {
		// the cloud controller removes the mapping together with the pod
	}

	private Pod reconcile(Pod pod) {
		PodNetwork network = new PodNetwork(pod);

		NetworkStatus status = network.getStatus();
		if (status == null) {
			network.setStatus(NetworkStatus.initial(NAME, NetworkState.WAITING));
			return network.getPod();
		}

		NetworkConfig config = normalizer.parse(network.getConfParams());
		Map<String, String> annotations = network.getPod().getMetadata().getAnnotations();
		annotations.put(PORT_MAPPING, portMapping(config, poolName(network)));
		annotations.put(ENABLE_PORT_MAPPING, Boolean.toString(!network.isDisabled()));

		if (!"Ready".equals(annotations.get(PORT_MAPPING_STATUS))) {
			return network.getPod();
		}

		String result = annotations.get(PORT_MAPPING_RESULT);
		if (result == null || result.isEmpty()) return network.getPod();

		List<PortMapping> mappings;
		try {
			mappings = GSON.fromJson(result, MAPPING_LIST_TYPE);
		} catch (JsonParseException e) {
			throw new PluginException(PluginErrorType.INTERNAL, "unreadable port mapping result on " + network.getKey(), e);
		}
		if (mappings == null || mappings.isEmpty()) return network.getPod();

		String podIp = pod.getStatus() == null ? null : pod.getStatus().getPodIP();
		List<NetworkAddress> internal = new ArrayList<>();
		List<NetworkAddress> external = new ArrayList<>();
		for (PortMapping mapping : mappings) {
			String[] address = mapping.address == null ? new String[0] : mapping.address.split(":");
			if (address.length != 2) continue;

			int lbPort;
			try {
				lbPort = Integer.parseInt(address[1]);
			} catch (NumberFormatException e) {
				System.out.println("[" + NAME + "] Warning: skipping mapping with invalid address " + mapping.address);
				continue;
			}

			String portName = Integer.toString(mapping.port);
			internal.add(NetworkAddress.ofIp(podIp, List.of(new NetworkPort(portName, mapping.protocol, mapping.port))));
			external.add(NetworkAddress.ofIp(address[0], List.of(new NetworkPort(portName, mapping.protocol, lbPort))));
		}

		if (!external.isEmpty()) {
			status.publishReady(internal, external);
			status.setNetworkType(NAME);
			network.setStatus(status);
		}
		return network.getPod();
	}

	/**
	 * Mapped ports are pooled per owning game server, falling back to the pod itself.
	 */
	private String poolName(PodNetwork network) {
		String gameServerName = network.getGameServerName();
		return network.getNamespace() + "-" + (gameServerName != null ? gameServerName : network.getName());
	}

	static String portMapping(NetworkConfig config, String poolName) {
		StringBuilder builder = new StringBuilder();
		for (Backend backend : config.getBackends()) {
			builder.append(backend.getTargetPort()).append(' ')
					.append(backend.getProtocol().name()).append(' ')
					.append(poolName).append('\n');
		}
		return builder.toString();
	}

	static class PortMapping {
		int port;
		String protocol;
		String address;
	}
}
