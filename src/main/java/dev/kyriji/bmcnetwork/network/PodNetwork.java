package dev.kyriji.bmcnetwork.network;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.objects.NetworkConfParam;
import dev.kyriji.bmcnetwork.objects.NetworkStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;

import java.lang.reflect.Type;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the network annotations and labels of a private copy of a pod.
 */
public class PodNetwork {
	private static final Gson GSON = new Gson();
	private static final Type PARAM_LIST_TYPE = new TypeToken<List<NetworkConfParam>>() {}.getType();

	private final Pod pod;

	public PodNetwork(Pod pod) {
		this.pod = new PodBuilder(pod).build();
		if (this.pod.getMetadata().getAnnotations() == null) {
			this.pod.getMetadata().setAnnotations(new HashMap<>());
		}
		if (this.pod.getMetadata().getLabels() == null) {
			this.pod.getMetadata().setLabels(new HashMap<>());
		}
	}

	public Pod getPod() {
		return pod;
	}

	public String getName() {
		return pod.getMetadata().getName();
	}

	public String getNamespace() {
		return pod.getMetadata().getNamespace();
	}

	public String getKey() {
		return getNamespace() + "/" + getName();
	}

	public String getNetworkType() {
		return annotations().get(NetworkLabel.NETWORK_TYPE.getLabel());
	}

	public List<NetworkConfParam> getConfParams() {
		String raw = annotations().get(NetworkLabel.NETWORK_CONF.getLabel());
		if (raw == null || raw.isBlank()) return List.of();

		try {
			List<NetworkConfParam> params = GSON.fromJson(raw, PARAM_LIST_TYPE);
			return params == null ? List.of() : params;
		} catch (JsonParseException e) {
			throw PluginException.parameter("network configuration of " + getKey() + " is not valid JSON: " + e.getMessage());
		}
	}

	/**
	 * @return the stored status, or null when the pod has none or it cannot be read
	 */
	public NetworkStatus getStatus() {
		String raw = annotations().get(NetworkLabel.NETWORK_STATUS.getLabel());
		if (raw == null || raw.isBlank()) return null;

		try {
			return GSON.fromJson(raw, NetworkStatus.class);
		} catch (JsonParseException e) {
			System.err.println("Discarding unreadable network status on " + getKey() + ": " + e.getMessage());
			return null;
		}
	}

	public void setStatus(NetworkStatus status) {
		annotations().put(NetworkLabel.NETWORK_STATUS.getLabel(), GSON.toJson(status));
	}

	public boolean isDisabled() {
		return "true".equalsIgnoreCase(labels().get(NetworkLabel.NETWORK_DISABLED.getLabel()));
	}

	public String getGameServerName() {
		return labels().get(NetworkLabel.GAME_SERVER.getLabel());
	}

	/**
	 * Adds the label the backing Service selects on.
	 */
	public void ensurePodNameLabel() {
		labels().put(NetworkLabel.POD_NAME.getLabel(), getName());
	}

	private Map<String, String> annotations() {
		return pod.getMetadata().getAnnotations();
	}

	private Map<String, String> labels() {
		return pod.getMetadata().getLabels();
	}
}
