package dev.kyriji.bmcnetwork.network;

import com.google.gson.Gson;
import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.objects.NetworkConfParam;
import dev.kyriji.bmcnetwork.objects.NetworkStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;

import java.util.List;

/**
 * Pod fixtures carrying network annotations.
 */
public class TestPods {
	private static final Gson GSON = new Gson();

	private TestPods() {
	}

	public static Pod pod(String namespace, String name, String networkType, NetworkConfParam... conf) {
		return new PodBuilder()
				.withNewMetadata()
					.withName(name)
					.withNamespace(namespace)
					.withUid(name + "-uid")
					.addToAnnotations(NetworkLabel.NETWORK_TYPE.getLabel(), networkType)
					.addToAnnotations(NetworkLabel.NETWORK_CONF.getLabel(), GSON.toJson(List.of(conf)))
				.endMetadata()
				.withNewSpec()
					.withNodeName("node-1")
				.endSpec()
				.withNewStatus()
					.withPodIP("10.0.0.7")
				.endStatus()
				.build();
	}

	public static Pod withConf(Pod pod, NetworkConfParam... conf) {
		return new PodBuilder(pod)
				.editMetadata()
					.addToAnnotations(NetworkLabel.NETWORK_CONF.getLabel(), GSON.toJson(List.of(conf)))
				.endMetadata()
				.build();
	}

	public static Pod withLabel(Pod pod, String key, String value) {
		return new PodBuilder(pod)
				.editMetadata()
					.addToLabels(key, value)
				.endMetadata()
				.build();
	}

	public static Pod withoutLabel(Pod pod, String key) {
		return new PodBuilder(pod)
				.editMetadata()
					.removeFromLabels(key)
				.endMetadata()
				.build();
	}

	public static NetworkStatus status(Pod pod) {
		return new PodNetwork(pod).getStatus();
	}

	public static NetworkConfParam param(String name, String value) {
		return new NetworkConfParam(name, value);
	}
}
