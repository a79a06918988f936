package dev.kyriji.bmcnetwork.utils;

import dev.kyriji.bmcnetwork.exceptions.PluginException;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.net.HttpURLConnection;

public class KubeResources {

	private KubeResources() {
	}

	/**
	 * Creates the resource, or replaces the live one while keeping its resource version.
	 */
	public static <T extends HasMetadata> T createOrUpdate(KubernetesClient client, T desired) {
		try {
			T existing = client.resource(desired).get();
			if (existing == null) {
				return client.resource(desired).create();
			}

			desired.getMetadata().setResourceVersion(existing.getMetadata().getResourceVersion());
			return client.resource(desired).update();
		} catch (KubernetesClientException e) {
			throw PluginException.apiCall("failed to apply " + describe(desired) + ": " + e.getMessage(), e);
		}
	}

	public static boolean isNotFound(KubernetesClientException e) {
		return e.getCode() == HttpURLConnection.HTTP_NOT_FOUND;
	}

	public static String describe(HasMetadata resource) {
		return resource.getKind() + " " + resource.getMetadata().getNamespace() + "/" + resource.getMetadata().getName();
	}
}
