package dev.kyriji.bmcnetwork.controllers;

import dev.kyriji.bmcnetwork.enums.NetworkLabel;
import dev.kyriji.bmcnetwork.interfaces.NetworkPlugin;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the enabled network plugins, looked up by name or alias.
 */
public class ProviderManager {
	private final Map<String, NetworkPlugin> plugins = new ConcurrentHashMap<>();
	private final List<NetworkPlugin> registered = Collections.synchronizedList(new ArrayList<>());

	public void register(NetworkPlugin plugin) {
		String alias = plugin.getAlias();
		boolean hasAlias = alias != null && !alias.isEmpty();
		if (plugins.containsKey(plugin.getName()) || (hasAlias && plugins.containsKey(alias))) {
			throw new IllegalStateException("Network plugin " + plugin.getName() + " is already registered");
		}

		plugins.put(plugin.getName(), plugin);
		if (hasAlias) {
			plugins.put(alias, plugin);
		}
		registered.add(plugin);
		System.out.println("Registered network plugin " + plugin.getName() + " (alias " + alias + ")");
	}

	public NetworkPlugin getPlugin(String nameOrAlias) {
		if (nameOrAlias == null) return null;
		return plugins.get(nameOrAlias);
	}

	/**
	 * @return the plugin named by the pod's network-type annotation, or null when there is none
	 */
	public NetworkPlugin findPlugin(Pod pod) {
		Map<String, String> annotations = pod.getMetadata().getAnnotations();
		if (annotations == null) return null;
		return getPlugin(annotations.get(NetworkLabel.NETWORK_TYPE.getLabel()));
	}

	/**
	 * Initializes every plugin. A plugin that fails to initialize is unregistered so its pods are left alone.
	 */
	public void initAll(KubernetesClient client) {
		for (NetworkPlugin plugin : List.copyOf(registered)) {
			try {
				plugin.init(client);
				System.out.println("Initialized network plugin " + plugin.getName());
			} catch (RuntimeException e) {
				System.err.println("Failed to initialize network plugin " + plugin.getName() + ": " + e.getMessage());
				e.printStackTrace();
				unregister(plugin);
			}
		}
	}

	private void unregister(NetworkPlugin plugin) {
		plugins.values().removeIf(existing -> existing == plugin);
		registered.remove(plugin);
	}

	public List<NetworkPlugin> getPlugins() {
		return List.copyOf(registered);
	}
}
