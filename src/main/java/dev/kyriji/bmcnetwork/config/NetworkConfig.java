package dev.kyriji.bmcnetwork.config;

import com.google.gson.Gson;
import dev.kyriji.bmcnetwork.objects.Backend;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.CRC32;

public class NetworkConfig {
	private static final Gson GSON = new Gson();

	private final List<String> loadBalancerIds;
	private final List<Backend> backends;
	private final boolean fixed;
	private final Map<String, String> annotations;
	private final Map<String, String> healthCheck;
	private final Map<String, String> options;
	private final Map<String, String> passthrough;

	public NetworkConfig(List<String> loadBalancerIds, List<Backend> backends, boolean fixed,
						 Map<String, String> annotations, Map<String, String> healthCheck,
						 Map<String, String> options, Map<String, String> passthrough) {
		this.loadBalancerIds = List.copyOf(loadBalancerIds);
		this.backends = List.copyOf(backends);
		this.fixed = fixed;
		this.annotations = Collections.unmodifiableMap(new TreeMap<>(annotations));
		this.healthCheck = Collections.unmodifiableMap(new TreeMap<>(healthCheck));
		this.options = Collections.unmodifiableMap(new TreeMap<>(options));
		this.passthrough = Collections.unmodifiableMap(new TreeMap<>(passthrough));
	}

	/**
	 * Digest of the canonical form. Map entries are sorted, so the order the parameters arrived in does
	 * not change the result; list order (candidate load balancers, backends) is significant.
	 */
	public String hash() {
		Map<String, Object> canonical = new TreeMap<>();
		canonical.put("loadBalancerIds", loadBalancerIds);
		List<String> backendStrings = new ArrayList<>();
		for (Backend backend : backends) {
			backendStrings.add(backend.toString());
		}
		canonical.put("backends", backendStrings);
		canonical.put("fixed", fixed);
		canonical.put("annotations", annotations);
		canonical.put("healthCheck", healthCheck);
		canonical.put("options", options);
		canonical.put("passthrough", passthrough);

		CRC32 checksum = new CRC32();
		checksum.update(GSON.toJson(canonical).getBytes(StandardCharsets.UTF_8));
		return Long.toHexString(checksum.getValue());
	}

	public List<String> getLoadBalancerIds() {
		return loadBalancerIds;
	}

	public List<Backend> getBackends() {
		return backends;
	}

	public boolean isFixed() {
		return fixed;
	}

	public Map<String, String> getAnnotations() {
		return annotations;
	}

	public Map<String, String> getHealthCheck() {
		return healthCheck;
	}

	public Map<String, String> getOptions() {
		return options;
	}

	public String getOption(String key) {
		return options.get(key);
	}

	public String getOption(String key, String defaultValue) {
		return options.getOrDefault(key, defaultValue);
	}

	public Map<String, String> getPassthrough() {
		return passthrough;
	}

	@Override
	public String toString() {
		return "NetworkConfig{" +
			   "loadBalancerIds=" + loadBalancerIds +
			   ", backends=" + backends +
			   ", fixed=" + fixed +
			   ", options=" + options +
			   '}';
	}
}
