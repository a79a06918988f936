package dev.kyriji.bmcnetwork.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Start-up options of one network plugin, read from environment variables named
 * {@code <PREFIX>_ENABLED}, {@code <PREFIX>_MIN_PORT}, {@code <PREFIX>_MAX_PORT} and
 * {@code <PREFIX>_BLOCK_PORTS}.
 */
public class PluginOptions {
	private final String prefix;
	private final boolean enabled;
	private final int minPort;
	private final int maxPort;
	private final List<Integer> blockPorts;
	private final Map<String, String> env;

	public PluginOptions(String prefix, boolean enabled, int minPort, int maxPort, List<Integer> blockPorts, Map<String, String> env) {
		this.prefix = prefix;
		this.enabled = enabled;
		this.minPort = minPort;
		this.maxPort = maxPort;
		this.blockPorts = Collections.unmodifiableList(new ArrayList<>(blockPorts));
		this.env = env;
	}

	public static PluginOptions fromEnv(Map<String, String> env, String prefix, boolean enabledByDefault, int defaultMinPort, int defaultMaxPort) {
		boolean enabled = Boolean.parseBoolean(env.getOrDefault(prefix + "_ENABLED", Boolean.toString(enabledByDefault)));
		int minPort = parseInt(env, prefix + "_MIN_PORT", defaultMinPort);
		int maxPort = parseInt(env, prefix + "_MAX_PORT", defaultMaxPort);

		List<Integer> blockPorts = new ArrayList<>();
		String blockStr = env.getOrDefault(prefix + "_BLOCK_PORTS", "");
		for (String item : blockStr.split(",")) {
			if (item.isBlank()) continue;
			try {
				blockPorts.add(Integer.parseInt(item.trim()));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException(prefix + "_BLOCK_PORTS contains an invalid port: " + item, e);
			}
		}

		return new PluginOptions(prefix, enabled, minPort, maxPort, blockPorts, env);
	}

	private static int parseInt(Map<String, String> env, String key, int defaultValue) {
		String value = env.get(key);
		if (value == null || value.isBlank()) return defaultValue;
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(key + " is not a valid integer: " + value, e);
		}
	}

	/**
	 * @param maxAllocatablePorts largest number of usable ports (range minus blocked ports) the cloud accepts
	 * @param blockedStrictlyInside whether blocked ports must lie strictly between the bounds
	 */
	public void validate(int maxAllocatablePorts, boolean blockedStrictlyInside) {
		if (minPort <= 0) {
			throw new IllegalArgumentException(prefix + " min port must be greater than 0, got " + minPort);
		}
		if (maxPort > 65535) {
			throw new IllegalArgumentException(prefix + " max port must not exceed 65535, got " + maxPort);
		}
		if (minPort > maxPort) {
			throw new IllegalArgumentException(prefix + " min port " + minPort + " is greater than max port " + maxPort);
		}

		for (int port : blockPorts) {
			boolean inside = blockedStrictlyInside ? port > minPort && port < maxPort : port >= minPort && port <= maxPort;
			if (!inside) {
				throw new IllegalArgumentException(prefix + " blocked port " + port + " is outside of [" + minPort + ", " + maxPort + "]");
			}
		}

		int usable = maxPort - minPort + 1 - (int) blockPorts.stream().distinct().count();
		if (usable > maxAllocatablePorts) {
			throw new IllegalArgumentException(prefix + " port range allows " + usable + " ports, the limit is " + maxAllocatablePorts);
		}
	}

	public String get(String suffix, String defaultValue) {
		return env.getOrDefault(prefix + "_" + suffix, defaultValue);
	}

	public String getPrefix() {
		return prefix;
	}

	public boolean isEnabled() {
		return enabled;
	}

	public int getMinPort() {
		return minPort;
	}

	public int getMaxPort() {
		return maxPort;
	}

	public List<Integer> getBlockPorts() {
		return blockPorts;
	}
}
