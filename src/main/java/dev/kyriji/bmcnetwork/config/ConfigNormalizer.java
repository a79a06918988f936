package dev.kyriji.bmcnetwork.config;

import dev.kyriji.bmcnetwork.enums.PortProtocol;
import dev.kyriji.bmcnetwork.exceptions.PluginException;
import dev.kyriji.bmcnetwork.objects.Backend;
import dev.kyriji.bmcnetwork.objects.NetworkConfParam;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class ConfigNormalizer {
	private final String pluginName;
	private final NetworkConfigSchema schema;

	public ConfigNormalizer(String pluginName, NetworkConfigSchema schema) {
		this.pluginName = pluginName;
		this.schema = schema;
	}

	public NetworkConfig parse(List<NetworkConfParam> params) {
		// last value wins when a key is repeated
		Map<String, String> raw = new LinkedHashMap<>();
		if (params != null) {
			for (NetworkConfParam param : params) {
				if (param == null || param.getName() == null) continue;
				raw.put(param.getName(), param.getValue() == null ? "" : param.getValue());
			}
		}

		List<String> loadBalancerIds = new ArrayList<>();
		List<Backend> backends = new ArrayList<>();
		boolean fixed = false;
		Map<String, String> annotations = new TreeMap<>();
		Map<String, String> healthCheck = new TreeMap<>();
		Map<String, String> options = new TreeMap<>();
		Map<String, String> passthrough = new TreeMap<>();

		for (Map.Entry<String, String> entry : raw.entrySet()) {
			String key = entry.getKey();
			String value = entry.getValue();

			if (key.equals(schema.getLoadBalancerIdsKey())) {
				loadBalancerIds.addAll(splitList(value));
			} else if (key.equals(NetworkConfigSchema.PORT_PROTOCOLS)) {
				backends.addAll(parseBackends(value));
			} else if (key.equals(NetworkConfigSchema.FIXED)) {
				String normalized = OptionType.BOOLEAN.normalize(value);
				if (normalized == null) {
					warn("invalid " + key + " value '" + value + "', keeping false");
				} else {
					fixed = Boolean.parseBoolean(normalized);
				}
			} else if (key.equals(NetworkConfigSchema.ANNOTATIONS)) {
				annotations.putAll(parsePairs(key, value));
			} else if (key.equals(schema.getHealthCheckKey())) {
				healthCheck.putAll(parsePairs(key, value));
			} else if (schema.getOptionKeys().containsKey(key)) {
				String normalized = schema.getOptionKeys().get(key).normalize(value);
				if (normalized == null) {
					warn("invalid " + key + " value '" + value + "', ignoring it");
				} else {
					options.put(key, normalized);
				}
			} else {
				passthrough.put(key, value);
			}
		}

		for (String mandatory : schema.getMandatoryKeys()) {
			boolean present;
			if (mandatory.equals(schema.getLoadBalancerIdsKey())) {
				present = !loadBalancerIds.isEmpty();
			} else if (mandatory.equals(NetworkConfigSchema.PORT_PROTOCOLS)) {
				present = !backends.isEmpty();
			} else {
				present = options.containsKey(mandatory);
			}

			if (!present) {
				throw PluginException.parameter("missing or invalid " + mandatory + " config");
			}
		}

		return new NetworkConfig(loadBalancerIds, backends, fixed, annotations, healthCheck, options, passthrough);
	}

	private List<Backend> parseBackends(String value) {
		List<Backend> backends = new ArrayList<>();
		for (String entry : splitList(value)) {
			String[] parts = entry.split("/");
			int port;
			try {
				port = Integer.parseInt(parts[0].trim());
			} catch (NumberFormatException e) {
				warn("invalid port in " + NetworkConfigSchema.PORT_PROTOCOLS + " entry '" + entry + "', skipping");
				continue;
			}
			if (port <= 0 || port > 65535) {
				warn("port out of range in " + NetworkConfigSchema.PORT_PROTOCOLS + " entry '" + entry + "', skipping");
				continue;
			}

			PortProtocol protocol = parts.length > 1 ? PortProtocol.fromString(parts[1]) : PortProtocol.TCP;
			if (protocol == null || !schema.getAllowedProtocols().contains(protocol)) {
				warn("unsupported protocol in " + NetworkConfigSchema.PORT_PROTOCOLS + " entry '" + entry + "', skipping");
				continue;
			}
			backends.add(new Backend(port, protocol));
		}
		return backends;
	}

	private Map<String, String> parsePairs(String key, String value) {
		Map<String, String> pairs = new TreeMap<>();
		for (String entry : splitList(value)) {
			int separator = entry.indexOf(':');
			if (separator <= 0) {
				warn(key + " entry '" + entry + "' is not a key:value pair, skipping");
				continue;
			}
			pairs.put(entry.substring(0, separator).trim(), entry.substring(separator + 1).trim());
		}
		return pairs;
	}

	private static List<String> splitList(String value) {
		List<String> items = new ArrayList<>();
		if (value == null) return items;
		for (String item : value.split(",")) {
			String trimmed = item.trim();
			if (!trimmed.isEmpty()) items.add(trimmed);
		}
		return items;
	}

	private void warn(String message) {
		System.out.println("[" + pluginName + "] Warning: " + message);
	}
}
