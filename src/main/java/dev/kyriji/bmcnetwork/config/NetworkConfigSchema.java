package dev.kyriji.bmcnetwork.config;

import dev.kyriji.bmcnetwork.enums.PortProtocol;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Parameter table of one network plugin: which keys it understands, how their values are typed and
 * which of them must be present.
 */
public class NetworkConfigSchema {
	public static final String PORT_PROTOCOLS = "PortProtocols";
	public static final String FIXED = "Fixed";
	public static final String ANNOTATIONS = "Annotations";

	private final String loadBalancerIdsKey;
	private final String healthCheckKey;
	private final Set<String> mandatoryKeys;
	private final Map<String, OptionType> optionKeys;
	private final Set<PortProtocol> allowedProtocols;

	private NetworkConfigSchema(Builder builder) {
		this.loadBalancerIdsKey = builder.loadBalancerIdsKey;
		this.healthCheckKey = builder.healthCheckKey;
		this.mandatoryKeys = Collections.unmodifiableSet(new LinkedHashSet<>(builder.mandatoryKeys));
		this.optionKeys = Collections.unmodifiableMap(new LinkedHashMap<>(builder.optionKeys));
		this.allowedProtocols = Collections.unmodifiableSet(EnumSet.copyOf(builder.allowedProtocols));
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isKnown(String key) {
		return key.equals(PORT_PROTOCOLS) || key.equals(FIXED) || key.equals(ANNOTATIONS)
			|| key.equals(loadBalancerIdsKey) || key.equals(healthCheckKey) || optionKeys.containsKey(key);
	}

	public String getLoadBalancerIdsKey() {
		return loadBalancerIdsKey;
	}

	public String getHealthCheckKey() {
		return healthCheckKey;
	}

	public Set<String> getMandatoryKeys() {
		return mandatoryKeys;
	}

	public Map<String, OptionType> getOptionKeys() {
		return optionKeys;
	}

	public Set<PortProtocol> getAllowedProtocols() {
		return allowedProtocols;
	}

	public static class Builder {
		private String loadBalancerIdsKey;
		private String healthCheckKey;
		private final Set<String> mandatoryKeys = new LinkedHashSet<>();
		private final Map<String, OptionType> optionKeys = new LinkedHashMap<>();
		private Set<PortProtocol> allowedProtocols = EnumSet.of(PortProtocol.TCP, PortProtocol.UDP);

		public Builder loadBalancerIds(String key) {
			this.loadBalancerIdsKey = key;
			this.mandatoryKeys.add(key);
			return this;
		}

		public Builder healthCheck(String key) {
			this.healthCheckKey = key;
			return this;
		}

		public Builder option(String key, OptionType type) {
			this.optionKeys.put(key, type);
			return this;
		}

		public Builder mandatoryOption(String key, OptionType type) {
			this.optionKeys.put(key, type);
			this.mandatoryKeys.add(key);
			return this;
		}

		public Builder requirePortProtocols() {
			this.mandatoryKeys.add(PORT_PROTOCOLS);
			return this;
		}

		public Builder protocols(PortProtocol first, PortProtocol... rest) {
			this.allowedProtocols = EnumSet.of(first, rest);
			return this;
		}

		public NetworkConfigSchema build() {
			return new NetworkConfigSchema(this);
		}
	}
}
