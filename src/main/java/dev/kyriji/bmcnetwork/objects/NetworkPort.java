package dev.kyriji.bmcnetwork.objects;

import java.util.Objects;

public class NetworkPort {
	private String name;
	private String protocol;
	private int port;

	public NetworkPort() {
	}

	public NetworkPort(String name, String protocol, int port) {
		this.name = name;
		this.protocol = protocol;
		this.port = port;
	}

	public String getName() {
		return name;
	}

	public String getProtocol() {
		return protocol;
	}

	public int getPort() {
		return port;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof NetworkPort that)) return false;
		return port == that.port && Objects.equals(name, that.name) && Objects.equals(protocol, that.protocol);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, protocol, port);
	}
}
