package dev.kyriji.bmcnetwork.objects;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class NetworkAddress {
	private String ip;
	private String endPoint;
	private List<NetworkPort> ports = new ArrayList<>();

	public NetworkAddress() {
	}

	public static NetworkAddress ofIp(String ip, List<NetworkPort> ports) {
		NetworkAddress address = new NetworkAddress();
		address.ip = ip;
		address.ports = new ArrayList<>(ports);
		return address;
	}

	public static NetworkAddress ofEndpoint(String endPoint, List<NetworkPort> ports) {
		NetworkAddress address = new NetworkAddress();
		address.endPoint = endPoint;
		address.ports = new ArrayList<>(ports);
		return address;
	}

	public String getIp() {
		return ip;
	}

	public String getEndPoint() {
		return endPoint;
	}

	public List<NetworkPort> getPorts() {
		return ports;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof NetworkAddress that)) return false;
		return Objects.equals(ip, that.ip) && Objects.equals(endPoint, that.endPoint) && Objects.equals(ports, that.ports);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ip, endPoint, ports);
	}
}
