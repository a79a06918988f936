package dev.kyriji.bmcnetwork.objects;

import dev.kyriji.bmcnetwork.enums.NetworkState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Network status published on the pod's network-status annotation. Only the network plugins write it.
 */
public class NetworkStatus {
	private String networkType;
	private NetworkState currentNetworkState;
	private NetworkState desiredNetworkState;
	private List<NetworkAddress> internalAddresses = new ArrayList<>();
	private List<NetworkAddress> externalAddresses = new ArrayList<>();
	private String createTime;
	private String lastTransitionTime;

	public NetworkStatus() {
	}

	public static NetworkStatus initial(String networkType, NetworkState state) {
		NetworkStatus status = new NetworkStatus();
		String now = Instant.now().toString();
		status.networkType = networkType;
		status.currentNetworkState = state;
		status.desiredNetworkState = NetworkState.READY;
		status.createTime = now;
		status.lastTransitionTime = now;
		return status;
	}

	/**
	 * Moves to the given state, touching the transition time only when the state actually changes.
	 */
	public void transitionTo(NetworkState state) {
		if (currentNetworkState != state) {
			currentNetworkState = state;
			lastTransitionTime = Instant.now().toString();
		}
		if (state != NetworkState.READY) {
			internalAddresses = new ArrayList<>();
			externalAddresses = new ArrayList<>();
		}
	}

	public void publishReady(List<NetworkAddress> internal, List<NetworkAddress> external) {
		transitionTo(NetworkState.READY);
		internalAddresses = new ArrayList<>(internal);
		externalAddresses = new ArrayList<>(external);
	}

	public String getNetworkType() {
		return networkType;
	}

	public void setNetworkType(String networkType) {
		this.networkType = networkType;
	}

	public NetworkState getCurrentNetworkState() {
		return currentNetworkState;
	}

	public NetworkState getDesiredNetworkState() {
		return desiredNetworkState;
	}

	public List<NetworkAddress> getInternalAddresses() {
		return internalAddresses;
	}

	public List<NetworkAddress> getExternalAddresses() {
		return externalAddresses;
	}

	public String getCreateTime() {
		return createTime;
	}

	public String getLastTransitionTime() {
		return lastTransitionTime;
	}
}
