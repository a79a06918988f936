package dev.kyriji.bmcnetwork.crd;

import dev.kyriji.bmcnetwork.objects.NetworkConfParam;

import java.util.List;

public class GameServerSpec {
	private NetworkSpec network;

	public NetworkSpec getNetwork() {
		return network;
	}

	public void setNetwork(NetworkSpec network) {
		this.network = network;
	}

	/**
	 * Network settings copied onto every pod of the game server.
	 */
	public static class NetworkSpec {
		private String networkType;
		private List<NetworkConfParam> networkConf;

		public String getNetworkType() {
			return networkType;
		}

		public void setNetworkType(String networkType) {
			this.networkType = networkType;
		}

		public List<NetworkConfParam> getNetworkConf() {
			return networkConf;
		}

		public void setNetworkConf(List<NetworkConfParam> networkConf) {
			this.networkConf = networkConf;
		}
	}
}
