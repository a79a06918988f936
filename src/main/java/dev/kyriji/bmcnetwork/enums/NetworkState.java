package dev.kyriji.bmcnetwork.enums;

import com.google.gson.annotations.SerializedName;

public enum NetworkState {
	@SerializedName("NotReady")
	NOT_READY,
	@SerializedName("Ready")
	READY,
	@SerializedName("Waiting")
	WAITING
}
