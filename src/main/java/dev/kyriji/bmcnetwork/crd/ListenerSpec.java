package dev.kyriji.bmcnetwork.crd;

import java.util.List;

public class ListenerSpec {
	private String loadBalancerARN;
	private Long port;
	private String protocol;
	private List<Action> defaultActions;

	public String getLoadBalancerARN() {
		return loadBalancerARN;
	}

	public void setLoadBalancerARN(String loadBalancerARN) {
		this.loadBalancerARN = loadBalancerARN;
	}

	public Long getPort() {
		return port;
	}

	public void setPort(Long port) {
		this.port = port;
	}

	public String getProtocol() {
		return protocol;
	}

	public void setProtocol(String protocol) {
		this.protocol = protocol;
	}

	public List<Action> getDefaultActions() {
		return defaultActions;
	}

	public void setDefaultActions(List<Action> defaultActions) {
		this.defaultActions = defaultActions;
	}

	public static class Action {
		private String type;
		private String targetGroupARN;

		public Action() {
		}

		public Action(String type, String targetGroupARN) {
			this.type = type;
			this.targetGroupARN = targetGroupARN;
		}

		public String getType() {
			return type;
		}

		public void setType(String type) {
			this.type = type;
		}

		public String getTargetGroupARN() {
			return targetGroupARN;
		}

		public void setTargetGroupARN(String targetGroupARN) {
			this.targetGroupARN = targetGroupARN;
		}
	}
}
