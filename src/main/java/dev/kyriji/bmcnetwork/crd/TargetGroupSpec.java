package dev.kyriji.bmcnetwork.crd;

public class TargetGroupSpec {
	private String name;
	private String protocol;
	private Long port;
	private String targetType;
	private String vpcID;
	private Boolean healthCheckEnabled;
	private Long healthCheckIntervalSeconds;
	private String healthCheckPath;
	private String healthCheckPort;
	private String healthCheckProtocol;
	private Long healthCheckTimeoutSeconds;
	private Long healthyThresholdCount;
	private Long unhealthyThresholdCount;

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getProtocol() {
		return protocol;
	}

	public void setProtocol(String protocol) {
		this.protocol = protocol;
	}

	public Long getPort() {
		return port;
	}

	public void setPort(Long port) {
		this.port = port;
	}

	public String getTargetType() {
		return targetType;
	}

	public void setTargetType(String targetType) {
		this.targetType = targetType;
	}

	public String getVpcID() {
		return vpcID;
	}

	public void setVpcID(String vpcID) {
		this.vpcID = vpcID;
	}

	public Boolean getHealthCheckEnabled() {
		return healthCheckEnabled;
	}

	public void setHealthCheckEnabled(Boolean healthCheckEnabled) {
		this.healthCheckEnabled = healthCheckEnabled;
	}

	public Long getHealthCheckIntervalSeconds() {
		return healthCheckIntervalSeconds;
	}

	public void setHealthCheckIntervalSeconds(Long healthCheckIntervalSeconds) {
		this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
	}

	public String getHealthCheckPath() {
		return healthCheckPath;
	}

	public void setHealthCheckPath(String healthCheckPath) {
		this.healthCheckPath = healthCheckPath;
	}

	public String getHealthCheckPort() {
		return healthCheckPort;
	}

	public void setHealthCheckPort(String healthCheckPort) {
		this.healthCheckPort = healthCheckPort;
	}

	public String getHealthCheckProtocol() {
		return healthCheckProtocol;
	}

	public void setHealthCheckProtocol(String healthCheckProtocol) {
		this.healthCheckProtocol = healthCheckProtocol;
	}

	public Long getHealthCheckTimeoutSeconds() {
		return healthCheckTimeoutSeconds;
	}

	public void setHealthCheckTimeoutSeconds(Long healthCheckTimeoutSeconds) {
		this.healthCheckTimeoutSeconds = healthCheckTimeoutSeconds;
	}

	public Long getHealthyThresholdCount() {
		return healthyThresholdCount;
	}

	public void setHealthyThresholdCount(Long healthyThresholdCount) {
		this.healthyThresholdCount = healthyThresholdCount;
	}

	public Long getUnhealthyThresholdCount() {
		return unhealthyThresholdCount;
	}

	public void setUnhealthyThresholdCount(Long unhealthyThresholdCount) {
		this.unhealthyThresholdCount = unhealthyThresholdCount;
	}
}
