package dev.kyriji.bmcnetwork.crd;

public class TargetGroupBindingSpec {
	private String targetGroupARN;
	private String targetType;
	private ServiceReference serviceRef;

	public String getTargetGroupARN() {
		return targetGroupARN;
	}

	public void setTargetGroupARN(String targetGroupARN) {
		this.targetGroupARN = targetGroupARN;
	}

	public String getTargetType() {
		return targetType;
	}

	public void setTargetType(String targetType) {
		this.targetType = targetType;
	}

	public ServiceReference getServiceRef() {
		return serviceRef;
	}

	public void setServiceRef(ServiceReference serviceRef) {
		this.serviceRef = serviceRef;
	}

	public static class ServiceReference {
		private String name;
		private Integer port;

		public ServiceReference() {
		}

		public ServiceReference(String name, Integer port) {
			this.name = name;
			this.port = port;
		}

		public String getName() {
			return name;
		}

		public void setName(String name) {
			this.name = name;
		}

		public Integer getPort() {
			return port;
		}

		public void setPort(Integer port) {
			this.port = port;
		}
	}
}
