package dev.kyriji.bmcnetwork.crd;

import java.util.ArrayList;
import java.util.List;

public class TargetGroupStatus {
	private ResourceMetadata ackResourceMetadata;
	private List<Condition> conditions = new ArrayList<>();

	public ResourceMetadata getAckResourceMetadata() {
		return ackResourceMetadata;
	}

	public void setAckResourceMetadata(ResourceMetadata ackResourceMetadata) {
		this.ackResourceMetadata = ackResourceMetadata;
	}

	public List<Condition> getConditions() {
		return conditions;
	}

	public void setConditions(List<Condition> conditions) {
		this.conditions = conditions;
	}

	public static class ResourceMetadata {
		private String arn;
		private String ownerAccountID;
		private String region;

		public String getArn() {
			return arn;
		}

		public void setArn(String arn) {
			this.arn = arn;
		}

		public String getOwnerAccountID() {
			return ownerAccountID;
		}

		public void setOwnerAccountID(String ownerAccountID) {
			this.ownerAccountID = ownerAccountID;
		}

		public String getRegion() {
			return region;
		}

		public void setRegion(String region) {
			this.region = region;
		}
	}

	public static class Condition {
		private String type;
		private String status;
		private String reason;
		private String message;

		public Condition() {
		}

		public Condition(String type, String status, String message) {
			this.type = type;
			this.status = status;
			this.message = message;
		}

		public String getType() {
			return type;
		}

		public void setType(String type) {
			this.type = type;
		}

		public String getStatus() {
			return status;
		}

		public void setStatus(String status) {
			this.status = status;
		}

		public String getReason() {
			return reason;
		}

		public void setReason(String reason) {
			this.reason = reason;
		}

		public String getMessage() {
			return message;
		}

		public void setMessage(String message) {
			this.message = message;
		}
	}
}
