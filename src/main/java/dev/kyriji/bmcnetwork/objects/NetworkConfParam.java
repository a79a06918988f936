package dev.kyriji.bmcnetwork.objects;

import java.util.Objects;

public class NetworkConfParam {
	private String name;
	private String value;

	public NetworkConfParam() {
	}

	public NetworkConfParam(String name, String value) {
		this.name = name;
		this.value = value;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getValue() {
		return value;
	}

	public void setValue(String value) {
		this.value = value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof NetworkConfParam that)) return false;
		return Objects.equals(name, that.name) && Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}

	@Override
	public String toString() {
		return name + "=" + value;
	}
}
