package dev.kyriji.bmcnetwork.config;

import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

public enum OptionType {
	STRING,
	INTEGER,
	BOOLEAN,
	JSON,
	ON_OFF;

	/**
	 * @return the normalised value, or null when the raw value is not valid for this type
	 */
	public String normalize(String raw) {
		if (raw == null) return null;
		String value = raw.trim();

		return switch (this) {
			case STRING -> value.isEmpty() ? null : value;
			case INTEGER -> {
				try {
					yield Long.toString(Long.parseLong(value));
				} catch (NumberFormatException e) {
					yield null;
				}
			}
			case BOOLEAN -> {
				if (value.equalsIgnoreCase("true")) yield "true";
				if (value.equalsIgnoreCase("false")) yield "false";
				yield null;
			}
			case JSON -> {
				try {
					yield JsonParser.parseString(value).toString();
				} catch (JsonSyntaxException e) {
					yield null;
				}
			}
			case ON_OFF -> value.equals("on") || value.equals("off") ? value : null;
		};
	}
}
