package dev.kyriji.bmcnetwork.utils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses shorthand duration strings into milliseconds.
 *
 * Supported units: days (d), hours (h), minutes (m), seconds (s) and milliseconds (ms), combined with
 * optional whitespace, e.g. "1d 5h 32m 15s", "2s", "500ms".
 */
public class DurationParser {

	private static final Pattern COMPONENT = Pattern.compile(
			"(\\d+)\\s*(ms|[dhms])", Pattern.CASE_INSENSITIVE);

	private DurationParser() {
	}

	/**
	 * @throws IllegalArgumentException if the string is null, blank or contains no recognised components
	 */
	public static long parseToMillis(String input) {
		if (input == null || input.isBlank()) {
			throw new IllegalArgumentException("Duration string must not be null or blank");
		}

		Matcher matcher = COMPONENT.matcher(input);
		long totalMillis = 0;
		boolean matched = false;

		while (matcher.find()) {
			matched = true;
			long value = Long.parseLong(matcher.group(1));
			String unit = matcher.group(2).toLowerCase();

			totalMillis += switch (unit) {
				case "d" -> value * 86_400_000L;
				case "h" -> value * 3_600_000L;
				case "m" -> value * 60_000L;
				case "s" -> value * 1_000L;
				case "ms" -> value;
				default -> throw new IllegalArgumentException("Unknown time unit: " + unit);
			};
		}

		if (!matched) {
			throw new IllegalArgumentException("No valid duration components found in: \"" + input + "\"");
		}

		return totalMillis;
	}

	public static long parseOrDefault(String input, long defaultMillis) {
		if (input == null || input.isBlank()) return defaultMillis;
		return parseToMillis(input);
	}
}
