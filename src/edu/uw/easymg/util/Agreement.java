package edu.uw.easymg.util;

import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/**
 * Used to unify two agreement maps (e.g. num=sg, person=3).
 *
 */
public class Agreement {

	private Agreement() {
	}

	/**
	 * Returns the union of the two maps, or Optional.empty() if they assign different values to the same key.
	 */
	public static Optional<ImmutableMap<String, String>> unify(final Map<String, String> left,
			final Map<String, String> right) {
		if (left.isEmpty()) {
			return Optional.of(ImmutableMap.copyOf(right));
		} else if (right.isEmpty()) {
			return Optional.of(ImmutableMap.copyOf(left));
		}

		final ImmutableMap.Builder<String, String> result = ImmutableMap.builder();
		result.putAll(left);
		for (final Entry<String, String> entry : right.entrySet()) {
			final String existing = left.get(entry.getKey());
			if (existing == null) {
				result.put(entry);
			} else if (!existing.equals(entry.getValue())) {
				return Optional.empty();
			}
		}

		return Optional.of(result.build());
	}

	/**
	 * Parses "key=value,key=value".
	 */
	public static ImmutableMap<String, String> fromString(final String text) {
		final ImmutableMap.Builder<String, String> result = ImmutableMap.builder();
		for (final String pair : text.split(",")) {
			if (pair.trim().isEmpty()) {
				continue;
			}
			final String[] fields = pair.trim().split("=");
			if (fields.length != 2 || fields[0].isEmpty() || fields[1].isEmpty()) {
				throw new IllegalArgumentException("Expected key=value in agreement annotation: " + text);
			}
			result.put(fields[0], fields[1]);
		}
		return result.build();
	}
}
