package org.javai.extparams.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-source configuration: the enablement flag plus the adapter's raw options.
 * <p>
 * Options are kept as the loosely typed values read from the configuration document; adapters
 * read them through the typed accessors and apply their own defaults.
 */
public record SourceConfig(boolean enabled, Map<String, Object> options) {

	public SourceConfig {
		options = options != null ? unmodifiableCopy(options) : Map.of();
	}

	public static SourceConfig enabled(Map<String, Object> options) {
		return new SourceConfig(true, options);
	}

	public static SourceConfig disabled() {
		return new SourceConfig(false, Map.of());
	}

	public boolean has(String name) {
		return options.get(name) != null;
	}

	public Optional<String> string(String name) {
		Object value = options.get(name);
		if (value == null) {
			return Optional.empty();
		}
		String text = value.toString();
		return text.isBlank() ? Optional.empty() : Optional.of(text);
	}

	public String string(String name, String defaultValue) {
		return string(name).orElse(defaultValue);
	}

	public int integer(String name, int defaultValue) {
		Object value = options.get(name);
		if (value instanceof Number number) {
			return number.intValue();
		}
		if (value instanceof String s && !s.isBlank()) {
			try {
				return Integer.parseInt(s.trim());
			}
			catch (NumberFormatException e) {
				throw new ConfigurationException("Option '" + name + "' must be an integer: " + s, e);
			}
		}
		return defaultValue;
	}

	public long longValue(String name, long defaultValue) {
		Object value = options.get(name);
		if (value instanceof Number number) {
			return number.longValue();
		}
		if (value instanceof String s && !s.isBlank()) {
			try {
				return Long.parseLong(s.trim());
			}
			catch (NumberFormatException e) {
				throw new ConfigurationException("Option '" + name + "' must be a number: " + s, e);
			}
		}
		return defaultValue;
	}

	public boolean bool(String name, boolean defaultValue) {
		Object value = options.get(name);
		if (value instanceof Boolean b) {
			return b;
		}
		if (value instanceof String s && !s.isBlank()) {
			return Boolean.parseBoolean(s.trim());
		}
		return defaultValue;
	}

	/**
	 * Reads a duration expressed in milliseconds.
	 */
	public Duration millis(String name, Duration defaultValue) {
		return has(name) ? Duration.ofMillis(longValue(name, 0)) : defaultValue;
	}

	/**
	 * Reads a duration expressed in seconds.
	 */
	public Duration seconds(String name, Duration defaultValue) {
		return has(name) ? Duration.ofSeconds(longValue(name, 0)) : defaultValue;
	}

	public List<String> strings(String name, List<String> defaultValue) {
		Object value = options.get(name);
		if (value instanceof Collection<?> collection) {
			List<String> result = new ArrayList<>();
			for (Object item : collection) {
				if (item != null) {
					result.add(item.toString());
				}
			}
			return List.copyOf(result);
		}
		if (value instanceof String s && !s.isBlank()) {
			List<String> result = new ArrayList<>();
			for (String part : s.split(",")) {
				if (!part.isBlank()) {
					result.add(part.trim());
				}
			}
			return List.copyOf(result);
		}
		return defaultValue;
	}

	public Map<String, String> stringMap(String name) {
		Object value = options.get(name);
		if (!(value instanceof Map<?, ?> map)) {
			return Map.of();
		}
		Map<String, String> result = new LinkedHashMap<>();
		map.forEach((k, v) -> {
			if (k != null && v != null) {
				result.put(k.toString(), v.toString());
			}
		});
		return Map.copyOf(result);
	}

	/**
	 * Returns a nested option object as its own {@code SourceConfig}, e.g. the {@code auth} block.
	 */
	public SourceConfig section(String name) {
		Object value = options.get(name);
		if (!(value instanceof Map<?, ?> map)) {
			return new SourceConfig(enabled, Map.of());
		}
		Map<String, Object> nested = new LinkedHashMap<>();
		map.forEach((k, v) -> {
			if (k != null) {
				nested.put(k.toString(), v);
			}
		});
		return new SourceConfig(enabled, nested);
	}

	private static Map<String, Object> unmodifiableCopy(Map<String, Object> options) {
		// JSON nulls are dropped, so an explicit null reads the same as an absent option
		Map<String, Object> copy = new LinkedHashMap<>();
		options.forEach((k, v) -> {
			if (k != null && v != null) {
				copy.put(k, v);
			}
		});
		return Collections.unmodifiableMap(copy);
	}
}
