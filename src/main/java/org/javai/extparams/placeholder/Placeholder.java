package org.javai.extparams.placeholder;

import java.util.Optional;

/**
 * A single {@code <name:source#key|default>} reference found in a document.
 * <p>
 * {@code name} is a descriptive label only; resolution is driven by {@code source} and {@code key}.
 * {@code defaultValue} is {@code null} when the placeholder carries no default and is otherwise
 * substituted verbatim, without further resolution.
 */
public record Placeholder(String name, String source, String key, String defaultValue) {

	public Placeholder {
		if (source == null || source.isEmpty()) {
			throw new IllegalArgumentException("source must not be empty");
		}
		if (key == null || key.isEmpty()) {
			throw new IllegalArgumentException("key must not be empty");
		}
	}

	public Placeholder(String name, String source, String key) {
		this(name, source, key, null);
	}

	public boolean hasDefault() {
		return defaultValue != null;
	}

	public Optional<String> defaultValueOptional() {
		return Optional.ofNullable(defaultValue);
	}

	/**
	 * Render this placeholder back into its document syntax.
	 */
	public String toText() {
		return PlaceholderGrammar.serialize(name, source, key, defaultValue);
	}
}
