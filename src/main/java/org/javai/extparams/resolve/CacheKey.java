package org.javai.extparams.resolve;

import org.javai.extparams.placeholder.Placeholder;

/**
 * Identity of a top-level cache entry. The placeholder name takes part, so two placeholders
 * that differ only in their label are cached independently.
 */
public record CacheKey(String name, String source, String key) {

	public static CacheKey of(Placeholder placeholder) {
		return new CacheKey(placeholder.name(), placeholder.source(), placeholder.key());
	}

	@Override
	public String toString() {
		return name + ":" + source + ":" + key;
	}
}
