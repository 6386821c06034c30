package org.javai.extparams.source;

/**
 * Capability contract implemented by every backend adapter.
 * <p>
 * Key strings are adapter-specific (see each implementation) but always a single string; any
 * sub-structure such as a field path, HTTP method or namespace is the adapter's own grammar.
 * {@link #resolve(String)} must be safe to call repeatedly and concurrently for different keys and
 * must have no side effects beyond the adapter's own cache.
 */
public interface ParamSource {

	SourceType type();

	/**
	 * Prepares the adapter, e.g. builds a client and probes the backend.
	 *
	 * @throws SourceInitializationException when the backend is unreachable or misconfigured
	 */
	void initialize();

	/**
	 * Looks up {@code key}.
	 *
	 * @return the value; {@code null} is treated by callers as "no value" without an error
	 * @throws SourceResolutionException when the key, path or field is absent, access is denied or
	 * the backend cannot be reached
	 */
	String resolve(String key);

	/**
	 * Drops everything the adapter has cached.
	 */
	default void refreshCache() {
	}

	/**
	 * Releases clients and caches. The adapter is not used again afterwards.
	 */
	default void cleanup() {
	}
}
