package org.javai.extparams.source;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The fixed set of source variants. Declaration order is the global precedence order used when a
 * placeholder's declared source cannot supply a value.
 */
public enum SourceType {

	ENV("env", true, Duration.ofSeconds(5)),
	FILE("file", true, Duration.ofSeconds(5)),
	VAULT("vault", false, Duration.ofSeconds(30)),
	AWS("aws", false, Duration.ofSeconds(30)),
	K8S("k8s", false, Duration.ofSeconds(30)),
	HTTP("http", true, Duration.ofSeconds(30));

	private static final List<SourceType> PRECEDENCE = List.of(values());

	private final String id;
	private final boolean enabledByDefault;
	private final Duration defaultResolveTimeout;

	SourceType(String id, boolean enabledByDefault, Duration defaultResolveTimeout) {
		this.id = id;
		this.enabledByDefault = enabledByDefault;
		this.defaultResolveTimeout = defaultResolveTimeout;
	}

	/**
	 * Identifier used in placeholders and configuration, e.g. {@code env}.
	 */
	public String id() {
		return id;
	}

	public boolean enabledByDefault() {
		return enabledByDefault;
	}

	/**
	 * Upper bound the engine places on one {@code resolve} call when the configuration sets no
	 * {@code resolveTimeout}. It covers the adapter's own retries.
	 */
	public Duration defaultResolveTimeout() {
		return defaultResolveTimeout;
	}

	public static Optional<SourceType> fromId(String id) {
		if (id == null) {
			return Optional.empty();
		}
		for (SourceType type : PRECEDENCE) {
			if (type.id.equals(id)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}

	/**
	 * {@code env, file, vault, aws, k8s, http}.
	 */
	public static List<SourceType> precedence() {
		return PRECEDENCE;
	}

	@Override
	public String toString() {
		return id;
	}
}
