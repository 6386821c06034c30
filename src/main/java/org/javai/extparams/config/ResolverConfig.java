package org.javai.extparams.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.extparams.source.SourceType;

/**
 * Engine configuration: the resolved-value cache TTL and the per-source settings.
 *
 * @param cacheTimeout TTL of the top-level resolved-value cache
 * @param sources per-source configuration keyed by source identifier
 */
public record ResolverConfig(Duration cacheTimeout, Map<String, SourceConfig> sources) {

	public static final Duration DEFAULT_CACHE_TIMEOUT = Duration.ofSeconds(60);

	public ResolverConfig {
		Objects.requireNonNull(cacheTimeout, "cacheTimeout must not be null");
		sources = sources != null ? Map.copyOf(sources) : Map.of();
	}

	/**
	 * Configuration for {@code type}; a source missing from the document gets the type's
	 * default enablement and no options.
	 */
	public SourceConfig source(SourceType type) {
		SourceConfig config = sources.get(type.id());
		if (config != null) {
			return config;
		}
		return type.enabledByDefault() ? SourceConfig.enabled(Map.of()) : SourceConfig.disabled();
	}

	/**
	 * Configuration used when no configuration document exists: env, file and http enabled,
	 * vault, aws and k8s disabled.
	 */
	public static ResolverConfig defaults(Path workingDirectory) {
		Map<String, SourceConfig> sources = new LinkedHashMap<>();
		sources.put(SourceType.ENV.id(), SourceConfig.enabled(Map.of()));
		sources.put(SourceType.FILE.id(), SourceConfig.enabled(Map.of(
				"basePath", workingDirectory.toAbsolutePath().toString())));
		sources.put(SourceType.HTTP.id(), SourceConfig.enabled(Map.of("timeout", 3000)));
		sources.put(SourceType.VAULT.id(), new SourceConfig(false, Map.of("url", "http://localhost:8200")));
		sources.put(SourceType.AWS.id(), new SourceConfig(false, Map.of("region", "us-east-1")));
		sources.put(SourceType.K8S.id(), new SourceConfig(false, Map.of("namespace", "default")));
		return new ResolverConfig(DEFAULT_CACHE_TIMEOUT, sources);
	}
}
