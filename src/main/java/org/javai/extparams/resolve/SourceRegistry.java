package org.javai.extparams.resolve;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.extparams.SecretMasker;
import org.javai.extparams.config.ResolverConfig;
import org.javai.extparams.config.SourceConfig;
import org.javai.extparams.source.ParamSource;
import org.javai.extparams.source.SourceFactory;
import org.javai.extparams.source.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The initialized sources of one engine instance, keyed by variant.
 * <p>
 * Built once from configuration by {@link #initialize}; an adapter that fails to start is left
 * out and recorded as a {@link SourceStartup.Failed}. The registry is immutable afterwards and is
 * discarded on {@link #cleanup()}.
 */
public final class SourceRegistry {

	private static final Logger logger = LoggerFactory.getLogger(SourceRegistry.class);

	private final Map<SourceType, RegisteredSource> sources;
	private final List<SourceStartup> startups;

	SourceRegistry(Map<SourceType, RegisteredSource> sources, List<SourceStartup> startups) {
		EnumMap<SourceType, RegisteredSource> copy = new EnumMap<>(SourceType.class);
		copy.putAll(sources);
		this.sources = Collections.unmodifiableMap(copy);
		this.startups = List.copyOf(startups);
	}

	public static SourceRegistry empty() {
		return new SourceRegistry(Map.of(), List.of());
	}

	/**
	 * Creates and initializes every enabled source, in precedence order. Failures are logged at
	 * WARN and the source is skipped.
	 */
	public static SourceRegistry initialize(ResolverConfig config, SourceFactory factory) {
		Map<SourceType, RegisteredSource> registered = new EnumMap<>(SourceType.class);
		List<SourceStartup> startups = new ArrayList<>();

		for (SourceType type : SourceType.precedence()) {
			SourceConfig sourceConfig = config.source(type);
			if (!sourceConfig.enabled()) {
				logger.debug("Source {} is disabled", type);
				continue;
			}
			ParamSource source = null;
			try {
				source = factory.create(type, sourceConfig);
				source.initialize();
				Duration timeout = sourceConfig.millis("resolveTimeout", type.defaultResolveTimeout());
				registered.put(type, new RegisteredSource(type, source, timeout));
				startups.add(new SourceStartup.Started(type));
				logger.info("Initialized {} source", type);
			}
			catch (RuntimeException e) {
				String reason = SecretMasker.mask(String.valueOf(e.getMessage()));
				logger.warn("Failed to initialize {} source: {}", type, reason);
				startups.add(new SourceStartup.Failed(type, reason));
				releaseQuietly(type, source);
			}
		}
		return new SourceRegistry(registered, startups);
	}

	private static void releaseQuietly(SourceType type, ParamSource source) {
		if (source == null) {
			return;
		}
		try {
			source.cleanup();
		}
		catch (RuntimeException e) {
			logger.debug("Cleanup of failed {} source also failed: {}", type, SecretMasker.mask(e.getMessage()));
		}
	}

	public Optional<RegisteredSource> get(SourceType type) {
		return Optional.ofNullable(sources.get(type));
	}

	public Set<SourceType> types() {
		return sources.keySet();
	}

	public boolean isEmpty() {
		return sources.isEmpty();
	}

	public List<SourceStartup> startups() {
		return startups;
	}

	/**
	 * The declared source first, then the rest of the precedence order, skipping anything not
	 * registered. An unknown declared source contributes nothing but still gets the full
	 * precedence walk.
	 */
	public List<RegisteredSource> fallbackChain(String declaredSource) {
		Optional<SourceType> declared = SourceType.fromId(declaredSource);
		List<RegisteredSource> chain = new ArrayList<>(sources.size());
		declared.map(sources::get).ifPresent(chain::add);
		for (SourceType type : SourceType.precedence()) {
			if (declared.isPresent() && declared.get() == type) {
				continue;
			}
			RegisteredSource source = sources.get(type);
			if (source != null) {
				chain.add(source);
			}
		}
		return chain;
	}

	/**
	 * Clears every adapter's own cache. A failing adapter is logged and skipped.
	 */
	public void refreshCaches() {
		sources.forEach((type, registered) -> {
			try {
				registered.source().refreshCache();
			}
			catch (RuntimeException e) {
				logger.warn("Failed to refresh cache for {} source: {}", type, SecretMasker.mask(e.getMessage()));
			}
		});
	}

	/**
	 * Releases every adapter. A failing adapter is logged and skipped.
	 */
	public void cleanup() {
		sources.forEach((type, registered) -> {
			try {
				registered.source().cleanup();
			}
			catch (RuntimeException e) {
				logger.warn("Failed to cleanup {} source: {}", type, SecretMasker.mask(e.getMessage()));
			}
		});
	}
}
