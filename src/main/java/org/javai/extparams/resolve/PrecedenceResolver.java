package org.javai.extparams.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.extparams.SecretMasker;
import org.javai.extparams.cache.TtlCache;
import org.javai.extparams.placeholder.Placeholder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a single placeholder by walking its fallback chain.
 * <ol>
 *   <li>A fresh top-level cache entry for {@code (name, source, key)} is returned without touching
 *       any source.</li>
 *   <li>Otherwise the declared source is tried, then the remaining registered sources in
 *       precedence order. The first non-null value wins, is cached and returned; later sources
 *       are not consulted.</li>
 *   <li>A failing source advances the walk. Its masked error is recorded. A {@code null} value
 *       advances the walk without recording anything.</li>
 *   <li>When the chain is exhausted the literal default is used if present. Defaults are never
 *       cached.</li>
 * </ol>
 */
public class PrecedenceResolver {

	private static final Logger logger = LoggerFactory.getLogger(PrecedenceResolver.class);

	private final SourceRegistry registry;
	private final SourceInvoker invoker;
	private final TtlCache<CacheKey, String> cache;

	public PrecedenceResolver(SourceRegistry registry, SourceInvoker invoker, TtlCache<CacheKey, String> cache) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
		this.cache = Objects.requireNonNull(cache, "cache must not be null");
	}

	/**
	 * Walks the chain and reports what happened without throwing for an unresolved placeholder.
	 */
	public ResolutionOutcome attempt(Placeholder placeholder) {
		Objects.requireNonNull(placeholder, "placeholder must not be null");
		CacheKey cacheKey = CacheKey.of(placeholder);

		Optional<String> cached = cache.get(cacheKey);
		if (cached.isPresent()) {
			logger.debug("Cache hit for {}", cacheKey);
			return new ResolutionOutcome.Resolved(placeholder, cached.get(), null, true, List.of());
		}

		List<SourceFailure> failures = new ArrayList<>();
		for (RegisteredSource source : registry.fallbackChain(placeholder.source())) {
			String value;
			try {
				value = invoker.invoke(source, placeholder.key());
			}
			catch (RuntimeException e) {
				recordFailure(failures, source, placeholder, e);
				continue;
			}
			if (value != null) {
				cache.put(cacheKey, value);
				logger.debug("Resolved {} from {} source", cacheKey, source.type());
				return new ResolutionOutcome.Resolved(placeholder, value, source.type(), false, failures);
			}
			logger.debug("Source {} returned no value for key '{}'", source.type(), placeholder.key());
		}

		if (placeholder.hasDefault()) {
			logger.debug("Using default value for {}", cacheKey);
			return new ResolutionOutcome.Defaulted(placeholder, failures);
		}
		return new ResolutionOutcome.Unresolved(placeholder, failures);
	}

	/**
	 * @return the resolved or default value
	 * @throws UnresolvedPlaceholderException when the chain is exhausted and there is no default
	 */
	public String resolve(Placeholder placeholder) {
		ResolutionOutcome outcome = attempt(placeholder);
		if (outcome instanceof ResolutionOutcome.Resolved resolved) {
			return resolved.value();
		}
		if (outcome instanceof ResolutionOutcome.Defaulted defaulted) {
			return defaulted.value();
		}
		throw ((ResolutionOutcome.Unresolved) outcome).toException();
	}

	public void clearCache() {
		cache.clear();
	}

	private static void recordFailure(List<SourceFailure> failures, RegisteredSource source, Placeholder placeholder,
			RuntimeException e) {
		String message = SecretMasker.mask(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
		failures.add(new SourceFailure(source.type(), message));
		logger.debug("Source {} failed for key '{}': {}", source.type(), placeholder.key(), message);
	}
}
