package org.javai.extparams;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.extparams.cache.TtlCache;
import org.javai.extparams.config.ConfigLoader;
import org.javai.extparams.config.ResolverConfig;
import org.javai.extparams.placeholder.Placeholder;
import org.javai.extparams.placeholder.PlaceholderGrammar;
import org.javai.extparams.resolve.CacheKey;
import org.javai.extparams.resolve.PrecedenceResolver;
import org.javai.extparams.resolve.ResolutionOutcome;
import org.javai.extparams.resolve.SourceInvoker;
import org.javai.extparams.resolve.SourceRegistry;
import org.javai.extparams.resolve.SourceStartup;
import org.javai.extparams.resolve.TextResolver;
import org.javai.extparams.source.DefaultSourceFactory;
import org.javai.extparams.source.SourceFactory;
import org.javai.extparams.source.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the placeholder resolution engine.
 *
 * <pre>{@code
 * ParamResolver resolver = ParamResolver.builder()
 *     .configPath(Path.of("gauge-external-params.json"))
 *     .build();
 * resolver.initialize();
 * String text = resolver.resolveText("Login as <user:env#TEST_USER|guest>");
 * resolver.cleanup();
 * }</pre>
 *
 * {@link #initialize()} loads the configuration and starts the enabled sources; sources that fail
 * to start are dropped with a warning. {@link #refreshCaches()} clears the resolved-value cache and
 * every source's own cache. {@link #cleanup()} releases everything, after which
 * {@link #initialize()} may be called again.
 */
public class ParamResolver {

	private static final Logger logger = LoggerFactory.getLogger(ParamResolver.class);

	private final Path configPath;
	private final ResolverConfig presetConfig;
	private final Path workingDirectory;
	private final SourceFactory sourceFactory;
	private final Clock clock;

	private volatile Engine engine;

	private ParamResolver(Builder builder) {
		this.workingDirectory = builder.workingDirectory != null ? builder.workingDirectory : Path.of("").toAbsolutePath();
		this.configPath = builder.configPath != null ? builder.configPath : ConfigLoader.defaultLocation(workingDirectory);
		this.presetConfig = builder.config;
		Map<String, String> environment = builder.environment != null ? builder.environment : System.getenv();
		this.sourceFactory = builder.sourceFactory != null
				? builder.sourceFactory
				: new DefaultSourceFactory(environment, workingDirectory);
		this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Loads configuration and starts the enabled sources. Calling it on an initialized resolver
	 * rebuilds it.
	 *
	 * @throws org.javai.extparams.config.ConfigurationException when the configuration file exists
	 * but cannot be read or parsed
	 */
	public synchronized void initialize() {
		if (engine != null) {
			logger.debug("Re-initializing ParamResolver");
			cleanup();
		}
		ResolverConfig config = presetConfig != null
				? presetConfig
				: new ConfigLoader().load(configPath, workingDirectory);

		SourceRegistry registry = SourceRegistry.initialize(config, sourceFactory);
		SourceInvoker invoker = new SourceInvoker();
		TtlCache<CacheKey, String> cache = new TtlCache<>(config.cacheTimeout(), clock);
		PrecedenceResolver precedence = new PrecedenceResolver(registry, invoker, cache);
		engine = new Engine(config, registry, invoker, precedence, new TextResolver(precedence));

		logger.info("ParamResolver initialized with sources {}", registry.types());
	}

	/**
	 * Replaces every placeholder in {@code text}. {@code null} and empty text are returned as is.
	 *
	 * @throws org.javai.extparams.resolve.UnresolvedPlaceholderException when a placeholder has
	 * no default and no source can supply it; no partial result is produced
	 */
	public String resolveText(String text) {
		if (text == null || text.isEmpty()) {
			return text;
		}
		return requireEngine().text().resolveText(text);
	}

	/**
	 * Resolves one placeholder given by its components.
	 *
	 * @param defaultValue literal fallback, may be {@code null}
	 */
	public String resolvePlaceholder(String name, String source, String key, String defaultValue) {
		return requireEngine().precedence().resolve(new Placeholder(name, source, key, defaultValue));
	}

	/**
	 * Like {@link #resolvePlaceholder} but reports the outcome, including the failed attempts,
	 * instead of throwing when nothing resolves.
	 */
	public ResolutionOutcome attempt(Placeholder placeholder) {
		return requireEngine().precedence().attempt(placeholder);
	}

	public void refreshCaches() {
		Engine current = engine;
		if (current == null) {
			return;
		}
		current.precedence().clearCache();
		current.registry().refreshCaches();
		logger.debug("Caches refreshed");
	}

	public synchronized void cleanup() {
		Engine current = engine;
		engine = null;
		if (current == null) {
			return;
		}
		current.precedence().clearCache();
		current.registry().cleanup();
		current.invoker().close();
		logger.debug("ParamResolver cleaned up");
	}

	public boolean isInitialized() {
		return engine != null;
	}

	/**
	 * Sources that started successfully; empty before {@link #initialize()} and after
	 * {@link #cleanup()}.
	 */
	public Set<SourceType> availableSources() {
		Engine current = engine;
		return current != null ? current.registry().types() : Set.of();
	}

	public List<SourceStartup> sourceStartups() {
		Engine current = engine;
		return current != null ? current.registry().startups() : List.of();
	}

	public ResolverConfig config() {
		return requireEngine().config();
	}

	/**
	 * Parses the first placeholder found in {@code text}.
	 *
	 * @throws org.javai.extparams.placeholder.InvalidPlaceholderSyntaxException when {@code text}
	 * contains no well-formed placeholder
	 */
	public static Placeholder parsePlaceholder(String text) {
		return PlaceholderGrammar.parse(text);
	}

	public static String createPlaceholder(String name, String source, String key) {
		return PlaceholderGrammar.serialize(name, source, key);
	}

	public static String createPlaceholder(String name, String source, String key, String defaultValue) {
		return PlaceholderGrammar.serialize(name, source, key, defaultValue);
	}

	private Engine requireEngine() {
		Engine current = engine;
		if (current == null) {
			throw new IllegalStateException("ParamResolver is not initialized");
		}
		return current;
	}

	private record Engine(ResolverConfig config, SourceRegistry registry, SourceInvoker invoker,
			PrecedenceResolver precedence, TextResolver text) {
	}

	public static final class Builder {

		private Path configPath;
		private ResolverConfig config;
		private Map<String, String> environment;
		private SourceFactory sourceFactory;
		private Clock clock;
		private Path workingDirectory;

		private Builder() {
		}

		/**
		 * Configuration file to load on {@link ParamResolver#initialize()}. Defaults to
		 * {@code gauge-external-params.json} in the working directory.
		 */
		public Builder configPath(Path configPath) {
			this.configPath = configPath;
			return this;
		}

		/**
		 * Uses {@code config} as is instead of loading a file.
		 */
		public Builder config(ResolverConfig config) {
			this.config = config;
			return this;
		}

		/**
		 * Environment table for the env source and ambient credentials. Defaults to the process
		 * environment.
		 */
		public Builder environment(Map<String, String> environment) {
			this.environment = Objects.requireNonNull(environment, "environment must not be null");
			return this;
		}

		public Builder sourceFactory(SourceFactory sourceFactory) {
			this.sourceFactory = sourceFactory;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder workingDirectory(Path workingDirectory) {
			this.workingDirectory = workingDirectory;
			return this;
		}

		public ParamResolver build() {
			return new ParamResolver(this);
		}
	}
}
