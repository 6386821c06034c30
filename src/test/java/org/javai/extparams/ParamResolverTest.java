package org.javai.extparams;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.javai.extparams.config.ConfigurationException;
import org.javai.extparams.config.ResolverConfig;
import org.javai.extparams.config.SourceConfig;
import org.javai.extparams.placeholder.InvalidPlaceholderSyntaxException;
import org.javai.extparams.placeholder.Placeholder;
import org.javai.extparams.resolve.ResolutionOutcome;
import org.javai.extparams.resolve.SourceStartup;
import org.javai.extparams.resolve.UnresolvedPlaceholderException;
import org.javai.extparams.source.SourceInitializationException;
import org.javai.extparams.source.SourceType;
import org.javai.extparams.testsupport.MutableClock;
import org.javai.extparams.testsupport.RecordingSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for {@link ParamResolver} as a whole engine.
 */
@DisplayName("ParamResolver")
class ParamResolverTest {

	private static final ResolverConfig ENV_ONLY = new ResolverConfig(Duration.ofSeconds(60), Map.of(
			"env", SourceConfig.enabled(Map.of()),
			"file", SourceConfig.disabled(),
			"http", SourceConfig.disabled()));

	@TempDir
	Path workDir;

	private ParamResolver resolver;

	@AfterEach
	void tearDown() {
		if (resolver != null) {
			resolver.cleanup();
		}
	}

	private ParamResolver envResolver(Map<String, String> environment) {
		resolver = ParamResolver.builder()
				.config(ENV_ONLY)
				.environment(environment)
				.workingDirectory(workDir)
				.build();
		resolver.initialize();
		return resolver;
	}

	@Nested
	@DisplayName("resolveText")
	class ResolveText {

		@Test
		@DisplayName("substitutes environment value")
		void substitutesEnvironmentValue() {
			envResolver(Map.of("TEST_VAR", "test_value"));

			assertThat(resolver.resolveText("Hello <user:env#TEST_VAR>!")).isEqualTo("Hello test_value!");
		}

		@Test
		@DisplayName("default used for missing variable")
		void defaultUsedForMissingVariable() {
			envResolver(Map.of());

			assertThat(resolver.resolveText("<x:env#MISSING|fallback_value>")).isEqualTo("fallback_value");
		}

		@Test
		@DisplayName("null and empty pass through")
		void nullAndEmptyPassThrough() {
			envResolver(Map.of());

			assertThat(resolver.resolveText(null)).isNull();
			assertThat(resolver.resolveText("")).isEmpty();
		}

		@Test
		@DisplayName("unresolvable placeholder fails")
		void unresolvablePlaceholderFails() {
			envResolver(Map.of());

			assertThatThrownBy(() -> resolver.resolveText("<x:env#MISSING>"))
					.isInstanceOf(UnresolvedPlaceholderException.class)
					.hasMessage("Could not resolve placeholder for key 'MISSING' from source 'env'. "
							+ "Last error: EnvSource failed to resolve key 'MISSING': Environment variable 'MISSING' not found");
		}
	}

	@Test
	@DisplayName("resolve placeholder and attempt")
	void resolvePlaceholderAndAttempt() {
		envResolver(Map.of("HOST", "db.local"));

		assertThat(resolver.resolvePlaceholder("db", "env", "HOST", null)).isEqualTo("db.local");
		assertThat(resolver.attempt(new Placeholder("db", "env", "NOPE", null)).isResolved()).isFalse();
		assertThat(resolver.attempt(new Placeholder("db", "env", "NOPE", "d")))
				.isInstanceOf(ResolutionOutcome.Defaulted.class);
	}

	@Test
	@DisplayName("use before initialize is rejected")
	void useBeforeInitializeIsRejected() {
		ParamResolver uninitialized = ParamResolver.builder().config(ENV_ONLY).environment(Map.of()).build();

		assertThatThrownBy(() -> uninitialized.resolveText("<a:env#B>"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessage("ParamResolver is not initialized");
		assertThat(uninitialized.availableSources()).isEmpty();
		uninitialized.refreshCaches();
	}

	@Test
	@DisplayName("cleanup releases sources and allows reinitialization")
	void cleanupReleasesSourcesAndAllowsReinitialization() {
		Map<SourceType, RecordingSource> sources = new EnumMap<>(SourceType.class);
		resolver = ParamResolver.builder()
				.config(ENV_ONLY)
				.sourceFactory((type, config) -> sources.computeIfAbsent(type,
						t -> new RecordingSource(t).with("A", "1")))
				.build();
		resolver.initialize();
		resolver.resolveText("<a:env#A>");

		resolver.cleanup();
		assertThat(resolver.isInitialized()).isFalse();
		assertThat(sources.get(SourceType.ENV).cleanupCount()).isEqualTo(1);

		resolver.initialize();
		assertThat(resolver.resolveText("<a:env#A>")).isEqualTo("1");
	}

	@Test
	@DisplayName("refresh caches clears resolved values")
	void refreshCachesClearsResolvedValues() {
		MutableClock clock = new MutableClock();
		RecordingSource env = new RecordingSource(SourceType.ENV).with("A", "1");
		resolver = ParamResolver.builder()
				.config(ENV_ONLY)
				.sourceFactory((type, config) -> env)
				.clock(clock)
				.build();
		resolver.initialize();

		resolver.resolveText("<a:env#A>");
		resolver.resolveText("<a:env#A>");
		assertThat(env.lookupCount("A")).isEqualTo(1);

		resolver.refreshCaches();
		resolver.resolveText("<a:env#A>");
		assertThat(env.lookupCount("A")).isEqualTo(2);
		assertThat(env.refreshCount()).isEqualTo(1);
	}

	@Test
	@DisplayName("failing source is left out")
	void failingSourceIsLeftOut() {
		ResolverConfig config = new ResolverConfig(Duration.ofSeconds(60), Map.of(
				"env", SourceConfig.enabled(Map.of()),
				"vault", SourceConfig.enabled(Map.of()),
				"file", SourceConfig.disabled(),
				"http", SourceConfig.disabled()));
		resolver = ParamResolver.builder()
				.config(config)
				.sourceFactory((type, sourceConfig) -> type == SourceType.VAULT
						? new RecordingSource(type).failingInitialization(
								new SourceInitializationException(type, "Vault token is required"))
						: new RecordingSource(type))
				.build();

		resolver.initialize();

		assertThat(resolver.availableSources()).containsExactly(SourceType.ENV);
		assertThat(resolver.sourceStartups()).contains(
				new SourceStartup.Failed(SourceType.VAULT, "Vault token is required"));
	}

	@Test
	@DisplayName("loads configuration from file")
	void loadsConfigurationFromFile() throws IOException {
		Path values = workDir.resolve("values.json");
		Files.writeString(values, "{ \"db\": { \"host\": \"file-host\" } }");
		Path config = workDir.resolve("params.json");
		Files.writeString(config, """
				{ "sources": { "file": { "basePath": "%s" }, "http": { "enabled": false } } }
				""".formatted(workDir.toString().replace("\\", "\\\\")));

		resolver = ParamResolver.builder()
				.configPath(config)
				.environment(Map.of())
				.workingDirectory(workDir)
				.build();
		resolver.initialize();

		assertThat(resolver.resolveText("host=<h:file#values.json#db.host>")).isEqualTo("host=file-host");
		assertThat(resolver.availableSources()).containsExactly(SourceType.ENV, SourceType.FILE);
	}

	@Test
	@DisplayName("malformed configuration fails initialization")
	void malformedConfigurationFailsInitialization() throws IOException {
		Path config = workDir.resolve("params.json");
		Files.writeString(config, "{ nope");
		resolver = ParamResolver.builder().configPath(config).environment(Map.of()).build();

		assertThatThrownBy(resolver::initialize).isInstanceOf(ConfigurationException.class);
		assertThat(resolver.isInitialized()).isFalse();
	}

	@Test
	@DisplayName("placeholder helpers")
	void placeholderHelpers() {
		assertThat(ParamResolver.createPlaceholder("user", "env", "USER")).isEqualTo("<user:env#USER>");
		assertThat(ParamResolver.createPlaceholder("user", "env", "USER", "guest")).isEqualTo("<user:env#USER|guest>");
		assertThat(ParamResolver.parsePlaceholder("<user:env#USER|guest>"))
				.isEqualTo(new Placeholder("user", "env", "USER", "guest"));
		assertThat(ParamResolver.parsePlaceholder("Use <a:env#K> here"))
				.isEqualTo(new Placeholder("a", "env", "K"));
		assertThatThrownBy(() -> ParamResolver.parsePlaceholder("no placeholder here"))
				.isInstanceOf(InvalidPlaceholderSyntaxException.class);
	}
}
