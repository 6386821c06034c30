package org.javai.extparams.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link SourceConfig} option accessors.
 */
@DisplayName("SourceConfig")
class SourceConfigTest {

	@Test
	@DisplayName("typed accessors accept numbers and strings")
	void typedAccessorsAcceptNumbersAndStrings() {
		SourceConfig config = SourceConfig.enabled(Map.of(
				"timeout", 2500,
				"retries", "4",
				"cacheFiles", "false",
				"cacheTimeout", 30));

		assertThat(config.millis("timeout", Duration.ZERO)).isEqualTo(Duration.ofMillis(2500));
		assertThat(config.integer("retries", 0)).isEqualTo(4);
		assertThat(config.bool("cacheFiles", true)).isFalse();
		assertThat(config.seconds("cacheTimeout", Duration.ZERO)).isEqualTo(Duration.ofSeconds(30));
	}

	@Test
	@DisplayName("absent options use the given default")
	void absentOptionsUseTheGivenDefault() {
		SourceConfig config = SourceConfig.enabled(Map.of());

		assertThat(config.integer("retries", 2)).isEqualTo(2);
		assertThat(config.string("prefix", "")).isEmpty();
		assertThat(config.strings("allowedExtensions", List.of(".json"))).containsExactly(".json");
		assertThat(config.stringMap("headers")).isEmpty();
	}

	@Test
	@DisplayName("null options read as absent")
	void nullOptionsReadAsAbsent() {
		Map<String, Object> options = new HashMap<>();
		options.put("token", null);

		SourceConfig config = SourceConfig.enabled(options);

		assertThat(config.has("token")).isFalse();
		assertThat(config.string("token")).isEmpty();
	}

	@Test
	@DisplayName("comma separated strings are split")
	void commaSeparatedStringsAreSplit() {
		SourceConfig config = SourceConfig.enabled(Map.of("allowedExtensions", ".json, .yml"));

		assertThat(config.strings("allowedExtensions", List.of())).containsExactly(".json", ".yml");
	}

	@Test
	@DisplayName("nested section is exposed as its own config")
	void nestedSectionIsExposedAsItsOwnConfig() {
		SourceConfig config = SourceConfig.enabled(Map.of(
				"auth", Map.of("username", "svc", "password", "pw"),
				"headers", Map.of("X-Trace", 1)));

		assertThat(config.section("auth").string("username")).contains("svc");
		assertThat(config.section("missing").options()).isEmpty();
		assertThat(config.stringMap("headers")).containsEntry("X-Trace", "1");
	}

	@Test
	@DisplayName("non numeric value is a configuration error")
	void nonNumericValueIsAConfigurationError() {
		SourceConfig config = SourceConfig.enabled(Map.of("retries", "many"));

		assertThatThrownBy(() -> config.integer("retries", 2))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("retries");
	}
}
