package org.javai.extparams.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.javai.extparams.source.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link ResolverConfig} from a JSON document.
 *
 * <pre>{@code
 * {
 *   "cacheTimeout": 60,
 *   "sources": {
 *     "env":   { "enabled": true, "prefix": "APP_" },
 *     "vault": { "enabled": true, "url": "https://vault:8200", "mount": "secret" }
 *   }
 * }
 * }</pre>
 *
 * A missing document is not an error: the default configuration is returned instead.
 */
public class ConfigLoader {

	public static final String DEFAULT_FILE_NAME = "gauge-external-params.json";

	private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
	private static final TypeReference<Map<String, Object>> OPTIONS_TYPE = new TypeReference<>() {
	};

	private final ObjectMapper mapper = new ObjectMapper();

	public ResolverConfig load(Path configPath, Path workingDirectory) {
		if (configPath == null || !Files.exists(configPath)) {
			logger.warn("Config file not found at {}, using defaults", configPath);
			return ResolverConfig.defaults(workingDirectory);
		}
		String content;
		try {
			content = Files.readString(configPath);
		}
		catch (IOException e) {
			throw new ConfigurationException("Failed to load config: " + e.getMessage(), e);
		}
		ResolverConfig config = parse(content);
		logger.debug("Loaded configuration from {}", configPath);
		return config;
	}

	public ResolverConfig parse(String json) {
		JsonNode root;
		try {
			root = mapper.readTree(json);
		}
		catch (JsonProcessingException e) {
			throw new ConfigurationException("Failed to load config: " + e.getOriginalMessage(), e);
		}
		if (root == null || !root.isObject()) {
			throw new ConfigurationException("Failed to load config: top level must be a JSON object");
		}
		return new ResolverConfig(cacheTimeout(root), sources(root.path("sources")));
	}

	private static Duration cacheTimeout(JsonNode root) {
		JsonNode node = root.path("cacheTimeout");
		if (node.isNumber() && node.asDouble() > 0) {
			return Duration.ofMillis(Math.round(node.asDouble() * 1000));
		}
		return ResolverConfig.DEFAULT_CACHE_TIMEOUT;
	}

	private Map<String, SourceConfig> sources(JsonNode sourcesNode) {
		Map<String, SourceConfig> sources = new LinkedHashMap<>();
		if (!sourcesNode.isObject()) {
			return sources;
		}
		Iterator<Map.Entry<String, JsonNode>> fields = sourcesNode.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			if (!field.getValue().isObject()) {
				throw new ConfigurationException(
						"Failed to load config: source '" + field.getKey() + "' must be a JSON object");
			}
			sources.put(field.getKey(), sourceConfig(field.getKey(), field.getValue()));
		}
		return sources;
	}

	private SourceConfig sourceConfig(String id, JsonNode node) {
		Map<String, Object> options = new LinkedHashMap<>(mapper.convertValue(node, OPTIONS_TYPE));
		Object enabled = options.remove("enabled");
		boolean defaultEnabled = SourceType.fromId(id)
				.map(SourceType::enabledByDefault)
				.orElse(false);
		return new SourceConfig(enabled instanceof Boolean b ? b : defaultEnabled, options);
	}

	/**
	 * The conventional configuration location inside {@code workingDirectory}.
	 */
	public static Path defaultLocation(Path workingDirectory) {
		return Optional.ofNullable(workingDirectory)
				.orElse(Path.of(""))
				.resolve(DEFAULT_FILE_NAME);
	}
}
