package org.javai.extparams.source.vault;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.javai.extparams.cache.TtlCache;
import org.javai.extparams.config.SourceConfig;
import org.javai.extparams.source.JsonValues;
import org.javai.extparams.source.ParamSource;
import org.javai.extparams.source.SourceInitializationException;
import org.javai.extparams.source.SourceResolutionException;
import org.javai.extparams.source.SourceType;
import org.javai.extparams.source.http.HttpResult;
import org.javai.extparams.source.http.HttpTransport;
import org.javai.extparams.source.http.JdkHttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves keys from a HashiCorp Vault KV secrets engine over its HTTP API.
 * <p>
 * Key format: {@code path/to/secret} (whole secret as JSON) or {@code path/to/secret:field}, where
 * {@code field} may be a dotted path into the secret data. Both KV v1 and v2 layouts are supported.
 * Secrets are cached per secret path for {@code cacheTimeout}.
 */
public class VaultSource implements ParamSource {

	private static final Logger logger = LoggerFactory.getLogger(VaultSource.class);
	private static final String NAME = "VaultSource";

	/** Active, standby, DR secondary and performance standby all count as reachable. */
	private static final Set<Integer> HEALTHY_STATUSES = Set.of(200, 429, 472, 473);

	private final Options options;
	private final TtlCache<String, JsonNode> secrets;
	private volatile HttpTransport transport;

	public VaultSource(Options options) {
		this(options, null, Clock.systemUTC());
	}

	public VaultSource(Options options, HttpTransport transport, Clock clock) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.transport = transport;
		this.secrets = new TtlCache<>(options.cacheTimeout(), clock);
	}

	@Override
	public SourceType type() {
		return SourceType.VAULT;
	}

	@Override
	public void initialize() {
		if (StringUtils.isBlank(options.token())) {
			throw new SourceInitializationException(SourceType.VAULT,
					"Vault token is required. Set VAULT_TOKEN environment variable or provide in config.");
		}
		if (transport == null) {
			transport = new JdkHttpTransport(options.timeout());
		}
		try {
			testConnection();
		}
		catch (VaultException e) {
			throw new SourceInitializationException(SourceType.VAULT,
					"Failed to initialize Vault client: " + e.getMessage(), e);
		}
	}

	private void testConnection() {
		String healthFailure;
		try {
			HttpResult health = send(get("sys/health"));
			if (HEALTHY_STATUSES.contains(health.statusCode())) {
				return;
			}
			healthFailure = "health check returned HTTP " + health.statusCode();
		}
		catch (VaultException e) {
			healthFailure = e.getMessage();
		}

		logger.debug("Vault health check failed ({}), trying token lookup", healthFailure);
		HttpResult lookup;
		try {
			lookup = send(get("auth/token/lookup-self"));
		}
		catch (VaultException e) {
			throw new VaultException("Vault connection failed: " + healthFailure, e);
		}
		if (!lookup.isSuccess()) {
			throw new VaultException("Vault connection failed: " + healthFailure);
		}
	}

	@Override
	public String resolve(String key) {
		String secretPath = StringUtils.substringBefore(key, ":");
		String field = key.contains(":") ? StringUtils.substringAfter(key, ":") : null;
		try {
			JsonNode secret = secrets.get(secretPath).orElse(null);
			if (secret == null) {
				secret = fetchSecret(secretPath);
				secrets.put(secretPath, secret);
			}
			return extractField(secret, field);
		}
		catch (VaultException e) {
			throw SourceResolutionException.failed(SourceType.VAULT, NAME, key, e.getMessage(), e.getCause());
		}
	}

	JsonNode fetchSecret(String secretPath) {
		boolean v2 = options.isV2();
		String apiPath = v2
				? options.mount() + "/data/" + secretPath
				: options.mount() + "/" + secretPath;

		HttpResult result = send(get(apiPath));
		if (result.statusCode() == 403) {
			throw new VaultException("Access denied to secret '" + secretPath + "'. Check token permissions.");
		}
		if (result.statusCode() == 404) {
			throw new VaultException("Secret not found at path '" + secretPath + "'");
		}
		if (!result.isSuccess()) {
			throw new VaultException("Failed to fetch secret: HTTP " + result.statusCode());
		}

		JsonNode response = JsonValues.tryParse(result.body())
				.orElseThrow(() -> new VaultException("Failed to fetch secret: response is not JSON"));
		JsonNode data = v2 ? response.path("data").path("data") : response.path("data");
		if (data.isMissingNode() || data.isNull()) {
			throw new VaultException("Secret not found at path '" + secretPath + "'");
		}
		return data;
	}

	private static String extractField(JsonNode secret, String field) {
		if (StringUtils.isEmpty(field)) {
			return secret.toString();
		}
		return JsonValues.at(secret, field)
				.map(JsonValues::render)
				.orElseThrow(() -> new VaultException("Field '" + field + "' not found in secret"));
	}

	/**
	 * Keys listed under {@code path}; empty when the path does not exist.
	 */
	public List<String> listSecrets(String path) {
		String listPath = options.isV2()
				? options.mount() + "/metadata/" + StringUtils.defaultString(path)
				: options.mount() + "/" + StringUtils.defaultString(path);
		try {
			HttpResult result = send(get(listPath + "?list=true"));
			if (result.statusCode() == 404) {
				return List.of();
			}
			if (!result.isSuccess()) {
				throw new VaultException("HTTP " + result.statusCode());
			}
			JsonNode keys = JsonValues.tryParse(result.body())
					.map(body -> body.path("data").path("keys"))
					.orElseThrow(() -> new VaultException("response is not JSON"));
			List<String> names = new ArrayList<>();
			keys.forEach(node -> names.add(node.asText()));
			return names;
		}
		catch (VaultException e) {
			throw new SourceResolutionException(SourceType.VAULT, path,
					"Failed to list secrets: " + e.getMessage(), e);
		}
	}

	public boolean secretExists(String secretPath) {
		try {
			fetchSecret(secretPath);
			return true;
		}
		catch (VaultException e) {
			logger.debug("Secret '{}' is not readable: {}", secretPath, e.getMessage());
			return false;
		}
	}

	/**
	 * KV v2 metadata (versions, timestamps) for a secret.
	 */
	public JsonNode secretMetadata(String secretPath) {
		if (!options.isV2()) {
			throw new SourceResolutionException(SourceType.VAULT, secretPath,
					"Secret metadata is only available in KV v2");
		}
		try {
			HttpResult result = send(get(options.mount() + "/metadata/" + secretPath));
			if (!result.isSuccess()) {
				throw new VaultException("HTTP " + result.statusCode());
			}
			return JsonValues.tryParse(result.body())
					.map(body -> body.path("data"))
					.orElseThrow(() -> new VaultException("response is not JSON"));
		}
		catch (VaultException e) {
			throw new SourceResolutionException(SourceType.VAULT, secretPath,
					"Failed to get secret metadata: " + e.getMessage(), e);
		}
	}

	private HttpRequest get(String apiPath) {
		URI uri;
		try {
			uri = URI.create(StringUtils.removeEnd(options.url(), "/") + "/v1/" + apiPath);
		}
		catch (IllegalArgumentException e) {
			throw new VaultException("Invalid Vault address: " + e.getMessage(), e);
		}
		HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
				.timeout(options.timeout())
				.header("X-Vault-Token", options.token())
				.GET();
		if (StringUtils.isNotBlank(options.namespace())) {
			builder.header("X-Vault-Namespace", options.namespace());
		}
		return builder.build();
	}

	private HttpResult send(HttpRequest request) {
		HttpTransport current = transport;
		if (current == null) {
			throw new VaultException("Vault client is not initialized");
		}
		try {
			return current.send(request);
		}
		catch (IOException e) {
			throw new VaultException("Failed to fetch secret: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new VaultException("Request interrupted", e);
		}
	}

	@Override
	public void refreshCache() {
		secrets.clear();
	}

	@Override
	public void cleanup() {
		secrets.clear();
		transport = null;
	}

	private static final class VaultException extends RuntimeException {

		VaultException(String message) {
			super(message);
		}

		VaultException(String message, Throwable cause) {
			super(message, cause);
		}
	}

	public record Options(String url, String token, String namespace, String mount, String version,
			Duration timeout, Duration cacheTimeout) {

		public static final String DEFAULT_URL = "http://localhost:8200";
		public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5000);
		public static final Duration DEFAULT_CACHE_TIMEOUT = Duration.ofMinutes(5);

		public Options {
			url = StringUtils.defaultIfBlank(url, DEFAULT_URL);
			mount = StringUtils.defaultIfBlank(mount, "secret");
			version = StringUtils.defaultIfBlank(version, "v2");
			timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
			cacheTimeout = cacheTimeout != null ? cacheTimeout : DEFAULT_CACHE_TIMEOUT;
		}

		/**
		 * Reads the options, taking the token and namespace from {@code VAULT_TOKEN} and
		 * {@code VAULT_NAMESPACE} in {@code environment} when the configuration leaves them out.
		 */
		public static Options from(SourceConfig config, Map<String, String> environment) {
			return new Options(
					config.string("url", DEFAULT_URL),
					config.string("token").orElse(environment.get("VAULT_TOKEN")),
					config.string("namespace").orElse(environment.get("VAULT_NAMESPACE")),
					config.string("mount", "secret"),
					config.string("version", "v2"),
					config.millis("timeout", DEFAULT_TIMEOUT),
					config.seconds("cacheTimeout", DEFAULT_CACHE_TIMEOUT));
		}

		boolean isV2() {
			return !"v1".equalsIgnoreCase(version);
		}

		@Override
		public String toString() {
			return "Options[url=" + url + ", namespace=" + namespace + ", mount=" + mount + ", version=" + version
					+ ", token=" + (token != null ? "***" : "none") + "]";
		}
	}
}
