package org.javai.extparams.source.k8s;

import com.fasterxml.jackson.databind.JsonNode;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.apache.commons.lang3.StringUtils;
import org.javai.extparams.cache.TtlCache;
import org.javai.extparams.config.SourceConfig;
import org.javai.extparams.source.JsonValues;
import org.javai.extparams.source.ParamSource;
import org.javai.extparams.source.SourceInitializationException;
import org.javai.extparams.source.SourceResolutionException;
import org.javai.extparams.source.SourceType;

/**
 * Resolves keys from Kubernetes secrets and config maps.
 * <p>
 * Key format: see {@link K8sKey}. Secret data is base64 decoded. Without a field the whole data
 * map is returned as JSON. Secrets and config maps are cached separately per
 * {@code type:namespace:name} for {@code cacheTimeout} (two minutes by default).
 */
public class K8sSource implements ParamSource {

	private static final String NAME = "K8sSource";

	private final Options options;
	private final Function<Options, KubernetesResourceReader> readerFactory;
	private final TtlCache<String, JsonNode> secretCache;
	private final TtlCache<String, JsonNode> configMapCache;
	private volatile KubernetesResourceReader reader;

	public K8sSource(Options options) {
		this(options, Fabric8ResourceReader::connect, Clock.systemUTC());
	}

	public K8sSource(Options options, Function<Options, KubernetesResourceReader> readerFactory, Clock clock) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.readerFactory = Objects.requireNonNull(readerFactory, "readerFactory must not be null");
		this.secretCache = new TtlCache<>(options.cacheTimeout(), clock);
		this.configMapCache = new TtlCache<>(options.cacheTimeout(), clock);
	}

	@Override
	public SourceType type() {
		return SourceType.K8S;
	}

	@Override
	public void initialize() {
		KubernetesResourceReader created;
		try {
			created = readerFactory.apply(options);
		}
		catch (KubernetesClientException e) {
			throw new SourceInitializationException(SourceType.K8S,
					"Failed to initialize Kubernetes client: " + e.getMessage(), e);
		}
		try {
			created.verifyConnection();
		}
		catch (KubernetesClientException e) {
			created.close();
			throw new SourceInitializationException(SourceType.K8S,
					"Failed to initialize Kubernetes client: " + connectionFailure(e), e);
		}
		reader = created;
	}

	private static String connectionFailure(KubernetesClientException e) {
		if (e.getCode() == 401) {
			return "Kubernetes authentication failed. Check credentials.";
		}
		if (e.getCode() == 403) {
			return "Kubernetes authorization failed. Check RBAC permissions.";
		}
		return "Kubernetes connection test failed: " + e.getMessage();
	}

	@Override
	public String resolve(String key) {
		try {
			K8sKey parsed = K8sKey.parse(key);
			String namespace = parsed.namespace() != null ? parsed.namespace() : options.namespace();
			JsonNode data = switch (parsed.type()) {
				case "secret" -> secretData(namespace, parsed.name());
				case "configmap" -> configMapData(namespace, parsed.name());
				default -> throw new K8sException("Unsupported Kubernetes resource type: " + parsed.type()
						+ ". Supported types: secret, configmap");
			};
			return extractField(data, parsed.field());
		}
		catch (IllegalArgumentException | K8sException e) {
			throw SourceResolutionException.failed(SourceType.K8S, NAME, key, e.getMessage(), e.getCause());
		}
	}

	private JsonNode secretData(String namespace, String name) {
		String cacheKey = "secret:" + namespace + ":" + name;
		JsonNode cached = secretCache.get(cacheKey).orElse(null);
		if (cached != null) {
			return cached;
		}
		Secret secret;
		try {
			secret = reader().readSecret(namespace, name);
		}
		catch (KubernetesClientException e) {
			throw apiFailure(e, "secret", "Secret", name, namespace);
		}
		if (secret == null) {
			throw new K8sException("Secret '" + name + "' not found in namespace '" + namespace + "'");
		}
		if (secret.getData() == null) {
			throw new K8sException("Secret '" + name + "' in namespace '" + namespace + "' has no data");
		}
		Map<String, String> decoded = new LinkedHashMap<>();
		secret.getData().forEach((field, encoded) -> decoded.put(field, decode(encoded, field)));
		JsonNode data = JsonValues.MAPPER.valueToTree(decoded);
		secretCache.put(cacheKey, data);
		return data;
	}

	private JsonNode configMapData(String namespace, String name) {
		String cacheKey = "configmap:" + namespace + ":" + name;
		JsonNode cached = configMapCache.get(cacheKey).orElse(null);
		if (cached != null) {
			return cached;
		}
		ConfigMap configMap;
		try {
			configMap = reader().readConfigMap(namespace, name);
		}
		catch (KubernetesClientException e) {
			throw apiFailure(e, "ConfigMap", "ConfigMap", name, namespace);
		}
		if (configMap == null) {
			throw new K8sException("ConfigMap '" + name + "' not found in namespace '" + namespace + "'");
		}
		if (configMap.getData() == null) {
			throw new K8sException("ConfigMap '" + name + "' in namespace '" + namespace + "' has no data");
		}
		JsonNode data = JsonValues.MAPPER.valueToTree(configMap.getData());
		configMapCache.put(cacheKey, data);
		return data;
	}

	private static K8sException apiFailure(KubernetesClientException e, String lowerKind, String kind, String name,
			String namespace) {
		if (e.getCode() == 404) {
			return new K8sException(kind + " '" + name + "' not found in namespace '" + namespace + "'", e);
		}
		if (e.getCode() == 403) {
			return new K8sException("Access denied to " + lowerKind + " '" + name + "' in namespace '" + namespace
					+ "'. Check RBAC permissions.", e);
		}
		return new K8sException("Failed to fetch " + kind + ": " + e.getMessage(), e);
	}

	private static String decode(String encoded, String field) {
		if (encoded == null) {
			return "";
		}
		try {
			return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
		}
		catch (IllegalArgumentException e) {
			throw new K8sException("Secret field '" + field + "' is not valid base64", e);
		}
	}

	private static String extractField(JsonNode data, String field) {
		if (field == null) {
			return data.toString();
		}
		return JsonValues.at(data, field)
				.map(JsonValues::render)
				.orElseThrow(() -> new K8sException("Field '" + field + "' not found in resource data"));
	}

	/**
	 * Secrets in {@code namespace}, or the configured namespace when {@code null}. Data values are
	 * not included, only their keys.
	 */
	public List<ResourceSummary> listSecrets(String namespace) {
		String target = StringUtils.defaultIfBlank(namespace, options.namespace());
		try {
			return reader().listSecrets(target).stream()
					.map(s -> summary(s, s.getType(), s.getData()))
					.toList();
		}
		catch (KubernetesClientException | K8sException e) {
			throw new SourceResolutionException(SourceType.K8S, target, "Failed to list secrets: " + e.getMessage(), e);
		}
	}

	public List<ResourceSummary> listConfigMaps(String namespace) {
		String target = StringUtils.defaultIfBlank(namespace, options.namespace());
		try {
			return reader().listConfigMaps(target).stream()
					.map(c -> summary(c, null, c.getData()))
					.toList();
		}
		catch (KubernetesClientException | K8sException e) {
			throw new SourceResolutionException(SourceType.K8S, target,
					"Failed to list ConfigMaps: " + e.getMessage(), e);
		}
	}

	public List<String> listNamespaces() {
		try {
			return reader().listNamespaces().stream()
					.map(n -> n.getMetadata().getName())
					.toList();
		}
		catch (KubernetesClientException | K8sException e) {
			throw new SourceResolutionException(SourceType.K8S, "*", "Failed to list namespaces: " + e.getMessage(), e);
		}
	}

	public boolean resourceExists(String type, String name, String namespace) {
		String target = StringUtils.defaultIfBlank(namespace, options.namespace());
		try {
			return switch (type) {
				case "secret" -> reader().readSecret(target, name) != null;
				case "configmap" -> reader().readConfigMap(target, name) != null;
				default -> throw new IllegalArgumentException("Unsupported resource type: " + type);
			};
		}
		catch (KubernetesClientException e) {
			if (e.getCode() == 404) {
				return false;
			}
			throw new SourceResolutionException(SourceType.K8S, name, "Failed to check resource: " + e.getMessage(), e);
		}
	}

	private static ResourceSummary summary(HasMetadata resource, String type, Map<String, String> data) {
		return new ResourceSummary(resource.getMetadata().getName(), resource.getMetadata().getNamespace(), type,
				data != null ? List.copyOf(data.keySet()) : List.of(),
				resource.getMetadata().getCreationTimestamp());
	}

	private KubernetesResourceReader reader() {
		KubernetesResourceReader current = reader;
		if (current == null) {
			throw new K8sException("Kubernetes client is not initialized");
		}
		return current;
	}

	@Override
	public void refreshCache() {
		secretCache.clear();
		configMapCache.clear();
	}

	@Override
	public void cleanup() {
		refreshCache();
		KubernetesResourceReader current = reader;
		reader = null;
		if (current != null) {
			current.close();
		}
	}

	public record ResourceSummary(String name, String namespace, String type, List<String> dataKeys,
			String creationTime) {
	}

	private static final class K8sException extends RuntimeException {

		K8sException(String message) {
			super(message);
		}

		K8sException(String message, Throwable cause) {
			super(message, cause);
		}
	}

	public record Options(String kubeconfig, String namespace, String context, Duration timeout,
			Duration cacheTimeout) {

		public static final String DEFAULT_NAMESPACE = "default";
		public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5000);
		public static final Duration DEFAULT_CACHE_TIMEOUT = Duration.ofMinutes(2);

		public Options {
			namespace = StringUtils.defaultIfBlank(namespace, DEFAULT_NAMESPACE);
			timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
			cacheTimeout = cacheTimeout != null ? cacheTimeout : DEFAULT_CACHE_TIMEOUT;
		}

		public static Options from(SourceConfig config) {
			return new Options(
					config.string("kubeconfig").orElse(null),
					config.string("namespace", DEFAULT_NAMESPACE),
					config.string("context").orElse(null),
					config.millis("timeout", DEFAULT_TIMEOUT),
					config.seconds("cacheTimeout", DEFAULT_CACHE_TIMEOUT));
		}
	}
}
