package org.javai.extparams.source.aws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
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
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.DecryptionFailureException;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.InvalidParameterException;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

/**
 * Resolves keys from AWS Secrets Manager.
 * <p>
 * Key format: see {@link AwsSecretKey}. String secrets are parsed as JSON when possible so a field
 * can be extracted; binary secrets are returned base64 encoded. Secrets are cached per name and
 * version for {@code cacheTimeout}.
 */
public class AwsSecretsSource implements ParamSource {

	private static final String NAME = "AwsSecretsSource";

	private final Options options;
	private final Function<Options, SecretsManagerConnection> connectionFactory;
	private final TtlCache<String, JsonNode> secrets;
	private volatile SecretsManagerConnection connection;

	public AwsSecretsSource(Options options) {
		this(options, SecretsManagerClients::create, Clock.systemUTC());
	}

	public AwsSecretsSource(Options options, Function<Options, SecretsManagerConnection> connectionFactory,
			Clock clock) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory must not be null");
		this.secrets = new TtlCache<>(options.cacheTimeout(), clock);
	}

	@Override
	public SourceType type() {
		return SourceType.AWS;
	}

	@Override
	public void initialize() {
		SecretsManagerConnection created;
		try {
			created = connectionFactory.apply(options);
		}
		catch (SdkException | IllegalArgumentException e) {
			throw new SourceInitializationException(SourceType.AWS,
					"Failed to initialize AWS Secrets Manager: " + e.getMessage(), e);
		}
		try {
			created.client().listSecrets(ListSecretsRequest.builder().maxResults(1).build());
		}
		catch (AwsServiceException e) {
			created.close();
			throw new SourceInitializationException(SourceType.AWS,
					"Failed to initialize AWS Secrets Manager: " + connectionFailure(e), e);
		}
		catch (SdkException e) {
			created.close();
			throw new SourceInitializationException(SourceType.AWS,
					"Failed to initialize AWS Secrets Manager: AWS connection test failed: " + e.getMessage(), e);
		}
		connection = created;
	}

	private static String connectionFailure(AwsServiceException e) {
		String code = errorCode(e);
		if ("UnauthorizedOperation".equals(code) || "AccessDenied".equals(code)
				|| "AccessDeniedException".equals(code)) {
			return "AWS credentials are invalid or insufficient permissions: " + e.getMessage();
		}
		if ("SignatureDoesNotMatch".equals(code)) {
			return "AWS signature validation failed. Check credentials and region.";
		}
		return "AWS connection test failed: " + e.getMessage();
	}

	@Override
	public String resolve(String key) {
		AwsSecretKey parsed = AwsSecretKey.parse(key);
		try {
			String cacheKey = parsed.cacheKey();
			JsonNode secret = secrets.get(cacheKey).orElse(null);
			if (secret == null) {
				secret = fetchSecret(parsed);
				secrets.put(cacheKey, secret);
			}
			return extractField(secret, parsed.field());
		}
		catch (AwsSecretException e) {
			throw SourceResolutionException.failed(SourceType.AWS, NAME, key, e.getMessage(), e.getCause());
		}
	}

	private JsonNode fetchSecret(AwsSecretKey key) {
		GetSecretValueRequest.Builder request = GetSecretValueRequest.builder().secretId(key.secretName());
		if (key.versionId() != null) {
			request.versionId(key.versionId());
		}
		else if (key.versionStage() != null) {
			request.versionStage(key.versionStage());
		}

		GetSecretValueResponse response;
		try {
			response = client().getSecretValue(request.build());
		}
		catch (ResourceNotFoundException e) {
			throw new AwsSecretException("Secret '" + key.secretName() + "' not found", e);
		}
		catch (InvalidParameterException e) {
			throw new AwsSecretException(
					"Invalid parameter for secret '" + key.secretName() + "': " + e.getMessage(), e);
		}
		catch (DecryptionFailureException e) {
			throw new AwsSecretException(
					"Failed to decrypt secret '" + key.secretName() + "'. Check KMS permissions.", e);
		}
		catch (AwsServiceException e) {
			if ("AccessDeniedException".equals(errorCode(e))) {
				throw new AwsSecretException(
						"Access denied to secret '" + key.secretName() + "'. Check IAM permissions.", e);
			}
			throw new AwsSecretException("AWS Secrets Manager error: " + e.getMessage(), e);
		}
		catch (SdkException e) {
			throw new AwsSecretException("AWS Secrets Manager error: " + e.getMessage(), e);
		}

		if (response.secretString() != null) {
			String text = response.secretString();
			return JsonValues.tryParse(text)
					.filter(JsonNode::isContainerNode)
					.orElseGet(() -> TextNode.valueOf(text));
		}
		if (response.secretBinary() != null) {
			return TextNode.valueOf(Base64.getEncoder().encodeToString(response.secretBinary().asByteArray()));
		}
		throw new AwsSecretException("Secret contains no data");
	}

	private static String extractField(JsonNode secret, String field) {
		if (field == null) {
			return JsonValues.render(secret);
		}
		if (!secret.isContainerNode()) {
			throw new AwsSecretException(
					"Cannot extract field '" + field + "' from string secret. Secret must be JSON.");
		}
		return JsonValues.at(secret, field)
				.map(JsonValues::render)
				.orElseThrow(() -> new AwsSecretException("Field '" + field + "' not found in secret"));
	}

	/**
	 * Names and timestamps of up to {@code maxResults} secrets visible to the credentials.
	 */
	public List<SecretSummary> listSecrets(int maxResults) {
		try {
			return client().listSecrets(ListSecretsRequest.builder().maxResults(maxResults).build())
					.secretList().stream()
					.map(s -> new SecretSummary(s.name(), s.arn(), s.description(), s.lastChangedDate(),
							s.lastAccessedDate()))
					.toList();
		}
		catch (SdkException | AwsSecretException e) {
			throw new SourceResolutionException(SourceType.AWS, "*", "Failed to list secrets: " + e.getMessage(), e);
		}
	}

	public boolean secretExists(String secretName) {
		try {
			client().describeSecret(DescribeSecretRequest.builder().secretId(secretName).build());
			return true;
		}
		catch (ResourceNotFoundException e) {
			return false;
		}
		catch (SdkException e) {
			throw new SourceResolutionException(SourceType.AWS, secretName,
					"Failed to check secret: " + e.getMessage(), e);
		}
	}

	public DescribeSecretResponse secretMetadata(String secretName) {
		try {
			return client().describeSecret(DescribeSecretRequest.builder().secretId(secretName).build());
		}
		catch (SdkException e) {
			throw new SourceResolutionException(SourceType.AWS, secretName,
					"Failed to get secret metadata: " + e.getMessage(), e);
		}
	}

	private SecretsManagerClient client() {
		SecretsManagerConnection current = connection;
		if (current == null) {
			throw new AwsSecretException("AWS Secrets Manager client is not initialized");
		}
		return current.client();
	}

	private static String errorCode(AwsServiceException e) {
		return e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
	}

	@Override
	public void refreshCache() {
		secrets.clear();
	}

	@Override
	public void cleanup() {
		secrets.clear();
		SecretsManagerConnection current = connection;
		connection = null;
		if (current != null) {
			current.close();
		}
	}

	public record SecretSummary(String name, String arn, String description, Instant lastChanged,
			Instant lastAccessed) {
	}

	private static final class AwsSecretException extends RuntimeException {

		AwsSecretException(String message) {
			super(message);
		}

		AwsSecretException(String message, Throwable cause) {
			super(message, cause);
		}
	}

	public record Options(String region, String accessKeyId, String secretAccessKey, String sessionToken,
			String profile, String roleArn, Duration timeout, int retries, Duration cacheTimeout) {

		public static final String DEFAULT_REGION = "us-east-1";
		public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5000);
		public static final Duration DEFAULT_CACHE_TIMEOUT = Duration.ofMinutes(5);

		public Options {
			region = StringUtils.defaultIfBlank(region, DEFAULT_REGION);
			timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
			cacheTimeout = cacheTimeout != null ? cacheTimeout : DEFAULT_CACHE_TIMEOUT;
		}

		/**
		 * Reads the options, falling back to the standard {@code AWS_*} variables in
		 * {@code environment} for region, credentials and profile.
		 */
		public static Options from(SourceConfig config, Map<String, String> environment) {
			return new Options(
					config.string("region").orElse(environment.get("AWS_DEFAULT_REGION")),
					config.string("accessKeyId").orElse(environment.get("AWS_ACCESS_KEY_ID")),
					config.string("secretAccessKey").orElse(environment.get("AWS_SECRET_ACCESS_KEY")),
					config.string("sessionToken").orElse(environment.get("AWS_SESSION_TOKEN")),
					config.string("profile").orElse(environment.get("AWS_PROFILE")),
					config.string("roleArn").orElse(null),
					config.millis("timeout", DEFAULT_TIMEOUT),
					config.integer("retries", 2),
					config.seconds("cacheTimeout", DEFAULT_CACHE_TIMEOUT));
		}

		@Override
		public String toString() {
			return "Options[region=" + region + ", profile=" + profile + ", roleArn=" + roleArn + ", timeout="
					+ timeout + ", retries=" + retries + ", credentials="
					+ (accessKeyId != null ? "static" : "default") + "]";
		}
	}
}
