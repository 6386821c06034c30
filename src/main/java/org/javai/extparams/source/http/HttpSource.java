package org.javai.extparams.source.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.javai.extparams.SecretMasker;
import org.javai.extparams.cache.TtlCache;
import org.javai.extparams.config.SourceConfig;
import org.javai.extparams.source.JsonValues;
import org.javai.extparams.source.ParamSource;
import org.javai.extparams.source.SourceResolutionException;
import org.javai.extparams.source.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves keys by calling HTTP endpoints.
 * <p>
 * Key format: see {@link HttpKey}. Without a path the whole response body is the value; with a
 * path the body is read as JSON and the path extracted. Network errors, 429 and 5xx responses are
 * retried up to {@code retries} times with exponential backoff. Response bodies are cached per key
 * for {@code cacheTimeout}.
 */
public class HttpSource implements ParamSource {

	private static final Logger logger = LoggerFactory.getLogger(HttpSource.class);
	private static final String NAME = "HttpSource";

	private final Options options;
	private final TtlCache<String, String> responses;
	private final Retry retry;
	private volatile HttpTransport transport;

	public HttpSource(Options options) {
		this(options, null, Clock.systemUTC());
	}

	public HttpSource(Options options, HttpTransport transport, Clock clock) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.transport = transport;
		this.responses = new TtlCache<>(options.cacheTimeout(), clock);
		this.retry = retryPolicy(options);
	}

	@Override
	public SourceType type() {
		return SourceType.HTTP;
	}

	@Override
	public void initialize() {
		if (transport == null) {
			transport = new JdkHttpTransport(options.timeout());
		}
	}

	@Override
	public String resolve(String key) {
		HttpKey parsed = HttpKey.parse(key);
		try {
			String body = options.cacheResponses() ? responses.get(key).orElse(null) : null;
			if (body == null) {
				body = fetch(parsed);
				if (options.cacheResponses()) {
					responses.put(key, body);
				}
			}
			return extractValue(body, parsed.path());
		}
		catch (HttpFailure e) {
			throw SourceResolutionException.failed(SourceType.HTTP, NAME, key, e.getMessage(), e.getCause());
		}
	}

	private String fetch(HttpKey key) {
		HttpTransport current = transport;
		if (current == null) {
			throw new HttpFailure("HTTP source is not initialized");
		}
		HttpRequest request = buildRequest(key);
		CheckedSupplier<HttpResult> call = Retry.decorateCheckedSupplier(retry, () -> current.send(request));
		HttpResult result;
		try {
			result = call.get();
		}
		catch (HttpTimeoutException e) {
			throw new HttpFailure("Request timeout after " + options.timeout().toMillis() + "ms", e);
		}
		catch (IOException e) {
			throw new HttpFailure("Network error: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new HttpFailure("Request interrupted", e);
		}
		catch (RuntimeException | Error e) {
			throw e;
		}
		catch (Throwable e) {
			throw new HttpFailure("Request failed: " + e.getMessage(), e);
		}
		if (!result.isSuccess()) {
			throw new HttpFailure("HTTP " + result.statusCode());
		}
		return result.body() != null ? result.body() : "";
	}

	private static Retry retryPolicy(Options options) {
		RetryConfig config = RetryConfig.<HttpResult>custom()
				.maxAttempts(Math.max(0, options.retries()) + 1)
				.intervalFunction(backoff(options.retryBackoff()))
				.retryExceptions(IOException.class)
				.retryOnResult(result -> isRetryable(result.statusCode()))
				.build();
		Retry retry = Retry.of(NAME, config);
		retry.getEventPublisher().onRetry(event -> logger.debug("Retrying request (attempt {} of {}) in {}ms after: {}",
				event.getNumberOfRetryAttempts(), options.retries(), event.getWaitInterval().toMillis(),
				event.getLastThrowable() != null
						? SecretMasker.mask(event.getLastThrowable().getMessage()) : "retryable status"));
		return retry;
	}

	/**
	 * Wait before retry {@code n} (1-based) is {@code 2^n × base}.
	 */
	static IntervalFunction backoff(Duration base) {
		long millis = base.toMillis();
		if (millis < 1) {
			return attempt -> 0L;
		}
		return IntervalFunction.ofExponentialBackoff(2 * millis, 2);
	}

	private static boolean isRetryable(int status) {
		return status == 429 || status >= 500;
	}

	HttpRequest buildRequest(HttpKey key) {
		URI uri;
		try {
			uri = URI.create(resolveUrl(key.url()));
		}
		catch (IllegalArgumentException e) {
			throw new HttpFailure("Request setup error: " + e.getMessage(), e);
		}

		HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(options.timeout());
		options.headers().forEach(builder::header);
		authorizationHeader().ifPresent(value -> builder.header("Authorization", value));

		if (key.body() != null && HttpKey.acceptsBody(key.method())) {
			if (!hasHeader("Content-Type")) {
				boolean json = JsonValues.tryParse(key.body()).map(JsonNode::isContainerNode).orElse(false);
				builder.header("Content-Type", json ? "application/json" : "text/plain");
			}
			builder.method(key.method(), HttpRequest.BodyPublishers.ofString(key.body()));
		}
		else {
			builder.method(key.method(), HttpRequest.BodyPublishers.noBody());
		}
		return builder.build();
	}

	private String resolveUrl(String url) {
		String base = options.baseUrl();
		if (base.isEmpty() || url.contains("://")) {
			return url;
		}
		if (url.isEmpty()) {
			return base;
		}
		return StringUtils.removeEnd(base, "/") + "/" + StringUtils.removeStart(url, "/");
	}

	private Optional<String> authorizationHeader() {
		if (StringUtils.isNotEmpty(options.authToken())) {
			return Optional.of("Bearer " + options.authToken());
		}
		if (StringUtils.isNotEmpty(options.username()) && StringUtils.isNotEmpty(options.password())) {
			String credentials = options.username() + ":" + options.password();
			return Optional.of(
					"Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
		}
		return Optional.empty();
	}

	private boolean hasHeader(String name) {
		return options.headers().keySet().stream().anyMatch(name::equalsIgnoreCase);
	}

	private static String extractValue(String body, String path) {
		if (path == null) {
			return body;
		}
		JsonNode document = JsonValues.tryParse(body)
				.orElseThrow(() -> new HttpFailure("Response is not JSON, cannot extract path '" + path + "'"));
		return JsonValues.at(document, path)
				.map(JsonValues::render)
				.orElseThrow(() -> new HttpFailure("Path '" + path + "' not found in response"));
	}

	@Override
	public void refreshCache() {
		responses.clear();
	}

	@Override
	public void cleanup() {
		responses.clear();
		transport = null;
	}

	private static final class HttpFailure extends RuntimeException {

		HttpFailure(String message) {
			super(message);
		}

		HttpFailure(String message, Throwable cause) {
			super(message, cause);
		}
	}

	public record Options(String baseUrl, Duration timeout, int retries, Duration retryBackoff,
			Map<String, String> headers, String authToken, String username, String password,
			boolean cacheResponses, Duration cacheTimeout) {

		public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(3000);
		public static final Duration DEFAULT_CACHE_TIMEOUT = Duration.ofMinutes(5);

		public Options {
			baseUrl = baseUrl != null ? baseUrl : "";
			timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
			retryBackoff = retryBackoff != null ? retryBackoff : Duration.ofSeconds(1);
			headers = headers != null ? Map.copyOf(headers) : Map.of();
			cacheTimeout = cacheTimeout != null ? cacheTimeout : DEFAULT_CACHE_TIMEOUT;
		}

		public static Options from(SourceConfig config) {
			SourceConfig auth = config.section("auth");
			return new Options(
					config.string("baseURL", ""),
					config.millis("timeout", DEFAULT_TIMEOUT),
					config.integer("retries", 2),
					config.millis("retryBackoff", Duration.ofSeconds(1)),
					config.stringMap("headers"),
					auth.string("token").orElse(null),
					auth.string("username").orElse(null),
					auth.string("password").orElse(null),
					config.bool("cacheResponses", true),
					config.seconds("cacheTimeout", DEFAULT_CACHE_TIMEOUT));
		}

		@Override
		public String toString() {
			return "Options[baseUrl=" + baseUrl + ", timeout=" + timeout + ", retries=" + retries
					+ ", cacheResponses=" + cacheResponses + ", cacheTimeout=" + cacheTimeout
					+ ", auth=" + (authToken != null || username != null ? "***" : "none") + "]";
		}
	}
}
