package org.javai.extparams.source.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.resilience4j.core.IntervalFunction;
import java.io.IOException;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import org.javai.extparams.config.SourceConfig;
import org.javai.extparams.source.SourceResolutionException;
import org.javai.extparams.testsupport.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link HttpSource} over a scripted transport.
 */
@DisplayName("HttpSource")
class HttpSourceTest {

	private final MutableClock clock = new MutableClock();
	private final ScriptedTransport transport = new ScriptedTransport();

	private HttpSource source(HttpSource.Options options) {
		HttpSource source = new HttpSource(options, transport, clock);
		source.initialize();
		return source;
	}

	private static HttpSource.Options options(int retries, boolean cache) {
		return new HttpSource.Options("", Duration.ofSeconds(1), retries, Duration.ZERO, Map.of(),
				null, null, null, cache, Duration.ofMinutes(5));
	}

	@Test
	@DisplayName("whole body is the value without path")
	void wholeBodyIsTheValueWithoutPath() {
		transport.respond(200, "plain-value");

		assertThat(source(options(0, false)).resolve("https://api.example.com/token")).isEqualTo("plain-value");
		assertThat(transport.requests).singleElement()
				.satisfies(r -> assertThat(r.method()).isEqualTo("GET"));
	}

	@Test
	@DisplayName("path is extracted from JSON body")
	void pathIsExtractedFromJsonBody() {
		transport.respond(200, "{\"db\":{\"host\":\"db.local\"}}");

		assertThat(source(options(0, false)).resolve("https://api.example.com/config#db.host"))
				.isEqualTo("db.local");
	}

	@Test
	@DisplayName("path on non JSON body fails")
	void pathOnNonJsonBodyFails() {
		transport.respond(200, "<html/>");

		assertThatThrownBy(() -> source(options(0, false)).resolve("https://api.example.com/page#title"))
				.isInstanceOf(SourceResolutionException.class)
				.hasMessageEndingWith("Response is not JSON, cannot extract path 'title'");
	}

	@Test
	@DisplayName("missing path fails")
	void missingPathFails() {
		transport.respond(200, "{\"a\":1}");

		assertThatThrownBy(() -> source(options(0, false)).resolve("https://api.example.com/x#b"))
				.hasMessageEndingWith("Path 'b' not found in response");
	}

	@Nested
	@DisplayName("Retries")
	class Retries {

		@Test
		@DisplayName("server errors are retried until success")
		void serverErrorsAreRetriedUntilSuccess() {
			transport.respond(503, "busy");
			transport.respond(429, "slow down");
			transport.respond(200, "ok");

			assertThat(source(options(2, false)).resolve("https://api.example.com/v")).isEqualTo("ok");
			assertThat(transport.requests).hasSize(3);
		}

		@Test
		@DisplayName("client errors are not retried")
		void clientErrorsAreNotRetried() {
			transport.respond(404, "missing");

			assertThatThrownBy(() -> source(options(2, false)).resolve("https://api.example.com/v"))
					.isInstanceOf(SourceResolutionException.class)
					.hasMessage("HttpSource failed to resolve key 'https://api.example.com/v': HTTP 404");
			assertThat(transport.requests).hasSize(1);
		}

		@Test
		@DisplayName("exhausted retries report last failure")
		void exhaustedRetriesReportLastFailure() {
			transport.fail(new IOException("connection refused"));
			transport.respond(500, "");
			transport.respond(502, "");

			assertThatThrownBy(() -> source(options(2, false)).resolve("https://api.example.com/v"))
					.hasMessageEndingWith("HTTP 502");
			assertThat(transport.requests).hasSize(3);
		}

		@Test
		@DisplayName("waits 2^n times the base backoff before retry n")
		void backoffDoublesPerRetry() {
			IntervalFunction backoff = HttpSource.backoff(Duration.ofMillis(100));

			assertThat(backoff.apply(1)).isEqualTo(200L);
			assertThat(backoff.apply(2)).isEqualTo(400L);
			assertThat(backoff.apply(3)).isEqualTo(800L);
		}

		@Test
		@DisplayName("a zero base backoff retries without waiting")
		void zeroBackoffDoesNotWait() {
			assertThat(HttpSource.backoff(Duration.ZERO).apply(2)).isZero();
		}

		@Test
		@DisplayName("network error is described")
		void networkErrorIsDescribed() {
			transport.fail(new IOException("connection refused"));

			assertThatThrownBy(() -> source(options(0, false)).resolve("https://api.example.com/v"))
					.hasMessageEndingWith("Network error: connection refused");
		}
	}

	@Nested
	@DisplayName("Caching")
	class Caching {

		@Test
		@DisplayName("response is reused within cache timeout")
		void responseIsReusedWithinCacheTimeout() {
			transport.respond(200, "{\"a\":\"1\",\"b\":\"2\"}");
			HttpSource source = source(options(0, true));

			assertThat(source.resolve("https://api.example.com/x#a")).isEqualTo("1");
			assertThat(source.resolve("https://api.example.com/x#a")).isEqualTo("1");
			assertThat(transport.requests).hasSize(1);
		}

		@Test
		@DisplayName("expired response is fetched again")
		void expiredResponseIsFetchedAgain() {
			transport.respond(200, "first");
			transport.respond(200, "second");
			HttpSource source = source(options(0, true));

			assertThat(source.resolve("https://api.example.com/x")).isEqualTo("first");
			clock.advance(Duration.ofMinutes(5));
			assertThat(source.resolve("https://api.example.com/x")).isEqualTo("second");
		}

		@Test
		@DisplayName("refresh cache drops responses")
		void refreshCacheDropsResponses() {
			transport.respond(200, "first");
			transport.respond(200, "second");
			HttpSource source = source(options(0, true));

			source.resolve("https://api.example.com/x");
			source.refreshCache();

			assertThat(source.resolve("https://api.example.com/x")).isEqualTo("second");
		}
	}

	@Nested
	@DisplayName("Request building")
	class RequestBuilding {

		@Test
		@DisplayName("relative URL joins base URL and carries configured headers")
		void relativeUrlJoinsBaseUrlAndCarriesConfiguredHeaders() {
			HttpSource source = source(HttpSource.Options.from(SourceConfig.enabled(Map.of(
					"baseURL", "https://api.example.com/",
					"headers", Map.of("X-Team", "qa"),
					"auth", Map.of("token", "abc123")))));

			HttpRequest request = source.buildRequest(HttpKey.parse("/config"));

			assertThat(request.uri()).hasToString("https://api.example.com/config");
			assertThat(request.headers().firstValue("X-Team")).contains("qa");
			assertThat(request.headers().firstValue("Authorization")).contains("Bearer abc123");
		}

		@Test
		@DisplayName("basic auth when no token")
		void basicAuthWhenNoToken() {
			HttpSource source = source(HttpSource.Options.from(SourceConfig.enabled(Map.of(
					"auth", Map.of("username", "user", "password", "pass")))));

			HttpRequest request = source.buildRequest(HttpKey.parse("https://api.example.com/x"));

			assertThat(request.headers().firstValue("Authorization")).contains("Basic dXNlcjpwYXNz");
		}

		@Test
		@DisplayName("JSON body gets JSON content type")
		void jsonBodyGetsJsonContentType() {
			HttpSource source = source(options(0, false));

			HttpRequest json = source.buildRequest(HttpKey.parse("POST:https://api.example.com/q:{\"id\":1}"));
			HttpRequest text = source.buildRequest(HttpKey.parse("POST:https://api.example.com/q:id=1"));

			assertThat(json.method()).isEqualTo("POST");
			assertThat(json.headers().firstValue("Content-Type")).contains("application/json");
			assertThat(text.headers().firstValue("Content-Type")).contains("text/plain");
		}

		@Test
		@DisplayName("options to string hides credentials")
		void optionsToStringHidesCredentials() {
			HttpSource.Options options = HttpSource.Options.from(SourceConfig.enabled(Map.of(
					"auth", Map.of("token", "super-secret-token"))));

			assertThat(options.toString()).doesNotContain("super-secret-token").contains("auth=***");
		}
	}

	@Test
	@DisplayName("resolve after cleanup fails")
	void resolveAfterCleanupFails() {
		HttpSource source = source(options(0, false));
		source.cleanup();

		assertThatThrownBy(() -> source.resolve("https://api.example.com/x"))
				.hasMessageEndingWith("HTTP source is not initialized");
	}

	private static final class ScriptedTransport implements HttpTransport {

		private final Deque<Object> script = new ArrayDeque<>();
		private final List<HttpRequest> requests = new ArrayList<>();

		void respond(int status, String body) {
			script.add(new HttpResult(status, body));
		}

		void fail(IOException error) {
			script.add(error);
		}

		@Override
		public HttpResult send(HttpRequest request) throws IOException {
			requests.add(request);
			Object next = script.poll();
			if (next instanceof IOException error) {
				throw error;
			}
			if (next == null) {
				throw new IOException("no scripted response");
			}
			return (HttpResult) next;
		}
	}
}
