package org.javai.extparams.resolve;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.javai.extparams.source.SourceResolutionException;
import org.javai.extparams.source.SourceType;

/**
 * Runs adapter {@code resolve} calls on a worker pool so each call can be bounded by its
 * source's resolve timeout. A timeout surfaces as an ordinary {@link SourceResolutionException}.
 */
public class SourceInvoker implements AutoCloseable {

	private final ExecutorService executor;
	private final Map<Duration, TimeLimiter> limiters = new ConcurrentHashMap<>();

	public SourceInvoker() {
		this(Executors.newCachedThreadPool(new BasicThreadFactory.Builder()
				.namingPattern("extparams-source-%d")
				.daemon(true)
				.build()));
	}

	SourceInvoker(ExecutorService executor) {
		this.executor = executor;
	}

	/**
	 * @return the adapter's value, possibly {@code null}
	 * @throws SourceResolutionException on adapter failure, timeout or interruption
	 * @throws RuntimeException any other unchecked exception the adapter raised
	 */
	public String invoke(RegisteredSource registered, String key) {
		Duration timeout = registered.resolveTimeout();
		if (timeout.isZero() || timeout.isNegative()) {
			return registered.source().resolve(key);
		}

		SourceType type = registered.type();
		TimeLimiter limiter = limiters.computeIfAbsent(timeout, SourceInvoker::limiter);
		Future<String> call = executor.submit(() -> registered.source().resolve(key));
		try {
			return limiter.executeFutureSupplier(() -> call);
		}
		catch (TimeoutException e) {
			throw new SourceResolutionException(type, key,
					"Source " + type + " timed out after " + timeout.toMillis() + "ms resolving key '" + key + "'", e);
		}
		catch (InterruptedException e) {
			call.cancel(true);
			Thread.currentThread().interrupt();
			throw new SourceResolutionException(type, key, "Interrupted while resolving key '" + key + "'", e);
		}
		catch (RuntimeException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SourceResolutionException(type, key,
					"Source " + type + " failed resolving key '" + key + "': " + e, e);
		}
	}

	private static TimeLimiter limiter(Duration timeout) {
		return TimeLimiter.of("source-" + timeout.toMillis() + "ms", TimeLimiterConfig.custom()
				.timeoutDuration(timeout)
				.cancelRunningFuture(true)
				.build());
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}
}
