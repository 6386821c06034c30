package org.javai.extparams.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Time-bounded memoization over a Caffeine cache with write expiry.
 * <p>
 * An entry is served while its age is strictly below the TTL. Expiry is driven by the supplied
 * {@link Clock} and maintenance runs on the calling thread, so there is no background sweep.
 * Concurrent inserts of the same key overwrite each other.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class TtlCache<K, V> {

	private final Cache<K, V> entries;
	private final Duration ttl;

	public TtlCache(Duration ttl) {
		this(ttl, Clock.systemUTC());
	}

	public TtlCache(Duration ttl, Clock clock) {
		this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
		Objects.requireNonNull(clock, "clock must not be null");
		if (ttl.isNegative()) {
			throw new IllegalArgumentException("ttl must not be negative: " + ttl);
		}
		this.entries = Caffeine.newBuilder()
				.expireAfterWrite(ttl)
				.ticker(clockTicker(clock))
				.executor(Runnable::run)
				.build();
	}

	public Optional<V> get(K key) {
		if (key == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(entries.getIfPresent(key));
	}

	public void put(K key, V value) {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(value, "value must not be null");
		entries.put(key, value);
	}

	public void invalidate(K key) {
		if (key != null) {
			entries.invalidate(key);
		}
	}

	public void clear() {
		entries.invalidateAll();
	}

	/**
	 * Number of live entries after pending expiry has been applied.
	 */
	public long size() {
		entries.cleanUp();
		return entries.estimatedSize();
	}

	public Duration ttl() {
		return ttl;
	}

	private static Ticker clockTicker(Clock clock) {
		return () -> {
			Instant now = clock.instant();
			return now.getEpochSecond() * 1_000_000_000L + now.getNano();
		};
	}
}
