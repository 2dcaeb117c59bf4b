package io.gitfort.insights;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * String-keyed in-memory cache whose entries expire after a per-entry time to live.
 *
 * <p>
 * Backed by a Caffeine {@link Cache} bounded by size, with variable expiry read from a
 * ticker over the injected {@link Clock}. Expired entries are invisible to lookups right
 * away and are physically removed by Caffeine's maintenance, which a scheduled executor
 * triggers at the sweep interval.
 *
 * @param <V> value type
 */
public class ExpiringCache<V> implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ExpiringCache.class);

	public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

	public static final int DEFAULT_MAX_SIZE = 1000;

	public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(1);

	private final Duration defaultTtl;

	private final int maxSize;

	private final Cache<String, Entry<V>> cache;

	private final @Nullable ScheduledExecutorService sweeper;

	public ExpiringCache() {
		this(DEFAULT_TTL, DEFAULT_MAX_SIZE, DEFAULT_SWEEP_INTERVAL, Clock.systemUTC());
	}

	public ExpiringCache(Duration defaultTtl, int maxSize) {
		this(defaultTtl, maxSize, DEFAULT_SWEEP_INTERVAL, Clock.systemUTC());
	}

	/**
	 * Create a cache.
	 * @param defaultTtl time to live of entries stored without an explicit one
	 * @param maxSize maximum number of entries
	 * @param sweepInterval period of the background sweep; zero disables it
	 * @param clock time source
	 */
	public ExpiringCache(Duration defaultTtl, int maxSize, Duration sweepInterval, Clock clock) {
		if (maxSize <= 0) {
			throw new IllegalArgumentException("maxSize must be positive");
		}
		this.defaultTtl = defaultTtl;
		this.maxSize = maxSize;
		this.cache = Caffeine.newBuilder()
			.maximumSize(maxSize)
			.expireAfter(new EntryExpiry<V>())
			.ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
			.executor(Runnable::run)
			.recordStats()
			.build();
		if (sweepInterval.isZero() || sweepInterval.isNegative()) {
			this.sweeper = null;
		}
		else {
			this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
				Thread thread = new Thread(runnable, "gitfort-cache-sweeper");
				thread.setDaemon(true);
				return thread;
			});
			long period = sweepInterval.toMillis();
			this.sweeper.scheduleAtFixedRate(this::sweep, period, period, TimeUnit.MILLISECONDS);
		}
	}

	public @Nullable V get(String key) {
		Entry<V> entry = cache.getIfPresent(key);
		return entry != null ? entry.value() : null;
	}

	public void put(String key, V value) {
		put(key, value, defaultTtl);
	}

	/**
	 * Store a value with its own time to live, replacing any previous value.
	 * @param key cache key
	 * @param value value to store
	 * @param ttl time to live of this entry
	 */
	public void put(String key, V value, Duration ttl) {
		cache.put(key, new Entry<>(value, ttl));
	}

	/**
	 * Whether a live entry exists. Does not count as a lookup in the statistics.
	 */
	public boolean has(String key) {
		return cache.asMap().containsKey(key);
	}

	public boolean delete(String key) {
		return cache.asMap().remove(key) != null;
	}

	public void clear() {
		cache.invalidateAll();
	}

	/**
	 * Remove every entry whose key contains a match of the regular expression.
	 * @param regex pattern searched in each key
	 * @return number of removed entries
	 */
	public int invalidatePattern(String regex) {
		Pattern pattern = Pattern.compile(regex);
		List<String> matching = cache.asMap()
			.keySet()
			.stream()
			.filter(key -> pattern.matcher(key).find())
			.collect(Collectors.toList());
		cache.invalidateAll(matching);
		logger.debug("Invalidated {} cache entries matching {}", matching.size(), regex);
		return matching.size();
	}

	public Stats getStats() {
		CacheStats stats = cache.stats();
		long lookups = stats.requestCount();
		return new Stats(cache.estimatedSize(), maxSize, stats.hitCount(), stats.missCount(),
				lookups > 0 ? (double) stats.hitCount() / lookups : 0.0);
	}

	/**
	 * Run pending maintenance, dropping expired entries and enforcing the size bound.
	 */
	void sweep() {
		long before = cache.estimatedSize();
		cache.cleanUp();
		long removed = before - cache.estimatedSize();
		if (removed > 0) {
			logger.debug("Swept {} cache entries", removed);
		}
	}

	@Override
	public void close() {
		if (sweeper != null) {
			sweeper.shutdownNow();
		}
		cache.invalidateAll();
		cache.cleanUp();
	}

	private record Entry<V>(V value, Duration ttl) {
	}

	private static final class EntryExpiry<V> implements Expiry<String, Entry<V>> {

		@Override
		public long expireAfterCreate(String key, Entry<V> entry, long currentTime) {
			return entry.ttl().toNanos();
		}

		@Override
		public long expireAfterUpdate(String key, Entry<V> entry, long currentTime, long currentDuration) {
			return entry.ttl().toNanos();
		}

		@Override
		public long expireAfterRead(String key, Entry<V> entry, long currentTime, long currentDuration) {
			return currentDuration;
		}

	}

	/**
	 * Cache occupancy and lookup statistics.
	 *
	 * @param size estimated number of entries (expired ones included until swept)
	 * @param maxSize capacity
	 * @param hits successful lookups
	 * @param misses lookups of absent or expired keys
	 * @param hitRate hits / (hits + misses), 0 before the first lookup
	 */
	public record Stats(long size, int maxSize, long hits, long misses, double hitRate) {
	}

}
