package io.gitfort.insights;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Serializes every outbound call through one bounded queue so a single process never
 * exceeds the GitHub rate limit and transient failures are retried safely.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Bounded FIFO queue; enqueue beyond capacity fails immediately with
 * {@link QueueFullException}</li>
 * <li>One drain loop on a dedicated scheduler thread, one request in flight at a time</li>
 * <li>Reset-aware suspension: when the tracked quota is exhausted the loop is rescheduled for
 * the reset instant instead of blocking</li>
 * <li>Hard rate limits (403 with remaining=0, 429) wait until reset + 1s and go back to the
 * front of the queue without consuming a retry</li>
 * <li>Exponential backoff ({@code baseDelay * 2^(retry-1)}) for transient errors, re-queued
 * at the front</li>
 * <li>Cooperative throttle once the remaining quota drops to the threshold</li>
 * </ul>
 *
 * <p>
 * Futures are completed on the engine thread; callers that chain heavy work should use the
 * {@code *Async} variants of {@link CompletableFuture}.
 *
 * <pre>
 * {@code
 * RequestEngine engine = RequestEngine.builder()
 *     .wrapping(new GitHubHttpClient(TokenAccessor.of(token)))
 *     .maxQueueSize(100)
 *     .build();
 *
 * CompletableFuture<GitHubResponse> pending = engine.enqueue(GitHubRequest.get("/rate_limit"));
 * GitHubResponse response = engine.execute(GitHubRequest.get("/users/octocat/repos"));
 * }
 * </pre>
 */
public final class RequestEngine implements GitHubClient, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(RequestEngine.class);

	/**
	 * Maximum time to wait for a rate limit reset (1 hour). Longer waits fall back to the
	 * base delay.
	 */
	private static final long MAX_RESET_WAIT_SECONDS = 3600;

	private final GitHubClient delegate;

	private final int maxRetries;

	private final long baseDelayMs;

	private final int maxQueueSize;

	private final int throttleThreshold;

	private final long throttleDelayMs;

	private final int maxRateLimitRequeues;

	private final Clock clock;

	private final ScheduledExecutorService scheduler;

	private final Object lock = new Object();

	// guarded by lock
	private final Deque<QueuedRequest> queue = new ArrayDeque<>();

	// guarded by lock
	private boolean processing;

	// guarded by lock
	private boolean closed;

	private volatile @Nullable RateLimitInfo rateLimitStatus;

	private RequestEngine(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.baseDelayMs = builder.baseDelayMs;
		this.maxQueueSize = builder.maxQueueSize;
		this.throttleThreshold = builder.throttleThreshold;
		this.throttleDelayMs = builder.throttleDelayMs;
		this.maxRateLimitRequeues = builder.maxRateLimitRequeues;
		this.clock = builder.clock;
		this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "gitfort-request-engine");
			thread.setDaemon(true);
			return thread;
		});
	}

	/**
	 * Create a new builder for RequestEngine.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Append a request to the back of the queue.
	 * @param request the request to send
	 * @return future completed with the response, or exceptionally with the terminal error
	 * @throws QueueFullException if the queue already holds {@code maxQueueSize} requests
	 */
	public CompletableFuture<GitHubResponse> enqueue(GitHubRequest request) {
		QueuedRequest queued = new QueuedRequest(request);
		boolean startDrain = false;
		synchronized (lock) {
			if (closed) {
				throw new GitHubException("Request engine is closed");
			}
			if (queue.size() >= maxQueueSize) {
				throw new QueueFullException(maxQueueSize);
			}
			queue.addLast(queued);
			if (!processing) {
				processing = true;
				startDrain = true;
			}
		}
		logger.debug("Queued {} (queue length {})", request.describe(), queueLength());
		if (startDrain) {
			scheduleDrain(0);
		}
		return queued.future;
	}

	/**
	 * Enqueue the request and block until it completes.
	 * @param request the request to send
	 * @return the successful response
	 * @throws GitHubException the typed terminal error of the request
	 */
	@Override
	public GitHubResponse execute(GitHubRequest request) {
		return await(enqueue(request));
	}

	/**
	 * Wait for a future produced by {@link #enqueue}, rethrowing its failure unwrapped so
	 * callers can catch the typed exception.
	 * @param future pending response
	 * @param <T> result type
	 * @return the result
	 */
	static <T> T await(CompletableFuture<T> future) {
		try {
			return future.join();
		}
		catch (CompletionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			if (cause instanceof Error error) {
				throw error;
			}
			throw new GitHubException("Request failed", cause != null ? cause : e);
		}
	}

	/**
	 * Returns the current queue snapshot.
	 * @return queue length, drain state and capacity
	 */
	public QueueStatus getQueueStatus() {
		synchronized (lock) {
			return new QueueStatus(queue.size(), processing, maxQueueSize);
		}
	}

	/**
	 * Returns the rate limit observed on the most recent response, or null before the first
	 * response carrying rate limit headers.
	 * @return last observed RateLimitInfo, or null
	 */
	public @Nullable RateLimitInfo getRateLimitStatus() {
		return rateLimitStatus;
	}

	/**
	 * Stop the drain loop and fail every queued request.
	 */
	@Override
	public void close() {
		List<QueuedRequest> pending;
		synchronized (lock) {
			if (closed) {
				return;
			}
			closed = true;
			processing = false;
			pending = new ArrayList<>(queue);
			queue.clear();
		}
		scheduler.shutdownNow();
		for (QueuedRequest request : pending) {
			request.state = RequestState.FAILED;
			request.future.completeExceptionally(new GitHubException("Request engine closed"));
		}
		if (!pending.isEmpty()) {
			logger.warn("Request engine closed with {} pending requests", pending.size());
		}
	}

	private void scheduleDrain(long delayMs) {
		try {
			if (delayMs <= 0) {
				scheduler.execute(this::drain);
			}
			else {
				scheduler.schedule(this::drain, delayMs, TimeUnit.MILLISECONDS);
			}
		}
		catch (RejectedExecutionException e) {
			logger.debug("Drain not scheduled, engine is shut down");
		}
	}

	private void drain() {
		long waitMs = millisUntilReset();
		if (waitMs > 0) {
			logger.info("Rate limit exhausted. Pausing queue for {}ms until reset", waitMs);
			scheduleDrain(waitMs);
			return;
		}

		QueuedRequest next;
		synchronized (lock) {
			if (closed) {
				return;
			}
			next = queue.pollFirst();
			if (next == null) {
				processing = false;
				return;
			}
		}

		long delay;
		try {
			delay = dispatch(next);
		}
		catch (RuntimeException e) {
			logger.error("Unexpected failure dispatching {}: {}", next.request.describe(), e.getMessage());
			fail(next, e);
			delay = 0;
		}
		scheduleDrain(delay);
	}

	/**
	 * Dispatch one request and decide what happens next.
	 * @return delay before the next drain step
	 */
	private long dispatch(QueuedRequest next) {
		next.state = RequestState.DISPATCHING;
		String description = next.request.describe();
		try {
			GitHubResponse response = delegate.execute(next.request);
			observe(response.rateLimit());
			next.state = RequestState.SUCCEEDED;
			next.future.complete(response);
			return throttleDelay(description);
		}
		catch (GitHubApiException e) {
			observe(e.getRateLimit());
			if (e.isRateLimitError()) {
				return handleRateLimit(next, new RateLimitExceededException(e.getResetEpochSeconds(), e));
			}
			if (e.isPermanent()) {
				logger.debug("{} failed permanently: {}", description, e.getMessage());
				return fail(next, e);
			}
			return retryOrFail(next, e);
		}
		catch (TokenInvalidException e) {
			logger.error("{} rejected: {}", description, e.getMessage());
			return fail(next, e);
		}
		catch (GitHubException e) {
			return fail(next, e);
		}
		catch (RuntimeException e) {
			return retryOrFail(next, new GitHubApiException("Request failed: " + e.getMessage(), e));
		}
	}

	private long handleRateLimit(QueuedRequest next, RateLimitExceededException signal) {
		String description = next.request.describe();
		if (next.rateLimitRequeues >= maxRateLimitRequeues) {
			logger.error("{} still rate limited after {} waits", description, next.rateLimitRequeues);
			return fail(next, (GitHubApiException) signal.getCause());
		}
		next.rateLimitRequeues++;
		next.state = RequestState.RATE_LIMITED;
		long waitMs = computeResetWait(signal.getResetEpochSeconds());
		logger.warn("{}: {}. Re-queued at front, waiting {}ms", description, signal.getMessage(), waitMs);
		requeueFront(next);
		return waitMs;
	}

	private long retryOrFail(QueuedRequest next, GitHubApiException e) {
		String description = next.request.describe();
		if (next.retryCount < maxRetries) {
			next.retryCount++;
			long delay = baseDelayMs * (1L << (next.retryCount - 1));
			next.state = RequestState.RETRYING;
			logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, next.retryCount,
					maxRetries + 1, e.getMessage(), delay);
			requeueFront(next);
			return delay;
		}
		logger.error("{} failed after {} attempts", description, maxRetries + 1);
		return fail(next, e);
	}

	private long fail(QueuedRequest next, RuntimeException e) {
		next.state = RequestState.FAILED;
		next.future.completeExceptionally(e);
		return 0;
	}

	private void requeueFront(QueuedRequest request) {
		synchronized (lock) {
			if (closed) {
				request.state = RequestState.FAILED;
				request.future.completeExceptionally(new GitHubException("Request engine closed"));
				return;
			}
			request.state = RequestState.QUEUED;
			queue.addFirst(request);
		}
	}

	private void observe(@Nullable RateLimitInfo info) {
		if (info != null) {
			this.rateLimitStatus = info;
		}
	}

	/**
	 * Pause before the next dispatch while the tracked quota is exhausted. A single pause
	 * never exceeds one hour; the status is checked again when it ends.
	 */
	long millisUntilReset() {
		RateLimitInfo info = rateLimitStatus;
		if (info == null || info.remaining() > 0) {
			return 0;
		}
		long waitMs = Math.max(0, info.reset() * 1000 - clock.millis());
		return Math.min(waitMs, MAX_RESET_WAIT_SECONDS * 1000);
	}

	/**
	 * Wait until exactly the reset second (+1s buffer). Unknown, past or distant resets fall
	 * back to the base delay.
	 */
	private long computeResetWait(long resetEpochSeconds) {
		if (resetEpochSeconds > 0) {
			long waitMs = resetEpochSeconds * 1000 - clock.millis() + 1000;
			if (waitMs > 0 && waitMs <= MAX_RESET_WAIT_SECONDS * 1000) {
				return waitMs;
			}
			if (waitMs > MAX_RESET_WAIT_SECONDS * 1000) {
				logger.warn("Rate limit reset is {} seconds away (> 1hr), using base delay instead", waitMs / 1000);
			}
		}
		return baseDelayMs;
	}

	private long throttleDelay(String description) {
		RateLimitInfo info = rateLimitStatus;
		if (info != null && info.remaining() <= throttleThreshold) {
			logger.debug("Throttling: {}/{} remaining, sleeping {}ms ({})", info.remaining(), info.limit(),
					throttleDelayMs, description);
			return throttleDelayMs;
		}
		return 0;
	}

	private int queueLength() {
		synchronized (lock) {
			return queue.size();
		}
	}

	/**
	 * A request owned by the engine queue. Only the drain thread mutates it after enqueue.
	 */
	private static final class QueuedRequest {

		private final GitHubRequest request;

		private final CompletableFuture<GitHubResponse> future = new CompletableFuture<>();

		private int retryCount;

		private int rateLimitRequeues;

		private volatile RequestState state = RequestState.QUEUED;

		private QueuedRequest(GitHubRequest request) {
			this.request = request;
		}

	}

	/**
	 * Builder for {@link RequestEngine}.
	 *
	 * <p>
	 * Provides the defaults:
	 * <ul>
	 * <li>maxRetries: 3</li>
	 * <li>baseDelay: 1 second</li>
	 * <li>maxQueueSize: 100</li>
	 * <li>throttleThreshold: 10 remaining requests, throttleDelay: 100ms</li>
	 * <li>maxRateLimitRequeues: 5</li>
	 * </ul>
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private int maxRetries = 3;

		private long baseDelayMs = 1000;

		private int maxQueueSize = 100;

		private int throttleThreshold = 10;

		private long throttleDelayMs = 100;

		private int maxRateLimitRequeues = 5;

		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		/**
		 * Set the transport the engine dispatches through.
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Apply the engine settings of a properties bean.
		 * @param properties configuration
		 * @return this builder
		 */
		public Builder properties(GitFortProperties properties) {
			this.maxRetries = properties.getMaxRetries();
			this.baseDelayMs = properties.getBaseDelayMs();
			this.maxQueueSize = properties.getMaxQueueSize();
			this.throttleThreshold = properties.getThrottleThreshold();
			this.throttleDelayMs = properties.getThrottleDelayMs();
			return this;
		}

		/**
		 * Set the maximum number of retry attempts for transient failures.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the base backoff delay.
		 * @param delay first retry delay, doubled on each subsequent retry (default: 1s)
		 * @return this builder
		 */
		public Builder baseDelay(Duration delay) {
			this.baseDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the base backoff delay in milliseconds.
		 * @param delayMs first retry delay (default: 1000)
		 * @return this builder
		 */
		public Builder baseDelayMs(long delayMs) {
			this.baseDelayMs = delayMs;
			return this;
		}

		/**
		 * Set the queue capacity.
		 * @param maxQueueSize maximum pending requests (default: 100)
		 * @return this builder
		 */
		public Builder maxQueueSize(int maxQueueSize) {
			this.maxQueueSize = maxQueueSize;
			return this;
		}

		/**
		 * Set the remaining-quota threshold at or below which the throttle delay applies.
		 * @param threshold remaining requests (default: 10)
		 * @return this builder
		 */
		public Builder throttleThreshold(int threshold) {
			this.throttleThreshold = threshold;
			return this;
		}

		/**
		 * Set the delay inserted after each successful dispatch while throttling.
		 * @param delayMs delay in milliseconds (default: 100)
		 * @return this builder
		 */
		public Builder throttleDelayMs(long delayMs) {
			this.throttleDelayMs = delayMs;
			return this;
		}

		/**
		 * Set how many hard rate-limit waits a single request may go through before it is
		 * failed.
		 * @param requeues maximum waits (default: 5)
		 * @return this builder
		 */
		public Builder maxRateLimitRequeues(int requeues) {
			this.maxRateLimitRequeues = requeues;
			return this;
		}

		/**
		 * Set the clock used to compare against rate limit reset times.
		 * @param clock time source (default: system UTC)
		 * @return this builder
		 */
		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * Build the RequestEngine.
		 * @return configured RequestEngine
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RequestEngine build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (baseDelayMs <= 0) {
				throw new IllegalStateException("baseDelay must be positive");
			}
			if (maxQueueSize <= 0) {
				throw new IllegalStateException("maxQueueSize must be positive");
			}
			return new RequestEngine(this);
		}

	}

}
