package io.gitfort.insights;

/**
 * Configuration properties for GitFort Insights.
 *
 * <p>
 * Covers the request engine, the streak analytics and the secret scanner. Properties can
 * be set directly via setters or passed to {@link GitFortBuilder}. Default values are
 * suitable for a single user token against github.com.
 */
public class GitFortProperties {

	/**
	 * Base URL of the GitHub REST API; the GraphQL endpoint is {@code <apiBaseUrl>/graphql}.
	 */
	private String apiBaseUrl = "https://api.github.com";

	/**
	 * Value of the User-Agent header sent with every request.
	 */
	private String userAgent = "GitFort-Insights/1.0";

	/**
	 * Maximum number of requests waiting in the engine queue.
	 */
	private int maxQueueSize = 100;

	/**
	 * Maximum number of retries for transient failures (attempts = retries + 1).
	 */
	private int maxRetries = 3;

	/**
	 * Base backoff delay in milliseconds, doubled on each retry.
	 */
	private long baseDelayMs = 1000;

	/**
	 * Remaining-quota level at or below which requests are spaced out.
	 */
	private int throttleThreshold = 10;

	/**
	 * Delay in milliseconds inserted between requests while throttling.
	 */
	private long throttleDelayMs = 100;

	/**
	 * Zone in which contribution dates, "today" and weekends are evaluated.
	 */
	private String timeZone = "UTC";

	/**
	 * Number of days of contribution history fetched for streaks.
	 */
	private int streakLookbackDays = 365;

	/**
	 * Hours since the last contribution after which a streak counts as at risk.
	 */
	private double riskThresholdHours = 20;

	/**
	 * Minutes a computed streak summary stays cached.
	 */
	private int streakCacheTtlMinutes = 60;

	/**
	 * Default window in days for build-failure analysis.
	 */
	private int failureWindowDays = 7;

	/**
	 * Maximum size in bytes of a file selected for secret scanning (default: 1MiB).
	 */
	private long maxFileSize = 1048576;

	/**
	 * Maximum number of files scanned per repository.
	 */
	private int maxFiles = 500;

	/**
	 * Risk score at or above which a security alert event is published.
	 */
	private int securityAlertThreshold = 70;

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	/**
	 * Returns the API base URL.
	 * @return the API base URL
	 */
	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	/**
	 * Sets the API base URL.
	 * @param apiBaseUrl the API base URL
	 */
	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	/**
	 * Returns the user agent.
	 * @return the user agent
	 */
	public String getUserAgent() {
		return userAgent;
	}

	/**
	 * Sets the user agent.
	 * @param userAgent the user agent
	 */
	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	/**
	 * Returns the queue capacity.
	 * @return the queue capacity
	 */
	public int getMaxQueueSize() {
		return maxQueueSize;
	}

	/**
	 * Sets the queue capacity.
	 * @param maxQueueSize the queue capacity
	 */
	public void setMaxQueueSize(int maxQueueSize) {
		this.maxQueueSize = maxQueueSize;
	}

	/**
	 * Returns the maximum retries.
	 * @return the maximum retries
	 */
	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * Sets the maximum retries.
	 * @param maxRetries the maximum retries
	 */
	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	/**
	 * Returns the base delay in milliseconds.
	 * @return the base delay in milliseconds
	 */
	public long getBaseDelayMs() {
		return baseDelayMs;
	}

	/**
	 * Sets the base delay in milliseconds.
	 * @param baseDelayMs the base delay in milliseconds
	 */
	public void setBaseDelayMs(long baseDelayMs) {
		this.baseDelayMs = baseDelayMs;
	}

	/**
	 * Returns the throttle threshold.
	 * @return the throttle threshold
	 */
	public int getThrottleThreshold() {
		return throttleThreshold;
	}

	/**
	 * Sets the throttle threshold.
	 * @param throttleThreshold the throttle threshold
	 */
	public void setThrottleThreshold(int throttleThreshold) {
		this.throttleThreshold = throttleThreshold;
	}

	/**
	 * Returns the throttle delay in milliseconds.
	 * @return the throttle delay in milliseconds
	 */
	public long getThrottleDelayMs() {
		return throttleDelayMs;
	}

	/**
	 * Sets the throttle delay in milliseconds.
	 * @param throttleDelayMs the throttle delay in milliseconds
	 */
	public void setThrottleDelayMs(long throttleDelayMs) {
		this.throttleDelayMs = throttleDelayMs;
	}

	/**
	 * Returns the zone id.
	 * @return the zone id
	 */
	public String getTimeZone() {
		return timeZone;
	}

	/**
	 * Sets the zone id.
	 * @param timeZone the zone id
	 */
	public void setTimeZone(String timeZone) {
		this.timeZone = timeZone;
	}

	/**
	 * Returns the lookback in days.
	 * @return the lookback in days
	 */
	public int getStreakLookbackDays() {
		return streakLookbackDays;
	}

	/**
	 * Sets the lookback in days.
	 * @param streakLookbackDays the lookback in days
	 */
	public void setStreakLookbackDays(int streakLookbackDays) {
		this.streakLookbackDays = streakLookbackDays;
	}

	/**
	 * Returns the risk threshold in hours.
	 * @return the risk threshold in hours
	 */
	public double getRiskThresholdHours() {
		return riskThresholdHours;
	}

	/**
	 * Sets the risk threshold in hours.
	 * @param riskThresholdHours the risk threshold in hours
	 */
	public void setRiskThresholdHours(double riskThresholdHours) {
		this.riskThresholdHours = riskThresholdHours;
	}

	/**
	 * Returns the cache time to live in minutes.
	 * @return the cache time to live in minutes
	 */
	public int getStreakCacheTtlMinutes() {
		return streakCacheTtlMinutes;
	}

	/**
	 * Sets the cache time to live in minutes.
	 * @param streakCacheTtlMinutes the cache time to live in minutes
	 */
	public void setStreakCacheTtlMinutes(int streakCacheTtlMinutes) {
		this.streakCacheTtlMinutes = streakCacheTtlMinutes;
	}

	/**
	 * Returns the window in days.
	 * @return the window in days
	 */
	public int getFailureWindowDays() {
		return failureWindowDays;
	}

	/**
	 * Sets the window in days.
	 * @param failureWindowDays the window in days
	 */
	public void setFailureWindowDays(int failureWindowDays) {
		this.failureWindowDays = failureWindowDays;
	}

	/**
	 * Returns the maximum file size in bytes.
	 * @return the maximum file size in bytes
	 */
	public long getMaxFileSize() {
		return maxFileSize;
	}

	/**
	 * Sets the maximum file size in bytes.
	 * @param maxFileSize the maximum file size in bytes
	 */
	public void setMaxFileSize(long maxFileSize) {
		this.maxFileSize = maxFileSize;
	}

	/**
	 * Returns the maximum file count.
	 * @return the maximum file count
	 */
	public int getMaxFiles() {
		return maxFiles;
	}

	/**
	 * Sets the maximum file count.
	 * @param maxFiles the maximum file count
	 */
	public void setMaxFiles(int maxFiles) {
		this.maxFiles = maxFiles;
	}

	/**
	 * Returns the alert threshold.
	 * @return the alert threshold
	 */
	public int getSecurityAlertThreshold() {
		return securityAlertThreshold;
	}

	/**
	 * Sets the alert threshold.
	 * @param securityAlertThreshold the alert threshold
	 */
	public void setSecurityAlertThreshold(int securityAlertThreshold) {
		this.securityAlertThreshold = securityAlertThreshold;
	}

	/**
	 * Returns whether verbose output is enabled.
	 * @return whether verbose output is enabled
	 */
	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * Sets whether verbose output is enabled.
	 * @param verbose whether verbose output is enabled
	 */
	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
