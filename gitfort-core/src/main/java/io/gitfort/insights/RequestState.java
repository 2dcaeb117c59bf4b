package io.gitfort.insights;

/**
 * Lifecycle of a request inside {@link RequestEngine}.
 *
 * <pre>
 * QUEUED -> DISPATCHING -> SUCCEEDED
 *                       -> RATE_LIMITED -> QUEUED (front)
 *                       -> RETRYING     -> QUEUED (front)
 *                       -> FAILED
 * </pre>
 */
public enum RequestState {

	QUEUED, DISPATCHING, SUCCEEDED, RATE_LIMITED, RETRYING, FAILED

}
