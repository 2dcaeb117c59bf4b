package io.gitfort.insights;

/**
 * Snapshot of the request queue for observability.
 *
 * @param queueLength requests waiting to be dispatched (the in-flight one excluded)
 * @param processing whether the drain loop is active
 * @param maxQueueSize capacity above which enqueue is rejected
 */
public record QueueStatus(int queueLength, boolean processing, int maxQueueSize) {
}
