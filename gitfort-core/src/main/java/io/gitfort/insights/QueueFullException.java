package io.gitfort.insights;

/**
 * Thrown synchronously by {@link RequestEngine#enqueue(GitHubRequest)} when the request
 * queue is at capacity. The engine never retries this; callers should back off and try
 * again later.
 */
public class QueueFullException extends GitHubException {

	private final int maxQueueSize;

	public QueueFullException(int maxQueueSize) {
		super("Request queue is full (" + maxQueueSize + " pending). Please try again later.");
		this.maxQueueSize = maxQueueSize;
	}

	public int getMaxQueueSize() {
		return maxQueueSize;
	}

}
