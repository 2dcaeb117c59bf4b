package io.gitfort.insights;

/**
 * Receives {@link NotificationEvent}s. Implementations must not throw; failures to deliver
 * are the listener's concern.
 */
@FunctionalInterface
public interface NotificationListener {

	NotificationListener NONE = event -> {
	};

	void onEvent(NotificationEvent event);

}
