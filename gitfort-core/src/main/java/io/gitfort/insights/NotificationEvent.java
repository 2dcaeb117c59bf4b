package io.gitfort.insights;

import java.time.Instant;
import java.util.Map;

/**
 * An event raised by the analytics, e.g. a streak at risk or a new critical finding.
 * Delivery (email, chat, ...) belongs to the {@link NotificationListener}.
 *
 * @param type event kind
 * @param subject user login or "owner/repo" the event is about
 * @param payload event details (copied, null values not allowed)
 * @param timestamp when the event was raised
 */
public record NotificationEvent(NotificationType type, String subject, Map<String, Object> payload,
		Instant timestamp) {

	public NotificationEvent {
		payload = Map.copyOf(payload);
	}

}
