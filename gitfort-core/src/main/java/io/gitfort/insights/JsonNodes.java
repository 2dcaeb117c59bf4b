package io.gitfort.insights;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for reading provider JSON at the service boundary.
 */
final class JsonNodes {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodes.class);

	private JsonNodes() {
	}

	static boolean isAbsent(@Nullable JsonNode node) {
		return node == null || node.isMissingNode() || node.isNull();
	}

	/**
	 * Text value, or null when the field is missing or JSON null.
	 */
	static @Nullable String text(JsonNode node, String field) {
		JsonNode value = node.path(field);
		return isAbsent(value) ? null : value.asText();
	}

	static String text(JsonNode node, String field, String defaultValue) {
		String value = text(node, field);
		return value != null ? value : defaultValue;
	}

	static @Nullable Instant instant(JsonNode node, String field) {
		String value = text(node, field);
		if (value == null || value.isEmpty()) {
			return null;
		}
		try {
			return Instant.parse(value);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse datetime: {}", value);
			return null;
		}
	}

	static List<JsonNode> array(JsonNode node) {
		List<JsonNode> result = new ArrayList<>();
		if (node.isArray()) {
			node.forEach(result::add);
		}
		return result;
	}

}
