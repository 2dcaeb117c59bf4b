package io.gitfort.insights;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A GraphQL response that succeeded at the transport level but carried a non-empty
 * {@code errors} array. Raised even when {@code data} is partially populated so callers
 * can inspect the partial-failure detail; never retried.
 */
public class GraphQLException extends GitHubException {

	private final JsonNode errors;

	private final List<String> messages;

	public GraphQLException(JsonNode errors) {
		this(errors, extractMessages(errors));
	}

	private GraphQLException(JsonNode errors, List<String> messages) {
		super("GraphQL errors: " + String.join("; ", messages));
		this.errors = errors;
		this.messages = messages;
	}

	/**
	 * Returns the raw {@code errors} array exactly as received.
	 * @return the errors node
	 */
	public JsonNode getErrors() {
		return errors;
	}

	/**
	 * Returns the {@code message} of each error, in response order.
	 * @return error messages
	 */
	public List<String> getMessages() {
		return messages;
	}

	private static List<String> extractMessages(JsonNode errors) {
		List<String> messages = new ArrayList<>();
		for (JsonNode error : errors) {
			messages.add(error.path("message").asText(error.toString()));
		}
		return List.copyOf(messages);
	}

}
