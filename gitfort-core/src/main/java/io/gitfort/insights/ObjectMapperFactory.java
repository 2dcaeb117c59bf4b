package io.gitfort.insights;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Creates the {@link ObjectMapper}s used to build request bodies and to render reports.
 *
 * <p>
 * The report mapper writes snake_case keys and ISO-8601 timestamps, matching the field
 * naming of the GitHub REST API (e.g.&nbsp;{@code currentStreak} &rarr;
 * {@code current_streak}).
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Mapper for request bodies and response trees. Property names are left untouched so
	 * GraphQL variables keep their spelling.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		return mapper;
	}

	/**
	 * Mapper for rendering results as snake_case JSON.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper createForReports() {
		ObjectMapper mapper = create();
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		mapper.enable(SerializationFeature.INDENT_OUTPUT);
		mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
		return mapper;
	}

}
