package org.springaicommunity.github.reporter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Creates the {@link ObjectMapper} shared by the REST service and the findings reader.
 *
 * <p>
 * GitHub uses snake_case keys ({@code html_url}, {@code target_url}), so record
 * components map with {@link PropertyNamingStrategies#SNAKE_CASE}. Unknown keys are
 * ignored because API responses carry far more than the reporter reads, null values are
 * left out of request bodies, and timestamps are written as ISO-8601 strings.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	public static ObjectMapper create() {
		return new ObjectMapper().registerModule(new JavaTimeModule())
			.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
			.setSerializationInclusion(JsonInclude.Include.NON_NULL)
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
	}

}
