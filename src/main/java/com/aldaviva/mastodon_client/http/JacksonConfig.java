package com.aldaviva.mastodon_client.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.ws.rs.ext.ContextResolver;
import jakarta.ws.rs.ext.Provider;

public abstract class JacksonConfig {

	private JacksonConfig() {
	}

	/**
	 * Mastodon adds entity properties between versions, so unknown properties and enum values are tolerated instead of failing the whole response.
	 */
	public static ObjectMapper createObjectMapper() {
		final ObjectMapper objectMapper = new ObjectMapper();
		objectMapper.registerModule(new JavaTimeModule());
		objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		objectMapper.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL);
		objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
		return objectMapper;
	}

	@Provider
	public static class CustomObjectMapperProvider implements ContextResolver<ObjectMapper> {

		public static final ObjectMapper OBJECT_MAPPER = createObjectMapper();

		@Override
		public ObjectMapper getContext(final Class<?> type) {
			return OBJECT_MAPPER;
		}
	}
}
