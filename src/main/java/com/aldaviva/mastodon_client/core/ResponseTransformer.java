package com.aldaviva.mastodon_client.core;

import com.aldaviva.mastodon_client.exceptions.MastodonApiException;
import com.aldaviva.mastodon_client.exceptions.MastodonDataException;
import com.aldaviva.mastodon_client.http.TransportResponse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import jakarta.ws.rs.core.Response.Status;
import java.util.List;

/**
 * Turns raw HTTP responses into {@link MastodonResponse} results, or throws {@link MastodonApiException} for every non-2xx status.
 */
public class ResponseTransformer {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(ResponseTransformer.class);

	private final ObjectMapper objectMapper;

	public ResponseTransformer(final ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Decode a response whose body is one JSON object.
	 */
	public <T> MastodonResponse<T> transformSingle(final TransportResponse response, final Class<T> entityType) {
		checkStatus(response);
		final T data = decode(response.getBody(), objectMapper.constructType(entityType), entityType);
		return new MastodonResponse<>(response.getStatus(), response.getHeaders(), data);
	}

	/**
	 * Decode a response whose body is a JSON array, keeping the server's order.
	 */
	public <T> MastodonResponse<List<T>> transformMulti(final TransportResponse response, final Class<T> entityType) {
		checkStatus(response);
		final JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, entityType);
		final List<T> data = decode(response.getBody(), listType, entityType);
		return new MastodonResponse<>(response.getStatus(), response.getHeaders(), data);
	}

	/**
	 * For endpoints whose response body carries no information: any 2xx status is {@code true}, regardless of the body.
	 */
	public MastodonResponse<Boolean> evaluate(final TransportResponse response) {
		checkStatus(response);
		return new MastodonResponse<>(response.getStatus(), response.getHeaders(), Boolean.TRUE);
	}

	private <T> T decode(final String body, final JavaType type, final Class<?> entityType) {
		try {
			final T data = objectMapper.readValue(body, type);
			if (data == null) {
				throw MismatchedInputException.from(null, type, "Response body was JSON null");
			}
			return data;
		} catch (final JsonProcessingException e) {
			throw new MastodonDataException(entityType, e);
		}
	}

	/**
	 * @throws MastodonApiException if the response status is not 2xx
	 */
	public void checkStatus(final TransportResponse response) {
		if (response.isSuccessful()) {
			return;
		}

		String error = null;
		String errorDescription = null;
		try {
			final JsonNode errorBody = objectMapper.readTree(response.getBody());
			if (errorBody != null && errorBody.path("error").isTextual()) {
				error = errorBody.path("error").asText();
				errorDescription = errorBody.path("error_description").isTextual() ? errorBody.path("error_description").asText() : null;
			}
		} catch (final JsonProcessingException e) {
			LOGGER.debug("Error response body with status {} is not JSON: {}", response.getStatus(), e.getOriginalMessage());
		}

		if (error == null) {
			error = getGenericMessage(response.getStatus());
		}

		throw new MastodonApiException(response.getStatus(), error, errorDescription);
	}

	static String getGenericMessage(final int status) {
		final Status knownStatus = Status.fromStatusCode(status);
		return knownStatus != null ? "HTTP " + status + " " + knownStatus.getReasonPhrase() : "HTTP " + status;
	}

}
