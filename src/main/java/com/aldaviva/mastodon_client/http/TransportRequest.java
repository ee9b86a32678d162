package com.aldaviva.mastodon_client.http;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One HTTP request to send to a Mastodon instance, relative to the instance's base URI. Build with {@link #builder(String, String)}.
 */
public final class TransportRequest {

	private final String method;
	private final String path;
	private final Map<String, String> pathParameters;
	private final Map<String, List<String>> queryParameters;
	private final Map<String, Object> jsonBody;
	private final Map<String, File> fileParts;
	private final String accessToken;

	private TransportRequest(final Builder builder) {
		method = builder.method;
		path = builder.path;
		pathParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pathParameters));
		final Map<String, List<String>> query = new LinkedHashMap<>();
		builder.queryParameters.forEach((name, values) -> query.put(name, Collections.unmodifiableList(new ArrayList<>(values))));
		queryParameters = Collections.unmodifiableMap(query);
		jsonBody = builder.jsonBody;
		fileParts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fileParts));
		accessToken = builder.accessToken;
	}

	/**
	 * @param method HTTP verb, one of the {@link jakarta.ws.rs.HttpMethod} constants
	 * @param path path relative to the instance base URI, which may contain <code>{name}</code> templates filled in by {@link Builder#pathParameter}
	 */
	public static Builder builder(final String method, final String path) {
		return new Builder(method, path);
	}

	public String getMethod() {
		return method;
	}

	public String getPath() {
		return path;
	}

	public Map<String, String> getPathParameters() {
		return pathParameters;
	}

	/**
	 * @return query parameters in insertion order. A name can have several values, which are sent as repeated parameters in order.
	 */
	public Map<String, List<String>> getQueryParameters() {
		return queryParameters;
	}

	/**
	 * @return body to serialize as {@code application/json}, or <code>null</code> if the request has no JSON body
	 */
	public Map<String, Object> getJsonBody() {
		return jsonBody;
	}

	/**
	 * @return form field names and files to send as {@code multipart/form-data}, empty if the request is not a multipart upload
	 */
	public Map<String, File> getFileParts() {
		return fileParts;
	}

	public boolean isMultipart() {
		return !fileParts.isEmpty();
	}

	/**
	 * @return bearer token to authenticate with, or <code>null</code> to send the request anonymously
	 */
	public String getAccessToken() {
		return accessToken;
	}

	@Override
	public String toString() {
		return String.format("TransportRequest [method=%s, path=%s, pathParameters=%s, queryParameters=%s, authenticated=%s]", method, path, pathParameters,
		    queryParameters, accessToken != null);
	}

	public static final class Builder {

		private final String method;
		private final String path;
		private final Map<String, String> pathParameters = new LinkedHashMap<>();
		private final Map<String, List<String>> queryParameters = new LinkedHashMap<>();
		private final Map<String, File> fileParts = new LinkedHashMap<>();
		private Map<String, Object> jsonBody;
		private String accessToken;

		private Builder(final String method, final String path) {
			this.method = method;
			this.path = path;
		}

		public Builder pathParameter(final String name, final String value) {
			if (value == null) {
				throw new IllegalArgumentException("Path parameter " + name + " is required");
			}
			pathParameters.put(name, value);
			return this;
		}

		/**
		 * Add a query parameter. Does nothing if {@code value} is <code>null</code>, so that unset optional parameters are not sent at all.
		 */
		public Builder queryParameter(final String name, final Object value) {
			if (value != null) {
				queryParameters.computeIfAbsent(name, key -> new ArrayList<>()).add(String.valueOf(value));
			}
			return this;
		}

		/**
		 * Add one query parameter per value, all with the same name, in iteration order.
		 */
		public Builder queryParameters(final String name, final Iterable<?> values) {
			for (final Object value : values) {
				queryParameter(name, value);
			}
			return this;
		}

		public Builder jsonBody(final Map<String, Object> jsonBody) {
			this.jsonBody = jsonBody;
			return this;
		}

		/**
		 * @throws IllegalArgumentException if {@code file} is not a readable regular file, so that nothing is sent
		 */
		public Builder filePart(final String name, final File file) {
			if (file == null || !file.isFile() || !file.canRead()) {
				throw new IllegalArgumentException("Cannot upload " + file + " as " + name + ": not a readable file");
			}
			fileParts.put(name, file);
			return this;
		}

		public Builder accessToken(final String accessToken) {
			this.accessToken = accessToken;
			return this;
		}

		public TransportRequest build() {
			return new TransportRequest(this);
		}
	}
}
