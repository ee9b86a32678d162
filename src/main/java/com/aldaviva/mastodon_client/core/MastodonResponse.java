package com.aldaviva.mastodon_client.core;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A decoded successful response, with the HTTP status and headers it came with.
 * @param <T> entity, list of entities, or {@link Boolean}
 */
public final class MastodonResponse<T> {

	private final int status;
	private final Map<String, List<String>> headers;
	private final T data;

	public MastodonResponse(final int status, final Map<String, List<String>> headers, final T data) {
		this.status = status;
		final Map<String, List<String>> caseInsensitiveHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		caseInsensitiveHeaders.putAll(headers);
		this.headers = Collections.unmodifiableMap(caseInsensitiveHeaders);
		this.data = data;
	}

	public int getStatus() {
		return status;
	}

	/**
	 * @return response headers, with case-insensitive names
	 */
	public Map<String, List<String>> getHeaders() {
		return headers;
	}

	/**
	 * @return the first value of the named response header, or <code>null</code> if it was not sent
	 */
	public String getHeader(final String name) {
		final List<String> values = headers.get(name);
		return values == null || values.isEmpty() ? null : values.get(0);
	}

	public T getData() {
		return data;
	}

	@Override
	public String toString() {
		return String.format("MastodonResponse [status=%d, data=%s]", status, data);
	}

}
