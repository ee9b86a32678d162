package com.aldaviva.mastodon_client.http;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Status, headers and undecoded body of an HTTP response.
 */
public final class TransportResponse {

	private final int status;
	private final Map<String, List<String>> headers;
	private final String body;

	public TransportResponse(final int status, final Map<String, List<String>> headers, final String body) {
		this.status = status;
		this.headers = headers != null ? Collections.unmodifiableMap(headers) : Collections.emptyMap();
		this.body = body != null ? body : "";
	}

	public int getStatus() {
		return status;
	}

	public boolean isSuccessful() {
		return status >= 200 && status < 300;
	}

	public Map<String, List<String>> getHeaders() {
		return headers;
	}

	/**
	 * @return response body text, or an empty string if the response had no body
	 */
	public String getBody() {
		return body;
	}

	@Override
	public String toString() {
		return String.format("TransportResponse [status=%d, body=%s]", status, body);
	}

}
