package com.aldaviva.mastodon_client.http;

import com.aldaviva.mastodon_client.exceptions.MastodonConnectionException;

import java.net.URI;

/**
 * Sends HTTP requests to a Mastodon instance. Implementations do not look at the response body, retry, or throw for non-2xx statuses.
 */
public interface MastodonTransport extends AutoCloseable {

	/**
	 * Perform one HTTP round trip.
	 * @param serverBaseUri root URI of the instance, which the request path is relative to
	 * @param request what to send
	 * @return the response, whatever its status code
	 * @throws MastodonConnectionException if no HTTP response was received
	 */
	TransportResponse send(URI serverBaseUri, TransportRequest request);

	@Override
	void close();

}
