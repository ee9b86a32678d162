package com.aldaviva.mastodon_client.exceptions;

import java.net.URI;

/**
 * The request never got an HTTP response: DNS failure, refused or reset connection, TLS handshake failure, timeout.
 */
public class MastodonConnectionException extends MastodonException {

	private static final long serialVersionUID = 1L;

	private final URI uri;

	public MastodonConnectionException(final String method, final URI uri, final Throwable cause) {
		super("Failed to " + method + " " + uri + ": " + cause.getMessage(), cause);
		this.uri = uri;
	}

	public URI getUri() {
		return uri;
	}

}
