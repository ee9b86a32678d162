package com.aldaviva.mastodon_client.exceptions;

/**
 * Base class of every failure reported by this client. None of them are retried.
 */
public abstract class MastodonException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	protected MastodonException(final String message) {
		super(message);
	}

	protected MastodonException(final String message, final Throwable cause) {
		super(message, cause);
	}

}
