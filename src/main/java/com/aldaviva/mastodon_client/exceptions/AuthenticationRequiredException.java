package com.aldaviva.mastodon_client.exceptions;

import com.aldaviva.mastodon_client.core.UserContext;

/**
 * Thrown before any request is sent when an endpoint needs an OAuth 2.0 access token and neither the client context nor the call supplied one.
 */
public class AuthenticationRequiredException extends MastodonException {

	private static final long serialVersionUID = 1L;

	private final UserContext userContext;

	public AuthenticationRequiredException(final UserContext userContext, final String path) {
		super("An OAuth 2.0 access token is required to call " + path + " (" + userContext + ")");
		this.userContext = userContext;
	}

	public UserContext getUserContext() {
		return userContext;
	}

}
