package com.aldaviva.mastodon_client.core;

import com.aldaviva.mastodon_client.exceptions.AuthenticationRequiredException;

/**
 * Which credentials an endpoint may be called with.
 */
public enum UserContext {

	/**
	 * The request is always sent without an access token, even if one is configured.
	 */
	ANONYMOUS_ONLY,

	/**
	 * The request must carry a user access token.
	 */
	OAUTH2_ONLY,

	/**
	 * The configured access token is sent if there is one, otherwise the request is anonymous.
	 */
	OAUTH2_OR_ANONYMOUS;

	/**
	 * Choose the access token to send for a request in this context.
	 * @param configuredToken the access token of the client context, or <code>null</code> if the client is anonymous
	 * @param adHocToken an access token passed to a single call, which takes precedence over {@code configuredToken}, or <code>null</code>
	 * @param path the endpoint being called, for the exception message
	 * @return the access token to send, or <code>null</code> to send the request anonymously
	 * @throws AuthenticationRequiredException if this context is {@link #OAUTH2_ONLY} and both tokens are missing
	 */
	public String resolveAccessToken(final String configuredToken, final String adHocToken, final String path) {
		switch (this) {
		case ANONYMOUS_ONLY:
			return null;
		case OAUTH2_OR_ANONYMOUS:
			return isPresent(adHocToken) ? adHocToken : isPresent(configuredToken) ? configuredToken : null;
		case OAUTH2_ONLY:
		default:
			if (isPresent(adHocToken)) {
				return adHocToken;
			} else if (isPresent(configuredToken)) {
				return configuredToken;
			}
			throw new AuthenticationRequiredException(this, path);
		}
	}

	private static boolean isPresent(final String token) {
		return token != null && !token.isBlank();
	}
}
