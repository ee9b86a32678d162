package com.aldaviva.mastodon_client.core;

import java.net.URI;

public class MastodonCredentials {

	private final URI serverBaseUri;
	private final String clientKey;
	private final String clientSecret;
	private final String userAccessToken;

	/**
	 * @param serverBaseUri root of the instance, like {@code https://mastodon.social/}
	 * @param clientKey client ID of the registered application, or <code>null</code>
	 * @param clientSecret client secret of the registered application, or <code>null</code>
	 * @param userAccessToken OAuth 2.0 bearer token of the user, or <code>null</code> to make anonymous requests
	 */
	public MastodonCredentials(final URI serverBaseUri, final String clientKey, final String clientSecret, final String userAccessToken) {
		if (serverBaseUri == null) {
			throw new IllegalArgumentException("serverBaseUri is required");
		}
		this.serverBaseUri = serverBaseUri;
		this.clientKey = clientKey;
		this.clientSecret = clientSecret;
		this.userAccessToken = userAccessToken;
	}

	public static MastodonCredentials anonymous(final URI serverBaseUri) {
		return new MastodonCredentials(serverBaseUri, null, null, null);
	}

	public URI getServerBaseUri() {
		return serverBaseUri;
	}

	public String getClientKey() {
		return clientKey;
	}

	public String getClientSecret() {
		return clientSecret;
	}

	public String getUserAccessToken() {
		return userAccessToken;
	}

	public boolean hasUserAccessToken() {
		return userAccessToken != null && !userAccessToken.isBlank();
	}

	/**
	 * @return a copy of these credentials for the same instance and application but a different user, or an anonymous user if {@code userAccessToken} is
	 *         <code>null</code>
	 */
	public MastodonCredentials withUserAccessToken(final String userAccessToken) {
		return new MastodonCredentials(serverBaseUri, clientKey, clientSecret, userAccessToken);
	}

	@Override
	public String toString() {
		return String.format("MastodonCredentials [serverBaseUri=%s, clientKey=%s, userAccessToken=%s]", serverBaseUri, clientKey, hasUserAccessToken() ? "<redacted>" : null);
	}

}
