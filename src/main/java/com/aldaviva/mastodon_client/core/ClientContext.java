package com.aldaviva.mastodon_client.core;

import com.aldaviva.mastodon_client.http.MastodonTransport;

/**
 * The instance, the user credentials, and the transport that a service sends its requests with. Immutable, so one context can be shared by any number of
 * threads, and several contexts for different users can share one transport.
 */
public final class ClientContext {

	private final MastodonCredentials credentials;
	private final MastodonTransport transport;

	public ClientContext(final MastodonCredentials credentials, final MastodonTransport transport) {
		if (credentials == null || transport == null) {
			throw new IllegalArgumentException("credentials and transport are required");
		}
		this.credentials = credentials;
		this.transport = transport;
	}

	public MastodonCredentials getCredentials() {
		return credentials;
	}

	public MastodonTransport getTransport() {
		return transport;
	}

	public ClientContext withUserAccessToken(final String userAccessToken) {
		return new ClientContext(credentials.withUserAccessToken(userAccessToken), transport);
	}

}
