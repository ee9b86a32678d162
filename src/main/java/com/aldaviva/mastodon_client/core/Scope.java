package com.aldaviva.mastodon_client.core;

/**
 * OAuth 2.0 scopes that an access token must have been granted for the server to authorize an endpoint.
 * @see <a href="https://docs.joinmastodon.org/api/oauth-scopes/">OAuth scopes</a>
 */
public enum Scope {

	READ("read"),
	READ_ACCOUNTS("read:accounts"),
	READ_FOLLOWS("read:follows"),
	READ_LISTS("read:lists"),
	READ_STATUSES("read:statuses"),
	WRITE_ACCOUNTS("write:accounts"),
	WRITE_BLOCKS("write:blocks"),
	WRITE_FOLLOWS("write:follows"),
	WRITE_MUTES("write:mutes");

	private final String value;

	Scope(final String value) {
		this.value = value;
	}

	/**
	 * @return the scope as it appears in an OAuth authorization request, like {@code read:accounts}
	 */
	public String getValue() {
		return value;
	}

	@Override
	public String toString() {
		return value;
	}
}
