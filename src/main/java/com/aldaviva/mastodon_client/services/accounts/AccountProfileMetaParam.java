package com.aldaviva.mastodon_client.services.accounts;

/**
 * One row of the profile metadata table, changed with {@link AccountsV1Service#updateAccount}.
 */
public final class AccountProfileMetaParam {

	private final String name;
	private final String value;

	public AccountProfileMetaParam(final String name, final String value) {
		this.name = name;
		this.value = value;
	}

	public String getName() {
		return name;
	}

	public String getValue() {
		return value;
	}

}
