package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.util.List;

/**
 * Accounts that both follow a given account and are followed by the authenticated user.
 */
public final class FamiliarFollower {

	/** ID of the account that was looked up */
	public final String id;
	public final List<Account> accounts;

	@JsonCreator
	public FamiliarFollower(
	    @JsonProperty(value = "id", required = true) @JsonSetter(nulls = Nulls.FAIL) final String id,
	    @JsonProperty("accounts") final List<Account> accounts) {
		this.id = id;
		this.accounts = accounts;
	}

}
