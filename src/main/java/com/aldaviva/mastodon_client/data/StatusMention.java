package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.net.URI;

public final class StatusMention {

	public final String id;
	public final String username;
	public final String acct;
	public final URI url;

	@JsonCreator
	public StatusMention(
	    @JsonProperty(value = "id", required = true) @JsonSetter(nulls = Nulls.FAIL) final String id,
	    @JsonProperty(value = "username", required = true) @JsonSetter(nulls = Nulls.FAIL) final String username,
	    @JsonProperty(value = "acct", required = true) @JsonSetter(nulls = Nulls.FAIL) final String acct,
	    @JsonProperty("url") final URI url) {
		this.id = id;
		this.username = username;
		this.acct = acct;
		this.url = url;
	}

}
