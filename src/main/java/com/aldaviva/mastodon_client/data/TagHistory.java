package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.time.Instant;

/**
 * Usage of a hashtag on one day. The server sends all three values as strings of digits.
 */
public final class TagHistory {

	/** Start of the day, in seconds since the Unix epoch */
	public final String day;
	/** Number of statuses using the tag that day */
	public final String uses;
	/** Number of accounts using the tag that day */
	public final String accounts;

	@JsonCreator
	public TagHistory(
	    @JsonProperty(value = "day", required = true) @JsonSetter(nulls = Nulls.FAIL) final String day,
	    @JsonProperty(value = "uses", required = true) @JsonSetter(nulls = Nulls.FAIL) final String uses,
	    @JsonProperty(value = "accounts", required = true) @JsonSetter(nulls = Nulls.FAIL) final String accounts) {
		this.day = day;
		this.uses = uses;
		this.accounts = accounts;
	}

	public Instant getDayStart() {
		return Instant.ofEpochSecond(Long.parseLong(day));
	}

}
