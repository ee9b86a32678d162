package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.time.Instant;

/**
 * A name and value pair shown in a profile's metadata table. The value may contain HTML.
 */
public final class AccountField {

	public final String name;
	public final String value;
	/** When the server verified that the linked page links back to the profile, or <code>null</code> if it is not verified */
	public final Instant verifiedAt;

	@JsonCreator
	public AccountField(
	    @JsonProperty(value = "name", required = true) @JsonSetter(nulls = Nulls.FAIL) final String name,
	    @JsonProperty(value = "value", required = true) @JsonSetter(nulls = Nulls.FAIL) final String value,
	    @JsonProperty("verified_at") final Instant verifiedAt) {
		this.name = name;
		this.value = value;
		this.verifiedAt = verifiedAt;
	}

}
