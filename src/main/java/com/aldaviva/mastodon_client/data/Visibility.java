package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Who can see a status.
 */
public enum Visibility {
	@JsonProperty("public") PUBLIC,
	@JsonProperty("unlisted") UNLISTED,
	@JsonProperty("private") PRIVATE,
	@JsonProperty("direct") DIRECT
}
