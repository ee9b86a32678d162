package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Which replies a list shows.
 */
public enum RepliesPolicy {
	/** Replies to any followed user */
	@JsonProperty("followed") FOLLOWED,
	/** Replies to members of the list */
	@JsonProperty("list") LIST,
	@JsonProperty("none") NONE
}
