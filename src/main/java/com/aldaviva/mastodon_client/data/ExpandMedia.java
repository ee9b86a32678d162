package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether media attachments are shown or hidden by default.
 */
public enum ExpandMedia {
	/** Hide media marked as sensitive */
	@JsonProperty("default") DEFAULT,
	@JsonProperty("show_all") SHOW_ALL,
	@JsonProperty("hide_all") HIDE_ALL
}
