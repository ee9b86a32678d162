package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

/**
 * A list of accounts whose statuses form a separate timeline.
 * @see <a href="https://docs.joinmastodon.org/entities/List/">List</a>
 */
public final class UserList {

	public final String id;
	public final String title;
	public final RepliesPolicy repliesPolicy;

	@JsonCreator
	public UserList(
	    @JsonProperty(value = "id", required = true) @JsonSetter(nulls = Nulls.FAIL) final String id,
	    @JsonProperty(value = "title", required = true) @JsonSetter(nulls = Nulls.FAIL) final String title,
	    @JsonProperty("replies_policy") final RepliesPolicy repliesPolicy) {
		this.id = id;
		this.title = title;
		this.repliesPolicy = repliesPolicy;
	}

	@Override
	public String toString() {
		return String.format("UserList [id=%s, title=%s]", id, title);
	}

}
