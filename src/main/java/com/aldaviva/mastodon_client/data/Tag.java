package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.net.URI;
import java.util.List;

/**
 * A hashtag.
 * @see <a href="https://docs.joinmastodon.org/entities/Tag/">Tag</a>
 */
public final class Tag {

	/** Without the leading {@code #} */
	public final String name;
	public final URI url;
	public final List<TagHistory> history;
	/** Whether the authenticated user follows this tag, or <code>null</code> for anonymous requests */
	public final Boolean following;

	@JsonCreator
	public Tag(
	    @JsonProperty(value = "name", required = true) @JsonSetter(nulls = Nulls.FAIL) final String name,
	    @JsonProperty("url") final URI url,
	    @JsonProperty("history") final List<TagHistory> history,
	    @JsonProperty("following") final Boolean following) {
		this.name = name;
		this.url = url;
		this.history = history;
		this.following = following;
	}

	@Override
	public String toString() {
		return "#" + name;
	}

}
