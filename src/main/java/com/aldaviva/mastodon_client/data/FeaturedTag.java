package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.net.URI;
import java.time.LocalDate;

/**
 * A hashtag that a user shows on their profile.
 * @see <a href="https://docs.joinmastodon.org/entities/FeaturedTag/">FeaturedTag</a>
 */
public final class FeaturedTag {

	public final String id;
	public final String name;
	public final URI url;
	public final Integer statusesCount;
	public final LocalDate lastStatusAt;

	@JsonCreator
	public FeaturedTag(
	    @JsonProperty(value = "id", required = true) @JsonSetter(nulls = Nulls.FAIL) final String id,
	    @JsonProperty(value = "name", required = true) @JsonSetter(nulls = Nulls.FAIL) final String name,
	    @JsonProperty("url") final URI url,
	    @JsonProperty("statuses_count") final Integer statusesCount,
	    @JsonProperty("last_status_at") final LocalDate lastStatusAt) {
		this.id = id;
		this.name = name;
		this.url = url;
		this.statusesCount = statusesCount;
		this.lastStatusAt = lastStatusAt;
	}

	@Override
	public String toString() {
		return String.format("FeaturedTag [id=%s, name=%s, statusesCount=%s]", id, name, statusesCount);
	}

}
