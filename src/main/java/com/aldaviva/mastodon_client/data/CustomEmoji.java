package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.net.URI;

public final class CustomEmoji {

	public final String shortcode;
	public final URI url;
	public final URI staticUrl;
	public final Boolean visibleInPicker;
	public final String category;

	@JsonCreator
	public CustomEmoji(
	    @JsonProperty(value = "shortcode", required = true) @JsonSetter(nulls = Nulls.FAIL) final String shortcode,
	    @JsonProperty(value = "url", required = true) @JsonSetter(nulls = Nulls.FAIL) final URI url,
	    @JsonProperty("static_url") final URI staticUrl,
	    @JsonProperty("visible_in_picker") final Boolean visibleInPicker,
	    @JsonProperty("category") final String category) {
		this.shortcode = shortcode;
		this.url = url;
		this.staticUrl = staticUrl;
		this.visibleInPicker = visibleInPicker;
		this.category = category;
	}

}
