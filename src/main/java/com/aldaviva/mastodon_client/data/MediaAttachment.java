package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.net.URI;

public final class MediaAttachment {

	public final String id;
	/** {@code image}, {@code gifv}, {@code video}, {@code audio} or {@code unknown} */
	public final String type;
	public final URI url;
	public final URI previewUrl;
	public final URI remoteUrl;
	/** Alt text */
	public final String description;
	public final String blurhash;

	@JsonCreator
	public MediaAttachment(
	    @JsonProperty(value = "id", required = true) @JsonSetter(nulls = Nulls.FAIL) final String id,
	    @JsonProperty(value = "type", required = true) @JsonSetter(nulls = Nulls.FAIL) final String type,
	    @JsonProperty("url") final URI url,
	    @JsonProperty("preview_url") final URI previewUrl,
	    @JsonProperty("remote_url") final URI remoteUrl,
	    @JsonProperty("description") final String description,
	    @JsonProperty("blurhash") final String blurhash) {
		this.id = id;
		this.type = type;
		this.url = url;
		this.previewUrl = previewUrl;
		this.remoteUrl = remoteUrl;
		this.description = description;
		this.blurhash = blurhash;
	}

}
