package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @see <a href="https://docs.joinmastodon.org/entities/Preferences/">Preferences</a>
 */
public final class AccountPreferences {

	public final Visibility postingDefaultVisibility;
	public final Boolean postingDefaultSensitive;
	/** ISO 639-1 code, or <code>null</code> if the user has not chosen a default language */
	public final String postingDefaultLanguage;
	public final ExpandMedia readingExpandMedia;
	public final Boolean readingExpandSpoilers;

	@JsonCreator
	public AccountPreferences(
	    @JsonProperty("posting:default:visibility") final Visibility postingDefaultVisibility,
	    @JsonProperty("posting:default:sensitive") final Boolean postingDefaultSensitive,
	    @JsonProperty("posting:default:language") final String postingDefaultLanguage,
	    @JsonProperty("reading:expand:media") final ExpandMedia readingExpandMedia,
	    @JsonProperty("reading:expand:spoilers") final Boolean readingExpandSpoilers) {
		this.postingDefaultVisibility = postingDefaultVisibility;
		this.postingDefaultSensitive = postingDefaultSensitive;
		this.postingDefaultLanguage = postingDefaultLanguage;
		this.readingExpandMedia = readingExpandMedia;
		this.readingExpandSpoilers = readingExpandSpoilers;
	}

}
