package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Unformatted profile text and default posting settings, only returned for the authenticated user's own account.
 */
public final class AccountSource {

	public final Visibility privacy;
	public final Boolean sensitive;
	public final String language;
	public final String note;
	public final List<AccountField> fields;
	public final Integer followRequestsCount;

	@JsonCreator
	public AccountSource(
	    @JsonProperty("privacy") final Visibility privacy,
	    @JsonProperty("sensitive") final Boolean sensitive,
	    @JsonProperty("language") final String language,
	    @JsonProperty("note") final String note,
	    @JsonProperty("fields") final List<AccountField> fields,
	    @JsonProperty("follow_requests_count") final Integer followRequestsCount) {
		this.privacy = privacy;
		this.sensitive = sensitive;
		this.language = language;
		this.note = note;
		this.fields = fields;
		this.followRequestsCount = followRequestsCount;
	}

}
