package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.util.List;

/**
 * How the authenticated user and another account are connected.
 * @see <a href="https://docs.joinmastodon.org/entities/Relationship/">Relationship</a>
 */
public final class Relationship {

	/** ID of the other account */
	public final String id;
	public final Boolean following;
	public final Boolean showingReblogs;
	public final Boolean notifying;
	/** Languages of the other account's statuses that the user receives, or <code>null</code> for all languages */
	public final List<String> languages;
	public final Boolean followedBy;
	public final Boolean blocking;
	public final Boolean blockedBy;
	public final Boolean muting;
	public final Boolean mutingNotifications;
	/** Whether the user has sent a follow request that the other account has not yet approved */
	public final Boolean requested;
	public final Boolean domainBlocking;
	/** Whether the user features the other account on their profile */
	public final Boolean endorsed;
	/** The user's private comment about the other account */
	public final String note;

	@JsonCreator
	public Relationship(
	    @JsonProperty(value = "id", required = true) @JsonSetter(nulls = Nulls.FAIL) final String id,
	    @JsonProperty("following") final Boolean following,
	    @JsonProperty("showing_reblogs") final Boolean showingReblogs,
	    @JsonProperty("notifying") final Boolean notifying,
	    @JsonProperty("languages") final List<String> languages,
	    @JsonProperty("followed_by") final Boolean followedBy,
	    @JsonProperty("blocking") final Boolean blocking,
	    @JsonProperty("blocked_by") final Boolean blockedBy,
	    @JsonProperty("muting") final Boolean muting,
	    @JsonProperty("muting_notifications") final Boolean mutingNotifications,
	    @JsonProperty("requested") final Boolean requested,
	    @JsonProperty("domain_blocking") final Boolean domainBlocking,
	    @JsonProperty("endorsed") final Boolean endorsed,
	    @JsonProperty("note") final String note) {
		this.id = id;
		this.following = following;
		this.showingReblogs = showingReblogs;
		this.notifying = notifying;
		this.languages = languages;
		this.followedBy = followedBy;
		this.blocking = blocking;
		this.blockedBy = blockedBy;
		this.muting = muting;
		this.mutingNotifications = mutingNotifications;
		this.requested = requested;
		this.domainBlocking = domainBlocking;
		this.endorsed = endorsed;
		this.note = note;
	}

	@Override
	public String toString() {
		return String.format("Relationship [id=%s, following=%s, followedBy=%s, blocking=%s, muting=%s, requested=%s]", id, following, followedBy, blocking, muting,
		    requested);
	}

}
