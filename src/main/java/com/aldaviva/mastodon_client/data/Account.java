package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A user profile and its statistics.
 * @see <a href="https://docs.joinmastodon.org/entities/Account/">Account</a>
 */
public final class Account {

	public final String id;
	public final String username;
	/** {@link #username} for local users, or {@code username@domain} for remote users */
	public final String acct;
	public final String displayName;
	public final Boolean locked;
	public final Boolean bot;
	public final Boolean discoverable;
	public final Boolean group;
	public final Instant createdAt;
	/** Profile bio, as HTML */
	public final String note;
	public final URI url;
	public final URI avatar;
	public final URI avatarStatic;
	public final URI header;
	public final URI headerStatic;
	public final Integer followersCount;
	public final Integer followingCount;
	public final Integer statusesCount;
	public final LocalDate lastStatusAt;
	public final List<CustomEmoji> emojis;
	public final List<AccountField> fields;
	/** Only present when the authenticated user looks up their own account */
	public final AccountSource source;
	/** The account this user has migrated to, if any */
	public final Account moved;

	@JsonCreator
	public Account(
	    @JsonProperty(value = "id", required = true) @JsonSetter(nulls = Nulls.FAIL) final String id,
	    @JsonProperty(value = "username", required = true) @JsonSetter(nulls = Nulls.FAIL) final String username,
	    @JsonProperty("acct") final String acct,
	    @JsonProperty("display_name") final String displayName,
	    @JsonProperty("locked") final Boolean locked,
	    @JsonProperty("bot") final Boolean bot,
	    @JsonProperty("discoverable") final Boolean discoverable,
	    @JsonProperty("group") final Boolean group,
	    @JsonProperty("created_at") final Instant createdAt,
	    @JsonProperty("note") final String note,
	    @JsonProperty("url") final URI url,
	    @JsonProperty("avatar") final URI avatar,
	    @JsonProperty("avatar_static") final URI avatarStatic,
	    @JsonProperty("header") final URI header,
	    @JsonProperty("header_static") final URI headerStatic,
	    @JsonProperty("followers_count") final Integer followersCount,
	    @JsonProperty("following_count") final Integer followingCount,
	    @JsonProperty("statuses_count") final Integer statusesCount,
	    @JsonProperty("last_status_at") final LocalDate lastStatusAt,
	    @JsonProperty("emojis") final List<CustomEmoji> emojis,
	    @JsonProperty("fields") final List<AccountField> fields,
	    @JsonProperty("source") final AccountSource source,
	    @JsonProperty("moved") final Account moved) {
		this.id = id;
		this.username = username;
		this.acct = acct;
		this.displayName = displayName;
		this.locked = locked;
		this.bot = bot;
		this.discoverable = discoverable;
		this.group = group;
		this.createdAt = createdAt;
		this.note = note;
		this.url = url;
		this.avatar = avatar;
		this.avatarStatic = avatarStatic;
		this.header = header;
		this.headerStatic = headerStatic;
		this.followersCount = followersCount;
		this.followingCount = followingCount;
		this.statusesCount = statusesCount;
		this.lastStatusAt = lastStatusAt;
		this.emojis = emojis;
		this.fields = fields;
		this.source = source;
		this.moved = moved;
	}

	@Override
	public String toString() {
		return String.format("Account [id=%s, acct=%s, displayName=%s]", id, acct != null ? acct : username, displayName);
	}

}
