package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.net.URI;
import java.time.Instant;
import java.util.List;

/**
 * A post, or a boost of another post when {@link #reblog} is set.
 * @see <a href="https://docs.joinmastodon.org/entities/Status/">Status</a>
 */
public final class Status {

	public final String id;
	public final Instant createdAt;
	public final Account account;
	public final URI uri;
	public final URI url;
	/** HTML */
	public final String content;
	public final Visibility visibility;
	public final Boolean sensitive;
	public final String spoilerText;
	public final String inReplyToId;
	public final String inReplyToAccountId;
	public final Status reblog;
	public final String language;
	public final Integer repliesCount;
	public final Integer reblogsCount;
	public final Integer favouritesCount;
	public final Instant editedAt;
	public final Boolean favourited;
	public final Boolean reblogged;
	public final Boolean muted;
	public final Boolean bookmarked;
	public final Boolean pinned;
	public final List<MediaAttachment> mediaAttachments;
	public final List<StatusMention> mentions;
	public final List<Tag> tags;
	public final List<CustomEmoji> emojis;

	@JsonCreator
	public Status(
	    @JsonProperty(value = "id", required = true) @JsonSetter(nulls = Nulls.FAIL) final String id,
	    @JsonProperty(value = "created_at", required = true) @JsonSetter(nulls = Nulls.FAIL) final Instant createdAt,
	    @JsonProperty(value = "account", required = true) @JsonSetter(nulls = Nulls.FAIL) final Account account,
	    @JsonProperty("uri") final URI uri,
	    @JsonProperty("url") final URI url,
	    @JsonProperty("content") final String content,
	    @JsonProperty("visibility") final Visibility visibility,
	    @JsonProperty("sensitive") final Boolean sensitive,
	    @JsonProperty("spoiler_text") final String spoilerText,
	    @JsonProperty("in_reply_to_id") final String inReplyToId,
	    @JsonProperty("in_reply_to_account_id") final String inReplyToAccountId,
	    @JsonProperty("reblog") final Status reblog,
	    @JsonProperty("language") final String language,
	    @JsonProperty("replies_count") final Integer repliesCount,
	    @JsonProperty("reblogs_count") final Integer reblogsCount,
	    @JsonProperty("favourites_count") final Integer favouritesCount,
	    @JsonProperty("edited_at") final Instant editedAt,
	    @JsonProperty("favourited") final Boolean favourited,
	    @JsonProperty("reblogged") final Boolean reblogged,
	    @JsonProperty("muted") final Boolean muted,
	    @JsonProperty("bookmarked") final Boolean bookmarked,
	    @JsonProperty("pinned") final Boolean pinned,
	    @JsonProperty("media_attachments") final List<MediaAttachment> mediaAttachments,
	    @JsonProperty("mentions") final List<StatusMention> mentions,
	    @JsonProperty("tags") final List<Tag> tags,
	    @JsonProperty("emojis") final List<CustomEmoji> emojis) {
		this.id = id;
		this.createdAt = createdAt;
		this.account = account;
		this.uri = uri;
		this.url = url;
		this.content = content;
		this.visibility = visibility;
		this.sensitive = sensitive;
		this.spoilerText = spoilerText;
		this.inReplyToId = inReplyToId;
		this.inReplyToAccountId = inReplyToAccountId;
		this.reblog = reblog;
		this.language = language;
		this.repliesCount = repliesCount;
		this.reblogsCount = reblogsCount;
		this.favouritesCount = favouritesCount;
		this.editedAt = editedAt;
		this.favourited = favourited;
		this.reblogged = reblogged;
		this.muted = muted;
		this.bookmarked = bookmarked;
		this.pinned = pinned;
		this.mediaAttachments = mediaAttachments;
		this.mentions = mentions;
		this.tags = tags;
		this.emojis = emojis;
	}

	@Override
	public String toString() {
		return String.format("Status [id=%s, createdAt=%s, account=%s, visibility=%s]", id, createdAt, account, visibility);
	}

}
