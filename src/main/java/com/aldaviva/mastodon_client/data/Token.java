package com.aldaviva.mastodon_client.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import java.time.Instant;

/**
 * An OAuth 2.0 access token.
 * @see <a href="https://docs.joinmastodon.org/entities/Token/">Token</a>
 */
public final class Token {

	public final String accessToken;
	/** Always {@code Bearer} */
	public final String tokenType;
	/** Space-separated list of granted scopes */
	public final String scope;
	public final Instant createdAt;

	@JsonCreator
	public Token(
	    @JsonProperty(value = "access_token", required = true) @JsonSetter(nulls = Nulls.FAIL) final String accessToken,
	    @JsonProperty(value = "token_type", required = true) @JsonSetter(nulls = Nulls.FAIL) final String tokenType,
	    @JsonProperty("scope") final String scope,
	    @JsonProperty("created_at") final Instant createdAt) {
		this.accessToken = accessToken;
		this.tokenType = tokenType;
		this.scope = scope;
		this.createdAt = createdAt;
	}

	@Override
	public String toString() {
		return String.format("Token [tokenType=%s, scope=%s, createdAt=%s]", tokenType, scope, createdAt);
	}

}
