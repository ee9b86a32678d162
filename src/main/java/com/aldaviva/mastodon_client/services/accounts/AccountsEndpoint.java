package com.aldaviva.mastodon_client.services.accounts;

import static com.aldaviva.mastodon_client.core.UserContext.ANONYMOUS_ONLY;
import static com.aldaviva.mastodon_client.core.UserContext.OAUTH2_ONLY;
import static com.aldaviva.mastodon_client.core.UserContext.OAUTH2_OR_ANONYMOUS;

import com.aldaviva.mastodon_client.core.Scope;
import com.aldaviva.mastodon_client.core.UserContext;
import com.aldaviva.mastodon_client.services.Endpoint;

import jakarta.ws.rs.HttpMethod;

/**
 * Routes of {@link AccountsV1Service}. Scopes are the ones the server documentation lists for each method, even where they look surprising.
 */
public enum AccountsEndpoint implements Endpoint {

	CREATE_ACCOUNT(HttpMethod.POST, "api/v1/accounts", OAUTH2_ONLY, Scope.WRITE_ACCOUNTS),
	VERIFY_ACCOUNT_CREDENTIALS(HttpMethod.GET, "api/v1/accounts/verify_credentials", OAUTH2_ONLY, Scope.READ_ACCOUNTS),
	UPDATE_ACCOUNT(HttpMethod.PATCH, "api/v1/accounts/update_credentials", OAUTH2_ONLY, Scope.READ_ACCOUNTS),
	UPDATE_AVATAR_IMAGE(HttpMethod.PATCH, "api/v1/accounts/update_credentials", OAUTH2_ONLY, Scope.READ_ACCOUNTS),
	UPDATE_HEADER_IMAGE(HttpMethod.PATCH, "api/v1/accounts/update_credentials", OAUTH2_ONLY, Scope.READ_ACCOUNTS),
	LOOKUP_BY_ID(HttpMethod.GET, "api/v1/accounts/{id}", OAUTH2_OR_ANONYMOUS, Scope.READ_ACCOUNTS),
	LOOKUP_STATUSES(HttpMethod.GET, "api/v1/accounts/{id}/statuses", OAUTH2_OR_ANONYMOUS, Scope.READ_STATUSES),
	LOOKUP_FOLLOWERS(HttpMethod.GET, "api/v1/accounts/{id}/followers", OAUTH2_ONLY, Scope.READ_ACCOUNTS),
	LOOKUP_FOLLOWINGS(HttpMethod.GET, "api/v1/accounts/{id}/following", OAUTH2_ONLY, Scope.READ_ACCOUNTS),
	LOOKUP_FEATURED_TAGS(HttpMethod.GET, "api/v1/accounts/{id}/featured_tags", ANONYMOUS_ONLY, null),
	LOOKUP_CONTAINED_LISTS(HttpMethod.GET, "api/v1/accounts/{id}/lists", OAUTH2_ONLY, Scope.READ_LISTS),
	CREATE_FOLLOW(HttpMethod.POST, "api/v1/accounts/{id}/follow", OAUTH2_ONLY, Scope.READ_LISTS),
	DESTROY_FOLLOW(HttpMethod.POST, "api/v1/accounts/{id}/unfollow", OAUTH2_ONLY, Scope.WRITE_FOLLOWS),
	DESTROY_FOLLOWER(HttpMethod.POST, "api/v1/accounts/{id}/remove_from_followers", OAUTH2_ONLY, Scope.WRITE_FOLLOWS),
	CREATE_BLOCK(HttpMethod.POST, "api/v1/accounts/{id}/block", OAUTH2_ONLY, Scope.WRITE_BLOCKS),
	DESTROY_BLOCK(HttpMethod.POST, "api/v1/accounts/{id}/unblock", OAUTH2_ONLY, Scope.WRITE_BLOCKS),
	CREATE_MUTE(HttpMethod.POST, "api/v1/accounts/{id}/mute", OAUTH2_ONLY, Scope.WRITE_MUTES),
	DESTROY_MUTE(HttpMethod.POST, "api/v1/accounts/{id}/unmute", OAUTH2_ONLY, Scope.WRITE_MUTES),
	CREATE_FEATURED_PROFILE(HttpMethod.POST, "api/v1/accounts/{id}/pin", OAUTH2_ONLY, Scope.WRITE_ACCOUNTS),
	DESTROY_FEATURED_PROFILE(HttpMethod.POST, "api/v1/accounts/{id}/unpin", OAUTH2_ONLY, Scope.WRITE_ACCOUNTS),
	UPDATE_PRIVATE_COMMENT(HttpMethod.POST, "api/v1/accounts/{id}/note", OAUTH2_ONLY, Scope.WRITE_ACCOUNTS),
	LOOKUP_RELATIONSHIPS(HttpMethod.GET, "api/v1/accounts/relationships", OAUTH2_ONLY, Scope.READ_FOLLOWS),
	LOOKUP_FAMILIAR_FOLLOWERS(HttpMethod.GET, "api/v1/accounts/familiar_followers", OAUTH2_ONLY, Scope.READ_FOLLOWS),
	SEARCH_ACCOUNTS(HttpMethod.GET, "api/v1/accounts/search", OAUTH2_ONLY, Scope.READ_ACCOUNTS),
	LOOKUP_ACCOUNT_FROM_WEBFINGER_ADDRESS(HttpMethod.GET, "api/v1/accounts/lookup", ANONYMOUS_ONLY, Scope.READ_ACCOUNTS),
	LOOKUP_PREFERENCES(HttpMethod.GET, "api/v1/preferences", OAUTH2_ONLY, Scope.READ_ACCOUNTS),
	LOOKUP_OWNED_FEATURED_TAGS(HttpMethod.GET, "api/v1/featured_tags", OAUTH2_ONLY, Scope.READ_ACCOUNTS),
	CREATE_FEATURED_TAG(HttpMethod.POST, "api/v1/featured_tags", OAUTH2_ONLY, Scope.WRITE_ACCOUNTS),
	DESTROY_FEATURED_TAG(HttpMethod.DELETE, "api/v1/featured_tags/{id}", OAUTH2_ONLY, Scope.WRITE_ACCOUNTS),
	LOOKUP_SUGGESTED_TAGS(HttpMethod.GET, "api/v1/featured_tags/suggestions", OAUTH2_ONLY, Scope.READ_ACCOUNTS),
	LOOKUP_FOLLOWED_TAGS(HttpMethod.GET, "api/v1/followed_tags", OAUTH2_ONLY, Scope.READ_FOLLOWS),
	DESTROY_FOLLOW_SUGGESTION(HttpMethod.DELETE, "api/v1/suggestions/{id}", OAUTH2_ONLY, Scope.READ);

	private final String method;
	private final String path;
	private final UserContext userContext;
	private final Scope scope;

	AccountsEndpoint(final String method, final String path, final UserContext userContext, final Scope scope) {
		this.method = method;
		this.path = path;
		this.userContext = userContext;
		this.scope = scope;
	}

	@Override
	public String getMethod() {
		return method;
	}

	@Override
	public String getPath() {
		return path;
	}

	@Override
	public UserContext getUserContext() {
		return userContext;
	}

	@Override
	public Scope getScope() {
		return scope;
	}

	@Override
	public String toString() {
		return method + " /" + path;
	}
}
