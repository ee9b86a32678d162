package com.aldaviva.mastodon_client.services.accounts;

import com.aldaviva.mastodon_client.core.ClientContext;
import com.aldaviva.mastodon_client.core.MastodonResponse;
import com.aldaviva.mastodon_client.data.Account;
import com.aldaviva.mastodon_client.data.AccountPreferences;
import com.aldaviva.mastodon_client.data.FamiliarFollower;
import com.aldaviva.mastodon_client.data.FeaturedTag;
import com.aldaviva.mastodon_client.data.Relationship;
import com.aldaviva.mastodon_client.data.Status;
import com.aldaviva.mastodon_client.data.Tag;
import com.aldaviva.mastodon_client.data.Token;
import com.aldaviva.mastodon_client.data.UserList;
import com.aldaviva.mastodon_client.services.BaseService;

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public class DefaultAccountsV1Service extends BaseService implements AccountsV1Service {

	/**
	 * Form field for both profile image uploads. Established clients send the avatar under this name; that the server also accepts a header image
	 * under it, rather than {@code header}, is unconfirmed.
	 */
	static final String IMAGE_FORM_FIELD = "avatar";

	public DefaultAccountsV1Service(final ClientContext context) {
		super(context);
	}

	@Override
	public MastodonResponse<Token> createAccount(final String username, final String email, final String password, final boolean agreement,
	    final Locale locale, final String reason) {
		final JsonBody body = new JsonBody()
		    .put("username", username)
		    .put("email", email)
		    .put("password", password)
		    .put("agreement", agreement)
		    .put("locale", locale != null ? locale.getLanguage() : null)
		    .put("reason", reason);

		return single(AccountsEndpoint.CREATE_ACCOUNT, request(AccountsEndpoint.CREATE_ACCOUNT).jsonBody(body.toMap()), Token.class);
	}

	@Override
	public MastodonResponse<Account> verifyAccountCredentials() {
		return verifyAccountCredentials(null);
	}

	@Override
	public MastodonResponse<Account> verifyAccountCredentials(final String bearerToken) {
		return single(AccountsEndpoint.VERIFY_ACCOUNT_CREDENTIALS, request(AccountsEndpoint.VERIFY_ACCOUNT_CREDENTIALS), Account.class, bearerToken);
	}

	@Override
	public MastodonResponse<Account> updateAccount(final String displayName, final String bio, final Boolean discoverable, final Boolean bot,
	    final Boolean locked, final AccountDefaultSettingsParam defaultSettings, final List<AccountProfileMetaParam> profileMeta) {
		final JsonBody source = new JsonBody();
		if (defaultSettings != null) {
			source.put("privacy", defaultSettings.getPrivacy())
			    .put("sensitive", defaultSettings.getSensitive())
			    .put("language", defaultSettings.getLanguage() != null ? defaultSettings.getLanguage().getLanguage() : null);
		}

		final List<Map<String, Object>> fieldsAttributes = profileMeta == null ? null
		    : profileMeta.stream()
		        .map(row -> new JsonBody().put("name", row.getName()).put("value", row.getValue()).toMap())
		        .collect(Collectors.toList());

		final JsonBody body = new JsonBody()
		    .put("display_name", displayName)
		    .put("note", bio)
		    .put("discoverable", discoverable)
		    .put("bot", bot)
		    .put("locked", locked)
		    .putObject("source", source)
		    .put("fields_attributes", fieldsAttributes);

		return single(AccountsEndpoint.UPDATE_ACCOUNT, request(AccountsEndpoint.UPDATE_ACCOUNT).jsonBody(body.toMap()), Account.class);
	}

	@Override
	public MastodonResponse<Account> updateAvatarImage(final File file) {
		return single(AccountsEndpoint.UPDATE_AVATAR_IMAGE, request(AccountsEndpoint.UPDATE_AVATAR_IMAGE).filePart(IMAGE_FORM_FIELD, file), Account.class);
	}

	@Override
	public MastodonResponse<Account> updateHeaderImage(final File file) {
		return single(AccountsEndpoint.UPDATE_HEADER_IMAGE, request(AccountsEndpoint.UPDATE_HEADER_IMAGE).filePart(IMAGE_FORM_FIELD, file), Account.class);
	}

	@Override
	public MastodonResponse<Account> lookupById(final String accountId) {
		return single(AccountsEndpoint.LOOKUP_BY_ID, request(AccountsEndpoint.LOOKUP_BY_ID, accountId), Account.class);
	}

	@Override
	public MastodonResponse<List<Status>> lookupStatuses(final String accountId, final String maxStatusId, final String minStatusId,
	    final String sinceStatusId, final String tagged, final Integer limit, final Boolean excludeReblogs) {
		return multi(AccountsEndpoint.LOOKUP_STATUSES, request(AccountsEndpoint.LOOKUP_STATUSES, accountId)
		    .queryParameter("max_id", maxStatusId)
		    .queryParameter("min_id", minStatusId)
		    .queryParameter("since_id", sinceStatusId)
		    .queryParameter("tagged", tagged)
		    .queryParameter("limit", limit)
		    .queryParameter("exclude_reblogs", excludeReblogs), Status.class);
	}

	@Override
	public MastodonResponse<List<Account>> lookupFollowers(final String accountId, final Integer limit) {
		return multi(AccountsEndpoint.LOOKUP_FOLLOWERS, request(AccountsEndpoint.LOOKUP_FOLLOWERS, accountId).queryParameter("limit", limit), Account.class);
	}

	@Override
	public MastodonResponse<List<Account>> lookupFollowings(final String accountId, final Integer limit) {
		return multi(AccountsEndpoint.LOOKUP_FOLLOWINGS, request(AccountsEndpoint.LOOKUP_FOLLOWINGS, accountId).queryParameter("limit", limit), Account.class);
	}

	@Override
	public MastodonResponse<List<FeaturedTag>> lookupFeaturedTags(final String accountId) {
		return multi(AccountsEndpoint.LOOKUP_FEATURED_TAGS, request(AccountsEndpoint.LOOKUP_FEATURED_TAGS, accountId), FeaturedTag.class);
	}

	@Override
	public MastodonResponse<List<UserList>> lookupContainedLists(final String accountId) {
		return multi(AccountsEndpoint.LOOKUP_CONTAINED_LISTS, request(AccountsEndpoint.LOOKUP_CONTAINED_LISTS, accountId), UserList.class);
	}

	@Override
	public MastodonResponse<Relationship> createFollow(final String accountId, final Boolean receiveReblogs, final Boolean receiveNotifications,
	    final List<Locale> filteringLanguages) {
		final List<String> languages = filteringLanguages == null ? null
		    : filteringLanguages.stream().map(Locale::getLanguage).collect(Collectors.toList());

		final JsonBody body = new JsonBody()
		    .put("reblogs", receiveReblogs)
		    .put("notify", receiveNotifications)
		    .put("languages", languages);

		return single(AccountsEndpoint.CREATE_FOLLOW, request(AccountsEndpoint.CREATE_FOLLOW, accountId).jsonBody(body.toMap()), Relationship.class);
	}

	@Override
	public MastodonResponse<Relationship> destroyFollow(final String accountId) {
		return relationshipAction(AccountsEndpoint.DESTROY_FOLLOW, accountId);
	}

	@Override
	public MastodonResponse<Relationship> destroyFollower(final String accountId) {
		return relationshipAction(AccountsEndpoint.DESTROY_FOLLOWER, accountId);
	}

	@Override
	public MastodonResponse<Relationship> createBlock(final String accountId) {
		return relationshipAction(AccountsEndpoint.CREATE_BLOCK, accountId);
	}

	@Override
	public MastodonResponse<Relationship> destroyBlock(final String accountId) {
		return relationshipAction(AccountsEndpoint.DESTROY_BLOCK, accountId);
	}

	@Override
	public MastodonResponse<Relationship> createMute(final String accountId, final Boolean includeNotifications, final Duration duration) {
		final JsonBody body = new JsonBody()
		    .put("notifications", includeNotifications)
		    .put("duration", duration != null ? duration.getSeconds() : null);

		return single(AccountsEndpoint.CREATE_MUTE, request(AccountsEndpoint.CREATE_MUTE, accountId).jsonBody(body.toMap()), Relationship.class);
	}

	@Override
	public MastodonResponse<Relationship> destroyMute(final String accountId) {
		return relationshipAction(AccountsEndpoint.DESTROY_MUTE, accountId);
	}

	@Override
	public MastodonResponse<Relationship> createFeaturedProfile(final String accountId) {
		return relationshipAction(AccountsEndpoint.CREATE_FEATURED_PROFILE, accountId);
	}

	@Override
	public MastodonResponse<Relationship> destroyFeaturedProfile(final String accountId) {
		return relationshipAction(AccountsEndpoint.DESTROY_FEATURED_PROFILE, accountId);
	}

	@Override
	public MastodonResponse<Relationship> updatePrivateComment(final String accountId, final String text) {
		// an empty comment clears it
		final JsonBody body = new JsonBody().put("comment", text != null ? text : "");
		return single(AccountsEndpoint.UPDATE_PRIVATE_COMMENT, request(AccountsEndpoint.UPDATE_PRIVATE_COMMENT, accountId).jsonBody(body.toMap()),
		    Relationship.class);
	}

	@Override
	public MastodonResponse<Relationship> updatePrivateComment(final String accountId) {
		return updatePrivateComment(accountId, null);
	}

	@Override
	public MastodonResponse<List<Relationship>> lookupRelationships(final List<String> accountIds) {
		return multi(AccountsEndpoint.LOOKUP_RELATIONSHIPS, request(AccountsEndpoint.LOOKUP_RELATIONSHIPS).queryParameters("id[]", accountIds),
		    Relationship.class);
	}

	@Override
	public MastodonResponse<List<FamiliarFollower>> lookupFamiliarFollowers(final List<String> accountIds) {
		return multi(AccountsEndpoint.LOOKUP_FAMILIAR_FOLLOWERS, request(AccountsEndpoint.LOOKUP_FAMILIAR_FOLLOWERS).queryParameters("id[]", accountIds),
		    FamiliarFollower.class);
	}

	@Override
	public MastodonResponse<List<Account>> searchAccounts(final String query, final Integer limit, final Boolean resolveWithWebFinger,
	    final Boolean onlyFollowings) {
		return multi(AccountsEndpoint.SEARCH_ACCOUNTS, request(AccountsEndpoint.SEARCH_ACCOUNTS)
		    .queryParameter("q", query)
		    .queryParameter("limit", limit)
		    .queryParameter("resolve", resolveWithWebFinger)
		    .queryParameter("following", onlyFollowings), Account.class);
	}

	@Override
	public MastodonResponse<Account> lookupAccountFromWebFingerAddress(final String accountIdentifier, final Boolean skipWebFinger) {
		return single(AccountsEndpoint.LOOKUP_ACCOUNT_FROM_WEBFINGER_ADDRESS, request(AccountsEndpoint.LOOKUP_ACCOUNT_FROM_WEBFINGER_ADDRESS)
		    .queryParameter("acct", accountIdentifier)
		    .queryParameter("skip_webfinger", skipWebFinger), Account.class);
	}

	@Override
	public MastodonResponse<AccountPreferences> lookupPreferences() {
		return single(AccountsEndpoint.LOOKUP_PREFERENCES, request(AccountsEndpoint.LOOKUP_PREFERENCES), AccountPreferences.class);
	}

	@Override
	public MastodonResponse<List<FeaturedTag>> lookupOwnedFeaturedTags() {
		return multi(AccountsEndpoint.LOOKUP_OWNED_FEATURED_TAGS, request(AccountsEndpoint.LOOKUP_OWNED_FEATURED_TAGS), FeaturedTag.class);
	}

	@Override
	public MastodonResponse<FeaturedTag> createFeaturedTag(final String tagName) {
		final JsonBody body = new JsonBody().put("name", tagName);
		return single(AccountsEndpoint.CREATE_FEATURED_TAG, request(AccountsEndpoint.CREATE_FEATURED_TAG).jsonBody(body.toMap()), FeaturedTag.class);
	}

	@Override
	public MastodonResponse<Boolean> destroyFeaturedTag(final String tagId) {
		return evaluate(AccountsEndpoint.DESTROY_FEATURED_TAG, request(AccountsEndpoint.DESTROY_FEATURED_TAG, tagId));
	}

	@Override
	public MastodonResponse<List<Tag>> lookupSuggestedTags() {
		return multi(AccountsEndpoint.LOOKUP_SUGGESTED_TAGS, request(AccountsEndpoint.LOOKUP_SUGGESTED_TAGS), Tag.class);
	}

	@Override
	public MastodonResponse<List<Tag>> lookupFollowedTags(final Integer limit) {
		return multi(AccountsEndpoint.LOOKUP_FOLLOWED_TAGS, request(AccountsEndpoint.LOOKUP_FOLLOWED_TAGS).queryParameter("limit", limit), Tag.class);
	}

	@Override
	public MastodonResponse<Boolean> destroyFollowSuggestion(final String accountId) {
		return evaluate(AccountsEndpoint.DESTROY_FOLLOW_SUGGESTION, request(AccountsEndpoint.DESTROY_FOLLOW_SUGGESTION, accountId));
	}

	private MastodonResponse<Relationship> relationshipAction(final AccountsEndpoint endpoint, final String accountId) {
		return single(endpoint, request(endpoint, accountId), Relationship.class);
	}

}
