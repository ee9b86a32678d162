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

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Accounts, relationships, featured tags, followed tags, follow suggestions and preferences, version 1 of the API.
 * <p>Optional parameters may be <code>null</code>, in which case they are not sent and the server uses its default.</p>
 * <p>Every method throws {@link com.aldaviva.mastodon_client.exceptions.AuthenticationRequiredException} without sending a request if it needs an access
 * token and none is available, {@link com.aldaviva.mastodon_client.exceptions.MastodonApiException} if the server responds with a non-2xx status,
 * {@link com.aldaviva.mastodon_client.exceptions.MastodonConnectionException} if no response is received, and
 * {@link com.aldaviva.mastodon_client.exceptions.MastodonDataException} if the response body can't be decoded.</p>
 * @see <a href="https://docs.joinmastodon.org/methods/accounts/">accounts API methods</a>
 */
public interface AccountsV1Service {

	static AccountsV1Service newInstance(final ClientContext context) {
		return new DefaultAccountsV1Service(context);
	}

	/**
	 * Register a new user. The returned token is for the app that made the request, which should keep it until the user confirms their email address.
	 * <p>{@code POST /api/v1/accounts}, OAuth 2.0, scope {@code write:accounts}</p>
	 * @param username desired username
	 * @param email address used to sign in
	 * @param password password used to sign in
	 * @param agreement whether the user agreed to the instance's rules, terms and policies
	 * @param locale language of the confirmation email
	 * @param reason text reviewed by moderators if registrations need manual approval, or <code>null</code>
	 * @see <a href="https://docs.joinmastodon.org/methods/accounts/#create">create</a>
	 */
	MastodonResponse<Token> createAccount(String username, String email, String password, boolean agreement, Locale locale, String reason);

	/**
	 * Check that the configured user token works.
	 * <p>{@code GET /api/v1/accounts/verify_credentials}, OAuth 2.0, scope {@code read:accounts}</p>
	 * @return the authenticated user's account, including {@link Account#source}
	 * @see <a href="https://docs.joinmastodon.org/methods/accounts/#verify_credentials">verify_credentials</a>
	 */
	MastodonResponse<Account> verifyAccountCredentials();

	/**
	 * Check that a specific bearer token works, whether or not the client context has one.
	 * @param bearerToken token to verify instead of the configured one, or <code>null</code> to verify the configured one
	 * @see #verifyAccountCredentials()
	 */
	MastodonResponse<Account> verifyAccountCredentials(String bearerToken);

	/**
	 * Change the authenticated user's profile and posting defaults.
	 * <p>{@code PATCH /api/v1/accounts/update_credentials}, OAuth 2.0, scope {@code read:accounts}</p>
	 * @param displayName profile display name
	 * @param bio profile bio
	 * @param discoverable whether the account is shown in the profile directory
	 * @param bot whether the account is flagged as a bot
	 * @param locked whether follow requests need manual approval
	 * @param defaultSettings defaults for new statuses
	 * @param profileMeta replacement profile metadata table; by default servers allow 4 rows of 255 characters
	 * @see <a href="https://docs.joinmastodon.org/methods/accounts/#update_credentials">update_credentials</a>
	 */
	MastodonResponse<Account> updateAccount(String displayName, String bio, Boolean discoverable, Boolean bot, Boolean locked,
	    AccountDefaultSettingsParam defaultSettings, List<AccountProfileMetaParam> profileMeta);

	/**
	 * Upload a new profile picture.
	 * <p>{@code PATCH /api/v1/accounts/update_credentials} as {@code multipart/form-data}, OAuth 2.0, scope {@code read:accounts}</p>
	 */
	MastodonResponse<Account> updateAvatarImage(File file);

	/**
	 * Upload a new profile banner image.
	 * <p>{@code PATCH /api/v1/accounts/update_credentials} as {@code multipart/form-data}, OAuth 2.0, scope {@code read:accounts}</p>
	 */
	MastodonResponse<Account> updateHeaderImage(File file);

	/**
	 * <p>{@code GET /api/v1/accounts/:id}, anonymous or OAuth 2.0, scope {@code read:accounts}</p>
	 * @see <a href="https://docs.joinmastodon.org/methods/accounts/#get">get</a>
	 */
	MastodonResponse<Account> lookupById(String accountId);

	/**
	 * Statuses posted by an account, newest first.
	 * <p>{@code GET /api/v1/accounts/:id/statuses}, anonymous or OAuth 2.0, scope {@code read:statuses}</p>
	 * @param accountId account whose statuses to list
	 * @param maxStatusId only return statuses older than this ID
	 * @param minStatusId only return statuses immediately newer than this ID
	 * @param sinceStatusId only return statuses newer than this ID
	 * @param tagged only return statuses with this hashtag
	 * @param limit maximum number of statuses, server default 20
	 * @param excludeReblogs whether to leave out boosts
	 * @see <a href="https://docs.joinmastodon.org/methods/accounts/#statuses">statuses</a>
	 */
	MastodonResponse<List<Status>> lookupStatuses(String accountId, String maxStatusId, String minStatusId, String sinceStatusId, String tagged, Integer limit,
	    Boolean excludeReblogs);

	/**
	 * Accounts that follow the given account, unless its owner hides them.
	 * <p>{@code GET /api/v1/accounts/:id/followers}, OAuth 2.0, scope {@code read:accounts}</p>
	 * @param limit maximum number of accounts, server default 40
	 */
	MastodonResponse<List<Account>> lookupFollowers(String accountId, Integer limit);

	/**
	 * Accounts that the given account follows, unless its owner hides them.
	 * <p>{@code GET /api/v1/accounts/:id/following}, OAuth 2.0, scope {@code read:accounts}</p>
	 * @param limit maximum number of accounts, server default 40
	 */
	MastodonResponse<List<Account>> lookupFollowings(String accountId, Integer limit);

	/**
	 * Hashtags featured on an account's profile.
	 * <p>{@code GET /api/v1/accounts/:id/featured_tags}, anonymous</p>
	 */
	MastodonResponse<List<FeaturedTag>> lookupFeaturedTags(String accountId);

	/**
	 * The authenticated user's lists that contain the given account.
	 * <p>{@code GET /api/v1/accounts/:id/lists}, OAuth 2.0, scope {@code read:lists}</p>
	 */
	MastodonResponse<List<UserList>> lookupContainedLists(String accountId);

	/**
	 * Follow an account, or change the settings of an existing follow.
	 * <p>{@code POST /api/v1/accounts/:id/follow}, OAuth 2.0, scope {@code read:lists}</p>
	 * @param receiveReblogs whether to show the account's boosts in the home timeline, server default {@code true}
	 * @param receiveNotifications whether to be notified when the account posts, server default {@code false}
	 * @param filteringLanguages only receive statuses in these languages, or <code>null</code> for all languages
	 */
	MastodonResponse<Relationship> createFollow(String accountId, Boolean receiveReblogs, Boolean receiveNotifications, List<Locale> filteringLanguages);

	/**
	 * <p>{@code POST /api/v1/accounts/:id/unfollow}, OAuth 2.0, scope {@code write:follows}</p>
	 */
	MastodonResponse<Relationship> destroyFollow(String accountId);

	/**
	 * Make an account stop following the authenticated user.
	 * <p>{@code POST /api/v1/accounts/:id/remove_from_followers}, OAuth 2.0, scope {@code write:follows}</p>
	 */
	MastodonResponse<Relationship> destroyFollower(String accountId);

	/**
	 * <p>{@code POST /api/v1/accounts/:id/block}, OAuth 2.0, scope {@code write:blocks}</p>
	 */
	MastodonResponse<Relationship> createBlock(String accountId);

	/**
	 * <p>{@code POST /api/v1/accounts/:id/unblock}, OAuth 2.0, scope {@code write:blocks}</p>
	 */
	MastodonResponse<Relationship> destroyBlock(String accountId);

	/**
	 * Hide an account's statuses, and optionally its notifications.
	 * <p>{@code POST /api/v1/accounts/:id/mute}, OAuth 2.0, scope {@code write:mutes}</p>
	 * @param includeNotifications whether to also mute notifications, server default {@code true}
	 * @param duration how long the mute lasts, sent in whole seconds, or <code>null</code> for indefinitely
	 */
	MastodonResponse<Relationship> createMute(String accountId, Boolean includeNotifications, Duration duration);

	/**
	 * <p>{@code POST /api/v1/accounts/:id/unmute}, OAuth 2.0, scope {@code write:mutes}</p>
	 */
	MastodonResponse<Relationship> destroyMute(String accountId);

	/**
	 * Feature an account on the authenticated user's profile.
	 * <p>{@code POST /api/v1/accounts/:id/pin}, OAuth 2.0, scope {@code write:accounts}</p>
	 */
	MastodonResponse<Relationship> createFeaturedProfile(String accountId);

	/**
	 * <p>{@code POST /api/v1/accounts/:id/unpin}, OAuth 2.0, scope {@code write:accounts}</p>
	 */
	MastodonResponse<Relationship> destroyFeaturedProfile(String accountId);

	/**
	 * Set the authenticated user's private comment about an account.
	 * <p>{@code POST /api/v1/accounts/:id/note}, OAuth 2.0, scope {@code write:accounts}</p>
	 * @param text the comment, or <code>null</code> or empty to remove it
	 */
	MastodonResponse<Relationship> updatePrivateComment(String accountId, String text);

	/**
	 * Remove the authenticated user's private comment about an account.
	 * @see #updatePrivateComment(String, String)
	 */
	MastodonResponse<Relationship> updatePrivateComment(String accountId);

	/**
	 * Whether the given accounts are followed, blocked, muted, etc. by the authenticated user.
	 * <p>{@code GET /api/v1/accounts/relationships?id[]=1&id[]=2}, OAuth 2.0, scope {@code read:follows}</p>
	 * @return relationships in the server's order, which is usually the order of {@code accountIds}
	 */
	MastodonResponse<List<Relationship>> lookupRelationships(List<String> accountIds);

	/**
	 * Followers of the given accounts that the authenticated user also follows.
	 * <p>{@code GET /api/v1/accounts/familiar_followers?id[]=1&id[]=2}, OAuth 2.0, scope {@code read:follows}</p>
	 * @see <a href="https://docs.joinmastodon.org/methods/accounts/#familiar_followers">familiar_followers</a>
	 */
	MastodonResponse<List<FamiliarFollower>> lookupFamiliarFollowers(List<String> accountIds);

	/**
	 * <p>{@code GET /api/v1/accounts/search}, OAuth 2.0, scope {@code read:accounts}</p>
	 * @param query text to search for in usernames, display names and addresses
	 * @param limit maximum number of accounts, server default 40
	 * @param resolveWithWebFinger whether to resolve remote accounts with WebFinger when {@code query} is an exact address, server default {@code false}
	 * @param onlyFollowings only search accounts that the authenticated user follows
	 */
	MastodonResponse<List<Account>> searchAccounts(String query, Integer limit, Boolean resolveWithWebFinger, Boolean onlyFollowings);

	/**
	 * Find an account by username or WebFinger address.
	 * <p>{@code GET /api/v1/accounts/lookup}, anonymous, scope {@code read:accounts}</p>
	 * @param accountIdentifier a local username like {@code alice}, or an address like {@code alice@example.com}
	 * @param skipWebFinger whether to use the server's cached copy instead of resolving the address again, server default {@code true}
	 * @see <a href="https://docs.joinmastodon.org/methods/accounts/#lookup">lookup</a>
	 */
	MastodonResponse<Account> lookupAccountFromWebFingerAddress(String accountIdentifier, Boolean skipWebFinger);

	/**
	 * <p>{@code GET /api/v1/preferences}, OAuth 2.0, scope {@code read:accounts}</p>
	 * @see <a href="https://docs.joinmastodon.org/methods/preferences/#get">preferences</a>
	 */
	MastodonResponse<AccountPreferences> lookupPreferences();

	/**
	 * Hashtags featured on the authenticated user's profile.
	 * <p>{@code GET /api/v1/featured_tags}, OAuth 2.0, scope {@code read:accounts}</p>
	 */
	MastodonResponse<List<FeaturedTag>> lookupOwnedFeaturedTags();

	/**
	 * <p>{@code POST /api/v1/featured_tags}, OAuth 2.0, scope {@code write:accounts}</p>
	 * @param tagName hashtag without the leading {@code #}
	 */
	MastodonResponse<FeaturedTag> createFeaturedTag(String tagName);

	/**
	 * <p>{@code DELETE /api/v1/featured_tags/:id}, OAuth 2.0, scope {@code write:accounts}</p>
	 * @param tagId {@link FeaturedTag#id}, not the hashtag name
	 * @return {@code true} for any successful status
	 */
	MastodonResponse<Boolean> destroyFeaturedTag(String tagId);

	/**
	 * The authenticated user's ten most used hashtags, to suggest featuring.
	 * <p>{@code GET /api/v1/featured_tags/suggestions}, OAuth 2.0, scope {@code read:accounts}</p>
	 */
	MastodonResponse<List<Tag>> lookupSuggestedTags();

	/**
	 * <p>{@code GET /api/v1/followed_tags}, OAuth 2.0, scope {@code read:follows}</p>
	 * @param limit maximum number of tags, server default 100
	 * @see <a href="https://docs.joinmastodon.org/methods/followed_tags/#get">followed_tags</a>
	 */
	MastodonResponse<List<Tag>> lookupFollowedTags(Integer limit);

	/**
	 * Stop suggesting an account to follow.
	 * <p>{@code DELETE /api/v1/suggestions/:account_id}, OAuth 2.0, scope {@code read}</p>
	 * @return {@code true} for any successful status
	 * @see <a href="https://docs.joinmastodon.org/methods/suggestions/#remove">suggestions</a>
	 */
	MastodonResponse<Boolean> destroyFollowSuggestion(String accountId);

}
