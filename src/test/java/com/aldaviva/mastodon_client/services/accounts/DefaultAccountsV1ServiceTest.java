package com.aldaviva.mastodon_client.services.accounts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.aldaviva.mastodon_client.Fixtures;
import com.aldaviva.mastodon_client.core.ClientContext;
import com.aldaviva.mastodon_client.core.MastodonCredentials;
import com.aldaviva.mastodon_client.core.MastodonResponse;
import com.aldaviva.mastodon_client.core.UserContext;
import com.aldaviva.mastodon_client.data.Account;
import com.aldaviva.mastodon_client.data.FamiliarFollower;
import com.aldaviva.mastodon_client.data.Relationship;
import com.aldaviva.mastodon_client.data.Status;
import com.aldaviva.mastodon_client.data.Token;
import com.aldaviva.mastodon_client.data.Visibility;
import com.aldaviva.mastodon_client.exceptions.AuthenticationRequiredException;
import com.aldaviva.mastodon_client.exceptions.MastodonApiException;
import com.aldaviva.mastodon_client.http.MastodonTransport;
import com.aldaviva.mastodon_client.http.TransportRequest;
import com.aldaviva.mastodon_client.http.TransportResponse;

import java.io.File;
import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DefaultAccountsV1ServiceTest {

	private static final URI SERVER = URI.create("https://mastodon.example/");
	private static final String TOKEN = "user-token";
	private static final File IMAGE = Fixtures.file("avatar.png");

	@Mock
	private MastodonTransport transport;

	private AccountsV1Service anonymousService() {
		return AccountsV1Service.newInstance(new ClientContext(MastodonCredentials.anonymous(SERVER), transport));
	}

	private AccountsV1Service authenticatedService() {
		return AccountsV1Service.newInstance(new ClientContext(new MastodonCredentials(SERVER, "client", "secret", TOKEN), transport));
	}

	private void respond(final int status, final String body) {
		when(transport.send(eq(SERVER), any(TransportRequest.class))).thenReturn(new TransportResponse(status, Collections.emptyMap(), body));
	}

	private void respondWithFixture(final String fixture) {
		respond(200, Fixtures.read(fixture));
	}

	private TransportRequest sentRequest() {
		final ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
		verify(transport).send(eq(SERVER), captor.capture());
		return captor.getValue();
	}

	static Stream<Arguments> oauthOnlyOperations() {
		final List<String> ids = Arrays.asList("1", "2");
		return Stream.of(
		    operation("createAccount", service -> service.createAccount("alice", "alice@example.com", "hunter2", true, Locale.ENGLISH, null)),
		    operation("verifyAccountCredentials", AccountsV1Service::verifyAccountCredentials),
		    operation("updateAccount", service -> service.updateAccount("Alice", null, null, null, null, null, null)),
		    operation("updateAvatarImage", service -> service.updateAvatarImage(IMAGE)),
		    operation("updateHeaderImage", service -> service.updateHeaderImage(IMAGE)),
		    operation("lookupFollowers", service -> service.lookupFollowers("1", null)),
		    operation("lookupFollowings", service -> service.lookupFollowings("1", null)),
		    operation("lookupContainedLists", service -> service.lookupContainedLists("1")),
		    operation("createFollow", service -> service.createFollow("1", null, null, null)),
		    operation("destroyFollow", service -> service.destroyFollow("1")),
		    operation("destroyFollower", service -> service.destroyFollower("1")),
		    operation("createBlock", service -> service.createBlock("1")),
		    operation("destroyBlock", service -> service.destroyBlock("1")),
		    operation("createMute", service -> service.createMute("1", null, null)),
		    operation("destroyMute", service -> service.destroyMute("1")),
		    operation("createFeaturedProfile", service -> service.createFeaturedProfile("1")),
		    operation("destroyFeaturedProfile", service -> service.destroyFeaturedProfile("1")),
		    operation("updatePrivateComment", service -> service.updatePrivateComment("1", "hi")),
		    operation("lookupRelationships", service -> service.lookupRelationships(ids)),
		    operation("lookupFamiliarFollowers", service -> service.lookupFamiliarFollowers(ids)),
		    operation("searchAccounts", service -> service.searchAccounts("alice", null, null, null)),
		    operation("lookupPreferences", AccountsV1Service::lookupPreferences),
		    operation("lookupOwnedFeaturedTags", AccountsV1Service::lookupOwnedFeaturedTags),
		    operation("createFeaturedTag", service -> service.createFeaturedTag("wonderland")),
		    operation("destroyFeaturedTag", service -> service.destroyFeaturedTag("627")),
		    operation("lookupSuggestedTags", AccountsV1Service::lookupSuggestedTags),
		    operation("lookupFollowedTags", service -> service.lookupFollowedTags(null)),
		    operation("destroyFollowSuggestion", service -> service.destroyFollowSuggestion("1")));
	}

	private static Arguments operation(final String name, final Consumer<AccountsV1Service> call) {
		return Arguments.of(name, call);
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("oauthOnlyOperations")
	void oauthOnlyOperationWithoutTokenIsNeverSent(final String name, final Consumer<AccountsV1Service> call) {
		final AccountsV1Service service = anonymousService();

		assertThatThrownBy(() -> call.accept(service))
		    .isInstanceOfSatisfying(AuthenticationRequiredException.class, e -> assertThat(e.getUserContext()).isEqualTo(UserContext.OAUTH2_ONLY));
		verifyNoInteractions(transport);
	}

	@Test
	void oauthOnlyRoutesAreCoveredByGateTest() {
		final long oauthOnlyRoutes = Arrays.stream(AccountsEndpoint.values()).filter(endpoint -> endpoint.getUserContext() == UserContext.OAUTH2_ONLY).count();

		assertThat(oauthOnlyOperations()).hasSize((int) oauthOnlyRoutes);
	}

	@Test
	void verifyCredentialsWithAdHocToken() {
		respond(200, "{\"id\":\"1\",\"username\":\"alice\"}");

		final MastodonResponse<Account> actual = anonymousService().verifyAccountCredentials("ad-hoc");

		assertThat(actual.getData().id).isEqualTo("1");
		final TransportRequest request = sentRequest();
		assertThat(request.getMethod()).isEqualTo("GET");
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/verify_credentials");
		assertThat(request.getAccessToken()).isEqualTo("ad-hoc");
	}

	@Test
	void verifyCredentialsWithConfiguredToken() {
		respondWithFixture("account.json");

		final Account actual = authenticatedService().verifyAccountCredentials().getData();

		assertThat(actual.source.privacy).isEqualTo(Visibility.UNLISTED);
		assertThat(sentRequest().getAccessToken()).isEqualTo(TOKEN);
	}

	@Test
	void anonymousOnlyRouteOmitsConfiguredToken() {
		respondWithFixture("account.json");

		authenticatedService().lookupAccountFromWebFingerAddress("alice@mastodon.example", false);

		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/lookup");
		assertThat(request.getAccessToken()).isNull();
		assertThat(request.getQueryParameters())
		    .containsEntry("acct", List.of("alice@mastodon.example"))
		    .containsEntry("skip_webfinger", List.of("false"));
	}

	@Test
	void featuredTagsOfAccountAreAnonymous() {
		respond(200, "[]");

		assertThat(authenticatedService().lookupFeaturedTags("5").getData()).isEmpty();

		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/{id}/featured_tags");
		assertThat(request.getPathParameters()).containsEntry("id", "5");
		assertThat(request.getAccessToken()).isNull();
	}

	@Test
	void lookupByIdSendsTokenIfPresent() {
		respondWithFixture("account.json");

		authenticatedService().lookupById("109302");

		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/{id}");
		assertThat(request.getPathParameters()).containsEntry("id", "109302");
		assertThat(request.getAccessToken()).isEqualTo(TOKEN);
	}

	@Test
	void lookupByIdAnonymously() {
		respondWithFixture("account.json");

		assertThat(anonymousService().lookupById("109302").getData().username).isEqualTo("alice");
		assertThat(sentRequest().getAccessToken()).isNull();
	}

	@Test
	void missingPathIdIsRejectedBeforeSending() {
		assertThatThrownBy(() -> authenticatedService().createBlock(null)).isInstanceOf(IllegalArgumentException.class);
		verifyNoInteractions(transport);
	}

	@Test
	void statusesQuery() {
		respondWithFixture("statuses.json");

		final List<Status> actual = anonymousService().lookupStatuses("109302", "200", null, "100", "wonderland", 2, true).getData();

		assertThat(actual).hasSize(2);
		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/{id}/statuses");
		assertThat(request.getQueryParameters()).containsOnlyKeys("max_id", "since_id", "tagged", "limit", "exclude_reblogs");
		assertThat(request.getQueryParameters().get("limit")).containsExactly("2");
		assertThat(request.getQueryParameters().get("exclude_reblogs")).containsExactly("true");
	}

	@Test
	void absentOptionalParametersAreNotSent() {
		respond(200, "[]");

		authenticatedService().lookupFollowers("1", null);

		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/{id}/followers");
		assertThat(request.getQueryParameters()).isEmpty();
		assertThat(request.getJsonBody()).isNull();
	}

	@Test
	void followingLimit() {
		respond(200, "[]");

		authenticatedService().lookupFollowings("1", 80);

		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/{id}/following");
		assertThat(request.getQueryParameters()).containsExactly(Map.entry("limit", List.of("80")));
	}

	@Test
	void relationshipsRepeatIdsInOrder() {
		respondWithFixture("relationships.json");

		final List<Relationship> actual = authenticatedService().lookupRelationships(Arrays.asList("1", "2")).getData();

		assertThat(actual).extracting(relationship -> relationship.id).containsExactly("1", "2");
		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/relationships");
		assertThat(request.getQueryParameters().get("id[]")).containsExactly("1", "2");
	}

	@Test
	void familiarFollowersRepeatIdsInOrder() {
		respondWithFixture("familiar_followers.json");

		final List<FamiliarFollower> actual = authenticatedService().lookupFamiliarFollowers(Arrays.asList("2", "1")).getData();

		assertThat(actual).hasSize(2);
		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/familiar_followers");
		assertThat(request.getQueryParameters().get("id[]")).containsExactly("2", "1");
	}

	@Test
	void createAccountBody() {
		respondWithFixture("token.json");

		final Token actual = authenticatedService().createAccount("alice", "alice@example.com", "hunter2", true, Locale.forLanguageTag("en-GB"), null).getData();

		assertThat(actual.tokenType).isEqualTo("Bearer");
		final TransportRequest request = sentRequest();
		assertThat(request.getMethod()).isEqualTo("POST");
		assertThat(request.getPath()).isEqualTo("api/v1/accounts");
		assertThat(request.getJsonBody())
		    .containsEntry("username", "alice")
		    .containsEntry("email", "alice@example.com")
		    .containsEntry("password", "hunter2")
		    .containsEntry("agreement", true)
		    .containsEntry("locale", "en")
		    .doesNotContainKey("reason");
	}

	@Test
	void updateAccountBody() {
		respondWithFixture("account.json");

		authenticatedService().updateAccount("Alice", "Curiouser", null, false, true, new AccountDefaultSettingsParam(Visibility.PRIVATE, null, Locale.UK),
		    List.of(new AccountProfileMetaParam("Website", "https://alice.example"), new AccountProfileMetaParam("Pronouns", "she/her")));

		final TransportRequest request = sentRequest();
		assertThat(request.getMethod()).isEqualTo("PATCH");
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/update_credentials");
		final Map<String, Object> body = request.getJsonBody();
		assertThat(body).containsOnlyKeys("display_name", "note", "bot", "locked", "source", "fields_attributes");
		assertThat(body).containsEntry("display_name", "Alice").containsEntry("note", "Curiouser").containsEntry("bot", false).containsEntry("locked", true);
		assertThat(body.get("source")).isEqualTo(Map.of("privacy", Visibility.PRIVATE, "language", "en"));
		assertThat(body.get("fields_attributes")).isEqualTo(List.of(
		    Map.of("name", "Website", "value", "https://alice.example"),
		    Map.of("name", "Pronouns", "value", "she/her")));
	}

	@Test
	void updateAccountWithEmptyDefaultSettingsOmitsSource() {
		respondWithFixture("account.json");

		authenticatedService().updateAccount(null, null, true, null, null, new AccountDefaultSettingsParam(null, null, null), null);

		assertThat(sentRequest().getJsonBody()).containsOnlyKeys("discoverable");
	}

	@Test
	void avatarUpload() {
		respondWithFixture("account.json");

		authenticatedService().updateAvatarImage(IMAGE);

		final TransportRequest request = sentRequest();
		assertThat(request.getMethod()).isEqualTo("PATCH");
		assertThat(request.isMultipart()).isTrue();
		assertThat(request.getFileParts()).containsExactly(Map.entry("avatar", IMAGE));
		assertThat(request.getJsonBody()).isNull();
	}

	@Test
	void missingUploadFileIsRejectedBeforeSending() {
		final File missing = new File(IMAGE.getParentFile(), "no-such-avatar.png");

		assertThatThrownBy(() -> authenticatedService().updateAvatarImage(missing))
		    .isInstanceOf(IllegalArgumentException.class)
		    .hasMessageContaining("no-such-avatar.png");
		assertThatThrownBy(() -> authenticatedService().updateHeaderImage(IMAGE.getParentFile()))
		    .isInstanceOf(IllegalArgumentException.class);
		verifyNoInteractions(transport);
	}

	@Test
	void headerUploadUsesSameFormField() {
		respondWithFixture("account.json");

		authenticatedService().updateHeaderImage(IMAGE);

		assertThat(sentRequest().getFileParts()).containsOnlyKeys("avatar");
	}

	@Test
	void followWithOptions() {
		respondWithFixture("relationship.json");

		final Relationship actual = authenticatedService().createFollow("1", false, true, List.of(Locale.ENGLISH, Locale.forLanguageTag("fr-CA"))).getData();

		assertThat(actual.following).isTrue();
		assertThat(actual.showingReblogs).isFalse();
		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/{id}/follow");
		assertThat(request.getJsonBody())
		    .containsEntry("reblogs", false)
		    .containsEntry("notify", true)
		    .containsEntry("languages", List.of("en", "fr"));
	}

	@Test
	void followWithoutOptionsSendsEmptyBody() {
		respondWithFixture("relationship.json");

		authenticatedService().createFollow("1", null, null, null);

		assertThat(sentRequest().getJsonBody()).isEmpty();
	}

	@Test
	void muteDurationInSeconds() {
		respondWithFixture("relationship.json");

		authenticatedService().createMute("1", false, Duration.ofHours(1));

		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/{id}/mute");
		assertThat(request.getJsonBody()).containsEntry("notifications", false).containsEntry("duration", 3600L);
	}

	@Test
	void unblockPath() {
		respondWithFixture("relationship.json");

		authenticatedService().destroyBlock("7");

		final TransportRequest request = sentRequest();
		assertThat(request.getMethod()).isEqualTo("POST");
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/{id}/unblock");
		assertThat(request.getPathParameters()).containsEntry("id", "7");
		assertThat(request.getJsonBody()).isNull();
	}

	@Test
	void clearingPrivateCommentSendsEmptyComment() {
		respondWithFixture("relationship.json");

		authenticatedService().updatePrivateComment("1");

		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/accounts/{id}/note");
		assertThat(request.getJsonBody()).containsExactly(Map.entry("comment", ""));
	}

	@Test
	void searchQuery() {
		respond(200, "[]");

		authenticatedService().searchAccounts("alice", 5, true, false);

		assertThat(sentRequest().getQueryParameters())
		    .containsEntry("q", List.of("alice"))
		    .containsEntry("limit", List.of("5"))
		    .containsEntry("resolve", List.of("true"))
		    .containsEntry("following", List.of("false"));
	}

	@Test
	void createFeaturedTagBody() {
		respondWithFixture("featured_tag.json");

		assertThat(authenticatedService().createFeaturedTag("wonderland").getData().id).isEqualTo("627");
		assertThat(sentRequest().getJsonBody()).containsExactly(Map.entry("name", "wonderland"));
	}

	@Test
	void destroyFeaturedTagIsTrueForEmptyObject() {
		respond(200, "{}");

		final MastodonResponse<Boolean> actual = authenticatedService().destroyFeaturedTag("627");

		assertThat(actual.getData()).isTrue();
		final TransportRequest request = sentRequest();
		assertThat(request.getMethod()).isEqualTo("DELETE");
		assertThat(request.getPath()).isEqualTo("api/v1/featured_tags/{id}");
		assertThat(request.getPathParameters()).containsEntry("id", "627");
	}

	@Test
	void destroyFollowSuggestionIsTrueForNoContent() {
		respond(204, "");

		assertThat(authenticatedService().destroyFollowSuggestion("9").getData()).isTrue();
		assertThat(sentRequest().getPath()).isEqualTo("api/v1/suggestions/{id}");
	}

	@Test
	void destroyFollowSuggestionFailure() {
		respond(404, "{\"error\":\"Record not found\"}");

		assertThatThrownBy(() -> authenticatedService().destroyFollowSuggestion("9"))
		    .isInstanceOfSatisfying(MastodonApiException.class, e -> assertThat(e.getStatus()).isEqualTo(404))
		    .hasMessage("Record not found");
	}

	@Test
	void preferences() {
		respondWithFixture("preferences.json");

		assertThat(authenticatedService().lookupPreferences().getData().postingDefaultVisibility).isEqualTo(Visibility.PRIVATE);
		assertThat(sentRequest().getPath()).isEqualTo("api/v1/preferences");
	}

	@Test
	void followedTags() {
		respondWithFixture("tags.json");

		assertThat(authenticatedService().lookupFollowedTags(10).getData()).extracting(tag -> tag.name).containsExactly("wonderland", "teaparty");

		final TransportRequest request = sentRequest();
		assertThat(request.getPath()).isEqualTo("api/v1/followed_tags");
		assertThat(request.getQueryParameters()).containsEntry("limit", List.of("10"));
	}

	@Test
	void containedLists() {
		respondWithFixture("lists.json");

		assertThat(authenticatedService().lookupContainedLists("1").getData()).hasSize(2);
		assertThat(sentRequest().getPath()).isEqualTo("api/v1/accounts/{id}/lists");
	}

}
