package com.aldaviva.mastodon_client.data;

import static org.assertj.core.api.Assertions.assertThat;

import com.aldaviva.mastodon_client.Fixtures;
import com.aldaviva.mastodon_client.http.JacksonConfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class EntityMappingTest {

	private static final ObjectMapper OBJECT_MAPPER = JacksonConfig.createObjectMapper();

	private static <T> T readFixture(final String name, final Class<T> type) throws Exception {
		return OBJECT_MAPPER.readValue(Fixtures.read(name), type);
	}

	private static <T> List<T> readFixtureList(final String name, final Class<T> type) throws Exception {
		return OBJECT_MAPPER.readValue(Fixtures.read(name), OBJECT_MAPPER.getTypeFactory().constructCollectionType(List.class, type));
	}

	static Stream<Arguments> accountFields() {
		return Stream.of(
		    Arguments.of("id", (Function<Account, Object>) a -> a.id, "109302"),
		    Arguments.of("username", (Function<Account, Object>) a -> a.username, "alice"),
		    Arguments.of("acct", (Function<Account, Object>) a -> a.acct, "alice"),
		    Arguments.of("display_name", (Function<Account, Object>) a -> a.displayName, "Alice Liddell"),
		    Arguments.of("locked", (Function<Account, Object>) a -> a.locked, false),
		    Arguments.of("discoverable", (Function<Account, Object>) a -> a.discoverable, true),
		    Arguments.of("created_at", (Function<Account, Object>) a -> a.createdAt, Instant.parse("2022-11-08T00:00:00Z")),
		    Arguments.of("note", (Function<Account, Object>) a -> a.note, "<p>Curiouser and curiouser</p>"),
		    Arguments.of("url", (Function<Account, Object>) a -> a.url, URI.create("https://mastodon.example/@alice")),
		    Arguments.of("avatar", (Function<Account, Object>) a -> a.avatar, URI.create("https://files.mastodon.example/accounts/avatars/alice.png")),
		    Arguments.of("header", (Function<Account, Object>) a -> a.header, URI.create("https://files.mastodon.example/accounts/headers/alice.png")),
		    Arguments.of("followers_count", (Function<Account, Object>) a -> a.followersCount, 12),
		    Arguments.of("following_count", (Function<Account, Object>) a -> a.followingCount, 34),
		    Arguments.of("statuses_count", (Function<Account, Object>) a -> a.statusesCount, 56),
		    Arguments.of("last_status_at", (Function<Account, Object>) a -> a.lastStatusAt, LocalDate.of(2024, 3, 1)),
		    Arguments.of("emojis[0].shortcode", (Function<Account, Object>) a -> a.emojis.get(0).shortcode, "rabbit"),
		    Arguments.of("fields[0].verified_at", (Function<Account, Object>) a -> a.fields.get(0).verifiedAt, Instant.parse("2023-01-02T03:04:05Z")),
		    Arguments.of("fields[1].value", (Function<Account, Object>) a -> a.fields.get(1).value, "she/her"),
		    Arguments.of("source.privacy", (Function<Account, Object>) a -> a.source.privacy, Visibility.UNLISTED),
		    Arguments.of("source.follow_requests_count", (Function<Account, Object>) a -> a.source.followRequestsCount, 2),
		    Arguments.of("moved", (Function<Account, Object>) a -> a.moved, null));
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("accountFields")
	void account(final String jsonField, final Function<Account, Object> getter, final Object expected) throws Exception {
		assertThat(getter.apply(readFixture("account.json", Account.class))).isEqualTo(expected);
	}

	@Test
	void statuses() throws Exception {
		final List<Status> statuses = readFixtureList("statuses.json", Status.class);

		final Status first = statuses.get(0);
		assertThat(first.createdAt).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
		assertThat(first.visibility).isEqualTo(Visibility.PUBLIC);
		assertThat(first.account.id).isEqualTo("109302");
		assertThat(first.favouritesCount).isEqualTo(3);
		assertThat(first.editedAt).isNull();
		assertThat(first.mediaAttachments).singleElement().satisfies(media -> {
			assertThat(media.type).isEqualTo("image");
			assertThat(media.description).isEqualTo("A rabbit");
		});
		assertThat(first.mentions).extracting(mention -> mention.acct).containsExactly("hatter@tea.example");
		assertThat(first.tags).extracting(tag -> tag.name).containsExactly("wonderland");

		final Status boost = statuses.get(1);
		assertThat(boost.visibility).as("unknown enum value").isNull();
		assertThat(boost.reblog.id).isEqualTo("42");
		assertThat(boost.reblog.account.username).isEqualTo("queen");
		assertThat(boost.mediaAttachments).isNull();
	}

	@Test
	void relationships() throws Exception {
		final List<Relationship> relationships = readFixtureList("relationships.json", Relationship.class);

		assertThat(relationships).extracting(relationship -> relationship.id).containsExactly("1", "2");
		final Relationship first = relationships.get(0);
		assertThat(first.following).isTrue();
		assertThat(first.showingReblogs).isTrue();
		assertThat(first.notifying).isFalse();
		assertThat(first.languages).containsExactly("en", "fr");
		assertThat(first.followedBy).isTrue();
		assertThat(first.endorsed).isTrue();
		assertThat(first.note).isEqualTo("Met at the tea party");
		assertThat(relationships.get(1).blocking).isTrue();
		assertThat(relationships.get(1).mutingNotifications).isNull();
	}

	@Test
	void tags() throws Exception {
		final List<Tag> tags = readFixtureList("tags.json", Tag.class);

		assertThat(tags).extracting(tag -> tag.name).containsExactly("wonderland", "teaparty");
		final TagHistory day = tags.get(0).history.get(0);
		assertThat(day.uses).isEqualTo("14");
		assertThat(day.accounts).isEqualTo("9");
		assertThat(day.getDayStart()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
		assertThat(tags.get(0).following).isTrue();
		assertThat(tags.get(1).history).isEmpty();
	}

	@Test
	void featuredTag() throws Exception {
		final FeaturedTag actual = readFixture("featured_tag.json", FeaturedTag.class);

		assertThat(actual.id).isEqualTo("627");
		assertThat(actual.name).isEqualTo("wonderland");
		assertThat(actual.statusesCount).isEqualTo(8);
		assertThat(actual.lastStatusAt).isEqualTo(LocalDate.of(2024, 3, 1));
	}

	@Test
	void token() throws Exception {
		final Token actual = readFixture("token.json", Token.class);

		assertThat(actual.accessToken).isEqualTo("ZA-Yj3aBD8U8Cm7lKUp-lm9O9BmDgdhHzDeqsY8tlL0");
		assertThat(actual.tokenType).isEqualTo("Bearer");
		assertThat(actual.scope).isEqualTo("read write follow push");
		assertThat(actual.createdAt).isEqualTo(Instant.ofEpochSecond(1573979017));
	}

	@Test
	void lists() throws Exception {
		final List<UserList> lists = readFixtureList("lists.json", UserList.class);

		assertThat(lists).extracting(list -> list.title).containsExactly("Friends", "Court");
		assertThat(lists).extracting(list -> list.repliesPolicy).containsExactly(RepliesPolicy.FOLLOWED, RepliesPolicy.LIST);
	}

	@Test
	void preferences() throws Exception {
		final AccountPreferences actual = readFixture("preferences.json", AccountPreferences.class);

		assertThat(actual.postingDefaultVisibility).isEqualTo(Visibility.PRIVATE);
		assertThat(actual.postingDefaultSensitive).isTrue();
		assertThat(actual.postingDefaultLanguage).isNull();
		assertThat(actual.readingExpandMedia).isEqualTo(ExpandMedia.SHOW_ALL);
		assertThat(actual.readingExpandSpoilers).isFalse();
	}

	@Test
	void familiarFollowers() throws Exception {
		final List<FamiliarFollower> actual = readFixtureList("familiar_followers.json", FamiliarFollower.class);

		assertThat(actual).extracting(follower -> follower.id).containsExactly("1", "2");
		assertThat(actual.get(0).accounts).extracting(account -> account.username).containsExactly("hatter", "dormouse");
		assertThat(actual.get(1).accounts).isEmpty();
	}

}
