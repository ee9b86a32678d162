package com.aldaviva.mastodon_client;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

public final class Fixtures {

	private Fixtures() {
	}

	/**
	 * @param name file name under {@code src/test/resources/fixtures}, like {@code account.json}
	 */
	public static String read(final String name) {
		try (InputStream resource = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
			if (resource == null) {
				throw new IllegalArgumentException("No such fixture: " + name);
			}
			return new String(resource.readAllBytes(), StandardCharsets.UTF_8);
		} catch (final IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * @param name file name under {@code src/test/resources/fixtures}, like {@code avatar.png}
	 */
	public static File file(final String name) {
		final URL resource = Fixtures.class.getResource("/fixtures/" + name);
		if (resource == null) {
			throw new IllegalArgumentException("No such fixture: " + name);
		}
		try {
			return new File(resource.toURI());
		} catch (final URISyntaxException e) {
			throw new IllegalArgumentException("Fixture " + name + " is not a file", e);
		}
	}

}
