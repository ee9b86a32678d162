package com.aldaviva.mastodon_client.config;

import com.aldaviva.mastodon_client.core.MastodonCredentials;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Reads {@link MastodonConfiguration} from properties files. System properties with the same names override values from files.
 *
 * <pre>
 * mastodon.instance=mastodon.social
 * mastodon.clientKey=...
 * mastodon.clientSecret=...
 * mastodon.accessToken=...
 * mastodon.connectTimeoutMillis=5000
 * mastodon.readTimeoutMillis=30000
 * mastodon.httpLogging=false
 * </pre>
 */
public final class ConfigurationFactory {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(ConfigurationFactory.class);

	public static final String DEFAULT_RESOURCE = "/mastodon.properties";

	public static final String INSTANCE = "mastodon.instance";
	public static final String CLIENT_KEY = "mastodon.clientKey";
	public static final String CLIENT_SECRET = "mastodon.clientSecret";
	public static final String ACCESS_TOKEN = "mastodon.accessToken";
	public static final String CONNECT_TIMEOUT_MILLIS = "mastodon.connectTimeoutMillis";
	public static final String READ_TIMEOUT_MILLIS = "mastodon.readTimeoutMillis";
	public static final String HTTP_LOGGING = "mastodon.httpLogging";

	private ConfigurationFactory() {
	}

	/**
	 * Load {@code mastodon.properties} from the root of the classpath, if it exists, overridden by system properties.
	 */
	public static MastodonConfiguration load() {
		final Properties properties = new Properties();
		try (InputStream resource = ConfigurationFactory.class.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (resource != null) {
				LOGGER.debug("Loading configuration from classpath resource {}", DEFAULT_RESOURCE);
				properties.load(resource);
			}
		} catch (final IOException e) {
			throw new IllegalStateException("Failed to read classpath resource " + DEFAULT_RESOURCE, e);
		}
		return fromProperties(withSystemOverrides(properties));
	}

	/**
	 * Load a UTF-8 properties file, overridden by system properties.
	 */
	public static MastodonConfiguration load(final Path propertiesFile) {
		final Properties properties = new Properties();
		try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
			LOGGER.debug("Loading configuration from {}", propertiesFile);
			properties.load(reader);
		} catch (final IOException e) {
			throw new IllegalStateException("Failed to read configuration file " + propertiesFile, e);
		}
		return fromProperties(withSystemOverrides(properties));
	}

	/**
	 * Parse configuration from already-loaded properties, without consulting system properties.
	 * @throws IllegalArgumentException if {@link #INSTANCE} is missing or a value cannot be parsed
	 */
	public static MastodonConfiguration fromProperties(final Properties properties) {
		final URI serverBaseUri = parseInstance(getRequired(properties, INSTANCE));
		final MastodonCredentials credentials = new MastodonCredentials(serverBaseUri, getOptional(properties, CLIENT_KEY), getOptional(properties, CLIENT_SECRET),
		    getOptional(properties, ACCESS_TOKEN));

		return MastodonConfiguration.builder(credentials)
		    .connectTimeout(getDuration(properties, CONNECT_TIMEOUT_MILLIS))
		    .readTimeout(getDuration(properties, READ_TIMEOUT_MILLIS))
		    .httpLoggingEnabled(Boolean.parseBoolean(getOptional(properties, HTTP_LOGGING)))
		    .build();
	}

	/**
	 * @param instance a hostname like {@code mastodon.social}, or an absolute URI like {@code https://mastodon.social/}
	 * @return the root URI of the instance, always ending with a slash
	 */
	public static URI parseInstance(final String instance) {
		final String trimmed = instance.trim();
		final String absolute = trimmed.contains("://") ? trimmed : "https://" + trimmed;
		try {
			final URI uri = new URI(absolute.endsWith("/") ? absolute : absolute + "/");
			if (uri.getHost() == null) {
				throw new IllegalArgumentException(INSTANCE + " has no host: " + instance);
			}
			return uri;
		} catch (final URISyntaxException e) {
			throw new IllegalArgumentException(INSTANCE + " is not a valid hostname or URI: " + instance, e);
		}
	}

	private static Properties withSystemOverrides(final Properties fileProperties) {
		final Properties merged = new Properties();
		merged.putAll(fileProperties);
		for (final String name : System.getProperties().stringPropertyNames()) {
			if (name.startsWith("mastodon.")) {
				merged.setProperty(name, System.getProperty(name));
			}
		}
		return merged;
	}

	private static String getRequired(final Properties properties, final String key) {
		final String value = getOptional(properties, key);
		if (value == null) {
			throw new IllegalArgumentException("Missing required configuration property " + key);
		}
		return value;
	}

	private static String getOptional(final Properties properties, final String key) {
		final String value = properties.getProperty(key);
		return value == null || value.isBlank() ? null : value.trim();
	}

	private static Duration getDuration(final Properties properties, final String key) {
		final String value = getOptional(properties, key);
		if (value == null) {
			return null;
		}
		try {
			final long millis = Long.parseLong(value);
			if (millis < 0) {
				throw new IllegalArgumentException(key + " must not be negative, but was " + value);
			}
			return Duration.ofMillis(millis);
		} catch (final NumberFormatException e) {
			throw new IllegalArgumentException(key + " must be a whole number of milliseconds, but was " + value, e);
		}
	}
}
