package com.aldaviva.mastodon_client.http;

import com.aldaviva.mastodon_client.config.MastodonConfiguration;
import com.aldaviva.mastodon_client.http.JacksonConfig.CustomObjectMapperProvider;

import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.glassfish.jersey.apache5.connector.Apache5ConnectorProvider;
import org.glassfish.jersey.client.ClientConfig;
import org.glassfish.jersey.client.ClientProperties;
import org.glassfish.jersey.jackson.JacksonFeature;
import org.glassfish.jersey.logging.LoggingFeature;
import org.slf4j.bridge.SLF4JBridgeHandler;

public final class HttpClientFactory {

	public static final String HTTP_LOGGER_NAME = "http";

	private HttpClientFactory() {
	}

	/**
	 * Create a Jersey client that reads and writes JSON with Jackson and can send PATCH requests, which the default {@code HttpURLConnection} connector can't.
	 */
	public static Client createHttpClient(final MastodonConfiguration configuration) {
		final ClientConfig clientConfig = new ClientConfig();
		clientConfig.register(CustomObjectMapperProvider.class);
		clientConfig.register(JacksonFeature.class);
		setTimeout(clientConfig, ClientProperties.CONNECT_TIMEOUT, configuration.getConnectTimeout());
		setTimeout(clientConfig, ClientProperties.READ_TIMEOUT, configuration.getReadTimeout());
		clientConfig.property(ClientProperties.FOLLOW_REDIRECTS, false);
		clientConfig.connectorProvider(new Apache5ConnectorProvider());

		if (configuration.isHttpLoggingEnabled()) {
			if (!SLF4JBridgeHandler.isInstalled()) {
				SLF4JBridgeHandler.removeHandlersForRootLogger();
				SLF4JBridgeHandler.install();
			}

			final Logger httpLogger = Logger.getLogger(HTTP_LOGGER_NAME);
			httpLogger.setLevel(Level.ALL);
			clientConfig.register(new LoggingFeature(httpLogger, LoggingFeature.Verbosity.PAYLOAD_ANY));
		}

		return ClientBuilder.newClient(clientConfig);
	}

	private static void setTimeout(final ClientConfig clientConfig, final String property, final Duration timeout) {
		if (timeout != null) {
			clientConfig.property(property, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
		}
	}

}
