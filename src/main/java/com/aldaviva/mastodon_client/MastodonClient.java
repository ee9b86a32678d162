package com.aldaviva.mastodon_client;

import com.aldaviva.mastodon_client.config.MastodonConfiguration;
import com.aldaviva.mastodon_client.core.ClientContext;
import com.aldaviva.mastodon_client.http.HttpClientFactory;
import com.aldaviva.mastodon_client.http.JerseyMastodonTransport;
import com.aldaviva.mastodon_client.services.accounts.AccountsV1Service;

/**
 * Entry point for calling a Mastodon instance.
 *
 * <pre>
 * try (MastodonClient mastodon = new MastodonClient(ConfigurationFactory.load())) {
 * 	Account me = mastodon.accounts().verifyAccountCredentials().getData();
 * }
 * </pre>
 *
 * Thread-safe. To act as several users at once, derive clients with {@link #withAccessToken(String)}; they share this client's connections.
 */
public class MastodonClient implements AutoCloseable {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(MastodonClient.class);

	private final ClientContext context;
	private final boolean ownsTransport;
	private final AccountsV1Service accounts;

	/**
	 * Create a client with its own HTTP connections, which {@link #close()} releases.
	 */
	public MastodonClient(final MastodonConfiguration configuration) {
		this(new ClientContext(configuration.getCredentials(), new JerseyMastodonTransport(HttpClientFactory.createHttpClient(configuration), true)), true);
		LOGGER.debug("Created client for {}", configuration);
	}

	/**
	 * Create a client that uses an existing context. {@link #close()} does not close the context's transport.
	 */
	public MastodonClient(final ClientContext context) {
		this(context, false);
	}

	private MastodonClient(final ClientContext context, final boolean ownsTransport) {
		this.context = context;
		this.ownsTransport = ownsTransport;
		accounts = AccountsV1Service.newInstance(context);
	}

	public AccountsV1Service accounts() {
		return accounts;
	}

	public ClientContext getContext() {
		return context;
	}

	/**
	 * @param userAccessToken bearer token of another user, or <code>null</code> for anonymous calls
	 * @return a client for the same instance acting as another user, sharing this client's connections, which stay open until this client is closed
	 */
	public MastodonClient withAccessToken(final String userAccessToken) {
		return new MastodonClient(context.withUserAccessToken(userAccessToken), false);
	}

	@Override
	public void close() {
		if (ownsTransport) {
			context.getTransport().close();
		}
	}

}
