package com.aldaviva.mastodon_client;

import com.aldaviva.mastodon_client.config.ConfigurationFactory;
import com.aldaviva.mastodon_client.config.MastodonConfiguration;
import com.aldaviva.mastodon_client.data.Account;
import com.aldaviva.mastodon_client.exceptions.MastodonException;

import java.nio.file.Paths;

/**
 * Checks a configuration against its instance.
 *
 * <pre>
 * java com.aldaviva.mastodon_client.Main [acct [config.properties]]
 * </pre>
 *
 * With no {@code acct}, verifies the configured access token and logs the authenticated account. Otherwise looks up {@code acct}, such as
 * {@code alice@mastodon.social}, and logs it. Without a properties file, configuration comes from {@code mastodon.properties} on the classpath and
 * {@code mastodon.*} system properties.
 */
public class Main {

	/** Classpath resource Logback reads when the command line is run without its own {@code logback.configurationFile} */
	static final String LOGGING_CONFIGURATION = "mastodon-cli-logback.xml";

	static {
		// must happen before the first logger is created
		if (System.getProperty("logback.configurationFile") == null) {
			System.setProperty("logback.configurationFile", LOGGING_CONFIGURATION);
		}
	}

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(Main.class);

	public static void main(final String[] args) {
		final MastodonConfiguration configuration = args.length >= 2 ? ConfigurationFactory.load(Paths.get(args[1])) : ConfigurationFactory.load();
		final String accountAddress = args.length >= 1 ? args[0] : null;

		final int exitCode;
		try (MastodonClient mastodon = new MastodonClient(configuration)) {
			exitCode = run(mastodon, accountAddress);
		}
		System.exit(exitCode);
	}

	/**
	 * @param accountAddress account to look up, or <code>null</code> to verify the client's credentials
	 * @return process exit code, {@code 0} if the account was found or {@code 1} if the call failed
	 */
	static int run(final MastodonClient mastodon, final String accountAddress) {
		try {
			final Account account;
			if (accountAddress == null) {
				LOGGER.info("Verifying credentials for {}...", mastodon.getContext().getCredentials().getServerBaseUri());
				account = mastodon.accounts().verifyAccountCredentials().getData();
				LOGGER.info("Signed in as {} ({})", account.acct, account.id);
			} else {
				LOGGER.info("Looking up {}...", accountAddress);
				account = mastodon.accounts().lookupAccountFromWebFingerAddress(accountAddress, null).getData();
				LOGGER.info("Found {} ({}): {} followers, {} following, {} statuses", account.acct, account.id, account.followersCount, account.followingCount,
				    account.statusesCount);
			}
			LOGGER.debug("{}", account);
			return 0;
		} catch (final MastodonException e) {
			LOGGER.error("Call failed: {}", e.getMessage(), e);
			return 1;
		}
	}

}
