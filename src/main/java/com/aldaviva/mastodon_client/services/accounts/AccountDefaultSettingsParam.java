package com.aldaviva.mastodon_client.services.accounts;

import com.aldaviva.mastodon_client.data.Visibility;

import java.util.Locale;

/**
 * Default settings for new statuses, changed with {@link AccountsV1Service#updateAccount}. Any setting may be <code>null</code> to leave it unchanged.
 */
public final class AccountDefaultSettingsParam {

	private final Visibility privacy;
	private final Boolean sensitive;
	private final Locale language;

	/**
	 * @param privacy default visibility of new statuses
	 * @param sensitive whether new statuses are marked sensitive by default
	 * @param language default language of new statuses, sent as its ISO 639-1 code
	 */
	public AccountDefaultSettingsParam(final Visibility privacy, final Boolean sensitive, final Locale language) {
		this.privacy = privacy;
		this.sensitive = sensitive;
		this.language = language;
	}

	public Visibility getPrivacy() {
		return privacy;
	}

	public Boolean getSensitive() {
		return sensitive;
	}

	public Locale getLanguage() {
		return language;
	}

}
