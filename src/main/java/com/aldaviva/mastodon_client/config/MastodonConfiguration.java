package com.aldaviva.mastodon_client.config;

import com.aldaviva.mastodon_client.core.MastodonCredentials;

import java.time.Duration;

/**
 * Everything needed to construct a {@link com.aldaviva.mastodon_client.MastodonClient}. Instances are immutable; build them with {@link #builder(MastodonCredentials)}
 * or load them with {@link ConfigurationFactory}.
 */
public final class MastodonConfiguration {

	private final MastodonCredentials credentials;
	private final Duration connectTimeout;
	private final Duration readTimeout;
	private final boolean httpLoggingEnabled;

	private MastodonConfiguration(final Builder builder) {
		credentials = builder.credentials;
		connectTimeout = builder.connectTimeout;
		readTimeout = builder.readTimeout;
		httpLoggingEnabled = builder.httpLoggingEnabled;
	}

	public static Builder builder(final MastodonCredentials credentials) {
		return new Builder(credentials);
	}

	public MastodonCredentials getCredentials() {
		return credentials;
	}

	/**
	 * @return how long to wait for a TCP connection, or <code>null</code> to use the HTTP client's default
	 */
	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	/**
	 * @return how long to wait for response data, or <code>null</code> to use the HTTP client's default
	 */
	public Duration getReadTimeout() {
		return readTimeout;
	}

	/**
	 * @return whether request and response headers and bodies are logged to the {@code http} logger
	 */
	public boolean isHttpLoggingEnabled() {
		return httpLoggingEnabled;
	}

	@Override
	public String toString() {
		return String.format("MastodonConfiguration [credentials=%s, connectTimeout=%s, readTimeout=%s, httpLoggingEnabled=%s]", credentials, connectTimeout, readTimeout,
		    httpLoggingEnabled);
	}

	public static final class Builder {

		private final MastodonCredentials credentials;
		private Duration connectTimeout;
		private Duration readTimeout;
		private boolean httpLoggingEnabled;

		private Builder(final MastodonCredentials credentials) {
			if (credentials == null) {
				throw new IllegalArgumentException("credentials are required");
			}
			this.credentials = credentials;
		}

		public Builder connectTimeout(final Duration connectTimeout) {
			this.connectTimeout = connectTimeout;
			return this;
		}

		public Builder readTimeout(final Duration readTimeout) {
			this.readTimeout = readTimeout;
			return this;
		}

		public Builder httpLoggingEnabled(final boolean httpLoggingEnabled) {
			this.httpLoggingEnabled = httpLoggingEnabled;
			return this;
		}

		public MastodonConfiguration build() {
			return new MastodonConfiguration(this);
		}
	}
}
