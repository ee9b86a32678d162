package com.aldaviva.mastodon_client.exceptions;

/**
 * The server answered with a non-2xx status. The message is the {@code error} property of the response body, or a generic description of the status code
 * if the body did not contain one.
 */
public class MastodonApiException extends MastodonException {

	private static final long serialVersionUID = 1L;

	private final int status;
	private final String error;
	private final String errorDescription;

	public MastodonApiException(final int status, final String error, final String errorDescription) {
		super(error);
		this.status = status;
		this.error = error;
		this.errorDescription = errorDescription;
	}

	public int getStatus() {
		return status;
	}

	public String getError() {
		return error;
	}

	/**
	 * @return the {@code error_description} sent by OAuth endpoints, or <code>null</code> if the server did not send one
	 */
	public String getErrorDescription() {
		return errorDescription;
	}

	@Override
	public String toString() {
		return String.format("MastodonApiException [status=%d, error=%s, errorDescription=%s]", status, error, errorDescription);
	}

}
