package com.aldaviva.mastodon_client.services;

import com.aldaviva.mastodon_client.core.Scope;
import com.aldaviva.mastodon_client.core.UserContext;

/**
 * Route of one REST operation: how it is called and with which credentials.
 */
public interface Endpoint {

	/**
	 * @return one of the {@link jakarta.ws.rs.HttpMethod} constants
	 */
	String getMethod();

	/**
	 * @return path relative to the instance root, with <code>{name}</code> placeholders for path parameters
	 */
	String getPath();

	UserContext getUserContext();

	/**
	 * @return the OAuth scope the server checks, or <code>null</code> if the endpoint is anonymous
	 */
	Scope getScope();

}
