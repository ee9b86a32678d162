package com.aldaviva.mastodon_client.http;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.client.ClientRequestContext;
import jakarta.ws.rs.client.ClientRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import java.io.IOException;
import java.util.Arrays;

/**
 * Sends the access token stored in the {@link #ACCESS_TOKEN_PROPERTY} request property as an OAuth 2.0 bearer token.
 * Requests without the property are sent anonymously, and an {@code Authorization} header set on the request is never replaced.
 */
@Priority(Priorities.AUTHENTICATION)
public class BearerAuthenticationFilter implements ClientRequestFilter {

	public static final String ACCESS_TOKEN_PROPERTY = BearerAuthenticationFilter.class.getName() + ".accessToken";

	@Override
	public void filter(final ClientRequestContext requestContext) throws IOException {
		final Object accessToken = requestContext.getProperty(ACCESS_TOKEN_PROPERTY);
		if (accessToken != null) {
			requestContext.getHeaders().putIfAbsent(HttpHeaders.AUTHORIZATION, Arrays.asList("Bearer " + accessToken));
		}
	}

}
