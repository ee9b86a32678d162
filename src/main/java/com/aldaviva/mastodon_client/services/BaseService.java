package com.aldaviva.mastodon_client.services;

import com.aldaviva.mastodon_client.core.ClientContext;
import com.aldaviva.mastodon_client.core.MastodonCredentials;
import com.aldaviva.mastodon_client.core.MastodonResponse;
import com.aldaviva.mastodon_client.core.ResponseTransformer;
import com.aldaviva.mastodon_client.http.JacksonConfig.CustomObjectMapperProvider;
import com.aldaviva.mastodon_client.http.TransportRequest;
import com.aldaviva.mastodon_client.http.TransportResponse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends requests for an {@link Endpoint} under the credentials of a {@link ClientContext} and decodes the responses.
 */
public abstract class BaseService {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(BaseService.class);

	private final ClientContext context;
	private final ResponseTransformer responseTransformer;

	protected BaseService(final ClientContext context) {
		this(context, new ResponseTransformer(CustomObjectMapperProvider.OBJECT_MAPPER));
	}

	protected BaseService(final ClientContext context, final ResponseTransformer responseTransformer) {
		this.context = context;
		this.responseTransformer = responseTransformer;
	}

	public ClientContext getContext() {
		return context;
	}

	protected TransportRequest.Builder request(final Endpoint endpoint) {
		return TransportRequest.builder(endpoint.getMethod(), endpoint.getPath());
	}

	protected TransportRequest.Builder request(final Endpoint endpoint, final String id) {
		return request(endpoint).pathParameter("id", id);
	}

	/**
	 * Check the endpoint's {@link com.aldaviva.mastodon_client.core.UserContext} and send the request. No request is sent if the check fails.
	 * @param adHocAccessToken token to use for this call only, or <code>null</code> to use the context's token
	 */
	protected TransportResponse send(final Endpoint endpoint, final TransportRequest.Builder request, final String adHocAccessToken) {
		final MastodonCredentials credentials = context.getCredentials();
		final String accessToken = endpoint.getUserContext().resolveAccessToken(credentials.getUserAccessToken(), adHocAccessToken, endpoint.toString());
		final TransportRequest transportRequest = request.accessToken(accessToken).build();

		LOGGER.debug("Calling {} (scope {})", endpoint, endpoint.getScope());
		return context.getTransport().send(credentials.getServerBaseUri(), transportRequest);
	}

	protected <T> MastodonResponse<T> single(final Endpoint endpoint, final TransportRequest.Builder request, final Class<T> entityType) {
		return single(endpoint, request, entityType, null);
	}

	protected <T> MastodonResponse<T> single(final Endpoint endpoint, final TransportRequest.Builder request, final Class<T> entityType, final String adHocAccessToken) {
		return responseTransformer.transformSingle(send(endpoint, request, adHocAccessToken), entityType);
	}

	protected <T> MastodonResponse<List<T>> multi(final Endpoint endpoint, final TransportRequest.Builder request, final Class<T> entityType) {
		return responseTransformer.transformMulti(send(endpoint, request, null), entityType);
	}

	protected MastodonResponse<Boolean> evaluate(final Endpoint endpoint, final TransportRequest.Builder request) {
		return responseTransformer.evaluate(send(endpoint, request, null));
	}

	/**
	 * Request body fields in insertion order. Fields set to <code>null</code> are left out instead of being sent as JSON {@code null}.
	 */
	protected static final class JsonBody {

		private final Map<String, Object> fields = new LinkedHashMap<>();

		public JsonBody() {
		}

		public JsonBody put(final String name, final Object value) {
			if (value != null) {
				fields.put(name, value);
			}
			return this;
		}

		/**
		 * Like {@link #put(String, Object)}, but also leaves out empty nested objects.
		 */
		public JsonBody putObject(final String name, final JsonBody value) {
			if (value != null && !value.isEmpty()) {
				fields.put(name, value.toMap());
			}
			return this;
		}

		public boolean isEmpty() {
			return fields.isEmpty();
		}

		public Map<String, Object> toMap() {
			return fields;
		}
	}
}
