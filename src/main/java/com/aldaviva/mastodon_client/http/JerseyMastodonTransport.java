package com.aldaviva.mastodon_client.http;

import com.aldaviva.mastodon_client.exceptions.MastodonConnectionException;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.Invocation;
import jakarta.ws.rs.client.WebTarget;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.glassfish.jersey.media.multipart.FormDataMultiPart;
import org.glassfish.jersey.media.multipart.MultiPartFeature;
import org.glassfish.jersey.media.multipart.file.FileDataBodyPart;
import org.glassfish.jersey.uri.UriComponent;

public class JerseyMastodonTransport implements MastodonTransport {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(JerseyMastodonTransport.class);

	private final Client httpClient;
	private final boolean closeClient;

	/**
	 * @param httpClient Jersey client with a JSON provider, such as one from {@link HttpClientFactory#createHttpClient}
	 * @param closeClient whether {@link #close()} should also close {@code httpClient}
	 */
	public JerseyMastodonTransport(final Client httpClient, final boolean closeClient) {
		this.httpClient = httpClient
		    .register(BearerAuthenticationFilter.class)
		    .register(MultiPartFeature.class);
		this.closeClient = closeClient;
	}

	@Override
	public TransportResponse send(final URI serverBaseUri, final TransportRequest request) {
		final WebTarget target = target(serverBaseUri, request);
		final URI uri = target.getUri();

		final Invocation.Builder invocation = target
		    .request(MediaType.APPLICATION_JSON_TYPE)
		    .property(BearerAuthenticationFilter.ACCESS_TOKEN_PROPERTY, request.getAccessToken());

		if (request.isMultipart()) {
			try (FormDataMultiPart requestBody = new FormDataMultiPart()) {
				for (final Map.Entry<String, File> filePart : request.getFileParts().entrySet()) {
					requestBody.bodyPart(new FileDataBodyPart(filePart.getKey(), filePart.getValue()));
				}
				return execute(request.getMethod(), uri, invocation, Entity.entity(requestBody, requestBody.getMediaType()));
			} catch (final IOException e) {
				throw new UncheckedIOException("Failed to close multipart request body for " + uri, e);
			}
		} else if (request.getJsonBody() != null) {
			return execute(request.getMethod(), uri, invocation, Entity.json(request.getJsonBody()));
		} else {
			return execute(request.getMethod(), uri, invocation, null);
		}
	}

	protected WebTarget target(final URI serverBaseUri, final TransportRequest request) {
		WebTarget target = httpClient.target(serverBaseUri).path(request.getPath());

		if (!request.getPathParameters().isEmpty()) {
			target = target.resolveTemplates(new LinkedHashMap<String, Object>(request.getPathParameters()));
		}

		// Pre-encoded so that braces in values are not mistaken for URI templates. Jersey leaves existing %XX escapes alone.
		for (final Map.Entry<String, List<String>> queryParameter : request.getQueryParameters().entrySet()) {
			final Object[] values = queryParameter.getValue().stream().map(JerseyMastodonTransport::encodeQueryComponent).toArray();
			target = target.queryParam(encodeQueryComponent(queryParameter.getKey()), values);
		}

		return target;
	}

	private TransportResponse execute(final String method, final URI uri, final Invocation.Builder invocation, final Entity<?> entity) {
		LOGGER.debug("{} {}", method, uri);
		try (Response response = entity != null ? invocation.method(method, entity) : invocation.method(method)) {
			final String body = response.hasEntity() ? response.readEntity(String.class) : "";
			LOGGER.debug("{} {} returned status {}", method, uri, response.getStatus());
			return new TransportResponse(response.getStatus(), new LinkedHashMap<>(response.getStringHeaders()), body);
		} catch (final ProcessingException e) {
			throw new MastodonConnectionException(method, uri, e.getCause() != null ? e.getCause() : e);
		}
	}

	private static String encodeQueryComponent(final String value) {
		return UriComponent.encode(value, UriComponent.Type.QUERY_PARAM_SPACE_ENCODED);
	}

	@Override
	public void close() {
		if (closeClient) {
			httpClient.close();
		}
	}

}
