package com.aldaviva.mastodon_client.exceptions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonMappingException.Reference;

/**
 * A 2xx response body could not be decoded into the entity the endpoint returns, either because it was not JSON or because a required field was missing
 * or had the wrong type.
 */
public class MastodonDataException extends MastodonException {

	private static final long serialVersionUID = 1L;

	private final Class<?> entityType;
	private final String fieldPath;

	public MastodonDataException(final Class<?> entityType, final JsonProcessingException cause) {
		this(entityType, getFieldPath(cause), cause);
	}

	private MastodonDataException(final Class<?> entityType, final String fieldPath, final JsonProcessingException cause) {
		super("Failed to decode " + entityType.getSimpleName() + (fieldPath.isEmpty() ? "" : " at " + fieldPath) + ": " + cause.getOriginalMessage(), cause);
		this.entityType = entityType;
		this.fieldPath = fieldPath;
	}

	public Class<?> getEntityType() {
		return entityType;
	}

	/**
	 * @return JSON path of the offending field, like {@code [2].account.id}, or an empty string if the body was not parseable at all
	 */
	public String getFieldPath() {
		return fieldPath;
	}

	private static String getFieldPath(final JsonProcessingException cause) {
		if (!(cause instanceof JsonMappingException)) {
			return "";
		}

		final StringBuilder path = new StringBuilder();
		for (final Reference reference : ((JsonMappingException) cause).getPath()) {
			if (reference.getFieldName() != null) {
				if (path.length() != 0) {
					path.append('.');
				}
				path.append(reference.getFieldName());
			} else if (reference.getIndex() >= 0) {
				path.append('[').append(reference.getIndex()).append(']');
			}
		}
		return path.toString();
	}

}
