package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A CRM object as returned by the list endpoint, before normalization.
 *
 * @param id object id
 * @param properties property values keyed by property name; values are strings, numbers,
 * booleans or null exactly as decoded from JSON
 * @param associations association payload keyed by association type
 * @param createdAt creation timestamp as sent by the API
 * @param updatedAt last update timestamp as sent by the API
 * @param archived whether the object is archived
 */
public record RawRecord(@Nullable String id, Map<String, @Nullable Object> properties,
		Map<String, @Nullable Object> associations, @Nullable String createdAt, @Nullable String updatedAt,
		boolean archived) {

	public RawRecord {
		properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
		associations = Collections.unmodifiableMap(new LinkedHashMap<>(associations));
	}

	@Nullable
	public Object property(String name) {
		return properties.get(name);
	}

	@Nullable
	public String stringProperty(String name) {
		Object value = properties.get(name);
		return value != null ? value.toString() : null;
	}

}
