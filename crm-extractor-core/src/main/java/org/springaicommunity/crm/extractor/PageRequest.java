package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters for fetching one page of records.
 *
 * @param cursor pagination cursor, or null for the first page
 * @param batchSize requested page size; clamped to {@link #MAX_BATCH_SIZE} when sent
 * @param properties properties to request; empty means the default property set
 * @param associations association types to request; empty means none
 * @param includeArchived whether archived records are listed
 * @param extraParams additional query parameters forwarded to the API
 */
public record PageRequest(@Nullable String cursor, int batchSize, List<String> properties, List<String> associations,
		boolean includeArchived, Map<String, String> extraParams) {

	/**
	 * Hard maximum page size accepted by the list endpoint.
	 */
	public static final int MAX_BATCH_SIZE = 100;

	public PageRequest {
		properties = List.copyOf(properties);
		associations = List.copyOf(associations);
		extraParams = Collections.unmodifiableMap(new LinkedHashMap<>(extraParams));
	}

	public static PageRequest first(int batchSize) {
		return new PageRequest(null, batchSize, List.of(), List.of(), false, Map.of());
	}

	public PageRequest withCursor(@Nullable String newCursor) {
		return new PageRequest(newCursor, batchSize, properties, associations, includeArchived, extraParams);
	}

	/**
	 * Page size that is actually sent, never above {@link #MAX_BATCH_SIZE} and never below 1.
	 */
	public int effectiveBatchSize() {
		return Math.max(1, Math.min(batchSize, MAX_BATCH_SIZE));
	}

}
