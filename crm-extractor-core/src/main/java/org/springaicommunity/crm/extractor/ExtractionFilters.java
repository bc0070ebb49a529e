package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-supplied filter and pacing parameters for one extraction run. The paginator
 * passes them through to the {@link PageFetcher} without interpreting them.
 *
 * @param properties properties to request; empty means the default set
 * @param associationTypes association types to request when {@code includeAssociations}
 * @param includeAssociations whether association types are requested at all
 * @param includeArchived whether archived records are listed
 * @param batchSize requested page size, at most 100 is sent
 * @param checkpointInterval write an {@code in_progress} checkpoint every this many pages
 * @param maxPages stop after this many pages in total, counting pages of earlier runs
 * @param extraParams additional query parameters
 */
public record ExtractionFilters(List<String> properties, List<String> associationTypes, boolean includeAssociations,
		boolean includeArchived, int batchSize, int checkpointInterval, int maxPages,
		Map<String, String> extraParams) {

	public static final int DEFAULT_BATCH_SIZE = 100;

	public static final int DEFAULT_CHECKPOINT_INTERVAL = 5;

	public static final int DEFAULT_MAX_PAGES = 10_000;

	public ExtractionFilters {
		properties = List.copyOf(properties);
		associationTypes = List.copyOf(associationTypes);
		extraParams = Collections.unmodifiableMap(new LinkedHashMap<>(extraParams));
		if (batchSize < 1) {
			throw new IllegalArgumentException("batchSize must be at least 1");
		}
		if (checkpointInterval < 1) {
			throw new IllegalArgumentException("checkpointInterval must be at least 1");
		}
		if (maxPages < 1) {
			throw new IllegalArgumentException("maxPages must be at least 1");
		}
	}

	public static ExtractionFilters defaults() {
		return new ExtractionFilters(List.of(), List.of(), false, false, DEFAULT_BATCH_SIZE,
				DEFAULT_CHECKPOINT_INTERVAL, DEFAULT_MAX_PAGES, Map.of());
	}

	public ExtractionFilters withProperties(List<String> newProperties) {
		return new ExtractionFilters(newProperties, associationTypes, includeAssociations, includeArchived, batchSize,
				checkpointInterval, maxPages, extraParams);
	}

	public ExtractionFilters withAssociations(List<String> types) {
		return new ExtractionFilters(properties, types, !types.isEmpty(), includeArchived, batchSize,
				checkpointInterval, maxPages, extraParams);
	}

	public ExtractionFilters withIncludeArchived(boolean archived) {
		return new ExtractionFilters(properties, associationTypes, includeAssociations, archived, batchSize,
				checkpointInterval, maxPages, extraParams);
	}

	public ExtractionFilters withBatchSize(int size) {
		return new ExtractionFilters(properties, associationTypes, includeAssociations, includeArchived, size,
				checkpointInterval, maxPages, extraParams);
	}

	public ExtractionFilters withCheckpointInterval(int interval) {
		return new ExtractionFilters(properties, associationTypes, includeAssociations, includeArchived, batchSize,
				interval, maxPages, extraParams);
	}

	public ExtractionFilters withMaxPages(int pages) {
		return new ExtractionFilters(properties, associationTypes, includeAssociations, includeArchived, batchSize,
				checkpointInterval, pages, extraParams);
	}

	public ExtractionFilters withExtraParams(Map<String, String> params) {
		return new ExtractionFilters(properties, associationTypes, includeAssociations, includeArchived, batchSize,
				checkpointInterval, maxPages, params);
	}

	/**
	 * Page size actually sent to the API.
	 */
	public int effectiveBatchSize() {
		return Math.min(batchSize, PageRequest.MAX_BATCH_SIZE);
	}

	/**
	 * Association types to request, empty unless {@code includeAssociations} is set.
	 */
	public List<String> effectiveAssociations() {
		return includeAssociations ? associationTypes : List.of();
	}

	/**
	 * Build the page request for the given cursor.
	 * @param cursor cursor of the page, or null for the first page
	 * @return request carrying these filters
	 */
	public PageRequest toPageRequest(@Nullable String cursor) {
		return new PageRequest(cursor, effectiveBatchSize(), properties, effectiveAssociations(), includeArchived,
				extraParams);
	}

}
