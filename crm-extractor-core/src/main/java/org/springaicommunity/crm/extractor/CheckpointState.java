package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of extraction progress handed to a {@link CheckpointCallback}. A new instance
 * is created for every checkpoint; instances are never mutated.
 *
 * @param phase phase of the run when the checkpoint was taken
 * @param recordsProcessed records delivered so far, including those of a partially
 * consumed page at a mid-page pause
 * @param cursor cursor to resume from, or null to start from the beginning
 * @param pageNumber number of pages fully consumed
 * @param batchSize page size requested by the run
 * @param extra phase-specific details; always contains {@code service} and
 * {@code timestamp}
 */
public record CheckpointState(CheckpointPhase phase, long recordsProcessed, @Nullable String cursor, int pageNumber,
		int batchSize, Map<String, @Nullable Object> extra) {

	public CheckpointState {
		extra = Collections.unmodifiableMap(new LinkedHashMap<>(extra));
	}

	@Nullable
	public Object extra(String key) {
		return extra.get(key);
	}

}
