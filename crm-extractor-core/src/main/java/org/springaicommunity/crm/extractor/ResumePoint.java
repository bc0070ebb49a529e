package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

/**
 * Where a new run picks up from a previous one.
 *
 * @param cursor cursor of the first page to fetch, or null to start at the beginning
 * @param pageNumber pages already consumed by earlier runs
 * @param recordsProcessed records already delivered by earlier runs
 */
public record ResumePoint(@Nullable String cursor, int pageNumber, long recordsProcessed) {

	public ResumePoint {
		if (pageNumber < 0) {
			throw new IllegalArgumentException("pageNumber must be non-negative");
		}
		if (recordsProcessed < 0) {
			throw new IllegalArgumentException("recordsProcessed must be non-negative");
		}
	}

	public static ResumePoint from(CheckpointState checkpoint) {
		return new ResumePoint(checkpoint.cursor(), checkpoint.pageNumber(), checkpoint.recordsProcessed());
	}

}
