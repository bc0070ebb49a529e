package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One decoded page of the list endpoint.
 *
 * @param records records in the order the API returned them
 * @param nextCursor cursor of the following page, or null when this is the last page
 * @param rawTotal total reported by the API, when present
 */
public record PageResult(List<RawRecord> records, @Nullable String nextCursor, @Nullable Long rawTotal) {

	public PageResult {
		records = List.copyOf(records);
	}

	public boolean isEmpty() {
		return records.isEmpty();
	}

	public boolean hasNext() {
		return nextCursor != null;
	}

}
