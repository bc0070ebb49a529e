package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Per-record contract delivered to consumers of an {@link ExtractionRun}.
 *
 * <p>
 * Consumers are expected to upsert by {@link #recordId()}: a resumed run may deliver
 * records of one page again.
 */
public interface NormalizedRecord {

	/**
	 * Stable identifier of the source object.
	 */
	@Nullable
	String recordId();

	ExtractionMetadata metadata();

	/**
	 * Raw property bag passed through from the source.
	 */
	Map<String, @Nullable Object> properties();

}
