package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

/**
 * Identity of one extraction job.
 *
 * @param scanId run identifier used as the checkpoint key; defaults to {@code unknown}
 * @param organizationId organization the extracted records belong to
 */
public record JobConfig(String scanId, String organizationId) {

	public static final String UNKNOWN_SCAN_ID = "unknown";

	public JobConfig {
		if (organizationId == null || organizationId.isBlank()) {
			throw new IllegalArgumentException("organizationId is required");
		}
		if (scanId == null || scanId.isBlank()) {
			scanId = UNKNOWN_SCAN_ID;
		}
	}

	public static JobConfig of(@Nullable String scanId, String organizationId) {
		return new JobConfig(scanId == null ? UNKNOWN_SCAN_ID : scanId, organizationId);
	}

}
