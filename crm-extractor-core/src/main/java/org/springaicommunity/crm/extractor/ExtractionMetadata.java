package org.springaicommunity.crm.extractor;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Provenance stamped on every normalized record.
 *
 * @param extractedAt when the record was emitted
 * @param scanId run that emitted it
 * @param organizationId organization the record belongs to
 * @param pageNumber one-based page the record came from, counted across resumed runs
 * @param sourceService name of the source service
 */
public record ExtractionMetadata(@JsonProperty("_extracted_at") Instant extractedAt,
		@JsonProperty("_scan_id") String scanId, @JsonProperty("_organization_id") String organizationId,
		@JsonProperty("_page_number") int pageNumber, @JsonProperty("_source_service") String sourceService) {

	public ExtractionMetadata withExtractedAt(Instant instant) {
		return new ExtractionMetadata(instant, scanId, organizationId, pageNumber, sourceService);
	}

}
