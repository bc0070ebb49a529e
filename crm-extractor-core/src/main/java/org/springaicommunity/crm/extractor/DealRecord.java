package org.springaicommunity.crm.extractor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Normalized deal row. Serialized with snake_case column names; the extraction metadata
 * is flattened into {@code _extracted_at}, {@code _scan_id}, {@code _organization_id},
 * {@code _page_number} and {@code _source_service}.
 */
public record DealRecord(@Nullable String dealId, @Nullable String dealName, @Nullable BigDecimal amount,
		String currency, @Nullable String dealStage, @Nullable String dealStageLabel, @Nullable String pipelineId,
		@Nullable String pipelineLabel, @Nullable Instant closeDate, @Nullable Instant createdAt,
		@Nullable Instant updatedAt, @Nullable String ownerId, @Nullable String ownerEmail, @Nullable String dealType,
		@JsonProperty("is_archived") boolean archived, @Nullable String dealUrl,
		Map<String, @Nullable Object> properties, Map<String, @Nullable Object> associations,
		@JsonUnwrapped ExtractionMetadata metadata) implements NormalizedRecord {

	@Override
	@JsonIgnore
	@Nullable
	public String recordId() {
		return dealId;
	}

}
