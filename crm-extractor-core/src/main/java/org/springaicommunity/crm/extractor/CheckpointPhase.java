package org.springaicommunity.crm.extractor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phase recorded in a {@link CheckpointState}. Serialized by its wire name.
 */
public enum CheckpointPhase {

	IN_PROGRESS("in_progress"),

	COMPLETED("completed"),

	CANCELLED("cancelled"),

	PAUSED("paused"),

	PAUSED_MID_PAGE("paused_mid_page"),

	ERROR("error");

	private final String wireName;

	CheckpointPhase(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String wireName() {
		return wireName;
	}

	/**
	 * Whether a run resumed from a checkpoint in this phase still has records to deliver.
	 */
	public boolean isResumable() {
		return this != COMPLETED;
	}

	@JsonCreator
	public static CheckpointPhase fromWireName(String value) {
		for (CheckpointPhase phase : values()) {
			if (phase.wireName.equals(value) || phase.name().equalsIgnoreCase(value)) {
				return phase;
			}
		}
		throw new IllegalArgumentException("Unknown checkpoint phase: " + value);
	}

}
