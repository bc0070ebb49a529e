package org.springaicommunity.crm.extractor;

/**
 * Lifecycle of one {@link ExtractionRun}.
 */
public enum RunState {

	STARTING, FETCHING, YIELDING, CHECKPOINTING, COMPLETED, CANCELLED, PAUSED, ERRORED;

	public boolean isTerminal() {
		return this == COMPLETED || this == CANCELLED || this == PAUSED || this == ERRORED;
	}

}
