package org.springaicommunity.crm.extractor;

/**
 * Receives checkpoints written during an extraction run.
 *
 * <p>
 * Implementations may throw; the paginator logs the failure and keeps going.
 */
@FunctionalInterface
public interface CheckpointCallback {

	void save(String runId, CheckpointState state) throws Exception;

	static CheckpointCallback noop() {
		return (runId, state) -> {
		};
	}

}
