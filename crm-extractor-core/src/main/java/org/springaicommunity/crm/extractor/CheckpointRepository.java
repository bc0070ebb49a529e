package org.springaicommunity.crm.extractor;

import java.util.Optional;

/**
 * Repository interface for checkpoint persistence.
 *
 * <p>
 * Abstracts the checkpoint store so the extraction engine can stay storage-agnostic and
 * tests can substitute in-memory implementations. Checkpoints are stored by run id and
 * overwritten on every save.
 */
public interface CheckpointRepository extends CheckpointCallback {

	/**
	 * Store the checkpoint of a run, replacing any earlier one.
	 * @param runId run identifier
	 * @param state checkpoint to store
	 * @throws java.io.UncheckedIOException if the checkpoint could not be written
	 */
	@Override
	void save(String runId, CheckpointState state);

	/**
	 * Load the last checkpoint of a run.
	 * @param runId run identifier
	 * @return the checkpoint, or empty if none was stored
	 */
	Optional<CheckpointState> load(String runId);

	/**
	 * Remove the checkpoint of a run.
	 * @param runId run identifier
	 * @return true if a checkpoint was removed
	 */
	boolean delete(String runId);

}
