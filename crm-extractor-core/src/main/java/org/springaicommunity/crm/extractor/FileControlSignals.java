package org.springaicommunity.crm.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Cancel and pause signals backed by marker files in the state directory.
 *
 * <p>
 * A run is asked to stop by creating {@code <run-id>.cancel} or {@code <run-id>.pause},
 * from this class or from another process (e.g. {@code touch}).
 */
public class FileControlSignals {

	private static final Logger logger = LoggerFactory.getLogger(FileControlSignals.class);

	static final String CANCEL_SUFFIX = ".cancel";

	static final String PAUSE_SUFFIX = ".pause";

	private final Path stateDirectory;

	public FileControlSignals(Path stateDirectory) {
		this.stateDirectory = stateDirectory;
	}

	public ControlSignal cancelSignal() {
		return runId -> Files.exists(marker(runId, CANCEL_SUFFIX));
	}

	public ControlSignal pauseSignal() {
		return runId -> Files.exists(marker(runId, PAUSE_SUFFIX));
	}

	public void requestCancel(String runId) {
		create(marker(runId, CANCEL_SUFFIX));
		logger.info("Cancellation requested for {}", runId);
	}

	public void requestPause(String runId) {
		create(marker(runId, PAUSE_SUFFIX));
		logger.info("Pause requested for {}", runId);
	}

	/**
	 * Remove both markers of a run so it can be started again.
	 * @param runId run identifier
	 */
	public void clear(String runId) {
		try {
			Files.deleteIfExists(marker(runId, CANCEL_SUFFIX));
			Files.deleteIfExists(marker(runId, PAUSE_SUFFIX));
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to clear control markers for " + runId, e);
		}
	}

	Path marker(String runId, String suffix) {
		return stateDirectory.resolve(FileSystemCheckpointRepository.safeFileName(runId) + suffix);
	}

	private void create(Path marker) {
		try {
			Files.createDirectories(stateDirectory);
			if (!Files.exists(marker)) {
				Files.createFile(marker);
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to create marker " + marker, e);
		}
	}

}
