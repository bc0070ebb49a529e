package org.springaicommunity.crm.extractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * File system implementation of {@link CheckpointRepository}.
 *
 * <p>
 * Writes one pretty-printed JSON file per run, {@code <run-id>.checkpoint.json}, in the
 * state directory. Files are written to a temporary sibling first and moved into place so
 * a crash never leaves a truncated checkpoint behind.
 */
public class FileSystemCheckpointRepository implements CheckpointRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCheckpointRepository.class);

	static final String SUFFIX = ".checkpoint.json";

	private final ObjectMapper objectMapper;

	private final Path stateDirectory;

	public FileSystemCheckpointRepository(ObjectMapper objectMapper, Path stateDirectory) {
		this.objectMapper = objectMapper;
		this.stateDirectory = stateDirectory;
	}

	public Path getStateDirectory() {
		return stateDirectory;
	}

	@Override
	public void save(String runId, CheckpointState state) {
		Path target = checkpointFile(runId);
		Path temp = target.resolveSibling(target.getFileName() + ".tmp");
		try {
			Files.createDirectories(stateDirectory);
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
			try {
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
			}
			logger.debug("Saved {} checkpoint for {} to {}", state.phase().wireName(), runId, target);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to save checkpoint for " + runId + " to " + target, e);
		}
	}

	@Override
	public Optional<CheckpointState> load(String runId) {
		Path file = checkpointFile(runId);
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			CheckpointState state = objectMapper.readValue(file.toFile(), CheckpointState.class);
			logger.info("Loaded {} checkpoint for {}: page {}, {} records", state.phase().wireName(), runId,
					state.pageNumber(), state.recordsProcessed());
			return Optional.of(state);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read checkpoint " + file, e);
		}
	}

	@Override
	public boolean delete(String runId) {
		try {
			return Files.deleteIfExists(checkpointFile(runId));
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to delete checkpoint for " + runId, e);
		}
	}

	Path checkpointFile(String runId) {
		return stateDirectory.resolve(safeFileName(runId) + SUFFIX);
	}

	/**
	 * Map a run id to a file name component. Letters, digits, dot, dash and underscore are
	 * kept; every other byte of the UTF-8 form, and a leading dot, is written as
	 * {@code %XX}. Distinct run ids always map to distinct names.
	 */
	static String safeFileName(String runId) {
		if (runId.isEmpty()) {
			throw new IllegalArgumentException("Run id must not be empty");
		}
		StringBuilder safe = new StringBuilder(runId.length());
		byte[] bytes = runId.getBytes(StandardCharsets.UTF_8);
		for (int i = 0; i < bytes.length; i++) {
			char c = (char) (bytes[i] & 0xFF);
			boolean plain = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-'
					|| c == '_' || (c == '.' && i > 0);
			if (plain) {
				safe.append(c);
			}
			else {
				safe.append('%').append(String.format("%02X", bytes[i] & 0xFF));
			}
		}
		return safe.toString();
	}

}
