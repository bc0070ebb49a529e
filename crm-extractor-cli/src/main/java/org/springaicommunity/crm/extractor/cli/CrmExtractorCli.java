package org.springaicommunity.crm.extractor.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.crm.extractor.*;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * CRM Extractor CLI Application
 *
 * Plain Java command-line application that extracts CRM records into a JSON Lines file,
 * writing checkpoints to a state directory so an extraction can be paused, cancelled and
 * resumed. Uses CrmExtractorBuilder for service wiring.
 *
 * Usage: java -jar crm-extractor-cli.jar [OPTIONS]
 *
 * Environment Variables: CRM_ACCESS_TOKEN - private-app access token for authentication
 *
 * Examples: java -jar crm-extractor-cli.jar --scan-id scan-42 --org-id acme -o
 * deals.jsonl java -jar crm-extractor-cli.jar --scan-id scan-42 --pause java -jar
 * crm-extractor-cli.jar --scan-id scan-42 --org-id acme -o deals.jsonl --resume
 */
public class CrmExtractorCli {

	private static final Logger logger = LoggerFactory.getLogger(CrmExtractorCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Extraction failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) throws Exception {
		// Create argument parser with default properties
		ExtractorProperties properties = new ExtractorProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		config.applyTo(properties);

		// Control requests only drop a marker file, no token needed
		if (config.isControlRequest()) {
			return requestControl(config, new FileControlSignals(Paths.get(config.stateDirectory)));
		}

		argumentParser.validateEnvironment();
		logConfiguration(config);

		CrmExtractorBuilder builder = CrmExtractorBuilder.create().tokenFromEnv().properties(properties);
		return run(config, builder);
	}

	/**
	 * Run a parsed configuration against a prepared builder.
	 * @param config parsed command-line options
	 * @param builder builder supplying the components; its properties are updated from
	 * the options
	 * @return process exit code
	 */
	static int run(ParsedConfiguration config, CrmExtractorBuilder builder) throws IOException {
		builder.properties(config.applyTo(builder.getProperties()));

		if (config.isControlRequest()) {
			return requestControl(config, builder.buildControlSignals());
		}
		if (config.testConnection) {
			return testConnection(builder.buildAccountService());
		}
		return extract(config, builder);
	}

	private static int requestControl(ParsedConfiguration config, FileControlSignals signals) {
		String scanId = requireScanId(config);
		if (config.requestCancel) {
			signals.requestCancel(scanId);
		}
		else {
			signals.requestPause(scanId);
		}
		return 0;
	}

	private static int testConnection(CrmAccountService accountService) {
		ConnectionTestResult result = accountService.testConnection();
		logger.info("Connection test:");
		logger.info("  Token valid: {}", result.tokenValid());
		logger.info("  API reachable: {}", result.apiReachable());
		logger.info("  Records accessible: {}", result.recordsAccessible());
		if (result.usage() != null) {
			logger.info("  Daily requests remaining: {}/{}", result.usage().dailyRemaining(),
					result.usage().dailyLimit());
		}
		if (result.error() != null) {
			logger.error("  Error: {}", result.error());
		}
		return result.isSuccessful() ? 0 : 1;
	}

	private static int extract(ParsedConfiguration config, CrmExtractorBuilder builder) throws IOException {
		String scanId = requireScanId(config);
		CheckpointRepository repository = builder.buildCheckpointRepository();
		FileControlSignals signals = builder.buildControlSignals();

		ResumePoint resumeFrom = null;
		if (config.resume) {
			Optional<CheckpointState> checkpoint = repository.load(scanId);
			if (checkpoint.isEmpty()) {
				logger.warn("No checkpoint found for {}, starting from the beginning", scanId);
			}
			else if (!checkpoint.get().phase().isResumable()) {
				logger.info("Extraction {} already completed with {} records, nothing to resume", scanId,
						checkpoint.get().recordsProcessed());
				return 0;
			}
			else {
				resumeFrom = ResumePoint.from(checkpoint.get());
			}
		}
		// Markers left by the previous run would stop this one immediately
		signals.clear(scanId);

		JobConfig job = JobConfig.of(scanId, config.organizationId);
		ExtractionRun<DealRecord> run = builder.buildPaginator()
			.extract(job, config.toFilters(), resumeFrom, repository, signals.cancelSignal(), signals.pauseSignal());

		ObjectMapper mapper = builder.getObjectMapper();
		try {
			if (config.outputFile != null) {
				Path output = Paths.get(config.outputFile);
				if (output.getParent() != null) {
					Files.createDirectories(output.getParent());
				}
				try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8,
						StandardOpenOption.CREATE, StandardOpenOption.WRITE,
						resumeFrom != null ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING)) {
					writeRecords(run, writer, mapper);
				}
			}
			else {
				// Flushed but never closed, System.out outlives the run
				Writer writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
				try {
					writeRecords(run, writer, mapper);
				}
				finally {
					writer.flush();
				}
			}
		}
		catch (CrmApiException e) {
			logger.error("Extraction {} failed after {} records: {}", scanId, run.recordsProcessed(), e.getMessage());
			logResults(run, config.outputFile);
			return 1;
		}

		logResults(run, config.outputFile);
		return run.state() == RunState.ERRORED ? 1 : 0;
	}

	private static void writeRecords(ExtractionRun<DealRecord> run, Writer writer, ObjectMapper mapper)
			throws IOException {
		while (run.hasNext()) {
			writer.write(mapper.writeValueAsString(run.next()));
			writer.write('\n');
		}
	}

	private static String requireScanId(ParsedConfiguration config) {
		if (config.scanId == null) {
			throw new IllegalArgumentException("Scan id is required (--scan-id)");
		}
		return config.scanId;
	}

	private static void logConfiguration(ParsedConfiguration config) {
		if (!config.verbose) {
			return;
		}
		logger.info("Configuration:");
		logger.info("  Scan id: {}", config.scanId);
		logger.info("  Organization id: {}", config.organizationId);
		logger.info("  Object type: {}", config.objectType);
		logger.info("  Properties: {}", config.properties.isEmpty() ? "(default)" : config.properties);
		logger.info("  Associations: {}", config.associations);
		logger.info("  Include archived: {}", config.includeArchived);
		logger.info("  Batch size: {}", config.batchSize);
		logger.info("  Checkpoint interval: {}", config.checkpointInterval);
		logger.info("  Max pages: {}", config.maxPages);
		logger.info("  Output file: {}", config.outputFile != null ? config.outputFile : "(stdout)");
		logger.info("  State directory: {}", config.stateDirectory);
		logger.info("  Resume: {}", config.resume);
	}

	private static void logResults(ExtractionRun<DealRecord> run, @Nullable String outputFile) {
		logger.info("Extraction {} ended: {}", run.runId(), run.state());
		logger.info("Records processed: {}", run.recordsProcessed());
		logger.info("Pages processed: {}", run.pageNumber());
		if (run.isLimitReached()) {
			logger.warn("Page limit reached; rerun with --resume to continue");
		}
		if (run.state() == RunState.PAUSED || run.state() == RunState.CANCELLED) {
			logger.info("Rerun with --resume to continue from the last checkpoint");
		}
		if (run.checkpointFailures() > 0) {
			logger.warn("{} checkpoint(s) could not be saved", run.checkpointFailures());
		}
		if (outputFile != null) {
			logger.info("Output file: {}", outputFile);
		}
	}

}
