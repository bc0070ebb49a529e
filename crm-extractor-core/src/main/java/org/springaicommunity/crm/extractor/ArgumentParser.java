package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line argument parser for the CRM extractor. Pure Java implementation with no
 * framework dependencies for maximum testability.
 */
public class ArgumentParser {

	private final ExtractorProperties defaultProperties;

	public ArgumentParser(ExtractorProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--scan-id":
					config.scanId = getRequiredValue(args, i, "scan-id");
					i++; // Skip next argument since we consumed it
					break;

				case "--org-id":
					config.organizationId = getRequiredValue(args, i, "org-id");
					i++;
					break;

				case "-t", "--object-type":
					config.objectType = getRequiredValue(args, i, "object-type").toLowerCase();
					i++;
					break;

				case "-p", "--properties":
					config.properties = splitList(getRequiredValue(args, i, "properties"));
					i++;
					break;

				case "-a", "--associations":
					config.associations = splitList(getRequiredValue(args, i, "associations"));
					i++;
					break;

				case "--include-archived":
					config.includeArchived = true;
					break;

				case "-b", "--batch-size":
					config.batchSize = parsePositive(getRequiredValue(args, i, "batch-size"), "batch size");
					i++;
					break;

				case "--checkpoint-interval":
					config.checkpointInterval = parsePositive(getRequiredValue(args, i, "checkpoint-interval"),
							"checkpoint interval");
					i++;
					break;

				case "--max-pages":
					config.maxPages = parsePositive(getRequiredValue(args, i, "max-pages"), "max pages");
					i++;
					break;

				case "-o", "--output":
					config.outputFile = getRequiredValue(args, i, "output");
					i++;
					break;

				case "--state-dir":
					config.stateDirectory = getRequiredValue(args, i, "state-dir");
					i++;
					break;

				case "--base-url":
					config.baseUrl = getRequiredValue(args, i, "base-url");
					i++;
					break;

				case "--resume":
					config.resume = true;
					break;

				case "--test-connection":
					config.testConnection = true;
					break;

				case "--pause":
					config.requestPause = true;
					break;

				case "--cancel":
					config.requestCancel = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: crm-extractor [OPTIONS]\n");
		help.append("\n");
		help.append("Extract CRM records page by page with checkpoints, pause/cancel and resume.\n");
		help.append("\n");
		help.append("JOB OPTIONS:\n");
		help.append("    -h, --help                  Show this help message\n");
		help.append("    --scan-id ID                Run identifier, keys checkpoints and control markers (required)\n");
		help.append("    --org-id ID                 Organization stamped on every record (required)\n");
		help.append("    --resume                    Continue from the last checkpoint of the scan id\n");
		help.append("    -v, --verbose               Enable verbose logging\n");
		help.append("\n");
		help.append("FILTERING OPTIONS:\n");
		help.append("    -t, --object-type TYPE      CRM object type, only deals is supported (default: ")
			.append(defaultProperties.getObjectType())
			.append(")\n");
		help.append("    -p, --properties LIST       Comma-separated properties (default: standard deal properties)\n");
		help.append("    -a, --associations LIST     Comma-separated association types to include\n");
		help.append("    --include-archived          Include archived records\n");
		help.append("\n");
		help.append("PAGING OPTIONS:\n");
		help.append("    -b, --batch-size SIZE       Records per page, at most 100 are requested (default: ")
			.append(defaultProperties.getBatchSize())
			.append(")\n");
		help.append("    --checkpoint-interval N     Checkpoint every N pages (default: ")
			.append(defaultProperties.getCheckpointInterval())
			.append(")\n");
		help.append("    --max-pages N               Stop after N pages (default: ")
			.append(defaultProperties.getMaxPages())
			.append(")\n");
		help.append("\n");
		help.append("OUTPUT OPTIONS:\n");
		help.append("    -o, --output FILE           Write records as JSON Lines to FILE (default: stdout)\n");
		help.append("    --state-dir DIR             Checkpoint and marker directory (default: ")
			.append(defaultProperties.getStateDirectory())
			.append(")\n");
		help.append("    --base-url URL              API base URL (default: ")
			.append(defaultProperties.getBaseUrl())
			.append(")\n");
		help.append("\n");
		help.append("CONTROL OPTIONS:\n");
		help.append("    --test-connection           Check token, account and record access, then exit\n");
		help.append("    --pause                     Ask the running extraction of the scan id to pause\n");
		help.append("    --cancel                    Ask the running extraction of the scan id to cancel\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ")
			.append(EnvironmentSupport.ACCESS_TOKEN_VARIABLE)
			.append("        Private-app access token (required, also read from .env)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    crm-extractor --scan-id scan-42 --org-id acme -o deals.jsonl\n");
		help.append("    crm-extractor --scan-id scan-42 --pause\n");
		help.append("    crm-extractor --scan-id scan-42 --org-id acme -o deals.jsonl --resume\n");
		help.append("    crm-extractor --test-connection\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment (access token, etc.)
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		if (EnvironmentSupport.accessToken() == null) {
			throw new IllegalStateException(EnvironmentSupport.ACCESS_TOKEN_VARIABLE
					+ " environment variable is required. Please set your private-app access token: export "
					+ EnvironmentSupport.ACCESS_TOKEN_VARIABLE + "=your_token_here");
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parsePositive(String value, String name) {
		int parsed;
		try {
			parsed = Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
		if (parsed <= 0) {
			throw new IllegalArgumentException(
					Character.toUpperCase(name.charAt(0)) + name.substring(1) + " must be positive: " + parsed);
		}
		return parsed;
	}

	private List<String> splitList(String value) {
		return Arrays.stream(value.split(","))
			.map(String::trim)
			.filter(s -> !s.isEmpty())
			.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.requestPause && config.requestCancel) {
			errors.add("--pause and --cancel cannot be combined");
		}
		if (config.testConnection && (config.isControlRequest() || config.resume)) {
			errors.add("--test-connection cannot be combined with --pause, --cancel or --resume");
		}

		boolean extracting = !config.testConnection && !config.isControlRequest();
		if ((extracting || config.isControlRequest()) && isBlank(config.scanId)) {
			errors.add("Scan id is required (--scan-id)");
		}
		if (extracting && isBlank(config.organizationId)) {
			errors.add("Organization id is required (--org-id)");
		}
		if (config.scanId != null && !config.scanId.matches("^[A-Za-z0-9._:-]+$")) {
			errors.add("Scan id may only contain letters, digits, '.', '_', ':' and '-' (got: " + config.scanId + ")");
		}
		if (!ExtractorProperties.SUPPORTED_OBJECT_TYPE.equals(config.objectType)) {
			errors.add("Object type must be '" + ExtractorProperties.SUPPORTED_OBJECT_TYPE
					+ "', records are normalized as deals (got: " + config.objectType + ")");
		}
		if (!config.baseUrl.startsWith("http://") && !config.baseUrl.startsWith("https://")) {
			errors.add("Base URL must start with http:// or https:// (got: " + config.baseUrl + ")");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.trim().isEmpty();
	}

}
