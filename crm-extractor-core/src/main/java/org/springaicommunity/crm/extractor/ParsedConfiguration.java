package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Job identity
	public @Nullable String scanId;

	public @Nullable String organizationId;

	// What to extract
	public String objectType;

	public List<String> properties = new ArrayList<>();

	public List<String> associations = new ArrayList<>();

	public boolean includeArchived = false;

	// Paging
	public int batchSize;

	public int checkpointInterval;

	public int maxPages;

	// Locations
	public @Nullable String outputFile = null; // JSON Lines output, stdout when null

	public String stateDirectory;

	public String baseUrl;

	// Modes
	public boolean resume = false;

	public boolean testConnection = false;

	public boolean requestPause = false;

	public boolean requestCancel = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(ExtractorProperties defaultProperties) {
		// Initialize with defaults
		this.objectType = defaultProperties.getObjectType();
		this.batchSize = defaultProperties.getBatchSize();
		this.checkpointInterval = defaultProperties.getCheckpointInterval();
		this.maxPages = defaultProperties.getMaxPages();
		this.stateDirectory = defaultProperties.getStateDirectory();
		this.baseUrl = defaultProperties.getBaseUrl();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Returns true if this invocation only writes a control marker for a running
	 * extraction.
	 */
	public boolean isControlRequest() {
		return requestPause || requestCancel;
	}

	/**
	 * Apply the parsed options on top of the given properties.
	 * @param target properties to update
	 * @return the same properties instance
	 */
	public ExtractorProperties applyTo(ExtractorProperties target) {
		target.setObjectType(objectType);
		target.setBatchSize(batchSize);
		target.setCheckpointInterval(checkpointInterval);
		target.setMaxPages(maxPages);
		target.setStateDirectory(stateDirectory);
		target.setBaseUrl(baseUrl);
		target.setVerbose(verbose);
		return target;
	}

	/**
	 * Build the extraction filters described by the options.
	 * @return the filters
	 */
	public ExtractionFilters toFilters() {
		return ExtractionFilters.defaults()
			.withProperties(properties)
			.withAssociations(associations)
			.withIncludeArchived(includeArchived)
			.withBatchSize(batchSize)
			.withCheckpointInterval(checkpointInterval)
			.withMaxPages(maxPages);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "scanId='" + scanId + '\'' + ", organizationId='" + organizationId + '\''
				+ ", objectType='" + objectType + '\'' + ", properties=" + properties + ", associations="
				+ associations + ", includeArchived=" + includeArchived + ", batchSize=" + batchSize
				+ ", checkpointInterval=" + checkpointInterval + ", maxPages=" + maxPages + ", outputFile='"
				+ outputFile + '\'' + ", stateDirectory='" + stateDirectory + '\'' + ", baseUrl='" + baseUrl + '\''
				+ ", resume=" + resume + ", testConnection=" + testConnection + ", requestPause=" + requestPause
				+ ", requestCancel=" + requestCancel + ", verbose=" + verbose + ", helpRequested=" + helpRequested
				+ '}';
	}

}
