package org.springaicommunity.crm.extractor;

/**
 * Configuration properties for CRM extraction.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link CrmExtractorBuilder}. The
 * defaults match the published limits of the CRM API and suit most accounts.
 */
public class ExtractorProperties {

	/**
	 * The only object type whose records {@link DealRecordTransformer} can normalize.
	 */
	public static final String SUPPORTED_OBJECT_TYPE = "deals";

	/**
	 * Base URL of the CRM API.
	 */
	private String baseUrl = "https://api.hubapi.com";

	/**
	 * CRM object type listed by the extractor.
	 */
	private String objectType = SUPPORTED_OBJECT_TYPE;

	/**
	 * Source service name stamped on records and checkpoints.
	 */
	private String sourceService = "hubspot_deals";

	/**
	 * Maximum number of requests per rate window, shared by all runs of the account.
	 */
	private int maxRequests = 150;

	/**
	 * Length of the sliding rate window in seconds.
	 */
	private int rateWindowSeconds = 10;

	/**
	 * Maximum number of retry attempts for failed API requests.
	 */
	private int maxRetries = 3;

	/**
	 * Backoff unit in milliseconds; attempt {@code i} waits {@code unit * (2^i + 1)}.
	 */
	private long retryBaseDelayMs = 1000;

	/**
	 * Deadline of a single HTTP attempt in seconds.
	 */
	private int requestTimeoutSeconds = 30;

	/**
	 * Records requested per page (the API caps this at 100).
	 */
	private int batchSize = 100;

	/**
	 * Write a progress checkpoint every this many pages.
	 */
	private int checkpointInterval = 5;

	/**
	 * Safety limit on the number of pages of one extraction.
	 */
	private int maxPages = 10000;

	/**
	 * Directory holding checkpoint files and control markers.
	 */
	private String stateDirectory = ".crm_extractor_state";

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public String getBaseUrl() {
		return baseUrl;
	}

	public void setBaseUrl(String baseUrl) {
		this.baseUrl = baseUrl;
	}

	public String getObjectType() {
		return objectType;
	}

	public void setObjectType(String objectType) {
		this.objectType = objectType;
	}

	public String getSourceService() {
		return sourceService;
	}

	public void setSourceService(String sourceService) {
		this.sourceService = sourceService;
	}

	public int getMaxRequests() {
		return maxRequests;
	}

	public void setMaxRequests(int maxRequests) {
		this.maxRequests = maxRequests;
	}

	public int getRateWindowSeconds() {
		return rateWindowSeconds;
	}

	public void setRateWindowSeconds(int rateWindowSeconds) {
		this.rateWindowSeconds = rateWindowSeconds;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryBaseDelayMs() {
		return retryBaseDelayMs;
	}

	public void setRetryBaseDelayMs(long retryBaseDelayMs) {
		this.retryBaseDelayMs = retryBaseDelayMs;
	}

	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public int getBatchSize() {
		return batchSize;
	}

	public void setBatchSize(int batchSize) {
		this.batchSize = batchSize;
	}

	public int getCheckpointInterval() {
		return checkpointInterval;
	}

	public void setCheckpointInterval(int checkpointInterval) {
		this.checkpointInterval = checkpointInterval;
	}

	public int getMaxPages() {
		return maxPages;
	}

	public void setMaxPages(int maxPages) {
		this.maxPages = maxPages;
	}

	public String getStateDirectory() {
		return stateDirectory;
	}

	public void setStateDirectory(String stateDirectory) {
		this.stateDirectory = stateDirectory;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
