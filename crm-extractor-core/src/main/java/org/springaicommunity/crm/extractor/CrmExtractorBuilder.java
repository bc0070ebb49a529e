package org.springaicommunity.crm.extractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Builder wiring the extraction components together.
 *
 * <p>
 * Components are created once per builder and shared: every executor, fetcher, paginator
 * and account service built from the same builder goes through the same
 * {@link RateLimiter}, so concurrent runs against one account share its request budget.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Simple usage with environment variable
 * CheckpointedPaginator<DealRecord> paginator = CrmExtractorBuilder.create()
 *     .tokenFromEnv()
 *     .buildPaginator();
 *
 * // With custom configuration
 * ExtractorProperties props = new ExtractorProperties();
 * props.setMaxRetries(5);
 *
 * CrmExtractorBuilder builder = CrmExtractorBuilder.create()
 *     .token("pat-xxxxx")
 *     .properties(props);
 *
 * // For testing with a fake transport
 * HttpTransport fake = mock(HttpTransport.class);
 * CheckpointedPaginator<DealRecord> testPaginator = CrmExtractorBuilder.create()
 *     .transport(fake)
 *     .buildPaginator();
 * }
 * </pre>
 */
public class CrmExtractorBuilder {

	private @Nullable String token;

	private ExtractorProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable HttpTransport transport;

	private @Nullable RateLimiter rateLimiter;

	private @Nullable Sleeper sleeper;

	private @Nullable CheckpointRepository checkpointRepository;

	private @Nullable Components components;

	private CrmExtractorBuilder() {
		this.properties = new ExtractorProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new CrmExtractorBuilder
	 */
	public static CrmExtractorBuilder create() {
		return new CrmExtractorBuilder();
	}

	/**
	 * Set the access token directly.
	 * @param token private-app access token
	 * @return this builder
	 */
	public CrmExtractorBuilder token(String token) {
		this.token = token;
		this.components = null;
		return this;
	}

	/**
	 * Read the access token from {@code CRM_ACCESS_TOKEN} (see {@link EnvironmentSupport}).
	 * @return this builder
	 * @throws IllegalStateException if CRM_ACCESS_TOKEN is not set
	 */
	public CrmExtractorBuilder tokenFromEnv() {
		String value = EnvironmentSupport.accessToken();
		if (value == null) {
			throw new IllegalStateException(EnvironmentSupport.ACCESS_TOKEN_VARIABLE
					+ " environment variable is required. Please set your CRM private-app access token.");
		}
		return token(value);
	}

	/**
	 * Set extraction properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public CrmExtractorBuilder properties(@Nullable ExtractorProperties properties) {
		if (properties != null) {
			this.properties = properties;
			this.components = null;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use {@link ObjectMapperFactory})
	 * @return this builder
	 */
	public CrmExtractorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		this.components = null;
		return this;
	}

	/**
	 * Set a custom HttpTransport implementation. Useful for testing with fakes or for
	 * adding decorators.
	 *
	 * <p>
	 * When a custom transport is provided, the token is not required.
	 * @param transport custom transport (null to use {@link JdkHttpTransport})
	 * @return this builder
	 */
	public CrmExtractorBuilder transport(@Nullable HttpTransport transport) {
		this.transport = transport;
		this.components = null;
		return this;
	}

	/**
	 * Share an existing rate limiter, e.g. one limiter for several builders targeting the
	 * same account.
	 * @param rateLimiter the limiter (null to create one from the properties)
	 * @return this builder
	 */
	public CrmExtractorBuilder rateLimiter(@Nullable RateLimiter rateLimiter) {
		this.rateLimiter = rateLimiter;
		this.components = null;
		return this;
	}

	/**
	 * Set the sleeper used for retry backoff.
	 * @param sleeper the sleeper (null for {@link Sleeper#threadSleep()})
	 * @return this builder
	 */
	public CrmExtractorBuilder sleeper(@Nullable Sleeper sleeper) {
		this.sleeper = sleeper;
		this.components = null;
		return this;
	}

	/**
	 * Set a custom CheckpointRepository implementation.
	 * @param checkpointRepository the repository (null for a
	 * {@link FileSystemCheckpointRepository} in the state directory)
	 * @return this builder
	 */
	public CrmExtractorBuilder checkpointRepository(@Nullable CheckpointRepository checkpointRepository) {
		this.checkpointRepository = checkpointRepository;
		this.components = null;
		return this;
	}

	public ExtractorProperties getProperties() {
		return properties;
	}

	/**
	 * Build the retrying request executor directly (for advanced usage).
	 * @return configured RequestExecutor
	 */
	public RequestExecutor buildRequestExecutor() {
		return components().executor;
	}

	/**
	 * Build the page fetcher for the configured object type.
	 * @return configured PageFetcher
	 */
	public PageFetcher buildPageFetcher() {
		return components().fetcher;
	}

	/**
	 * Build a paginator producing {@link DealRecord}s.
	 * @return configured CheckpointedPaginator
	 */
	public CheckpointedPaginator<DealRecord> buildPaginator() {
		return buildPaginator(new DealRecordTransformer());
	}

	/**
	 * Build a paginator with a custom record transformer.
	 * @param transformer maps raw records to the output type
	 * @param <T> output record type
	 * @return configured CheckpointedPaginator
	 */
	public <T> CheckpointedPaginator<T> buildPaginator(RecordTransformer<T> transformer) {
		return new CheckpointedPaginator<>(components().fetcher, transformer, properties.getSourceService());
	}

	/**
	 * Build the account service.
	 * @return configured CrmAccountService
	 */
	public CrmAccountService buildAccountService() {
		Components c = components();
		return new CrmAccountService(c.executor, c.fetcher, c.objectMapper, properties.getBaseUrl(),
				properties.getMaxRequests(), Duration.ofSeconds(properties.getRateWindowSeconds()));
	}

	/**
	 * Build the checkpoint repository.
	 * @return configured CheckpointRepository
	 */
	public CheckpointRepository buildCheckpointRepository() {
		return components().checkpointRepository;
	}

	/**
	 * Build file-backed cancel and pause signals in the state directory.
	 * @return configured FileControlSignals
	 */
	public FileControlSignals buildControlSignals() {
		return new FileControlSignals(Path.of(properties.getStateDirectory()));
	}

	/**
	 * Filters derived from the properties: batch size, checkpoint interval and page limit.
	 * @return filters with default properties and no associations
	 */
	public ExtractionFilters defaultFilters() {
		return ExtractionFilters.defaults()
			.withBatchSize(properties.getBatchSize())
			.withCheckpointInterval(properties.getCheckpointInterval())
			.withMaxPages(properties.getMaxPages());
	}

	public ObjectMapper getObjectMapper() {
		return components().objectMapper;
	}

	/**
	 * Get the transport in use, e.g. to read its last rate limit information.
	 * @return the transport
	 */
	public HttpTransport getTransport() {
		return components().transport;
	}

	private void validateToken() {
		// A custom transport carries its own credentials
		if (transport != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("CRM access token is required. Call token() or tokenFromEnv() first.");
		}
	}

	private Components components() {
		Components built = this.components;
		if (built == null) {
			validateToken();
			built = buildComponents();
			this.components = built;
		}
		return built;
	}

	private Components buildComponents() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		HttpTransport client = this.transport != null ? this.transport : new JdkHttpTransport(token);
		RateLimiter limiter = this.rateLimiter != null ? this.rateLimiter : new SlidingWindowRateLimiter(
				properties.getMaxRequests(), Duration.ofSeconds(properties.getRateWindowSeconds()));

		RetryingRequestExecutor executor = RetryingRequestExecutor.builder()
			.transport(client)
			.rateLimiter(limiter)
			.maxRetries(properties.getMaxRetries())
			.baseBackoff(Duration.ofMillis(properties.getRetryBaseDelayMs()))
			.timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
			.sleeper(this.sleeper != null ? this.sleeper : Sleeper.threadSleep())
			.build();
		CrmPageFetcher fetcher = new CrmPageFetcher(executor, mapper, properties.getBaseUrl(),
				properties.getObjectType());
		CheckpointRepository repository = this.checkpointRepository != null ? this.checkpointRepository
				: new FileSystemCheckpointRepository(mapper, Path.of(properties.getStateDirectory()));

		return new Components(mapper, client, limiter, executor, fetcher, repository);
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(ObjectMapper objectMapper, HttpTransport transport, RateLimiter rateLimiter,
			RequestExecutor executor, PageFetcher fetcher, CheckpointRepository checkpointRepository) {
	}

}
