package org.springaicommunity.crm.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Account-level calls used before an extraction: token validation, API usage, account
 * details and a combined connection test.
 *
 * <p>
 * These calls retry at most once and never throw on API or transport failures; failures
 * are logged and reported as {@code false} or an empty result.
 */
public class CrmAccountService {

	private static final Logger logger = LoggerFactory.getLogger(CrmAccountService.class);

	static final String USAGE_PATH = "/account-info/v3/api-usage/daily";

	static final String DETAILS_PATH = "/account-info/v3/details";

	static final int ACCOUNT_MAX_RETRIES = 1;

	private final RequestExecutor executor;

	private final PageFetcher fetcher;

	private final ObjectMapper objectMapper;

	private final String baseUrl;

	private final int intervalLimit;

	private final Duration intervalWindow;

	private final Clock clock;

	public CrmAccountService(RequestExecutor executor, PageFetcher fetcher, ObjectMapper objectMapper, String baseUrl,
			int intervalLimit, Duration intervalWindow) {
		this(executor, fetcher, objectMapper, baseUrl, intervalLimit, intervalWindow, Clock.systemUTC());
	}

	CrmAccountService(RequestExecutor executor, PageFetcher fetcher, ObjectMapper objectMapper, String baseUrl,
			int intervalLimit, Duration intervalWindow, Clock clock) {
		this.executor = executor;
		this.fetcher = fetcher;
		this.objectMapper = objectMapper;
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.intervalLimit = intervalLimit;
		this.intervalWindow = intervalWindow;
		this.clock = clock;
	}

	/**
	 * Check whether the access token is accepted by the API.
	 * @return true if the usage endpoint answered 200
	 */
	public boolean validateToken() {
		logger.debug("Validating access token");
		try {
			ApiResponse response = executor.execute(ApiRequest.get(baseUrl + USAGE_PATH), ACCOUNT_MAX_RETRIES);
			if (response.statusCode() == 200) {
				logger.info("Token validation successful");
				return true;
			}
			logger.warn("Token validation failed with HTTP {}", response.statusCode());
			return false;
		}
		catch (CrmApiException e) {
			logger.error("Token validation error: {}", e.getMessage());
			return false;
		}
	}

	/**
	 * Get the daily API usage of the account. Daily figures from the response headers take
	 * precedence over those in the body.
	 * @return usage, or empty if the call failed
	 */
	public Optional<ApiUsage> getApiUsage() {
		try {
			ApiResponse response = executor.execute(ApiRequest.get(baseUrl + USAGE_PATH), ACCOUNT_MAX_RETRIES);
			if (response.statusCode() != 200) {
				logger.debug("API usage not available: HTTP {}", response.statusCode());
				return Optional.empty();
			}
			JsonNode body = readBody(response);
			Long dailyLimit = JsonNodes.getLong(body, "currentUsage", "dailyLimit").orElse(null);
			Long dailyRemaining = JsonNodes.getLong(body, "currentUsage", "dailyRemaining").orElse(null);

			OptionalLong headerLimit = response.longHeader(RateLimitInfo.DAILY_LIMIT_HEADER);
			OptionalLong headerRemaining = response.longHeader(RateLimitInfo.DAILY_REMAINING_HEADER);
			if (headerLimit.isPresent()) {
				dailyLimit = headerLimit.getAsLong();
			}
			if (headerRemaining.isPresent()) {
				dailyRemaining = headerRemaining.getAsLong();
			}

			ApiUsage usage = new ApiUsage(dailyLimit, dailyRemaining, intervalLimit, intervalWindow.toSeconds(),
					clock.instant());
			logger.debug("API usage: {}/{} daily requests remaining", dailyRemaining, dailyLimit);
			return Optional.of(usage);
		}
		catch (CrmApiException e) {
			logger.warn("Could not retrieve API usage: {}", e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Get the account details.
	 * @return account details JSON, or empty if the call failed
	 */
	public Optional<JsonNode> getAccountInfo() {
		try {
			ApiResponse response = executor.execute(ApiRequest.get(baseUrl + DETAILS_PATH), ACCOUNT_MAX_RETRIES);
			if (response.statusCode() != 200) {
				return Optional.empty();
			}
			JsonNode info = readBody(response);
			logger.debug("Account info retrieved (portal {})", JsonNodes.getString(info, "portalId").orElse("?"));
			return Optional.of(info);
		}
		catch (CrmApiException e) {
			logger.debug("Account info not available: {}", e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Validate the token, collect account details and usage, and list a single record.
	 * @return the combined result; never throws
	 */
	public ConnectionTestResult testConnection() {
		logger.info("Testing API connection");
		boolean tokenValid = validateToken();
		if (!tokenValid) {
			logger.warn("Connection test failed: invalid access token");
			return new ConnectionTestResult(false, false, false, null, null, "Invalid access token");
		}

		JsonNode accountInfo = getAccountInfo().orElse(null);
		ApiUsage usage = getApiUsage().orElse(null);
		try {
			fetcher.fetch(PageRequest.first(1));
			logger.info("Connection test successful");
			return new ConnectionTestResult(true, true, true, accountInfo, usage, null);
		}
		catch (RuntimeException e) {
			logger.warn("Record access test failed: {}", e.getMessage());
			return new ConnectionTestResult(true, true, false, accountInfo, usage,
					"Records access failed: " + e.getMessage());
		}
	}

	private JsonNode readBody(ApiResponse response) {
		try {
			return objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			throw new CrmApiException("Could not decode response: " + e.getOriginalMessage(), e);
		}
	}

}
