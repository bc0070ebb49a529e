package org.springaicommunity.crm.extractor;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Daily request quota reported by the CRM API in its response headers.
 *
 * @param dailyLimit maximum number of requests allowed per day
 * @param dailyRemaining number of requests remaining today
 */
public record RateLimitInfo(long dailyLimit, long dailyRemaining) {

	public static final String DAILY_LIMIT_HEADER = "X-HubSpot-RateLimit-Daily";

	public static final String DAILY_REMAINING_HEADER = "X-HubSpot-RateLimit-Daily-Remaining";

	/**
	 * Read the daily quota headers of a response.
	 * @param response the response
	 * @return the quota, or empty unless both headers are present and numeric
	 */
	public static Optional<RateLimitInfo> from(ApiResponse response) {
		OptionalLong limit = response.longHeader(DAILY_LIMIT_HEADER);
		OptionalLong remaining = response.longHeader(DAILY_REMAINING_HEADER);
		if (limit.isEmpty() || remaining.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(new RateLimitInfo(limit.getAsLong(), remaining.getAsLong()));
	}

	/**
	 * Returns true if the daily quota is used up.
	 * @return true if no requests remaining
	 */
	public boolean isExceeded() {
		return dailyRemaining <= 0;
	}

}
