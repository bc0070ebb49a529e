package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.time.Duration;

/**
 * Interface for issuing a single HTTP attempt against the CRM API.
 *
 * <p>
 * Implementations perform no retries and no rate limiting; both are layered on top by
 * {@link RetryingRequestExecutor}. This keeps the transport replaceable in tests.
 */
public interface HttpTransport {

	/**
	 * Send one request and return whatever the server answered, including error statuses.
	 * @param request the request to send
	 * @param timeout deadline for this attempt
	 * @return the response
	 * @throws java.net.http.HttpTimeoutException if the deadline elapsed
	 * @throws IOException on any other connection-level failure
	 */
	ApiResponse send(ApiRequest request, Duration timeout) throws IOException;

	/**
	 * Get the daily rate limit information from the most recent response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	@Nullable
	default RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
