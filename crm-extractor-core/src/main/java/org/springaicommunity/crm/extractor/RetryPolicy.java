package org.springaicommunity.crm.extractor;

import java.time.Duration;

/**
 * Immutable retry settings for one {@link RetryingRequestExecutor}.
 *
 * @param maxRetries retries after the first attempt (0 means a single attempt)
 * @param baseBackoff unit of the backoff for server errors and transport failures; attempt
 * {@code i} waits {@code baseBackoff * (2^i + 1)}
 * @param timeout deadline of each individual attempt
 */
public record RetryPolicy(int maxRetries, Duration baseBackoff, Duration timeout) {

	public static final int DEFAULT_MAX_RETRIES = 3;

	public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofSeconds(1);

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	public RetryPolicy {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be non-negative");
		}
		if (baseBackoff.isNegative()) {
			throw new IllegalArgumentException("baseBackoff must not be negative");
		}
		if (timeout.isZero() || timeout.isNegative()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
	}

	public static RetryPolicy defaults() {
		return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_BACKOFF, DEFAULT_TIMEOUT);
	}

	/**
	 * Backoff before retrying after a failed attempt.
	 * @param attempt zero-based attempt index that failed
	 * @return delay before the next attempt
	 */
	public Duration backoffFor(int attempt) {
		return baseBackoff.multipliedBy((1L << Math.min(attempt, 30)) + 1);
	}

}
