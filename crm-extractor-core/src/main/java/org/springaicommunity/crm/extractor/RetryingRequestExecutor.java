package org.springaicommunity.crm.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * {@link RequestExecutor} that adds rate limiting, per-attempt timeouts and a bounded
 * retry policy keyed by failure class to an {@link HttpTransport}.
 *
 * <p>
 * Policy for attempt {@code i} from 0 to {@code maxRetries}:
 * <ul>
 * <li>Every attempt, retries included, first acquires a {@link RateLimiter} slot</li>
 * <li>429: waits for {@code Retry-After} seconds (1 when absent or invalid); once
 * exhausted the 429 response is returned as-is</li>
 * <li>5xx: waits {@code baseBackoff * (2^i + 1)}; once exhausted the response is
 * returned as-is</li>
 * <li>Timeout or connection failure: same backoff; once exhausted a
 * {@link CrmApiException} is thrown</li>
 * <li>Any other status is returned immediately</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * RequestExecutor executor = RetryingRequestExecutor.builder()
 *     .transport(new JdkHttpTransport(token))
 *     .rateLimiter(sharedLimiter)
 *     .maxRetries(5)
 *     .build();
 * }
 * </pre>
 */
public final class RetryingRequestExecutor implements RequestExecutor {

	private static final Logger logger = LoggerFactory.getLogger(RetryingRequestExecutor.class);

	static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);

	private final HttpTransport transport;

	private final RateLimiter rateLimiter;

	private final RetryPolicy policy;

	private final Sleeper sleeper;

	/**
	 * Private constructor - use {@link #builder()} to create instances.
	 */
	private RetryingRequestExecutor(Builder builder) {
		this.transport = builder.transport;
		this.rateLimiter = builder.rateLimiter;
		this.policy = new RetryPolicy(builder.maxRetries, builder.baseBackoff, builder.timeout);
		this.sleeper = builder.sleeper;
	}

	/**
	 * Create a new builder for RetryingRequestExecutor.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	public RetryPolicy getPolicy() {
		return policy;
	}

	@Override
	public ApiResponse execute(ApiRequest request) {
		return execute(request, policy.maxRetries());
	}

	@Override
	public ApiResponse execute(ApiRequest request, int maxRetries) {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be non-negative");
		}
		String description = request.method() + " " + request.url();

		for (int attempt = 0;; attempt++) {
			boolean exhausted = attempt >= maxRetries;
			rateLimiter.acquire();

			ApiResponse response;
			try {
				response = transport.send(request, policy.timeout());
			}
			catch (IOException e) {
				String failure = e instanceof HttpTimeoutException ? "timed out" : "failed";
				if (exhausted) {
					logger.error("{} {} after {} attempts: {}", description, failure, attempt + 1, e.toString());
					throw new CrmApiException(description + " " + failure + " after " + (attempt + 1) + " attempts",
							e);
				}
				Duration backoff = policy.backoffFor(attempt);
				logger.warn("{} {} (attempt {}/{}): {}. Retrying in {}ms...", description, failure, attempt + 1,
						maxRetries + 1, e.toString(), backoff.toMillis());
				sleeper.sleep(backoff);
				continue;
			}

			int status = response.statusCode();
			if (status == 429) {
				if (exhausted) {
					logger.warn("{} still rate limited after {} attempts, giving up", description, attempt + 1);
					return response;
				}
				Duration retryAfter = retryAfter(response);
				logger.warn("{} rate limited (attempt {}/{}). Waiting {}s as requested by Retry-After", description,
						attempt + 1, maxRetries + 1, retryAfter.toSeconds());
				sleeper.sleep(retryAfter);
				continue;
			}
			if (status >= 500 && status < 600) {
				if (exhausted) {
					logger.error("{} returned {} after {} attempts", description, status, attempt + 1);
					return response;
				}
				Duration backoff = policy.backoffFor(attempt);
				logger.warn("{} returned {} (attempt {}/{}). Retrying in {}ms...", description, status, attempt + 1,
						maxRetries + 1, backoff.toMillis());
				sleeper.sleep(backoff);
				continue;
			}
			return response;
		}
	}

	/**
	 * Read the {@code Retry-After} header as whole seconds, falling back to one second
	 * when it is absent, not a number or negative.
	 */
	static Duration retryAfter(ApiResponse response) {
		return response.firstHeader("Retry-After").map(value -> {
			try {
				long seconds = Long.parseLong(value.trim());
				return seconds >= 0 ? Duration.ofSeconds(seconds) : DEFAULT_RETRY_AFTER;
			}
			catch (NumberFormatException e) {
				return DEFAULT_RETRY_AFTER;
			}
		}).orElse(DEFAULT_RETRY_AFTER);
	}

	/**
	 * Builder for {@link RetryingRequestExecutor}.
	 *
	 * <p>
	 * Provides sensible defaults:
	 * <ul>
	 * <li>maxRetries: 3</li>
	 * <li>baseBackoff: 1 second (waits of 2s, 3s, 5s, ...)</li>
	 * <li>timeout: 30 seconds per attempt</li>
	 * </ul>
	 */
	public static class Builder {

		private HttpTransport transport;

		private RateLimiter rateLimiter;

		private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;

		private Duration baseBackoff = RetryPolicy.DEFAULT_BASE_BACKOFF;

		private Duration timeout = RetryPolicy.DEFAULT_TIMEOUT;

		private Sleeper sleeper = Sleeper.threadSleep();

		private Builder() {
		}

		/**
		 * Set the transport that performs the individual attempts.
		 * @param transport the HttpTransport (required)
		 * @return this builder
		 */
		public Builder transport(HttpTransport transport) {
			this.transport = transport;
			return this;
		}

		/**
		 * Set the rate limiter consulted before every attempt.
		 * @param rateLimiter the shared RateLimiter (required)
		 * @return this builder
		 */
		public Builder rateLimiter(RateLimiter rateLimiter) {
			this.rateLimiter = rateLimiter;
			return this;
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the backoff unit for server errors and transport failures.
		 * @param baseBackoff backoff unit (default: 1 second)
		 * @return this builder
		 */
		public Builder baseBackoff(Duration baseBackoff) {
			this.baseBackoff = baseBackoff;
			return this;
		}

		/**
		 * Set the deadline of each individual attempt.
		 * @param timeout per-attempt timeout (default: 30 seconds)
		 * @return this builder
		 */
		public Builder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		/**
		 * Set the sleeper used for backoff and Retry-After waits.
		 * @param sleeper the Sleeper (default: {@link Sleeper#threadSleep()})
		 * @return this builder
		 */
		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the RetryingRequestExecutor.
		 * @return configured RetryingRequestExecutor
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingRequestExecutor build() {
			if (transport == null) {
				throw new IllegalStateException("An HttpTransport is required. Call transport() first.");
			}
			if (rateLimiter == null) {
				throw new IllegalStateException("A RateLimiter is required. Call rateLimiter() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (baseBackoff == null || baseBackoff.isNegative()) {
				throw new IllegalStateException("baseBackoff must not be negative");
			}
			if (timeout == null || timeout.isZero() || timeout.isNegative()) {
				throw new IllegalStateException("timeout must be positive");
			}
			return new RetryingRequestExecutor(this);
		}

	}

}
