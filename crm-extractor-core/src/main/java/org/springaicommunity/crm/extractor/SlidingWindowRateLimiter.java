package org.springaicommunity.crm.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * {@link RateLimiter} enforcing at most {@code maxRequests} requests within any trailing
 * window.
 *
 * <p>
 * Keeps an ordered queue of request timestamps. Expired entries are removed on every
 * call, so memory stays bounded by {@code maxRequests}. When the budget is exhausted the
 * caller sleeps until the oldest entry leaves the window (plus a small buffer), then
 * re-validates. The lock is released while sleeping, so one waiting thread never
 * serializes the others behind its sleep.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * // 150 requests per 10 seconds, shared by all runs against one account
 * RateLimiter limiter = new SlidingWindowRateLimiter(150, Duration.ofSeconds(10));
 * }
 * </pre>
 */
public final class SlidingWindowRateLimiter implements RateLimiter {

	private static final Logger logger = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

	static final Duration DEFAULT_EPSILON = Duration.ofMillis(100);

	private final int maxRequests;

	private final long windowNanos;

	private final long epsilonNanos;

	private final LongSupplier nanoClock;

	private final Sleeper sleeper;

	// guarded by this
	private final Deque<Long> timestamps = new ArrayDeque<>();

	public SlidingWindowRateLimiter(int maxRequests, Duration window) {
		this(maxRequests, window, DEFAULT_EPSILON, System::nanoTime, Sleeper.threadSleep());
	}

	SlidingWindowRateLimiter(int maxRequests, Duration window, Duration epsilon, LongSupplier nanoClock,
			Sleeper sleeper) {
		if (maxRequests <= 0) {
			throw new IllegalArgumentException("maxRequests must be positive (got: " + maxRequests + ")");
		}
		if (window.isZero() || window.isNegative()) {
			throw new IllegalArgumentException("window must be positive (got: " + window + ")");
		}
		this.maxRequests = maxRequests;
		this.windowNanos = window.toNanos();
		this.epsilonNanos = epsilon.toNanos();
		this.nanoClock = nanoClock;
		this.sleeper = sleeper;
	}

	@Override
	public void acquire() {
		while (true) {
			long waitNanos;
			synchronized (this) {
				long now = nanoClock.getAsLong();
				evictExpired(now);
				if (timestamps.size() < maxRequests) {
					timestamps.addLast(now);
					return;
				}
				waitNanos = windowNanos - (now - timestamps.peekFirst()) + epsilonNanos;
			}
			logger.debug("Rate limit of {} requests per {}ms reached, waiting {}ms", maxRequests,
					windowNanos / 1_000_000, waitNanos / 1_000_000);
			sleeper.sleep(Duration.ofNanos(waitNanos));
		}
	}

	/**
	 * Number of requests recorded within the current window.
	 * @return requests counted against the budget right now
	 */
	public synchronized int currentWindowSize() {
		evictExpired(nanoClock.getAsLong());
		return timestamps.size();
	}

	public int getMaxRequests() {
		return maxRequests;
	}

	public Duration getWindow() {
		return Duration.ofNanos(windowNanos);
	}

	private void evictExpired(long now) {
		while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowNanos) {
			timestamps.removeFirst();
		}
	}

}
