package org.springaicommunity.crm.extractor;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread for a duration. Injected into the rate limiter and the retry
 * executor so tests can record delays instead of waiting them out.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Block for the given duration.
	 * @param duration how long to block; zero or negative returns immediately
	 * @throws CrmApiException if the thread is interrupted while sleeping
	 */
	void sleep(Duration duration);

	/**
	 * Sleeper backed by {@link Thread#sleep}.
	 * @return the default sleeper
	 */
	static Sleeper threadSleep() {
		return duration -> {
			if (duration.isZero() || duration.isNegative()) {
				return;
			}
			try {
				TimeUnit.NANOSECONDS.sleep(duration.toNanos());
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new CrmApiException("Interrupted while waiting", e);
			}
		};
	}

}
