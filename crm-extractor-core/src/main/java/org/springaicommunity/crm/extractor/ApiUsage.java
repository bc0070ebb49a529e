package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * API usage snapshot for the account behind the access token.
 *
 * @param dailyLimit daily request quota, when reported
 * @param dailyRemaining requests left today, when reported
 * @param intervalLimit requests allowed per rate window by the local limiter
 * @param intervalWindowSeconds length of the rate window in seconds
 * @param timestamp when the snapshot was taken
 */
public record ApiUsage(@Nullable Long dailyLimit, @Nullable Long dailyRemaining, int intervalLimit,
		long intervalWindowSeconds, Instant timestamp) {
}
