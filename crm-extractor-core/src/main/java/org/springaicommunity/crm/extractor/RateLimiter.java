package org.springaicommunity.crm.extractor;

/**
 * Request budget gate shared by every caller that talks to the same CRM account.
 *
 * <p>
 * A single instance is passed by reference into each extraction run, since the budget is
 * account-wide rather than per run.
 */
public interface RateLimiter {

	/**
	 * Block until issuing one more request stays within the budget, then record it.
	 * Never fails, only delays.
	 */
	void acquire();

}
