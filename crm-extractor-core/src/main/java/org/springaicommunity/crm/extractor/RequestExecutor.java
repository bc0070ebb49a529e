package org.springaicommunity.crm.extractor;

/**
 * Executes one logical CRM API call, hiding rate limiting and transient failures.
 */
public interface RequestExecutor {

	/**
	 * Execute a request with the executor's configured retry budget.
	 * @param request the request
	 * @return the terminal response; may be a non-2xx status
	 * @throws CrmApiException if no response could be obtained within the retry budget
	 */
	ApiResponse execute(ApiRequest request);

	/**
	 * Execute a request with an explicit retry budget for this call only.
	 * @param request the request
	 * @param maxRetries retries after the first attempt
	 * @return the terminal response; may be a non-2xx status
	 * @throws CrmApiException if no response could be obtained within the retry budget
	 */
	ApiResponse execute(ApiRequest request, int maxRetries);

}
