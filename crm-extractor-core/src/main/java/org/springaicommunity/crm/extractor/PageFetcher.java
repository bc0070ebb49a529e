package org.springaicommunity.crm.extractor;

/**
 * Fetches one page of records from the CRM list endpoint.
 *
 * <p>
 * Implementations carry no retry or persistence logic; retries belong to the
 * {@link RequestExecutor} they delegate to.
 */
@FunctionalInterface
public interface PageFetcher {

	/**
	 * Fetch the page described by the request.
	 * @param request cursor and filter parameters
	 * @return the decoded page
	 * @throws CrmApiException if the API answered with a non-2xx status after retries, or
	 * the body could not be decoded
	 */
	PageResult fetch(PageRequest request);

}
