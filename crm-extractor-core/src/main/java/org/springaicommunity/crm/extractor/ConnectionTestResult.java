package org.springaicommunity.crm.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of {@link CrmAccountService#testConnection()}.
 *
 * @param tokenValid whether the access token was accepted
 * @param apiReachable whether the API answered the validation call
 * @param recordsAccessible whether a one-record page of the object type could be listed
 * @param accountInfo account details, when available
 * @param usage API usage, when available
 * @param error description of the first failure, or null when everything worked
 */
public record ConnectionTestResult(boolean tokenValid, boolean apiReachable, boolean recordsAccessible,
		@Nullable JsonNode accountInfo, @Nullable ApiUsage usage, @Nullable String error) {

	public boolean isSuccessful() {
		return tokenValid && apiReachable && recordsAccessible;
	}

}
