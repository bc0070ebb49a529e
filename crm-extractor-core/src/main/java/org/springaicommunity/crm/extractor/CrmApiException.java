package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a CRM API call fails terminally.
 *
 * <p>
 * Carries the HTTP status code and response body when the remote API answered, or the
 * underlying cause (timeout, connection failure, interrupt) when it did not. A status
 * code of {@code -1} means no response was received.
 */
public class CrmApiException extends RuntimeException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	public CrmApiException(String message, int statusCode, @Nullable String responseBody) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	public CrmApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	/**
	 * Returns true if the remote API rejected the call with 429 Too Many Requests.
	 */
	public boolean isRateLimited() {
		return statusCode == 429;
	}

	/**
	 * Returns true if the remote API answered with a 5xx status.
	 */
	public boolean isServerError() {
		return statusCode >= 500 && statusCode < 600;
	}

	/**
	 * Returns true if no HTTP response was received (timeout or connection failure).
	 */
	public boolean isTransportFailure() {
		return statusCode == -1;
	}

}
