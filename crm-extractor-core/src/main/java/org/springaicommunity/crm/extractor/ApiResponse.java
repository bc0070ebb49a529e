package org.springaicommunity.crm.extractor;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Raw HTTP response from the CRM API. Header lookup is case-insensitive.
 *
 * @param statusCode HTTP status code
 * @param headers response headers
 * @param body response body (empty string when there is none)
 */
public record ApiResponse(int statusCode, Map<String, List<String>> headers, String body) {

	public ApiResponse {
		Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
		headers = Collections.unmodifiableMap(copy);
	}

	public static ApiResponse of(int statusCode, String body) {
		return new ApiResponse(statusCode, Map.of(), body);
	}

	public Optional<String> firstHeader(String name) {
		List<String> values = headers.get(name);
		return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
	}

	/**
	 * Read a header as a long.
	 * @param name header name
	 * @return the value, or empty if the header is absent or not a number
	 */
	public OptionalLong longHeader(String name) {
		Optional<String> value = firstHeader(name);
		if (value.isEmpty()) {
			return OptionalLong.empty();
		}
		try {
			return OptionalLong.of(Long.parseLong(value.get().trim()));
		}
		catch (NumberFormatException e) {
			return OptionalLong.empty();
		}
	}

	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

}
