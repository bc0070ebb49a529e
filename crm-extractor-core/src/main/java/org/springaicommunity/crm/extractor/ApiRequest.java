package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A single logical HTTP call against the CRM API.
 *
 * @param method HTTP method (GET, POST, ...)
 * @param url absolute URL without query string
 * @param headers extra headers, layered over the transport defaults
 * @param params query parameters, in insertion order
 * @param body JSON request body, or null for none
 */
public record ApiRequest(String method, String url, Map<String, String> headers, Map<String, String> params,
		@Nullable String body) {

	public ApiRequest {
		headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
		params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
	}

	public static ApiRequest get(String url) {
		return new ApiRequest("GET", url, Map.of(), Map.of(), null);
	}

	public static ApiRequest get(String url, Map<String, String> params) {
		return new ApiRequest("GET", url, Map.of(), params, null);
	}

	/**
	 * Build the full request URI, URL-encoding the query parameters.
	 * @return the URI including the query string
	 */
	public URI uri() {
		if (params.isEmpty()) {
			return URI.create(url);
		}
		String query = params.entrySet()
			.stream()
			.map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
			.collect(Collectors.joining("&"));
		return URI.create(url + (url.contains("?") ? "&" : "?") + query);
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

}
