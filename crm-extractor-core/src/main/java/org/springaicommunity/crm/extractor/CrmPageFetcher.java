package org.springaicommunity.crm.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link PageFetcher} for the CRM v3 objects list endpoint
 * ({@code GET /crm/v3/objects/{objectType}}).
 *
 * <p>
 * Converts the JSON response to {@link RawRecord}s at the service boundary and reads the
 * next cursor from {@code paging.next.after}.
 */
public class CrmPageFetcher implements PageFetcher {

	private static final Logger logger = LoggerFactory.getLogger(CrmPageFetcher.class);

	/**
	 * Properties requested when the caller does not name any.
	 */
	public static final List<String> DEFAULT_PROPERTIES = List.of("dealname", "amount", "dealstage", "pipeline",
			"closedate", "createdate", "hs_lastmodifieddate", "hubspot_owner_id", "dealtype",
			"hs_deal_stage_probability");

	static final String TEST_PARAM_PREFIX = "_test_";

	static final String SCAN_ID_PARAM = "scan_id";

	private final RequestExecutor executor;

	private final ObjectMapper objectMapper;

	private final String baseUrl;

	private final String objectType;

	public CrmPageFetcher(RequestExecutor executor, ObjectMapper objectMapper, String baseUrl, String objectType) {
		this.executor = executor;
		this.objectMapper = objectMapper;
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.objectType = objectType;
	}

	public String getObjectType() {
		return objectType;
	}

	@Override
	public PageResult fetch(PageRequest request) {
		String url = baseUrl + "/crm/v3/objects/" + objectType;
		Map<String, String> params = buildParams(request);

		long start = System.currentTimeMillis();
		ApiResponse response = executor.execute(ApiRequest.get(url, params));
		if (!response.isSuccessful()) {
			logger.error("Error fetching {} page (cursor={}): HTTP {}", objectType, request.cursor(),
					response.statusCode());
			throw new CrmApiException("Listing " + objectType + " failed with HTTP " + response.statusCode(),
					response.statusCode(), response.body());
		}

		PageResult page = parse(response.body());
		logger.info("Retrieved {} {} in {}ms (has more: {}, next cursor: {})", page.records().size(), objectType,
				System.currentTimeMillis() - start, page.hasNext(), page.nextCursor());
		return page;
	}

	/**
	 * Build the query parameters for one list call. Insertion order is the order they
	 * appear on the wire.
	 */
	Map<String, String> buildParams(PageRequest request) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("limit", String.valueOf(request.effectiveBatchSize()));
		params.put("archived", String.valueOf(request.includeArchived()));
		if (request.cursor() != null) {
			params.put("after", request.cursor());
		}
		List<String> properties = request.properties().isEmpty() ? DEFAULT_PROPERTIES : request.properties();
		params.put("properties", String.join(",", properties));
		if (!request.associations().isEmpty()) {
			params.put("associations", String.join(",", request.associations()));
		}
		request.extraParams().forEach((key, value) -> {
			if (!key.startsWith(TEST_PARAM_PREFIX) && !SCAN_ID_PARAM.equals(key)) {
				params.put(key, value);
			}
		});
		return params;
	}

	PageResult parse(String body) {
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new CrmApiException("Could not decode " + objectType + " page: " + e.getOriginalMessage(), e);
		}
		if (root == null || !root.isObject()) {
			throw new CrmApiException("Unexpected " + objectType + " page payload", 200, body);
		}

		List<RawRecord> records = new ArrayList<>();
		for (JsonNode node : JsonNodes.getArray(root, "results")) {
			records.add(parseRecord(node));
		}
		String nextCursor = JsonNodes.getString(root, "paging", "next", "after").filter(s -> !s.isEmpty()).orElse(null);
		Long total = JsonNodes.getLong(root, "total").orElse(null);
		return new PageResult(records, nextCursor, total);
	}

	private RawRecord parseRecord(JsonNode node) {
		return new RawRecord(JsonNodes.getString(node, "id").orElse(null), JsonNodes.toMap(node.path("properties")),
				JsonNodes.toMap(node.path("associations")), JsonNodes.getString(node, "createdAt").orElse(null),
				JsonNodes.getString(node, "updatedAt").orElse(null), node.path("archived").asBoolean(false));
	}

}
