package org.springaicommunity.crm.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static helpers for JsonNode navigation.
 */
final class JsonNodes {

	private JsonNodes() {
	}

	static JsonNode path(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

	static Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = path(node, path);
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target.asText());
	}

	static Optional<Long> getLong(JsonNode node, String... path) {
		JsonNode target = path(node, path);
		if (target.isNumber()) {
			return Optional.of(target.asLong());
		}
		if (target.isTextual()) {
			try {
				return Optional.of(Long.parseLong(target.asText().trim()));
			}
			catch (NumberFormatException e) {
				return Optional.empty();
			}
		}
		return Optional.empty();
	}

	static List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = path(node, path);
		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}
		return List.of();
	}

	/**
	 * Convert an object node into a map of plain Java values (strings, numbers, booleans,
	 * nested maps and lists). Anything that is not an object yields an empty map.
	 */
	static Map<String, @Nullable Object> toMap(JsonNode node) {
		Map<String, @Nullable Object> result = new LinkedHashMap<>();
		if (node.isObject()) {
			node.fields().forEachRemaining(entry -> result.put(entry.getKey(), toValue(entry.getValue())));
		}
		return result;
	}

	@Nullable
	static Object toValue(JsonNode node) {
		if (node.isNull() || node.isMissingNode()) {
			return null;
		}
		if (node.isObject()) {
			return toMap(node);
		}
		if (node.isArray()) {
			List<@Nullable Object> list = new ArrayList<>();
			node.forEach(child -> list.add(toValue(child)));
			return list;
		}
		if (node.isBoolean()) {
			return node.booleanValue();
		}
		if (node.isIntegralNumber()) {
			return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
		}
		if (node.isNumber()) {
			return node.decimalValue();
		}
		return node.asText();
	}

}
