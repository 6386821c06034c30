package org.javai.extparams.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Field-path extraction over Jackson trees, shared by the structured-data adapters.
 * <p>
 * Paths use dots and brackets: {@code database.host}, {@code servers[0].name}, {@code servers.0.name}.
 * A key that literally contains the whole path (e.g. a flat {@code "database.url"} entry) wins over
 * the nested interpretation.
 */
public final class JsonValues {

	public static final ObjectMapper MAPPER = new ObjectMapper();

	private JsonValues() {
	}

	public static Optional<JsonNode> at(JsonNode root, String path) {
		if (root == null || root.isMissingNode()) {
			return Optional.empty();
		}
		if (StringUtils.isEmpty(path)) {
			return Optional.of(root);
		}
		if (root.isObject() && root.has(path)) {
			return Optional.of(root.get(path));
		}
		JsonNode current = root;
		for (String segment : segments(path)) {
			current = step(current, segment);
			if (current == null) {
				return Optional.empty();
			}
		}
		return Optional.of(current);
	}

	/**
	 * Text nodes render as their text; anything else renders as compact JSON.
	 */
	public static String render(JsonNode node) {
		if (node.isTextual()) {
			return node.textValue();
		}
		try {
			return MAPPER.writeValueAsString(node);
		}
		catch (JsonProcessingException e) {
			return node.toString();
		}
	}

	/**
	 * Parses {@code content} as JSON, returning empty when it is not JSON.
	 */
	public static Optional<JsonNode> tryParse(String content) {
		if (StringUtils.isBlank(content)) {
			return Optional.empty();
		}
		try {
			return Optional.ofNullable(MAPPER.readTree(content));
		}
		catch (JsonProcessingException e) {
			return Optional.empty();
		}
	}

	private static JsonNode step(JsonNode current, String segment) {
		if (current.isObject()) {
			return current.get(segment);
		}
		if (current.isArray() && StringUtils.isNumeric(segment)) {
			return current.get(Integer.parseInt(segment));
		}
		return null;
	}

	static List<String> segments(String path) {
		List<String> segments = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		for (char c : path.toCharArray()) {
			if (c == '.' || c == '[' || c == ']') {
				if (current.length() > 0) {
					segments.add(current.toString());
					current.setLength(0);
				}
			}
			else {
				current.append(c);
			}
		}
		if (current.length() > 0) {
			segments.add(current.toString());
		}
		return segments;
	}
}
