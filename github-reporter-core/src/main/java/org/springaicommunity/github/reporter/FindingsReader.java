package org.springaicommunity.github.reporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the findings of a review run from JSON.
 *
 * <p>
 * Expected document:
 *
 * <pre>
 * {
 *   "warnings":  ["plain text", {"message": "text", "sticky": true}],
 *   "errors":    [],
 *   "messages":  [],
 *   "markdowns": []
 * }
 * </pre>
 *
 * Every array is optional. An entry is either a string or an object with a
 * {@code message} and an optional {@code sticky} flag.
 */
public class FindingsReader {

	private final ObjectMapper objectMapper;

	public FindingsReader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public FindingSet read(Path file) throws IOException {
		return parse(Files.readString(file));
	}

	/**
	 * Parse a findings document.
	 * @param json the document
	 * @return the finding set
	 * @throws IllegalArgumentException if the document is not valid findings JSON
	 */
	public FindingSet parse(String json) {
		JsonNode root;
		try {
			root = objectMapper.readTree(json);
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Findings are not valid JSON: " + e.getOriginalMessage(), e);
		}
		if (root == null || !root.isObject()) {
			throw new IllegalArgumentException("Findings must be a JSON object");
		}
		return new FindingSet(parseKind(root, "warnings", FindingKind.WARNING),
				parseKind(root, "errors", FindingKind.ERROR), parseKind(root, "messages", FindingKind.MESSAGE),
				parseKind(root, "markdowns", FindingKind.MARKDOWN));
	}

	private List<Finding> parseKind(JsonNode root, String field, FindingKind kind) {
		JsonNode nodes = root.path(field);
		if (nodes.isMissingNode() || nodes.isNull()) {
			return List.of();
		}
		if (!nodes.isArray()) {
			throw new IllegalArgumentException("'" + field + "' must be an array");
		}
		List<Finding> findings = new ArrayList<>();
		for (JsonNode node : nodes) {
			if (node.isTextual()) {
				findings.add(new Finding(kind, node.asText(), false));
			}
			else if (node.isObject() && node.path("message").isTextual()) {
				findings.add(new Finding(kind, node.path("message").asText(), node.path("sticky").asBoolean(false)));
			}
			else {
				throw new IllegalArgumentException("Invalid entry in '" + field + "': " + node);
			}
		}
		return findings;
	}

}
