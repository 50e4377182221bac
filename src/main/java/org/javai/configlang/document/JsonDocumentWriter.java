package org.javai.configlang.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;

/**
 * Writes a document as JSON. Each element becomes an object with an {@code element}
 * name and, when present, {@code attributes}, {@code text} and {@code children}.
 */
public class JsonDocumentWriter implements DocumentWriter {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	@Override
	public String write(DocumentNode root, boolean pretty) {
		ObjectNode tree = toJson(root);
		try {
			return pretty
					? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(tree)
					: MAPPER.writeValueAsString(tree);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to write JSON document", e);
		}
	}

	ObjectNode toJson(DocumentNode node) {
		ObjectNode json = MAPPER.createObjectNode();
		json.put("element", node.name());
		if (!node.attributes().isEmpty()) {
			ObjectNode attributes = json.putObject("attributes");
			for (Map.Entry<String, String> attribute : node.attributes().entrySet()) {
				attributes.put(attribute.getKey(), attribute.getValue());
			}
		}
		if (node.hasText()) {
			json.put("text", node.text());
		}
		if (!node.children().isEmpty()) {
			ArrayNode children = json.putArray("children");
			for (DocumentNode child : node.children()) {
				children.add(toJson(child));
			}
		}
		return json;
	}
}
