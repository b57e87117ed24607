package org.javai.conl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders CONL documents as JSON trees.
 *
 * Maps become objects, lists become arrays, scalars become strings and missing values
 * become {@code null}. An empty document is an empty object.
 */
public final class ConlJson {

	private static final ObjectMapper MAPPER = new ObjectMapper();
	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

	private ConlJson() {
		// Utility class - no instantiation
	}

	public static JsonNode toJson(ConlDocument document) {
		ConlValue root = document.root();
		return root.isEmpty() ? NODES.objectNode() : toJson(root);
	}

	public static JsonNode toJson(ConlValue value) {
		if (value.isScalar()) {
			return NODES.textNode(value.scalar());
		}
		if (value.isMap()) {
			ObjectNode object = NODES.objectNode();
			for (ConlEntry entry : value.entries()) {
				object.set(entry.key().content(), toJson(entry.value()));
			}
			return object;
		}
		if (value.isList()) {
			ArrayNode array = NODES.arrayNode();
			for (ConlEntry entry : value.entries()) {
				array.add(toJson(entry.value()));
			}
			return array;
		}
		return NODES.nullNode();
	}

	/**
	 * Renders a document as compact JSON text.
	 *
	 * @throws IllegalArgumentException if the document contains decode errors
	 */
	public static String toJsonString(ConlDocument document) {
		if (document.hasErrors()) {
			Token first = document.errors().get(0);
			throw new IllegalArgumentException(first.line() + ": " + first.error());
		}
		try {
			return MAPPER.writeValueAsString(toJson(document));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render document as JSON", e);
		}
	}
}
