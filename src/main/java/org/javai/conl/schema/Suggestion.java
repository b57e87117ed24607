package org.javai.conl.schema;

/**
 * A completion offered for a key or value.
 *
 * @param value the text to insert
 * @param docs documentation for the suggestion, or null
 * @param kind whether this is a literal, or a signal that a list or map may start here
 */
public record Suggestion(String value, String docs, Kind kind) {

	public enum Kind {
		LITERAL,
		LIST,
		MAP
	}

	public static Suggestion literal(String value, String docs) {
		return new Suggestion(value, docs, Kind.LITERAL);
	}

	static Suggestion startList() {
		return new Suggestion("=", "list", Kind.LIST);
	}

	static Suggestion startMap() {
		return new Suggestion("", "map", Kind.MAP);
	}
}
