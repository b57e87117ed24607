package org.javai.conl;

/**
 * Represents a token in a CONL document.
 *
 * @param kind the token kind
 * @param content the decoded text content (empty for structural tokens)
 * @param line the 1-based line the token starts on
 * @param error a decode or structure problem found for this token, or null
 */
public record Token(Kind kind, String content, int line, String error) {

	public enum Kind {
		COMMENT,            // ; text
		INDENT,             // deeper indentation
		OUTDENT,            // end of an indented section
		MAP_KEY,            // key = ...
		LIST_ITEM,          // = ...
		SCALAR,             // single line value
		NO_VALUE,           // key or item without a value
		MULTILINE_HINT,     // """hint
		MULTILINE_SCALAR    // indented block following a hint
	}

	public Token {
		content = content != null ? content : "";
	}

	public static Token of(Kind kind, String content, int line) {
		return new Token(kind, content, line, null);
	}

	public static Token error(Kind kind, int line, String error) {
		return new Token(kind, "", line, error);
	}

	public boolean hasError() {
		return error != null;
	}

	public boolean isKind(Kind expected) {
		return kind == expected;
	}

	/**
	 * Whether this token carries the key or item marker of an entry.
	 */
	public boolean isEntry() {
		return kind == Kind.MAP_KEY || kind == Kind.LIST_ITEM;
	}

	@Override
	public String toString() {
		String text = switch (kind) {
			case MAP_KEY, SCALAR, MULTILINE_SCALAR, COMMENT, MULTILINE_HINT -> kind + "(" + content + ")";
			default -> kind.toString();
		};
		return line + ":" + text + (error != null ? "!" + error : "");
	}
}
