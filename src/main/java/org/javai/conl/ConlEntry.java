package org.javai.conl;

/**
 * A map entry or list item.
 *
 * The key token is the {@link Token.Kind#MAP_KEY} or {@link Token.Kind#LIST_ITEM} that
 * introduced the entry; its line is the line of the entry. The parent line is the line of
 * the entry whose value contains this one, or 0 at the document root.
 */
public final class ConlEntry {

	private final Token key;
	private final int parentLine;
	private ConlValue value = ConlValue.NONE;

	ConlEntry(Token key, int parentLine) {
		this.key = key;
		this.parentLine = parentLine;
	}

	public Token key() {
		return key;
	}

	public ConlValue value() {
		return value;
	}

	void value(ConlValue value) {
		this.value = value;
	}

	public int line() {
		return key.line();
	}

	public int parentLine() {
		return parentLine;
	}

	public boolean isListItem() {
		return key.isKind(Token.Kind.LIST_ITEM);
	}

	/**
	 * The line the value starts on: its scalar token for scalars, otherwise the entry line.
	 */
	public int valueLine() {
		return value.isScalar() ? value.scalarToken().line() : key.line();
	}

	@Override
	public String toString() {
		return (isListItem() ? "=" : key.content()) + "@" + key.line() + "=" + value;
	}
}
