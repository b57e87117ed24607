package org.javai.conl.schema;

import java.util.Comparator;

/**
 * Where in a document a validation attempt or error applies: the key (or list marker) of
 * the entry on a line, the value starting on a line, or the document as a whole.
 *
 * @param line the 1-based line, or 0 for the document root
 * @param key whether the position is the key of an entry rather than its value
 */
public record Position(int line, boolean key) implements Comparable<Position> {

	public static final Position ROOT = new Position(0, false);

	private static final Comparator<Position> ORDER = Comparator
			.comparingInt(Position::displayLine)
			.thenComparingInt(Position::rank);

	public static Position key(int line) {
		return new Position(line, true);
	}

	public static Position value(int line) {
		return new Position(line, false);
	}

	public boolean isRoot() {
		return line == 0;
	}

	/**
	 * The line to show to users; errors about the document as a whole are shown on line 1.
	 */
	public int displayLine() {
		return isRoot() ? 1 : line;
	}

	private int rank() {
		if (isRoot()) {
			return 2;
		}
		return key ? 0 : 1;
	}

	@Override
	public int compareTo(Position other) {
		return ORDER.compare(this, other);
	}

	@Override
	public String toString() {
		if (isRoot()) {
			return "root";
		}
		return line + (key ? ":key" : ":value");
	}
}
