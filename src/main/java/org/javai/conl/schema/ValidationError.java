package org.javai.conl.schema;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.javai.conl.LineSpans;

/**
 * A problem found while validating a document, attached to the key or value it concerns.
 *
 * {@code toString()} renders the error the way command line tools print it:
 * {@code "<line>: <message>"}.
 */
public sealed interface ValidationError {

	/**
	 * Orders errors by line; on the same line key errors come before value errors, and
	 * errors about the document as a whole come last.
	 */
	Comparator<ValidationError> ORDER = Comparator.comparing(ValidationError::position);

	Position position();

	/**
	 * The human readable description of the problem.
	 */
	String message();

	/**
	 * When several kinds of error are found at one position only the highest priority kind
	 * is reported.
	 */
	int priority();

	/**
	 * The 1-based line to report the error on.
	 */
	default int line() {
		return position().displayLine();
	}

	/**
	 * The column range, in code points, of the part of the line the error refers to: the
	 * key or list marker for key errors and for entries without a value, the value
	 * otherwise, and the whole entry for document-level errors.
	 *
	 * @param lineText the text of line {@link #line()} of the validated document
	 */
	default Range range(String lineText) {
		LineSpans spans = LineSpans.of(Objects.requireNonNull(lineText, "lineText must not be null"));
		if (position().isRoot()) {
			return new Range(spans.startKey(), spans.endValue());
		}
		if (position().key() || !spans.hasValue()) {
			return new Range(spans.startKey(), spans.endKey());
		}
		return new Range(spans.startValue(), spans.endValue());
	}

	/**
	 * A column range within a line, end exclusive.
	 */
	record Range(int start, int end) {
	}

	/**
	 * The text could not be decoded, for example because of an unclosed quote.
	 */
	record DecodeError(Position position, String error) implements ValidationError {
		@Override
		public String message() {
			return error;
		}

		@Override
		public int priority() {
			return 4;
		}

		@Override
		public String toString() {
			return line() + ": " + message();
		}
	}

	/**
	 * The value did not match any of the candidates.
	 */
	record ExpectedMatch(Position position, List<String> candidates) implements ValidationError {
		public ExpectedMatch {
			candidates = sortedDistinct(candidates);
		}

		@Override
		public String message() {
			return "expected " + joinWithOr(candidates);
		}

		@Override
		public int priority() {
			return 1;
		}

		@Override
		public String toString() {
			return line() + ": " + message();
		}
	}

	/**
	 * A map is missing a required key. Several missing keys are reported as alternatives.
	 */
	record MissingRequiredKey(Position position, List<String> keys) implements ValidationError {
		public MissingRequiredKey {
			keys = sortedDistinct(keys);
		}

		@Override
		public String message() {
			return "missing required key " + joinWithOr(keys);
		}

		@Override
		public int priority() {
			return 2;
		}

		@Override
		public String toString() {
			return line() + ": " + message();
		}
	}

	/**
	 * A list is shorter than its required items.
	 */
	record MissingRequiredItem(Position position, String description) implements ValidationError {
		@Override
		public String message() {
			return "missing required list item " + description;
		}

		@Override
		public int priority() {
			return 2;
		}

		@Override
		public String toString() {
			return line() + ": " + message();
		}
	}

	/**
	 * A key or list item that the schema does not allow.
	 */
	record Unexpected(Position position, String description) implements ValidationError {
		@Override
		public String message() {
			return "unexpected " + description;
		}

		@Override
		public int priority() {
			return 3;
		}

		@Override
		public String toString() {
			return line() + ": " + message();
		}
	}

	/**
	 * A key that repeats an earlier key, or matches the same required key as an earlier one.
	 */
	record DuplicateKey(Position position, String description) implements ValidationError {
		@Override
		public String message() {
			return "duplicate key " + description;
		}

		@Override
		public int priority() {
			return 3;
		}

		@Override
		public String toString() {
			return line() + ": " + message();
		}
	}

	/**
	 * The schema the document asked for could not be loaded.
	 */
	record SchemaUnavailable(Position position, String reason) implements ValidationError {
		@Override
		public String message() {
			return reason;
		}

		@Override
		public int priority() {
			return 5;
		}

		@Override
		public String toString() {
			return line() + ": " + message();
		}
	}

	private static List<String> sortedDistinct(List<String> items) {
		return List.copyOf(new TreeSet<>(items));
	}

	private static String joinWithOr(List<String> items) {
		if (items.size() <= 1) {
			return items.isEmpty() ? "" : items.get(0);
		}
		return String.join(", ", items.subList(0, items.size() - 1)) + " or " + items.get(items.size() - 1);
	}
}
