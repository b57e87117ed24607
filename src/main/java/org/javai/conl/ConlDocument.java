package org.javai.conl;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An in-memory CONL document built from the normalized token stream.
 *
 * Building never fails: tokens that carry errors are kept in the tree as they are, and
 * are also listed by {@link #errors()} so that callers can report them.
 */
public final class ConlDocument {

	private final ConlValue root;
	private final List<Token> errors;
	private final Map<Integer, ConlEntry> entriesByLine;

	private ConlDocument(ConlValue root, List<Token> errors, Map<Integer, ConlEntry> entriesByLine) {
		this.root = root;
		this.errors = Collections.unmodifiableList(errors);
		this.entriesByLine = entriesByLine;
	}

	public static ConlDocument parse(String input) {
		return parse(input != null ? input.getBytes(StandardCharsets.UTF_8) : new byte[0]);
	}

	public static ConlDocument parse(byte[] input) {
		return build(new ConlTokenizer(input));
	}

	/**
	 * Builds a document from a normalized token stream.
	 */
	public static ConlDocument build(Iterator<Token> tokens) {
		ConlValue root = ConlValue.container();
		List<ConlValue> stack = new ArrayList<>(List.of(root));
		List<Integer> lineStack = new ArrayList<>(List.of(0));
		List<Token> errors = new ArrayList<>();
		Map<Integer, ConlEntry> entriesByLine = new HashMap<>();
		int lastLine = 0;

		while (tokens.hasNext()) {
			Token token = tokens.next();
			if (token.hasError()) {
				errors.add(token);
			}
			ConlValue current = stack.get(stack.size() - 1);

			switch (token.kind()) {
				case MAP_KEY, LIST_ITEM -> {
					lastLine = token.line();
					ConlEntry entry = new ConlEntry(token, lineStack.get(lineStack.size() - 1));
					current.add(entry);
					ConlEntry indexed = entriesByLine.get(token.line());
					if (indexed == null || (indexed.key().hasError() && !token.hasError())) {
						entriesByLine.put(token.line(), entry);
					}
				}
				case SCALAR, MULTILINE_SCALAR -> {
					ConlEntry entry = current.lastEntry();
					if (entry != null) {
						entry.value(ConlValue.scalar(token));
					}
				}
				case INDENT -> {
					ConlEntry entry = current.lastEntry();
					ConlValue container = ConlValue.container();
					if (entry != null) {
						entry.value(container);
					}
					stack.add(container);
					lineStack.add(lastLine);
				}
				case OUTDENT -> {
					if (stack.size() > 1) {
						stack.remove(stack.size() - 1);
						lineStack.remove(lineStack.size() - 1);
					}
				}
				default -> {
					// NO_VALUE, MULTILINE_HINT and COMMENT leave the tree unchanged
				}
			}
		}
		return new ConlDocument(root, errors, entriesByLine);
	}

	public ConlValue root() {
		return root;
	}

	/**
	 * Tokens that carried decode or structure errors, in document order.
	 */
	public List<Token> errors() {
		return errors;
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	/**
	 * Finds the entry whose key or list marker is on the given line. When the normalizer
	 * inserted an error entry on the same line, the entry written in the document wins.
	 */
	public Optional<ConlEntry> entryAt(int line) {
		return Optional.ofNullable(entriesByLine.get(line));
	}

	/**
	 * Returns a document with one root entry removed.
	 * Line lookups still find the removed entry.
	 */
	public ConlDocument without(ConlEntry rootEntry) {
		return new ConlDocument(root.without(rootEntry), errors, entriesByLine);
	}
}
