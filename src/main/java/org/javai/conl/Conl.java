package org.javai.conl;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Entry points for reading CONL documents.
 *
 * Example usage:
 *
 * <pre>
 * for (Token token : Conl.structuralTokens(bytes)) {
 *     if (token.hasError()) {
 *         throw new IllegalArgumentException(token.line() + ": " + token.error());
 *     }
 *     ...
 * }
 *
 * ConlDocument document = Conl.parse(bytes);
 * </pre>
 */
public final class Conl {

	private Conl() {
		// Utility class - no instantiation
	}

	/**
	 * The normalized token stream of a document. Each call to {@code iterator()} scans the
	 * input afresh.
	 */
	public static Iterable<Token> tokens(byte[] input) {
		byte[] data = input != null ? input.clone() : new byte[0];
		return () -> new ConlTokenizer(data);
	}

	public static Iterable<Token> tokens(String input) {
		return tokens(input != null ? input.getBytes(StandardCharsets.UTF_8) : null);
	}

	/**
	 * The token stream without comments and multiline hints: only map, list and scalar
	 * structure, including {@code NO_VALUE} and error-flagged tokens.
	 */
	public static Iterable<Token> structuralTokens(byte[] input) {
		Iterable<Token> tokens = tokens(input);
		return () -> new StructuralIterator(tokens.iterator());
	}

	public static Iterable<Token> structuralTokens(String input) {
		return structuralTokens(input != null ? input.getBytes(StandardCharsets.UTF_8) : null);
	}

	public static ConlDocument parse(byte[] input) {
		return ConlDocument.parse(input);
	}

	public static ConlDocument parse(String input) {
		return ConlDocument.parse(input);
	}

	private static final class StructuralIterator implements Iterator<Token> {

		private final Iterator<Token> delegate;
		private Token next;

		StructuralIterator(Iterator<Token> delegate) {
			this.delegate = delegate;
		}

		@Override
		public boolean hasNext() {
			while (next == null && delegate.hasNext()) {
				Token candidate = delegate.next();
				if (!candidate.isKind(Token.Kind.COMMENT) && !candidate.isKind(Token.Kind.MULTILINE_HINT)) {
					next = candidate;
				}
			}
			return next != null;
		}

		@Override
		public Token next() {
			if (!hasNext()) {
				throw new NoSuchElementException("No more tokens");
			}
			Token token = next;
			next = null;
			return token;
		}
	}
}
