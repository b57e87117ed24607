package org.javai.conl;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.javai.conl.ConlLiterals.Decoded;
import org.javai.conl.ConlLiterals.Split;

/**
 * Raw line-by-line tokenizer.
 * Tracks the indentation stack and multiline capture state, and produces tokens one
 * line at a time. Malformed input never stops the scan; problems are attached to the
 * offending token. {@link ConlTokenizer} layers the stream invariants on top.
 */
final class ConlLexer implements Iterator<Token> {

	private static final String MULTILINE_MARKER = "\"\"\"";

	private final ConlLines lines;
	private final Deque<Token> pending = new ArrayDeque<>();
	private final List<String> stack = new ArrayList<>(List.of(""));

	private boolean multiline = false;
	private String multilinePrefix = null;
	private final StringBuilder multilineValue = new StringBuilder();
	private int multilineLine = 0;
	private boolean finished = false;

	ConlLexer(byte[] input) {
		this.lines = new ConlLines(new String(input != null ? input : new byte[0], StandardCharsets.ISO_8859_1));
	}

	@Override
	public boolean hasNext() {
		fill();
		return !pending.isEmpty();
	}

	@Override
	public Token next() {
		if (!hasNext()) {
			throw new NoSuchElementException("No more tokens");
		}
		return pending.poll();
	}

	private void fill() {
		while (pending.isEmpty() && !finished) {
			if (lines.hasNext()) {
				lexLine(lines.next());
			}
			else {
				finish();
				finished = true;
			}
		}
	}

	private void lexLine(ConlLines.Line line) {
		String content = line.text();
		int lno = line.number();
		String rest = ConlLiterals.trimLeading(content);
		String indent = content.substring(0, content.length() - rest.length());

		if (multiline && continueMultiline(content, indent, rest, lno)) {
			return;
		}

		if (rest.isEmpty()) {
			return;
		}

		if (rest.startsWith(";")) {
			comment(rest.substring(1), lno);
			return;
		}

		while (!indent.startsWith(top())) {
			stack.remove(stack.size() - 1);
			pending.add(Token.of(Token.Kind.OUTDENT, "", lno));
		}
		if (!indent.equals(top())) {
			stack.add(indent);
			pending.add(Token.of(Token.Kind.INDENT, indent, lno));
		}

		if (rest.startsWith("=")) {
			rest = ConlLiterals.trimLeading(rest.substring(1));
			pending.add(Token.of(Token.Kind.LIST_ITEM, "", lno));
		}
		else {
			Split key = ConlLiterals.splitLiteral(rest, true);
			Decoded decoded = ConlLiterals.decodeLiteral(key.before());
			pending.add(new Token(Token.Kind.MAP_KEY, decoded.value(), lno, decoded.error()));
			rest = ConlLiterals.trimLeading(key.after());
			if (rest.startsWith("=")) {
				rest = ConlLiterals.trimLeading(rest.substring(1));
			}
		}

		if (rest.startsWith(";")) {
			comment(rest.substring(1), lno);
			return;
		}

		if (rest.startsWith(MULTILINE_MARKER)) {
			Split hint = ConlLiterals.splitLiteral(rest.substring(MULTILINE_MARKER.length()), false);
			multiline = true;
			multilineLine = lno;
			Decoded decoded = ConlLiterals.decodeUtf8(hint.before());
			String error = hint.before().startsWith("\"") ? "characters after quotes" : decoded.error();
			pending.add(new Token(Token.Kind.MULTILINE_HINT, decoded.value(), lno, error));
			if (hint.after().startsWith(";")) {
				comment(hint.after().substring(1), lno);
			}
			return;
		}

		Split value = ConlLiterals.splitLiteral(rest, false);
		if (!value.before().isEmpty()) {
			Decoded decoded = ConlLiterals.decodeLiteral(value.before());
			pending.add(new Token(Token.Kind.SCALAR, decoded.value(), lno, decoded.error()));
		}
		if (value.after().startsWith(";")) {
			comment(value.after().substring(1), lno);
		}
	}

	/**
	 * Feeds one line to an open multiline capture.
	 *
	 * @return true if the line was consumed by the capture
	 */
	private boolean continueMultiline(String content, String indent, String rest, int lno) {
		if (multilinePrefix == null) {
			String top = top();
			if (!rest.isEmpty() && indent.startsWith(top) && !indent.equals(top)) {
				multilinePrefix = indent;
				multilineValue.setLength(0);
				multilineValue.append(rest);
				multilineLine = lno;
				return true;
			}
			if (rest.isEmpty()) {
				return true;
			}
			pending.add(Token.error(Token.Kind.MULTILINE_SCALAR, multilineLine, "missing multiline value"));
			resetMultiline();
			return false;
		}

		if (content.startsWith(multilinePrefix)) {
			multilineValue.append('\n').append(content.substring(multilinePrefix.length()));
			return true;
		}
		if (rest.isEmpty()) {
			multilineValue.append('\n');
			return true;
		}
		emitMultiline();
		return false;
	}

	private void emitMultiline() {
		String value = ConlLiterals.trimTrailingWhitespace(multilineValue.toString());
		Decoded decoded = ConlLiterals.decodeUtf8(value);
		pending.add(new Token(Token.Kind.MULTILINE_SCALAR, decoded.value(), multilineLine, decoded.error()));
		resetMultiline();
	}

	private void resetMultiline() {
		multiline = false;
		multilinePrefix = null;
		multilineValue.setLength(0);
	}

	private void finish() {
		if (!multiline) {
			return;
		}
		if (multilinePrefix != null) {
			emitMultiline();
		}
		else {
			pending.add(Token.error(Token.Kind.MULTILINE_SCALAR, multilineLine, "missing multiline value"));
			resetMultiline();
		}
	}

	private void comment(String text, int lno) {
		Decoded decoded = ConlLiterals.decodeUtf8(text);
		pending.add(new Token(Token.Kind.COMMENT, decoded.value(), lno, decoded.error()));
	}

	private String top() {
		return stack.get(stack.size() - 1);
	}
}
