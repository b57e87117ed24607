package org.javai.conl;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Tokenizer for CONL documents.
 *
 * <p>Post-processes the raw lexer output so that consumers can rely on these invariants:
 * <ul>
 * <li>{@link Token.Kind#INDENT} and {@link Token.Kind#OUTDENT} are always paired</li>
 * <li>ignoring comments, a {@code MAP_KEY} or {@code LIST_ITEM} is always followed by a
 * {@code SCALAR}, a {@code MULTILINE_HINT} (then a {@code MULTILINE_SCALAR}), a
 * {@code NO_VALUE} or an {@code INDENT}</li>
 * <li>a section contains only map keys or only list items, never a mix</li>
 * </ul>
 * Problems are reported in {@link Token#error()} and scanning continues, so the resulting
 * document may not be what the author intended.
 *
 * <p>One token is produced per {@link #next()} call. A tokenizer is consumed once and is
 * not safe for use from several threads.
 */
public final class ConlTokenizer implements Iterator<Token> {

	private static final class SectionState {
		Token.Kind kind;
		boolean hasKey;
	}

	private final ConlLexer lexer;
	private final Deque<Token> pending = new ArrayDeque<>();
	private final List<SectionState> states = new ArrayList<>(List.of(new SectionState()));
	private int lastLine = 0;
	private boolean drained = false;

	public ConlTokenizer(byte[] input) {
		this.lexer = new ConlLexer(input);
	}

	public ConlTokenizer(String input) {
		this(input != null ? input.getBytes(StandardCharsets.UTF_8) : new byte[0]);
	}

	/**
	 * Drains the remaining tokens into a list.
	 *
	 * @return the remaining tokens, in order
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<>();
		while (hasNext()) {
			tokens.add(next());
		}
		return tokens;
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
		while (pending.isEmpty() && !drained) {
			if (lexer.hasNext()) {
				normalize(lexer.next());
			}
			else {
				closeSections();
				drained = true;
			}
		}
	}

	private void normalize(Token token) {
		SectionState state = states.get(states.size() - 1);
		switch (token.kind()) {
			case INDENT -> {
				if (state.hasKey) {
					state.hasKey = false;
				}
				else {
					if (state.kind == null) {
						state.kind = Token.Kind.MAP_KEY;
					}
					pending.add(Token.error(state.kind, token.line(), "unexpected indent"));
				}
				states.add(new SectionState());
			}
			case OUTDENT -> {
				states.remove(states.size() - 1);
				if (state.hasKey) {
					pending.add(Token.of(Token.Kind.NO_VALUE, "", token.line()));
				}
			}
			case MAP_KEY, LIST_ITEM -> {
				if (state.kind == null) {
					state.kind = token.kind();
				}
				if (state.hasKey) {
					pending.add(Token.of(Token.Kind.NO_VALUE, "", token.line()));
				}
				state.hasKey = true;
				if (state.kind != token.kind()) {
					String error = token.kind() == Token.Kind.LIST_ITEM ? "unexpected list item" : "unexpected map key";
					pending.add(Token.error(state.kind, token.line(), error));
					return;
				}
			}
			case SCALAR, MULTILINE_SCALAR -> state.hasKey = false;
			default -> {
				// comments and multiline hints pass through
			}
		}
		lastLine = token.line();
		pending.add(token);
	}

	private void closeSections() {
		while (!states.isEmpty()) {
			SectionState state = states.remove(states.size() - 1);
			if (state.hasKey) {
				pending.add(Token.of(Token.Kind.NO_VALUE, "", lastLine));
			}
			if (!states.isEmpty()) {
				pending.add(Token.of(Token.Kind.OUTDENT, "", lastLine));
			}
		}
	}
}
