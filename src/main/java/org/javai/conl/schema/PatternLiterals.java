package org.javai.conl.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates the strings a pattern can match when it is a plain alternation of literals,
 * such as {@code true|false} or {@code (?:red|green|blue)}.
 */
final class PatternLiterals {

	private static final String METACHARACTERS = ".^$*+?()[]{}";

	private PatternLiterals() {
		// Utility class - no instantiation
	}

	/**
	 * Returns the literal alternatives of the pattern in the order written, or an empty list
	 * if the pattern uses any other regular expression construct.
	 */
	static List<String> of(String pattern) {
		String body = stripGroup(pattern);
		List<String> literals = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		for (int i = 0; i < body.length(); i++) {
			char c = body.charAt(i);
			if (c == '\\') {
				if (i + 1 >= body.length()) {
					return List.of();
				}
				char escaped = body.charAt(++i);
				if (Character.isLetterOrDigit(escaped)) {
					return List.of();
				}
				current.append(escaped);
			}
			else if (c == '|') {
				addLiteral(literals, current);
			}
			else if (METACHARACTERS.indexOf(c) >= 0) {
				return List.of();
			}
			else {
				current.append(c);
			}
		}
		addLiteral(literals, current);
		return literals;
	}

	private static void addLiteral(List<String> literals, StringBuilder current) {
		if (current.length() > 0 && !literals.contains(current.toString())) {
			literals.add(current.toString());
		}
		current.setLength(0);
	}

	/**
	 * Removes one pair of parentheses enclosing the whole pattern.
	 */
	private static String stripGroup(String pattern) {
		int open;
		if (pattern.startsWith("(?:")) {
			open = 3;
		}
		else if (pattern.startsWith("(") && !pattern.startsWith("(?")) {
			open = 1;
		}
		else {
			return pattern;
		}
		if (!pattern.endsWith(")")) {
			return pattern;
		}
		int depth = 0;
		for (int i = 0; i < pattern.length(); i++) {
			char c = pattern.charAt(i);
			if (c == '\\') {
				i++;
			}
			else if (c == '(') {
				depth++;
			}
			else if (c == ')') {
				depth--;
				if (depth == 0 && i != pattern.length() - 1) {
					return pattern;
				}
			}
		}
		return depth == 0 ? pattern.substring(open, pattern.length() - 1) : pattern;
	}
}
