package org.javai.conl.schema;

import com.google.re2j.Pattern;
import com.google.re2j.PatternSyntaxException;
import java.util.List;
import java.util.Objects;

/**
 * Matches a single value: either a regular expression over the whole decoded scalar, or a
 * reference {@code <name>} to a named definition.
 *
 * References are bound to their definition when the schema is resolved. A leading
 * {@code \<} writes a pattern that starts with a literal {@code <}.
 * <p>
 * Patterns use RE2 syntax and match in time linear in the length of the value.
 */
public final class Matcher {

	private final String raw;
	private final String docs;
	private final String reference;
	private final Pattern pattern;
	private Definition resolved;

	private Matcher(String raw, String docs, String reference, Pattern pattern) {
		this.raw = raw;
		this.docs = docs;
		this.reference = reference;
		this.pattern = pattern;
	}

	/**
	 * Parses a matcher as written in a schema.
	 *
	 * @throws SchemaParseException if a reference is not closed or a pattern does not compile
	 */
	public static Matcher parse(String text, String docs) {
		Objects.requireNonNull(text, "text must not be null");
		if (text.startsWith("<")) {
			if (!text.endsWith(">") || text.length() < 3) {
				throw new SchemaParseException("invalid schema: " + text + " is missing a closing >");
			}
			return new Matcher(text, docs, text.substring(1, text.length() - 1), null);
		}
		try {
			Pattern pattern = Pattern.compile("^(?:" + text + ")$", Pattern.DOTALL);
			return new Matcher(text, docs, null, pattern);
		}
		catch (PatternSyntaxException e) {
			throw new SchemaParseException("invalid schema: invalid pattern " + text + ": " + e.getDescription(), e);
		}
	}

	public static Matcher parse(String text) {
		return parse(text, null);
	}

	public boolean isReference() {
		return reference != null;
	}

	/**
	 * The referenced definition name, or null for patterns.
	 */
	public String reference() {
		return reference;
	}

	public String docs() {
		return docs;
	}

	/**
	 * The definition a reference was resolved to, or null for patterns and unresolved
	 * references.
	 */
	public Definition resolved() {
		return resolved;
	}

	void resolve(Definition definition) {
		this.resolved = definition;
	}

	/**
	 * Whether the text is a match for this matcher. References match when the definition
	 * they point to accepts the text as a scalar.
	 */
	public boolean matches(String text) {
		if (pattern != null) {
			return pattern.matcher(text).matches();
		}
		if (resolved == null) {
			return false;
		}
		Definition.Shape shape = resolved.shape();
		if (shape instanceof Definition.Scalar scalar) {
			return scalar.matcher().matches(text);
		}
		if (shape instanceof Definition.OneOf oneOf) {
			return oneOf.alternatives().stream().anyMatch(m -> m.matches(text));
		}
		return false;
	}

	/**
	 * The matcher as written in the schema.
	 */
	public String description() {
		return raw;
	}

	/**
	 * What a value has to look like to match, for error messages: the literals of a literal
	 * alternation, otherwise the matcher as written.
	 */
	public List<String> candidates() {
		if (pattern != null) {
			List<String> literals = PatternLiterals.of(raw);
			if (!literals.isEmpty()) {
				return literals;
			}
		}
		return List.of(raw);
	}

	/**
	 * The literal strings this matcher accepts, following references to scalar and
	 * one-of definitions. Empty when the accepted values cannot be enumerated.
	 */
	public List<String> literals() {
		if (pattern != null) {
			return PatternLiterals.of(raw);
		}
		if (resolved == null) {
			return List.of();
		}
		Definition.Shape shape = resolved.shape();
		if (shape instanceof Definition.Scalar scalar) {
			return scalar.matcher().literals();
		}
		if (shape instanceof Definition.OneOf oneOf) {
			return oneOf.alternatives().stream()
					.flatMap(m -> m.literals().stream())
					.distinct()
					.toList();
		}
		return List.of();
	}

	/**
	 * The docs of this matcher, or of the definition it refers to.
	 */
	public String effectiveDocs() {
		if (docs != null) {
			return docs;
		}
		return resolved != null ? resolved.docs() : null;
	}

	@Override
	public String toString() {
		return raw;
	}
}
