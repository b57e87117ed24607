package org.javai.conl.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.conl.ConlDocument;
import org.javai.conl.ConlEntry;
import org.javai.conl.ConlValue;
import org.javai.conl.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a schema document into a resolved {@link Schema}.
 *
 * A schema document has a {@code root} matcher and a {@code definitions} map:
 *
 * <pre>
 * root = &lt;config&gt;
 * definitions
 *   config
 *     docs = Settings for the service
 *     required keys
 *       port = &lt;port&gt;
 *     keys
 *       host = .*
 *   port
 *     matches = [0-9]+
 * </pre>
 *
 * Definitions use exactly one of {@code matches}, {@code one of}, {@code keys}/{@code required keys}
 * or {@code items}/{@code required items}; a definition with none of them matches only a
 * missing value. A matcher is written either as a scalar or as a map with {@code matches}
 * and {@code docs}.
 */
final class SchemaParser {

	private static final Logger logger = LoggerFactory.getLogger(SchemaParser.class);

	private static final String ROOT = "root";
	private static final String DEFINITIONS = "definitions";
	private static final String DOCS = "docs";
	private static final String MATCHES = "matches";
	private static final String ONE_OF = "one of";
	private static final String KEYS = "keys";
	private static final String REQUIRED_KEYS = "required keys";
	private static final String ITEMS = "items";
	private static final String REQUIRED_ITEMS = "required items";

	private SchemaParser() {
		// Utility class - no instantiation
	}

	/**
	 * Builds and resolves a schema from a parsed schema document.
	 *
	 * @throws SchemaParseException if the document is malformed or does not describe a
	 *         valid schema
	 */
	static Schema parse(ConlDocument document) {
		if (document.hasErrors()) {
			Token error = document.errors().get(0);
			throw new SchemaParseException("invalid schema: " + error.line() + ": " + error.error());
		}

		Matcher root = null;
		Map<String, Definition> definitions = new LinkedHashMap<>();
		for (ConlEntry entry : document.root().entries()) {
			String key = entry.key().content();
			if (entry.isListItem()) {
				throw invalid(entry, "expected a map");
			}
			switch (key) {
				case ROOT -> root = parseMatcher(entry);
				case DEFINITIONS -> parseDefinitions(entry, definitions);
				default -> throw invalid(entry, "unexpected key " + key);
			}
		}
		if (root == null) {
			throw new SchemaParseException("invalid schema: missing root");
		}

		Schema schema = new Schema(root, definitions);
		resolve(schema);
		logger.debug("Parsed schema with {} definitions", definitions.size());
		return schema;
	}

	/**
	 * Binds every reference in the schema to its definition. Calling this on a resolved
	 * schema changes nothing.
	 *
	 * @throws SchemaParseException for references to missing definitions, or cycles that
	 *         do not pass through a map or list
	 */
	static void resolve(Schema schema) {
		Resolver resolver = new Resolver(schema.definitions());
		resolver.resolveMatcher(schema.root(), List.of());
		for (Definition definition : schema.definitions().values()) {
			resolver.resolveDefinition(definition, List.of(definition.name()));
		}
	}

	private static void parseDefinitions(ConlEntry entry, Map<String, Definition> definitions) {
		ConlValue value = entry.value();
		if (value.isScalar() || value.isList()) {
			throw invalid(entry, "definitions must be a map");
		}
		for (ConlEntry definition : value.entries()) {
			String name = definition.key().content();
			if (definitions.containsKey(name)) {
				throw invalid(definition, "duplicate definition " + name);
			}
			definitions.put(name, parseDefinition(name, definition));
		}
	}

	private static Definition parseDefinition(String name, ConlEntry entry) {
		ConlValue value = entry.value();
		if (value.isScalar() || value.isList()) {
			throw invalid(entry, name + " must be a map");
		}

		String docs = null;
		Matcher matches = null;
		List<Matcher> oneOf = null;
		List<Definition.KeyRule> keys = null;
		List<Definition.KeyRule> requiredKeys = null;
		Matcher items = null;
		List<Matcher> requiredItems = null;

		for (ConlEntry field : value.entries()) {
			String key = field.key().content();
			switch (key) {
				case DOCS -> docs = scalar(field);
				case MATCHES -> matches = parseMatcher(field);
				case ONE_OF -> oneOf = parseMatcherList(field);
				case KEYS -> keys = parseKeyRules(field);
				case REQUIRED_KEYS -> requiredKeys = parseKeyRules(field);
				case ITEMS -> items = parseMatcher(field);
				case REQUIRED_ITEMS -> requiredItems = parseMatcherList(field);
				default -> throw invalid(field, "unexpected key " + key);
			}
		}

		int shapes = count(matches != null, oneOf != null,
				keys != null || requiredKeys != null,
				items != null || requiredItems != null);
		if (shapes > 1) {
			throw new SchemaParseException("invalid schema: " + name
					+ " must have only one of matches, one of, keys or items");
		}

		Definition.Shape shape;
		if (matches != null) {
			shape = new Definition.Scalar(matches);
		}
		else if (oneOf != null) {
			shape = new Definition.OneOf(oneOf);
		}
		else if (keys != null || requiredKeys != null) {
			shape = new Definition.Keys(orEmpty(keys), orEmpty(requiredKeys));
		}
		else if (items != null || requiredItems != null) {
			shape = new Definition.Items(items, orEmpty(requiredItems));
		}
		else {
			shape = new Definition.Empty();
		}
		return new Definition(name, docs, shape);
	}

	private static Matcher parseMatcher(ConlEntry entry) {
		ConlValue value = entry.value();
		if (value.isScalar()) {
			return parseMatcher(value.scalar(), null);
		}
		if (value.isMap()) {
			String matches = null;
			String docs = null;
			for (ConlEntry field : value.entries()) {
				String key = field.key().content();
				switch (key) {
					case MATCHES -> matches = scalar(field);
					case DOCS -> docs = scalar(field);
					default -> throw invalid(field, "unexpected key " + key);
				}
			}
			if (matches == null) {
				throw invalid(entry, "missing matches");
			}
			return parseMatcher(matches, docs);
		}
		throw invalid(entry, "expected a matcher");
	}

	private static Matcher parseMatcher(String text, String docs) {
		return Matcher.parse(text, docs);
	}

	private static List<Matcher> parseMatcherList(ConlEntry entry) {
		ConlValue value = entry.value();
		if (value.isScalar() || value.isMap()) {
			throw invalid(entry, "expected a list");
		}
		List<Matcher> matchers = new ArrayList<>();
		for (ConlEntry item : value.entries()) {
			matchers.add(parseMatcher(item));
		}
		return matchers;
	}

	private static List<Definition.KeyRule> parseKeyRules(ConlEntry entry) {
		ConlValue value = entry.value();
		if (value.isScalar() || value.isList()) {
			throw invalid(entry, "expected a map");
		}
		List<Definition.KeyRule> rules = new ArrayList<>();
		for (ConlEntry rule : value.entries()) {
			Matcher key = parseMatcher(rule.key().content(), null);
			rules.add(new Definition.KeyRule(key, parseMatcher(rule)));
		}
		return rules;
	}

	private static String scalar(ConlEntry entry) {
		if (!entry.value().isScalar()) {
			throw invalid(entry, "expected a scalar");
		}
		return entry.value().scalar();
	}

	private static <T> List<T> orEmpty(List<T> list) {
		return list != null ? list : List.of();
	}

	private static int count(boolean... present) {
		int count = 0;
		for (boolean b : present) {
			if (b) {
				count++;
			}
		}
		return count;
	}

	private static SchemaParseException invalid(ConlEntry entry, String message) {
		return new SchemaParseException("invalid schema: " + entry.line() + ": " + message);
	}

	/**
	 * Depth-first reference binding. The path holds the definitions being resolved through
	 * scalar and one-of shapes; maps and lists start a new path, so definitions may
	 * contain themselves.
	 */
	private static final class Resolver {

		private final Map<String, Definition> definitions;

		Resolver(Map<String, Definition> definitions) {
			this.definitions = definitions;
		}

		void resolveMatcher(Matcher matcher, List<String> path) {
			if (!matcher.isReference() || matcher.resolved() != null) {
				return;
			}
			String name = matcher.reference();
			Definition definition = definitions.get(name);
			if (definition == null) {
				throw new SchemaParseException("<" + name + "> is not defined");
			}
			if (path.contains(name)) {
				throw new SchemaParseException("<" + name + "> is defined in terms of itself");
			}
			List<String> next = new ArrayList<>(path);
			next.add(name);
			resolveDefinition(definition, next);
			matcher.resolve(definition);
		}

		void resolveDefinition(Definition definition, List<String> path) {
			if (definition.isResolved()) {
				return;
			}
			Definition.Shape shape = definition.shape();
			if (shape instanceof Definition.Keys || shape instanceof Definition.Items) {
				definition.markResolved();
				for (Matcher matcher : definition.matchers()) {
					resolveMatcher(matcher, List.of());
				}
				return;
			}
			for (Matcher matcher : definition.matchers()) {
				resolveMatcher(matcher, path);
			}
			definition.markResolved();
			logger.debug("Resolved definition {}", definition.name());
		}
	}
}
