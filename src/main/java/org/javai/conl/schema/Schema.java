package org.javai.conl.schema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.conl.ConlDocument;
import org.javai.conl.ConlEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A parsed and resolved schema: a root matcher and the definitions it refers to.
 *
 * Schemas are immutable once parsed and can validate any number of documents.
 *
 * Example usage:
 *
 * <pre>
 * Schema schema = Schema.parse(schemaText);
 * ValidationResult result = schema.validate(documentBytes);
 * result.errors().forEach(error -&gt; System.err.println(error));
 * </pre>
 */
public final class Schema {

	private static final Logger logger = LoggerFactory.getLogger(Schema.class);

	static final String META_SCHEMA_RESOURCE = "META-INF/conl/schema.schema.conl";
	static final String ANY_SCHEMA_RESOURCE = "META-INF/conl/any.schema.conl";

	/**
	 * The root key a document uses to name its schema.
	 */
	public static final String SCHEMA_KEY = "schema";

	private final Matcher root;
	private final Map<String, Definition> definitions;

	Schema(Matcher root, Map<String, Definition> definitions) {
		this.root = root;
		this.definitions = Collections.unmodifiableMap(definitions);
	}

	/**
	 * Parses a schema, first checking it against the meta-schema.
	 *
	 * @throws SchemaParseException if the text is not a valid schema
	 */
	public static Schema parse(byte[] input) {
		return parse(input, true);
	}

	public static Schema parse(String input) {
		Objects.requireNonNull(input, "input must not be null");
		return parse(input.getBytes(StandardCharsets.UTF_8));
	}

	static Schema parse(byte[] input, boolean checkAgainstMeta) {
		Objects.requireNonNull(input, "input must not be null");
		ConlDocument document = ConlDocument.parse(input);
		if (checkAgainstMeta) {
			ValidationResult result = meta().validate(document);
			if (!result.valid()) {
				throw new SchemaParseException("invalid schema: " + result.errors().get(0), result.errors());
			}
		}
		return SchemaParser.parse(document);
	}

	/**
	 * The schema that accepts every document.
	 */
	public static Schema any() {
		return AnyHolder.INSTANCE;
	}

	/**
	 * The schema that schema documents are checked against.
	 */
	public static Schema meta() {
		return MetaHolder.INSTANCE;
	}

	public Matcher root() {
		return root;
	}

	public Map<String, Definition> definitions() {
		return definitions;
	}

	public Optional<Definition> definition(String name) {
		return Optional.ofNullable(definitions.get(name));
	}

	/**
	 * Validates a document. Malformed documents do not throw; their problems are reported
	 * in the result.
	 */
	public ValidationResult validate(byte[] input) {
		Objects.requireNonNull(input, "input must not be null");
		return validate(ConlDocument.parse(input));
	}

	public ValidationResult validate(String input) {
		Objects.requireNonNull(input, "input must not be null");
		return validate(ConlDocument.parse(input));
	}

	public ValidationResult validate(ConlDocument document) {
		Objects.requireNonNull(document, "document must not be null");
		return SchemaValidator.validate(this, document);
	}

	/**
	 * Validates a document against the schema it names with a root {@code schema} key.
	 *
	 * The {@code schema} entry itself is not validated. The loader is asked for the named
	 * schema, or for {@code null} when the document names none; when there is no loader or
	 * it returns null, the document is checked against {@link #any()}. A loader failure is
	 * reported as an error on the {@code schema} line, alongside the document's own errors.
	 * Empty documents are valid without consulting the loader.
	 */
	public static ValidationResult validate(byte[] input, SchemaLoader loader) {
		Objects.requireNonNull(input, "input must not be null");
		ConlDocument document = ConlDocument.parse(input);
		if (document.root().isEmpty() && !document.hasErrors()) {
			return any().validate(document);
		}

		ConlEntry schemaEntry = null;
		if (document.root().isMap()) {
			for (ConlEntry entry : document.root().entries()) {
				if (SCHEMA_KEY.equals(entry.key().content()) && entry.value().isScalar()) {
					schemaEntry = entry;
					break;
				}
			}
		}
		String name = schemaEntry != null ? schemaEntry.value().scalar() : null;
		ConlDocument content = schemaEntry != null ? document.without(schemaEntry) : document;

		Schema schema = null;
		List<ValidationError> loadErrors = new ArrayList<>();
		if (loader != null) {
			try {
				schema = loader.load(name);
			}
			catch (Exception e) {
				logger.debug("Failed to load schema {}", name, e);
				Position position = schemaEntry != null ? Position.value(schemaEntry.valueLine()) : Position.ROOT;
				String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
				loadErrors.add(new ValidationError.SchemaUnavailable(position, reason));
			}
		}
		if (schema == null) {
			schema = any();
		}
		return SchemaValidator.validate(schema, content, loadErrors);
	}

	public static ValidationResult validate(String input, SchemaLoader loader) {
		Objects.requireNonNull(input, "input must not be null");
		return validate(input.getBytes(StandardCharsets.UTF_8), loader);
	}

	/**
	 * Loads a bundled schema from the classpath.
	 */
	static Schema loadResource(String resource, boolean checkAgainstMeta) {
		try (InputStream is = Schema.class.getClassLoader().getResourceAsStream(resource)) {
			if (is == null) {
				throw new SchemaParseException("Schema resource not found: " + resource);
			}
			Schema schema = parse(is.readAllBytes(), checkAgainstMeta);
			logger.debug("Loaded schema resource {}", resource);
			return schema;
		}
		catch (IOException e) {
			throw new SchemaParseException("Failed to read schema resource: " + resource, e);
		}
	}

	@Override
	public String toString() {
		return "Schema[root=" + root + ", definitions=" + definitions.keySet() + "]";
	}

	private static final class MetaHolder {
		static final Schema INSTANCE = loadResource(META_SCHEMA_RESOURCE, false);
	}

	private static final class AnyHolder {
		static final Schema INSTANCE = loadResource(ANY_SCHEMA_RESOURCE, true);
	}
}
