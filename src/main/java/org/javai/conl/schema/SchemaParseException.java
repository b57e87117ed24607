package org.javai.conl.schema;

import java.util.List;

/**
 * Exception thrown when a schema cannot be loaded: the text is malformed, does not
 * describe a schema, or refers to definitions that are missing or circular.
 */
public class SchemaParseException extends RuntimeException {

	private final List<ValidationError> errors;

	public SchemaParseException(String message) {
		super(message);
		this.errors = List.of();
	}

	public SchemaParseException(String message, Throwable cause) {
		super(message, cause);
		this.errors = List.of();
	}

	public SchemaParseException(String message, List<ValidationError> errors) {
		super(message);
		this.errors = List.copyOf(errors);
	}

	/**
	 * The problems found when checking the schema text against the meta-schema, if that is
	 * where loading failed.
	 */
	public List<ValidationError> errors() {
		return errors;
	}
}
