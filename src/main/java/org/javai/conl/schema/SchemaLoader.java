package org.javai.conl.schema;

/**
 * Finds the schema a document asks for by name.
 */
@FunctionalInterface
public interface SchemaLoader {

	/**
	 * Loads the named schema.
	 *
	 * @param name the value of the document's {@code schema} key, or null if it has none
	 * @return the schema, or null to validate against {@link Schema#any()}
	 * @throws Exception if the schema cannot be loaded; the failure is reported as a
	 *         validation error
	 */
	Schema load(String name) throws Exception;
}
