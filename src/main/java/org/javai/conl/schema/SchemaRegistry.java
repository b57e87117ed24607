package org.javai.conl.schema;

import java.io.InputStream;
import java.net.JarURLConnection;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of named schemas.
 *
 * Applications register their schemas once and documents then select one by name with a
 * root {@code schema} key. Schemas found on the classpath as
 * {@code META-INF/conl/<name>.schema.conl} are registered under {@code <name>}.
 * Registrations are idempotent per name: the first schema registered for a name wins.
 */
public final class SchemaRegistry implements SchemaLoader {

	private static final Logger logger = LoggerFactory.getLogger(SchemaRegistry.class);

	static final String SCHEMA_DIRECTORY = "META-INF/conl/";
	static final String SCHEMA_SUFFIX = ".schema.conl";

	private final Map<String, Schema> schemas = new LinkedHashMap<>();

	private SchemaRegistry() {
	}

	/**
	 * Create an empty registry.
	 */
	public static SchemaRegistry create() {
		return new SchemaRegistry();
	}

	/**
	 * Register a schema under a name. If a schema with the same name is already present, the
	 * existing one is kept and returned.
	 */
	public Schema register(String name, Schema schema) {
		Objects.requireNonNull(schema, "schema must not be null");
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Schema name must not be blank");
		}
		Schema existing = schemas.get(name);
		if (existing != null) {
			logger.debug("Schema '{}' already registered; skipping", name);
			return existing;
		}
		schemas.put(name, schema);
		return schema;
	}

	/**
	 * Load a schema from a classpath resource using this class' loader.
	 */
	public Schema registerResource(String name, String resourcePath) {
		return registerResource(name, resourcePath, SchemaRegistry.class.getClassLoader());
	}

	/**
	 * Load and register a schema from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws IllegalStateException if parsing fails
	 */
	public Schema registerResource(String name, String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return register(name, Schema.parse(is.readAllBytes()));
		}
		catch (IllegalArgumentException e) {
			throw e;
		}
		catch (Exception e) {
			throw new IllegalStateException("Failed to load schema from resource: " + resourcePath, e);
		}
	}

	/**
	 * Load and register a schema from a file, named after the file without its
	 * {@code .schema.conl} suffix.
	 *
	 * @throws IllegalStateException if reading or parsing fails
	 */
	public Schema registerPath(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try {
			return register(schemaName(path.getFileName().toString()), Schema.parse(Files.readAllBytes(path)));
		}
		catch (Exception e) {
			throw new IllegalStateException("Failed to load schema from path: " + path, e);
		}
	}

	/**
	 * Discover and register schemas found under {@code META-INF/conl/} on the classpath.
	 * <p>
	 * This scans both exploded directories and JARs. Schemas that fail to load are logged
	 * and skipped.
	 */
	public SchemaRegistry registerMetaInfSchemas(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		try {
			Enumeration<URL> resources = loader.getResources(SCHEMA_DIRECTORY);
			while (resources.hasMoreElements()) {
				URL url = resources.nextElement();
				if ("file".equalsIgnoreCase(url.getProtocol())) {
					loadFromDirectory(url);
				}
				else if ("jar".equalsIgnoreCase(url.getProtocol())) {
					loadFromJar(url);
				}
			}
		}
		catch (Exception e) {
			throw new IllegalStateException("Failed to scan " + SCHEMA_DIRECTORY + " for schemas", e);
		}
		return this;
	}

	/**
	 * Retrieve a schema by name.
	 */
	public Optional<Schema> schemaFor(String name) {
		return Optional.ofNullable(schemas.get(name));
	}

	/**
	 * Retrieve a schema by name or throw if not present.
	 */
	public Schema requireSchema(String name) {
		return schemaFor(name).orElseThrow(() -> new IllegalStateException("No schema registered with name: " + name));
	}

	/**
	 * Names of all registered schemas in insertion order.
	 */
	public List<String> names() {
		return List.copyOf(schemas.keySet());
	}

	/**
	 * Documents without a {@code schema} key are validated against {@link Schema#any()};
	 * unknown names fail.
	 */
	@Override
	public Schema load(String name) {
		return name == null ? null : requireSchema(name);
	}

	static String schemaName(String fileName) {
		return fileName.endsWith(SCHEMA_SUFFIX)
				? fileName.substring(0, fileName.length() - SCHEMA_SUFFIX.length())
				: fileName;
	}

	private void loadFromDirectory(URL url) {
		try {
			Path path = Paths.get(url.toURI());
			if (!Files.isDirectory(path)) {
				return;
			}
			try (Stream<Path> files = Files.list(path)) {
				files.filter(Files::isRegularFile)
						.filter(p -> p.getFileName().toString().endsWith(SCHEMA_SUFFIX))
						.sorted()
						.forEach(p -> {
							try {
								register(schemaName(p.getFileName().toString()), Schema.parse(Files.readAllBytes(p)));
							}
							catch (Exception ex) {
								logger.warn("Failed to load schema from {}", p, ex);
							}
						});
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan directory {}", url, e);
		}
	}

	private void loadFromJar(URL url) {
		try {
			JarURLConnection conn = (JarURLConnection) url.openConnection();
			conn.setUseCaches(false);
			try (JarFile jar = conn.getJarFile()) {
				Enumeration<JarEntry> entries = jar.entries();
				while (entries.hasMoreElements()) {
					JarEntry entry = entries.nextElement();
					if (entry.isDirectory()) {
						continue;
					}
					String name = entry.getName();
					if (!name.startsWith(SCHEMA_DIRECTORY) || !name.endsWith(SCHEMA_SUFFIX)) {
						continue;
					}
					try (InputStream is = jar.getInputStream(entry)) {
						register(schemaName(name.substring(SCHEMA_DIRECTORY.length())), Schema.parse(is.readAllBytes()));
					}
					catch (Exception ex) {
						logger.warn("Failed to load schema from JAR entry {}", name, ex);
					}
				}
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan JAR {}", url, e);
		}
	}
}
