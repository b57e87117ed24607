package org.javai.conl.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.Level;
import org.javai.conl.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaRegistryTest {

	@Test
	void discoverSchemasOnTheClasspath() {
		SchemaRegistry registry;
		try (LogCaptorAppender captor = LogCaptorAppender.capture(SchemaRegistry.class, Level.WARN)) {
			registry = SchemaRegistry.create().registerMetaInfSchemas(getClass().getClassLoader());

			assertThat(captor.messagesAt(Level.WARN))
					.anyMatch(message -> message.startsWith("Failed to load schema from") && message.contains("broken"));
		}

		assertThat(registry.names()).contains("user", "any", "schema").doesNotContain("broken");
		assertThat(registry.requireSchema("user").validate("username = bob").valid()).isTrue();
	}

	@Test
	void firstRegistrationWins() {
		SchemaRegistry registry = SchemaRegistry.create();
		Schema first = Schema.parse("root = a");
		Schema second = Schema.parse("root = b");

		assertThat(registry.register("letters", first)).isSameAs(first);
		assertThat(registry.register("letters", second)).isSameAs(first);
		assertThat(registry.names()).containsExactly("letters");
	}

	@Test
	void registerFromResource() {
		SchemaRegistry registry = SchemaRegistry.create();

		Schema schema = registry.registerResource("account", "META-INF/conl/user.schema.conl");

		assertThat(registry.schemaFor("account")).containsSame(schema);
		assertThatThrownBy(() -> registry.registerResource("missing", "META-INF/conl/missing.schema.conl"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Resource not found");
		assertThatThrownBy(() -> registry.registerResource("broken", "META-INF/conl/broken.schema.conl"))
				.isInstanceOf(IllegalStateException.class)
				.hasRootCauseInstanceOf(SchemaParseException.class);
	}

	@Test
	void registerFromPathUsesFileName(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("settings.schema.conl");
		Files.writeString(file, "root = <settings>\ndefinitions\n  settings\n    keys\n      debug = true|false\n",
				StandardCharsets.UTF_8);
		SchemaRegistry registry = SchemaRegistry.create();

		registry.registerPath(file);

		assertThat(registry.names()).containsExactly("settings");
		assertThat(registry.load("settings").validate("debug = maybe").errors())
				.extracting(ValidationError::toString)
				.containsExactly("1: expected false or true");
	}

	@Test
	void registerFromBrokenPathFails(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("bad.schema.conl");
		Files.writeString(file, "root = <nowhere>", StandardCharsets.UTF_8);

		assertThatThrownBy(() -> SchemaRegistry.create().registerPath(file))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("bad.schema.conl");
	}

	@Test
	void loadByName() {
		SchemaRegistry registry = SchemaRegistry.create();
		registry.register("any", Schema.any());

		assertThat(registry.load(null)).isNull();
		assertThat(registry.load("any")).isSameAs(Schema.any());
		assertThatThrownBy(() -> registry.load("other"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessage("No schema registered with name: other");
	}

	@Test
	void rejectBlankNames() {
		assertThatThrownBy(() -> SchemaRegistry.create().register(" ", Schema.any()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void schemaNameDropsSuffix() {
		assertThat(SchemaRegistry.schemaName("user.schema.conl")).isEqualTo("user");
		assertThat(SchemaRegistry.schemaName("plain.conl")).isEqualTo("plain.conl");
	}
}
