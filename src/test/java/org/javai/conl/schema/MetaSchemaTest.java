package org.javai.conl.schema;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import org.junit.jupiter.api.Test;

class MetaSchemaTest {

	private static byte[] resource(String name) throws IOException {
		try (InputStream is = MetaSchemaTest.class.getClassLoader().getResourceAsStream(name)) {
			assertThat(is).as(name).isNotNull();
			return is.readAllBytes();
		}
	}

	@Test
	void bundledSchemasValidateEachOther() throws IOException {
		byte[] meta = resource(Schema.META_SCHEMA_RESOURCE);
		byte[] any = resource(Schema.ANY_SCHEMA_RESOURCE);

		assertThat(Schema.meta().validate(meta).errors()).isEmpty();
		assertThat(Schema.meta().validate(any).errors()).isEmpty();
		assertThat(Schema.any().validate(meta).errors()).isEmpty();
		assertThat(Schema.any().validate(any).errors()).isEmpty();
	}

	@Test
	void metaSchemaParsesAsAnOrdinarySchema() throws IOException {
		Schema reparsed = Schema.parse(resource(Schema.META_SCHEMA_RESOURCE));

		assertThat(reparsed.definitions().keySet()).isEqualTo(Schema.meta().definitions().keySet());
	}

	@Test
	void bundledSchemasAreShared() {
		assertThat(Schema.any()).isSameAs(Schema.any());
		assertThat(Schema.meta()).isSameAs(Schema.meta());
	}

	@Test
	void anyAcceptsEveryShape() {
		ValidationResult result = Schema.any().validate("""
				name = value
				empty
				list
				  = a
				  =
				    nested = map
				text = \"""
				  multi
				  line
				""");

		assertThat(result.valid()).isTrue();
	}

	@Test
	void metaSchemaSuggestsDefinitionKeys() {
		ValidationResult result = Schema.meta().validate("definitions\n  a\n    ");

		assertThat(result.suggestedKeys(0)).extracting(Suggestion::value).containsExactly("root");
		assertThat(result.suggestedKeys(2)).extracting(Suggestion::value)
				.containsExactly("docs", "items", "keys", "matches", "one of", "required items", "required keys");
	}
}
