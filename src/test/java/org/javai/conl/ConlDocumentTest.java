package org.javai.conl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConlDocumentTest {

	private static final String SERVICE = """
			name = api
			server
			  port = 8080
			hosts
			  = alpha
			  = beta
			debug
			""";

	@Test
	void buildMapsListsAndScalars() {
		ConlDocument document = ConlDocument.parse(SERVICE);

		List<ConlEntry> entries = document.root().entries();
		assertThat(entries).extracting(e -> e.key().content()).containsExactly("name", "server", "hosts", "debug");
		assertThat(entries.get(0).value().scalar()).isEqualTo("api");
		assertThat(entries.get(1).value().isMap()).isTrue();
		assertThat(entries.get(1).value().entries().get(0).value().scalar()).isEqualTo("8080");
		assertThat(entries.get(2).value().isList()).isTrue();
		assertThat(entries.get(2).value().entries()).extracting(e -> e.value().scalar()).containsExactly("alpha", "beta");
		assertThat(entries.get(3).value().isEmpty()).isTrue();
		assertThat(document.hasErrors()).isFalse();
	}

	@Test
	void valueHoldsOnlyOneShape() {
		ConlValue map = ConlDocument.parse(SERVICE).root();

		assertThat(map.isMap()).isTrue();
		assertThat(map.isList()).isFalse();
		assertThat(map.isScalar()).isFalse();
		assertThat(map.scalar()).isNull();
	}

	@Test
	void entriesRecordTheirParentLine() {
		ConlDocument document = ConlDocument.parse(SERVICE);

		assertThat(document.entryAt(1)).get().extracting(ConlEntry::parentLine).isEqualTo(0);
		assertThat(document.entryAt(3)).get().extracting(ConlEntry::parentLine).isEqualTo(2);
		assertThat(document.entryAt(6)).get().satisfies(entry -> {
			assertThat(entry.isListItem()).isTrue();
			assertThat(entry.parentLine()).isEqualTo(4);
		});
		assertThat(document.entryAt(8)).isEmpty();
	}

	@Test
	void multilineValueStartsOnItsFirstLine() {
		ConlDocument document = ConlDocument.parse("text = \"\"\"\n  one\n  two");

		ConlEntry entry = document.entryAt(1).orElseThrow();
		assertThat(entry.value().scalar()).isEqualTo("one\ntwo");
		assertThat(entry.valueLine()).isEqualTo(2);
	}

	@Test
	void collectErrorTokens() {
		ConlDocument document = ConlDocument.parse("a = \"x\nb = 1\n= 2");

		assertThat(document.errors()).extracting(Token::line, Token::error).containsExactly(
				tuple(1, "unclosed quotes"),
				tuple(3, "unexpected list item"));
		assertThat(document.root().entries()).hasSize(3);
	}

	@Test
	void topLevelListIsTheRoot() {
		ConlDocument document = ConlDocument.parse("= a\n= b");

		assertThat(document.root().isList()).isTrue();
		assertThat(document.root().entries()).hasSize(2);
	}

	@Test
	void emptyDocumentHasEmptyRoot() {
		ConlDocument document = ConlDocument.parse("; nothing here\n");

		assertThat(document.root().isEmpty()).isTrue();
		assertThat(document.root().entries()).isEmpty();
	}

	@Test
	void withoutRemovesOneRootEntry() {
		ConlDocument document = ConlDocument.parse("schema = x\na = 1");
		ConlEntry schema = document.entryAt(1).orElseThrow();

		ConlDocument rest = document.without(schema);

		assertThat(rest.root().entries()).extracting(e -> e.key().content()).containsExactly("a");
		assertThat(document.root().entries()).hasSize(2);
		assertThat(rest.entryAt(2)).isPresent();
	}

	@Test
	void lineLookupFindsTheWrittenEntryAfterUnexpectedIndent() {
		ConlDocument document = ConlDocument.parse("a = 1\n    b = 2");

		assertThat(document.errors()).extracting(Token::error).containsExactly("unexpected indent");
		assertThat(document.entryAt(2)).get().satisfies(entry -> {
			assertThat(entry.key().content()).isEqualTo("b");
			assertThat(entry.key().hasError()).isFalse();
			assertThat(entry.value().scalar()).isEqualTo("2");
		});
	}

	@Test
	void entriesWithoutValuesCannotBeFilled() {
		ConlDocument document = ConlDocument.parse("a\nb = 1");
		ConlEntry empty = document.entryAt(1).orElseThrow();
		ConlEntry scalar = document.entryAt(2).orElseThrow();

		assertThatThrownBy(() -> empty.value().add(scalar)).isInstanceOf(UnsupportedOperationException.class);
		assertThatThrownBy(() -> scalar.value().add(empty)).isInstanceOf(UnsupportedOperationException.class);
		assertThat(empty.value().isEmpty()).isTrue();
		assertThat(ConlDocument.parse("c").root().entries().get(0).value().isEmpty()).isTrue();
	}
}
