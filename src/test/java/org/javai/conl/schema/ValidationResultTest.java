package org.javai.conl.schema;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationResultTest {

	private static List<String> values(List<Suggestion> suggestions) {
		return suggestions.stream().map(Suggestion::value).toList();
	}

	@Test
	void suggestKeysAtTheRoot() {
		Schema schema = Schema.parse("""
				root = <root>
				definitions
				  root
				    keys
				      b = .*
				      a = .*
				""");

		assertThat(values(schema.validate("").suggestedKeys(0))).containsExactly("a", "b");
		assertThat(values(schema.validate("a = 1\n").suggestedKeys(0))).containsExactly("b");
	}

	@Test
	void suggestKeysOfNestedMap() {
		Schema schema = Schema.parse("""
				root = <root>
				definitions
				  root
				    keys
				      a = <nested>
				  nested
				    keys
				      b = .*
				      c = .*
				""");

		assertThat(values(schema.validate("a\n  ").suggestedKeys(1))).containsExactly("b", "c");
		assertThat(values(schema.validate("a\n  c = 1").suggestedKeys(1))).containsExactly("b");
	}

	@Test
	void suggestKeysOfEveryAlternative() {
		Schema schema = Schema.parse("""
				root = <root>
				definitions
				  root
				    keys
				      a = <nested>
				  nested
				    one of
				      = <b map>
				      = <c map>
				  b map
				    required keys
				      b = .*
				  c map
				    required keys
				      c = .*
				""");

		assertThat(values(schema.validate("a\n  ").suggestedKeys(1))).containsExactly("b", "c");
	}

	@Test
	void suggestRequiredAndOptionalKeys() {
		Schema schema = Schema.parse("""
				root = <root>
				definitions
				  root
				    keys
				      a = <nested>
				  nested
				    keys
				      b = <wow>
				  wow
				    required keys
				      d = .*
				    keys
				      e = .*
				""");

		assertThat(values(schema.validate("a\n  b\n").suggestedKeys(2))).containsExactly("d", "e");
	}

	@Test
	void suggestKeysOfLiteralAlternation() {
		Schema schema = Schema.parse("""
				root = <root>
				definitions
				  root
				    keys
				      (?:north|south) = .*
				      [a-z]+ = .*
				""");

		assertThat(values(schema.validate("").suggestedKeys(0))).containsExactly("north", "south");
	}

	@Test
	void keySuggestionsCarryValueDocs() {
		Schema schema = Schema.parse("""
				root = <root>
				definitions
				  root
				    keys
				      a
				        matches = hello
				        docs = Hello!
				""");

		assertThat(schema.validate("").suggestedKeys(0))
				.containsExactly(new Suggestion("a", "Hello!", Suggestion.Kind.LITERAL));
	}

	@Test
	void suggestValuesWithDocs() {
		Schema schema = Schema.parse("""
				root = <root>
				definitions
				  root
				    keys
				      a = <test>
				  test
				    one of
				      =
				        matches = a
				        docs = Hello!
				""");

		assertThat(schema.validate("a = ").suggestedValues(1))
				.containsExactly(new Suggestion("a", "Hello!", Suggestion.Kind.LITERAL));
	}

	@Test
	void suggestValuesEvenWhenInvalid() {
		Schema schema = Schema.parse("""
				root = <root>
				definitions
				  root
				    keys
				      color = red|green|blue
				      size = [0-9]+
				""");
		ValidationResult result = schema.validate("color = purple\nsize = 3");

		assertThat(result.valid()).isFalse();
		assertThat(values(result.suggestedValues(1))).containsExactly("blue", "green", "red");
		assertThat(result.suggestedValues(2)).isEmpty();
		assertThat(result.suggestedValues(9)).isEmpty();
	}

	@Test
	void signalThatListsAndMapsAreAccepted() {
		Schema schema = Schema.parse("""
				root = <root>
				definitions
				  root
				    keys
				      x = <value>
				  value
				    one of
				      = none
				      = <list>
				      = <map>
				  list
				    items = .*
				  map
				    keys
				      k = .*
				""");

		assertThat(schema.validate("x = ").suggestedValues(1)).containsExactly(
				new Suggestion("none", null, Suggestion.Kind.LITERAL),
				new Suggestion("=", "list", Suggestion.Kind.LIST),
				new Suggestion("", "map", Suggestion.Kind.MAP));
	}

	@Test
	void lookUpKeyAndValueDocs() {
		Schema schema = Schema.parse("""
				root = <user>
				definitions
				  user
				    required keys
				      username = <username>
				    keys
				      role = <role>
				  username
				    docs = Login name
				    matches = \\w+
				  role
				    one of
				      = admin
				      =
				        matches = guest
				        docs = Read only access
				""");
		ValidationResult result = schema.validate("username = bob\nrole = guest");

		assertThat(result.keyDocs(1)).contains("Login name");
		assertThat(result.keyDocs(2)).isEmpty();
		assertThat(result.valueDocs(1)).contains("Login name");
		assertThat(result.valueDocs(2)).contains("Read only access");
		assertThat(result.valueDocs(3)).isEmpty();
	}

	@Test
	void resultExposesWhatWasValidated() {
		Schema schema = Schema.any();
		ValidationResult result = schema.validate("a = 1");

		assertThat(result.valid()).isTrue();
		assertThat(result.schema()).isSameAs(schema);
		assertThat(result.document().entryAt(1)).isPresent();
		assertThat(result).hasToString("valid");
	}
}
