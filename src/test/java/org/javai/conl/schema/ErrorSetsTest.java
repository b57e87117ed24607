package org.javai.conl.schema;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ErrorSetsTest {

	private static ValidationError expected(int line, String... candidates) {
		return new ValidationError.ExpectedMatch(Position.value(line), List.of(candidates));
	}

	@Test
	void laterFirstErrorWins() {
		List<ValidationError> early = List.of(expected(1, "a"), expected(5, "b"), expected(6, "c"));
		List<ValidationError> late = List.of(expected(3, "d"));

		assertThat(ErrorSets.merge(early, late)).isSameAs(late);
		assertThat(ErrorSets.merge(late, early)).isSameAs(late);
	}

	@Test
	void moreErrorsWinOnSameLine() {
		List<ValidationError> one = List.of(expected(2, "a"));
		List<ValidationError> two = List.of(expected(2, "b"), new ValidationError.Unexpected(Position.key(4), "key c"));

		assertThat(ErrorSets.merge(one, two)).isSameAs(two);
	}

	@Test
	void tiesAreCombined() {
		List<ValidationError> merged = ErrorSets.merge(
				ErrorSets.merge(List.of(expected(2, "b")), List.of(expected(2, "a"))),
				List.of(expected(2, "c")));

		assertThat(merged).containsExactly(expected(2, "a", "b", "c"));
	}

	@Test
	void emptySetIsIgnored() {
		List<ValidationError> errors = List.of(expected(1, "a"));

		assertThat(ErrorSets.merge(List.of(), errors)).isSameAs(errors);
	}

	@Test
	void renderKeepsHighestPriorityPerPosition() {
		List<ValidationError> rendered = ErrorSets.render(List.of(
				expected(1, "x"),
				new ValidationError.MissingRequiredKey(Position.value(1), List.of("b")),
				new ValidationError.MissingRequiredKey(Position.value(1), List.of("a")),
				new ValidationError.DecodeError(Position.key(2), "invalid UTF-8"),
				new ValidationError.Unexpected(Position.key(2), "key k"),
				expected(2, "y")));

		assertThat(rendered).extracting(ValidationError::toString).containsExactly(
				"1: missing required key a or b",
				"2: invalid UTF-8",
				"2: expected y");
	}
}
