package org.javai.conl.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the errors of competing validation attempts and reduces the final set to one
 * error per position.
 */
final class ErrorSets {

	private ErrorSets() {
		// Utility class - no instantiation
	}

	/**
	 * Picks between the errors of two failed alternatives. The alternative whose first error
	 * is on a later line got further and wins; otherwise the one with more errors wins; when
	 * both agree the errors are combined per position.
	 */
	static List<ValidationError> merge(List<ValidationError> a, List<ValidationError> b) {
		if (a.isEmpty() || b.isEmpty()) {
			return a.isEmpty() ? b : a;
		}
		int firstA = firstLine(a);
		int firstB = firstLine(b);
		if (firstA != firstB) {
			return firstA > firstB ? a : b;
		}
		if (a.size() != b.size()) {
			return a.size() > b.size() ? a : b;
		}
		List<ValidationError> union = new ArrayList<>(a);
		union.addAll(b);
		return collapse(union);
	}

	/**
	 * Folds errors of the same kind at the same position into one, combining their
	 * candidate lists.
	 */
	static List<ValidationError> collapse(List<ValidationError> errors) {
		Map<Position, Map<Class<?>, ValidationError>> byPosition = new LinkedHashMap<>();
		for (ValidationError error : errors) {
			byPosition.computeIfAbsent(error.position(), p -> new LinkedHashMap<>())
					.merge(error.getClass(), error, ErrorSets::combine);
		}
		List<ValidationError> collapsed = new ArrayList<>();
		byPosition.values().forEach(kinds -> collapsed.addAll(kinds.values()));
		return collapsed;
	}

	/**
	 * Keeps the highest priority kind of error at each position and sorts the result.
	 */
	static List<ValidationError> render(List<ValidationError> errors) {
		Map<Position, ValidationError> best = new LinkedHashMap<>();
		for (ValidationError error : collapse(errors)) {
			best.merge(error.position(), error,
					(existing, candidate) -> candidate.priority() > existing.priority() ? candidate : existing);
		}
		List<ValidationError> rendered = new ArrayList<>(best.values());
		rendered.sort(ValidationError.ORDER);
		return Collections.unmodifiableList(rendered);
	}

	private static ValidationError combine(ValidationError first, ValidationError second) {
		if (first instanceof ValidationError.ExpectedMatch a && second instanceof ValidationError.ExpectedMatch b) {
			return new ValidationError.ExpectedMatch(a.position(), concat(a.candidates(), b.candidates()));
		}
		if (first instanceof ValidationError.MissingRequiredKey a && second instanceof ValidationError.MissingRequiredKey b) {
			return new ValidationError.MissingRequiredKey(a.position(), concat(a.keys(), b.keys()));
		}
		return first;
	}

	private static List<String> concat(List<String> a, List<String> b) {
		List<String> all = new ArrayList<>(a);
		all.addAll(b);
		return all;
	}

	private static int firstLine(List<ValidationError> errors) {
		int first = Integer.MAX_VALUE;
		for (ValidationError error : errors) {
			first = Math.min(first, error.line());
		}
		return first;
	}
}
