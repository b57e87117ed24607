package org.javai.conl.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.conl.ConlDocument;
import org.javai.conl.ConlEntry;
import org.javai.conl.ConlValue;
import org.javai.conl.Token;

/**
 * Checks a document tree against a schema.
 *
 * Every matcher tried is recorded against the position of the value it was tried on,
 * whether or not it matched, so that suggestions can be offered for invalid documents too.
 * A validator is used for a single document.
 */
final class SchemaValidator {

	private static final String ANY_SCALAR = "any scalar";

	private final Map<Position, List<Attempt>> attempts = new LinkedHashMap<>();

	static ValidationResult validate(Schema schema, ConlDocument document) {
		return validate(schema, document, List.of());
	}

	/**
	 * Validates the document, adding the given errors to those found.
	 */
	static ValidationResult validate(Schema schema, ConlDocument document, List<ValidationError> extra) {
		SchemaValidator validator = new SchemaValidator();
		List<ValidationError> errors = new ArrayList<>(extra);
		for (Token token : document.errors()) {
			Position position = token.isEntry() ? Position.key(token.line()) : Position.value(token.line());
			errors.add(new ValidationError.DecodeError(position, token.error()));
		}
		errors.addAll(validator.validateMatcher(schema.root(), document.root(), Position.ROOT));
		return new ValidationResult(ErrorSets.render(errors), document, validator.attempts, schema);
	}

	List<ValidationError> validateMatcher(Matcher matcher, ConlValue value, Position position) {
		List<ValidationError> errors;
		Token scalar = value.scalarToken();
		if (scalar != null && scalar.hasError()) {
			errors = List.of(new ValidationError.DecodeError(position, scalar.error()));
		}
		else if (matcher.isReference()) {
			errors = validateDefinition(matcher.resolved(), value, position);
		}
		else if (value.isMap() || value.isList()) {
			errors = expected(position, ANY_SCALAR);
		}
		else if (value.isEmpty() || !matcher.matches(value.scalar())) {
			errors = List.of(new ValidationError.ExpectedMatch(position, matcher.candidates()));
		}
		else {
			errors = List.of();
		}
		attempts.computeIfAbsent(position, p -> new ArrayList<>()).add(new Attempt(matcher, value, errors.isEmpty()));
		return errors;
	}

	private List<ValidationError> validateDefinition(Definition definition, ConlValue value, Position position) {
		Definition.Shape shape = definition.shape();
		if (shape instanceof Definition.Scalar scalar) {
			if (value.isMap() || value.isList()) {
				return expected(position, ANY_SCALAR);
			}
			return validateMatcher(scalar.matcher(), value, position);
		}
		if (shape instanceof Definition.OneOf oneOf) {
			return validateOneOf(oneOf, value, position);
		}
		if (shape instanceof Definition.Keys keys) {
			return validateKeys(keys, value, position);
		}
		if (shape instanceof Definition.Items items) {
			return validateItems(items, value, position);
		}
		return value.isEmpty() ? List.of() : expected(position, "no value");
	}

	private List<ValidationError> validateOneOf(Definition.OneOf oneOf, ConlValue value, Position position) {
		if (oneOf.alternatives().isEmpty()) {
			return expected(position, "nothing");
		}
		boolean matched = false;
		List<ValidationError> combined = List.of();
		for (Matcher alternative : oneOf.alternatives()) {
			List<ValidationError> errors = validateMatcher(alternative, value, position);
			if (errors.isEmpty()) {
				matched = true;
			}
			else if (!matched) {
				combined = ErrorSets.merge(combined, errors);
			}
		}
		return matched ? List.of() : combined;
	}

	private List<ValidationError> validateKeys(Definition.Keys keys, ConlValue value, Position position) {
		if (value.isScalar() || value.isList()) {
			return expected(position, "a map");
		}
		List<ValidationError> errors = new ArrayList<>();
		List<Definition.KeyRule> required = keys.required();
		boolean[] seenRequired = new boolean[required.size()];
		Set<String> seenKeys = new HashSet<>();

		for (ConlEntry entry : value.entries()) {
			Token key = entry.key();
			Position keyPosition = Position.key(entry.line());
			if (key.hasError()) {
				errors.add(new ValidationError.DecodeError(keyPosition, key.error()));
				continue;
			}
			String name = key.content();
			if (!seenKeys.add(name)) {
				errors.add(new ValidationError.DuplicateKey(keyPosition, name));
				continue;
			}
			Position valuePosition = Position.value(entry.valueLine());
			int match = firstMatch(required, name);
			if (match >= 0) {
				if (seenRequired[match]) {
					errors.add(new ValidationError.DuplicateKey(keyPosition, required.get(match).key().description()));
				}
				else {
					seenRequired[match] = true;
					errors.addAll(validateMatcher(required.get(match).value(), entry.value(), valuePosition));
				}
				continue;
			}
			match = firstMatch(keys.optional(), name);
			if (match >= 0) {
				errors.addAll(validateMatcher(keys.optional().get(match).value(), entry.value(), valuePosition));
			}
			else {
				errors.add(new ValidationError.Unexpected(keyPosition, "key " + name));
			}
		}

		List<String> missing = new ArrayList<>();
		for (int i = 0; i < required.size(); i++) {
			if (!seenRequired[i]) {
				missing.addAll(required.get(i).key().candidates());
			}
		}
		if (!missing.isEmpty()) {
			errors.add(new ValidationError.MissingRequiredKey(position, missing));
		}
		return errors;
	}

	private List<ValidationError> validateItems(Definition.Items items, ConlValue value, Position position) {
		if (value.isScalar() || value.isMap()) {
			return expected(position, "a list");
		}
		List<ValidationError> errors = new ArrayList<>();
		List<Matcher> required = items.required();
		List<ConlEntry> entries = value.entries();

		for (int i = 0; i < entries.size(); i++) {
			ConlEntry entry = entries.get(i);
			Position itemPosition = Position.key(entry.line());
			if (entry.key().hasError()) {
				errors.add(new ValidationError.DecodeError(itemPosition, entry.key().error()));
				continue;
			}
			Position valuePosition = Position.value(entry.valueLine());
			if (i < required.size()) {
				errors.addAll(validateMatcher(required.get(i), entry.value(), valuePosition));
			}
			else if (items.items() != null) {
				errors.addAll(validateMatcher(items.items(), entry.value(), valuePosition));
			}
			else {
				errors.add(new ValidationError.Unexpected(itemPosition, "list item"));
			}
		}
		if (entries.size() < required.size()) {
			errors.add(new ValidationError.MissingRequiredItem(position, required.get(entries.size()).description()));
		}
		return errors;
	}

	private static int firstMatch(List<Definition.KeyRule> rules, String key) {
		for (int i = 0; i < rules.size(); i++) {
			if (rules.get(i).key().matches(key)) {
				return i;
			}
		}
		return -1;
	}

	private static List<ValidationError> expected(Position position, String description) {
		return List.of(new ValidationError.ExpectedMatch(position, List.of(description)));
	}
}
