package org.javai.conl.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.javai.conl.ConlDocument;
import org.javai.conl.ConlEntry;
import org.javai.conl.ConlValue;

/**
 * The outcome of validating a document: the errors found, and what was tried where.
 *
 * Results can be queried for completions and docs at any line of the document without
 * validating again. Line 0 refers to the document itself.
 */
public final class ValidationResult {

	private final List<ValidationError> errors;
	private final ConlDocument document;
	private final Map<Position, List<Attempt>> attempts;
	private final Schema schema;

	ValidationResult(List<ValidationError> errors, ConlDocument document, Map<Position, List<Attempt>> attempts,
			Schema schema) {
		this.errors = errors;
		this.document = document;
		this.attempts = attempts;
		this.schema = schema;
	}

	public boolean valid() {
		return errors.isEmpty();
	}

	/**
	 * The errors found, ordered by line.
	 */
	public List<ValidationError> errors() {
		return errors;
	}

	public ConlDocument document() {
		return document;
	}

	public Schema schema() {
		return schema;
	}

	/**
	 * Keys that could be added to the map that is the value of the entry on the given line,
	 * sorted by key. Keys already present are left out.
	 */
	public List<Suggestion> suggestedKeys(int line) {
		ConlValue map;
		Position position;
		if (line == 0) {
			map = document.root();
			position = Position.ROOT;
		}
		else {
			Optional<ConlEntry> entry = document.entryAt(line);
			if (entry.isEmpty()) {
				return List.of();
			}
			map = entry.get().value();
			position = Position.value(entry.get().valueLine());
		}

		Set<String> present = new HashSet<>();
		if (map.isMap()) {
			map.entries().forEach(e -> present.add(e.key().content()));
		}

		TreeMap<String, Suggestion> suggestions = new TreeMap<>();
		for (Attempt attempt : attemptsAt(position)) {
			Definition definition = attempt.definition();
			if (definition == null || !(definition.shape() instanceof Definition.Keys keys)) {
				continue;
			}
			for (Definition.KeyRule rule : keys.all()) {
				String docs = rule.value().effectiveDocs();
				if (docs == null) {
					docs = rule.key().effectiveDocs();
				}
				for (String literal : rule.key().literals()) {
					if (!present.contains(literal)) {
						add(suggestions, Suggestion.literal(literal, docs));
					}
				}
			}
		}
		return List.copyOf(suggestions.values());
	}

	/**
	 * Values that would match at the entry on the given line, sorted by value. When a list
	 * or map would also be accepted there, a signal for that follows the literals.
	 */
	public List<Suggestion> suggestedValues(int line) {
		Position position = valuePosition(line).orElse(null);
		if (position == null) {
			return List.of();
		}
		TreeMap<String, Suggestion> literals = new TreeMap<>();
		boolean list = false;
		boolean map = false;
		for (Attempt attempt : attemptsAt(position)) {
			Definition definition = attempt.definition();
			if (definition == null) {
				for (String literal : attempt.matcher().literals()) {
					add(literals, Suggestion.literal(literal, attempt.matcher().docs()));
				}
			}
			else if (definition.shape() instanceof Definition.Items) {
				list = true;
			}
			else if (definition.shape() instanceof Definition.Keys) {
				map = true;
			}
		}
		List<Suggestion> suggestions = new ArrayList<>(literals.values());
		if (list) {
			suggestions.add(Suggestion.startList());
		}
		if (map) {
			suggestions.add(Suggestion.startMap());
		}
		return List.copyOf(suggestions);
	}

	/**
	 * Docs for the key on the given line, from the map definitions tried for its parent.
	 */
	public Optional<String> keyDocs(int line) {
		Optional<ConlEntry> entry = document.entryAt(line);
		if (entry.isEmpty() || entry.get().isListItem()) {
			return Optional.empty();
		}
		String key = entry.get().key().content();
		int parentLine = entry.get().parentLine();
		Position parent = parentLine == 0 ? Position.ROOT : Position.value(parentLine);
		for (Attempt attempt : attemptsAt(parent)) {
			Definition definition = attempt.definition();
			if (definition == null || !(definition.shape() instanceof Definition.Keys keys)) {
				continue;
			}
			for (Definition.KeyRule rule : keys.all()) {
				if (!rule.key().matches(key)) {
					continue;
				}
				String docs = rule.value().effectiveDocs();
				if (docs == null) {
					docs = rule.key().effectiveDocs();
				}
				if (docs != null) {
					return Optional.of(docs);
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Docs for the value on the given line, from the most specific matcher that accepted it.
	 */
	public Optional<String> valueDocs(int line) {
		Optional<Position> position = valuePosition(line);
		if (position.isEmpty()) {
			return Optional.empty();
		}
		for (Attempt attempt : attemptsAt(position.get())) {
			if (attempt.ok() && attempt.matcher().effectiveDocs() != null) {
				return Optional.of(attempt.matcher().effectiveDocs());
			}
		}
		return Optional.empty();
	}

	private Optional<Position> valuePosition(int line) {
		if (line == 0) {
			return Optional.of(Position.ROOT);
		}
		return document.entryAt(line).map(entry -> Position.value(entry.valueLine()));
	}

	private List<Attempt> attemptsAt(Position position) {
		return attempts.getOrDefault(position, List.of());
	}

	private static void add(TreeMap<String, Suggestion> suggestions, Suggestion suggestion) {
		suggestions.merge(suggestion.value(), suggestion,
				(existing, candidate) -> existing.docs() == null ? candidate : existing);
	}

	@Override
	public String toString() {
		return valid() ? "valid" : errors.toString();
	}
}
