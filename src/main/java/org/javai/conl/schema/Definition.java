package org.javai.conl.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * A named rule in a schema. Each definition has exactly one shape: it matches a scalar,
 * one of several alternatives, a map, a list, or only a missing value.
 */
public final class Definition {

	/**
	 * The structure a definition accepts.
	 */
	public sealed interface Shape permits Scalar, OneOf, Keys, Items, Empty {
	}

	/**
	 * A scalar value matching the matcher.
	 */
	public record Scalar(Matcher matcher) implements Shape {
	}

	/**
	 * A value matching at least one of the alternatives.
	 */
	public record OneOf(List<Matcher> alternatives) implements Shape {
		public OneOf {
			alternatives = List.copyOf(alternatives);
		}
	}

	/**
	 * A map. Each required key must appear exactly once; optional keys may appear any
	 * number of times.
	 */
	public record Keys(List<KeyRule> optional, List<KeyRule> required) implements Shape {
		public Keys {
			optional = List.copyOf(optional);
			required = List.copyOf(required);
		}

		/**
		 * Required rules first, then optional ones.
		 */
		public List<KeyRule> all() {
			return Stream.concat(required.stream(), optional.stream()).toList();
		}
	}

	/**
	 * A list. The first items match the required matchers by position; any further items
	 * match {@code items}, or are rejected when it is null.
	 */
	public record Items(Matcher items, List<Matcher> required) implements Shape {
		public Items {
			required = List.copyOf(required);
		}
	}

	/**
	 * No value at all.
	 */
	public record Empty() implements Shape {
	}

	/**
	 * A key matcher and the matcher for the values of matching keys.
	 */
	public record KeyRule(Matcher key, Matcher value) {
	}

	private final String name;
	private final String docs;
	private final Shape shape;
	private boolean resolved;

	Definition(String name, String docs, Shape shape) {
		this.name = name;
		this.docs = docs;
		this.shape = shape;
	}

	public String name() {
		return name;
	}

	public String docs() {
		return docs;
	}

	public Shape shape() {
		return shape;
	}

	boolean isResolved() {
		return resolved;
	}

	void markResolved() {
		this.resolved = true;
	}

	/**
	 * Every matcher this definition contains, in the order written.
	 */
	List<Matcher> matchers() {
		if (shape instanceof Scalar scalar) {
			return List.of(scalar.matcher());
		}
		if (shape instanceof OneOf oneOf) {
			return oneOf.alternatives();
		}
		if (shape instanceof Keys keys) {
			return keys.all().stream()
					.flatMap(rule -> Stream.of(rule.key(), rule.value()))
					.toList();
		}
		if (shape instanceof Items items) {
			List<Matcher> all = new ArrayList<>(items.required());
			if (items.items() != null) {
				all.add(items.items());
			}
			return all;
		}
		return List.of();
	}

	@Override
	public String toString() {
		return "<" + name + ">";
	}
}
