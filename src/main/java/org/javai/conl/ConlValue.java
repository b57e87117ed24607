package org.javai.conl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of a parsed CONL document.
 *
 * A value is exactly one of:
 * - a scalar (the token that carried it)
 * - a map (entries keyed by {@link Token.Kind#MAP_KEY} tokens)
 * - a list (entries keyed by {@link Token.Kind#LIST_ITEM} tokens)
 * - nothing at all, for a key or item without a value
 */
public final class ConlValue {

	/**
	 * The shared value of every entry without one. Only containers accept entries.
	 */
	static final ConlValue NONE = new ConlValue(null, List.of(), List.of());

	private final Token scalar;
	private final List<ConlEntry> map;
	private final List<ConlEntry> list;

	private ConlValue(Token scalar, List<ConlEntry> map, List<ConlEntry> list) {
		this.scalar = scalar;
		this.map = map;
		this.list = list;
	}

	static ConlValue scalar(Token token) {
		return new ConlValue(token, List.of(), List.of());
	}

	static ConlValue container() {
		return new ConlValue(null, new ArrayList<>(), new ArrayList<>());
	}

	/**
	 * @throws UnsupportedOperationException if this value is a scalar or {@link #NONE}
	 */
	void add(ConlEntry entry) {
		if (entry.key().isKind(Token.Kind.LIST_ITEM)) {
			list.add(entry);
		}
		else {
			map.add(entry);
		}
	}

	/**
	 * The entry most recently added to this container, or null.
	 */
	ConlEntry lastEntry() {
		if (!map.isEmpty()) {
			return map.get(map.size() - 1);
		}
		return list.isEmpty() ? null : list.get(list.size() - 1);
	}

	public boolean isScalar() {
		return scalar != null;
	}

	public boolean isMap() {
		return !map.isEmpty();
	}

	public boolean isList() {
		return !list.isEmpty();
	}

	/**
	 * Whether this node holds no value at all.
	 */
	public boolean isEmpty() {
		return scalar == null && map.isEmpty() && list.isEmpty();
	}

	public Token scalarToken() {
		return scalar;
	}

	/**
	 * The decoded scalar text, or null if this is not a scalar.
	 */
	public String scalar() {
		return scalar != null ? scalar.content() : null;
	}

	/**
	 * The map or list entries of this node, in document order.
	 */
	public List<ConlEntry> entries() {
		return Collections.unmodifiableList(map.isEmpty() ? list : map);
	}

	/**
	 * Returns a copy of this map without the given entry.
	 */
	public ConlValue without(ConlEntry entry) {
		if (scalar != null) {
			return this;
		}
		ConlValue copy = container();
		for (ConlEntry e : map) {
			if (e != entry) {
				copy.map.add(e);
			}
		}
		for (ConlEntry e : list) {
			if (e != entry) {
				copy.list.add(e);
			}
		}
		return copy;
	}

	@Override
	public String toString() {
		if (scalar != null) {
			return "Scalar(" + scalar.content() + ")";
		}
		if (!map.isEmpty()) {
			return "Map" + map;
		}
		if (!list.isEmpty()) {
			return "List" + list;
		}
		return "NoValue";
	}
}
