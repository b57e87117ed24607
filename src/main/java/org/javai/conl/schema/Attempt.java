package org.javai.conl.schema;

import org.javai.conl.ConlValue;

/**
 * A record of one matcher being tried against a value during validation.
 */
record Attempt(Matcher matcher, ConlValue value, boolean ok) {

	/**
	 * The definition tried, or null when the matcher is a pattern.
	 */
	Definition definition() {
		return matcher.resolved();
	}
}
