package org.javai.conl;

import com.google.re2j.Matcher;
import com.google.re2j.Pattern;

/**
 * Column offsets of the key, value and comment of a single document line.
 *
 * Offsets are code point indexes into the line, end exclusive. Quoted literals are
 * treated as opaque, so {@code =} and {@code ;} inside quotes do not split the line.
 */
public record LineSpans(int startKey, int endKey, int startValue, int endValue, int startComment) {

	private static final Pattern QUOTED = Pattern.compile("^\"(?:[^\\\\\"]|\\\\.)*\"", Pattern.DOTALL);

	public static LineSpans of(String line) {
		String trimmed = ConlLiterals.trimLeading(line);
		int startKey = line.length() - trimmed.length();
		trimmed = maskQuoted(trimmed);

		int endKey;
		int startValue = line.length();
		if (trimmed.startsWith("=")) {
			endKey = startKey + 1;
			startValue = endKey;
		}
		else {
			int found = indexOfAny(trimmed, "=;");
			if (found > -1) {
				endKey = startKey + ConlLiterals.trimTrailing(trimmed.substring(0, found)).length();
				startValue = trimmed.charAt(found) == '=' ? startKey + found + 1 : startKey + found;
			}
			else {
				endKey = startKey + ConlLiterals.trimTrailing(trimmed).length();
			}
		}

		String valueHalf = line.substring(startValue);
		trimmed = ConlLiterals.trimLeading(valueHalf);
		startValue += valueHalf.length() - trimmed.length();
		trimmed = maskQuoted(trimmed);

		int endValue;
		int startComment = line.length();
		int found = trimmed.indexOf(';');
		if (found > -1) {
			endValue = startValue + ConlLiterals.trimTrailing(trimmed.substring(0, found)).length();
			startComment = startValue + found;
		}
		else {
			endValue = startValue + ConlLiterals.trimTrailing(trimmed).length();
		}

		return new LineSpans(
			codePoints(line, startKey),
			codePoints(line, endKey),
			codePoints(line, startValue),
			codePoints(line, endValue),
			codePoints(line, startComment));
	}

	public boolean hasValue() {
		return startValue != endValue;
	}

	private static String maskQuoted(String text) {
		Matcher quoted = QUOTED.matcher(text);
		if (!quoted.find()) {
			return text;
		}
		return "a".repeat(quoted.end()) + text.substring(quoted.end());
	}

	private static int indexOfAny(String text, String chars) {
		for (int i = 0; i < text.length(); i++) {
			if (chars.indexOf(text.charAt(i)) >= 0) {
				return i;
			}
		}
		return -1;
	}

	private static int codePoints(String line, int index) {
		return line.codePointCount(0, index);
	}
}
