package org.javai.conl;

import com.google.re2j.Matcher;
import com.google.re2j.Pattern;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Literal boundaries, quoting and escapes of CONL keys and values.
 *
 * <p>The lexer works on a byte-preserving view of its input: every byte is mapped to the
 * char with the same value (ISO-8859-1). All syntax characters are ASCII, so splitting is
 * unaffected, and each token's bytes are decoded as UTF-8 only once its boundaries are
 * known. Invalid UTF-8 therefore becomes an error on one token instead of a failed scan.
 */
public final class ConlLiterals {

	static final String INVALID_UTF8 = "invalid UTF-8";

	private static final Pattern QUOTED = Pattern.compile("^\"((?:\\\\.|[^\\\\\"])*)\"", Pattern.DOTALL);
	private static final Pattern ESCAPE = Pattern.compile("\\\\(\\{[^}]*\\}?|.)", Pattern.DOTALL);

	private ConlLiterals() {
		// Utility class - no instantiation
	}

	/**
	 * A literal and whatever follows it on the line.
	 */
	record Split(String before, String after) {
	}

	/**
	 * Decoded text, or the reason it could not be decoded.
	 */
	record Decoded(String value, String error) {
	}

	/**
	 * Decodes a key or value exactly as it would be written in a document.
	 *
	 * @param literal a bare or quoted literal
	 * @return the decoded text
	 * @throws IllegalArgumentException if the literal is malformed
	 */
	public static String decode(String literal) {
		Decoded decoded = decodeLiteral(transport(literal));
		if (decoded.error() != null) {
			throw new IllegalArgumentException(decoded.error() + ": " + literal);
		}
		return decoded.value();
	}

	/**
	 * Encodes text as a quoted literal, escaping quotes, backslashes and control characters.
	 */
	public static String quote(String text) {
		StringBuilder sb = new StringBuilder("\"");
		text.codePoints().forEach(cp -> {
			switch (cp) {
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				default -> {
					if (cp < 0x20 || cp == 0x7f) {
						sb.append("\\{").append(Integer.toHexString(cp)).append('}');
					} else {
						sb.appendCodePoint(cp);
					}
				}
			}
		});
		return sb.append('"').toString();
	}

	/**
	 * Encodes text as a bare literal when that round-trips, otherwise quotes it.
	 */
	public static String encode(String text, boolean key) {
		boolean bare = !text.isEmpty()
				&& text.equals(trimHorizontal(text))
				&& !text.startsWith("\"")
				&& !text.startsWith("=")
				&& text.indexOf(';') < 0
				&& !(key && text.indexOf('=') >= 0)
				&& text.codePoints().noneMatch(cp -> cp < 0x20 || cp == 0x7f);
		return bare ? text : quote(text);
	}

	static String transport(String text) {
		return new String(text.getBytes(StandardCharsets.UTF_8), StandardCharsets.ISO_8859_1);
	}

	static Split splitLiteral(String input, boolean key) {
		if (input.startsWith("\"")) {
			boolean wasEscape = false;
			for (int i = 1; i < input.length(); i++) {
				char c = input.charAt(i);
				if (c == '"' && !wasEscape) {
					Split tail = splitUnquoted(input.substring(i), key);
					return new Split(input.substring(0, i) + tail.before(), tail.after());
				}
				wasEscape = c == '\\' && !wasEscape;
			}
			return new Split(input, "");
		}
		return splitUnquoted(input, key);
	}

	private static Split splitUnquoted(String input, boolean key) {
		if (key) {
			int equals = input.indexOf('=');
			if (equals >= 0) {
				String before = input.substring(0, equals);
				int semicolon = before.indexOf(';');
				if (semicolon >= 0) {
					return new Split(trimTrailing(before.substring(0, semicolon)), input.substring(semicolon));
				}
				return new Split(trimTrailing(before), input.substring(equals + 1));
			}
		}
		int semicolon = input.indexOf(';');
		if (semicolon >= 0) {
			return new Split(trimTrailing(input.substring(0, semicolon)), input.substring(semicolon));
		}
		return new Split(trimTrailing(input), "");
	}

	static Decoded decodeLiteral(String raw) {
		Decoded text = decodeUtf8(raw);
		if (text.error() != null) {
			return new Decoded("", text.error());
		}
		String input = text.value();
		if (!input.startsWith("\"")) {
			return text;
		}

		Matcher match = QUOTED.matcher(input);
		if (!match.find()) {
			return new Decoded("", "unclosed quotes");
		}
		if (match.end() != input.length()) {
			return new Decoded("", "characters after quotes");
		}

		String body = match.group(1);
		StringBuilder sb = new StringBuilder();
		Matcher escapes = ESCAPE.matcher(body);
		int last = 0;
		while (escapes.find()) {
			sb.append(body, last, escapes.start());
			String escape = escapes.group();
			String replacement = unescape(escape);
			if (replacement == null) {
				return new Decoded("", "invalid escape code: " + escape);
			}
			sb.append(replacement);
			last = escapes.end();
		}
		sb.append(body.substring(last));
		return new Decoded(sb.toString(), null);
	}

	private static String unescape(String escape) {
		return switch (escape.charAt(1)) {
			case 'n' -> "\n";
			case 'r' -> "\r";
			case 't' -> "\t";
			case '"' -> "\"";
			case '\\' -> "\\";
			case '{' -> unescapeCodePoint(escape);
			default -> null;
		};
	}

	private static String unescapeCodePoint(String escape) {
		// \{X} .. \{XXXXXXXX}
		if (!escape.endsWith("}") || escape.length() == 3 || escape.length() > 11) {
			return null;
		}
		String hex = escape.substring(2, escape.length() - 1);
		long codePoint;
		try {
			codePoint = Long.parseLong(hex, 16);
		}
		catch (NumberFormatException e) {
			return null;
		}
		if (codePoint > Character.MAX_CODE_POINT || (codePoint >= 0xD800 && codePoint <= 0xDFFF) || hex.startsWith("-") || hex.startsWith("+")) {
			return null;
		}
		return new String(Character.toChars((int) codePoint));
	}

	static Decoded decodeUtf8(String raw) {
		byte[] bytes = raw.getBytes(StandardCharsets.ISO_8859_1);
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		try {
			CharBuffer decoded = decoder.decode(ByteBuffer.wrap(bytes));
			return new Decoded(decoded.toString(), null);
		}
		catch (CharacterCodingException e) {
			return new Decoded(new String(bytes, StandardCharsets.UTF_8), INVALID_UTF8);
		}
	}

	static String trimLeading(String text) {
		int start = 0;
		while (start < text.length() && isHorizontalSpace(text.charAt(start))) {
			start++;
		}
		return text.substring(start);
	}

	static String trimTrailing(String text) {
		int end = text.length();
		while (end > 0 && isHorizontalSpace(text.charAt(end - 1))) {
			end--;
		}
		return text.substring(0, end);
	}

	static String trimHorizontal(String text) {
		return trimTrailing(trimLeading(text));
	}

	static String trimTrailingWhitespace(String text) {
		int end = text.length();
		while (end > 0) {
			char c = text.charAt(end - 1);
			if (!isHorizontalSpace(c) && c != '\r' && c != '\n') {
				break;
			}
			end--;
		}
		return text.substring(0, end);
	}

	static boolean isHorizontalSpace(char c) {
		return c == ' ' || c == '\t';
	}
}
