package org.javai.conl;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Splits input into physical lines on {@code \r\n}, {@code \r} or {@code \n}.
 * The last line is always produced, even when it is empty.
 */
final class ConlLines implements Iterator<ConlLines.Line> {

	record Line(int number, String text) {
	}

	private final String input;
	private int pos = 0;
	private int number = 0;
	private boolean done = false;

	ConlLines(String input) {
		this.input = input != null ? input : "";
	}

	@Override
	public boolean hasNext() {
		return !done;
	}

	@Override
	public Line next() {
		if (done) {
			throw new NoSuchElementException("No more lines");
		}
		int end = pos;
		while (end < input.length() && input.charAt(end) != '\r' && input.charAt(end) != '\n') {
			end++;
		}
		String text = input.substring(pos, end);
		if (end == input.length()) {
			done = true;
		}
		else if (input.charAt(end) == '\r' && end + 1 < input.length() && input.charAt(end + 1) == '\n') {
			pos = end + 2;
		}
		else {
			pos = end + 1;
		}
		number++;
		return new Line(number, text);
	}
}
