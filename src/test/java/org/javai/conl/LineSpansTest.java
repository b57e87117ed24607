package org.javai.conl;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LineSpansTest {

	/**
	 * Each case marks the key start, key end, value start, value end and comment start with
	 * {@code |}; missing trailing marks repeat the last one.
	 */
	@ParameterizedTest
	@ValueSource(strings = {
			"|a| = |a| |;a",
			"|\"a = a\"| = |\"b =|",
			"|\"a = a = \"b| =|||;",
			"  |a| = |b|",
			"|=|",
			"|=| |x|",
			"|key| |;comment"
	})
	void splitLine(String marked) {
		StringBuilder line = new StringBuilder();
		List<Integer> marks = new ArrayList<>();
		for (char c : marked.toCharArray()) {
			if (c == '|') {
				marks.add(line.length());
			}
			else {
				line.append(c);
			}
		}
		while (marks.size() < 5) {
			marks.add(marks.get(marks.size() - 1));
		}

		LineSpans spans = LineSpans.of(line.toString());

		assertThat(List.of(spans.startKey(), spans.endKey(), spans.startValue(), spans.endValue(), spans.startComment()))
				.as(line.toString())
				.isEqualTo(marks);
	}

	@Test
	void offsetsCountCodePoints() {
		LineSpans spans = LineSpans.of("\uD83D\uDE00 = ü");

		assertThat(spans.endKey()).isEqualTo(1);
		assertThat(spans.startValue()).isEqualTo(4);
		assertThat(spans.endValue()).isEqualTo(5);
	}

	@Test
	void reportWhetherLineHasValue() {
		assertThat(LineSpans.of("a = 1").hasValue()).isTrue();
		assertThat(LineSpans.of("a").hasValue()).isFalse();
	}

	@Test
	void longQuotedKeyIsOneSpan() {
		String key = "\"" + "k=;".repeat(20000) + "\"";

		LineSpans spans = LineSpans.of(key + " = v");

		assertThat(spans.endKey()).isEqualTo(key.length());
		assertThat(spans.startValue()).isEqualTo(key.length() + 3);
		assertThat(spans.hasValue()).isTrue();
	}
}
