package org.sensitiveword.core.filter;

import com.ibm.icu.text.BreakIterator;
import com.ibm.icu.util.ULocale;
import org.sensitiveword.core.matcher.Automaton;
import org.sensitiveword.core.matcher.MatchSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stateless scan, containment and redaction over a given {@link Automaton}.
 *
 * <p>The engine holds only the mask character, so one instance can serve any number of threads and
 * automaton snapshots.</p>
 */
public class FilterEngine {
	public static final char DEFAULT_MASK = '*';

	private final char mask;

	public FilterEngine() {
		this(DEFAULT_MASK);
	}

	public FilterEngine(char mask) {
		if (Character.isSurrogate(mask)) {
			throw new IllegalArgumentException("Mask character must not be a surrogate: \\u"
					+ Integer.toHexString(mask));
		}
		this.mask = mask;
	}

	public char getMask() {
		return mask;
	}

	/**
	 * Ordered, non-overlapping matches of the text
	 */
	public List<MatchSpan> scan(Automaton automaton, String text) {
		if (text == null || text.isEmpty() || automaton.isEmpty()) {
			return Collections.emptyList();
		}

		List<MatchSpan> spans = new ArrayList<>();
		int position = 0;
		MatchSpan span;
		while (position < text.length() && (span = automaton.findFrom(text, position)) != null) {
			spans.add(span);
			position = span.end();
		}
		return spans;
	}

	/**
	 * Matched words in scan order, repeated once per occurrence
	 */
	public List<String> matchedWords(Automaton automaton, String text) {
		List<MatchSpan> spans = scan(automaton, text);
		List<String> words = new ArrayList<>(spans.size());
		for (MatchSpan span : spans) {
			words.add(span.word());
		}
		return words;
	}

	public boolean contains(Automaton automaton, String text) {
		if (text == null || text.isEmpty()) {
			return false;
		}
		return automaton.matchesAny(text);
	}

	/**
	 * Replace every match with a run of mask characters, one per user-perceived character of the word.
	 */
	public String redact(Automaton automaton, String text) {
		List<MatchSpan> spans = scan(automaton, text);
		if (spans.isEmpty()) {
			return text;
		}

		StringBuilder redacted = new StringBuilder(text.length());
		int copied = 0;
		for (MatchSpan span : spans) {
			redacted.append(text, copied, span.start());
			int characters = countCharacters(span.word());
			for (int i = 0; i < characters; i++) {
				redacted.append(mask);
			}
			copied = span.end();
		}
		redacted.append(text, copied, text.length());
		return redacted.toString();
	}

	/**
	 * Extended grapheme clusters in the word, so emoji sequences and flags count once
	 */
	static int countCharacters(String word) {
		BreakIterator boundaries = BreakIterator.getCharacterInstance(ULocale.ROOT);
		boundaries.setText(word);
		int count = 0;
		while (boundaries.next() != BreakIterator.DONE) {
			count++;
		}
		return count;
	}
}
