package org.sensitiveword.core.dictionary;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, duplicate-free list of trimmed, non-empty words.
 *
 * <p>Order is the order in which words were first seen in the source. It decides which pattern wins when
 * several words match at the same position, so two dictionaries with the same words in a different order
 * are not interchangeable.</p>
 */
public record Dictionary(List<String> words) {
	private static final Dictionary EMPTY = new Dictionary(List.of());

	public Dictionary {
		words = List.copyOf(words);
		Set<String> seen = new LinkedHashSet<>();
		for (String word : words) {
			if (word.isEmpty() || !word.equals(word.strip())) {
				throw new IllegalArgumentException("Dictionary words must be trimmed and non-empty: '" + word + "'");
			}
			if (!seen.add(word)) {
				throw new IllegalArgumentException("Duplicate dictionary word: '" + word + "'");
			}
		}
	}

	public static Dictionary empty() {
		return EMPTY;
	}

	/**
	 * Normalizes raw candidates: trims each, drops blanks and keeps the first occurrence of every word.
	 */
	public static Dictionary of(Iterable<String> candidates) {
		Set<String> unique = new LinkedHashSet<>();
		for (String candidate : candidates) {
			if (candidate == null) {
				continue;
			}
			String word = candidate.strip();
			if (!word.isEmpty()) {
				unique.add(word);
			}
		}
		return new Dictionary(new ArrayList<>(unique));
	}

	public static Dictionary of(String... candidates) {
		return of(List.of(candidates));
	}

	public int size() {
		return words.size();
	}

	public boolean isEmpty() {
		return words.isEmpty();
	}
}
