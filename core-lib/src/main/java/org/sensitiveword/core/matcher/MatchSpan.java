package org.sensitiveword.core.matcher;

/**
 * A matched dictionary word inside a scanned text.
 *
 * @param start index of the first matched char (inclusive)
 * @param end index after the last matched char (exclusive)
 * @param word the dictionary word that matched
 */
public record MatchSpan(int start, int end, String word) {
	public MatchSpan {
		if (start < 0 || end <= start) {
			throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
		}
	}

	public int length() {
		return end - start;
	}
}
