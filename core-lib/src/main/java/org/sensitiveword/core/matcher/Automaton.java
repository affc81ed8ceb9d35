package org.sensitiveword.core.matcher;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable Aho-Corasick automaton over a fixed list of patterns.
 *
 * <p>Matching is case-sensitive and follows the leftmost-first policy: among all occurrences the one with
 * the smallest start wins, and among occurrences sharing that start the pattern listed first wins. This is
 * fixed behavior; there is no overlapping or longest-match mode.</p>
 *
 * <p>Transitions are stored in compressed rows: the transitions of state {@code s} occupy
 * {@code [transitionOffsets[s], transitionOffsets[s + 1])} of {@link #transitionChars} and
 * {@link #transitionTargets}, sorted by char. Instances are safe to share between threads.</p>
 */
public final class Automaton {
	static final int ROOT = 0;
	static final int NONE = -1;

	private final String[] patterns;
	private final int[] depth;
	private final int[] fail;
	private final int[] output;
	private final int[] dictionaryLink;
	private final int[] transitionOffsets;
	private final char[] transitionChars;
	private final int[] transitionTargets;

	Automaton(String[] patterns, int[] depth, int[] fail, int[] output, int[] dictionaryLink,
			  int[] transitionOffsets, char[] transitionChars, int[] transitionTargets) {
		this.patterns = patterns;
		this.depth = depth;
		this.fail = fail;
		this.output = output;
		this.dictionaryLink = dictionaryLink;
		this.transitionOffsets = transitionOffsets;
		this.transitionChars = transitionChars;
		this.transitionTargets = transitionTargets;
	}

	/**
	 * Patterns in construction order; index {@code i} is the pattern id used for tie-breaking.
	 */
	public List<String> patterns() {
		return List.of(patterns);
	}

	public int patternCount() {
		return patterns.length;
	}

	public int stateCount() {
		return depth.length;
	}

	public boolean isEmpty() {
		return patterns.length == 0;
	}

	/**
	 * Find the leftmost-first match starting at or after {@code from}.
	 *
	 * @return the match, or {@code null} if the rest of the text contains no pattern
	 */
	public MatchSpan findFrom(CharSequence text, int from) {
		if (patterns.length == 0) {
			return null;
		}

		int state = ROOT;
		int bestStart = NONE;
		int bestEnd = NONE;
		int bestPattern = NONE;

		for (int i = from; i < text.length(); i++) {
			state = step(state, text.charAt(i));

			// the longest output ending here has the smallest start of all outputs at this position
			int matched = output[state] != NONE ? state : dictionaryLink[state];
			if (matched != NONE) {
				int pattern = output[matched];
				int start = i + 1 - depth[matched];
				if (bestPattern == NONE || start < bestStart || (start == bestStart && pattern < bestPattern)) {
					bestStart = start;
					bestEnd = i + 1;
					bestPattern = pattern;
				}
			}

			// no later occurrence can start at or before bestStart once the tracked prefix begins after it
			if (bestPattern != NONE && bestStart < i + 1 - depth[state]) {
				break;
			}
		}

		return bestPattern == NONE ? null : new MatchSpan(bestStart, bestEnd, patterns[bestPattern]);
	}

	/**
	 * True as soon as any pattern occurs in the text.
	 */
	public boolean matchesAny(CharSequence text) {
		if (patterns.length == 0) {
			return false;
		}

		int state = ROOT;
		for (int i = 0; i < text.length(); i++) {
			state = step(state, text.charAt(i));
			if (output[state] != NONE || dictionaryLink[state] != NONE) {
				return true;
			}
		}
		return false;
	}

	private int step(int state, char c) {
		while (true) {
			int next = transition(state, c);
			if (next != NONE) {
				return next;
			}
			if (state == ROOT) {
				return ROOT;
			}
			state = fail[state];
		}
	}

	private int transition(int state, char c) {
		int from = transitionOffsets[state];
		int to = transitionOffsets[state + 1];
		int index = Arrays.binarySearch(transitionChars, from, to, c);
		return index >= 0 ? transitionTargets[index] : NONE;
	}

	String[] patternArray() {
		return patterns;
	}

	int[] depthArray() {
		return depth;
	}

	int[] failArray() {
		return fail;
	}

	int[] outputArray() {
		return output;
	}

	int[] dictionaryLinkArray() {
		return dictionaryLink;
	}

	int[] transitionOffsetArray() {
		return transitionOffsets;
	}

	char[] transitionCharArray() {
		return transitionChars;
	}

	int[] transitionTargetArray() {
		return transitionTargets;
	}

	@Override
	public String toString() {
		return "Automaton{patterns=" + patterns.length + ", states=" + depth.length + "}";
	}
}
