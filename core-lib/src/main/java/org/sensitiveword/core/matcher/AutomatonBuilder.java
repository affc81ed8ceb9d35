package org.sensitiveword.core.matcher;

import org.sensitiveword.core.dictionary.Dictionary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;

/**
 * Compiles a {@link Dictionary} into an {@link Automaton}.
 *
 * <p>Runs in time and space linear in the total pattern length: a trie is built in dictionary order, then
 * failure and dictionary-suffix links are filled in breadth-first. State numbering depends only on the
 * dictionary, so equal dictionaries produce equal automatons.</p>
 */
public class AutomatonBuilder {
	private static final Logger logger = LoggerFactory.getLogger(AutomatonBuilder.class);

	public Automaton build(Dictionary dictionary) {
		if (dictionary.isEmpty()) {
			logger.warn("No sensitive words to build automaton, nothing will match");
		}

		try {
			Trie trie = new Trie();
			List<String> words = dictionary.words();
			for (int id = 0; id < words.size(); id++) {
				trie.insert(words.get(id), id);
			}
			trie.linkFailures();

			Automaton automaton = trie.freeze(words.toArray(new String[0]));
			logger.info("Built automaton with {} words and {} states",
					automaton.patternCount(), automaton.stateCount());
			return automaton;
		} catch (MatcherBuildException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new MatcherBuildException("Failed to build automaton from " + dictionary.size() + " words", e);
		}
	}

	private static final class Trie {
		private final List<TreeMap<Character, Integer>> children = new ArrayList<>();
		private final IntList depth = new IntList();
		private final IntList output = new IntList();
		private int[] fail;
		private int[] dictionaryLink;

		Trie() {
			addState(0);
		}

		void insert(String word, int patternId) {
			int state = Automaton.ROOT;
			for (int i = 0; i < word.length(); i++) {
				char c = word.charAt(i);
				Integer next = children.get(state).get(c);
				if (next == null) {
					next = addState(depth.get(state) + 1);
					children.get(state).put(c, next);
				}
				state = next;
			}
			if (output.get(state) != Automaton.NONE) {
				throw new MatcherBuildException("Duplicate pattern: '" + word + "'");
			}
			output.set(state, patternId);
		}

		void linkFailures() {
			int states = children.size();
			fail = new int[states];
			dictionaryLink = new int[states];
			dictionaryLink[Automaton.ROOT] = Automaton.NONE;

			Queue<Integer> queue = new ArrayDeque<>();
			for (int child : children.get(Automaton.ROOT).values()) {
				fail[child] = Automaton.ROOT;
				dictionaryLink[child] = Automaton.NONE;
				queue.add(child);
			}

			while (!queue.isEmpty()) {
				int state = queue.poll();
				for (Map.Entry<Character, Integer> entry : children.get(state).entrySet()) {
					char c = entry.getKey();
					int child = entry.getValue();

					int candidate = fail[state];
					while (candidate != Automaton.ROOT && !children.get(candidate).containsKey(c)) {
						candidate = fail[candidate];
					}
					Integer target = children.get(candidate).get(c);
					fail[child] = target != null ? target : Automaton.ROOT;

					int suffix = fail[child];
					dictionaryLink[child] = output.get(suffix) != Automaton.NONE ? suffix : dictionaryLink[suffix];

					queue.add(child);
				}
			}
		}

		Automaton freeze(String[] patterns) {
			int states = children.size();
			int transitions = states - 1;

			int[] offsets = new int[states + 1];
			char[] chars = new char[transitions];
			int[] targets = new int[transitions];

			int cursor = 0;
			for (int state = 0; state < states; state++) {
				offsets[state] = cursor;
				for (Map.Entry<Character, Integer> entry : children.get(state).entrySet()) {
					chars[cursor] = entry.getKey();
					targets[cursor] = entry.getValue();
					cursor++;
				}
			}
			offsets[states] = cursor;

			return new Automaton(patterns, depth.toArray(), fail, output.toArray(), dictionaryLink,
					offsets, chars, targets);
		}

		private int addState(int stateDepth) {
			if (children.size() == Integer.MAX_VALUE - 1) {
				throw new MatcherBuildException("Dictionary too large: state limit reached");
			}
			children.add(new TreeMap<>());
			depth.add(stateDepth);
			output.add(Automaton.NONE);
			return children.size() - 1;
		}
	}

	private static final class IntList {
		private int[] values = new int[16];
		private int size;

		void add(int value) {
			if (size == values.length) {
				values = Arrays.copyOf(values, values.length * 2);
			}
			values[size++] = value;
		}

		int get(int index) {
			return values[index];
		}

		void set(int index, int value) {
			values[index] = value;
		}

		int[] toArray() {
			return Arrays.copyOf(values, size);
		}
	}
}
