package org.sensitiveword.core.matcher;

import org.junit.jupiter.api.Test;
import org.sensitiveword.core.dictionary.Dictionary;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class AutomatonBuilderTest {

	private final AutomatonBuilder builder = new AutomatonBuilder();

	@Test
	public void testEmptyDictionaryNeverMatches() {
		Automaton automaton = builder.build(Dictionary.empty());

		assertTrue(automaton.isEmpty());
		assertEquals(1, automaton.stateCount());
		assertNull(automaton.findFrom("anything at all", 0));
		assertFalse(automaton.matchesAny("anything at all"));
	}

	@Test
	public void testEarlierPatternWinsAtSameStart() {
		Automaton longFirst = builder.build(Dictionary.of("abcd", "ab"));
		Automaton shortFirst = builder.build(Dictionary.of("ab", "abcd"));

		assertEquals(new MatchSpan(1, 5, "abcd"), longFirst.findFrom("xabcdx", 0));
		assertEquals(new MatchSpan(1, 3, "ab"), shortFirst.findFrom("xabcdx", 0));
	}

	@Test
	public void testLeftmostStartWinsOverEarlierEnd() {
		Automaton automaton = builder.build(Dictionary.of("bc", "abcd"));

		assertEquals(new MatchSpan(0, 4, "abcd"), automaton.findFrom("abcd", 0));
		assertEquals(new MatchSpan(1, 3, "bc"), automaton.findFrom("abce", 0));
	}

	@Test
	public void testClassicPatternSet() {
		Automaton automaton = builder.build(Dictionary.of("he", "she", "his", "hers"));

		assertEquals(new MatchSpan(1, 4, "she"), automaton.findFrom("ushers", 0));
		assertNull(automaton.findFrom("ushers", 4));
		assertEquals(new MatchSpan(2, 4, "he"), automaton.findFrom("ushers", 2));
	}

	@Test
	public void testCaseSensitive() {
		Automaton automaton = builder.build(Dictionary.of("Bad"));

		assertEquals(new MatchSpan(8, 11, "Bad"), automaton.findFrom("bad BAD Bad", 0));
		assertFalse(automaton.matchesAny("bad BAD"));
	}

	@Test
	public void testSupplementaryCharactersStayOnCodePointBoundaries() {
		Automaton automaton = builder.build(Dictionary.of("😀x"));

		MatchSpan span = automaton.findFrom("a😀x", 0);

		assertEquals(new MatchSpan(1, 4, "😀x"), span);
	}

	@Test
	public void testSharedPrefixesShareStates() {
		Automaton automaton = builder.build(Dictionary.of("abc", "abd", "ab"));

		// root, a, ab, abc, abd
		assertEquals(5, automaton.stateCount());
		assertEquals(List.of("abc", "abd", "ab"), automaton.patterns());
	}

	@Test
	public void testMatchesAgreeWithNaiveLeftmostFirst() {
		Random random = new Random(42);
		for (int round = 0; round < 300; round++) {
			List<String> words = new ArrayList<>();
			int count = 1 + random.nextInt(6);
			for (int i = 0; i < count; i++) {
				words.add(randomString(random, 1 + random.nextInt(4)));
			}
			Dictionary dictionary = Dictionary.of(words);
			Automaton automaton = builder.build(dictionary);

			for (int sample = 0; sample < 10; sample++) {
				String text = randomString(random, random.nextInt(30));
				assertEquals(naiveScan(dictionary.words(), text), scanAll(automaton, text),
						"dictionary=" + dictionary.words() + " text=" + text);
				assertEquals(!naiveScan(dictionary.words(), text).isEmpty(), automaton.matchesAny(text));
			}
		}
	}

	@Test
	public void testDeterministicBuilds() {
		Dictionary dictionary = Dictionary.of("ab", "b", "bab", "aab", "ba");
		Automaton first = builder.build(dictionary);
		Automaton second = builder.build(dictionary);

		Random random = new Random(7);
		for (int i = 0; i < 200; i++) {
			String text = randomString(random, random.nextInt(40));
			assertEquals(scanAll(first, text), scanAll(second, text));
		}
		assertEquals(first.stateCount(), second.stateCount());
	}

	static List<MatchSpan> scanAll(Automaton automaton, String text) {
		List<MatchSpan> spans = new ArrayList<>();
		int position = 0;
		MatchSpan span;
		while ((span = automaton.findFrom(text, position)) != null) {
			spans.add(span);
			position = span.end();
		}
		return spans;
	}

	private static List<MatchSpan> naiveScan(List<String> words, String text) {
		List<MatchSpan> spans = new ArrayList<>();
		int start = 0;
		while (start < text.length()) {
			String winner = null;
			for (String word : words) {
				if (text.startsWith(word, start)) {
					winner = word;
					break;
				}
			}
			if (winner != null) {
				spans.add(new MatchSpan(start, start + winner.length(), winner));
				start += winner.length();
			} else {
				start++;
			}
		}
		return spans;
	}

	private static String randomString(Random random, int length) {
		StringBuilder sb = new StringBuilder(length);
		for (int i = 0; i < length; i++) {
			sb.append((char) ('a' + random.nextInt(3)));
		}
		return sb.toString();
	}
}
