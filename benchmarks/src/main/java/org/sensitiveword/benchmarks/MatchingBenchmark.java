package org.sensitiveword.benchmarks;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.sensitiveword.core.dictionary.Dictionary;
import org.sensitiveword.core.filter.FilterEngine;
import org.sensitiveword.core.matcher.Automaton;
import org.sensitiveword.core.matcher.AutomatonBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for the matching hot path
 * Tests: build automaton, contains, scan, redact
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class MatchingBenchmark {

	private static final String ALPHABET = "的一是在不了有和人这中大为上个国我以要他时来用们生到作地于出就分对成会可主发年动同工也能下过子说产种面而方后多定行学法所民得经十三之进着等部度家电力里如水化高自二理起小物现实加量都两体制机当使点从业本去把性好应开它合还因由其些然前外天政四日那社义事平形相全表间样与关各重新线内数正心反你明看原又么利比或但质气第向道命此变条只没结解问意建月公无系军很情者最立代想已通并提直题党程展五果料象员革位入常文总次品式活设及管特件长求老头基资边流路级少图山统接知较将组见计别她手角期根论运农指几九区强放决西被干做必战先回则任取据处队南给色光门即保治北造百规热领七海口东导器压志世金增争济阶油思术极交受联什认六共权收证改清己美再采转更单风切打白教速花带安场身车例真务具万每目至达走积示议声报斗完类八离华名确才科张信马节话米整空元况今集温传土许步群广石记需段研界拉林律叫且究观越织装影算低持音众书布复容儿须际商非验连断深难近矿千周委素技备半办青省列习响约支般史感劳便团往酸历市克何除消构府称太准精值号率族维划选标写存候毛亲快效斯院查江型眼王按格养易置派层片始却专状育厂京识适属圆包火住调满县局照参红细引听该铁价严";

	private FilterEngine engine;
	private Dictionary dictionary;
	private Automaton automaton;
	private String cleanText;
	private String dirtyText;

	@Param({"100", "1000", "10000"})
	private int wordCount;

	@Setup(Level.Trial)
	public void setup() {
		System.out.println("=== Matching Benchmark Setup (wordCount=" + wordCount + ") ===");

		Random random = new Random(42);
		List<String> words = new ArrayList<>(wordCount);
		while (words.size() < wordCount) {
			words.add(randomWord(random, 2 + random.nextInt(4)));
		}
		dictionary = Dictionary.of(words);
		automaton = new AutomatonBuilder().build(dictionary);
		engine = new FilterEngine();

		StringBuilder clean = new StringBuilder();
		StringBuilder dirty = new StringBuilder();
		for (int i = 0; i < 2000; i++) {
			String filler = randomWord(random, 1);
			clean.append(filler).append(' ');
			dirty.append(filler);
			if (i % 50 == 0) {
				dirty.append(dictionary.words().get(random.nextInt(dictionary.size())));
			}
			dirty.append(' ');
		}
		cleanText = clean.toString();
		dirtyText = dirty.toString();

		System.out.println("Automaton ready: " + automaton.patternCount() + " words, " + automaton.stateCount() + " states");
	}

	private static String randomWord(Random random, int length) {
		StringBuilder word = new StringBuilder(length);
		for (int i = 0; i < length; i++) {
			word.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
		}
		return word.toString();
	}

	/**
	 * Benchmark: compile the dictionary into an automaton
	 */
	@Benchmark
	public void buildAutomaton(Blackhole blackhole) {
		blackhole.consume(new AutomatonBuilder().build(dictionary));
	}

	/**
	 * Benchmark: containment test on text with early matches
	 */
	@Benchmark
	public void containsDirty(Blackhole blackhole) {
		blackhole.consume(engine.contains(automaton, dirtyText));
	}

	/**
	 * Benchmark: containment test that has to read the whole text
	 */
	@Benchmark
	public void containsClean(Blackhole blackhole) {
		blackhole.consume(engine.contains(automaton, cleanText));
	}

	/**
	 * Benchmark: full scan collecting every match
	 */
	@Benchmark
	public void scan(Blackhole blackhole) {
		blackhole.consume(engine.scan(automaton, dirtyText));
	}

	/**
	 * Benchmark: redaction of every match
	 */
	@Benchmark
	public void redact(Blackhole blackhole) {
		blackhole.consume(engine.redact(automaton, dirtyText));
	}
}
