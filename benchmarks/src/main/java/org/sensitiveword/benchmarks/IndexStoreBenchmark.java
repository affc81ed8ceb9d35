package org.sensitiveword.benchmarks;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.sensitiveword.core.dictionary.Dictionary;
import org.sensitiveword.core.index.BinaryIndexStore;
import org.sensitiveword.core.index.IndexStoreException;
import org.sensitiveword.core.matcher.Automaton;
import org.sensitiveword.core.matcher.AutomatonBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Benchmarks for index persistence
 * Tests: save, load
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class IndexStoreBenchmark {

	private static final String BENCHMARK_INDEX_DIR = "./benchmark-indexes";

	private BinaryIndexStore store;
	private Automaton automaton;
	private Path savePath;
	private Path loadPath;

	@Param({"1000", "10000", "100000"})
	private int wordCount;

	@Setup(Level.Trial)
	public void setup() throws IOException {
		System.out.println("=== Index Store Benchmark Setup (wordCount=" + wordCount + ") ===");

		List<String> words = new ArrayList<>(wordCount);
		for (int i = 0; i < wordCount; i++) {
			words.add("敏感词" + Integer.toString(i, 36));
		}
		automaton = new AutomatonBuilder().build(Dictionary.of(words));
		store = new BinaryIndexStore();

		Path dir = Files.createDirectories(Paths.get(BENCHMARK_INDEX_DIR));
		savePath = dir.resolve("save_" + wordCount + ".bin");
		loadPath = dir.resolve("load_" + wordCount + ".bin");
		store.save(automaton, loadPath);

		System.out.println("Index ready: " + store.sizeInBytes(loadPath) + " bytes");
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		Path indexDir = Paths.get(BENCHMARK_INDEX_DIR);
		if (!Files.exists(indexDir)) {
			return;
		}
		try (Stream<Path> paths = Files.walk(indexDir)) {
			for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
				Files.deleteIfExists(path);
			}
		}
	}

	/**
	 * Benchmark: encode and atomically publish the index file
	 */
	@Benchmark
	public void save() throws IndexStoreException {
		store.save(automaton, savePath);
	}

	/**
	 * Benchmark: read, verify and decode the index file
	 */
	@Benchmark
	public void load(Blackhole blackhole) throws IndexStoreException {
		blackhole.consume(store.load(loadPath));
	}
}
