package org.sensitiveword.core.registry;

import org.sensitiveword.core.dictionary.Dictionary;
import org.sensitiveword.core.dictionary.DictionaryLoader;
import org.sensitiveword.core.dictionary.SourceUnavailableException;
import org.sensitiveword.core.index.IndexStore;
import org.sensitiveword.core.index.IndexStoreException;
import org.sensitiveword.core.matcher.Automaton;
import org.sensitiveword.core.matcher.AutomatonBuilder;
import org.sensitiveword.core.matcher.MatcherBuildException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the active automaton and swaps it on rebuild.
 *
 * <p>Readers call {@link #current()} and keep working on the returned snapshot for as long as they need it;
 * they never take a lock. Rebuilds are serialized among themselves, compile the replacement off to the side
 * and publish it with a single reference swap, so a snapshot already handed out stays valid.</p>
 *
 * <p>Lifecycle: uninitialized until {@link #initialize(boolean)} succeeds, ready afterwards. A failed
 * {@link #rebuild()} leaves the active snapshot untouched.</p>
 */
public class MatcherRegistry {
	private static final Logger logger = LoggerFactory.getLogger(MatcherRegistry.class);

	private final DictionaryLoader dictionaryLoader;
	private final AutomatonBuilder automatonBuilder;
	private final IndexStore indexStore;
	private final Path dictionaryPath;
	private final Path indexPath;

	private final AtomicReference<MatcherSnapshot> active = new AtomicReference<>();
	private final AtomicLong generations = new AtomicLong();
	private final ReentrantLock rebuildLock = new ReentrantLock();
	private volatile String lastRebuildError;

	public MatcherRegistry(DictionaryLoader dictionaryLoader, AutomatonBuilder automatonBuilder,
						   IndexStore indexStore, Path dictionaryPath, Path indexPath) {
		this.dictionaryLoader = dictionaryLoader;
		this.automatonBuilder = automatonBuilder;
		this.indexStore = indexStore;
		this.dictionaryPath = dictionaryPath;
		this.indexPath = indexPath;
	}

	/**
	 * Publish the first snapshot, from the index file when possible, otherwise from the dictionary.
	 *
	 * @param forceRebuild build from the dictionary even if a valid index file exists
	 * @throws IllegalStateException if neither source yields an automaton
	 */
	public void initialize(boolean forceRebuild) {
		rebuildLock.lock();
		try {
			boolean indexUsable = indexStore.exists(indexPath);
			if (!forceRebuild && indexUsable) {
				logger.info("Loading existing index from {}", indexPath);
				try {
					publish(indexStore.load(indexPath), MatcherSnapshot.Origin.LOADED);
					return;
				} catch (IndexStoreException e) {
					logger.error("Failed to load index: {}, will build from source", e.getMessage());
					indexUsable = false;
				}
			}

			Dictionary dictionary;
			try {
				dictionary = dictionaryLoader.load(dictionaryPath);
			} catch (SourceUnavailableException e) {
				if (forceRebuild && indexUsable) {
					logger.warn("Forced rebuild impossible ({}), falling back to existing index", e.getMessage());
					try {
						publish(indexStore.load(indexPath), MatcherSnapshot.Origin.LOADED);
						return;
					} catch (IndexStoreException loadFailure) {
						e.addSuppressed(loadFailure);
					}
				}
				throw new IllegalStateException("No usable matcher: " + e.getMessage(), e);
			}

			Automaton automaton = automatonBuilder.build(dictionary);
			try {
				indexStore.save(automaton, indexPath);
			} catch (IndexStoreException e) {
				logger.error("Failed to persist index, serving the in-memory automaton: {}", e.getMessage());
			}
			publish(automaton, MatcherSnapshot.Origin.BUILT);
		} finally {
			rebuildLock.unlock();
		}
	}

	/**
	 * Reload the dictionary, recompile, persist and publish.
	 *
	 * <p>Never throws for source or store problems; they are returned as a failed result and the previous
	 * snapshot keeps serving.</p>
	 */
	public RebuildResult rebuild() {
		rebuildLock.lock();
		try {
			logger.info("Rebuilding index from {}", dictionaryPath);
			Dictionary dictionary = dictionaryLoader.load(dictionaryPath);
			Automaton automaton = automatonBuilder.build(dictionary);
			indexStore.save(automaton, indexPath);
			MatcherSnapshot snapshot = publish(automaton, MatcherSnapshot.Origin.BUILT);
			lastRebuildError = null;
			return RebuildResult.success("Index rebuilt successfully: " + automaton.patternCount()
					+ " words, generation " + snapshot.generation());
		} catch (SourceUnavailableException | IndexStoreException | MatcherBuildException e) {
			lastRebuildError = e.getMessage();
			logger.warn("Failed to rebuild index: {}", e.getMessage());
			return RebuildResult.failure(e.getMessage());
		} finally {
			rebuildLock.unlock();
		}
	}

	/**
	 * The active snapshot
	 *
	 * @throws IllegalStateException before {@link #initialize(boolean)} has succeeded
	 */
	public MatcherSnapshot current() {
		MatcherSnapshot snapshot = active.get();
		if (snapshot == null) {
			throw new IllegalStateException("Matcher registry is not initialized");
		}
		return snapshot;
	}

	public boolean isReady() {
		return active.get() != null;
	}

	public RegistryStats stats() {
		MatcherSnapshot snapshot = active.get();
		long indexSize = indexStore.sizeInBytes(indexPath);
		if (snapshot == null) {
			return new RegistryStats(false, 0, null, 0, 0, null, indexSize, lastRebuildError);
		}
		return new RegistryStats(
				true,
				snapshot.generation(),
				snapshot.origin().name(),
				snapshot.automaton().patternCount(),
				snapshot.automaton().stateCount(),
				snapshot.publishedAt().toString(),
				indexSize,
				lastRebuildError
		);
	}

	public Path getDictionaryPath() {
		return dictionaryPath;
	}

	public Path getIndexPath() {
		return indexPath;
	}

	private MatcherSnapshot publish(Automaton automaton, MatcherSnapshot.Origin origin) {
		MatcherSnapshot snapshot = new MatcherSnapshot(automaton, origin, generations.incrementAndGet(), Instant.now());
		active.set(snapshot);
		logger.info("Published matcher generation {} ({}, {} words)",
				snapshot.generation(), origin, automaton.patternCount());
		return snapshot;
	}
}
