package org.sensitiveword.core.index;

import org.sensitiveword.core.matcher.Automaton;

import java.nio.file.Path;

public interface IndexStore {
	/**
	 * Persist the automaton; readers never observe a partially written file
	 */
	void save(Automaton automaton, Path path) throws IndexStoreException;

	/**
	 * Read the automaton back, rejecting foreign versions and corrupt content
	 */
	Automaton load(Path path) throws IndexStoreException;

	/**
	 * Check whether an index file is present
	 */
	boolean exists(Path path);

	/**
	 * Get size of the index file in bytes, 0 if absent
	 */
	long sizeInBytes(Path path);
}
