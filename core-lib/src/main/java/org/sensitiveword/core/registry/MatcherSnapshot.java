package org.sensitiveword.core.registry;

import org.sensitiveword.core.matcher.Automaton;

import java.time.Instant;

/**
 * An automaton as published by the registry. Never mutated after publication.
 *
 * @param automaton the compiled matcher
 * @param origin whether it was read from the index file or built from the dictionary
 * @param generation publication counter, starting at 1
 * @param publishedAt publication time
 */
public record MatcherSnapshot(Automaton automaton, Origin origin, long generation, Instant publishedAt) {
	public enum Origin {
		LOADED,
		BUILT
	}
}
