package org.sensitiveword.core.registry;

public record RegistryStats(
		boolean ready,
		long generation,
		String origin,
		int wordCount,
		int stateCount,
		String publishedAt,
		long indexSizeBytes,
		String lastRebuildError
) {}
