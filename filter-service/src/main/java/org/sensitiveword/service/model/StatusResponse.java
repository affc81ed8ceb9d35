package org.sensitiveword.service.model;

import org.sensitiveword.core.registry.RegistryStats;

public record StatusResponse(
		String status,
		boolean matcherReady,
		long generation,
		String origin,
		int wordCount,
		int stateCount,
		String publishedAt,
		long indexSizeBytes,
		String lastRebuildError
) {
	public static StatusResponse running(RegistryStats stats) {
		return new StatusResponse(
				"Service is running",
				stats.ready(),
				stats.generation(),
				stats.origin(),
				stats.wordCount(),
				stats.stateCount(),
				stats.publishedAt(),
				stats.indexSizeBytes(),
				stats.lastRebuildError()
		);
	}
}
