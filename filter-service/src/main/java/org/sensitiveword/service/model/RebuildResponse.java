package org.sensitiveword.service.model;

import org.sensitiveword.core.registry.RebuildResult;

import java.util.Locale;

public record RebuildResponse(
		String status,
		String detail
) {
	public static RebuildResponse from(RebuildResult result) {
		return new RebuildResponse(result.status().name().toLowerCase(Locale.ROOT), result.detail());
	}
}
