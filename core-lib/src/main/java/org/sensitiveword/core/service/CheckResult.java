package org.sensitiveword.core.service;

import java.util.List;

public record CheckResult(
		boolean containsSensitive,
		List<String> words
) {}
