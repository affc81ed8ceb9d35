package org.sensitiveword.core.service;

import org.sensitiveword.core.filter.FilterEngine;
import org.sensitiveword.core.matcher.Automaton;
import org.sensitiveword.core.registry.MatcherRegistry;
import org.sensitiveword.core.registry.RebuildResult;
import org.sensitiveword.core.registry.RegistryStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The operations offered to the request-handling layer: check, filter and rebuild.
 *
 * <p>Every call reads the registry's snapshot once and runs entirely against it, so a rebuild that
 * completes midway does not change the result of a request already in progress.</p>
 */
public class SensitiveWordService {
	private static final Logger logger = LoggerFactory.getLogger(SensitiveWordService.class);

	private final MatcherRegistry registry;
	private final FilterEngine filterEngine;

	public SensitiveWordService(MatcherRegistry registry, FilterEngine filterEngine) {
		this.registry = registry;
		this.filterEngine = filterEngine;
	}

	public CheckResult check(String text) {
		Automaton automaton = registry.current().automaton();
		List<String> words = filterEngine.matchedWords(automaton, text);
		logger.debug("Checked {} chars, {} sensitive words found", text.length(), words.size());
		return new CheckResult(!words.isEmpty(), words);
	}

	public FilterResult filter(String text) {
		Automaton automaton = registry.current().automaton();
		return new FilterResult(filterEngine.redact(automaton, text));
	}

	public RebuildResult rebuild() {
		return registry.rebuild();
	}

	public RegistryStats getStats() {
		return registry.stats();
	}
}
