package org.sensitiveword.core.matcher;

/**
 * Thrown when an automaton cannot be compiled from a dictionary. Not recoverable.
 */
public class MatcherBuildException extends IllegalStateException {
	public MatcherBuildException(String message) {
		super(message);
	}

	public MatcherBuildException(String message, Throwable cause) {
		super(message, cause);
	}
}
