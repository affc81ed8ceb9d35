package org.sensitiveword.core.dictionary;

import java.io.IOException;

/**
 * Indicates the word-list source could not be read (missing file, permission error, invalid UTF-8).
 */
public class SourceUnavailableException extends IOException {
	public SourceUnavailableException(String message) {
		super(message);
	}

	public SourceUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
