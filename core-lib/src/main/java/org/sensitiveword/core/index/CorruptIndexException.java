package org.sensitiveword.core.index;

/**
 * The index file is truncated, fails its checksum, or does not decode to a valid automaton.
 */
public class CorruptIndexException extends IndexStoreException {
	public CorruptIndexException(String message) {
		super(message);
	}

	public CorruptIndexException(String message, Throwable cause) {
		super(message, cause);
	}
}
