package org.sensitiveword.core.index;

/**
 * The index file was written with a different format version than this build reads.
 */
public class VersionMismatchException extends IndexStoreException {
	private final int foundVersion;
	private final int expectedVersion;

	public VersionMismatchException(int foundVersion, int expectedVersion) {
		super("Index format version " + foundVersion + " does not match expected version " + expectedVersion);
		this.foundVersion = foundVersion;
		this.expectedVersion = expectedVersion;
	}

	public int getFoundVersion() {
		return foundVersion;
	}

	public int getExpectedVersion() {
		return expectedVersion;
	}
}
