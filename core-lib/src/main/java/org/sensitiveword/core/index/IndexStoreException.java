package org.sensitiveword.core.index;

import java.io.IOException;

/**
 * Base failure of the persisted index. Callers recover by rebuilding from the dictionary source.
 */
public class IndexStoreException extends IOException {
	public IndexStoreException(String message) {
		super(message);
	}

	public IndexStoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
