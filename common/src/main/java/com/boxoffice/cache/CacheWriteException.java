package com.boxoffice.cache;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * A cache entry could not be written to disk. Fatal: continuing would lose the entry and
 * pay for the same lookup again on the next run.
 */
public class CacheWriteException extends UncheckedIOException {

    public CacheWriteException(String message, IOException cause) {
        super(message, cause);
    }
}
