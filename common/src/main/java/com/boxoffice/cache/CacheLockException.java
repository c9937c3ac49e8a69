package com.boxoffice.cache;

/**
 * Another process (or another cache instance in this JVM) already holds the cache file.
 */
public class CacheLockException extends RuntimeException {

    public CacheLockException(String message) {
        super(message);
    }

    public CacheLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
