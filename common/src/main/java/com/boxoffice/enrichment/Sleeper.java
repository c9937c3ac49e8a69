package com.boxoffice.enrichment;

/**
 * Blocking pause between lookup attempts. Swapped out in tests to observe backoff without
 * waiting for it.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
