package com.boxoffice.enrichment;

import lombok.extern.slf4j.Slf4j;

/**
 * Ceiling on the number of network calls this process may make against the lookup API.
 *
 * <p>Every HTTP attempt, retries included, consumes one unit. The counter only grows; a
 * budget of {@code 0} allows no calls at all. Single-threaded by contract, like the rest of
 * the enrichment path.</p>
 */
@Slf4j
public class RequestBudget {

    private final int limit;
    private long used;

    public RequestBudget(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        this.limit = limit;
    }

    /**
     * Consumes one unit if any are left.
     *
     * @return {@code false} when the ceiling has been reached; nothing is consumed then
     */
    public boolean tryAcquire() {
        if (used >= limit) {
            return false;
        }
        used++;
        if (used == limit) {
            log.debug("Last request of the daily limit ({}) granted", limit);
        }
        return true;
    }

    public boolean isExhausted() {
        return used >= limit;
    }

    public int getLimit() {
        return limit;
    }

    public long getUsed() {
        return used;
    }

    public long getRemaining() {
        return limit - used;
    }
}
