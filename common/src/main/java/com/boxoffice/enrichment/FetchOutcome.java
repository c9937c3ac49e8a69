package com.boxoffice.enrichment;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one {@link Enricher#resolve} call.
 *
 * <p>{@link Status#MATCHED}, {@link Status#NOT_FOUND} and {@link Status#ERROR} are terminal
 * and get cached by the caller. {@link Status#SKIPPED} means no lookup was completed because
 * the request budget ran out (or the thread was interrupted) and must not be cached.</p>
 *
 * @param <T> the metadata payload type
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchOutcome<T> {

    public enum Status {
        MATCHED,
        NOT_FOUND,
        ERROR,
        SKIPPED
    }

    private final Status status;
    private final T payload;
    private final String message;
    /** HTTP attempts made for this lookup. */
    private final int attempts;

    public static <T> FetchOutcome<T> matched(T payload, int attempts) {
        return new FetchOutcome<>(Status.MATCHED, payload, null, attempts);
    }

    public static <T> FetchOutcome<T> notFound(int attempts) {
        return new FetchOutcome<>(Status.NOT_FOUND, null, null, attempts);
    }

    public static <T> FetchOutcome<T> error(String message, int attempts) {
        return new FetchOutcome<>(Status.ERROR, null, message, attempts);
    }

    public static <T> FetchOutcome<T> skipped(String message, int attempts) {
        return new FetchOutcome<>(Status.SKIPPED, null, message, attempts);
    }

    public boolean isTerminal() {
        return status != Status.SKIPPED;
    }
}
