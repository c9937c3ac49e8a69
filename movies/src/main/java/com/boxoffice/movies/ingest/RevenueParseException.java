package com.boxoffice.movies.ingest;

/**
 * A single revenue row could not be turned into an observation. The reader logs it and
 * moves on to the next row.
 */
public class RevenueParseException extends Exception {

    private final long rowNumber;

    public RevenueParseException(long rowNumber, String message) {
        super("Row " + rowNumber + ": " + message);
        this.rowNumber = rowNumber;
    }

    public RevenueParseException(long rowNumber, String message, Throwable cause) {
        super("Row " + rowNumber + ": " + message, cause);
        this.rowNumber = rowNumber;
    }

    public long getRowNumber() {
        return rowNumber;
    }
}
