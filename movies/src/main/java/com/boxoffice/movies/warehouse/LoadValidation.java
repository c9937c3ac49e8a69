package com.boxoffice.movies.warehouse;

import lombok.Value;

/**
 * Post-load check of one warehouse alias: either a document count or the error that
 * prevented counting.
 */
@Value
public class LoadValidation {

    String alias;
    Long documentCount;
    String error;

    public static LoadValidation counted(String alias, long documentCount) {
        return new LoadValidation(alias, documentCount, null);
    }

    public static LoadValidation failed(String alias, String error) {
        return new LoadValidation(alias, null, error);
    }

    public boolean isSuccessful() {
        return error == null;
    }
}
