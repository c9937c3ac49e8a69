package com.boxoffice.enrichment;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * A successfully transported (HTTP 2xx) lookup API response, classified before any field
 * is read. The raw map never leaves the enricher; {@link ApiEnricher} turns a
 * {@link Kind#MATCH} into the typed payload straight away.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LookupResponse {

    public enum Kind {
        /** Well-formed, carries data. */
        MATCH,
        /** Well-formed, the service says the subject does not exist. */
        NOT_FOUND,
        /** Not a JSON object; retryable. */
        MALFORMED
    }

    private final Kind kind;
    private final Map<String, Object> body;
    private final String detail;

    public static LookupResponse match(Map<String, Object> body) {
        return new LookupResponse(Kind.MATCH, body, null);
    }

    public static LookupResponse notFound(Map<String, Object> body) {
        return new LookupResponse(Kind.NOT_FOUND, body, null);
    }

    public static LookupResponse malformed(String detail) {
        return new LookupResponse(Kind.MALFORMED, Map.of(), detail);
    }
}
