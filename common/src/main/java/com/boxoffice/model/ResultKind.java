package com.boxoffice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal outcome of a metadata lookup, as stored in the cache and on enriched records.
 */
public enum ResultKind {

    MATCH("match"),
    NOT_FOUND("not_found"),
    ERROR("error");

    private final String wireName;

    ResultKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ResultKind fromWireName(String value) {
        for (ResultKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown result kind: " + value);
    }
}
