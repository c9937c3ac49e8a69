package com.boxoffice.cache;

import com.boxoffice.model.ResultKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One cached lookup outcome. Exactly one of three variants, told apart by {@link #getResultKind()}:
 * <ul>
 *   <li>{@link ResultKind#MATCH} carries the parsed {@code payload}</li>
 *   <li>{@link ResultKind#NOT_FOUND} carries nothing beyond the title and timestamp</li>
 *   <li>{@link ResultKind#ERROR} carries the last failure message</li>
 * </ul>
 *
 * <p>Entries are immutable; all three are terminal for their key.</p>
 *
 * @param <T> the metadata payload type
 */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class CacheEntry<T> {

    private String title;
    private ResultKind resultKind;
    private Instant cachedAt;
    private T payload;
    private String errorMessage;

    private CacheEntry(String title, ResultKind resultKind, Instant cachedAt,
                       T payload, String errorMessage) {
        this.title = title;
        this.resultKind = resultKind;
        this.cachedAt = cachedAt;
        this.payload = payload;
        this.errorMessage = errorMessage;
    }

    public static <T> CacheEntry<T> matched(String title, T payload, Instant cachedAt) {
        if (payload == null) {
            throw new IllegalArgumentException("A matched entry needs a payload");
        }
        return new CacheEntry<>(title, ResultKind.MATCH, cachedAt, payload, null);
    }

    public static <T> CacheEntry<T> notFound(String title, Instant cachedAt) {
        return new CacheEntry<>(title, ResultKind.NOT_FOUND, cachedAt, null, null);
    }

    public static <T> CacheEntry<T> error(String title, String errorMessage, Instant cachedAt) {
        return new CacheEntry<>(title, ResultKind.ERROR, cachedAt, null, errorMessage);
    }

    @JsonIgnore
    public boolean isMatch() {
        return resultKind == ResultKind.MATCH;
    }
}
