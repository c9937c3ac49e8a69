package com.boxoffice.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;

/**
 * Normalised {@code (title, year)} pair addressing both the cache and the lookup API.
 *
 * <p>The title is lower-cased and trimmed. A year-less and a year-qualified lookup of the
 * same title are distinct keys and are cached independently.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LookupKey {

    private static final char YEAR_SEPARATOR = '|';

    String normalizedTitle;
    Integer year;

    public static LookupKey of(String title, Integer year) {
        if (title == null) {
            throw new IllegalArgumentException("title must not be null");
        }
        return new LookupKey(title.trim().toLowerCase(Locale.ROOT), year);
    }

    public boolean hasYear() {
        return year != null;
    }

    /** The string form used as the key in the cache file, e.g. {@code "the dark knight|2008"}. */
    public String asCacheKey() {
        return year == null ? normalizedTitle : normalizedTitle + YEAR_SEPARATOR + year;
    }

    @Override
    public String toString() {
        return asCacheKey();
    }
}
