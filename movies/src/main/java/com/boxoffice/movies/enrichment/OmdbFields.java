package com.boxoffice.movies.enrichment;

/**
 * Normalisation of raw OMDb field values. OMDb reports absent values as {@code "N/A"};
 * those, blanks and anything that does not parse become {@code null}.
 */
final class OmdbFields {

    static final String NOT_AVAILABLE = "N/A";

    private OmdbFields() {
    }

    static String text(Object raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.toString().trim();
        return value.isEmpty() || NOT_AVAILABLE.equalsIgnoreCase(value) ? null : value;
    }

    static Integer integer(Object raw) {
        String value = text(raw);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Double decimal(Object raw) {
        String value = text(raw);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Vote counts come formatted with thousands separators, e.g. {@code "1,234,567"}. */
    static Long votes(Object raw) {
        String value = text(raw);
        if (value == null) {
            return null;
        }
        try {
            return Long.valueOf(value.replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
