package com.boxoffice.pipeline;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a release-year hint out of free-form title text.
 *
 * <p>The first (leftmost) 4-digit run in 1900–2029 wins, wherever it sits, so
 * {@code "The Polar Express2017 IMAX Release"} yields {@code 2017}. A title that carries
 * an unrelated year-like number gets a wrong hint; that is accepted.</p>
 */
public final class YearHintExtractor {

    private static final Pattern YEAR = Pattern.compile("(19\\d{2}|20[0-2]\\d)");

    private YearHintExtractor() {
    }

    /**
     * @return the hinted year, or {@code null} when the title has none
     */
    public static Integer extract(String title) {
        if (title == null) {
            return null;
        }
        Matcher matcher = YEAR.matcher(title);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }
}
