package com.boxoffice.movies.aggregation;

import com.boxoffice.movies.model.RankedMovie;
import com.boxoffice.movies.model.RevenueObservation;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sums revenue per exact title and ranks the titles by total, highest first.
 *
 * <p>Titles are grouped verbatim: no case folding, no trimming beyond what the reader
 * did. Equal totals keep the order in which their titles were first seen. Memory grows
 * with the number of distinct titles, not with the number of observations.</p>
 */
@Slf4j
public class RevenueAggregator {

    private static final Comparator<RankedMovie> BY_TOTAL_DESC =
            Comparator.comparing(RankedMovie::getTotalRevenue).reversed();

    public List<RankedMovie> rank(Iterable<RevenueObservation> observations) {
        return rank(observations, null);
    }

    /**
     * @param topN maximum number of titles to return; {@code null} returns all of them
     */
    public List<RankedMovie> rank(Iterable<RevenueObservation> observations, Integer topN) {
        if (topN != null && topN < 0) {
            throw new IllegalArgumentException("topN must not be negative, got " + topN);
        }

        Map<String, Totals> byTitle = new LinkedHashMap<>();
        for (RevenueObservation observation : observations) {
            byTitle.computeIfAbsent(observation.getTitle(), t -> new Totals())
                    .add(observation.getRevenue(), observation.getObservationDate());
        }

        List<RankedMovie> ranked = new ArrayList<>(byTitle.size());
        byTitle.forEach((title, totals) -> ranked.add(
                new RankedMovie(title, totals.revenue, totals.first, totals.last)));
        // List.sort is stable, so ties stay in first-seen order
        ranked.sort(BY_TOTAL_DESC);

        List<RankedMovie> top = topN == null || topN >= ranked.size()
                ? ranked
                : new ArrayList<>(ranked.subList(0, topN));
        log.info("Found {} unique movies, returning top {}", ranked.size(), top.size());
        return top;
    }

    private static final class Totals {
        BigDecimal revenue = BigDecimal.ZERO;
        LocalDate first;
        LocalDate last;

        void add(BigDecimal amount, LocalDate date) {
            revenue = revenue.add(amount);
            if (first == null || date.isBefore(first)) {
                first = date;
            }
            if (last == null || date.isAfter(last)) {
                last = date;
            }
        }
    }
}
