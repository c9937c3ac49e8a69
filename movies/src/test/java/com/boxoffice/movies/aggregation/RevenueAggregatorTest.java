package com.boxoffice.movies.aggregation;

import com.boxoffice.movies.model.RankedMovie;
import com.boxoffice.movies.model.RevenueObservation;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RevenueAggregatorTest {

    private final RevenueAggregator aggregator = new RevenueAggregator();

    @Test
    void sumsPerTitleAndRanksDescending() {
        List<RevenueObservation> observations = List.of(
                observation("A", "100", "2023-01-01"),
                observation("B", "200", "2023-01-01"),
                observation("A", "50", "2023-01-02"));

        List<RankedMovie> ranked = aggregator.rank(observations);

        assertThat(ranked).extracting(RankedMovie::getTitle).containsExactly("B", "A");
        assertThat(ranked.get(0).getTotalRevenue()).isEqualByComparingTo("200");
        assertThat(ranked.get(1).getTotalRevenue()).isEqualByComparingTo("150");
    }

    @Test
    void topNTruncates() {
        List<RevenueObservation> observations = List.of(
                observation("A", "100", "2023-01-01"),
                observation("B", "200", "2023-01-01"),
                observation("A", "50", "2023-01-02"));

        List<RankedMovie> ranked = aggregator.rank(observations, 1);

        assertThat(ranked).singleElement().satisfies(movie -> {
            assertThat(movie.getTitle()).isEqualTo("B");
            assertThat(movie.getTotalRevenue()).isEqualByComparingTo("200");
        });
    }

    @Test
    void totalsAreConservedExactly() {
        List<RevenueObservation> observations = List.of(
                observation("A", "0.10", "2023-01-01"),
                observation("A", "0.20", "2023-01-02"),
                observation("B", "1000000000000.01", "2023-01-01"),
                observation("C", "0", "2023-01-01"));

        List<RankedMovie> ranked = aggregator.rank(observations);

        BigDecimal total = ranked.stream().map(RankedMovie::getTotalRevenue).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(total).isEqualByComparingTo("1000000000000.31");
        assertThat(ranked.get(1).getTotalRevenue()).isEqualByComparingTo("0.30");
    }

    @Test
    void tiesKeepFirstSeenOrder() {
        List<RevenueObservation> observations = List.of(
                observation("Second", "10", "2023-01-01"),
                observation("First", "10", "2023-01-01"),
                observation("Top", "99", "2023-01-01"),
                observation("Third", "10", "2023-01-01"));

        assertThat(aggregator.rank(observations)).extracting(RankedMovie::getTitle)
                .containsExactly("Top", "Second", "First", "Third");
    }

    @Test
    void titlesAreGroupedVerbatim() {
        List<RevenueObservation> observations = List.of(
                observation("Heat", "1", "2023-01-01"),
                observation("HEAT", "1", "2023-01-01"));

        assertThat(aggregator.rank(observations)).hasSize(2);
    }

    @Test
    void tracksObservedDateRange() {
        List<RevenueObservation> observations = List.of(
                observation("A", "1", "2023-03-05"),
                observation("A", "1", "2023-01-01"),
                observation("A", "1", "2023-02-10"));

        RankedMovie movie = aggregator.rank(observations).get(0);

        assertThat(movie.getFirstObservedDate()).isEqualTo(LocalDate.of(2023, 1, 1));
        assertThat(movie.getLastObservedDate()).isEqualTo(LocalDate.of(2023, 3, 5));
    }

    @Test
    void emptyInputAndOversizedTopN() {
        assertThat(aggregator.rank(List.of(), 10)).isEmpty();
        assertThat(aggregator.rank(List.of(observation("A", "1", "2023-01-01")), 10)).hasSize(1);
        assertThat(aggregator.rank(List.of(observation("A", "1", "2023-01-01")), 0)).isEmpty();
    }

    @Test
    void negativeTopNIsRejected() {
        assertThatThrownBy(() -> aggregator.rank(List.of(), -1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static RevenueObservation observation(String title, String revenue, String date) {
        return RevenueObservation.builder()
                .id(title + "-" + date)
                .observationDate(LocalDate.parse(date))
                .title(title)
                .revenue(new BigDecimal(revenue))
                .build();
    }
}
