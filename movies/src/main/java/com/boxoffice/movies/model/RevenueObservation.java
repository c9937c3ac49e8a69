package com.boxoffice.movies.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row of the daily revenue file: revenue of one title on one date.
 *
 * <p>{@code id}, {@code observationDate} and {@code title} are always present. Absent
 * {@code theaters} / {@code distributor} values are {@code null} and flagged through
 * {@code hasValidTheaters} / {@code hasValidDistributor}. Serialises to the
 * {@code stg_revenues_raw} warehouse shape.</p>
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RevenueObservation {

    String id;

    @JsonProperty("date")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    LocalDate observationDate;

    String title;

    /** Never negative; zero when the source left it blank. */
    BigDecimal revenue;

    Integer theaters;
    String distributor;

    boolean hasValidTheaters;
    boolean hasValidDistributor;
}
