package com.boxoffice.movies.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A distinct title with its revenue summed over every observation of it.
 */
@Value
public class RankedMovie {

    String title;
    BigDecimal totalRevenue;
    LocalDate firstObservedDate;
    LocalDate lastObservedDate;
}
