package com.boxoffice.movies.model;

import com.boxoffice.model.ResultKind;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Movie metadata returned by OMDb, normalised: every field the service reported as
 * {@code "N/A"} or left out is {@code null}.
 *
 * <p>Stored as the payload of matched cache entries and loaded into the
 * {@code stg_movies_enriched} warehouse index, both in snake_case.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MovieMetadata {

    private String title;
    private String year;
    private String rated;
    private String released;
    private String runtime;
    private String genre;
    private String director;
    private String actors;
    private String plot;
    private String language;
    private String country;
    private String awards;
    private String posterUrl;
    private Integer metascore;
    private Double imdbRating;
    private Long imdbVotes;
    private String imdbId;
    private String boxOffice;

    private Instant enrichedAt;

    @JsonProperty("api_response_type")
    private ResultKind resultKind;
}
