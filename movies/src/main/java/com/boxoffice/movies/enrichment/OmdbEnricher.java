package com.boxoffice.movies.enrichment;

import com.boxoffice.enrichment.ApiEnricher;
import com.boxoffice.model.ResultKind;
import com.boxoffice.movies.model.MovieMetadata;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Looks movies up by title on the OMDb API.
 *
 * <p>Sends {@code apikey}, {@code t}, {@code type=movie}, {@code plot=short} and, when a
 * year hint exists, {@code y}. OMDb answers HTTP 200 with {@code "Response": "False"} for
 * titles it does not know; that is a not-found, not an error.</p>
 *
 * <p>Configured via {@code enricher.className: com.boxoffice.movies.enrichment.OmdbEnricher}.
 * The {@code plot} property overrides the plot length.</p>
 */
@Slf4j
public class OmdbEnricher extends ApiEnricher<MovieMetadata> {

    static final String RESPONSE_FIELD = "Response";

    @Override
    public Class<MovieMetadata> getPayloadType() {
        return MovieMetadata.class;
    }

    @Override
    public Map<String, String> mapToRequest(String title, Integer year) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("apikey", getConfig().getApiKey());
        params.put("t", title);
        params.put("type", "movie");
        params.put("plot", getConfig().getProperty("plot", "short"));
        if (year != null) {
            params.put("y", String.valueOf(year));
        }
        return params;
    }

    @Override
    public boolean isNotFound(Map<String, Object> apiResponse) {
        Object response = apiResponse.get(RESPONSE_FIELD);
        return response != null && "False".equalsIgnoreCase(response.toString().trim());
    }

    @Override
    public MovieMetadata mapFromResponse(String title, Map<String, Object> apiResponse) {
        String reportedTitle = OmdbFields.text(apiResponse.get("Title"));
        if (reportedTitle == null) {
            log.debug("OMDb match for '{}' has no Title, keeping the queried one", title);
        }
        return MovieMetadata.builder()
                .title(reportedTitle != null ? reportedTitle : title)
                .year(OmdbFields.text(apiResponse.get("Year")))
                .rated(OmdbFields.text(apiResponse.get("Rated")))
                .released(OmdbFields.text(apiResponse.get("Released")))
                .runtime(OmdbFields.text(apiResponse.get("Runtime")))
                .genre(OmdbFields.text(apiResponse.get("Genre")))
                .director(OmdbFields.text(apiResponse.get("Director")))
                .actors(OmdbFields.text(apiResponse.get("Actors")))
                .plot(OmdbFields.text(apiResponse.get("Plot")))
                .language(OmdbFields.text(apiResponse.get("Language")))
                .country(OmdbFields.text(apiResponse.get("Country")))
                .awards(OmdbFields.text(apiResponse.get("Awards")))
                .posterUrl(OmdbFields.text(apiResponse.get("Poster")))
                .metascore(OmdbFields.integer(apiResponse.get("Metascore")))
                .imdbRating(OmdbFields.decimal(apiResponse.get("imdbRating")))
                .imdbVotes(OmdbFields.votes(apiResponse.get("imdbVotes")))
                .imdbId(OmdbFields.text(apiResponse.get("imdbID")))
                .boxOffice(OmdbFields.text(apiResponse.get("BoxOffice")))
                .enrichedAt(clock.instant())
                .resultKind(ResultKind.MATCH)
                .build();
    }
}
