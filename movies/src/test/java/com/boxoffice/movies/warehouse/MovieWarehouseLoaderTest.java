package com.boxoffice.movies.warehouse;

import com.boxoffice.config.ElasticsearchConfig;
import com.boxoffice.elasticsearch.ElasticsearchService;
import com.boxoffice.elasticsearch.WarehouseLoadException;
import com.boxoffice.movies.model.MovieMetadata;
import com.boxoffice.movies.model.RevenueObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MovieWarehouseLoaderTest {

    @Mock
    private ElasticsearchService elasticsearch;

    private MovieWarehouseLoader loader;

    @BeforeEach
    void setUp() {
        loader = new MovieWarehouseLoader(elasticsearch, new ElasticsearchConfig());
    }

    @Test
    @SuppressWarnings("unchecked")
    void revenuesAreKeyedByRowId() {
        RevenueObservation row = RevenueObservation.builder()
                .id("r-17").observationDate(LocalDate.of(2023, 1, 1)).title("Heat").revenue(BigDecimal.TEN)
                .build();
        when(elasticsearch.replaceAlias(eq("stg_revenues_raw"), anyList(), any())).thenReturn(1);

        assertThat(loader.loadRevenues(List.of(row))).isEqualTo(1);

        ArgumentCaptor<Function<RevenueObservation, String>> idOf = ArgumentCaptor.forClass(Function.class);
        verify(elasticsearch).replaceAlias(eq("stg_revenues_raw"), eq(List.of(row)), idOf.capture());
        assertThat(idOf.getValue().apply(row)).isEqualTo("r-17");
    }

    @Test
    @SuppressWarnings("unchecked")
    void moviesSharingImdbIdAreAllLoaded() {
        MovieMetadata original = MovieMetadata.builder().title("Heat").imdbId("tt0113277").build();
        MovieMetadata rerelease = MovieMetadata.builder().title("Heat").imdbId("tt0113277").build();
        when(elasticsearch.replaceAlias(eq("stg_movies_enriched"), anyList(), any())).thenReturn(2);

        assertThat(loader.loadMovies(List.of(original, rerelease))).isEqualTo(2);

        ArgumentCaptor<Function<MovieMetadata, String>> idOf = ArgumentCaptor.forClass(Function.class);
        verify(elasticsearch).replaceAlias(eq("stg_movies_enriched"), eq(List.of(original, rerelease)),
                idOf.capture());
        assertThat(idOf.getValue().apply(original)).isNull();
        assertThat(idOf.getValue().apply(rerelease)).isNull();
    }

    @Test
    void loadFailurePropagates() {
        when(elasticsearch.replaceAlias(eq("stg_movies_enriched"), anyList(), any()))
                .thenThrow(new WarehouseLoadException("bulk rejected"));

        assertThatThrownBy(() -> loader.loadMovies(List.of())).isInstanceOf(WarehouseLoadException.class);
    }

    @Test
    void validationRecordsPerAliasFailures() throws IOException {
        when(elasticsearch.count("stg_revenues_raw")).thenReturn(1200L);
        when(elasticsearch.count("stg_movies_enriched")).thenThrow(new IOException("index_not_found"));

        Map<String, LoadValidation> results = loader.validateLoad();

        assertThat(results).containsOnlyKeys("stg_revenues_raw", "stg_movies_enriched");
        assertThat(results.get("stg_revenues_raw").isSuccessful()).isTrue();
        assertThat(results.get("stg_revenues_raw").getDocumentCount()).isEqualTo(1200L);
        assertThat(results.get("stg_movies_enriched").isSuccessful()).isFalse();
        assertThat(results.get("stg_movies_enriched").getError()).isEqualTo("index_not_found");
    }
}
