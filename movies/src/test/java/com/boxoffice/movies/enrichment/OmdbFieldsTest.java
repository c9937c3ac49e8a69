package com.boxoffice.movies.enrichment;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OmdbFieldsTest {

    @Test
    void notAvailableAndBlankBecomeNull() {
        assertThat(OmdbFields.text("N/A")).isNull();
        assertThat(OmdbFields.text("  ")).isNull();
        assertThat(OmdbFields.text(null)).isNull();
        assertThat(OmdbFields.text(" Drama ")).isEqualTo("Drama");
    }

    @Test
    void numbersParseOrBecomeNull() {
        assertThat(OmdbFields.integer("74")).isEqualTo(74);
        assertThat(OmdbFields.integer("N/A")).isNull();
        assertThat(OmdbFields.integer("seventy")).isNull();
        assertThat(OmdbFields.decimal("8.3")).isEqualTo(8.3);
        assertThat(OmdbFields.decimal("N/A")).isNull();
    }

    @Test
    void votesDropThousandsSeparators() {
        assertThat(OmdbFields.votes("1,234,567")).isEqualTo(1_234_567L);
        assertThat(OmdbFields.votes("N/A")).isNull();
        assertThat(OmdbFields.votes("lots")).isNull();
    }
}
