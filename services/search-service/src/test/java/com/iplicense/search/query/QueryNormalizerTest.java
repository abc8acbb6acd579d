package com.iplicense.search.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.iplicense.search.config.SearchConfig;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryNormalizerTest {
    private final QueryNormalizer normalizer = new QueryNormalizer();
    private final SearchConfig config = SearchConfig.builder().build();

    @Test
    void trimsSanitizesAndKeepsOriginalText() {
        SearchQuery query = normalize("  The <Logo>   of   Brand;  ", null);

        assertThat(query.getText()).isEqualTo("The Logo of Brand;");
        assertThat(query.getNormalizedText()).isEqualTo("the logo of brand;");
        assertThat(query.getTokens()).containsExactly("logo", "brand");
    }

    @Test
    void rejectsTooShortAndTooLongText() {
        assertThatThrownBy(() -> normalize(" a ", null)).isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> normalize("x".repeat(201), null)).isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> normalize("<>", null)).isInstanceOf(InvalidSearchRequestException.class);
    }

    @Test
    void defaultsToAllEntityKinds() {
        SearchQuery query = normalize("logo", null);

        assertThat(query.getEntityKinds()).isEqualTo(EnumSet.allOf(EntityKind.class));
    }

    @Test
    void rejectsUnknownEntityKinds() {
        assertThatThrownBy(() -> normalize("logo", List.of("assets", "songs")))
            .isInstanceOf(InvalidSearchRequestException.class)
            .hasMessageContaining("songs");
    }

    @Test
    void clampsPageSizeAndRejectsPageBelowOne() {
        SearchQuery big = normalizer.normalize("logo", null, null, 2, 500, null, null, config);
        SearchQuery small = normalizer.normalize("logo", null, null, null, 0, null, null, config);
        SearchQuery defaulted = normalizer.normalize("logo", null, null, null, null, null, null, config);

        assertThat(big.getPageSize()).isEqualTo(100);
        assertThat(big.getOffset()).isEqualTo(100);
        assertThat(small.getPageSize()).isEqualTo(1);
        assertThat(defaulted.getPageSize()).isEqualTo(20);
        assertThat(defaulted.getPage()).isEqualTo(1);
        assertThatThrownBy(() -> normalizer.normalize("logo", null, null, 0, 10, null, null, config))
            .isInstanceOf(InvalidSearchRequestException.class);
    }

    @Test
    void resolvesSortDirectiveWithFieldDefaults() {
        SearchQuery byTitle = normalizer.normalize("logo", null, null, null, null, "name", null, config);
        SearchQuery byCreated = normalizer.normalize("logo", null, null, null, null, "created_at", "asc", config);

        assertThat(byTitle.getSort()).isEqualTo(new SortDirective(SortField.TITLE, SortOrder.ASC));
        assertThat(byCreated.getSort()).isEqualTo(new SortDirective(SortField.CREATED_AT, SortOrder.ASC));
        assertThatThrownBy(() -> normalizer.normalize("logo", null, null, null, null, "popularity", null, config))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> normalizer.normalize("logo", null, null, null, null, null, "sideways", config))
            .isInstanceOf(InvalidSearchRequestException.class);
    }

    @Test
    void validatesFilters() {
        SearchFilters badAvailability = SearchFilters.builder().availabilityStatus("busy").build();
        SearchFilters badRange = SearchFilters.builder()
            .dateFrom(Instant.parse("2025-02-01T00:00:00Z"))
            .dateTo(Instant.parse("2025-01-01T00:00:00Z"))
            .build();

        assertThatThrownBy(() -> normalizer.normalize("logo", null, badAvailability, null, null, null, null, config))
            .isInstanceOf(InvalidSearchRequestException.class);
        assertThatThrownBy(() -> normalizer.normalize("logo", null, badRange, null, null, null, null, config))
            .isInstanceOf(InvalidSearchRequestException.class);
    }

    @Test
    void stopWordsOnlyAffectTokens() {
        SearchQuery query = normalize("the and", null);

        assertThat(query.getTokens()).isEmpty();
        assertThat(query.getNormalizedText()).isEqualTo("the and");
    }

    @Test
    void facetQueryWithoutTextBrowses() {
        SearchFilters filters = SearchFilters.builder().assetTypes(List.of("IMAGE")).build();

        SearchQuery blank = normalizer.normalizeForFacets(null, List.of("assets"), filters, config);
        SearchQuery tooShort = normalizer.normalizeForFacets(" l ", null, null, config);

        assertThat(blank.isBrowse()).isTrue();
        assertThat(blank.getText()).isEmpty();
        assertThat(blank.getEntityKinds()).containsExactly(EntityKind.ASSETS);
        assertThat(blank.getFilters().getAssetTypes()).containsExactly("IMAGE");
        assertThat(tooShort.isBrowse()).isTrue();
        assertThat(tooShort.getEntityKinds()).isEqualTo(EnumSet.allOf(EntityKind.class));
    }

    @Test
    void facetQueryWithTextIsNormalized() {
        SearchQuery query = normalizer.normalizeForFacets("  Brand <Logo> ", List.of("assets"), null, config);

        assertThat(query.isBrowse()).isFalse();
        assertThat(query.getText()).isEqualTo("Brand Logo");
        assertThat(query.getTokens()).containsExactly("brand", "logo");
    }

    @Test
    void facetQueryStillRejectsUnknownKinds() {
        assertThatThrownBy(() -> normalizer.normalizeForFacets(null, List.of("books"), null, config))
            .isInstanceOf(InvalidSearchRequestException.class);
    }

    private SearchQuery normalize(String text, List<String> entities) {
        return normalizer.normalize(text, entities, null, null, null, null, null, config);
    }
}
