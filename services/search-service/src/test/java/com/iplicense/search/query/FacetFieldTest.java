package com.iplicense.search.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class FacetFieldTest {
    @Test
    void clearDropsOnlyItsOwnFilter() {
        SearchFilters filters = SearchFilters.builder()
            .assetTypes(List.of("IMAGE"))
            .assetStatuses(List.of("PUBLISHED"))
            .tags(List.of("retro"))
            .build();

        SearchFilters cleared = FacetField.ASSET_TYPE.clear(filters);

        assertThat(cleared.getAssetTypes()).isEmpty();
        assertThat(cleared.getAssetStatuses()).containsExactly("PUBLISHED");
        assertThat(cleared.getTags()).containsExactly("retro");
        assertThat(filters.getAssetTypes()).containsExactly("IMAGE");
    }

    @Test
    void selectedReadsTheMatchingFilter() {
        SearchFilters filters = SearchFilters.builder().licenseStatuses(List.of("ACTIVE")).build();

        assertThat(FacetField.LICENSE_STATUS.selected(filters)).containsExactly("ACTIVE");
        assertThat(FacetField.LICENSE_TYPE.selected(filters)).isEmpty();
        assertThat(FacetField.PROJECT_TYPE.selected(null)).isEmpty();
    }

    @Test
    void everyFieldBelongsToOneKind() {
        assertThat(FacetField.VERIFICATION_STATUS.kind()).isEqualTo(EntityKind.CREATORS);
        assertThat(FacetField.PROJECT_STATUS.value()).isEqualTo("projectStatus");
        assertThat(FacetField.ASSET_STATUS.label()).isEqualTo("Status");
    }
}
