package com.iplicense.search.query;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Filter fields that can be counted per value. Each is owned by one entity kind and maps onto the
 * matching {@link SearchFilters} list.
 */
public enum FacetField {
    ASSET_TYPE("assetType", "Asset Type", EntityKind.ASSETS, SearchFilters::getAssetTypes, SearchFilters.Builder::assetTypes),
    ASSET_STATUS("assetStatus", "Status", EntityKind.ASSETS, SearchFilters::getAssetStatuses, SearchFilters.Builder::assetStatuses),
    VERIFICATION_STATUS(
        "verificationStatus",
        "Verification Status",
        EntityKind.CREATORS,
        SearchFilters::getVerificationStatuses,
        SearchFilters.Builder::verificationStatuses
    ),
    PROJECT_TYPE("projectType", "Project Type", EntityKind.PROJECTS, SearchFilters::getProjectTypes, SearchFilters.Builder::projectTypes),
    PROJECT_STATUS(
        "projectStatus",
        "Project Status",
        EntityKind.PROJECTS,
        SearchFilters::getProjectStatuses,
        SearchFilters.Builder::projectStatuses
    ),
    LICENSE_TYPE("licenseType", "License Type", EntityKind.LICENSES, SearchFilters::getLicenseTypes, SearchFilters.Builder::licenseTypes),
    LICENSE_STATUS(
        "licenseStatus",
        "License Status",
        EntityKind.LICENSES,
        SearchFilters::getLicenseStatuses,
        SearchFilters.Builder::licenseStatuses
    );

    private final String value;
    private final String label;
    private final EntityKind kind;
    private final Function<SearchFilters, List<String>> getter;
    private final BiFunction<SearchFilters.Builder, List<String>, SearchFilters.Builder> setter;

    FacetField(
        String value,
        String label,
        EntityKind kind,
        Function<SearchFilters, List<String>> getter,
        BiFunction<SearchFilters.Builder, List<String>, SearchFilters.Builder> setter
    ) {
        this.value = value;
        this.label = label;
        this.kind = kind;
        this.getter = getter;
        this.setter = setter;
    }

    public String value() {
        return value;
    }

    public String label() {
        return label;
    }

    public EntityKind kind() {
        return kind;
    }

    public List<String> selected(SearchFilters filters) {
        return getter.apply(filters == null ? SearchFilters.NONE : filters);
    }

    /** The same filters without this field's own constraint, so its other values stay countable. */
    public SearchFilters clear(SearchFilters filters) {
        SearchFilters source = filters == null ? SearchFilters.NONE : filters;
        return setter.apply(source.toBuilder(), List.of()).build();
    }
}
