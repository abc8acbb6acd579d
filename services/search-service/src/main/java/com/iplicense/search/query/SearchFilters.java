package com.iplicense.search.query;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured constraints applied by entity adapters before scoring. Each adapter reads only the keys it
 * understands; the rest are ignored for that kind.
 */
public final class SearchFilters {
    public static final SearchFilters NONE = builder().build();

    private final List<String> assetTypes;
    private final List<String> assetStatuses;
    private final String projectId;
    private final String creatorId;
    private final String createdBy;
    private final List<String> tags;
    private final List<String> verificationStatuses;
    private final List<String> specialties;
    private final List<String> industries;
    private final List<String> categories;
    private final String country;
    private final String region;
    private final String city;
    private final String availabilityStatus;
    private final List<String> projectTypes;
    private final List<String> projectStatuses;
    private final String brandId;
    private final List<String> licenseTypes;
    private final List<String> licenseStatuses;
    private final Instant dateFrom;
    private final Instant dateTo;

    private SearchFilters(Builder builder) {
        this.assetTypes = copy(builder.assetTypes);
        this.assetStatuses = copy(builder.assetStatuses);
        this.projectId = builder.projectId;
        this.creatorId = builder.creatorId;
        this.createdBy = builder.createdBy;
        this.tags = copy(builder.tags);
        this.verificationStatuses = copy(builder.verificationStatuses);
        this.specialties = copy(builder.specialties);
        this.industries = copy(builder.industries);
        this.categories = copy(builder.categories);
        this.country = builder.country;
        this.region = builder.region;
        this.city = builder.city;
        this.availabilityStatus = builder.availabilityStatus;
        this.projectTypes = copy(builder.projectTypes);
        this.projectStatuses = copy(builder.projectStatuses);
        this.brandId = builder.brandId;
        this.licenseTypes = copy(builder.licenseTypes);
        this.licenseStatuses = copy(builder.licenseStatuses);
        this.dateFrom = builder.dateFrom;
        this.dateTo = builder.dateTo;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
            .assetTypes(assetTypes)
            .assetStatuses(assetStatuses)
            .projectId(projectId)
            .creatorId(creatorId)
            .createdBy(createdBy)
            .tags(tags)
            .verificationStatuses(verificationStatuses)
            .specialties(specialties)
            .industries(industries)
            .categories(categories)
            .country(country)
            .region(region)
            .city(city)
            .availabilityStatus(availabilityStatus)
            .projectTypes(projectTypes)
            .projectStatuses(projectStatuses)
            .brandId(brandId)
            .licenseTypes(licenseTypes)
            .licenseStatuses(licenseStatuses)
            .dateFrom(dateFrom)
            .dateTo(dateTo);
    }

    public List<String> getAssetTypes() {
        return assetTypes;
    }

    public List<String> getAssetStatuses() {
        return assetStatuses;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getCreatorId() {
        return creatorId;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<String> getVerificationStatuses() {
        return verificationStatuses;
    }

    public List<String> getSpecialties() {
        return specialties;
    }

    public List<String> getIndustries() {
        return industries;
    }

    public List<String> getCategories() {
        return categories;
    }

    public String getCountry() {
        return country;
    }

    public String getRegion() {
        return region;
    }

    public String getCity() {
        return city;
    }

    public String getAvailabilityStatus() {
        return availabilityStatus;
    }

    public List<String> getProjectTypes() {
        return projectTypes;
    }

    public List<String> getProjectStatuses() {
        return projectStatuses;
    }

    public String getBrandId() {
        return brandId;
    }

    public List<String> getLicenseTypes() {
        return licenseTypes;
    }

    public List<String> getLicenseStatuses() {
        return licenseStatuses;
    }

    public Instant getDateFrom() {
        return dateFrom;
    }

    public Instant getDateTo() {
        return dateTo;
    }

    public boolean isEmpty() {
        return toMap().isEmpty();
    }

    /** Applied (non-empty) filters keyed by their request names, for analytics. */
    public Map<String, Object> toMap() {
        Map<String, Object> applied = new LinkedHashMap<>();
        putIfPresent(applied, "assetType", assetTypes);
        putIfPresent(applied, "assetStatus", assetStatuses);
        putIfPresent(applied, "projectId", projectId);
        putIfPresent(applied, "creatorId", creatorId);
        putIfPresent(applied, "createdBy", createdBy);
        putIfPresent(applied, "tags", tags);
        putIfPresent(applied, "verificationStatus", verificationStatuses);
        putIfPresent(applied, "specialties", specialties);
        putIfPresent(applied, "industry", industries);
        putIfPresent(applied, "category", categories);
        putIfPresent(applied, "country", country);
        putIfPresent(applied, "region", region);
        putIfPresent(applied, "city", city);
        putIfPresent(applied, "availabilityStatus", availabilityStatus);
        putIfPresent(applied, "projectType", projectTypes);
        putIfPresent(applied, "projectStatus", projectStatuses);
        putIfPresent(applied, "brandId", brandId);
        putIfPresent(applied, "licenseType", licenseTypes);
        putIfPresent(applied, "licenseStatus", licenseStatuses);
        putIfPresent(applied, "dateFrom", dateFrom == null ? null : dateFrom.toString());
        putIfPresent(applied, "dateTo", dateTo == null ? null : dateTo.toString());
        return applied;
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof List<?> list && list.isEmpty()) {
            return;
        }
        target.put(key, value);
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    public static final class Builder {
        private List<String> assetTypes;
        private List<String> assetStatuses;
        private String projectId;
        private String creatorId;
        private String createdBy;
        private List<String> tags;
        private List<String> verificationStatuses;
        private List<String> specialties;
        private List<String> industries;
        private List<String> categories;
        private String country;
        private String region;
        private String city;
        private String availabilityStatus;
        private List<String> projectTypes;
        private List<String> projectStatuses;
        private String brandId;
        private List<String> licenseTypes;
        private List<String> licenseStatuses;
        private Instant dateFrom;
        private Instant dateTo;

        private Builder() {
        }

        public Builder assetTypes(List<String> assetTypes) {
            this.assetTypes = assetTypes;
            return this;
        }

        public Builder assetStatuses(List<String> assetStatuses) {
            this.assetStatuses = assetStatuses;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder creatorId(String creatorId) {
            this.creatorId = creatorId;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder verificationStatuses(List<String> verificationStatuses) {
            this.verificationStatuses = verificationStatuses;
            return this;
        }

        public Builder specialties(List<String> specialties) {
            this.specialties = specialties;
            return this;
        }

        public Builder industries(List<String> industries) {
            this.industries = industries;
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories = categories;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder availabilityStatus(String availabilityStatus) {
            this.availabilityStatus = availabilityStatus;
            return this;
        }

        public Builder projectTypes(List<String> projectTypes) {
            this.projectTypes = projectTypes;
            return this;
        }

        public Builder projectStatuses(List<String> projectStatuses) {
            this.projectStatuses = projectStatuses;
            return this;
        }

        public Builder brandId(String brandId) {
            this.brandId = brandId;
            return this;
        }

        public Builder licenseTypes(List<String> licenseTypes) {
            this.licenseTypes = licenseTypes;
            return this;
        }

        public Builder licenseStatuses(List<String> licenseStatuses) {
            this.licenseStatuses = licenseStatuses;
            return this;
        }

        public Builder dateFrom(Instant dateFrom) {
            this.dateFrom = dateFrom;
            return this;
        }

        public Builder dateTo(Instant dateTo) {
            this.dateTo = dateTo;
            return this;
        }

        public SearchFilters build() {
            return new SearchFilters(this);
        }
    }
}
