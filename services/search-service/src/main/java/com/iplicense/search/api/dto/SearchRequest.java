package com.iplicense.search.api.dto;

import java.util.List;

public class SearchRequest {
    private String query;
    private List<String> entities;
    private Filters filters;
    private Integer page;
    private Integer pageSize;
    private String sortBy;
    private String sortOrder;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public List<String> getEntities() {
        return entities;
    }

    public void setEntities(List<String> entities) {
        this.entities = entities;
    }

    public Filters getFilters() {
        return filters;
    }

    public void setFilters(Filters filters) {
        this.filters = filters;
    }

    public Integer getPage() {
        return page;
    }

    public void setPage(Integer page) {
        this.page = page;
    }

    public Integer getPageSize() {
        return pageSize;
    }

    public void setPageSize(Integer pageSize) {
        this.pageSize = pageSize;
    }

    public String getSortBy() {
        return sortBy;
    }

    public void setSortBy(String sortBy) {
        this.sortBy = sortBy;
    }

    public String getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(String sortOrder) {
        this.sortOrder = sortOrder;
    }

    public static class Filters {
        private List<String> assetType;
        private List<String> assetStatus;
        private String projectId;
        private String creatorId;
        private List<String> tags;
        private String createdBy;
        private List<String> verificationStatus;
        private List<String> specialties;
        private List<String> industry;
        private List<String> category;
        private String country;
        private String region;
        private String city;
        private String availabilityStatus;
        private List<String> projectType;
        private List<String> projectStatus;
        private String brandId;
        private List<String> licenseType;
        private List<String> licenseStatus;
        private String dateFrom;
        private String dateTo;

        public List<String> getAssetType() {
            return assetType;
        }

        public void setAssetType(List<String> assetType) {
            this.assetType = assetType;
        }

        public List<String> getAssetStatus() {
            return assetStatus;
        }

        public void setAssetStatus(List<String> assetStatus) {
            this.assetStatus = assetStatus;
        }

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getCreatorId() {
            return creatorId;
        }

        public void setCreatorId(String creatorId) {
            this.creatorId = creatorId;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }

        public String getCreatedBy() {
            return createdBy;
        }

        public void setCreatedBy(String createdBy) {
            this.createdBy = createdBy;
        }

        public List<String> getVerificationStatus() {
            return verificationStatus;
        }

        public void setVerificationStatus(List<String> verificationStatus) {
            this.verificationStatus = verificationStatus;
        }

        public List<String> getSpecialties() {
            return specialties;
        }

        public void setSpecialties(List<String> specialties) {
            this.specialties = specialties;
        }

        public List<String> getIndustry() {
            return industry;
        }

        public void setIndustry(List<String> industry) {
            this.industry = industry;
        }

        public List<String> getCategory() {
            return category;
        }

        public void setCategory(List<String> category) {
            this.category = category;
        }

        public String getCountry() {
            return country;
        }

        public void setCountry(String country) {
            this.country = country;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getCity() {
            return city;
        }

        public void setCity(String city) {
            this.city = city;
        }

        public String getAvailabilityStatus() {
            return availabilityStatus;
        }

        public void setAvailabilityStatus(String availabilityStatus) {
            this.availabilityStatus = availabilityStatus;
        }

        public List<String> getProjectType() {
            return projectType;
        }

        public void setProjectType(List<String> projectType) {
            this.projectType = projectType;
        }

        public List<String> getProjectStatus() {
            return projectStatus;
        }

        public void setProjectStatus(List<String> projectStatus) {
            this.projectStatus = projectStatus;
        }

        public String getBrandId() {
            return brandId;
        }

        public void setBrandId(String brandId) {
            this.brandId = brandId;
        }

        public List<String> getLicenseType() {
            return licenseType;
        }

        public void setLicenseType(List<String> licenseType) {
            this.licenseType = licenseType;
        }

        public List<String> getLicenseStatus() {
            return licenseStatus;
        }

        public void setLicenseStatus(List<String> licenseStatus) {
            this.licenseStatus = licenseStatus;
        }

        public String getDateFrom() {
            return dateFrom;
        }

        public void setDateFrom(String dateFrom) {
            this.dateFrom = dateFrom;
        }

        public String getDateTo() {
            return dateTo;
        }

        public void setDateTo(String dateTo) {
            this.dateTo = dateTo;
        }
    }
}
