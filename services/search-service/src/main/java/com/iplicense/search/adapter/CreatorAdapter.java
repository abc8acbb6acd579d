package com.iplicense.search.adapter;

import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.FacetField;
import com.iplicense.search.query.SearchFilters;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.query.SortField;
import com.iplicense.search.scoring.Candidate;
import com.iplicense.search.scoring.PopularityVector;
import com.iplicense.search.scoring.QualityFlags;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class CreatorAdapter extends AbstractJdbcEntityAdapter {
    private static final Map<FacetField, String> FACET_COLUMNS = Map.of(
        FacetField.VERIFICATION_STATUS, "c.verification_status"
    );
    private static final String VERIFIED = "approved";
    private static final String UNAVAILABLE = "unavailable";

    public CreatorAdapter(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.CREATORS;
    }

    @Override
    protected Map<FacetField, String> facetColumns() {
        return FACET_COLUMNS;
    }

    @Override
    public String subtitle(Candidate candidate) {
        Object verification = candidate.metadata().get("verificationStatus");
        return verification == null ? "Creator" : String.valueOf(verification);
    }

    @Override
    protected String selectFields() {
        return "SELECT c.id, c.user_id, c.stage_name, c.bio, c.verification_status, c.availability_status, "
            + "c.portfolio_url, c.avatar_url, c.country, c.region, c.city, c.profile_views, c.total_collaborations, "
            + "c.total_revenue_cents, c.average_rating, c.verified_at, c.created_at, c.updated_at";
    }

    @Override
    protected String fromClause() {
        return "FROM creators c";
    }

    @Override
    protected String orderBy() {
        return "c.created_at DESC, c.id ASC";
    }

    @Override
    protected SqlCriteria criteria(SearchQuery query, PermissionContext permissions) {
        SqlCriteria criteria = new SqlCriteria()
            .and("c.deleted_at IS NULL")
            .andTextMatch("c.stage_name", "c.bio", query);

        SearchFilters filters = query.getFilters();
        criteria.andIn("c.verification_status", filters.getVerificationStatuses())
            .andEquals("c.country", filters.getCountry())
            .andEquals("c.region", filters.getRegion())
            .andEquals("c.city", filters.getCity())
            .andEquals("c.availability_status", filters.getAvailabilityStatus())
            .andCreatedBetween("c.created_at", filters.getDateFrom(), filters.getDateTo());
        // industry and category are stored as specialty tags
        andSpecialties(criteria, filters.getSpecialties());
        andSpecialties(criteria, filters.getIndustries());
        andSpecialties(criteria, filters.getCategories());
        return criteria;
    }

    private static void andSpecialties(SqlCriteria criteria, List<String> values) {
        if (values.isEmpty()) {
            return;
        }
        criteria.and(
            "EXISTS (SELECT 1 FROM creator_specialties s WHERE s.creator_id = c.id AND s.specialty IN ("
                + SqlCriteria.placeholders(values.size()) + "))",
            values.toArray()
        );
    }

    @Override
    protected Candidate toCandidate(Map<String, Object> row) {
        String verification = JdbcRows.string(row, "verification_status");
        String availability = JdbcRows.string(row, "availability_status");
        boolean verified = VERIFIED.equalsIgnoreCase(verification);
        long collaborations = JdbcRows.longValue(row, "total_collaborations");
        Instant verifiedAt = JdbcRows.instant(row, "verified_at");

        Map<String, Double> sortMetrics = new LinkedHashMap<>();
        sortMetrics.put(SortField.TOTAL_COLLABORATIONS.value(), (double) collaborations);
        sortMetrics.put(SortField.TOTAL_REVENUE.value(), (double) JdbcRows.longValue(row, "total_revenue_cents"));
        Double rating = JdbcRows.doubleOrNull(row, "average_rating");
        if (rating != null) {
            sortMetrics.put(SortField.AVERAGE_RATING.value(), rating);
        }
        if (verifiedAt != null) {
            sortMetrics.put(SortField.VERIFIED_AT.value(), (double) verifiedAt.toEpochMilli());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("userId", JdbcRows.string(row, "user_id"));
        metadata.put("verificationStatus", verification);
        metadata.put("availabilityStatus", availability);
        metadata.put("portfolioUrl", JdbcRows.string(row, "portfolio_url"));
        metadata.put("avatarUrl", JdbcRows.string(row, "avatar_url"));
        metadata.put("country", JdbcRows.string(row, "country"));
        metadata.put("totalCollaborations", collaborations);
        metadata.put("averageRating", rating);
        metadata.put("verifiedAt", verifiedAt == null ? null : verifiedAt.toString());

        return new Candidate(
            EntityKind.CREATORS,
            JdbcRows.string(row, "id"),
            JdbcRows.string(row, "stage_name"),
            JdbcRows.string(row, "bio"),
            JdbcRows.instant(row, "created_at"),
            JdbcRows.instant(row, "updated_at"),
            new PopularityVector(JdbcRows.longValue(row, "profile_views"), collaborations, 0L),
            new QualityFlags(verified, !UNAVAILABLE.equalsIgnoreCase(availability), verified),
            sortMetrics,
            metadata
        );
    }
}
