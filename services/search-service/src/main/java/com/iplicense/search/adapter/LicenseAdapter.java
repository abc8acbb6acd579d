package com.iplicense.search.adapter;

import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.query.EntityKind;
import com.iplicense.search.query.FacetField;
import com.iplicense.search.query.SearchFilters;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.scoring.Candidate;
import com.iplicense.search.scoring.PopularityVector;
import com.iplicense.search.scoring.QualityFlags;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Licenses have no text of their own; they match on the licensed asset's title and the brand name, and are
 * presented as {@code "<TYPE> License - <asset title>"}.
 */
@Component
public class LicenseAdapter extends AbstractJdbcEntityAdapter {
    private static final Map<FacetField, String> FACET_COLUMNS = Map.of(
        FacetField.LICENSE_TYPE, "l.license_type",
        FacetField.LICENSE_STATUS, "l.status"
    );
    private static final Set<String> UNAPPROVED_STATUSES = Set.of("DRAFT", "PENDING_APPROVAL");

    public LicenseAdapter(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.LICENSES;
    }

    @Override
    protected Map<FacetField, String> facetColumns() {
        return FACET_COLUMNS;
    }

    @Override
    public String subtitle(Candidate candidate) {
        Object type = candidate.metadata().get("licenseType");
        return type == null ? "License" : String.valueOf(type);
    }

    @Override
    protected String selectFields() {
        return "SELECT l.id, l.license_type, l.status, l.ip_asset_id, l.brand_id, l.fee_cents, l.start_date, "
            + "l.end_date, l.created_at, l.updated_at, a.title AS asset_title, b.company_name AS brand_name, "
            + "b.verified_at AS brand_verified_at";
    }

    @Override
    protected String fromClause() {
        return "FROM licenses l JOIN ip_assets a ON a.id = l.ip_asset_id LEFT JOIN brands b ON b.id = l.brand_id";
    }

    @Override
    protected String orderBy() {
        return "l.created_at DESC, l.id ASC";
    }

    @Override
    protected SqlCriteria criteria(SearchQuery query, PermissionContext permissions) {
        SqlCriteria criteria = new SqlCriteria().and("l.deleted_at IS NULL");
        if (permissions.isBrand()) {
            criteria.and("l.brand_id = ?", permissions.brandId());
        } else if (permissions.isCreator()) {
            criteria.and(
                "EXISTS (SELECT 1 FROM ip_ownerships o WHERE o.ip_asset_id = l.ip_asset_id AND o.creator_id = ?)",
                permissions.creatorId()
            );
        }
        SearchFilters filters = query.getFilters();
        return criteria
            .andTextMatch("a.title", "b.company_name", query)
            .andIn("l.license_type", filters.getLicenseTypes())
            .andIn("l.status", filters.getLicenseStatuses())
            .andEquals("l.brand_id", filters.getBrandId())
            .andCreatedBetween("l.created_at", filters.getDateFrom(), filters.getDateTo());
    }

    @Override
    protected Candidate toCandidate(Map<String, Object> row) {
        String licenseType = JdbcRows.string(row, "license_type");
        String status = JdbcRows.string(row, "status");
        String assetTitle = JdbcRows.string(row, "asset_title");
        String brandName = JdbcRows.string(row, "brand_name");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("licenseType", licenseType);
        metadata.put("status", status);
        metadata.put("assetId", JdbcRows.string(row, "ip_asset_id"));
        metadata.put("assetTitle", assetTitle);
        metadata.put("brandId", JdbcRows.string(row, "brand_id"));
        metadata.put("brandName", brandName);
        metadata.put("feeCents", JdbcRows.longValue(row, "fee_cents"));

        return new Candidate(
            EntityKind.LICENSES,
            JdbcRows.string(row, "id"),
            licenseType + " License - " + (assetTitle == null ? "" : assetTitle),
            brandName == null ? null : "License for " + brandName,
            JdbcRows.instant(row, "created_at"),
            JdbcRows.instant(row, "updated_at"),
            PopularityVector.NONE,
            new QualityFlags(
                row.get("brand_verified_at") != null,
                "ACTIVE".equals(status),
                status != null && !UNAPPROVED_STATUSES.contains(status)
            ),
            Map.of(),
            metadata
        );
    }
}
