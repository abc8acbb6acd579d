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

@Component
public class AssetAdapter extends AbstractJdbcEntityAdapter {
    private static final Map<FacetField, String> FACET_COLUMNS = Map.of(
        FacetField.ASSET_TYPE, "a.type",
        FacetField.ASSET_STATUS, "a.status"
    );
    private static final Set<String> LIVE_STATUSES = Set.of("APPROVED", "PUBLISHED");
    private static final String ACTIVE_OWNERSHIP =
        "EXISTS (SELECT 1 FROM ip_ownerships o WHERE o.ip_asset_id = a.id AND o.creator_id = ? "
            + "AND (o.end_date IS NULL OR o.end_date > CURRENT_TIMESTAMP))";

    public AssetAdapter(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.ASSETS;
    }

    @Override
    protected Map<FacetField, String> facetColumns() {
        return FACET_COLUMNS;
    }

    @Override
    public String subtitle(Candidate candidate) {
        Object type = candidate.metadata().get("type");
        return type == null ? null : String.valueOf(type);
    }

    @Override
    protected String selectFields() {
        return "SELECT a.id, a.title, a.description, a.type, a.status, a.project_id, a.created_by, a.thumbnail_url, "
            + "a.view_count, a.favorite_count, a.created_at, a.updated_at, "
            + "(SELECT COUNT(*) FROM licenses l WHERE l.ip_asset_id = a.id AND l.deleted_at IS NULL) AS license_count, "
            + "EXISTS (SELECT 1 FROM ip_ownerships vo JOIN creators vc ON vc.id = vo.creator_id "
            + "WHERE vo.ip_asset_id = a.id AND vc.verification_status = 'approved') AS owner_verified";
    }

    @Override
    protected String fromClause() {
        return "FROM ip_assets a";
    }

    @Override
    protected String orderBy() {
        return "a.created_at DESC, a.id ASC";
    }

    @Override
    protected SqlCriteria criteria(SearchQuery query, PermissionContext permissions) {
        SqlCriteria criteria = new SqlCriteria().and("a.deleted_at IS NULL");
        if (permissions.isCreator()) {
            criteria.and(ACTIVE_OWNERSHIP, permissions.creatorId());
        } else if (permissions.isBrand()) {
            criteria.and(
                "(a.project_id IN (SELECT p.id FROM projects p WHERE p.brand_id = ? AND p.deleted_at IS NULL) "
                    + "OR EXISTS (SELECT 1 FROM licenses bl WHERE bl.ip_asset_id = a.id AND bl.brand_id = ? "
                    + "AND bl.status = 'ACTIVE' AND bl.end_date >= CURRENT_TIMESTAMP AND bl.deleted_at IS NULL))",
                permissions.brandId(),
                permissions.brandId()
            );
        }
        criteria.andTextMatch("a.title", "a.description", query);

        SearchFilters filters = query.getFilters();
        criteria.andIn("a.type", filters.getAssetTypes())
            .andIn("a.status", filters.getAssetStatuses())
            .andEquals("a.project_id", filters.getProjectId())
            .andEquals("a.created_by", filters.getCreatedBy())
            .andCreatedBetween("a.created_at", filters.getDateFrom(), filters.getDateTo());
        if (filters.getCreatorId() != null) {
            criteria.and(ACTIVE_OWNERSHIP, filters.getCreatorId());
        }
        if (!filters.getTags().isEmpty()) {
            criteria.and(
                "EXISTS (SELECT 1 FROM ip_asset_tags t WHERE t.asset_id = a.id AND t.tag IN ("
                    + SqlCriteria.placeholders(filters.getTags().size()) + "))",
                filters.getTags().toArray()
            );
        }
        return criteria;
    }

    @Override
    protected Candidate toCandidate(Map<String, Object> row) {
        String status = JdbcRows.string(row, "status");
        boolean live = status != null && LIVE_STATUSES.contains(status);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("type", JdbcRows.string(row, "type"));
        metadata.put("status", status);
        metadata.put("projectId", JdbcRows.string(row, "project_id"));
        metadata.put("createdBy", JdbcRows.string(row, "created_by"));
        metadata.put("thumbnailUrl", JdbcRows.string(row, "thumbnail_url"));

        return new Candidate(
            EntityKind.ASSETS,
            JdbcRows.string(row, "id"),
            JdbcRows.string(row, "title"),
            JdbcRows.string(row, "description"),
            JdbcRows.instant(row, "created_at"),
            JdbcRows.instant(row, "updated_at"),
            new PopularityVector(
                JdbcRows.longValue(row, "view_count"),
                JdbcRows.longValue(row, "license_count"),
                JdbcRows.longValue(row, "favorite_count")
            ),
            new QualityFlags(JdbcRows.bool(row, "owner_verified"), live, live),
            Map.of(),
            metadata
        );
    }
}
