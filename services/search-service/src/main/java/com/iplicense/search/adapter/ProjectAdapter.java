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
public class ProjectAdapter extends AbstractJdbcEntityAdapter {
    private static final Map<FacetField, String> FACET_COLUMNS = Map.of(
        FacetField.PROJECT_TYPE, "p.project_type",
        FacetField.PROJECT_STATUS, "p.status"
    );
    private static final Set<String> ACTIVE_STATUSES = Set.of("ACTIVE", "IN_PROGRESS");
    private static final Set<String> APPROVED_STATUSES = Set.of("ACTIVE", "IN_PROGRESS", "COMPLETED");

    public ProjectAdapter(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.PROJECTS;
    }

    @Override
    protected Map<FacetField, String> facetColumns() {
        return FACET_COLUMNS;
    }

    @Override
    public String subtitle(Candidate candidate) {
        Object status = candidate.metadata().get("status");
        return status == null ? "Project" : String.valueOf(status);
    }

    @Override
    protected String selectFields() {
        return "SELECT p.id, p.name, p.description, p.project_type, p.status, p.brand_id, p.budget_cents, "
            + "p.start_date, p.end_date, p.created_at, p.updated_at, b.company_name AS brand_name, "
            + "b.verified_at AS brand_verified_at, "
            + "(SELECT COUNT(*) FROM ip_assets pa WHERE pa.project_id = p.id AND pa.deleted_at IS NULL) AS asset_count";
    }

    @Override
    protected String fromClause() {
        return "FROM projects p LEFT JOIN brands b ON b.id = p.brand_id";
    }

    @Override
    protected String orderBy() {
        return "p.created_at DESC, p.id ASC";
    }

    @Override
    protected SqlCriteria criteria(SearchQuery query, PermissionContext permissions) {
        SearchFilters filters = query.getFilters();
        return new SqlCriteria()
            .and("p.deleted_at IS NULL")
            .andTextMatch("p.name", "p.description", query)
            .andIn("p.project_type", filters.getProjectTypes())
            .andIn("p.status", filters.getProjectStatuses())
            .andEquals("p.brand_id", filters.getBrandId())
            .andCreatedBetween("p.created_at", filters.getDateFrom(), filters.getDateTo());
    }

    @Override
    protected Candidate toCandidate(Map<String, Object> row) {
        String status = JdbcRows.string(row, "status");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("projectType", JdbcRows.string(row, "project_type"));
        metadata.put("status", status);
        metadata.put("brandId", JdbcRows.string(row, "brand_id"));
        metadata.put("brandName", JdbcRows.string(row, "brand_name"));
        metadata.put("budgetCents", JdbcRows.longValue(row, "budget_cents"));
        metadata.put("startDate", stringOrNull(JdbcRows.instant(row, "start_date")));
        metadata.put("endDate", stringOrNull(JdbcRows.instant(row, "end_date")));

        return new Candidate(
            EntityKind.PROJECTS,
            JdbcRows.string(row, "id"),
            JdbcRows.string(row, "name"),
            JdbcRows.string(row, "description"),
            JdbcRows.instant(row, "created_at"),
            JdbcRows.instant(row, "updated_at"),
            new PopularityVector(0L, JdbcRows.longValue(row, "asset_count"), 0L),
            new QualityFlags(
                row.get("brand_verified_at") != null,
                status != null && ACTIVE_STATUSES.contains(status),
                status != null && APPROVED_STATUSES.contains(status)
            ),
            Map.of(),
            metadata
        );
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
