package com.iplicense.search.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.iplicense.search.common.PermissionContext;
import com.iplicense.search.config.SearchConfig;
import com.iplicense.search.query.QueryNormalizer;
import com.iplicense.search.query.SearchFilters;
import com.iplicense.search.query.SearchQuery;
import com.iplicense.search.scoring.Candidate;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class CreatorAdapterTest {
    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    void creatorRowCarriesSortMetrics() {
        Instant verifiedAt = Instant.parse("2024-03-01T00:00:00Z");
        JdbcStubs.stubCount(jdbcTemplate, 1L);
        Map<String, Object> row = new HashMap<>();
        row.put("id", "c-1");
        row.put("stage_name", "Studio Nova");
        row.put("bio", "Illustration and motion");
        row.put("verification_status", "approved");
        row.put("availability_status", "available");
        row.put("profile_views", 1200L);
        row.put("total_collaborations", 14);
        row.put("total_revenue_cents", 900000L);
        row.put("average_rating", new BigDecimal("4.5"));
        row.put("verified_at", Timestamp.from(verifiedAt));
        JdbcStubs.stubRows(jdbcTemplate, List.of(row));

        Candidate candidate = new CreatorAdapter(jdbcTemplate)
            .search(query(SearchFilters.NONE), PermissionContext.ANONYMOUS, 10, JdbcStubs.TIMEOUT)
            .candidates()
            .get(0);

        assertEquals("Studio Nova", candidate.title());
        assertEquals(14.0, candidate.sortMetric("total_collaborations"));
        assertEquals(900000.0, candidate.sortMetric("total_revenue"));
        assertEquals(4.5, candidate.sortMetric("average_rating"));
        assertEquals((double) verifiedAt.toEpochMilli(), candidate.sortMetric("verified_at"));
        assertEquals(1200L, candidate.popularity().views());
        assertTrue(candidate.quality().verified());
        assertTrue(candidate.quality().active());
    }

    @Test
    void unratedUnavailableCreator() {
        JdbcStubs.stubCount(jdbcTemplate, 1L);
        Map<String, Object> row = new HashMap<>();
        row.put("id", "c-2");
        row.put("stage_name", "Nova Sketch");
        row.put("verification_status", "pending");
        row.put("availability_status", "unavailable");
        JdbcStubs.stubRows(jdbcTemplate, List.of(row));

        Candidate candidate = new CreatorAdapter(jdbcTemplate)
            .search(query(SearchFilters.NONE), PermissionContext.ANONYMOUS, 10, JdbcStubs.TIMEOUT)
            .candidates()
            .get(0);

        assertNull(candidate.sortMetric("average_rating"));
        assertNull(candidate.sortMetric("verified_at"));
        assertFalse(candidate.quality().verified());
        assertFalse(candidate.quality().active());
        assertNull(candidate.metadata().get("averageRating"));
    }

    @Test
    void industryAndCategoryMatchSpecialties() {
        JdbcStubs.stubCount(jdbcTemplate, 0L);
        SearchFilters filters = SearchFilters.builder()
            .specialties(List.of("illustration"))
            .industries(List.of("gaming"))
            .country("DE")
            .build();

        new CreatorAdapter(jdbcTemplate).search(query(filters), PermissionContext.ANONYMOUS, 10, JdbcStubs.TIMEOUT);

        JdbcStubs.Statement count = JdbcStubs.onlyStatement(jdbcTemplate);
        assertThat(count.sql())
            .contains("c.country = ?")
            .containsSubsequence("creator_specialties s", "creator_specialties s");
        assertThat(count.params()).endsWith("DE", "illustration", "gaming");
    }

    private static SearchQuery query(SearchFilters filters) {
        return new QueryNormalizer().normalize(
            "nova",
            List.of("creators"),
            filters,
            1,
            20,
            null,
            null,
            SearchConfig.builder().build()
        );
    }
}
