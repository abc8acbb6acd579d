package com.iplicense.search.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.iplicense.search.query.EntityKind;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

class EntityAdapterRegistryTest {
    private final JdbcTemplate jdbcTemplate = new JdbcTemplate();

    @Test
    void indexesAdaptersByKind() {
        EntityAdapterRegistry registry = new EntityAdapterRegistry(List.of(
            new AssetAdapter(jdbcTemplate),
            new CreatorAdapter(jdbcTemplate),
            new ProjectAdapter(jdbcTemplate),
            new LicenseAdapter(jdbcTemplate)
        ));

        assertThat(registry.all()).containsOnlyKeys(EntityKind.values());
        assertThat(registry.find(EntityKind.LICENSES)).get().isInstanceOf(LicenseAdapter.class);
    }

    @Test
    void missingKindIsEmpty() {
        EntityAdapterRegistry registry = new EntityAdapterRegistry(List.of(new AssetAdapter(jdbcTemplate)));

        assertThat(registry.find(EntityKind.CREATORS)).isEmpty();
    }

    @Test
    void duplicateKindIsRejected() {
        assertThatThrownBy(() -> new EntityAdapterRegistry(List.of(
            new AssetAdapter(jdbcTemplate),
            new AssetAdapter(jdbcTemplate)
        ))).isInstanceOf(IllegalStateException.class).hasMessageContaining("assets");
    }
}
