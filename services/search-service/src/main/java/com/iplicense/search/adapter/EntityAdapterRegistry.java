package com.iplicense.search.adapter;

import com.iplicense.search.query.EntityKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class EntityAdapterRegistry {
    private final Map<EntityKind, EntityAdapter> adapters;

    public EntityAdapterRegistry(List<EntityAdapter> adapters) {
        Map<EntityKind, EntityAdapter> byKind = new EnumMap<>(EntityKind.class);
        for (EntityAdapter adapter : adapters) {
            EntityAdapter previous = byKind.put(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("duplicate adapter for kind " + adapter.kind().value());
            }
        }
        this.adapters = Collections.unmodifiableMap(byKind);
    }

    public Optional<EntityAdapter> find(EntityKind kind) {
        return Optional.ofNullable(adapters.get(kind));
    }

    public Map<EntityKind, EntityAdapter> all() {
        return adapters;
    }
}
