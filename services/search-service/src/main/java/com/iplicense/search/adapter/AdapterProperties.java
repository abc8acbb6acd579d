package com.iplicense.search.adapter;

import com.iplicense.search.query.EntityKind;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.adapters")
public class AdapterProperties {
    private long defaultTimeoutMs = 400L;
    private Map<String, Long> timeoutsMs = new LinkedHashMap<>();

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public void setDefaultTimeoutMs(long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    /** Per-kind overrides keyed by wire name ({@code assets}, {@code creators}, ...). */
    public Map<String, Long> getTimeoutsMs() {
        return timeoutsMs;
    }

    public void setTimeoutsMs(Map<String, Long> timeoutsMs) {
        this.timeoutsMs = timeoutsMs == null ? new LinkedHashMap<>() : timeoutsMs;
    }

    public Duration timeoutFor(EntityKind kind) {
        Long override = kind == null ? null : timeoutsMs.get(kind.value());
        long millis = override == null || override <= 0 ? defaultTimeoutMs : override;
        return Duration.ofMillis(Math.max(1L, millis));
    }
}
