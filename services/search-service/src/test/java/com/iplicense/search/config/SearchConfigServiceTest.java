package com.iplicense.search.config;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SearchConfigServiceTest {
    @TempDir
    Path tempDir;

    private Path file;
    private ScoringProperties properties;
    private SearchConfigService service;

    @BeforeEach
    void setUp() throws IOException {
        file = tempDir.resolve("scoring.yaml");
        Files.writeString(file, "recency:\n  half_life_days: 45\n");
        properties = new ScoringProperties();
        properties.setConfigPath(file.toString());
        service = new SearchConfigService(new SearchConfigLoader(), properties);
        service.init();
    }

    @Test
    void loadsOverrideOnStartup() {
        SearchConfig config = service.current();

        assertEquals(1L, config.getVersion());
        assertEquals(45.0, config.getHalfLifeDays(), 1e-9);
    }

    @Test
    void reloadSwapsInNewVersion() throws IOException {
        SearchConfig before = service.current();
        Files.writeString(file, "recency:\n  half_life_days: 10\n");

        SearchConfig after = service.reload();

        assertEquals(2L, after.getVersion());
        assertEquals(10.0, after.getHalfLifeDays(), 1e-9);
        assertSame(after, service.current());
        assertEquals(45.0, before.getHalfLifeDays(), 1e-9);
    }

    @Test
    void invalidReloadKeepsActiveConfig() throws IOException {
        SearchConfig before = service.current();
        Files.writeString(file, "recency:\n  half_life_days: -1\n");

        assertThatThrownBy(service::reload)
            .isInstanceOf(InvalidSearchConfigException.class)
            .hasMessageContaining("half_life_days");

        assertSame(before, service.current());
    }

    @Test
    void brokenOverrideFallsBackToPropertiesWhenNotStrict() throws IOException {
        Files.writeString(file, "weights: 3\n");

        SearchConfigService fresh = new SearchConfigService(new SearchConfigLoader(), properties);
        fresh.init();

        assertEquals(90.0, fresh.current().getHalfLifeDays(), 1e-9);
    }

    @Test
    void brokenOverrideFailsStartupWhenStrict() throws IOException {
        Files.writeString(file, "weights: 3\n");
        properties.setStrict(true);

        SearchConfigService fresh = new SearchConfigService(new SearchConfigLoader(), properties);

        assertThatThrownBy(fresh::init).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void concurrentReloadsInstallDistinctIncreasingVersions() throws Exception {
        int reloads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<SearchConfig>> futures = new ArrayList<>();
            for (int i = 0; i < reloads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return service.reload();
                }));
            }
            start.countDown();

            Set<Long> versions = new HashSet<>();
            for (Future<SearchConfig> future : futures) {
                versions.add(future.get(5, TimeUnit.SECONDS).getVersion());
            }

            assertEquals(reloads, versions.size());
            assertEquals(2L, Collections.min(versions));
            assertEquals(reloads + 1L, Collections.max(versions));
            assertEquals(reloads + 1L, service.current().getVersion());
        } finally {
            pool.shutdownNow();
        }
    }
}
