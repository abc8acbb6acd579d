package com.iplicense.search.execution;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SearchExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService searchExecutor(@Value("${search.execution.pool-size:8}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(2, poolSize), namedThreads("search-adapter-"));
    }

    @Bean
    public Clock searchClock() {
        return Clock.systemUTC();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
