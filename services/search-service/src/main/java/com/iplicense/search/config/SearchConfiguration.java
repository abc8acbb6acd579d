package com.iplicense.search.config;

import com.iplicense.search.adapter.AdapterProperties;
import com.iplicense.search.analytics.AnalyticsProperties;
import com.iplicense.search.suggest.SuggestProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
    ScoringProperties.class,
    AdapterProperties.class,
    AnalyticsProperties.class,
    SuggestProperties.class
})
public class SearchConfiguration {}
