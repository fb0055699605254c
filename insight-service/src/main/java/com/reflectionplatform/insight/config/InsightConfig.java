package com.reflectionplatform.insight.config;

import com.reflectionplatform.correlation.catalog.MetricCatalog;
import com.reflectionplatform.correlation.engine.CorrelationEngine;
import com.reflectionplatform.correlation.engine.CorrelationSettings;
import com.reflectionplatform.correlation.suggestion.SuggestionGenerator;
import com.reflectionplatform.insight.cache.RelationshipCache;
import com.reflectionplatform.insight.journal.JournalEntrySource;
import com.reflectionplatform.insight.journal.JournalMoodValueProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Builds the single engine instance of the process and everything it depends on.
 * Collaborators register their metrics on the {@link MetricCatalog} bean.
 */
@Configuration
public class InsightConfig {

    private static final Logger log = LoggerFactory.getLogger(InsightConfig.class);

    @Value("${correlation.minimum-sample-size:7}")
    private int minimumSampleSize;

    @Value("${correlation.large-sample-threshold:60}")
    private int largeSampleThreshold;

    @Value("${correlation.lag-offsets:0,1,2,3}")
    private int[] lagOffsets;

    @Value("${correlation.default-window-days:30}")
    private int defaultWindowDays;

    @Value("${correlation.max-concurrency:4}")
    private int maxConcurrency;

    @Value("${correlation.cache.ttl:10m}")
    private Duration cacheTtl;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public CorrelationSettings correlationSettings() {
        List<Integer> lags = Arrays.stream(lagOffsets).boxed().toList();
        CorrelationSettings settings = new CorrelationSettings(minimumSampleSize, largeSampleThreshold,
            lags, defaultWindowDays, maxConcurrency, cacheTtl);
        log.info("Correlation settings: minimumSampleSize={} largeSampleThreshold={} lags={} "
                 + "defaultWindowDays={} maxConcurrency={} cacheTtl={}",
                 settings.minimumSampleSize(), settings.largeSampleThreshold(), settings.lagOffsets(),
                 settings.defaultWindowDays(), settings.maxConcurrency(), settings.cacheTtl());
        return settings;
    }

    @Bean
    public MetricCatalog metricCatalog(ObjectProvider<JournalEntrySource> journalSource, Clock clock) {
        MetricCatalog catalog = new MetricCatalog();
        journalSource.ifAvailable(source -> {
            catalog.register(JournalMoodValueProvider.METRIC, new JournalMoodValueProvider(source, clock.getZone()));
            log.info("Registered metric={} from journal store", JournalMoodValueProvider.METRIC.key());
        });
        return catalog;
    }

    @Bean
    public CorrelationEngine correlationEngine(MetricCatalog catalog, CorrelationSettings settings, Clock clock) {
        return new CorrelationEngine(catalog, settings, clock);
    }

    @Bean
    public SuggestionGenerator suggestionGenerator() {
        return new SuggestionGenerator();
    }

    @Bean
    public RelationshipCache relationshipCache(CorrelationSettings settings, Clock clock) {
        return new RelationshipCache(settings.cacheTtl(), clock);
    }
}
