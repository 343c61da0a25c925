package dev.pekelund.pricing.config;

import dev.pekelund.pricing.analysis.AnalysisResultStore;
import dev.pekelund.pricing.analysis.InMemoryAnalysisResultStore;
import dev.pekelund.pricing.analysis.PageDetailSource;
import dev.pekelund.pricing.certification.CertificationTypeCatalog;
import dev.pekelund.pricing.certification.InMemoryCertificationTypeCatalog;
import dev.pekelund.pricing.jobs.AnalysisService;
import dev.pekelund.pricing.jobs.BatchJobMonitor;
import dev.pekelund.pricing.quote.QuoteEmissionAdapter;
import dev.pekelund.pricing.quote.QuoteEmitter;
import dev.pekelund.pricing.settings.PricingSettings;
import dev.pekelund.pricing.settings.PricingSettingsProvider;
import dev.pekelund.pricing.settings.StaticPricingSettingsProvider;
import dev.pekelund.pricing.sheet.PricingSheetFactory;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Wires the pricing engine. Without Firestore the record store, settings and certification
 * catalog live in memory and are seeded from {@link PricingProperties}.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(PricingEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PricingSettings defaultPricingSettings(PricingProperties properties) {
        return properties.toSettings();
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler analysisJobScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("analysis-job-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public BatchJobMonitor batchJobMonitor(AnalysisService analysisService,
        ThreadPoolTaskScheduler analysisJobScheduler, PricingProperties properties) {
        return new BatchJobMonitor(analysisService, analysisJobScheduler, properties.getPollInterval());
    }

    @Bean
    public PricingSheetFactory pricingSheetFactory(AnalysisResultStore analysisResultStore,
        PricingSettingsProvider pricingSettingsProvider, CertificationTypeCatalog certificationTypeCatalog,
        BatchJobMonitor batchJobMonitor, PageDetailSource pageDetailSource, Clock clock) {
        return new PricingSheetFactory(analysisResultStore, pricingSettingsProvider, certificationTypeCatalog,
            batchJobMonitor, pageDetailSource, clock);
    }

    @Bean
    public QuoteEmissionAdapter quoteEmissionAdapter(QuoteEmitter quoteEmitter) {
        return new QuoteEmissionAdapter(quoteEmitter);
    }

    @Bean
    @ConditionalOnProperty(value = "firestore.enabled", havingValue = "false", matchIfMissing = true)
    public AnalysisResultStore inMemoryAnalysisResultStore() {
        log.info("Firestore disabled; analysis records are kept in memory");
        return new InMemoryAnalysisResultStore();
    }

    @Bean
    @ConditionalOnProperty(value = "firestore.enabled", havingValue = "false", matchIfMissing = true)
    public PricingSettingsProvider staticPricingSettingsProvider(PricingSettings defaultPricingSettings) {
        return new StaticPricingSettingsProvider(defaultPricingSettings);
    }

    @Bean
    @ConditionalOnProperty(value = "firestore.enabled", havingValue = "false", matchIfMissing = true)
    public CertificationTypeCatalog inMemoryCertificationTypeCatalog(PricingProperties properties) {
        return new InMemoryCertificationTypeCatalog(properties.toCertificationTypes());
    }
}
