package dev.pekelund.pricing.sheet;

import dev.pekelund.pricing.analysis.AnalysisResult;
import dev.pekelund.pricing.analysis.AnalysisResultStore;
import dev.pekelund.pricing.analysis.PageDetailCache;
import dev.pekelund.pricing.analysis.PageDetailSource;
import dev.pekelund.pricing.certification.CertificationTypeCatalog;
import dev.pekelund.pricing.certification.CertificationTypes;
import dev.pekelund.pricing.jobs.BatchJobMonitor;
import dev.pekelund.pricing.settings.PricingSettings;
import dev.pekelund.pricing.settings.PricingSettingsProvider;
import dev.pekelund.pricing.support.PricingMdc;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens pricing sheet sessions. Settings and certification types are read once per sheet load;
 * when either source is unavailable the sheet is built with built-in defaults or without
 * certifications instead of failing.
 */
public class PricingSheetFactory {

    private static final Logger log = LoggerFactory.getLogger(PricingSheetFactory.class);

    private final AnalysisResultStore store;
    private final PricingSettingsProvider settingsProvider;
    private final CertificationTypeCatalog certificationTypeCatalog;
    private final BatchJobMonitor jobMonitor;
    private final PageDetailSource pageDetailSource;
    private final Clock clock;

    public PricingSheetFactory(AnalysisResultStore store, PricingSettingsProvider settingsProvider,
        CertificationTypeCatalog certificationTypeCatalog, BatchJobMonitor jobMonitor,
        PageDetailSource pageDetailSource, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.settingsProvider = Objects.requireNonNull(settingsProvider, "settingsProvider");
        this.certificationTypeCatalog = Objects.requireNonNull(certificationTypeCatalog, "certificationTypeCatalog");
        this.jobMonitor = Objects.requireNonNull(jobMonitor, "jobMonitor");
        this.pageDetailSource = Objects.requireNonNull(pageDetailSource, "pageDetailSource");
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public PricingSheetSession open(String batchId) {
        return open(batchId, Sheet.DEFAULT_LANGUAGE_MULTIPLIER);
    }

    public PricingSheetSession open(String batchId, BigDecimal languageMultiplier) {
        Sheet sheet = loadSheet(batchId, languageMultiplier);
        log.info("Opened pricing sheet of batch {} with {} row(s)", batchId, sheet.rows().size());
        return new PricingSheetSession(sheet, store, this::loadSheet, jobMonitor,
            new PageDetailCache(pageDetailSource), clock);
    }

    Sheet loadSheet(String batchId, BigDecimal languageMultiplier) {
        try (PricingMdc.Context ignored = PricingMdc.forBatch(batchId)) {
            PricingSettings settings = loadSettings();
            CertificationTypes certificationTypes = loadCertificationTypes();
            List<AnalysisResult> results = store.findByBatch(batchId);
            return Sheet.build(batchId, results, settings, certificationTypes, languageMultiplier);
        }
    }

    private PricingSettings loadSettings() {
        try {
            PricingSettings settings = settingsProvider.loadSettings();
            return settings != null ? settings : PricingSettings.defaults();
        } catch (RuntimeException ex) {
            log.warn("Failed to load pricing settings; using built-in defaults", ex);
            return PricingSettings.defaults();
        }
    }

    private CertificationTypes loadCertificationTypes() {
        try {
            return CertificationTypes.of(certificationTypeCatalog.listActiveTypes());
        } catch (RuntimeException ex) {
            log.warn("Failed to load certification types; pricing without certifications", ex);
            return CertificationTypes.empty();
        }
    }
}
