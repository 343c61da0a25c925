package dev.pekelund.pricing.config;

import dev.pekelund.pricing.certification.CertificationType;
import dev.pekelund.pricing.jobs.BatchJobMonitor;
import dev.pekelund.pricing.settings.PricingSettings;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "pricing")
public class PricingProperties {

    /**
     * Base price of one billable page before complexity and language multipliers.
     */
    private BigDecimal baseRate = PricingSettings.DEFAULT_BASE_RATE;

    /**
     * Number of words that make up one billable page.
     */
    private int wordsPerPage = PricingSettings.DEFAULT_WORDS_PER_PAGE;

    private BigDecimal complexityEasy = PricingSettings.DEFAULT_EASY_MULTIPLIER;

    private BigDecimal complexityMedium = PricingSettings.DEFAULT_MEDIUM_MULTIPLIER;

    private BigDecimal complexityHard = PricingSettings.DEFAULT_HARD_MULTIPLIER;

    /**
     * Smallest billable page count of a document with any words.
     */
    private BigDecimal minBillablePages = PricingSettings.DEFAULT_MIN_BILLABLE_PAGES;

    /**
     * Delay between two polls of a running analysis job.
     */
    private Duration pollInterval = BatchJobMonitor.DEFAULT_POLL_INTERVAL;

    /**
     * Certification types offered when no Firestore catalog is configured.
     */
    private List<CertificationTypeEntry> certificationTypes = new ArrayList<>();

    public BigDecimal getBaseRate() {
        return baseRate;
    }

    public void setBaseRate(BigDecimal baseRate) {
        this.baseRate = baseRate;
    }

    public int getWordsPerPage() {
        return wordsPerPage;
    }

    public void setWordsPerPage(int wordsPerPage) {
        this.wordsPerPage = wordsPerPage;
    }

    public BigDecimal getComplexityEasy() {
        return complexityEasy;
    }

    public void setComplexityEasy(BigDecimal complexityEasy) {
        this.complexityEasy = complexityEasy;
    }

    public BigDecimal getComplexityMedium() {
        return complexityMedium;
    }

    public void setComplexityMedium(BigDecimal complexityMedium) {
        this.complexityMedium = complexityMedium;
    }

    public BigDecimal getComplexityHard() {
        return complexityHard;
    }

    public void setComplexityHard(BigDecimal complexityHard) {
        this.complexityHard = complexityHard;
    }

    public BigDecimal getMinBillablePages() {
        return minBillablePages;
    }

    public void setMinBillablePages(BigDecimal minBillablePages) {
        this.minBillablePages = minBillablePages;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public List<CertificationTypeEntry> getCertificationTypes() {
        return certificationTypes;
    }

    public void setCertificationTypes(List<CertificationTypeEntry> certificationTypes) {
        this.certificationTypes = certificationTypes != null ? certificationTypes : new ArrayList<>();
    }

    public PricingSettings toSettings() {
        return new PricingSettings(baseRate, wordsPerPage, complexityEasy, complexityMedium, complexityHard,
            minBillablePages);
    }

    public List<CertificationType> toCertificationTypes() {
        List<CertificationType> types = new ArrayList<>();
        for (CertificationTypeEntry entry : certificationTypes) {
            if (entry != null && StringUtils.hasText(entry.getId())) {
                types.add(entry.toCertificationType());
            }
        }
        return types;
    }

    public static class CertificationTypeEntry {

        private String id;
        private String name;
        private String code;
        private BigDecimal price;
        private boolean active = true;
        private int sortOrder;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public BigDecimal getPrice() {
            return price;
        }

        public void setPrice(BigDecimal price) {
            this.price = price;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public int getSortOrder() {
            return sortOrder;
        }

        public void setSortOrder(int sortOrder) {
            this.sortOrder = sortOrder;
        }

        CertificationType toCertificationType() {
            return new CertificationType(id.trim(), name, code, price, active, sortOrder);
        }
    }
}
