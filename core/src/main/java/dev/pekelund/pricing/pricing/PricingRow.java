package dev.pekelund.pricing.pricing;

import dev.pekelund.pricing.analysis.EntryMethod;
import dev.pekelund.pricing.analysis.PricingSnapshot;
import dev.pekelund.pricing.analysis.SnapshotCertification;
import dev.pekelund.pricing.certification.CertificationType;
import dev.pekelund.pricing.settings.Complexity;
import dev.pekelund.pricing.settings.PricingSettings;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Editable billing line for one analysed document.
 *
 * <p>Rows are immutable. Every {@code with...} method returns a new row whose costs were
 * recalculated, so {@code lineTotal == translationCost + certificationCost} holds for every
 * included row and all three are zero for an excluded row.
 */
public record PricingRow(
    String analysisId,
    String fileId,
    String originalFilename,
    String documentType,
    EntryMethod entryMethod,
    int wordCount,
    int pageCount,
    int documentCount,
    BigDecimal billablePages,
    boolean billablePagesOverridden,
    Complexity complexity,
    BigDecimal complexityMultiplier,
    BigDecimal baseRate,
    boolean baseRateOverridden,
    String defaultCertTypeId,
    String defaultCertTypeName,
    BigDecimal defaultCertUnitPrice,
    List<DocumentCertification> documentCertifications,
    boolean hasPerDocCertOverrides,
    boolean excluded,
    BigDecimal translationCost,
    BigDecimal certificationCost,
    BigDecimal lineTotal,
    Instant loadedSavedAt
) {

    public PricingRow {
        Objects.requireNonNull(analysisId, "analysisId must not be null");
        documentCertifications = documentCertifications != null ? List.copyOf(documentCertifications) : List.of();
    }

    public boolean isManual() {
        return entryMethod == EntryMethod.MANUAL;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Change the complexity tier. The billable page count follows the new multiplier unless staff
     * entered it by hand.
     */
    public PricingRow withComplexity(Complexity newComplexity, PricingSettings settings, BigDecimal languageMultiplier) {
        Complexity tier = newComplexity != null ? newComplexity : Complexity.MEDIUM;
        BigDecimal multiplier = settings.multiplierFor(tier);
        Builder builder = toBuilder().complexity(tier).complexityMultiplier(multiplier);
        if (!billablePagesOverridden) {
            builder.billablePages(PricingCalculator.billablePages(wordCount, multiplier, settings));
        }
        return builder.build(languageMultiplier);
    }

    public PricingRow withBillablePages(BigDecimal pages, BigDecimal languageMultiplier) {
        BigDecimal value = PricingCalculator.nonNegative(pages).setScale(1, RoundingMode.HALF_UP);
        return toBuilder()
            .billablePages(value)
            .billablePagesOverridden(true)
            .build(languageMultiplier);
    }

    public PricingRow withBaseRate(BigDecimal rate, BigDecimal languageMultiplier) {
        BigDecimal value = PricingCalculator.nonNegative(rate).setScale(2, RoundingMode.HALF_UP);
        return toBuilder()
            .baseRate(value)
            .baseRateOverridden(true)
            .build(languageMultiplier);
    }

    /**
     * Change the row default certification. Sub-documents follow the new default only while none
     * of them was customized individually.
     */
    public PricingRow withRowCertification(CertificationType type, BigDecimal languageMultiplier) {
        Builder builder = toBuilder().defaultCertification(type);
        if (!hasPerDocCertOverrides) {
            List<DocumentCertification> updated = new ArrayList<>(documentCertifications.size());
            for (DocumentCertification certification : documentCertifications) {
                updated.add(certification.withCertification(type));
            }
            builder.documentCertifications(updated);
        }
        return builder.build(languageMultiplier);
    }

    /**
     * Change the certification of the sub-document at {@code index}. The row is considered
     * manually curated from then on.
     */
    public PricingRow withDocumentCertification(int index, CertificationType type, BigDecimal languageMultiplier) {
        if (index < 0 || index >= documentCertifications.size()) {
            throw new IllegalArgumentException("No sub-document at index " + index + " on row " + analysisId);
        }
        List<DocumentCertification> updated = new ArrayList<>(documentCertifications);
        updated.set(index, updated.get(index).withCertification(type));
        return toBuilder()
            .documentCertifications(updated)
            .hasPerDocCertOverrides(true)
            .build(languageMultiplier);
    }

    public PricingRow withExcluded(boolean value, BigDecimal languageMultiplier) {
        return toBuilder().excluded(value).build(languageMultiplier);
    }

    public PricingRow recalculated(BigDecimal languageMultiplier) {
        return toBuilder().build(languageMultiplier);
    }

    public PricingRow withLoadedSavedAt(Instant savedAt) {
        return toBuilder().loadedSavedAt(savedAt).build(translationCost, certificationCost, lineTotal);
    }

    /**
     * Capture the row's human decisions as a pricing snapshot. Sub-document certifications are
     * only written when they were customized individually.
     */
    public PricingSnapshot toSnapshot(Instant savedAt) {
        List<SnapshotCertification> certifications = null;
        if (hasPerDocCertOverrides) {
            certifications = new ArrayList<>(documentCertifications.size());
            for (DocumentCertification certification : documentCertifications) {
                certifications.add(new SnapshotCertification(
                    certification.index(),
                    certification.certificationTypeId(),
                    certification.price()));
            }
        }
        return new PricingSnapshot(
            billablePages,
            complexity,
            complexityMultiplier,
            baseRate,
            defaultCertTypeId,
            excluded,
            billablePagesOverridden,
            certifications,
            savedAt);
    }

    public static final class Builder {

        private String analysisId;
        private String fileId;
        private String originalFilename;
        private String documentType;
        private EntryMethod entryMethod = EntryMethod.OCR;
        private int wordCount;
        private int pageCount;
        private int documentCount = 1;
        private BigDecimal billablePages = BigDecimal.ZERO.setScale(1);
        private boolean billablePagesOverridden;
        private Complexity complexity = Complexity.MEDIUM;
        private BigDecimal complexityMultiplier = PricingSettings.DEFAULT_MEDIUM_MULTIPLIER;
        private BigDecimal baseRate = PricingSettings.DEFAULT_BASE_RATE;
        private boolean baseRateOverridden;
        private String defaultCertTypeId;
        private String defaultCertTypeName;
        private BigDecimal defaultCertUnitPrice = BigDecimal.ZERO.setScale(2);
        private List<DocumentCertification> documentCertifications = List.of();
        private boolean hasPerDocCertOverrides;
        private boolean excluded;
        private Instant loadedSavedAt;

        public Builder() {
        }

        private Builder(PricingRow row) {
            this.analysisId = row.analysisId;
            this.fileId = row.fileId;
            this.originalFilename = row.originalFilename;
            this.documentType = row.documentType;
            this.entryMethod = row.entryMethod;
            this.wordCount = row.wordCount;
            this.pageCount = row.pageCount;
            this.documentCount = row.documentCount;
            this.billablePages = row.billablePages;
            this.billablePagesOverridden = row.billablePagesOverridden;
            this.complexity = row.complexity;
            this.complexityMultiplier = row.complexityMultiplier;
            this.baseRate = row.baseRate;
            this.baseRateOverridden = row.baseRateOverridden;
            this.defaultCertTypeId = row.defaultCertTypeId;
            this.defaultCertTypeName = row.defaultCertTypeName;
            this.defaultCertUnitPrice = row.defaultCertUnitPrice;
            this.documentCertifications = row.documentCertifications;
            this.hasPerDocCertOverrides = row.hasPerDocCertOverrides;
            this.excluded = row.excluded;
            this.loadedSavedAt = row.loadedSavedAt;
        }

        public Builder analysisId(String analysisId) {
            this.analysisId = analysisId;
            return this;
        }

        public Builder fileId(String fileId) {
            this.fileId = fileId;
            return this;
        }

        public Builder originalFilename(String originalFilename) {
            this.originalFilename = originalFilename;
            return this;
        }

        public Builder documentType(String documentType) {
            this.documentType = documentType;
            return this;
        }

        public Builder entryMethod(EntryMethod entryMethod) {
            this.entryMethod = entryMethod;
            return this;
        }

        public Builder wordCount(int wordCount) {
            this.wordCount = Math.max(0, wordCount);
            return this;
        }

        public Builder pageCount(int pageCount) {
            this.pageCount = Math.max(0, pageCount);
            return this;
        }

        public Builder documentCount(int documentCount) {
            this.documentCount = Math.max(1, documentCount);
            return this;
        }

        public Builder billablePages(BigDecimal billablePages) {
            this.billablePages = PricingCalculator.nonNegative(billablePages).setScale(1, RoundingMode.HALF_UP);
            return this;
        }

        public Builder billablePagesOverridden(boolean billablePagesOverridden) {
            this.billablePagesOverridden = billablePagesOverridden;
            return this;
        }

        public Builder complexity(Complexity complexity) {
            this.complexity = complexity != null ? complexity : Complexity.MEDIUM;
            return this;
        }

        public Builder complexityMultiplier(BigDecimal complexityMultiplier) {
            this.complexityMultiplier = PricingCalculator.nonNegative(complexityMultiplier);
            return this;
        }

        public Builder baseRate(BigDecimal baseRate) {
            this.baseRate = PricingCalculator.nonNegative(baseRate).setScale(2, RoundingMode.HALF_UP);
            return this;
        }

        public Builder baseRateOverridden(boolean baseRateOverridden) {
            this.baseRateOverridden = baseRateOverridden;
            return this;
        }

        public Builder defaultCertification(CertificationType type) {
            if (type == null) {
                return defaultCertification(null, null, null);
            }
            return defaultCertification(type.id(), type.name(), type.unitPrice());
        }

        public Builder defaultCertification(String typeId, String typeName, BigDecimal unitPrice) {
            this.defaultCertTypeId = typeId;
            this.defaultCertTypeName = typeName;
            this.defaultCertUnitPrice = PricingCalculator.nonNegative(unitPrice).setScale(2, RoundingMode.HALF_UP);
            return this;
        }

        public Builder documentCertifications(List<DocumentCertification> documentCertifications) {
            this.documentCertifications = documentCertifications != null ? documentCertifications : List.of();
            return this;
        }

        public Builder hasPerDocCertOverrides(boolean hasPerDocCertOverrides) {
            this.hasPerDocCertOverrides = hasPerDocCertOverrides;
            return this;
        }

        public Builder excluded(boolean excluded) {
            this.excluded = excluded;
            return this;
        }

        public Builder loadedSavedAt(Instant loadedSavedAt) {
            this.loadedSavedAt = loadedSavedAt;
            return this;
        }

        /**
         * Build the row, deriving translation, certification and line totals from the current
         * field values and the sheet's language multiplier.
         */
        public PricingRow build(BigDecimal languageMultiplier) {
            BigDecimal translation = BigDecimal.ZERO.setScale(2);
            BigDecimal certification = BigDecimal.ZERO.setScale(2);
            if (!excluded) {
                BigDecimal rate = PricingCalculator.perPageRate(baseRate, languageMultiplier);
                translation = PricingCalculator.translationCost(billablePages, rate);
                certification = PricingCalculator.certificationCost(documentCertifications);
            }
            BigDecimal total = PricingCalculator.lineTotal(translation, certification, excluded);
            return build(translation, certification, total);
        }

        private PricingRow build(BigDecimal translation, BigDecimal certification, BigDecimal total) {
            return new PricingRow(
                analysisId,
                fileId,
                originalFilename,
                documentType,
                entryMethod,
                wordCount,
                pageCount,
                documentCount,
                billablePages,
                billablePagesOverridden,
                complexity,
                complexityMultiplier,
                baseRate,
                baseRateOverridden,
                defaultCertTypeId,
                defaultCertTypeName,
                defaultCertUnitPrice,
                documentCertifications,
                hasPerDocCertOverrides,
                excluded,
                translation,
                certification,
                total,
                loadedSavedAt);
        }
    }
}
