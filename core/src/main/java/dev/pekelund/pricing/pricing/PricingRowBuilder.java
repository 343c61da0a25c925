package dev.pekelund.pricing.pricing;

import dev.pekelund.pricing.analysis.AnalysisResult;
import dev.pekelund.pricing.analysis.PricingSnapshot;
import dev.pekelund.pricing.analysis.SnapshotCertification;
import dev.pekelund.pricing.analysis.SubDocument;
import dev.pekelund.pricing.certification.CertificationType;
import dev.pekelund.pricing.certification.CertificationTypes;
import dev.pekelund.pricing.settings.Complexity;
import dev.pekelund.pricing.settings.PricingSettings;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Derives pricing rows from analysis results.
 *
 * <p>A record carrying a saved pricing snapshot is rebuilt from that snapshot; AI output is
 * only used for records nobody has priced yet. Building is deterministic: the same results,
 * settings and certification types always produce equal rows.
 */
public class PricingRowBuilder {

    private static final Logger log = LoggerFactory.getLogger(PricingRowBuilder.class);

    static final BigDecimal MANUAL_DOCUMENT_PAGES = new BigDecimal("1.0");

    /**
     * Upper bound on the sub-documents a saved snapshot may add to a row. Entries indexed at or
     * beyond it are dropped when the row is rebuilt.
     */
    static final int MAX_SUB_DOCUMENTS = 200;

    public List<PricingRow> buildRows(List<AnalysisResult> results, PricingSettings settings,
        CertificationTypes certificationTypes, BigDecimal languageMultiplier) {

        if (results == null || results.isEmpty()) {
            return List.of();
        }
        List<PricingRow> rows = new ArrayList<>();
        for (AnalysisResult result : results) {
            buildRow(result, settings, certificationTypes, languageMultiplier).ifPresent(rows::add);
        }
        return List.copyOf(rows);
    }

    /**
     * Build the row for a single record, or nothing when the record is still waiting for
     * analysis.
     */
    public Optional<PricingRow> buildRow(AnalysisResult result, PricingSettings settings,
        CertificationTypes certificationTypes, BigDecimal languageMultiplier) {

        if (result == null || !result.isPriceable()) {
            return Optional.empty();
        }
        CertificationTypes types = certificationTypes != null ? certificationTypes : CertificationTypes.empty();
        PricingRow.Builder builder = new PricingRow.Builder()
            .analysisId(result.id())
            .fileId(result.fileId())
            .originalFilename(result.originalFilename())
            .documentType(result.documentType())
            .entryMethod(result.entryMethod())
            .wordCount(result.wordCount())
            .pageCount(result.pageCount());

        if (result.hasPricingSnapshot()) {
            applySnapshot(builder, result, result.pricingSnapshot(), settings, types);
        } else {
            applyDefaults(builder, result, settings, types);
        }
        return Optional.of(builder.build(languageMultiplier));
    }

    private void applyDefaults(PricingRow.Builder builder, AnalysisResult result, PricingSettings settings,
        CertificationTypes types) {

        Complexity complexity = result.complexity();
        BigDecimal multiplier = settings.multiplierFor(complexity);
        CertificationType defaultType = types.defaultType().orElse(null);

        builder.complexity(complexity)
            .complexityMultiplier(multiplier)
            .baseRate(settings.baseRate())
            .baseRateOverridden(false)
            .defaultCertification(defaultType)
            .documentCount(result.documentCount())
            .documentCertifications(replicate(result, result.documentCount(), defaultType))
            .hasPerDocCertOverrides(false)
            .excluded(false)
            .loadedSavedAt(null);

        if (result.isManual()) {
            // Manual documents carry no OCR words; they bill one page until staff says otherwise.
            builder.billablePages(MANUAL_DOCUMENT_PAGES).billablePagesOverridden(true);
        } else {
            builder.billablePages(PricingCalculator.billablePages(result.wordCount(), multiplier, settings))
                .billablePagesOverridden(false);
        }
    }

    private void applySnapshot(PricingRow.Builder builder, AnalysisResult result, PricingSnapshot snapshot,
        PricingSettings settings, CertificationTypes types) {

        Complexity complexity = snapshot.complexity() != null ? snapshot.complexity() : result.complexity();
        BigDecimal multiplier = snapshot.complexityMultiplier() != null && snapshot.complexityMultiplier().signum() > 0
            ? snapshot.complexityMultiplier()
            : settings.multiplierFor(complexity);
        BigDecimal billablePages = snapshot.billablePages() != null
            ? snapshot.billablePages()
            : PricingCalculator.billablePages(result.wordCount(), multiplier, settings);
        BigDecimal baseRate = snapshot.baseRate() != null ? snapshot.baseRate() : settings.baseRate();
        boolean baseRateOverridden = snapshot.baseRate() != null
            && snapshot.baseRate().compareTo(settings.baseRate()) != 0;

        CertificationType rowType = resolveRowCertification(result, snapshot.certificationTypeId(), types);

        int documentCount = result.documentCount();
        List<DocumentCertification> certifications;
        if (snapshot.hasDocumentCertifications()) {
            int limit = Math.max(result.documentCount(), MAX_SUB_DOCUMENTS);
            List<SnapshotCertification> saved = new ArrayList<>();
            for (SnapshotCertification entry : snapshot.documentCertifications()) {
                if (entry.index() >= limit) {
                    log.warn("Ignoring saved certification of {} at sub-document index {}; rows hold at most {}",
                        result.id(), entry.index(), limit);
                    continue;
                }
                saved.add(entry);
                documentCount = Math.max(documentCount, entry.index() + 1);
            }
            certifications = rehydrate(result, documentCount, saved, rowType, types);
        } else {
            certifications = replicate(result, documentCount, rowType);
        }

        builder.complexity(complexity)
            .complexityMultiplier(multiplier)
            .billablePages(billablePages)
            .billablePagesOverridden(snapshot.billableOverridden())
            .baseRate(baseRate)
            .baseRateOverridden(baseRateOverridden)
            .defaultCertification(rowType)
            .documentCount(documentCount)
            .documentCertifications(certifications)
            .hasPerDocCertOverrides(snapshot.hasDocumentCertifications())
            .excluded(snapshot.excluded())
            .loadedSavedAt(snapshot.savedAt());
    }

    private CertificationType resolveRowCertification(AnalysisResult result, String typeId, CertificationTypes types) {
        if (!StringUtils.hasText(typeId)) {
            return types.defaultType().orElse(null);
        }
        Optional<CertificationType> type = types.findById(typeId);
        if (type.isEmpty()) {
            log.warn("Pricing snapshot of {} references unknown certification type {}; using the default",
                result.id(), typeId);
        }
        return type.or(types::defaultType).orElse(null);
    }

    private List<DocumentCertification> replicate(AnalysisResult result, int documentCount, CertificationType type) {
        List<DocumentCertification> certifications = new ArrayList<>(documentCount);
        for (int index = 0; index < documentCount; index++) {
            certifications.add(placeholder(result, index).withCertification(type));
        }
        return certifications;
    }

    private List<DocumentCertification> rehydrate(AnalysisResult result, int documentCount,
        List<SnapshotCertification> saved, CertificationType rowType, CertificationTypes types) {

        Map<Integer, SnapshotCertification> byIndex = new HashMap<>();
        for (SnapshotCertification entry : saved) {
            byIndex.putIfAbsent(entry.index(), entry);
        }

        List<DocumentCertification> certifications = new ArrayList<>(documentCount);
        for (int index = 0; index < documentCount; index++) {
            DocumentCertification placeholder = placeholder(result, index);
            SnapshotCertification entry = byIndex.get(index);
            if (entry == null || !StringUtils.hasText(entry.certificationTypeId())) {
                certifications.add(placeholder.withCertification(rowType));
                continue;
            }
            String typeName = types.findById(entry.certificationTypeId())
                .map(CertificationType::name)
                .orElse(entry.certificationTypeId());
            certifications.add(placeholder.withCertification(entry.certificationTypeId(), typeName, entry.price()));
        }
        return certifications;
    }

    private DocumentCertification placeholder(AnalysisResult result, int index) {
        List<SubDocument> subDocuments = result.subDocuments();
        SubDocument subDocument = index < subDocuments.size() ? subDocuments.get(index) : null;
        String type = subDocument != null && StringUtils.hasText(subDocument.type())
            ? subDocument.type()
            : result.documentType();
        String holder = subDocument != null && StringUtils.hasText(subDocument.holderName())
            ? subDocument.holderName()
            : "Document " + (index + 1);
        return new DocumentCertification(index, type, holder, null, null, null);
    }
}
