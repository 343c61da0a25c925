package dev.pekelund.pricing.sheet;

import dev.pekelund.pricing.analysis.AnalysisResult;
import dev.pekelund.pricing.analysis.PricingSnapshot;
import dev.pekelund.pricing.certification.CertificationType;
import dev.pekelund.pricing.certification.CertificationTypes;
import dev.pekelund.pricing.pricing.PricingRow;
import dev.pekelund.pricing.pricing.PricingRowBuilder;
import dev.pekelund.pricing.settings.Complexity;
import dev.pekelund.pricing.settings.PricingSettings;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.springframework.util.StringUtils;

/**
 * Immutable pricing sheet of one batch: the analysis records it was built from and one pricing
 * row per priceable record, in store order.
 *
 * <p>Edits never mutate a sheet. Each returns a {@link SheetTransition} holding the edited sheet
 * and the record store effects the edit implies; applying those effects is left to the caller.
 * Edits referencing unknown rows or certification types throw {@link PricingSheetException}.
 */
public final class Sheet {

    public static final BigDecimal DEFAULT_LANGUAGE_MULTIPLIER = new BigDecimal("1.00");

    private static final PricingRowBuilder ROW_BUILDER = new PricingRowBuilder();

    private final String batchId;
    private final PricingSettings settings;
    private final CertificationTypes certificationTypes;
    private final BigDecimal languageMultiplier;
    private final Map<String, AnalysisResult> results;
    private final Map<String, PricingRow> rows;

    private Sheet(String batchId, PricingSettings settings, CertificationTypes certificationTypes,
        BigDecimal languageMultiplier, Map<String, AnalysisResult> results, Map<String, PricingRow> rows) {
        this.batchId = batchId;
        this.settings = settings;
        this.certificationTypes = certificationTypes;
        this.languageMultiplier = languageMultiplier;
        this.results = Collections.unmodifiableMap(results);
        this.rows = Collections.unmodifiableMap(rows);
    }

    public static Sheet build(String batchId, List<AnalysisResult> records, PricingSettings settings,
        CertificationTypes certificationTypes) {
        return build(batchId, records, settings, certificationTypes, DEFAULT_LANGUAGE_MULTIPLIER);
    }

    public static Sheet build(String batchId, List<AnalysisResult> records, PricingSettings settings,
        CertificationTypes certificationTypes, BigDecimal languageMultiplier) {

        Objects.requireNonNull(batchId, "batchId");
        PricingSettings effectiveSettings = settings != null ? settings : PricingSettings.defaults();
        CertificationTypes types = certificationTypes != null ? certificationTypes : CertificationTypes.empty();
        BigDecimal multiplier = normalizeMultiplier(languageMultiplier);

        Map<String, AnalysisResult> results = new LinkedHashMap<>();
        Map<String, PricingRow> rows = new LinkedHashMap<>();
        if (records != null) {
            for (AnalysisResult record : records) {
                if (record == null || results.containsKey(record.id())) {
                    continue;
                }
                results.put(record.id(), record);
                ROW_BUILDER.buildRow(record, effectiveSettings, types, multiplier)
                    .ifPresent(row -> rows.put(row.analysisId(), row));
            }
        }
        return new Sheet(batchId, effectiveSettings, types, multiplier, results, rows);
    }

    public String batchId() {
        return batchId;
    }

    public PricingSettings settings() {
        return settings;
    }

    public CertificationTypes certificationTypes() {
        return certificationTypes;
    }

    public BigDecimal languageMultiplier() {
        return languageMultiplier;
    }

    /**
     * All records of the batch, including records still pending analysis.
     */
    public List<AnalysisResult> results() {
        return List.copyOf(results.values());
    }

    public Optional<AnalysisResult> result(String analysisId) {
        return Optional.ofNullable(results.get(analysisId));
    }

    public List<PricingRow> rows() {
        return List.copyOf(rows.values());
    }

    public Optional<PricingRow> row(String analysisId) {
        return Optional.ofNullable(rows.get(analysisId));
    }

    public SheetTotals totals() {
        return SheetTotals.of(rows.values());
    }

    public SheetTransition editComplexity(String analysisId, Complexity complexity) {
        return replaceRow(analysisId, row -> row.withComplexity(complexity, settings, languageMultiplier));
    }

    public SheetTransition editBillablePages(String analysisId, BigDecimal billablePages) {
        return replaceRow(analysisId, row -> row.withBillablePages(billablePages, languageMultiplier));
    }

    public SheetTransition editBaseRate(String analysisId, BigDecimal baseRate) {
        return replaceRow(analysisId, row -> row.withBaseRate(baseRate, languageMultiplier));
    }

    /**
     * Change the default certification of a row. A blank type id removes the certification.
     */
    public SheetTransition changeRowCertification(String analysisId, String certificationTypeId) {
        requireRow(analysisId);
        CertificationType type = resolveCertification(certificationTypeId);
        return replaceRow(analysisId, row -> row.withRowCertification(type, languageMultiplier));
    }

    public SheetTransition changeDocumentCertification(String analysisId, int index, String certificationTypeId) {
        PricingRow current = requireRow(analysisId);
        if (index < 0 || index >= current.documentCertifications().size()) {
            throw new PricingSheetException("Row " + analysisId + " has no sub-document at index " + index);
        }
        CertificationType type = resolveCertification(certificationTypeId);
        return replaceRow(analysisId, row -> row.withDocumentCertification(index, type, languageMultiplier));
    }

    public SheetTransition setExcluded(String analysisId, boolean excluded) {
        return replaceRow(analysisId, row -> row.withExcluded(excluded, languageMultiplier));
    }

    public SheetTransition toggleExcluded(String analysisId) {
        return setExcluded(analysisId, !requireRow(analysisId).excluded());
    }

    /**
     * Append a document entered by hand. The returned transition carries the insert of its
     * backing record.
     */
    public SheetTransition addManualDocument(String analysisId, String filename) {
        if (!StringUtils.hasText(analysisId)) {
            throw new PricingSheetException("A manual document needs an id");
        }
        if (results.containsKey(analysisId)) {
            throw new PricingSheetException("Analysis " + analysisId + " already exists in batch " + batchId);
        }
        AnalysisResult record = AnalysisResult.manualEntry(analysisId, batchId, filename);
        PricingRow row = ROW_BUILDER.buildRow(record, settings, certificationTypes, languageMultiplier)
            .orElseThrow(() -> new IllegalStateException("Manual entry " + analysisId + " is not priceable"));

        Map<String, AnalysisResult> nextResults = new LinkedHashMap<>(results);
        nextResults.put(analysisId, record);
        Map<String, PricingRow> nextRows = new LinkedHashMap<>(rows);
        nextRows.put(analysisId, row);
        Sheet next = new Sheet(batchId, settings, certificationTypes, languageMultiplier, nextResults, nextRows);
        return SheetTransition.of(next, new SheetEffect.InsertAnalysisResult(record));
    }

    /**
     * Remove a document that was entered by hand. Rows backed by OCR output cannot be deleted.
     */
    public SheetTransition deleteManualDocument(String analysisId) {
        PricingRow row = requireRow(analysisId);
        if (!row.isManual()) {
            throw new PricingSheetException("Only manually added documents can be deleted; " + analysisId
                + " came from analysis");
        }
        Map<String, AnalysisResult> nextResults = new LinkedHashMap<>(results);
        nextResults.remove(analysisId);
        Map<String, PricingRow> nextRows = new LinkedHashMap<>(rows);
        nextRows.remove(analysisId);
        Sheet next = new Sheet(batchId, settings, certificationTypes, languageMultiplier, nextResults, nextRows);
        return SheetTransition.of(next, new SheetEffect.DeleteAnalysisResult(batchId, analysisId));
    }

    /**
     * Apply the target language's price multiplier to every row.
     */
    public SheetTransition withLanguageMultiplier(BigDecimal multiplier) {
        BigDecimal normalized = normalizeMultiplier(multiplier);
        Map<String, PricingRow> nextRows = new LinkedHashMap<>();
        rows.forEach((id, row) -> nextRows.put(id, row.recalculated(normalized)));
        return SheetTransition.of(new Sheet(batchId, settings, certificationTypes, normalized,
            new LinkedHashMap<>(results), nextRows));
    }

    /**
     * Record snapshots that were written to the store, so later saves compare against them.
     */
    Sheet withSavedSnapshots(Map<String, PricingSnapshot> snapshots) {
        if (snapshots.isEmpty()) {
            return this;
        }
        Map<String, AnalysisResult> nextResults = new LinkedHashMap<>(results);
        Map<String, PricingRow> nextRows = new LinkedHashMap<>(rows);
        snapshots.forEach((id, snapshot) -> {
            nextResults.computeIfPresent(id, (key, record) -> record.withPricingSnapshot(snapshot));
            nextRows.computeIfPresent(id, (key, row) -> row.withLoadedSavedAt(snapshot.savedAt()));
        });
        return new Sheet(batchId, settings, certificationTypes, languageMultiplier, nextResults, nextRows);
    }

    private SheetTransition replaceRow(String analysisId, UnaryOperator<PricingRow> edit) {
        PricingRow current = requireRow(analysisId);
        Map<String, PricingRow> nextRows = new LinkedHashMap<>(rows);
        nextRows.put(analysisId, edit.apply(current));
        return SheetTransition.of(new Sheet(batchId, settings, certificationTypes, languageMultiplier,
            new LinkedHashMap<>(results), nextRows));
    }

    private PricingRow requireRow(String analysisId) {
        PricingRow row = analysisId != null ? rows.get(analysisId) : null;
        if (row == null) {
            throw PricingSheetException.unknownRow(analysisId);
        }
        return row;
    }

    private CertificationType resolveCertification(String certificationTypeId) {
        if (!StringUtils.hasText(certificationTypeId)) {
            return null;
        }
        return certificationTypes.findById(certificationTypeId)
            .orElseThrow(() -> PricingSheetException.unknownCertification(certificationTypeId));
    }

    private static BigDecimal normalizeMultiplier(BigDecimal multiplier) {
        return multiplier != null && multiplier.signum() > 0 ? multiplier : DEFAULT_LANGUAGE_MULTIPLIER;
    }
}
