package dev.pekelund.pricing.analysis;

import dev.pekelund.pricing.settings.Complexity;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * OCR and AI output for one file or one AI-detected sub-document, together with the pricing
 * snapshot staff saved for it, if any.
 */
public record AnalysisResult(
    String id,
    String batchId,
    String fileId,
    String originalFilename,
    int wordCount,
    int pageCount,
    String documentType,
    Complexity complexity,
    int documentCount,
    List<SubDocument> subDocuments,
    String detectedLanguage,
    String issuingCountry,
    ProcessingStatus processingStatus,
    EntryMethod entryMethod,
    String errorMessage,
    PricingSnapshot pricingSnapshot
) {

    public static final String MANUAL_DOCUMENT_TYPE = "Manual entry";

    public AnalysisResult {
        Objects.requireNonNull(id, "id must not be null");
        wordCount = Math.max(0, wordCount);
        pageCount = Math.max(0, pageCount);
        subDocuments = subDocuments != null ? List.copyOf(subDocuments) : List.of();
        documentCount = documentCount > 0 ? documentCount : Math.max(1, subDocuments.size());
        complexity = complexity != null ? complexity : Complexity.MEDIUM;
        processingStatus = processingStatus != null ? processingStatus : ProcessingStatus.PENDING;
        entryMethod = entryMethod != null ? entryMethod : EntryMethod.OCR;
    }

    /**
     * Create the record backing a document that staff adds by hand: no OCR words, a single
     * document and one page.
     */
    public static AnalysisResult manualEntry(String id, String batchId, String filename) {
        String displayName = filename != null && !filename.isBlank() ? filename.trim() : MANUAL_DOCUMENT_TYPE;
        return new AnalysisResult(
            id,
            batchId,
            null,
            displayName,
            0,
            1,
            MANUAL_DOCUMENT_TYPE,
            Complexity.MEDIUM,
            1,
            List.of(),
            null,
            null,
            ProcessingStatus.MANUAL,
            EntryMethod.MANUAL,
            null,
            null);
    }

    public boolean isManual() {
        return entryMethod == EntryMethod.MANUAL;
    }

    /**
     * Records are priced once analysis finished (successfully or not) or when staff entered
     * them by hand. Records still waiting for analysis are left off the sheet.
     */
    public boolean isPriceable() {
        return isManual()
            || processingStatus == ProcessingStatus.COMPLETED
            || processingStatus == ProcessingStatus.MANUAL
            || processingStatus == ProcessingStatus.FAILED;
    }

    public boolean hasPricingSnapshot() {
        return pricingSnapshot != null && pricingSnapshot.savedAt() != null;
    }

    public Instant pricingSavedAt() {
        return pricingSnapshot != null ? pricingSnapshot.savedAt() : null;
    }

    public AnalysisResult withPricingSnapshot(PricingSnapshot snapshot) {
        return new AnalysisResult(id, batchId, fileId, originalFilename, wordCount, pageCount, documentType,
            complexity, documentCount, subDocuments, detectedLanguage, issuingCountry, processingStatus,
            entryMethod, errorMessage, snapshot);
    }
}
