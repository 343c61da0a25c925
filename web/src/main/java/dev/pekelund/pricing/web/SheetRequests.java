package dev.pekelund.pricing.web;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request bodies accepted by {@link PricingSheetController}.
 */
public final class SheetRequests {

    private SheetRequests() {
    }

    public record OpenSheet(BigDecimal languageMultiplier) {
    }

    public record ComplexityEdit(String complexity) {
    }

    public record BillablePagesEdit(BigDecimal billablePages) {
    }

    public record BaseRateEdit(BigDecimal baseRate) {
    }

    public record CertificationChange(String certificationTypeId) {
    }

    public record ExclusionChange(boolean excluded) {
    }

    public record LanguageMultiplierChange(BigDecimal languageMultiplier) {
    }

    public record ManualDocument(String filename) {
    }

    public record StartAnalysis(List<String> fileIds) {
    }

    public record QuoteRequest(String jobId) {
    }

    public record ManualDocumentCreated(String analysisId, SheetView sheet) {
    }

    public record ApiError(String error) {
    }
}
