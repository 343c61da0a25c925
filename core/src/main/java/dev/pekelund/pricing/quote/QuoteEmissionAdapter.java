package dev.pekelund.pricing.quote;

import dev.pekelund.pricing.analysis.AnalysisResult;
import dev.pekelund.pricing.analysis.ProcessingStatus;
import dev.pekelund.pricing.messaging.QuotePricingMessage;
import dev.pekelund.pricing.messaging.QuotePricingMessage.CertificationPricing;
import dev.pekelund.pricing.messaging.QuotePricingMessage.RowPricing;
import dev.pekelund.pricing.pricing.DocumentCertification;
import dev.pekelund.pricing.pricing.PricingRow;
import dev.pekelund.pricing.sheet.Sheet;
import dev.pekelund.pricing.sheet.SheetTotals;
import dev.pekelund.pricing.support.PricingMdc;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Turns the non-excluded rows of a pricing sheet into the payload the quote service expects and
 * hands it over.
 */
public class QuoteEmissionAdapter {

    private static final Logger log = LoggerFactory.getLogger(QuoteEmissionAdapter.class);

    private final QuoteEmitter quoteEmitter;

    public QuoteEmissionAdapter(QuoteEmitter quoteEmitter) {
        this.quoteEmitter = Objects.requireNonNull(quoteEmitter, "quoteEmitter");
    }

    public QuoteReference createQuote(Sheet sheet, String jobId) {
        QuotePricingMessage message = toMessage(sheet, jobId);
        try (PricingMdc.Context ignored = PricingMdc.forJob(sheet.batchId(), jobId)) {
            QuoteReference reference = quoteEmitter.createQuote(message);
            log.info("Created quote {} from {} priced row(s)", reference != null ? reference.quoteNumber() : null,
                message.analysisIds().size());
            return reference;
        }
    }

    public QuoteReference updateQuote(String quoteId, Sheet sheet, String jobId) {
        if (!StringUtils.hasText(quoteId)) {
            throw new IllegalArgumentException("quoteId must not be blank");
        }
        QuotePricingMessage message = toMessage(sheet, jobId);
        try (PricingMdc.Context ignored = PricingMdc.forJob(sheet.batchId(), jobId)) {
            QuoteReference reference = quoteEmitter.updateQuote(quoteId, message);
            log.info("Updated quote {} from {} priced row(s)", quoteId, message.analysisIds().size());
            return reference;
        }
    }

    public static QuotePricingMessage toMessage(Sheet sheet, String jobId) {
        Objects.requireNonNull(sheet, "sheet");
        List<String> analysisIds = new ArrayList<>();
        List<RowPricing> overrides = new ArrayList<>();
        for (PricingRow row : sheet.rows()) {
            if (row.excluded()) {
                continue;
            }
            analysisIds.add(row.analysisId());
            overrides.add(toRowPricing(row));
        }

        SheetTotals totals = sheet.totals();
        List<AnalysisResult> completed = sheet.results().stream()
            .filter(result -> result.processingStatus() == ProcessingStatus.COMPLETED)
            .toList();

        return new QuotePricingMessage(
            jobId,
            sheet.batchId(),
            analysisIds,
            overrides,
            totals.totalDocuments(),
            totals.translationSubtotal(),
            totals.certificationSubtotal(),
            totals.grandTotal(),
            mostCommon(completed, AnalysisResult::detectedLanguage),
            mostCommon(completed, AnalysisResult::issuingCountry));
    }

    private static RowPricing toRowPricing(PricingRow row) {
        List<CertificationPricing> certifications = new ArrayList<>(row.documentCertifications().size());
        for (DocumentCertification certification : row.documentCertifications()) {
            certifications.add(new CertificationPricing(
                certification.index(),
                certification.certificationTypeId(),
                certification.price()));
        }
        return new RowPricing(
            row.analysisId(),
            row.billablePages(),
            row.complexity().value(),
            row.complexityMultiplier(),
            row.baseRate(),
            certifications);
    }

    /**
     * Most frequent non-blank value; ties go to the value seen first.
     */
    static String mostCommon(List<AnalysisResult> results, Function<AnalysisResult, String> extractor) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (AnalysisResult result : results) {
            String value = extractor.apply(result);
            if (StringUtils.hasText(value)) {
                counts.merge(value.trim(), 1, Integer::sum);
            }
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
