package dev.pekelund.pricing.quote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.pekelund.pricing.analysis.AnalysisResult;
import dev.pekelund.pricing.analysis.EntryMethod;
import dev.pekelund.pricing.analysis.ProcessingStatus;
import dev.pekelund.pricing.certification.CertificationType;
import dev.pekelund.pricing.certification.CertificationTypes;
import dev.pekelund.pricing.messaging.QuotePricingMessage;
import dev.pekelund.pricing.messaging.QuotePricingMessage.RowPricing;
import dev.pekelund.pricing.settings.Complexity;
import dev.pekelund.pricing.settings.PricingSettings;
import dev.pekelund.pricing.sheet.Sheet;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class QuoteEmissionAdapterTest {

    private static final CertificationTypes CERTIFICATIONS = CertificationTypes.of(List.of(
        new CertificationType("notary", "Notarization", "notarization", new BigDecimal("30.00"), true, 1)));

    @Test
    void includesOnlyRowsThatAreNotExcluded() {
        Sheet sheet = sheet(
            result("a-1", "es", "MX", ProcessingStatus.COMPLETED),
            result("a-2", "es", "ES", ProcessingStatus.COMPLETED),
            result("a-3", "pt", "BR", ProcessingStatus.COMPLETED))
            .editComplexity("a-2", Complexity.HARD).sheet()
            .setExcluded("a-3", true).sheet();

        QuotePricingMessage message = QuoteEmissionAdapter.toMessage(sheet, "job-1");

        assertThat(message.jobId()).isEqualTo("job-1");
        assertThat(message.batchId()).isEqualTo("batch-1");
        assertThat(message.analysisIds()).containsExactly("a-1", "a-2");
        assertThat(message.totalDocuments()).isEqualTo(2);
        assertThat(message.translationSubtotal()).isEqualByComparingTo("312.00");
        assertThat(message.certificationSubtotal()).isEqualByComparingTo("60.00");
        assertThat(message.grandTotal()).isEqualByComparingTo("372.00");

        RowPricing hard = message.pricingOverrides().get(1);
        assertThat(hard.analysisId()).isEqualTo("a-2");
        assertThat(hard.complexity()).isEqualTo("hard");
        assertThat(hard.complexityMultiplier()).isEqualByComparingTo("1.25");
        assertThat(hard.billablePages()).isEqualByComparingTo("2.5");
        assertThat(hard.baseRate()).isEqualByComparingTo("65.00");
        assertThat(hard.documentCertifications()).singleElement().satisfies(certification -> {
            assertThat(certification.index()).isZero();
            assertThat(certification.certificationTypeId()).isEqualTo("notary");
            assertThat(certification.certificationPrice()).isEqualByComparingTo("30.00");
        });
    }

    @Test
    void carriesMostCommonLanguageAndCountryOfCompletedResults() {
        Sheet sheet = sheet(
            result("a-1", "pt", "BR", ProcessingStatus.FAILED),
            result("a-2", "pt", "BR", ProcessingStatus.FAILED),
            result("a-3", "es", "MX", ProcessingStatus.COMPLETED),
            result("a-4", "fr", "CO", ProcessingStatus.COMPLETED),
            result("a-5", "fr", "MX", ProcessingStatus.COMPLETED));

        QuotePricingMessage message = QuoteEmissionAdapter.toMessage(sheet, null);

        assertThat(message.detectedSourceLanguage()).isEqualTo("fr");
        assertThat(message.detectedIssuingCountry()).isEqualTo("MX");
    }

    @Test
    void tiesGoToTheFirstValueSeen() {
        Sheet sheet = sheet(
            result("a-1", "de", "AT", ProcessingStatus.COMPLETED),
            result("a-2", "it", "CH", ProcessingStatus.COMPLETED));

        QuotePricingMessage message = QuoteEmissionAdapter.toMessage(sheet, null);

        assertThat(message.detectedSourceLanguage()).isEqualTo("de");
        assertThat(message.detectedIssuingCountry()).isEqualTo("AT");
    }

    @Test
    void handsMessageToQuoteService() {
        QuoteEmitter emitter = mock(QuoteEmitter.class);
        when(emitter.updateQuote(eq("q-9"), any())).thenReturn(new QuoteReference("q-9", "Q-2024-0009"));
        QuoteEmissionAdapter adapter = new QuoteEmissionAdapter(emitter);
        Sheet sheet = sheet(result("a-1", "es", "MX", ProcessingStatus.COMPLETED));

        QuoteReference reference = adapter.updateQuote("q-9", sheet, "job-1");

        ArgumentCaptor<QuotePricingMessage> message = ArgumentCaptor.forClass(QuotePricingMessage.class);
        verify(emitter).updateQuote(eq("q-9"), message.capture());
        assertThat(message.getValue().analysisIds()).containsExactly("a-1");
        assertThat(reference.quoteNumber()).isEqualTo("Q-2024-0009");
    }

    private static Sheet sheet(AnalysisResult... results) {
        return Sheet.build("batch-1", List.of(results), PricingSettings.defaults(), CERTIFICATIONS);
    }

    private static AnalysisResult result(String id, String language, String country, ProcessingStatus status) {
        return new AnalysisResult(id, "batch-1", "file-" + id, id + ".pdf", 450, 1, "Diploma", Complexity.MEDIUM, 1,
            List.of(), language, country, status, EntryMethod.OCR, null, null);
    }
}
