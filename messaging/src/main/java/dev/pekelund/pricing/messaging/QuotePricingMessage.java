package dev.pekelund.pricing.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Payload handed to the quote service when a quote is created or updated from a finalized
 * pricing sheet. Only rows that were not excluded on the sheet are included.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuotePricingMessage(
    @JsonProperty("jobId") String jobId,
    @JsonProperty("batchId") String batchId,
    @JsonProperty("analysisIds") List<String> analysisIds,
    @JsonProperty("pricingOverrides") List<RowPricing> pricingOverrides,
    @JsonProperty("totalDocuments") int totalDocuments,
    @JsonProperty("translationSubtotal") BigDecimal translationSubtotal,
    @JsonProperty("certificationSubtotal") BigDecimal certificationSubtotal,
    @JsonProperty("grandTotal") BigDecimal grandTotal,
    @JsonProperty("detectedSourceLanguage") String detectedSourceLanguage,
    @JsonProperty("detectedIssuingCountry") String detectedIssuingCountry
) {

    public QuotePricingMessage {
        Objects.requireNonNull(batchId, "batchId must not be null");
        analysisIds = analysisIds != null ? List.copyOf(analysisIds) : List.of();
        pricingOverrides = pricingOverrides != null ? List.copyOf(pricingOverrides) : List.of();
    }

    /**
     * Pricing decisions for a single analysed document.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RowPricing(
        @JsonProperty("analysisId") String analysisId,
        @JsonProperty("billablePages") BigDecimal billablePages,
        @JsonProperty("complexity") String complexity,
        @JsonProperty("complexityMultiplier") BigDecimal complexityMultiplier,
        @JsonProperty("baseRate") BigDecimal baseRate,
        @JsonProperty("documentCertifications") List<CertificationPricing> documentCertifications
    ) {

        public RowPricing {
            documentCertifications = documentCertifications != null ? List.copyOf(documentCertifications) : List.of();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CertificationPricing(
        @JsonProperty("index") int index,
        @JsonProperty("certificationTypeId") String certificationTypeId,
        @JsonProperty("certificationPrice") BigDecimal certificationPrice
    ) {
    }
}
