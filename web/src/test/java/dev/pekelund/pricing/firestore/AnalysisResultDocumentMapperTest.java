package dev.pekelund.pricing.firestore;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.cloud.Timestamp;
import dev.pekelund.pricing.analysis.AnalysisResult;
import dev.pekelund.pricing.analysis.EntryMethod;
import dev.pekelund.pricing.analysis.PricingSnapshot;
import dev.pekelund.pricing.analysis.ProcessingStatus;
import dev.pekelund.pricing.analysis.SnapshotCertification;
import dev.pekelund.pricing.certification.CertificationType;
import dev.pekelund.pricing.settings.Complexity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnalysisResultDocumentMapperTest {

    private static final Instant SAVED_AT = Instant.parse("2024-06-01T10:15:30.123456Z");

    @Test
    void readsSnakeCaseDocument() {
        Map<String, Object> data = new HashMap<>();
        data.put("batch_id", "batch-1");
        data.put("file_id", "file-1");
        data.put("original_filename", "passport.pdf");
        data.put("word_count", 450L);
        data.put("page_count", 2L);
        data.put("document_type", "Passport");
        data.put("complexity", "hard");
        data.put("document_count", 2L);
        data.put("sub_documents", List.of(
            Map.of("document_type", "Passport", "holder_name", "Ana Ruiz", "page_range", "1"),
            Map.of("type", "Visa", "holder_name", "Ana Ruiz")));
        data.put("detected_language", "es");
        data.put("issuing_country", "MX");
        data.put("processing_status", "completed");
        data.put("entry_method", "ocr");

        AnalysisResult result = AnalysisResultDocumentMapper.fromDocument("a-1", data);

        assertThat(result.id()).isEqualTo("a-1");
        assertThat(result.batchId()).isEqualTo("batch-1");
        assertThat(result.wordCount()).isEqualTo(450);
        assertThat(result.complexity()).isEqualTo(Complexity.HARD);
        assertThat(result.documentCount()).isEqualTo(2);
        assertThat(result.subDocuments()).extracting("type").containsExactly("Passport", "Visa");
        assertThat(result.processingStatus()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(result.hasPricingSnapshot()).isFalse();
    }

    @Test
    void readsCamelCasePricingSnapshot() {
        Map<String, Object> data = new HashMap<>();
        data.put("batchId", "batch-1");
        data.put("wordCount", 300);
        data.put("processingStatus", "completed");
        data.put("pricingBillablePages", 3.0);
        data.put("pricingComplexity", "easy");
        data.put("pricingComplexityMultiplier", 1.0);
        data.put("pricingBaseRate", 70.0);
        data.put("pricingCertificationTypeId", "notary");
        data.put("pricingIsExcluded", true);
        data.put("pricingIsBillableOverridden", true);
        data.put("pricingDocumentCertifications", List.of(
            Map.of("index", 0L, "certificationTypeId", "express", "price", 50.0)));
        data.put("pricingSavedAt", "2024-06-01T10:15:30Z");

        AnalysisResult result = AnalysisResultDocumentMapper.fromDocument("a-2", data);
        PricingSnapshot snapshot = result.pricingSnapshot();

        assertThat(result.batchId()).isEqualTo("batch-1");
        assertThat(snapshot).isNotNull();
        assertThat(snapshot.billablePages()).isEqualByComparingTo("3.0");
        assertThat(snapshot.complexity()).isEqualTo(Complexity.EASY);
        assertThat(snapshot.baseRate()).isEqualByComparingTo("70.00");
        assertThat(snapshot.excluded()).isTrue();
        assertThat(snapshot.billableOverridden()).isTrue();
        assertThat(snapshot.documentCertifications())
            .containsExactly(new SnapshotCertification(0, "express", new BigDecimal("50.00")));
        assertThat(snapshot.savedAt()).isEqualTo(Instant.parse("2024-06-01T10:15:30Z"));
    }

    @Test
    void recordWithoutSavedAtHasNoSnapshot() {
        Map<String, Object> data = Map.of(
            "batch_id", "batch-1",
            "pricing_billable_pages", 4.0,
            "pricing_base_rate", 80.0);

        AnalysisResult result = AnalysisResultDocumentMapper.fromDocument("a-3", data);

        assertThat(result.pricingSnapshot()).isNull();
    }

    @Test
    void writesPricingFieldsInSnakeCase() {
        PricingSnapshot snapshot = new PricingSnapshot(new BigDecimal("2.3"), Complexity.MEDIUM,
            new BigDecimal("1.15"), new BigDecimal("65.00"), "notary", false, false, null, SAVED_AT);

        Map<String, Object> fields = AnalysisResultDocumentMapper.toPricingFields(snapshot);

        assertThat(fields)
            .containsEntry("pricing_billable_pages", 2.3)
            .containsEntry("pricing_complexity", "medium")
            .containsEntry("pricing_base_rate", 65.0)
            .containsEntry("pricing_certification_type_id", "notary")
            .containsEntry("pricing_is_excluded", false)
            .containsEntry("pricing_document_certifications", null)
            .containsEntry("pricing_saved_at", Timestamp.ofTimeSecondsAndNanos(SAVED_AT.getEpochSecond(), SAVED_AT.getNano()));
    }

    @Test
    void writtenSnapshotReadsBackUnchanged() {
        PricingSnapshot snapshot = new PricingSnapshot(new BigDecimal("1.0"), Complexity.HARD,
            new BigDecimal("1.25"), new BigDecimal("72.50"), "notary", true, true,
            List.of(new SnapshotCertification(0, "notary", new BigDecimal("30.00")),
                new SnapshotCertification(1, "express", new BigDecimal("50.00"))),
            SAVED_AT);
        AnalysisResult record = new AnalysisResult("a-4", "batch-1", null, "Manual.pdf", 0, 1, "Manual entry",
            Complexity.MEDIUM, 2, List.of(), null, null, ProcessingStatus.MANUAL, EntryMethod.MANUAL, null, snapshot);

        Map<String, Object> document = AnalysisResultDocumentMapper.toDocument(record, SAVED_AT);
        AnalysisResult restored = AnalysisResultDocumentMapper.fromDocument("a-4", document);

        assertThat(restored.entryMethod()).isEqualTo(EntryMethod.MANUAL);
        assertThat(restored.pricingSnapshot().savedAt()).isEqualTo(SAVED_AT);
        assertThat(restored.pricingSnapshot().documentCertifications())
            .isEqualTo(snapshot.documentCertifications());
        assertThat(restored.pricingSnapshot().baseRate()).isEqualByComparingTo("72.50");
        assertThat(AnalysisResultDocumentMapper.createdAt(document)).isEqualTo(SAVED_AT);
    }

    @Test
    void certificationTypeAcceptsBothFieldSpellings() {
        CertificationType type = FirestoreCertificationTypeCatalog.toCertificationType("notary", Map.of(
            "name", "Notarization",
            "code", "notarization",
            "unit_price", 30.0,
            "isActive", true,
            "sortOrder", 2L));

        assertThat(type.unitPrice()).isEqualByComparingTo("30.00");
        assertThat(type.active()).isTrue();
        assertThat(type.sortOrder()).isEqualTo(2);
    }

    @Test
    void camelCaseConversion() {
        assertThat(AnalysisResultDocumentMapper.toCamelCase("pricing_is_billable_overridden"))
            .isEqualTo("pricingIsBillableOverridden");
    }

    @Test
    void nestedMapsKeepTextualKeysAndSkipNullKeys() {
        Map<Object, Object> nested = new HashMap<>();
        nested.put(1, "one");
        nested.put("holder_name", "Ana Ruiz");
        nested.put(null, "dropped");

        Map<String, Object> converted = AnalysisResultDocumentMapper.toStringObjectMap(nested);

        assertThat(converted).containsOnly(
            Map.entry("1", "one"),
            Map.entry("holder_name", "Ana Ruiz"));
        assertThat(AnalysisResultDocumentMapper.toStringObjectMap("not a map")).isEmpty();
    }
}
