package dev.pekelund.pricing.pricing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import dev.pekelund.pricing.analysis.AnalysisResult;
import dev.pekelund.pricing.analysis.EntryMethod;
import dev.pekelund.pricing.analysis.PricingSnapshot;
import dev.pekelund.pricing.analysis.ProcessingStatus;
import dev.pekelund.pricing.analysis.SnapshotCertification;
import dev.pekelund.pricing.analysis.SubDocument;
import dev.pekelund.pricing.certification.CertificationType;
import dev.pekelund.pricing.certification.CertificationTypes;
import dev.pekelund.pricing.settings.Complexity;
import dev.pekelund.pricing.settings.PricingSettings;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class PricingRowBuilderTest {

    private static final Instant SAVED_AT = Instant.parse("2024-05-02T09:15:00Z");

    private final PricingRowBuilder builder = new PricingRowBuilder();
    private final PricingSettings settings = PricingSettings.defaults();
    private final CertificationTypes certificationTypes = CertificationTypes.of(List.of(
        new CertificationType("apostille", "Apostille", "apostille", new BigDecimal("30.00"), true, 1),
        new CertificationType("notary", "Notarization", "notarization", new BigDecimal("50.00"), true, 2),
        new CertificationType("retired", "Retired", "legacy", new BigDecimal("10.00"), false, 0)));

    @Test
    void buildsRowFromAiOutputWhenNothingWasSaved() {
        PricingRow row = build(completed("a-1", 450, 2, null));

        assertThat(row.complexity()).isEqualTo(Complexity.MEDIUM);
        assertThat(row.complexityMultiplier()).isEqualByComparingTo("1.15");
        assertThat(row.billablePages()).isEqualByComparingTo("2.3");
        assertThat(row.billablePagesOverridden()).isFalse();
        assertThat(row.baseRate()).isEqualByComparingTo("65.00");
        assertThat(row.baseRateOverridden()).isFalse();
        assertThat(row.defaultCertTypeId()).isEqualTo("notary");
        assertThat(row.hasPerDocCertOverrides()).isFalse();
        assertThat(row.documentCertifications())
            .extracting(DocumentCertification::holderName, DocumentCertification::subDocumentType,
                DocumentCertification::certificationTypeId)
            .containsExactly(
                tuple("Ana Silva", "Passport", "notary"),
                tuple("Document 2", "Birth certificate", "notary"));
        assertThat(row.translationCost()).isEqualByComparingTo("149.50");
        assertThat(row.certificationCost()).isEqualByComparingTo("100.00");
        assertThat(row.lineTotal()).isEqualByComparingTo("249.50");
        assertThat(row.loadedSavedAt()).isNull();
    }

    @Test
    void savedSnapshotWinsOverAiOutput() {
        PricingSnapshot snapshot = new PricingSnapshot(new BigDecimal("5.0"), Complexity.HARD, new BigDecimal("1.25"),
            new BigDecimal("80.00"), "apostille", false, true, null, SAVED_AT);

        PricingRow row = build(completed("a-1", 450, 2, snapshot));

        assertThat(row.billablePages()).isEqualByComparingTo("5.0");
        assertThat(row.billablePagesOverridden()).isTrue();
        assertThat(row.complexity()).isEqualTo(Complexity.HARD);
        assertThat(row.baseRate()).isEqualByComparingTo("80.00");
        assertThat(row.baseRateOverridden()).isTrue();
        assertThat(row.defaultCertTypeId()).isEqualTo("apostille");
        assertThat(row.documentCertifications()).allSatisfy(certification -> {
            assertThat(certification.certificationTypeId()).isEqualTo("apostille");
            assertThat(certification.price()).isEqualByComparingTo("30.00");
        });
        assertThat(row.hasPerDocCertOverrides()).isFalse();
        assertThat(row.translationCost()).isEqualByComparingTo("400.00");
        assertThat(row.certificationCost()).isEqualByComparingTo("60.00");
        assertThat(row.loadedSavedAt()).isEqualTo(SAVED_AT);
    }

    @Test
    void rehydratesSavedSubDocumentCertificationsByIndex() {
        PricingSnapshot snapshot = new PricingSnapshot(new BigDecimal("2.3"), Complexity.MEDIUM,
            new BigDecimal("1.15"), new BigDecimal("65.00"), "notary", false, false,
            List.of(
                new SnapshotCertification(0, "apostille", new BigDecimal("30.00")),
                new SnapshotCertification(1, "notary", new BigDecimal("45.00"))),
            SAVED_AT);

        PricingRow row = build(completed("a-1", 450, 3, snapshot));

        assertThat(row.hasPerDocCertOverrides()).isTrue();
        assertThat(row.baseRateOverridden()).isFalse();
        assertThat(row.documentCertifications())
            .extracting(DocumentCertification::certificationTypeId)
            .containsExactly("apostille", "notary", "notary");
        assertThat(row.documentCertifications())
            .extracting(DocumentCertification::price)
            .usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("30.00"), new BigDecimal("45.00"), new BigDecimal("50.00"));
        assertThat(row.certificationCost()).isEqualByComparingTo("125.00");
    }

    @Test
    void snapshotEntriesBeyondDocumentCountExtendTheRow() {
        PricingSnapshot snapshot = new PricingSnapshot(new BigDecimal("1.0"), Complexity.EASY, BigDecimal.ONE,
            new BigDecimal("65.00"), "notary", false, false,
            List.of(new SnapshotCertification(2, "apostille", new BigDecimal("30.00"))),
            SAVED_AT);

        PricingRow row = build(completed("a-1", 100, 1, snapshot));

        assertThat(row.documentCount()).isEqualTo(3);
        assertThat(row.documentCertifications()).hasSize(3);
        assertThat(row.documentCertifications().get(2).certificationTypeId()).isEqualTo("apostille");
    }

    @Test
    void corruptSnapshotIndexIsIgnored() {
        PricingSnapshot snapshot = new PricingSnapshot(new BigDecimal("1.0"), Complexity.EASY, BigDecimal.ONE,
            new BigDecimal("65.00"), "notary", false, false,
            List.of(
                new SnapshotCertification(0, "apostille", new BigDecimal("30.00")),
                new SnapshotCertification(Integer.MAX_VALUE - 1, "apostille", BigDecimal.ONE)),
            SAVED_AT);

        PricingRow row = build(completed("a-1", 100, 2, snapshot));

        assertThat(row.documentCount()).isEqualTo(2);
        assertThat(row.documentCertifications())
            .extracting(DocumentCertification::certificationTypeId)
            .containsExactly("apostille", "notary");
        assertThat(row.certificationCost()).isEqualByComparingTo("80.00");
    }

    @Test
    void unknownSavedCertificationsAreTolerated() {
        PricingSnapshot snapshot = new PricingSnapshot(new BigDecimal("2.3"), null, null, null, "gone", false, false,
            List.of(new SnapshotCertification(0, "discontinued", new BigDecimal("42.00"))),
            SAVED_AT);

        PricingRow row = build(completed("a-1", 450, 1, snapshot));

        assertThat(row.defaultCertTypeId()).isEqualTo("notary");
        assertThat(row.complexity()).isEqualTo(Complexity.MEDIUM);
        assertThat(row.complexityMultiplier()).isEqualByComparingTo("1.15");
        assertThat(row.baseRate()).isEqualByComparingTo("65.00");
        DocumentCertification certification = row.documentCertifications().get(0);
        assertThat(certification.certificationTypeId()).isEqualTo("discontinued");
        assertThat(certification.price()).isEqualByComparingTo("42.00");
    }

    @Test
    void manualEntriesBillOnePage() {
        PricingRow row = build(AnalysisResult.manualEntry("m-1", "batch-1", "Affidavit"));

        assertThat(row.isManual()).isTrue();
        assertThat(row.wordCount()).isZero();
        assertThat(row.billablePages()).isEqualByComparingTo("1.0");
        assertThat(row.billablePagesOverridden()).isTrue();
        assertThat(row.documentCertifications()).hasSize(1);
        assertThat(row.lineTotal()).isEqualByComparingTo("115.00");
    }

    @Test
    void skipsRecordsStillBeingAnalysed() {
        AnalysisResult pending = new AnalysisResult("p-1", "batch-1", "file-p", "scan.pdf", 300, 1, null, null, 1,
            List.of(), null, null, ProcessingStatus.PENDING, EntryMethod.OCR, null, null);
        AnalysisResult failed = new AnalysisResult("f-1", "batch-1", "file-f", "blurry.pdf", 0, 2, null, null, 1,
            List.of(), null, null, ProcessingStatus.FAILED, EntryMethod.AI_FAILED, "OCR failed", null);

        List<PricingRow> rows = builder.buildRows(List.of(pending, completed("a-1", 450, 1, null), failed),
            settings, certificationTypes, BigDecimal.ONE);

        assertThat(rows).extracting(PricingRow::analysisId).containsExactly("a-1", "f-1");
        assertThat(rows.get(1).billablePages()).isEqualByComparingTo("0");
    }

    @Test
    void buildingIsDeterministic() {
        List<AnalysisResult> results = List.of(completed("a-1", 450, 2, null), completed("a-2", 1200, 1, null));

        assertThat(builder.buildRows(results, settings, certificationTypes, new BigDecimal("1.4")))
            .isEqualTo(builder.buildRows(results, settings, certificationTypes, new BigDecimal("1.4")));
    }

    @Test
    void pricesWithoutCertificationWhenCatalogIsEmpty() {
        PricingRow row = builder.buildRow(completed("a-1", 450, 2, null), settings, CertificationTypes.empty(),
            BigDecimal.ONE).orElseThrow();

        assertThat(row.defaultCertTypeId()).isNull();
        assertThat(row.certificationCost()).isEqualByComparingTo("0");
        assertThat(row.lineTotal()).isEqualByComparingTo(row.translationCost());
    }

    private PricingRow build(AnalysisResult result) {
        return builder.buildRow(result, settings, certificationTypes, BigDecimal.ONE).orElseThrow();
    }

    private static AnalysisResult completed(String id, int words, int documentCount, PricingSnapshot snapshot) {
        return new AnalysisResult(id, "batch-1", "file-" + id, id + ".pdf", words, 2, "Birth certificate",
            Complexity.MEDIUM, documentCount, List.of(new SubDocument("Passport", "Ana Silva", "1", "pt")), "pt", "BR",
            ProcessingStatus.COMPLETED, EntryMethod.OCR, null, snapshot);
    }
}
