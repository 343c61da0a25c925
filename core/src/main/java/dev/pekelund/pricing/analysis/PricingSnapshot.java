package dev.pekelund.pricing.analysis;

import dev.pekelund.pricing.settings.Complexity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Human-finalized pricing decision persisted on an analysis record. A snapshot always wins
 * over AI defaults when the pricing sheet is rebuilt.
 *
 * <p>{@code documentCertifications} is {@code null} when the row used its default certification
 * for every sub-document; a non-null list means staff customized sub-documents individually.
 * {@code complexity} may be {@code null} for snapshots written before complexity was stored.
 */
public record PricingSnapshot(
    BigDecimal billablePages,
    Complexity complexity,
    BigDecimal complexityMultiplier,
    BigDecimal baseRate,
    String certificationTypeId,
    boolean excluded,
    boolean billableOverridden,
    List<SnapshotCertification> documentCertifications,
    Instant savedAt
) {

    public PricingSnapshot {
        documentCertifications = documentCertifications != null ? List.copyOf(documentCertifications) : null;
    }

    public boolean hasDocumentCertifications() {
        return documentCertifications != null;
    }
}
