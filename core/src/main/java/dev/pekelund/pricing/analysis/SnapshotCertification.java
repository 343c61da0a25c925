package dev.pekelund.pricing.analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Persisted certification choice for the sub-document at {@code index} (zero based).
 */
public record SnapshotCertification(
    int index,
    String certificationTypeId,
    BigDecimal price
) {

    public SnapshotCertification {
        index = Math.max(0, index);
        price = price != null && price.signum() > 0
            ? price.setScale(2, RoundingMode.HALF_UP)
            : BigDecimal.ZERO.setScale(2);
    }
}
