package dev.pekelund.pricing.certification;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Certification service (notarization, authentication, ...) priced per document.
 */
public record CertificationType(
    String id,
    String name,
    String code,
    BigDecimal unitPrice,
    boolean active,
    int sortOrder
) {

    public CertificationType {
        Objects.requireNonNull(id, "id must not be null");
        name = name != null ? name : id;
        unitPrice = unitPrice != null && unitPrice.signum() > 0
            ? unitPrice.setScale(2, RoundingMode.HALF_UP)
            : BigDecimal.ZERO.setScale(2);
    }
}
