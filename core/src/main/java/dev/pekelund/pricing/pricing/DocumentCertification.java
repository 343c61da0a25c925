package dev.pekelund.pricing.pricing;

import dev.pekelund.pricing.certification.CertificationType;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Certification chosen for one sub-document of a pricing row. {@code index} is zero based.
 */
public record DocumentCertification(
    int index,
    String subDocumentType,
    String holderName,
    String certificationTypeId,
    String certificationTypeName,
    BigDecimal price
) {

    public DocumentCertification {
        price = price != null && price.signum() > 0
            ? price.setScale(2, RoundingMode.HALF_UP)
            : BigDecimal.ZERO.setScale(2);
    }

    public DocumentCertification withCertification(String typeId, String typeName, BigDecimal unitPrice) {
        return new DocumentCertification(index, subDocumentType, holderName, typeId, typeName, unitPrice);
    }

    public DocumentCertification withCertification(CertificationType type) {
        if (type == null) {
            return withCertification(null, null, null);
        }
        return withCertification(type.id(), type.name(), type.unitPrice());
    }
}
