package dev.pekelund.pricing.certification;

import java.util.Comparator;
import java.util.List;

public class InMemoryCertificationTypeCatalog implements CertificationTypeCatalog {

    private final List<CertificationType> types;

    public InMemoryCertificationTypeCatalog(List<CertificationType> types) {
        this.types = types != null
            ? types.stream()
                .filter(CertificationType::active)
                .sorted(Comparator.comparingInt(CertificationType::sortOrder))
                .toList()
            : List.of();
    }

    @Override
    public List<CertificationType> listActiveTypes() {
        return types;
    }
}
