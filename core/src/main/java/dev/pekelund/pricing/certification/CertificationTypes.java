package dev.pekelund.pricing.certification;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup over the active certification types a pricing sheet was built with.
 */
public final class CertificationTypes {

    public static final String NOTARIZATION_CODE = "notarization";

    private static final CertificationTypes EMPTY = new CertificationTypes(List.of());

    private final Map<String, CertificationType> byId;
    private final CertificationType defaultType;

    private CertificationTypes(List<CertificationType> types) {
        Map<String, CertificationType> index = new LinkedHashMap<>();
        types.stream()
            .filter(CertificationType::active)
            .sorted(Comparator.comparingInt(CertificationType::sortOrder))
            .forEach(type -> index.putIfAbsent(type.id(), type));
        this.byId = index;
        this.defaultType = index.values().stream()
            .filter(type -> type.code() != null
                && NOTARIZATION_CODE.equals(type.code().trim().toLowerCase(Locale.ROOT)))
            .findFirst()
            .orElseGet(() -> index.values().stream().findFirst().orElse(null));
    }

    public static CertificationTypes of(List<CertificationType> types) {
        if (types == null || types.isEmpty()) {
            return EMPTY;
        }
        return new CertificationTypes(types);
    }

    public static CertificationTypes empty() {
        return EMPTY;
    }

    public Optional<CertificationType> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * The type preselected for new rows: the one coded {@value #NOTARIZATION_CODE}, otherwise the
     * first active type. Empty when the catalog has no active types.
     */
    public Optional<CertificationType> defaultType() {
        return Optional.ofNullable(defaultType);
    }

    public List<CertificationType> asList() {
        return List.copyOf(byId.values());
    }
}
