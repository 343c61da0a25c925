package dev.pekelund.pricing.certification;

import java.util.List;

/**
 * Reference data source for certification types.
 */
public interface CertificationTypeCatalog {

    /**
     * Active certification types ordered by their configured sort key.
     */
    List<CertificationType> listActiveTypes();
}
