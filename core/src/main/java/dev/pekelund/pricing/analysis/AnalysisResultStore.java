package dev.pekelund.pricing.analysis;

import java.util.List;
import java.util.Optional;

/**
 * Keyed record store holding analysis results, scoped by batch.
 */
public interface AnalysisResultStore {

    /**
     * List the records of a batch in their stable display order.
     */
    List<AnalysisResult> findByBatch(String batchId);

    Optional<AnalysisResult> findById(String batchId, String analysisId);

    void insert(AnalysisResult result);

    /**
     * Replace the pricing snapshot fields of an existing record.
     *
     * @throws AnalysisResultStoreException when the record does not exist or cannot be written
     */
    void updatePricing(String batchId, String analysisId, PricingSnapshot snapshot);

    void delete(String batchId, String analysisId);
}
