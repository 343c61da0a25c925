package dev.pekelund.pricing.analysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Record store kept in memory, used when no persistent store is configured and in tests.
 * Records keep their insertion order within a batch.
 */
public class InMemoryAnalysisResultStore implements AnalysisResultStore {

    private final ConcurrentMap<String, Map<String, AnalysisResult>> batches = new ConcurrentHashMap<>();

    @Override
    public List<AnalysisResult> findByBatch(String batchId) {
        Map<String, AnalysisResult> records = batches.get(batchId);
        if (records == null) {
            return List.of();
        }
        synchronized (records) {
            return List.copyOf(records.values());
        }
    }

    @Override
    public Optional<AnalysisResult> findById(String batchId, String analysisId) {
        Map<String, AnalysisResult> records = batches.get(batchId);
        if (records == null) {
            return Optional.empty();
        }
        synchronized (records) {
            return Optional.ofNullable(records.get(analysisId));
        }
    }

    @Override
    public void insert(AnalysisResult result) {
        Objects.requireNonNull(result, "result");
        if (result.batchId() == null) {
            throw new AnalysisResultStoreException("Analysis result " + result.id() + " has no batch id");
        }
        Map<String, AnalysisResult> records = batches.computeIfAbsent(result.batchId(),
            key -> new LinkedHashMap<>());
        synchronized (records) {
            records.put(result.id(), result);
        }
    }

    @Override
    public void updatePricing(String batchId, String analysisId, PricingSnapshot snapshot) {
        Map<String, AnalysisResult> records = batches.get(batchId);
        if (records == null) {
            throw new AnalysisResultStoreException("Unknown batch " + batchId);
        }
        synchronized (records) {
            AnalysisResult existing = records.get(analysisId);
            if (existing == null) {
                throw new AnalysisResultStoreException("Analysis result " + analysisId + " not found");
            }
            records.put(analysisId, existing.withPricingSnapshot(snapshot));
        }
    }

    @Override
    public void delete(String batchId, String analysisId) {
        Map<String, AnalysisResult> records = batches.get(batchId);
        if (records == null) {
            return;
        }
        synchronized (records) {
            records.remove(analysisId);
        }
    }
}
