package dev.pekelund.pricing.sheet;

import java.util.List;

/**
 * Outcome of saving a sheet. Rows are saved independently; a failed row does not stop the rest.
 */
public record SaveResult(int requestedCount, List<String> savedIds, List<RowSaveFailure> failures) {

    public SaveResult {
        savedIds = savedIds != null ? List.copyOf(savedIds) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public int succeededCount() {
        return savedIds.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * @param stale {@code true} when someone saved the record after this sheet loaded it
     */
    public record RowSaveFailure(String analysisId, String message, boolean stale) {
    }
}
