package dev.pekelund.pricing.jobs;

import java.time.Instant;
import java.util.Objects;

/**
 * Progress of one asynchronous OCR/AI analysis run over the files of a batch.
 */
public record AnalysisJob(
    String id,
    String batchId,
    AnalysisJobStatus status,
    int totalFiles,
    int completedFiles,
    int failedFiles,
    int totalDocumentsFound,
    Instant startedAt,
    Instant completedAt
) {

    public AnalysisJob {
        Objects.requireNonNull(id, "id must not be null");
        status = status != null ? status : AnalysisJobStatus.QUEUED;
        totalFiles = Math.max(0, totalFiles);
        completedFiles = Math.max(0, completedFiles);
        failedFiles = Math.max(0, failedFiles);
        totalDocumentsFound = Math.max(0, totalDocumentsFound);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
