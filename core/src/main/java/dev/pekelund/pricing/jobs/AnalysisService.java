package dev.pekelund.pricing.jobs;

import java.util.List;

/**
 * Remote OCR/AI analysis service. Calls are idempotent; failures surface as
 * {@link AnalysisServiceException}.
 */
public interface AnalysisService {

    /**
     * Start analysing the given files of a batch. The returned job may already be terminal when
     * the service analysed the files synchronously.
     */
    AnalysisJob submit(String batchId, List<String> fileIds);

    AnalysisJob fetchJob(String jobId);
}
