package dev.pekelund.pricing.analysisservice;

import dev.pekelund.pricing.analysis.PageDetail;
import dev.pekelund.pricing.analysis.PageDetailSource;
import dev.pekelund.pricing.jobs.AnalysisJob;
import dev.pekelund.pricing.jobs.AnalysisService;
import dev.pekelund.pricing.jobs.AnalysisServiceException;
import java.util.List;

/**
 * Stand-in used when no analysis service URL is configured. Sheets can still be opened, edited
 * and saved; starting or following analysis fails.
 */
public class DisabledAnalysisService implements AnalysisService, PageDetailSource {

    @Override
    public AnalysisJob submit(String batchId, List<String> fileIds) {
        throw new AnalysisServiceException("Analysis service integration is disabled");
    }

    @Override
    public AnalysisJob fetchJob(String jobId) {
        throw new AnalysisServiceException("Analysis service integration is disabled");
    }

    @Override
    public List<PageDetail> fetchPages(String fileId) {
        return List.of();
    }
}
