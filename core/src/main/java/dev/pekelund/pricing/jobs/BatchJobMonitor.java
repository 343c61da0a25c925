package dev.pekelund.pricing.jobs;

import dev.pekelund.pricing.support.PricingMdc;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Submits analysis jobs and polls them on a fixed delay until they reach a terminal state.
 */
public class BatchJobMonitor {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);

    private static final Logger log = LoggerFactory.getLogger(BatchJobMonitor.class);

    private final AnalysisService analysisService;
    private final TaskScheduler taskScheduler;
    private final Duration pollInterval;

    public BatchJobMonitor(AnalysisService analysisService, TaskScheduler taskScheduler) {
        this(analysisService, taskScheduler, DEFAULT_POLL_INTERVAL);
    }

    public BatchJobMonitor(AnalysisService analysisService, TaskScheduler taskScheduler, Duration pollInterval) {
        this.analysisService = Objects.requireNonNull(analysisService, "analysisService");
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler");
        this.pollInterval = pollInterval != null && !pollInterval.isNegative() && !pollInterval.isZero()
            ? pollInterval
            : DEFAULT_POLL_INTERVAL;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public JobWatch submit(String batchId, List<String> fileIds) {
        List<String> files = fileIds != null ? List.copyOf(fileIds) : List.of();
        AnalysisJob job;
        try (PricingMdc.Context ignored = PricingMdc.forBatch(batchId)) {
            job = analysisService.submit(batchId, files);
            if (job == null) {
                throw new AnalysisServiceException("Analysis service accepted batch " + batchId + " without a job");
            }
            log.info("Submitted analysis job {} for {} file(s), status {}", job.id(), files.size(),
                job.status().value());
        }
        return watch(batchId, job);
    }

    /**
     * Submit the files of an earlier run as a new job. The earlier job is left untouched.
     */
    public JobWatch reanalyse(String batchId, List<String> fileIds) {
        if (fileIds == null || fileIds.isEmpty()) {
            throw new IllegalArgumentException("Batch " + batchId + " has no analysed files to re-analyse");
        }
        return submit(batchId, fileIds);
    }

    /**
     * Follow an existing job. A job that is already terminal is returned completed without
     * scheduling any polls.
     */
    public JobWatch watch(String batchId, AnalysisJob job) {
        JobWatch watch = new JobWatch(batchId, job, analysisService);
        if (!watch.isDone()) {
            ScheduledFuture<?> schedule = taskScheduler.scheduleWithFixedDelay(watch::poll, pollInterval);
            watch.attachSchedule(schedule);
            log.debug("Polling analysis job {} of batch {} every {}", job.id(), batchId, pollInterval);
        }
        return watch;
    }
}
