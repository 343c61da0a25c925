package dev.pekelund.pricing.jobs;

import dev.pekelund.pricing.support.PricingMdc;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscription to an analysis job. Completes with the terminal job state once polling observes
 * it; cancelling stops polling and cancels the completion.
 */
public final class JobWatch {

    private static final Logger log = LoggerFactory.getLogger(JobWatch.class);

    private final String batchId;
    private final AnalysisService analysisService;
    private final CompletableFuture<AnalysisJob> completion = new CompletableFuture<>();
    private AnalysisJob latest;
    private ScheduledFuture<?> schedule;

    JobWatch(String batchId, AnalysisJob job, AnalysisService analysisService) {
        this.batchId = batchId;
        this.latest = Objects.requireNonNull(job, "job");
        this.analysisService = analysisService;
        if (job.isTerminal()) {
            completion.complete(job);
        }
    }

    public String batchId() {
        return batchId;
    }

    public String jobId() {
        return latestJob().id();
    }

    public synchronized AnalysisJob latestJob() {
        return latest;
    }

    public CompletableFuture<AnalysisJob> completion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Poll the job once, outside the fixed schedule. Failures propagate to the caller.
     */
    public AnalysisJob refreshNow() {
        if (isDone()) {
            return latestJob();
        }
        return fetch();
    }

    public synchronized void cancel() {
        if (schedule != null) {
            schedule.cancel(false);
        }
        if (completion.cancel(false)) {
            log.debug("Stopped watching analysis job {} of batch {}", latest.id(), batchId);
        }
    }

    synchronized void attachSchedule(ScheduledFuture<?> schedule) {
        this.schedule = schedule;
        if (schedule != null && isDone()) {
            schedule.cancel(false);
        }
    }

    /**
     * Scheduled poll. A failing poll is logged and retried on the next tick.
     */
    void poll() {
        if (isDone()) {
            return;
        }
        try {
            fetch();
        } catch (RuntimeException ex) {
            try (PricingMdc.Context ignored = PricingMdc.forJob(batchId, latestJob().id())) {
                log.warn("Polling analysis job {} failed; retrying on the next interval", latestJob().id(), ex);
            }
        }
    }

    private AnalysisJob fetch() {
        String jobId = latestJob().id();
        AnalysisJob job = analysisService.fetchJob(jobId);
        if (job == null) {
            throw new AnalysisServiceException("Analysis service returned no state for job " + jobId);
        }
        boolean terminal;
        synchronized (this) {
            latest = job;
            terminal = job.isTerminal();
            if (terminal && schedule != null) {
                schedule.cancel(false);
            }
        }
        if (terminal) {
            try (PricingMdc.Context ignored = PricingMdc.forJob(batchId, job.id())) {
                log.info("Analysis job {} finished with status {} ({} of {} files completed, {} failed)",
                    job.id(), job.status().value(), job.completedFiles(), job.totalFiles(), job.failedFiles());
            }
            completion.complete(job);
        }
        return job;
    }
}
