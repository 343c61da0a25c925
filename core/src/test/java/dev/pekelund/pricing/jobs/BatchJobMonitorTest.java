package dev.pekelund.pricing.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

class BatchJobMonitorTest {

    private AnalysisService analysisService;
    private TaskScheduler taskScheduler;
    private ScheduledFuture<?> schedule;
    private BatchJobMonitor monitor;

    @BeforeEach
    void setUp() {
        analysisService = mock(AnalysisService.class);
        taskScheduler = mock(TaskScheduler.class);
        schedule = mock(ScheduledFuture.class);
        doReturn(schedule).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        monitor = new BatchJobMonitor(analysisService, taskScheduler, Duration.ofSeconds(5));
    }

    @Test
    void pollsUntilJobIsTerminal() {
        when(analysisService.submit("batch-1", List.of("file-1", "file-2"))).thenReturn(job(AnalysisJobStatus.QUEUED, 0));
        when(analysisService.fetchJob("job-1"))
            .thenReturn(job(AnalysisJobStatus.PROCESSING, 1))
            .thenReturn(job(AnalysisJobStatus.PARTIAL, 2));

        JobWatch watch = monitor.submit("batch-1", List.of("file-1", "file-2"));

        Runnable poll = capturePoll();
        poll.run();
        assertThat(watch.isDone()).isFalse();
        assertThat(watch.latestJob().status()).isEqualTo(AnalysisJobStatus.PROCESSING);

        poll.run();
        assertThat(watch.completion()).isCompletedWithValueMatching(job -> job.status() == AnalysisJobStatus.PARTIAL);
        verify(schedule).cancel(false);

        poll.run();
        verify(analysisService, times(2)).fetchJob("job-1");
    }

    @Test
    void synchronousResultsNeedNoPolling() {
        when(analysisService.submit(eq("batch-1"), any())).thenReturn(job(AnalysisJobStatus.COMPLETED, 2));

        JobWatch watch = monitor.submit("batch-1", List.of("file-1", "file-2"));

        assertThat(watch.isDone()).isTrue();
        assertThat(watch.completion().join().status()).isEqualTo(AnalysisJobStatus.COMPLETED);
        verifyNoInteractions(taskScheduler);
    }

    @Test
    void pollFailuresAreRetriedOnTheNextInterval() {
        when(analysisService.submit(eq("batch-1"), any())).thenReturn(job(AnalysisJobStatus.PROCESSING, 0));
        when(analysisService.fetchJob("job-1"))
            .thenThrow(new AnalysisServiceException("analysis service unavailable"))
            .thenReturn(job(AnalysisJobStatus.COMPLETED, 2));

        JobWatch watch = monitor.submit("batch-1", List.of("file-1"));
        Runnable poll = capturePoll();

        poll.run();
        assertThat(watch.isDone()).isFalse();

        poll.run();
        assertThat(watch.isDone()).isTrue();
    }

    @Test
    void manualRefreshPollsOnceAndPropagatesFailures() {
        when(analysisService.submit(eq("batch-1"), any())).thenReturn(job(AnalysisJobStatus.PROCESSING, 0));
        when(analysisService.fetchJob("job-1"))
            .thenReturn(job(AnalysisJobStatus.PROCESSING, 1))
            .thenThrow(new AnalysisServiceException("timeout"));

        JobWatch watch = monitor.submit("batch-1", List.of("file-1"));

        assertThat(watch.refreshNow().completedFiles()).isEqualTo(1);
        assertThatThrownBy(watch::refreshNow).isInstanceOf(AnalysisServiceException.class);
    }

    @Test
    void cancellingStopsPolling() {
        when(analysisService.submit(eq("batch-1"), any())).thenReturn(job(AnalysisJobStatus.QUEUED, 0));

        JobWatch watch = monitor.submit("batch-1", List.of("file-1"));
        Runnable poll = capturePoll();
        watch.cancel();
        poll.run();

        assertThat(watch.completion()).isCancelled();
        verify(schedule).cancel(false);
        verify(analysisService, never()).fetchJob(any());
    }

    @Test
    void reanalysisStartsANewJob() {
        when(analysisService.submit("batch-1", List.of("file-1"))).thenReturn(job(AnalysisJobStatus.QUEUED, 0));

        monitor.reanalyse("batch-1", List.of("file-1"));

        verify(analysisService).submit("batch-1", List.of("file-1"));
        verify(analysisService, never()).fetchJob(any());
        assertThatThrownBy(() -> monitor.reanalyse("batch-1", List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fallsBackToDefaultIntervalWhenNoneConfigured() {
        assertThat(new BatchJobMonitor(analysisService, taskScheduler, Duration.ZERO).getPollInterval())
            .isEqualTo(BatchJobMonitor.DEFAULT_POLL_INTERVAL);
        assertThat(AnalysisJobStatus.fromValue("pending")).isEqualTo(AnalysisJobStatus.QUEUED);
        assertThat(AnalysisJobStatus.fromValue("partial").isTerminal()).isTrue();
    }

    private Runnable capturePoll() {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleWithFixedDelay(captor.capture(), eq(Duration.ofSeconds(5)));
        return captor.getValue();
    }

    private static AnalysisJob job(AnalysisJobStatus status, int completedFiles) {
        return new AnalysisJob("job-1", "batch-1", status, 2, completedFiles, 0, completedFiles,
            Instant.parse("2024-06-01T10:00:00Z"), status.isTerminal() ? Instant.parse("2024-06-01T10:01:00Z") : null);
    }
}
