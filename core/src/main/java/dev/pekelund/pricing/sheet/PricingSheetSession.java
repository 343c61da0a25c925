package dev.pekelund.pricing.sheet;

import dev.pekelund.pricing.analysis.AnalysisResult;
import dev.pekelund.pricing.analysis.AnalysisResultStore;
import dev.pekelund.pricing.analysis.AnalysisResultStoreException;
import dev.pekelund.pricing.analysis.PageDetail;
import dev.pekelund.pricing.analysis.PageDetailCache;
import dev.pekelund.pricing.analysis.PricingSnapshot;
import dev.pekelund.pricing.jobs.AnalysisJob;
import dev.pekelund.pricing.jobs.BatchJobMonitor;
import dev.pekelund.pricing.jobs.JobWatch;
import dev.pekelund.pricing.pricing.PricingRow;
import dev.pekelund.pricing.settings.Complexity;
import dev.pekelund.pricing.sheet.SaveResult.RowSaveFailure;
import dev.pekelund.pricing.support.PricingMdc;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The open pricing sheet of one batch. Applies edits in the order they arrive, carries out the
 * record store effects of each edit, saves rows and follows the batch's analysis job.
 *
 * <p>All public methods are synchronized; concurrent callers see edits applied one at a time.
 */
public class PricingSheetSession {

    private static final Logger log = LoggerFactory.getLogger(PricingSheetSession.class);

    private final String batchId;
    private final AnalysisResultStore store;
    private final SheetLoader loader;
    private final BatchJobMonitor jobMonitor;
    private final PageDetailCache pageDetails;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    private Sheet sheet;
    private boolean unsavedChanges;
    private JobWatch activeJob;
    private boolean closed;

    PricingSheetSession(Sheet sheet, AnalysisResultStore store, SheetLoader loader, BatchJobMonitor jobMonitor,
        PageDetailCache pageDetails, Clock clock) {
        this(sheet, store, loader, jobMonitor, pageDetails, clock, () -> UUID.randomUUID().toString());
    }

    PricingSheetSession(Sheet sheet, AnalysisResultStore store, SheetLoader loader, BatchJobMonitor jobMonitor,
        PageDetailCache pageDetails, Clock clock, Supplier<String> idGenerator) {
        this.sheet = sheet;
        this.batchId = sheet.batchId();
        this.store = store;
        this.loader = loader;
        this.jobMonitor = jobMonitor;
        this.pageDetails = pageDetails;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    public String getBatchId() {
        return batchId;
    }

    public synchronized Sheet sheet() {
        return sheet;
    }

    public synchronized boolean hasUnsavedChanges() {
        return unsavedChanges;
    }

    public synchronized Optional<AnalysisJob> currentJob() {
        return Optional.ofNullable(activeJob).map(JobWatch::latestJob);
    }

    public synchronized Sheet editComplexity(String analysisId, Complexity complexity) {
        return apply(sheet.editComplexity(analysisId, complexity));
    }

    public synchronized Sheet editBillablePages(String analysisId, BigDecimal billablePages) {
        return apply(sheet.editBillablePages(analysisId, billablePages));
    }

    public synchronized Sheet editBaseRate(String analysisId, BigDecimal baseRate) {
        return apply(sheet.editBaseRate(analysisId, baseRate));
    }

    public synchronized Sheet changeRowCertification(String analysisId, String certificationTypeId) {
        return apply(sheet.changeRowCertification(analysisId, certificationTypeId));
    }

    public synchronized Sheet changeDocumentCertification(String analysisId, int index, String certificationTypeId) {
        return apply(sheet.changeDocumentCertification(analysisId, index, certificationTypeId));
    }

    public synchronized Sheet setExcluded(String analysisId, boolean excluded) {
        return apply(sheet.setExcluded(analysisId, excluded));
    }

    public synchronized Sheet toggleExcluded(String analysisId) {
        return apply(sheet.toggleExcluded(analysisId));
    }

    public synchronized Sheet setLanguageMultiplier(BigDecimal languageMultiplier) {
        return apply(sheet.withLanguageMultiplier(languageMultiplier));
    }

    /**
     * Insert a hand-entered document into the record store and append its row.
     *
     * @return the id of the new analysis record
     */
    public synchronized String addManualDocument(String filename) {
        String analysisId = idGenerator.get();
        apply(sheet.addManualDocument(analysisId, filename));
        log.info("Added manual document {} to batch {}", analysisId, batchId);
        return analysisId;
    }

    public synchronized Sheet deleteManualDocument(String analysisId) {
        Sheet next = apply(sheet.deleteManualDocument(analysisId));
        log.info("Deleted manual document {} from batch {}", analysisId, batchId);
        return next;
    }

    /**
     * Write every row's pricing decisions to its record. Rows are saved independently; a row whose
     * record was saved by someone else after this sheet loaded it is rejected as stale.
     */
    public synchronized SaveResult save() {
        ensureOpen();
        Instant savedAt = clock.instant();
        List<PricingRow> rows = sheet.rows();
        List<String> savedIds = new ArrayList<>();
        List<RowSaveFailure> failures = new ArrayList<>();
        Map<String, PricingSnapshot> written = new LinkedHashMap<>();

        try (PricingMdc.Context ignored = PricingMdc.forBatch(batchId)) {
            for (PricingRow row : rows) {
                try {
                    Optional<RowSaveFailure> conflict = detectConflict(row);
                    if (conflict.isPresent()) {
                        log.warn("Skipping save of {}: {}", row.analysisId(), conflict.get().message());
                        failures.add(conflict.get());
                        continue;
                    }
                    PricingSnapshot snapshot = row.toSnapshot(savedAt);
                    store.updatePricing(batchId, row.analysisId(), snapshot);
                    written.put(row.analysisId(), snapshot);
                    savedIds.add(row.analysisId());
                } catch (AnalysisResultStoreException ex) {
                    log.error("Failed to save pricing for analysis {}", row.analysisId(), ex);
                    failures.add(new RowSaveFailure(row.analysisId(), ex.getMessage(), false));
                }
            }

            sheet = sheet.withSavedSnapshots(written);
            if (failures.isEmpty()) {
                unsavedChanges = false;
            }
            log.info("Saved pricing for {} of {} row(s)", savedIds.size(), rows.size());
        }
        return new SaveResult(rows.size(), savedIds, failures);
    }

    /**
     * Rebuild the sheet from the record store with freshly loaded settings and certification
     * types. Unsaved edits are discarded.
     */
    public synchronized Sheet reload() {
        ensureOpen();
        sheet = loader.load(batchId, sheet.languageMultiplier());
        unsavedChanges = false;
        return sheet;
    }

    public synchronized AnalysisJob startAnalysis(List<String> fileIds) {
        ensureOpen();
        return attachJob(jobMonitor.submit(batchId, fileIds));
    }

    /**
     * Analyse the batch's previously analysed files again as a new job.
     */
    public synchronized AnalysisJob reanalyse() {
        ensureOpen();
        Set<String> fileIds = new LinkedHashSet<>();
        for (AnalysisResult result : sheet.results()) {
            if (!result.isManual() && result.fileId() != null) {
                fileIds.add(result.fileId());
            }
        }
        return attachJob(jobMonitor.reanalyse(batchId, List.copyOf(fileIds)));
    }

    /**
     * Follow a job that was started elsewhere. Replaces any job this sheet was following.
     */
    public synchronized AnalysisJob watchJob(AnalysisJob job) {
        ensureOpen();
        return attachJob(jobMonitor.watch(batchId, job));
    }

    /**
     * Poll the current job once, outside its regular schedule.
     */
    public AnalysisJob refreshJob() {
        JobWatch watch;
        synchronized (this) {
            ensureOpen();
            if (activeJob == null) {
                throw new PricingSheetException("Batch " + batchId + " has no analysis job to refresh");
            }
            watch = activeJob;
        }
        return watch.refreshNow();
    }

    /**
     * Page-level detail of a row's file. The fetch from the analysis service runs without
     * holding the session lock.
     */
    public List<PageDetail> pageDetails(String analysisId) {
        String fileId;
        synchronized (this) {
            fileId = sheet.result(analysisId)
                .orElseThrow(() -> PricingSheetException.unknownRow(analysisId))
                .fileId();
        }
        return pageDetails.pagesFor(fileId);
    }

    /**
     * Close the sheet and stop following its job.
     *
     * @throws UnsavedChangesException when there are unsaved edits and {@code discardUnsaved} is
     *     {@code false}
     */
    public synchronized void close(boolean discardUnsaved) {
        if (closed) {
            return;
        }
        if (unsavedChanges && !discardUnsaved) {
            throw new UnsavedChangesException(batchId);
        }
        if (activeJob != null) {
            activeJob.cancel();
            activeJob = null;
        }
        closed = true;
        log.info("Closed pricing sheet of batch {}", batchId);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private AnalysisJob attachJob(JobWatch watch) {
        if (activeJob != null && activeJob != watch) {
            activeJob.cancel();
        }
        activeJob = watch;
        watch.completion().thenAccept(job -> onJobFinished(watch, job));
        return watch.latestJob();
    }

    private synchronized void onJobFinished(JobWatch watch, AnalysisJob job) {
        if (closed || activeJob != watch) {
            return;
        }
        try (PricingMdc.Context ignored = PricingMdc.forJob(batchId, job.id())) {
            if (unsavedChanges) {
                log.warn("Analysis job {} finished; discarding unsaved edits while rebuilding the sheet", job.id());
            }
            sheet = loader.load(batchId, sheet.languageMultiplier());
            unsavedChanges = false;
            log.info("Rebuilt pricing sheet with {} row(s) after job {}", sheet.rows().size(), job.id());
        } catch (RuntimeException ex) {
            log.error("Failed to rebuild pricing sheet after analysis job {}", job.id(), ex);
        }
    }

    private Optional<RowSaveFailure> detectConflict(PricingRow row) {
        Optional<AnalysisResult> persisted = store.findById(batchId, row.analysisId());
        if (persisted.isEmpty()) {
            return Optional.of(new RowSaveFailure(row.analysisId(), "Analysis record no longer exists", false));
        }
        Instant persistedAt = persisted.get().pricingSavedAt();
        if (persistedAt != null && (row.loadedSavedAt() == null || persistedAt.isAfter(row.loadedSavedAt()))) {
            return Optional.of(new RowSaveFailure(row.analysisId(),
                "Pricing was saved elsewhere at " + persistedAt + " after this sheet was loaded", true));
        }
        return Optional.empty();
    }

    private Sheet apply(SheetTransition transition) {
        ensureOpen();
        for (SheetEffect effect : transition.effects()) {
            if (effect instanceof SheetEffect.InsertAnalysisResult insert) {
                store.insert(insert.result());
            } else if (effect instanceof SheetEffect.DeleteAnalysisResult delete) {
                store.delete(delete.batchId(), delete.analysisId());
            }
        }
        sheet = transition.sheet();
        unsavedChanges = true;
        return sheet;
    }

    private void ensureOpen() {
        if (closed) {
            throw new PricingSheetException("Pricing sheet of batch " + batchId + " is closed");
        }
    }
}
