package dev.pekelund.pricing.web;

import dev.pekelund.pricing.jobs.AnalysisJob;
import dev.pekelund.pricing.quote.QuoteEmissionAdapter;
import dev.pekelund.pricing.quote.QuoteReference;
import dev.pekelund.pricing.sheet.PricingSheetFactory;
import dev.pekelund.pricing.sheet.PricingSheetSession;
import dev.pekelund.pricing.sheet.UnsavedChangesException;
import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Registry of open pricing sheets. A batch has at most one open sheet; opening it again returns
 * the sheet that is already open.
 */
@Service
public class PricingSheetService {

    private static final Logger log = LoggerFactory.getLogger(PricingSheetService.class);

    private final ConcurrentMap<String, PricingSheetSession> sessions = new ConcurrentHashMap<>();
    private final PricingSheetFactory sheetFactory;
    private final QuoteEmissionAdapter quoteEmissionAdapter;

    public PricingSheetService(PricingSheetFactory sheetFactory, QuoteEmissionAdapter quoteEmissionAdapter) {
        this.sheetFactory = sheetFactory;
        this.quoteEmissionAdapter = quoteEmissionAdapter;
    }

    public PricingSheetSession open(String batchId, BigDecimal languageMultiplier) {
        if (!StringUtils.hasText(batchId)) {
            throw new IllegalArgumentException("Batch id is required to open a pricing sheet.");
        }
        return sessions.compute(batchId, (key, existing) -> {
            if (existing != null && !existing.isClosed()) {
                return existing;
            }
            return languageMultiplier != null
                ? sheetFactory.open(key, languageMultiplier)
                : sheetFactory.open(key);
        });
    }

    public PricingSheetSession session(String batchId) {
        PricingSheetSession session = sessions.get(batchId);
        if (session == null || session.isClosed()) {
            throw new SheetNotOpenException(batchId);
        }
        return session;
    }

    public boolean isOpen(String batchId) {
        PricingSheetSession session = sessions.get(batchId);
        return session != null && !session.isClosed();
    }

    /**
     * Close the sheet of a batch. The sheet stays open when it has unsaved edits and
     * {@code discardUnsaved} is {@code false}.
     *
     * @throws UnsavedChangesException when unsaved edits would be lost
     */
    public void close(String batchId, boolean discardUnsaved) {
        session(batchId);
        // Closing and removing happen under the map entry's lock so a concurrent open never sees
        // the closed session.
        sessions.computeIfPresent(batchId, (key, session) -> {
            session.close(discardUnsaved);
            return null;
        });
    }

    public QuoteReference createQuote(String batchId, String jobId) {
        PricingSheetSession session = session(batchId);
        return quoteEmissionAdapter.createQuote(session.sheet(), resolveJobId(session, jobId));
    }

    public QuoteReference updateQuote(String batchId, String quoteId, String jobId) {
        PricingSheetSession session = session(batchId);
        return quoteEmissionAdapter.updateQuote(quoteId, session.sheet(), resolveJobId(session, jobId));
    }

    @PreDestroy
    void closeAll() {
        sessions.forEach((batchId, session) -> {
            if (session.hasUnsavedChanges()) {
                log.warn("Discarding unsaved pricing edits of batch {} on shutdown", batchId);
            }
            session.close(true);
        });
        sessions.clear();
    }

    private String resolveJobId(PricingSheetSession session, String jobId) {
        if (StringUtils.hasText(jobId)) {
            return jobId;
        }
        return session.currentJob().map(AnalysisJob::id).orElse(null);
    }
}
