package dev.pekelund.pricing.support;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates mapped diagnostic context entries so log lines emitted while working on a batch
 * share the same identifiers (batch id, analysis job id).
 */
public final class PricingMdc {

    private static final String KEY_BATCH_ID = "pricing.batchId";
    private static final String KEY_JOB_ID = "pricing.jobId";

    private PricingMdc() {
        // Utility class
    }

    public static Context forBatch(String batchId) {
        return new Context(batchId, null);
    }

    public static Context forJob(String batchId, String jobId) {
        return new Context(batchId, jobId);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    public static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String batchId, String jobId) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_BATCH_ID, batchId);
            putIfHasText(KEY_JOB_ID, jobId);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
