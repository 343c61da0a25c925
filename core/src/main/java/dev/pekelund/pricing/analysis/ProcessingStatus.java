package dev.pekelund.pricing.analysis;

import java.util.Locale;
import org.springframework.util.StringUtils;

/**
 * Lifecycle state of a single analysis record.
 */
public enum ProcessingStatus {

    /**
     * OCR/AI analysis has not finished for this record; it is not priced yet.
     */
    PENDING("pending"),

    /**
     * OCR and AI classification finished successfully.
     */
    COMPLETED("completed"),

    /**
     * OCR or AI classification failed. The record can still be priced by hand.
     */
    FAILED("failed"),

    /**
     * The record was entered by staff without OCR.
     */
    MANUAL("manual");

    private final String value;

    ProcessingStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ProcessingStatus fromValue(String raw) {
        if (!StringUtils.hasText(raw)) {
            return PENDING;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ProcessingStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return "processing".equals(normalized) ? PENDING : FAILED;
    }
}
