package dev.pekelund.pricing.jobs;

import java.util.Locale;
import org.springframework.util.StringUtils;

public enum AnalysisJobStatus {

    QUEUED("queued"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    PARTIAL("partial"),
    FAILED("failed");

    private final String value;

    AnalysisJobStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Whether the job has stopped: every file either completed or failed.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL || this == FAILED;
    }

    public static AnalysisJobStatus fromValue(String raw) {
        if (!StringUtils.hasText(raw)) {
            return QUEUED;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AnalysisJobStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return switch (normalized) {
            case "pending" -> QUEUED;
            case "running", "in_progress" -> PROCESSING;
            default -> FAILED;
        };
    }
}
