package dev.pekelund.pricing.settings;

import java.util.Locale;
import org.springframework.util.StringUtils;

/**
 * Translation difficulty tier assessed by the AI classifier or chosen by staff.
 */
public enum Complexity {

    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard");

    private final String value;

    Complexity(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Lenient lookup used for AI output and persisted values. Unknown or blank values fall
     * back to {@link #MEDIUM}; the legacy "low"/"high" labels map to easy/hard.
     */
    public static Complexity fromValue(String raw) {
        if (!StringUtils.hasText(raw)) {
            return MEDIUM;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "easy", "low" -> EASY;
            case "hard", "high" -> HARD;
            default -> MEDIUM;
        };
    }
}
