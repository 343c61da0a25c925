package dev.pekelund.pricing.analysis;

import java.util.Locale;
import org.springframework.util.StringUtils;

/**
 * How an analysis record came into existence.
 */
public enum EntryMethod {

    OCR("ocr"),
    MANUAL("manual"),
    AI_FAILED("ai_failed");

    private final String value;

    EntryMethod(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static EntryMethod fromValue(String raw) {
        if (!StringUtils.hasText(raw)) {
            return OCR;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (EntryMethod method : values()) {
            if (method.value.equals(normalized)) {
                return method;
            }
        }
        return OCR;
    }
}
