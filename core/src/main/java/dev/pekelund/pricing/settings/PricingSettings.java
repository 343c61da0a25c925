package dev.pekelund.pricing.settings;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Global billing constants used while a pricing sheet is open. A sheet keeps the settings it
 * was built with; picking up changed values requires reopening the sheet.
 */
public record PricingSettings(
    BigDecimal baseRate,
    int wordsPerPage,
    BigDecimal easyMultiplier,
    BigDecimal mediumMultiplier,
    BigDecimal hardMultiplier,
    BigDecimal minBillablePages
) {

    public static final String KEY_BASE_RATE = "base_rate";
    public static final String KEY_WORDS_PER_PAGE = "words_per_page";
    public static final String KEY_COMPLEXITY_EASY = "complexity_easy";
    public static final String KEY_COMPLEXITY_MEDIUM = "complexity_medium";
    public static final String KEY_COMPLEXITY_HARD = "complexity_hard";
    public static final String KEY_MIN_BILLABLE_PAGES = "min_billable_pages";

    public static final BigDecimal DEFAULT_BASE_RATE = new BigDecimal("65.00");
    public static final int DEFAULT_WORDS_PER_PAGE = 225;
    public static final BigDecimal DEFAULT_EASY_MULTIPLIER = new BigDecimal("1.00");
    public static final BigDecimal DEFAULT_MEDIUM_MULTIPLIER = new BigDecimal("1.15");
    public static final BigDecimal DEFAULT_HARD_MULTIPLIER = new BigDecimal("1.25");
    public static final BigDecimal DEFAULT_MIN_BILLABLE_PAGES = new BigDecimal("0.5");

    private static final PricingSettings DEFAULTS = new PricingSettings(
        DEFAULT_BASE_RATE,
        DEFAULT_WORDS_PER_PAGE,
        DEFAULT_EASY_MULTIPLIER,
        DEFAULT_MEDIUM_MULTIPLIER,
        DEFAULT_HARD_MULTIPLIER,
        DEFAULT_MIN_BILLABLE_PAGES);

    public PricingSettings {
        baseRate = positiveOr(baseRate, DEFAULT_BASE_RATE).setScale(2, RoundingMode.HALF_UP);
        wordsPerPage = wordsPerPage > 0 ? wordsPerPage : DEFAULT_WORDS_PER_PAGE;
        easyMultiplier = positiveOr(easyMultiplier, DEFAULT_EASY_MULTIPLIER);
        mediumMultiplier = positiveOr(mediumMultiplier, DEFAULT_MEDIUM_MULTIPLIER);
        hardMultiplier = positiveOr(hardMultiplier, DEFAULT_HARD_MULTIPLIER);
        minBillablePages = minBillablePages != null && minBillablePages.signum() >= 0
            ? minBillablePages
            : DEFAULT_MIN_BILLABLE_PAGES;
    }

    public static PricingSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Resolve settings from raw key/value pairs as stored by the settings provider. Missing
     * keys and values that do not parse fall back to the documented defaults.
     */
    public static PricingSettings fromValues(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        return fromValues(values, DEFAULTS);
    }

    public static PricingSettings fromValues(Map<String, String> values, PricingSettings fallback) {
        Objects.requireNonNull(values, "values");
        PricingSettings base = fallback != null ? fallback : DEFAULTS;
        return new PricingSettings(
            parseDecimal(values.get(KEY_BASE_RATE), base.baseRate()),
            parseInt(values.get(KEY_WORDS_PER_PAGE), base.wordsPerPage()),
            parseDecimal(values.get(KEY_COMPLEXITY_EASY), base.easyMultiplier()),
            parseDecimal(values.get(KEY_COMPLEXITY_MEDIUM), base.mediumMultiplier()),
            parseDecimal(values.get(KEY_COMPLEXITY_HARD), base.hardMultiplier()),
            parseNonNegativeDecimal(values.get(KEY_MIN_BILLABLE_PAGES), base.minBillablePages()));
    }

    public BigDecimal multiplierFor(Complexity complexity) {
        if (complexity == null) {
            return mediumMultiplier;
        }
        return switch (complexity) {
            case EASY -> easyMultiplier;
            case MEDIUM -> mediumMultiplier;
            case HARD -> hardMultiplier;
        };
    }

    private static BigDecimal positiveOr(BigDecimal value, BigDecimal fallback) {
        return value != null && value.signum() > 0 ? value : fallback;
    }

    private static BigDecimal parseDecimal(String raw, BigDecimal fallback) {
        if (!StringUtils.hasText(raw)) {
            return fallback;
        }
        try {
            BigDecimal parsed = new BigDecimal(raw.trim());
            return parsed.signum() > 0 ? parsed : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    // Zero is a valid minimum: it switches the billable page floor off.
    private static BigDecimal parseNonNegativeDecimal(String raw, BigDecimal fallback) {
        if (!StringUtils.hasText(raw)) {
            return fallback;
        }
        try {
            BigDecimal parsed = new BigDecimal(raw.trim());
            return parsed.signum() >= 0 ? parsed : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static int parseInt(String raw, int fallback) {
        if (!StringUtils.hasText(raw)) {
            return fallback;
        }
        try {
            int parsed = new BigDecimal(raw.trim()).intValue();
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
