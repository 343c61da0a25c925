package dev.pekelund.pricing.pricing;

import dev.pekelund.pricing.settings.PricingSettings;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Pricing formulas shared by every row of a pricing sheet.
 *
 * <p>All methods are total: negative or missing inputs are treated as zero so a single corrupt
 * row never aborts a sheet. Page quantities carry one decimal, money two.
 */
public final class PricingCalculator {

    /**
     * Per-page rates are quoted in increments of this amount.
     */
    public static final BigDecimal RATE_GRANULARITY = new BigDecimal("2.50");

    private static final BigDecimal ZERO_PAGES = BigDecimal.ZERO.setScale(1);
    private static final BigDecimal ZERO_MONEY = BigDecimal.ZERO.setScale(2);

    private PricingCalculator() {
    }

    /**
     * {@code ceil((wordCount / wordsPerPage) * complexityMultiplier * 10) / 10}, never below
     * {@code minPages}. Always rounds up to the next tenth of a page. A document without words
     * bills nothing and skips the minimum.
     */
    public static BigDecimal billablePages(int wordCount, BigDecimal complexityMultiplier, int wordsPerPage,
        BigDecimal minPages) {

        if (wordCount <= 0) {
            return ZERO_PAGES;
        }
        int divisor = wordsPerPage > 0 ? wordsPerPage : PricingSettings.DEFAULT_WORDS_PER_PAGE;
        BigDecimal tenths = BigDecimal.valueOf(wordCount)
            .multiply(nonNegative(complexityMultiplier))
            .multiply(BigDecimal.TEN)
            .divide(BigDecimal.valueOf(divisor), 0, RoundingMode.CEILING);
        BigDecimal pages = tenths.movePointLeft(1).setScale(1, RoundingMode.UNNECESSARY);
        BigDecimal minimum = nonNegative(minPages).setScale(1, RoundingMode.CEILING);
        return pages.max(minimum);
    }

    public static BigDecimal billablePages(int wordCount, BigDecimal complexityMultiplier, PricingSettings settings) {
        return billablePages(wordCount, complexityMultiplier, settings.wordsPerPage(), settings.minBillablePages());
    }

    /**
     * Base rate adjusted by the target language multiplier, rounded up to the next
     * {@link #RATE_GRANULARITY} increment.
     */
    public static BigDecimal perPageRate(BigDecimal baseRate, BigDecimal languageMultiplier) {
        BigDecimal multiplier = languageMultiplier != null && languageMultiplier.signum() > 0
            ? languageMultiplier
            : BigDecimal.ONE;
        BigDecimal steps = nonNegative(baseRate)
            .multiply(multiplier)
            .divide(RATE_GRANULARITY, 0, RoundingMode.CEILING);
        return steps.multiply(RATE_GRANULARITY).setScale(2, RoundingMode.UNNECESSARY);
    }

    public static BigDecimal translationCost(BigDecimal billablePages, BigDecimal perPageRate) {
        BigDecimal pages = nonNegative(billablePages);
        if (pages.signum() == 0) {
            return ZERO_MONEY;
        }
        return pages.multiply(nonNegative(perPageRate)).setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal certificationCost(List<DocumentCertification> certifications) {
        if (certifications == null || certifications.isEmpty()) {
            return ZERO_MONEY;
        }
        BigDecimal total = ZERO_MONEY;
        for (DocumentCertification certification : certifications) {
            if (certification != null) {
                total = total.add(nonNegative(certification.price()));
            }
        }
        return total.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal lineTotal(BigDecimal translationCost, BigDecimal certificationCost, boolean excluded) {
        if (excluded) {
            return ZERO_MONEY;
        }
        return nonNegative(translationCost).add(nonNegative(certificationCost)).setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal nonNegative(BigDecimal value) {
        return value != null && value.signum() > 0 ? value : BigDecimal.ZERO;
    }
}
