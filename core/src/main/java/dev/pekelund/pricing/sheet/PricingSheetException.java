package dev.pekelund.pricing.sheet;

/**
 * Raised when an edit cannot be applied to a pricing sheet. The sheet is left unchanged.
 */
public class PricingSheetException extends RuntimeException {

    private final boolean notFound;

    public PricingSheetException(String message) {
        this(message, false);
    }

    private PricingSheetException(String message, boolean notFound) {
        super(message);
        this.notFound = notFound;
    }

    public static PricingSheetException unknownRow(String analysisId) {
        return new PricingSheetException("No pricing row for analysis " + analysisId, true);
    }

    public static PricingSheetException unknownCertification(String certificationTypeId) {
        return new PricingSheetException("Unknown certification type " + certificationTypeId);
    }

    /**
     * Whether the edit referenced a row that is not on the sheet.
     */
    public boolean isNotFound() {
        return notFound;
    }
}
