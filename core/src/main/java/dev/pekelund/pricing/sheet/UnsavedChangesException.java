package dev.pekelund.pricing.sheet;

public class UnsavedChangesException extends RuntimeException {

    private final String batchId;

    public UnsavedChangesException(String batchId) {
        super("Pricing sheet for batch " + batchId + " has unsaved changes");
        this.batchId = batchId;
    }

    public String getBatchId() {
        return batchId;
    }
}
