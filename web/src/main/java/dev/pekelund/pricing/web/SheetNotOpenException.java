package dev.pekelund.pricing.web;

public class SheetNotOpenException extends RuntimeException {

    public SheetNotOpenException(String batchId) {
        super("No pricing sheet is open for batch " + batchId);
    }
}
