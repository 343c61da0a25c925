package dev.pekelund.pricing.analysis;

public class AnalysisResultStoreException extends RuntimeException {

    public AnalysisResultStoreException(String message) {
        super(message);
    }

    public AnalysisResultStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
