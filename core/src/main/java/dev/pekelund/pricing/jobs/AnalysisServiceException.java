package dev.pekelund.pricing.jobs;

public class AnalysisServiceException extends RuntimeException {

    public AnalysisServiceException(String message) {
        super(message);
    }

    public AnalysisServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
