package dev.pekelund.pricing.quote;

public class QuoteEmissionException extends RuntimeException {

    public QuoteEmissionException(String message) {
        super(message);
    }

    public QuoteEmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
