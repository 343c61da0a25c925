package dev.pekelund.pricing.quote;

public record QuoteReference(String quoteId, String quoteNumber) {
}
