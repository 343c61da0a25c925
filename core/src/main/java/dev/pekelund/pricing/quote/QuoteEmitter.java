package dev.pekelund.pricing.quote;

import dev.pekelund.pricing.messaging.QuotePricingMessage;

/**
 * Downstream quote service receiving finalized pricing.
 */
public interface QuoteEmitter {

    QuoteReference createQuote(QuotePricingMessage message);

    QuoteReference updateQuote(String quoteId, QuotePricingMessage message);
}
