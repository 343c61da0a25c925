package dev.pekelund.pricing.quoteservice;

import dev.pekelund.pricing.messaging.QuotePricingMessage;
import dev.pekelund.pricing.quote.QuoteEmitter;
import dev.pekelund.pricing.quote.QuoteEmissionException;
import dev.pekelund.pricing.quote.QuoteReference;

public class DisabledQuoteEmitter implements QuoteEmitter {

    @Override
    public QuoteReference createQuote(QuotePricingMessage message) {
        throw new QuoteEmissionException("Quote service integration is disabled");
    }

    @Override
    public QuoteReference updateQuote(String quoteId, QuotePricingMessage message) {
        throw new QuoteEmissionException("Quote service integration is disabled");
    }
}
