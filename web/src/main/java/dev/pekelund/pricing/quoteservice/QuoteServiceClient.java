package dev.pekelund.pricing.quoteservice;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.pekelund.pricing.gcp.ServiceIdTokenProvider;
import dev.pekelund.pricing.messaging.QuotePricingMessage;
import dev.pekelund.pricing.quote.QuoteEmissionException;
import dev.pekelund.pricing.quote.QuoteEmitter;
import dev.pekelund.pricing.quote.QuoteReference;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

public class QuoteServiceClient implements QuoteEmitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuoteServiceClient.class);

    private final RestClient restClient;
    private final QuoteServiceProperties properties;
    private final ServiceIdTokenProvider idTokenProvider;

    public QuoteServiceClient(RestClient restClient, QuoteServiceProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
        this.idTokenProvider = new ServiceIdTokenProvider(properties.resolveAudience(), QuoteEmissionException::new);
    }

    @Override
    public QuoteReference createQuote(QuotePricingMessage message) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
            .path(properties.getQuotesPath())
            .build()
            .toUri();
        try {
            QuoteResponse response = restClient
                .post()
                .uri(uri)
                .headers(this::applyHeaders)
                .contentType(MediaType.APPLICATION_JSON)
                .body(message)
                .retrieve()
                .body(QuoteResponse.class);
            QuoteReference reference = toReference(response, null);
            LOGGER.info("Created quote {} for batch {}", reference.quoteId(), message.batchId());
            return reference;
        } catch (RestClientException ex) {
            throw new QuoteEmissionException("Failed to create quote for batch " + message.batchId(), ex);
        }
    }

    @Override
    public QuoteReference updateQuote(String quoteId, QuotePricingMessage message) {
        if (!StringUtils.hasText(quoteId)) {
            throw new QuoteEmissionException("A quote id is required to update a quote");
        }
        URI uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
            .path(properties.getQuotesPath())
            .pathSegment(quoteId)
            .build()
            .toUri();
        try {
            QuoteResponse response = restClient
                .put()
                .uri(uri)
                .headers(this::applyHeaders)
                .contentType(MediaType.APPLICATION_JSON)
                .body(message)
                .retrieve()
                .body(QuoteResponse.class);
            QuoteReference reference = toReference(response, quoteId);
            LOGGER.info("Updated quote {} for batch {}", reference.quoteId(), message.batchId());
            return reference;
        } catch (RestClientException ex) {
            throw new QuoteEmissionException("Failed to update quote " + quoteId, ex);
        }
    }

    private void applyHeaders(HttpHeaders headers) {
        if (properties.isUseIdToken()) {
            headers.setBearerAuth(idTokenProvider.fetchIdToken());
        }
    }

    private QuoteReference toReference(QuoteResponse response, String fallbackQuoteId) {
        String quoteId = response != null && StringUtils.hasText(response.quoteId())
            ? response.quoteId()
            : fallbackQuoteId;
        if (!StringUtils.hasText(quoteId)) {
            throw new QuoteEmissionException("Quote service response did not include a quote id");
        }
        return new QuoteReference(quoteId, response != null ? response.quoteNumber() : null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QuoteResponse(
        @JsonAlias({"id", "quote_id"}) String quoteId,
        @JsonAlias("quote_number") String quoteNumber
    ) {
    }
}
