package dev.pekelund.pricing.quoteservice;

import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(QuoteServiceProperties.class)
public class QuoteServiceConfig {

    @Bean
    @ConditionalOnExpression("'${quote.service.base-url:}' != ''")
    public QuoteServiceClient quoteServiceClient(RestClient.Builder restClientBuilder,
        QuoteServiceProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());

        RestClient restClient = restClientBuilder
            .requestFactory(requestFactory)
            .build();
        return new QuoteServiceClient(restClient, properties);
    }

    @Bean
    @ConditionalOnExpression("'${quote.service.base-url:}' == ''")
    public DisabledQuoteEmitter disabledQuoteEmitter() {
        return new DisabledQuoteEmitter();
    }
}
