package dev.pekelund.pricing.analysisservice;

import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(AnalysisServiceProperties.class)
public class AnalysisServiceConfig {

    @Bean
    @ConditionalOnExpression("'${analysis.service.base-url:}' != ''")
    public AnalysisServiceClient analysisServiceClient(RestClient.Builder restClientBuilder,
        AnalysisServiceProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());

        RestClient restClient = restClientBuilder
            .requestFactory(requestFactory)
            .build();
        return new AnalysisServiceClient(restClient, properties);
    }

    @Bean
    @ConditionalOnExpression("'${analysis.service.base-url:}' == ''")
    public DisabledAnalysisService disabledAnalysisService() {
        return new DisabledAnalysisService();
    }
}
