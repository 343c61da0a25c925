package dev.pekelund.pricing.quoteservice;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "quote.service")
public class QuoteServiceProperties {

    /**
     * Base URL of the quote service.
     */
    private String baseUrl;

    /**
     * Path creating quotes; an existing quote is updated at {@code <quotes-path>/<quote id>}.
     */
    private String quotesPath = "/quotes";

    private boolean useIdToken = false;

    private String audience;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(30);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getQuotesPath() {
        return quotesPath;
    }

    public void setQuotesPath(String quotesPath) {
        this.quotesPath = quotesPath;
    }

    public boolean isUseIdToken() {
        return useIdToken;
    }

    public void setUseIdToken(boolean useIdToken) {
        this.useIdToken = useIdToken;
    }

    public String getAudience() {
        return audience;
    }

    public void setAudience(String audience) {
        this.audience = audience;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public boolean isConfigured() {
        return StringUtils.hasText(baseUrl);
    }

    public String resolveAudience() {
        return StringUtils.hasText(audience) ? audience : baseUrl;
    }
}
