package dev.pekelund.pricing.analysisservice;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "analysis.service")
public class AnalysisServiceProperties {

    /**
     * Base URL of the OCR/AI analysis service.
     */
    private String baseUrl;

    /**
     * Path accepting new analysis jobs; job state is read from {@code <jobs-path>/<job id>}.
     */
    private String jobsPath = "/jobs";

    /**
     * Path template returning per-page OCR detail of a file.
     */
    private String pagesPath = "/files/{fileId}/pages";

    /**
     * Whether to attach an ID token to each request for service-to-service authentication.
     */
    private boolean useIdToken = false;

    /**
     * Optional audience to include when minting the ID token. Defaults to the base URL.
     */
    private String audience;

    /**
     * HTTP connect timeout used when calling the analysis service.
     */
    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * HTTP read timeout used when calling the analysis service.
     */
    private Duration readTimeout = Duration.ofSeconds(60);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getJobsPath() {
        return jobsPath;
    }

    public void setJobsPath(String jobsPath) {
        this.jobsPath = jobsPath;
    }

    public String getPagesPath() {
        return pagesPath;
    }

    public void setPagesPath(String pagesPath) {
        this.pagesPath = pagesPath;
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
