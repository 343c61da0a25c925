package dev.pekelund.pricing.analysisservice;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.pekelund.pricing.analysis.PageDetail;
import dev.pekelund.pricing.analysis.PageDetailSource;
import dev.pekelund.pricing.gcp.ServiceIdTokenProvider;
import dev.pekelund.pricing.jobs.AnalysisJob;
import dev.pekelund.pricing.jobs.AnalysisJobStatus;
import dev.pekelund.pricing.jobs.AnalysisService;
import dev.pekelund.pricing.jobs.AnalysisServiceException;
import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * HTTP client of the OCR/AI analysis service. Jobs are submitted with a JSON body of batch id
 * and file ids; job state and page detail are read with plain GETs.
 */
public class AnalysisServiceClient implements AnalysisService, PageDetailSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisServiceClient.class);

    private static final ParameterizedTypeReference<List<PagePayload>> PAGE_LIST = new ParameterizedTypeReference<>() {
    };

    private final RestClient restClient;
    private final AnalysisServiceProperties properties;
    private final ServiceIdTokenProvider idTokenProvider;

    public AnalysisServiceClient(RestClient restClient, AnalysisServiceProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
        this.idTokenProvider = new ServiceIdTokenProvider(properties.resolveAudience(), AnalysisServiceException::new);
    }

    @Override
    public AnalysisJob submit(String batchId, List<String> fileIds) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
            .path(properties.getJobsPath())
            .build()
            .toUri();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("batchId", batchId);
        payload.put("fileIds", fileIds != null ? List.copyOf(fileIds) : List.of());

        try {
            JobPayload response = restClient
                .post()
                .uri(uri)
                .headers(this::applyHeaders)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JobPayload.class);
            AnalysisJob job = toJob(response, batchId);
            LOGGER.info("Analysis service accepted job {} for {} file(s) of batch {}", job.id(),
                fileIds != null ? fileIds.size() : 0, batchId);
            return job;
        } catch (RestClientException ex) {
            throw new AnalysisServiceException("Failed to submit analysis job for batch " + batchId, ex);
        }
    }

    @Override
    public AnalysisJob fetchJob(String jobId) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
            .path(properties.getJobsPath())
            .pathSegment(jobId)
            .build()
            .toUri();
        try {
            JobPayload response = restClient
                .get()
                .uri(uri)
                .headers(this::applyHeaders)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JobPayload.class);
            return toJob(response, null);
        } catch (RestClientException ex) {
            throw new AnalysisServiceException("Failed to fetch analysis job " + jobId, ex);
        }
    }

    @Override
    public List<PageDetail> fetchPages(String fileId) {
        if (!StringUtils.hasText(fileId)) {
            return List.of();
        }
        URI uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
            .path(properties.getPagesPath())
            .buildAndExpand(Map.of("fileId", fileId))
            .encode()
            .toUri();
        try {
            List<PagePayload> response = restClient
                .get()
                .uri(uri)
                .headers(this::applyHeaders)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(PAGE_LIST);
            if (response == null) {
                return List.of();
            }
            List<PageDetail> pages = new ArrayList<>(response.size());
            for (PagePayload page : response) {
                if (page == null) {
                    continue;
                }
                pages.add(new PageDetail(
                    StringUtils.hasText(page.fileId()) ? page.fileId() : fileId,
                    page.pageNumber() != null ? page.pageNumber() : pages.size() + 1,
                    page.wordCount() != null ? page.wordCount() : 0,
                    page.complexity()));
            }
            return List.copyOf(pages);
        } catch (RestClientException ex) {
            throw new AnalysisServiceException("Failed to fetch page detail of file " + fileId, ex);
        }
    }

    private void applyHeaders(HttpHeaders headers) {
        if (properties.isUseIdToken()) {
            headers.setBearerAuth(idTokenProvider.fetchIdToken());
        }
    }

    private AnalysisJob toJob(JobPayload payload, String fallbackBatchId) {
        if (payload == null || !StringUtils.hasText(payload.id())) {
            throw new AnalysisServiceException("Analysis service returned a job without an id");
        }
        return new AnalysisJob(
            payload.id(),
            StringUtils.hasText(payload.batchId()) ? payload.batchId() : fallbackBatchId,
            AnalysisJobStatus.fromValue(payload.status()),
            orZero(payload.totalFiles()),
            orZero(payload.completedFiles()),
            orZero(payload.failedFiles()),
            orZero(payload.totalDocumentsFound()),
            parseInstant(payload.startedAt()),
            parseInstant(payload.completedAt()));
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private static Instant parseInstant(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            LOGGER.warn("Ignoring unparseable job timestamp '{}'", value);
            return null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JobPayload(
        @JsonAlias("job_id") String id,
        @JsonAlias("batch_id") String batchId,
        String status,
        @JsonAlias("total_files") Integer totalFiles,
        @JsonAlias("completed_files") Integer completedFiles,
        @JsonAlias("failed_files") Integer failedFiles,
        @JsonAlias("total_documents_found") Integer totalDocumentsFound,
        @JsonAlias("started_at") String startedAt,
        @JsonAlias("completed_at") String completedAt
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PagePayload(
        @JsonAlias("file_id") String fileId,
        @JsonAlias("page_number") Integer pageNumber,
        @JsonAlias("word_count") Integer wordCount,
        String complexity
    ) {
    }
}
