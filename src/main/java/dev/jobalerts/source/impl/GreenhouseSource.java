package dev.jobalerts.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobalerts.config.SourcesConfig.CompanyConfig;
import dev.jobalerts.metrics.AlertMetrics;
import dev.jobalerts.model.Posting;
import lombok.Data;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Reads a Greenhouse job board through its public JSON API.
 * The configured url is either the board token or the board page URL.
 */
public class GreenhouseSource extends AbstractJobSource {

    private static final String API_URL = "https://boards-api.greenhouse.io/v1/boards/%s/jobs?content=true";

    public GreenhouseSource(WebClient.Builder webClientBuilder, AlertMetrics metrics, CompanyConfig company) {
        super(webClientBuilder, metrics, company);
    }

    protected String getApiUrl(String boardToken) {
        return String.format(API_URL, boardToken);
    }

    /**
     * "https://boards.greenhouse.io/stripe/" and "stripe" both give "stripe".
     */
    static String boardToken(String configured) {
        String trimmed = configured.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    @Override
    protected Mono<List<Posting>> fetchCompanyPostings() {
        String url = getApiUrl(boardToken(company.getUrl()));

        return timedGet(url, GreenhouseResponse.class)
                .map(response -> {
                    if (response.getJobs() == null)
                        return List.<Posting>of();
                    return response.getJobs().stream()
                            .map(this::mapToPosting)
                            .toList();
                });
    }

    private Posting mapToPosting(GreenhouseJob ghJob) {
        String location = "";
        if (ghJob.getLocation() != null) {
            location = ghJob.getLocation().getOrDefault("name", "");
        }

        return basePosting()
                .title(ghJob.getTitle())
                .url(ghJob.getAbsoluteUrl())
                .location(location)
                .description(stripHtml(ghJob.getContent()))
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GreenhouseResponse {
        private List<GreenhouseJob> jobs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GreenhouseJob {
        private String title;
        @JsonProperty("absolute_url")
        private String absoluteUrl;
        private String content;
        private Map<String, String> location;
    }
}
