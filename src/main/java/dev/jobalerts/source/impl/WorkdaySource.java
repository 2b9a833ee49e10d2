package dev.jobalerts.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.jobalerts.config.SourcesConfig.CompanyConfig;
import dev.jobalerts.metrics.AlertMetrics;
import dev.jobalerts.model.Posting;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a Workday career site through its CXS jobs endpoint, page by page.
 * <p>
 * Accepts either the human site URL
 * ({@code https://acme.wd5.myworkdayjobs.com/AcmeCareers}) or the API URL
 * ({@code https://acme.wd5.myworkdayjobs.com/wday/cxs/acme/AcmeCareers/jobs}).
 */
@Slf4j
public class WorkdaySource extends AbstractJobSource {

    static final int PAGE_SIZE = 20;
    static final int MAX_OFFSET = 200;

    private static final Pattern SITE_URL =
            Pattern.compile("https?://([^.]+)\\.(wd\\d+)\\.myworkdayjobs\\.com/([^/?]+)");
    private static final Pattern API_URL =
            Pattern.compile("(https?://[^/]+\\.myworkdayjobs\\.com)/wday/cxs/[^/]+/([^/]+)");

    private final String apiUrl;
    private final String siteUrl;

    public WorkdaySource(WebClient.Builder webClientBuilder, AlertMetrics metrics, CompanyConfig company) {
        super(webClientBuilder, metrics, company);
        this.apiUrl = toApiUrl(company.getUrl());
        this.siteUrl = toSiteUrl(company.getUrl());
    }

    static String toApiUrl(String url) {
        if (url.contains("/wday/cxs/")) {
            return url;
        }
        Matcher matcher = SITE_URL.matcher(url);
        if (matcher.lookingAt()) {
            String tenant = matcher.group(1);
            return String.format("https://%s.%s.myworkdayjobs.com/wday/cxs/%s/%s/jobs",
                    tenant, matcher.group(2), tenant, matcher.group(3));
        }
        return url;
    }

    static String toSiteUrl(String url) {
        if (url.contains("/wday/cxs/")) {
            Matcher matcher = API_URL.matcher(url);
            if (matcher.lookingAt()) {
                return matcher.group(1) + "/" + matcher.group(2);
            }
        }
        String withoutQuery = url.split("\\?")[0];
        while (withoutQuery.endsWith("/")) {
            withoutQuery = withoutQuery.substring(0, withoutQuery.length() - 1);
        }
        return withoutQuery;
    }

    protected String getApiUrl() {
        return apiUrl;
    }

    @Override
    protected Mono<List<Posting>> fetchCompanyPostings() {
        return fetchPage(0, -1)
                .expand(page -> page.hasNext() ? fetchPage(page.offset() + PAGE_SIZE, page.total()) : Mono.empty())
                .flatMapIterable(Page::postings)
                .collectList();
    }

    /**
     * @param knownTotal total reported by the first page; later pages may report 0
     */
    private Mono<Page> fetchPage(int offset, int knownTotal) {
        WorkdayRequest request = new WorkdayRequest(Map.of(), PAGE_SIZE, offset, "");
        return timedPost(getApiUrl(), request, WorkdayResponse.class)
                .map(response -> {
                    List<WorkdayJob> jobs = response.getJobPostings() != null ? response.getJobPostings() : List.of();
                    int total = knownTotal >= 0 ? knownTotal : response.getTotal();
                    List<Posting> postings = jobs.stream()
                            .map(this::mapToPosting)
                            .filter(posting -> posting.hasUrl() && posting.getTitle() != null && !posting.getTitle().isBlank())
                            .toList();
                    log.debug("{} - Workday page at offset {}: {} postings of {}", getName(), offset, jobs.size(), total);
                    return new Page(offset, total, !jobs.isEmpty(), postings);
                });
    }

    private Posting mapToPosting(WorkdayJob job) {
        String path = job.getExternalPath();
        String url = (path != null && !path.isBlank()) ? siteUrl + path : "";
        return basePosting()
                .title(job.getTitle())
                .url(url)
                .location(job.getLocationsText() != null ? job.getLocationsText() : "")
                .build();
    }

    record Page(int offset, int total, boolean nonEmpty, List<Posting> postings) {
        boolean hasNext() {
            return nonEmpty && offset + PAGE_SIZE < total && offset < MAX_OFFSET;
        }
    }

    record WorkdayRequest(Map<String, Object> appliedFacets, int limit, int offset, String searchText) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WorkdayResponse {
        private int total;
        private List<WorkdayJob> jobPostings;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WorkdayJob {
        private String title;
        private String externalPath;
        private String locationsText;
    }
}
