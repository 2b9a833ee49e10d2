package dev.jobalerts.source.impl;

import dev.jobalerts.config.SourcesConfig.CompanyConfig;
import dev.jobalerts.metrics.AlertMetrics;
import dev.jobalerts.model.Posting;
import dev.jobalerts.source.JobSource;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Base for sources that read one company's postings over HTTP.
 * Handles the shared client setup, rate-limit retries and latency metrics.
 */
@Slf4j
public abstract class AbstractJobSource implements JobSource {

    protected final WebClient webClient;
    protected final AlertMetrics metrics;
    protected final CompanyConfig company;

    protected AbstractJobSource(WebClient.Builder webClientBuilder, AlertMetrics metrics, CompanyConfig company) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        // Sources share one injected builder, so each one configures its own copy
        this.webClient = webClientBuilder.clone()
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent",
                        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36")
                .defaultHeader("Accept-Language", "en-US,en;q=0.9")
                .build();
        this.metrics = metrics;
        this.company = company;
    }

    /**
     * Fetch all current postings of the company.
     */
    protected abstract Mono<List<Posting>> fetchCompanyPostings();

    @Override
    public String getName() {
        return company.getName();
    }

    @Override
    public Flux<Posting> fetchPostings() {
        log.info("Fetching postings from {} ({})", getName(), getClass().getSimpleName());

        return Mono.defer(this::fetchCompanyPostings)
                .retryWhen(Retry.backoff(2, Duration.ofSeconds(2)).filter(this::isRateLimited))
                .doOnNext(postings -> log.info("Fetched {} postings from {}", postings.size(), getName()))
                .flatMapMany(Flux::fromIterable)
                .doOnNext(posting -> metrics.incrementPostingsDiscovered(getName()));
    }

    private boolean isRateLimited(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            return response.getStatusCode().value() == 429;
        }
        return e.getMessage() != null && e.getMessage().contains("429");
    }

    /**
     * Strip HTML tags from text. Entity-escaped markup is unescaped first.
     */
    protected String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(Parser.unescapeEntities(html, false)).text();
    }

    /**
     * Build a Posting with common defaults.
     */
    protected Posting.PostingBuilder basePosting() {
        return Posting.builder()
                .company(company.getName())
                .source(getName())
                .firstSeen(Instant.now());
    }

    /**
     * Execute a timed GET request.
     */
    @SuppressWarnings("null")
    protected <T> Mono<T> timedGet(String url, Class<T> responseType) {
        long start = System.currentTimeMillis();
        return webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(responseType)
                .timeout(Duration.ofSeconds(30))
                .doOnTerminate(() -> metrics.recordFetchLatency(getName(), System.currentTimeMillis() - start));
    }

    /**
     * Execute a timed POST request with a JSON body.
     */
    @SuppressWarnings("null")
    protected <T, R> Mono<T> timedPost(String url, R body, Class<T> responseType) {
        long start = System.currentTimeMillis();
        return webClient.post()
                .uri(url)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(responseType)
                .timeout(Duration.ofSeconds(30))
                .doOnTerminate(() -> metrics.recordFetchLatency(getName(), System.currentTimeMillis() - start));
    }
}
