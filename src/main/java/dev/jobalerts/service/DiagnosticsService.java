package dev.jobalerts.service;

import dev.jobalerts.matching.KeywordMatcher;
import dev.jobalerts.matching.MatchCriteria;
import dev.jobalerts.model.Posting;
import dev.jobalerts.notify.NotificationChannel;
import dev.jobalerts.source.JobSource;
import dev.jobalerts.source.JobSourceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manual checks of the configured sources and channels. Nothing here touches
 * the posting store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagnosticsService {

    private final JobSourceRegistry sourceRegistry;
    private final KeywordMatcher keywordMatcher;
    private final MatchCriteria criteria;
    private final List<NotificationChannel> channels;

    /**
     * Fetch every enabled source and log each posting with its match decision.
     */
    public Mono<List<SourceScrape>> testScrape() {
        List<JobSource> sources = sourceRegistry.getSources().stream()
                .filter(JobSource::isEnabled)
                .toList();

        return Flux.fromIterable(sources)
                .concatMap(source -> Flux.defer(source::fetchPostings)
                        .map(posting -> new ScrapedPosting(posting, keywordMatcher.matches(posting, criteria)))
                        .collectList()
                        .map(postings -> new SourceScrape(source.getName(), postings, false))
                        .onErrorResume(e -> {
                            log.warn("Source {} failed: {}", source.getName(), e.getMessage());
                            return Mono.just(new SourceScrape(source.getName(), List.of(), true));
                        }))
                .doOnNext(this::logScrape)
                .collectList();
    }

    private void logScrape(SourceScrape scrape) {
        log.info("=== {} ({} postings{}) ===", scrape.source(), scrape.postings().size(),
                scrape.failed() ? ", FAILED" : "");
        for (ScrapedPosting scraped : scrape.postings()) {
            Posting posting = scraped.posting();
            log.info("  [{}] {}", scraped.matches() ? "x" : " ", posting.getTitle());
            log.info("      Location: {}", posting.getLocation());
            log.info("      URL: {}", posting.getUrl());
        }
    }

    /**
     * Send a sample posting through every enabled channel.
     *
     * @return send outcome per channel name
     */
    public Mono<Map<String, Boolean>> testNotify() {
        Posting sample = samplePosting();

        return Flux.fromIterable(channels)
                .filter(NotificationChannel::isEnabled)
                .concatMap(channel -> Mono.defer(() -> channel.send(sample))
                        .defaultIfEmpty(false)
                        .onErrorResume(e -> {
                            log.error("Channel {} failed: {}", channel.getName(), e.getMessage());
                            return Mono.just(false);
                        })
                        .map(sent -> Map.entry(channel.getName(), sent)))
                .doOnNext(result -> log.info("{} {} test notification",
                        result.getKey(), Boolean.TRUE.equals(result.getValue()) ? "sent" : "FAILED"))
                .collect(LinkedHashMap<String, Boolean>::new, (map, entry) -> map.put(entry.getKey(), entry.getValue()))
                .map(map -> (Map<String, Boolean>) map);
    }

    static Posting samplePosting() {
        return Posting.builder()
                .company("Test Company")
                .title("Software Engineer")
                .url("https://example.com/jobs/123")
                .location("Remote")
                .jobType("Full-time")
                .description("This is a test job posting.")
                .source("diagnostics")
                .firstSeen(Instant.now())
                .build();
    }

    public record ScrapedPosting(Posting posting, boolean matches) {
    }

    public record SourceScrape(String source, List<ScrapedPosting> postings, boolean failed) {
    }
}
