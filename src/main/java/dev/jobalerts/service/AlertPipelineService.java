package dev.jobalerts.service;

import dev.jobalerts.matching.KeywordMatcher;
import dev.jobalerts.matching.MatchCriteria;
import dev.jobalerts.metrics.AlertMetrics;
import dev.jobalerts.model.CycleReport;
import dev.jobalerts.model.Posting;
import dev.jobalerts.notify.NotificationChannel;
import dev.jobalerts.source.JobSource;
import dev.jobalerts.source.JobSourceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one alert cycle: collect from every source, filter with the keyword
 * matcher, persist first-seen postings and deliver them to every channel.
 * <p>
 * Source and channel failures are contained and reported. Store failures abort
 * the cycle and surface as an error of the returned {@link Mono}. Only one cycle
 * runs at a time; a call made while one is in progress returns a skipped report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertPipelineService {

    private static final String SEPARATOR = "========================================";

    private final JobSourceRegistry sourceRegistry;
    private final KeywordMatcher keywordMatcher;
    private final MatchCriteria criteria;
    private final PostingStore postingStore;
    private final List<NotificationChannel> channels;
    private final AlertMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Value("${alerts.dry-run:false}")
    private boolean dryRun;

    /**
     * Execute one collect/filter/persist/notify cycle.
     *
     * @return report of the cycle, or a skipped report if a cycle is already running
     */
    public Mono<CycleReport> runCycle() {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                log.warn("Previous cycle still in progress - skipping this one");
                metrics.recordCycleSkipped();
                return Mono.just(CycleReport.skipped(Instant.now()));
            }

            Instant startedAt = Instant.now();
            log.info(SEPARATOR);
            log.info("Alert cycle starting");
            log.info(SEPARATOR);

            return collect()
                    .publishOn(Schedulers.boundedElastic())
                    .flatMap(results -> process(startedAt, results))
                    .doOnError(e -> log.error("Alert cycle aborted: {}", e.getMessage(), e))
                    .doFinally(signal -> running.set(false));
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Fetch from every enabled source. Sources run concurrently; results keep the
     * configured source order. A failing source yields an empty, failed result.
     */
    private Mono<List<SourceResult>> collect() {
        List<JobSource> sources = sourceRegistry.getSources().stream()
                .filter(JobSource::isEnabled)
                .toList();
        log.info("Sources enabled: {}", sources.size());

        return Flux.fromIterable(sources)
                .flatMapSequential(source -> Flux.defer(source::fetchPostings)
                        .filter(Posting::hasUrl)
                        .collectList()
                        .map(postings -> new SourceResult(source.getName(), postings, false))
                        .onErrorResume(e -> {
                            log.warn("Source {} failed: {}", source.getName(), e.getMessage());
                            metrics.recordSourceFailure(source.getName());
                            return Mono.just(new SourceResult(source.getName(), List.of(), true));
                        }))
                .collectList();
    }

    private Mono<CycleReport> process(Instant startedAt, List<SourceResult> results) {
        CycleReport.CycleReportBuilder report = CycleReport.builder().startedAt(startedAt);

        List<Posting> collected = new ArrayList<>();
        for (SourceResult result : results) {
            collected.addAll(result.postings());
            if (result.failed()) {
                report.failedSource(result.source());
            }
        }
        log.info("Total postings collected: {}", collected.size());
        metrics.recordPostingsCollected(collected.size());

        List<Posting> matched = collected.stream()
                .filter(posting -> keywordMatcher.matches(posting, criteria))
                .toList();
        log.info("Postings matching criteria: {}", matched.size());
        metrics.recordPostingsMatched(matched.size());

        List<Posting> newPostings = matched.stream()
                .filter(postingStore::add)
                .toList();
        log.info("New postings: {}", newPostings.size());
        metrics.recordPostingsNew(newPostings.size());

        report.collected(collected.size())
                .matched(matched.size())
                .newPostings(newPostings);

        return deliver(newPostings)
                .map(outcomes -> {
                    for (ChannelOutcome outcome : outcomes) {
                        report.delivered(outcome.channel(), outcome.delivered());
                        if (outcome.failed()) {
                            report.failedChannel(outcome.channel());
                        }
                    }
                    return finish(report, newPostings);
                });
    }

    private Mono<List<ChannelOutcome>> deliver(List<Posting> newPostings) {
        if (newPostings.isEmpty()) {
            log.info("No new postings to deliver");
            return Mono.just(List.of());
        }

        if (dryRun) {
            log.info("DRY RUN - would deliver {} postings:", newPostings.size());
            newPostings.forEach(posting -> log.info("  - [{}] {} @ {} ({})",
                    posting.getSource(), posting.getTitle(), posting.getCompany(), posting.getUrl()));
            return Mono.just(List.of());
        }

        List<NotificationChannel> enabled = channels.stream()
                .filter(NotificationChannel::isEnabled)
                .toList();
        if (enabled.isEmpty()) {
            log.warn("No notification channel enabled - {} postings stay unnotified", newPostings.size());
        }

        // One channel at a time so the notified marks are applied in channel order
        return Flux.fromIterable(enabled)
                .concatMap(channel -> Mono.defer(() -> channel.sendBatch(newPostings))
                        .defaultIfEmpty(0)
                        .map(count -> new ChannelOutcome(channel.getName(), count, count == 0))
                        .onErrorResume(e -> {
                            log.error("Channel {} failed: {}", channel.getName(), e.getMessage(), e);
                            return Mono.just(new ChannelOutcome(channel.getName(), 0, true));
                        })
                        .publishOn(Schedulers.boundedElastic())
                        .doOnNext(outcome -> applyOutcome(outcome, newPostings)))
                .collectList();
    }

    /**
     * A non-zero delivered count marks the whole batch notified, even if the
     * channel delivered only part of it.
     */
    private void applyOutcome(ChannelOutcome outcome, List<Posting> batch) {
        if (outcome.failed()) {
            log.error("Channel {} delivered none of {} postings", outcome.channel(), batch.size());
            metrics.recordChannelFailure(outcome.channel());
            return;
        }

        if (outcome.delivered() < batch.size()) {
            log.warn("Channel {} delivered {}/{} postings - marking the whole batch notified",
                    outcome.channel(), outcome.delivered(), batch.size());
        } else {
            log.info("Channel {} delivered {} postings", outcome.channel(), outcome.delivered());
        }
        metrics.recordPostingsDelivered(outcome.channel(), outcome.delivered());

        for (Posting posting : batch) {
            postingStore.markNotified(posting.getUrl());
            posting.markNotified();
        }
    }

    private CycleReport finish(CycleReport.CycleReportBuilder builder, List<Posting> newPostings) {
        CycleReport report = builder
                .pendingNotification(postingStore.countUnnotified())
                .finishedAt(Instant.now())
                .build();

        metrics.recordCycle();
        metrics.updateLastCycleStats(report.getCollected(), report.newCount(), (int) report.notifiedCount());

        log.info(SEPARATOR);
        log.info("CYCLE SUMMARY: collected {}, matched {}, new {}, notified {}",
                report.getCollected(), report.getMatched(), newPostings.size(), report.notifiedCount());
        report.getDeliveredByChannel().forEach((channel, count) -> log.info("  {}: {} delivered", channel, count));
        if (!report.getFailedSources().isEmpty()) {
            log.info("  Failed sources: {}", report.getFailedSources());
        }
        if (report.getPendingNotification() > 0) {
            log.info("  Postings awaiting notification: {}", report.getPendingNotification());
        }
        log.info(SEPARATOR);
        return report;
    }

    record SourceResult(String source, List<Posting> postings, boolean failed) {
    }

    record ChannelOutcome(String channel, int delivered, boolean failed) {
    }
}
