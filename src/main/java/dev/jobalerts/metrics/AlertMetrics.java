package dev.jobalerts.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for alert cycles, sources and channels.
 */
@Component
public class AlertMetrics {

    private static final String TAG_SOURCE = "source";
    private static final String TAG_CHANNEL = "channel";
    private final MeterRegistry registry;

    private final Counter cyclesCounter;
    private final Counter cyclesSkippedCounter;
    private final Counter postingsCollectedCounter;
    private final Counter postingsMatchedCounter;
    private final Counter postingsNewCounter;

    private final ConcurrentHashMap<String, Timer> sourceTimers = new ConcurrentHashMap<>();

    private final AtomicInteger lastCycleCollected = new AtomicInteger(0);
    private final AtomicInteger lastCycleNew = new AtomicInteger(0);
    private final AtomicInteger lastCycleNotified = new AtomicInteger(0);

    public AlertMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.cyclesCounter = Counter.builder("job_alerts_cycles_total")
                .description("Completed alert cycles")
                .register(registry);

        this.cyclesSkippedCounter = Counter.builder("job_alerts_cycles_skipped_total")
                .description("Cycles skipped because another was still running")
                .register(registry);

        this.postingsCollectedCounter = Counter.builder("job_alerts_postings_collected_total")
                .description("Postings returned by all sources")
                .register(registry);

        this.postingsMatchedCounter = Counter.builder("job_alerts_postings_matched_total")
                .description("Postings accepted by the keyword matcher")
                .register(registry);

        this.postingsNewCounter = Counter.builder("job_alerts_postings_new_total")
                .description("Matched postings seen for the first time")
                .register(registry);

        Gauge.builder("job_alerts_last_cycle_collected", lastCycleCollected, AtomicInteger::get)
                .description("Postings collected in last cycle")
                .register(registry);

        Gauge.builder("job_alerts_last_cycle_new", lastCycleNew, AtomicInteger::get)
                .description("New postings in last cycle")
                .register(registry);

        Gauge.builder("job_alerts_last_cycle_notified", lastCycleNotified, AtomicInteger::get)
                .description("Postings marked notified in last cycle")
                .register(registry);
    }

    public void recordCycle() {
        cyclesCounter.increment();
    }

    public void recordCycleSkipped() {
        cyclesSkippedCounter.increment();
    }

    public void recordPostingsCollected(int count) {
        postingsCollectedCounter.increment(count);
    }

    public void recordPostingsMatched(int count) {
        postingsMatchedCounter.increment(count);
    }

    public void recordPostingsNew(int count) {
        postingsNewCounter.increment(count);
    }

    public void recordPostingsDelivered(String channel, int count) {
        Counter.builder("job_alerts_postings_delivered_total")
                .tag(TAG_CHANNEL, channel)
                .register(registry)
                .increment(count);
    }

    public void recordChannelFailure(String channel) {
        Counter.builder("job_alerts_channel_failures_total")
                .tag(TAG_CHANNEL, channel)
                .register(registry)
                .increment();
    }

    public void recordSourceFailure(String source) {
        Counter.builder("job_alerts_source_failures_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    public void incrementPostingsDiscovered(String source) {
        Counter.builder("job_alerts_postings_discovered_by_source_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    /**
     * Get or create a timer for a specific source.
     */
    public Timer getSourceTimer(String source) {
        return sourceTimers.computeIfAbsent(source, name ->
                Timer.builder("job_alerts_source_fetch_duration")
                        .description("Time to fetch postings from a source")
                        .tag(TAG_SOURCE, name)
                        .register(registry));
    }

    public void recordFetchLatency(String source, long latencyMs) {
        getSourceTimer(source).record(Duration.ofMillis(latencyMs));
    }

    public void updateLastCycleStats(int collected, int newPostings, int notified) {
        lastCycleCollected.set(collected);
        lastCycleNew.set(newPostings);
        lastCycleNotified.set(notified);
    }
}
