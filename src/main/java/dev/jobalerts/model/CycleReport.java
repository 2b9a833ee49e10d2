package dev.jobalerts.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one collect/filter/dedup/notify cycle.
 */
@Value
@Builder
public class CycleReport {

    Instant startedAt;
    Instant finishedAt;

    /** True when the trigger fired while another cycle was still running. */
    boolean skipped;

    int collected;
    int matched;
    @Singular
    List<Posting> newPostings;

    /** Delivered count per channel name, in channel order. */
    @Singular("delivered")
    Map<String, Integer> deliveredByChannel;

    @Singular
    List<String> failedSources;
    @Singular
    List<String> failedChannels;

    long pendingNotification;

    public static CycleReport skipped(Instant at) {
        return CycleReport.builder()
                .startedAt(at)
                .finishedAt(at)
                .skipped(true)
                .build();
    }

    public int newCount() {
        return newPostings.size();
    }

    public long notifiedCount() {
        return newPostings.stream().filter(Posting::isNotified).count();
    }
}
