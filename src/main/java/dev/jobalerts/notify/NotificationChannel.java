package dev.jobalerts.notify;

import dev.jobalerts.model.Posting;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A delivery mechanism for new postings.
 * <p>
 * Delivery failures are reported through the returned values, never as
 * errors: {@link #send} emits false and {@link #sendBatch} emits how many
 * postings actually went out, possibly fewer than the batch or zero.
 */
public interface NotificationChannel {

    /**
     * Stable channel name, used in logs, reports and metric tags.
     */
    String getName();

    /**
     * Deliver a single posting.
     *
     * @return true if the posting was delivered
     */
    Mono<Boolean> send(Posting posting);

    /**
     * Deliver a batch of postings.
     *
     * @return number of postings delivered
     */
    Mono<Integer> sendBatch(List<Posting> postings);

    default boolean isEnabled() {
        return true;
    }
}
