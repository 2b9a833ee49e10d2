package dev.jobalerts.source;

import dev.jobalerts.model.Posting;
import reactor.core.publisher.Flux;

/**
 * A producer of candidate postings, usually one company's career site.
 */
public interface JobSource {

    /**
     * Name used in logs and metrics (e.g. the company name).
     */
    String getName();

    /**
     * Fetch the current postings. Errors are signalled on the returned stream
     * and are isolated by the caller; they never affect other sources.
     */
    Flux<Posting> fetchPostings();

    /**
     * Check if this source is enabled.
     */
    default boolean isEnabled() {
        return true;
    }
}
