package dev.jobalerts.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A single job listing, identified by its URL.
 * <p>
 * All attributes are fixed at construction. The only state change allowed
 * afterwards is the one-way {@code notified} transition.
 */
@Getter
@Builder
@ToString(exclude = "description")
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Posting {

    @EqualsAndHashCode.Include
    private final String url;
    private final String company;
    private final String title;
    @Builder.Default
    private final String location = "";
    @Builder.Default
    private final String jobType = "";
    @Builder.Default
    private final String description = "";
    private final String source; // producer name, for logging only
    private final Instant firstSeen;

    private boolean notified;

    public void markNotified() {
        this.notified = true;
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
