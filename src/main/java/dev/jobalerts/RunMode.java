package dev.jobalerts;

import java.util.Locale;
import java.util.Optional;

/**
 * What the application does after startup, selected with {@code alerts.mode}.
 */
public enum RunMode {
    /** One cycle, then exit. */
    ONCE,
    /** A cycle now and then every polling interval until shutdown. */
    SCHEDULED,
    /** Fetch and match without persisting, then exit. */
    TEST_SCRAPE,
    /** Send a sample posting through each channel, then exit. */
    TEST_NOTIFY;

    public static Optional<RunMode> fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(ONCE);
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (RunMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
