package dev.jobalerts.source;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of source implementations a company can be configured with.
 */
public enum SourceType {
    GREENHOUSE,
    WORKDAY,
    GENERIC;

    public static Optional<SourceType> fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(GENERIC);
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.name().equals(normalized))
                .findFirst();
    }
}
