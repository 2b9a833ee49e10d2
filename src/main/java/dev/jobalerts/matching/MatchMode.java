package dev.jobalerts.matching;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * How a keyword is compared against posting text.
 */
public enum MatchMode {

    /** Keyword is a contiguous substring of the text. */
    EXACT,

    /** Keyword tokens are found among the text tokens, ignoring numeral suffixes. */
    TOKENIZED,

    /** Tokenized first, then token-set similarity above a threshold. */
    FUZZY;

    /**
     * Resolve a configured mode name such as {@code "fuzzy"}.
     *
     * @return the mode, or empty when the name is not recognised
     */
    public static Optional<MatchMode> fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(mode -> mode.name().equals(normalized))
                .findFirst();
    }
}
