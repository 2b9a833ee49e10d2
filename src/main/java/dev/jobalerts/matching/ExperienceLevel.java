package dev.jobalerts.matching;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonical experience buckets, each detected in a job title by a fixed keyword set.
 */
public enum ExperienceLevel {

    INTERN("intern", "internship", "co-op", "coop", "apprentice"),
    ENTRY("entry", "entry-level", "junior", "jr", "graduate", "new grad", "associate"),
    MID("mid", "mid-level", "intermediate"),
    SENIOR("senior", "sr", "lead", "principal", "staff", "director", "manager", "head");

    private final Pattern pattern;

    ExperienceLevel(String... keywords) {
        String alternatives = Arrays.stream(keywords)
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        // Whole words only: "sr" must not fire inside "srinagar", "lead" not inside "leading".
        // A hyphen is a word break, so "senior-level" still reads as senior
        this.pattern = Pattern.compile("\\b(?:" + alternatives + ")\\b");
    }

    /**
     * All levels whose keywords appear in the title. Matching is case-insensitive.
     */
    public static Set<ExperienceLevel> detect(String title) {
        Set<ExperienceLevel> detected = EnumSet.noneOf(ExperienceLevel.class);
        if (title == null || title.isBlank()) {
            return detected;
        }
        String normalized = title.toLowerCase(Locale.ROOT);
        for (ExperienceLevel level : values()) {
            if (level.pattern.matcher(normalized).find()) {
                detected.add(level);
            }
        }
        return detected;
    }

    /**
     * Resolve a configured level name such as {@code "senior"}.
     */
    public static Optional<ExperienceLevel> fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(level -> level.name().equals(normalized))
                .findFirst();
    }
}
