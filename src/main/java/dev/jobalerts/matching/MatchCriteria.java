package dev.jobalerts.matching;

import lombok.Builder;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Operator interest criteria. Immutable; keywords are normalized once here so
 * that the matcher can compare them directly against normalized text.
 *
 * @param include          keywords of interest; empty means every posting matches
 * @param exclude          keywords that reject a posting, checked before include
 * @param locations        accepted location keywords; empty disables location filtering
 * @param experienceLevels allowed levels; empty disables level filtering
 * @param mode             keyword comparison mode
 * @param fuzzyThreshold   minimum similarity ratio in [0,1] for fuzzy mode
 * @param caseSensitive    compare without lower-casing
 */
@Builder(toBuilder = true)
public record MatchCriteria(
        Set<String> include,
        Set<String> exclude,
        Set<String> locations,
        Set<ExperienceLevel> experienceLevels,
        MatchMode mode,
        Double fuzzyThreshold,
        boolean caseSensitive) {

    public static final double DEFAULT_FUZZY_THRESHOLD = 0.85;

    public MatchCriteria {
        include = normalize(include, caseSensitive);
        exclude = normalize(exclude, caseSensitive);
        locations = normalize(locations, caseSensitive);
        experienceLevels = experienceLevels == null || experienceLevels.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ExperienceLevel.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(experienceLevels));
        mode = mode != null ? mode : MatchMode.TOKENIZED;
        fuzzyThreshold = fuzzyThreshold != null ? fuzzyThreshold : DEFAULT_FUZZY_THRESHOLD;
        if (fuzzyThreshold.isNaN() || fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0) {
            throw new IllegalArgumentException("Fuzzy threshold must be within [0,1]: " + fuzzyThreshold);
        }
    }

    /**
     * Criteria that accept every posting.
     */
    public static MatchCriteria matchAll() {
        return MatchCriteria.builder().build();
    }

    /**
     * Apply the same case normalization that was applied to the keywords.
     */
    public String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        return caseSensitive ? text : text.toLowerCase(Locale.ROOT);
    }

    private static Set<String> normalize(Collection<String> keywords, boolean caseSensitive) {
        if (keywords == null || keywords.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String trimmed = keyword.trim();
            normalized.add(caseSensitive ? trimmed : trimmed.toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(normalized);
    }
}
