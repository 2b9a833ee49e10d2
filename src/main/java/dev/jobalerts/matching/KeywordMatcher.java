package dev.jobalerts.matching;

import dev.jobalerts.model.Posting;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a posting is of interest under a set of {@link MatchCriteria}.
 * <p>
 * Checks run in a fixed order and stop at the first rejection: exclusion,
 * location, experience level, inclusion. Criteria without include keywords
 * accept everything. Evaluation is pure and does no I/O.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeywordMatcher {

    private final SimilarityScorer similarityScorer;

    /**
     * Check whether a posting matches the criteria.
     *
     * @param posting  The posting to check
     * @param criteria Active criteria
     * @return true if the posting is of interest
     */
    public boolean matches(Posting posting, MatchCriteria criteria) {
        if (criteria.include().isEmpty()) {
            return true;
        }

        String probe = probeText(posting);

        if (!criteria.exclude().isEmpty() && matchesAny(probe, criteria.exclude(), criteria)) {
            log.debug("Posting '{}' rejected by exclude keyword", posting.getTitle());
            return false;
        }

        String location = posting.getLocation();
        if (!criteria.locations().isEmpty() && location != null && !location.isBlank()
                && !matchesAny(location, criteria.locations(), criteria)) {
            log.debug("Posting '{}' rejected by location: {}", posting.getTitle(), location);
            return false;
        }

        if (!criteria.experienceLevels().isEmpty() && !experienceAllowed(posting.getTitle(), criteria)) {
            log.debug("Posting '{}' rejected by experience level", posting.getTitle());
            return false;
        }

        return matchesAny(probe, criteria.include(), criteria);
    }

    /**
     * Title-based level check. A title without any level keyword fits every level.
     */
    boolean experienceAllowed(String title, MatchCriteria criteria) {
        Set<ExperienceLevel> detected = ExperienceLevel.detect(title);
        if (detected.isEmpty()) {
            return true;
        }
        return detected.stream().anyMatch(criteria.experienceLevels()::contains);
    }

    /**
     * Check if the text matches any keyword under the active mode.
     */
    boolean matchesAny(String text, Set<String> keywords, MatchCriteria criteria) {
        String normalized = criteria.normalizeText(text);
        return switch (criteria.mode()) {
            case EXACT -> exactMatch(normalized, keywords);
            case TOKENIZED -> tokenizedMatch(normalized, keywords);
            case FUZZY -> tokenizedMatch(normalized, keywords)
                    || fuzzyMatch(normalized, keywords, criteria.fuzzyThreshold());
        };
    }

    private boolean exactMatch(String normalized, Set<String> keywords) {
        for (String keyword : keywords) {
            if (normalized.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * "software engineer" matches "software engineer chrome extension" and
     * "software engineer iii", but not "software engineering manager".
     */
    private boolean tokenizedMatch(String normalized, Set<String> keywords) {
        Set<String> textTokenSet = new HashSet<>(TextTokenizer.tokenize(normalized));

        for (String keyword : keywords) {
            List<String> keywordTokens = TextTokenizer.tokenize(keyword);
            if (keywordTokens.isEmpty()) {
                // Keywords made only of punctuation have no tokens; compare them literally
                if (normalized.contains(keyword)) {
                    return true;
                }
                continue;
            }

            // Whole-token containment; also covers the keyword appearing as a contiguous phrase
            if (textTokenSet.containsAll(keywordTokens)) {
                return true;
            }
        }
        return false;
    }

    private boolean fuzzyMatch(String normalized, Set<String> keywords, double threshold) {
        double minimum = threshold * 100;
        for (String keyword : keywords) {
            double score = similarityScorer.score(keyword, normalized);
            if (score >= minimum) {
                log.debug("Fuzzy match: '{}' (score: {})", keyword, score);
                return true;
            }
        }
        return false;
    }

    private static String probeText(Posting posting) {
        String title = posting.getTitle() != null ? posting.getTitle() : "";
        String description = posting.getDescription() != null ? posting.getDescription() : "";
        return (title + " " + description).strip();
    }
}
