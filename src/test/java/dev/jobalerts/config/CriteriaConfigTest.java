package dev.jobalerts.config;

import dev.jobalerts.matching.ExperienceLevel;
import dev.jobalerts.matching.MatchCriteria;
import dev.jobalerts.matching.MatchMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CriteriaConfigTest {

    private final CriteriaConfig criteriaConfig = new CriteriaConfig();

    private KeywordsConfig keywords;
    private MatchingConfig matching;

    @BeforeEach
    void setUp() {
        keywords = new KeywordsConfig();
        keywords.setInclude(List.of("Java", " Backend ", ""));
        keywords.setExclude(List.of("Intern"));
        matching = new MatchingConfig();
    }

    @Test
    void buildsNormalizedCriteria() {
        MatchCriteria criteria = criteriaConfig.matchCriteria(keywords, matching);

        assertThat(criteria.include()).containsExactly("java", "backend");
        assertThat(criteria.exclude()).containsExactly("intern");
        assertThat(criteria.mode()).isEqualTo(MatchMode.TOKENIZED);
        assertThat(criteria.fuzzyThreshold()).isEqualTo(0.85);
        assertThat(criteria.experienceLevels()).isEmpty();
    }

    @Test
    void unknownModeFallsBackToTokenized() {
        matching.setMode("semantic");

        assertThat(criteriaConfig.matchCriteria(keywords, matching).mode()).isEqualTo(MatchMode.TOKENIZED);
    }

    @Test
    void fuzzyModeIsParsed() {
        matching.setMode("FUZZY");

        assertThat(criteriaConfig.matchCriteria(keywords, matching).mode()).isEqualTo(MatchMode.FUZZY);
    }

    @Test
    void outOfRangeThresholdIsClamped() {
        matching.setFuzzyThreshold(1.5);
        assertThat(criteriaConfig.matchCriteria(keywords, matching).fuzzyThreshold()).isEqualTo(1.0);

        matching.setFuzzyThreshold(-0.2);
        assertThat(criteriaConfig.matchCriteria(keywords, matching).fuzzyThreshold()).isEqualTo(0.0);
    }

    @Test
    void nanThresholdFallsBackToDefault() {
        matching.setFuzzyThreshold(Double.NaN);

        assertThat(criteriaConfig.matchCriteria(keywords, matching).fuzzyThreshold())
                .isEqualTo(MatchCriteria.DEFAULT_FUZZY_THRESHOLD);
    }

    @Test
    void unknownExperienceLevelsAreIgnored() {
        matching.setExperienceLevels(List.of("senior", "wizard"));

        assertThat(criteriaConfig.matchCriteria(keywords, matching).experienceLevels())
                .containsExactly(ExperienceLevel.SENIOR);
    }

    @Test
    void caseSensitiveKeepsKeywordCase() {
        matching.setCaseSensitive(true);

        assertThat(criteriaConfig.matchCriteria(keywords, matching).include()).containsExactly("Java", "Backend");
    }
}
