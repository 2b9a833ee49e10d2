package dev.jobalerts.config;

import dev.jobalerts.matching.ExperienceLevel;
import dev.jobalerts.matching.MatchCriteria;
import dev.jobalerts.matching.MatchMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds the immutable {@link MatchCriteria} once at startup. Bad values
 * degrade to documented defaults instead of failing the application.
 */
@Slf4j
@Configuration
public class CriteriaConfig {

    @Bean
    public MatchCriteria matchCriteria(KeywordsConfig keywords, MatchingConfig matching) {
        MatchMode mode = MatchMode.fromConfig(matching.getMode()).orElseGet(() -> {
            log.warn("Unknown matching mode: '{}', falling back to tokenized", matching.getMode());
            return MatchMode.TOKENIZED;
        });

        double threshold = matching.getFuzzyThreshold();
        if (Double.isNaN(threshold)) {
            log.warn("Fuzzy threshold is not a number, using {}", MatchCriteria.DEFAULT_FUZZY_THRESHOLD);
            threshold = MatchCriteria.DEFAULT_FUZZY_THRESHOLD;
        } else if (threshold < 0.0 || threshold > 1.0) {
            double clamped = Math.max(0.0, Math.min(1.0, threshold));
            log.warn("Fuzzy threshold {} outside [0,1], using {}", threshold, clamped);
            threshold = clamped;
        }

        Set<ExperienceLevel> levels = EnumSet.noneOf(ExperienceLevel.class);
        for (String name : matching.getExperienceLevels()) {
            ExperienceLevel.fromConfig(name).ifPresentOrElse(levels::add,
                    () -> log.warn("Unknown experience level '{}' ignored", name));
        }

        MatchCriteria criteria = MatchCriteria.builder()
                .include(new LinkedHashSet<>(keywords.getInclude()))
                .exclude(new LinkedHashSet<>(keywords.getExclude()))
                .locations(new LinkedHashSet<>(keywords.getLocations()))
                .experienceLevels(levels)
                .mode(mode)
                .fuzzyThreshold(threshold)
                .caseSensitive(matching.isCaseSensitive())
                .build();

        log.info("Match criteria: {} include, {} exclude, {} location keywords, levels {}, mode {}",
                criteria.include().size(), criteria.exclude().size(), criteria.locations().size(),
                criteria.experienceLevels(), criteria.mode());
        return criteria;
    }
}
