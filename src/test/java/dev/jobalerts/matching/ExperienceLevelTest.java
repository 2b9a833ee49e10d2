package dev.jobalerts.matching;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExperienceLevelTest {

    @Test
    void shouldDetectLevelsInTitle() {
        assertThat(ExperienceLevel.detect("Senior Director of Engineering")).containsExactly(ExperienceLevel.SENIOR);
        assertThat(ExperienceLevel.detect("Software Engineering Intern")).containsExactly(ExperienceLevel.INTERN);
        assertThat(ExperienceLevel.detect("Entry-Level Analyst")).containsExactly(ExperienceLevel.ENTRY);
        assertThat(ExperienceLevel.detect("New Grad Software Engineer")).containsExactly(ExperienceLevel.ENTRY);
        assertThat(ExperienceLevel.detect("Mid-Level Backend Developer")).containsExactly(ExperienceLevel.MID);
        assertThat(ExperienceLevel.detect("Co-op Student")).containsExactly(ExperienceLevel.INTERN);
    }

    @Test
    void shouldTreatHyphenAsWordBreak() {
        assertThat(ExperienceLevel.detect("Senior-Level Software Engineer")).containsExactly(ExperienceLevel.SENIOR);
        assertThat(ExperienceLevel.detect("Sr-Software Engineer")).containsExactly(ExperienceLevel.SENIOR);
        assertThat(ExperienceLevel.detect("Backend Engineer - Lead")).containsExactly(ExperienceLevel.SENIOR);
    }

    @Test
    void shouldDetectSeveralLevels() {
        assertThat(ExperienceLevel.detect("Junior to Senior Engineer"))
                .containsExactlyInAnyOrder(ExperienceLevel.ENTRY, ExperienceLevel.SENIOR);
    }

    @Test
    void shouldMatchWholeWordsOnly() {
        assertThat(ExperienceLevel.detect("Internal Tools Engineer")).isEmpty();
        assertThat(ExperienceLevel.detect("Leading Edge Developer")).isEmpty();
        assertThat(ExperienceLevel.detect("Engineer, Srinagar office")).isEmpty();
        assertThat(ExperienceLevel.detect("Software Engineer")).isEmpty();
        assertThat(ExperienceLevel.detect(null)).isEmpty();
    }

    @Test
    void shouldResolveConfiguredNames() {
        assertThat(ExperienceLevel.fromConfig("Senior")).contains(ExperienceLevel.SENIOR);
        assertThat(ExperienceLevel.fromConfig(" intern ")).contains(ExperienceLevel.INTERN);
        assertThat(ExperienceLevel.fromConfig("principal")).isEmpty();
        assertThat(ExperienceLevel.fromConfig("")).isEmpty();
    }
}
