package dev.jobalerts.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Companies to watch, in the order their sources run.
 * Loaded from application.yml under 'sources' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sources")
public class SourcesConfig {

    public static final String DEFAULT_JOB_SELECTOR = "a[href*=job], a[href*=career], a[href*=position]";

    private List<CompanyConfig> companies = new ArrayList<>();

    @Data
    public static class CompanyConfig {
        private String name;
        private String url;

        /** greenhouse | workday | generic */
        private String type = "generic";

        // Only used by the generic page source
        private String jobSelector = DEFAULT_JOB_SELECTOR;
        private String titleSelector;
        private String locationSelector;
    }
}
