package dev.jobalerts.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Matching algorithm settings.
 * Loaded from application.yml under 'matching' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig {

    /** exact | tokenized | fuzzy */
    private String mode = "tokenized";
    private double fuzzyThreshold = 0.85;
    private boolean caseSensitive = false;

    /** Subset of intern, entry, mid, senior. Empty disables the check. */
    private List<String> experienceLevels = new ArrayList<>();
}
