package dev.jobalerts.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword lists for posting selection.
 * Loaded from application.yml under 'keywords' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "keywords")
public class KeywordsConfig {

    private List<String> include = new ArrayList<>();
    private List<String> exclude = new ArrayList<>();
    private List<String> locations = new ArrayList<>();
}
