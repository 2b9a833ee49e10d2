package dev.jobalerts.source;

import dev.jobalerts.config.SourcesConfig;
import dev.jobalerts.config.SourcesConfig.CompanyConfig;
import dev.jobalerts.metrics.AlertMetrics;
import dev.jobalerts.source.impl.GenericSource;
import dev.jobalerts.source.impl.GreenhouseSource;
import dev.jobalerts.source.impl.WorkdaySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the configured companies into sources once, at startup, keeping
 * the configured order.
 */
@Slf4j
@Component
public class JobSourceRegistry {

    private final List<JobSource> sources;

    public JobSourceRegistry(SourcesConfig sourcesConfig, WebClient.Builder webClientBuilder, AlertMetrics metrics) {
        List<JobSource> resolved = new ArrayList<>();
        for (CompanyConfig company : sourcesConfig.getCompanies()) {
            create(company, webClientBuilder, metrics).ifPresent(resolved::add);
        }
        this.sources = List.copyOf(resolved);
        log.info("Configured {} sources", sources.size());
    }

    /**
     * Sources in configured order.
     */
    public List<JobSource> getSources() {
        return sources;
    }

    private Optional<JobSource> create(CompanyConfig company, WebClient.Builder builder, AlertMetrics metrics) {
        if (company.getName() == null || company.getUrl() == null || company.getUrl().isBlank()) {
            log.warn("Skipping source with missing name or url: {}", company);
            return Optional.empty();
        }

        Optional<SourceType> type = SourceType.fromConfig(company.getType());
        if (type.isEmpty()) {
            log.warn("Unknown source type '{}' for {}", company.getType(), company.getName());
            return Optional.empty();
        }

        JobSource source = switch (type.get()) {
            case GREENHOUSE -> new GreenhouseSource(builder, metrics, company);
            case WORKDAY -> new WorkdaySource(builder, metrics, company);
            case GENERIC -> new GenericSource(builder, metrics, company);
        };
        return Optional.of(source);
    }
}
