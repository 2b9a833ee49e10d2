package dev.jobalerts.source.impl;

import dev.jobalerts.config.SourcesConfig;
import dev.jobalerts.config.SourcesConfig.CompanyConfig;
import dev.jobalerts.metrics.AlertMetrics;
import dev.jobalerts.model.Posting;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scrapes a static careers page for job links.
 * <p>
 * Links are picked with the company's {@code job-selector}. The title comes from
 * {@code title-selector} inside the link when configured, otherwise from the link
 * text. Pages rendered by JavaScript are not supported.
 */
@Slf4j
public class GenericSource extends AbstractJobSource {

    static final int MAX_TITLE_LENGTH = 200;

    public GenericSource(WebClient.Builder webClientBuilder, AlertMetrics metrics, CompanyConfig company) {
        super(webClientBuilder, metrics, company);
    }

    @Override
    protected Mono<List<Posting>> fetchCompanyPostings() {
        String pageUrl = company.getUrl();
        return timedGet(pageUrl, String.class)
                .map(html -> parse(Jsoup.parse(html, pageUrl)));
    }

    List<Posting> parse(Document document) {
        String jobSelector = company.getJobSelector() != null && !company.getJobSelector().isBlank()
                ? company.getJobSelector()
                : SourcesConfig.DEFAULT_JOB_SELECTOR;

        Set<String> seen = new HashSet<>();
        List<Posting> postings = new ArrayList<>();

        for (Element link : document.select(jobSelector)) {
            String url = link.attr("abs:href");
            if (!url.startsWith("http") || !seen.add(url)) {
                continue;
            }

            String title = extractText(link, company.getTitleSelector());
            if (title.isBlank() || title.length() > MAX_TITLE_LENGTH) {
                log.debug("{} - skipping link with unusable title: {}", getName(), url);
                continue;
            }

            String location = "";
            if (company.getLocationSelector() != null && !company.getLocationSelector().isBlank()) {
                Element locationElement = link.selectFirst(company.getLocationSelector());
                if (locationElement == null && link.parent() != null) {
                    locationElement = link.parent().selectFirst(company.getLocationSelector());
                }
                if (locationElement != null) {
                    location = locationElement.text().strip();
                }
            }

            postings.add(basePosting()
                    .title(title)
                    .url(url)
                    .location(location)
                    .build());
        }
        return postings;
    }

    private static String extractText(Element link, String selector) {
        if (selector != null && !selector.isBlank()) {
            Element element = link.selectFirst(selector);
            if (element != null) {
                return element.text().strip();
            }
        }
        return link.text().strip();
    }
}
