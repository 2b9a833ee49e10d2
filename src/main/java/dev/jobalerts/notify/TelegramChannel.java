package dev.jobalerts.notify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobalerts.config.NotificationsConfig;
import dev.jobalerts.model.Posting;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Sends one Telegram Bot API message per posting, formatted as MarkdownV2.
 */
@Slf4j
@Component
public class TelegramChannel implements NotificationChannel {

    private static final Pattern MARKDOWN_SPECIAL = Pattern.compile("([_*\\[\\]()~`>#+\\-=|{}.!\\\\])");

    private final WebClient webClient;
    private final NotificationsConfig.Telegram config;
    private final boolean enabled;

    public TelegramChannel(WebClient.Builder webClientBuilder, NotificationsConfig notificationsConfig) {
        this.config = notificationsConfig.getTelegram();
        this.webClient = webClientBuilder.clone()
                .baseUrl(config.getApiUrl())
                .build();
        this.enabled = config.isEnabled() && hasCredentials();
    }

    private boolean hasCredentials() {
        if (isBlank(config.getBotToken()) || isBlank(config.getChatId())) {
            log.warn("Telegram channel enabled but bot token or chat id is missing; channel disabled");
            return false;
        }
        return true;
    }

    @Override
    public String getName() {
        return "Telegram";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Mono<Boolean> send(Posting posting) {
        SendMessageRequest request = new SendMessageRequest(config.getChatId(), formatMessage(posting),
                "MarkdownV2", false);

        return webClient.post()
                .uri("/bot" + config.getBotToken() + "/sendMessage")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(TelegramResponse.class)
                .timeout(Duration.ofSeconds(30))
                .map(response -> {
                    if (!response.isOk()) {
                        log.error("Telegram rejected message for '{}': {}", posting.getTitle(), response.getDescription());
                    }
                    return response.isOk();
                })
                .doOnNext(ok -> {
                    if (Boolean.TRUE.equals(ok)) {
                        log.info("Telegram notification sent for: {}", posting.getTitle());
                    }
                })
                .onErrorResume(e -> {
                    log.error("Failed to send Telegram notification for '{}': {}", posting.getTitle(), e.getMessage());
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<Integer> sendBatch(List<Posting> postings) {
        return Flux.fromIterable(postings)
                .concatMap(this::send)
                .filter(Boolean::booleanValue)
                .count()
                .map(Long::intValue)
                .doOnNext(sent -> log.info("Telegram: sent {}/{} notifications", sent, postings.size()));
    }

    static String formatMessage(Posting posting) {
        StringBuilder message = new StringBuilder();
        message.append("*New Job Alert\\!*\n\n");
        message.append('*').append(escape(posting.getTitle())).append("*\n");
        message.append(escape(posting.getCompany())).append('\n');
        if (!isBlank(posting.getLocation())) {
            message.append("Location: ").append(escape(posting.getLocation())).append('\n');
        }
        if (!isBlank(posting.getJobType())) {
            message.append("Type: ").append(escape(posting.getJobType())).append('\n');
        }
        message.append("\n[Apply Here](").append(escapeUrl(posting.getUrl())).append(')');
        return message.toString();
    }

    /**
     * Escape every MarkdownV2 special character.
     */
    static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return MARKDOWN_SPECIAL.matcher(text).replaceAll("\\\\$1");
    }

    // Inside (...) of an inline link only ')' and '\' must be escaped
    static String escapeUrl(String url) {
        return url.replace("\\", "\\\\").replace(")", "\\)");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record SendMessageRequest(
            @JsonProperty("chat_id") String chatId,
            String text,
            @JsonProperty("parse_mode") String parseMode,
            @JsonProperty("disable_web_page_preview") boolean disableWebPagePreview) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TelegramResponse {
        private boolean ok;
        private String description;
    }
}
