package dev.jobalerts.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Delivery channel settings.
 * Loaded from application.yml under 'notifications' prefix. SMTP itself is
 * configured through spring.mail.*.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "notifications")
public class NotificationsConfig {

    private Email email = new Email();
    private Telegram telegram = new Telegram();

    @Data
    public static class Email {
        private boolean enabled = false;
        private String to = "";
        private String subjectPrefix = "Job Alerts";
    }

    @Data
    public static class Telegram {
        private boolean enabled = false;
        private String botToken = "";
        private String chatId = "";
        private String apiUrl = "https://api.telegram.org";
    }
}
