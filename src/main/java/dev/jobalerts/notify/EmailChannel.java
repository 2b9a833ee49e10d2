package dev.jobalerts.notify;

import dev.jobalerts.config.NotificationsConfig;
import dev.jobalerts.model.Posting;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Sends posting alerts by email, rendered with Thymeleaf.
 * A batch goes out as one digest email, so it is delivered entirely or not at all.
 */
@Slf4j
@Component
public class EmailChannel implements NotificationChannel {

    static final String ALERT_TEMPLATE = "email/posting-alert";
    static final String DIGEST_TEMPLATE = "email/posting-digest";

    private final JavaMailSender mailSender;
    private final TemplateEngine templateEngine;
    private final NotificationsConfig.Email config;
    private final String fromEmail;
    private final boolean enabled;

    public EmailChannel(JavaMailSender mailSender,
                        TemplateEngine templateEngine,
                        NotificationsConfig notificationsConfig,
                        @Value("${spring.mail.username:}") String fromEmail) {
        this.mailSender = mailSender;
        this.templateEngine = templateEngine;
        this.config = notificationsConfig.getEmail();
        this.fromEmail = fromEmail;
        this.enabled = config.isEnabled() && hasCredentials();
    }

    private boolean hasCredentials() {
        if (isBlank(config.getTo()) || isBlank(fromEmail)) {
            log.warn("Email channel enabled but recipient or sender is missing; channel disabled");
            return false;
        }
        return true;
    }

    @Override
    public String getName() {
        return "Email";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Mono<Boolean> send(Posting posting) {
        return Mono.fromCallable(() -> {
            String subject = String.format("%s: %s at %s",
                    config.getSubjectPrefix(), posting.getTitle(), posting.getCompany());

            Context context = new Context(Locale.getDefault());
            context.setVariable("posting", posting);
            String html = templateEngine.process(ALERT_TEMPLATE, context);

            return sendEmail(subject, html, plainText(List.of(posting)));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Integer> sendBatch(List<Posting> postings) {
        if (postings.isEmpty()) {
            return Mono.just(0);
        }
        return Mono.fromCallable(() -> {
            String today = LocalDate.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd"));
            String subject = String.format("%s: %d new postings - %s",
                    config.getSubjectPrefix(), postings.size(), today);

            Context context = new Context(Locale.getDefault());
            context.setVariable("postings", postings);
            context.setVariable("postingCount", postings.size());
            context.setVariable("date", LocalDate.now().format(DateTimeFormatter.ofPattern("MMMM d, yyyy")));
            String html = templateEngine.process(DIGEST_TEMPLATE, context);

            return sendEmail(subject, html, plainText(postings)) ? postings.size() : 0;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private boolean sendEmail(String subject, String html, String text) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

            helper.setFrom(fromEmail);
            helper.setTo(config.getTo());
            helper.setSubject(subject);
            helper.setText(text, html);

            mailSender.send(message);
            log.info("Email sent to {}: {}", config.getTo(), subject);
            return true;

        } catch (MessagingException | MailException e) {
            log.error("Failed to send email: {}", e.getMessage(), e);
            return false;
        }
    }

    static String plainText(List<Posting> postings) {
        StringBuilder text = new StringBuilder();
        for (Posting posting : postings) {
            text.append(posting.getTitle()).append('\n');
            text.append("Company: ").append(posting.getCompany()).append('\n');
            if (!isBlank(posting.getLocation())) {
                text.append("Location: ").append(posting.getLocation()).append('\n');
            }
            if (!isBlank(posting.getJobType())) {
                text.append("Type: ").append(posting.getJobType()).append('\n');
            }
            text.append("Apply: ").append(posting.getUrl()).append("\n\n");
        }
        return text.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
