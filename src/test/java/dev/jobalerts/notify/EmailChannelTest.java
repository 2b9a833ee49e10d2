package dev.jobalerts.notify;

import dev.jobalerts.config.NotificationsConfig;
import dev.jobalerts.model.Posting;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.IContext;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailChannelTest {

        @Mock
        private JavaMailSender mailSender;

        @Mock
        private TemplateEngine templateEngine;

        @Mock
        private MimeMessage mimeMessage;

        private NotificationsConfig config;
        private EmailChannel emailChannel;

        @BeforeEach
        void setUp() {
                config = new NotificationsConfig();
                config.getEmail().setEnabled(true);
                config.getEmail().setTo("recipient@example.com");
                emailChannel = new EmailChannel(mailSender, templateEngine, config, "alerts@example.com");
        }

        private Posting createPosting(String id, String title) {
                return Posting.builder()
                                .title(title)
                                .url("https://example.com/jobs/" + id)
                                .company("Acme")
                                .location("Remote")
                                .jobType("Full-time")
                                .source("Acme")
                                .firstSeen(Instant.now())
                                .build();
        }

        @Nested
        @DisplayName("Send digest")
        class SendBatchTests {

                @Test
                @DisplayName("Should report the whole batch as delivered")
                void shouldSendDigest() {
                        List<Posting> postings = List.of(
                                        createPosting("1", "Software Engineer"),
                                        createPosting("2", "Backend Engineer"));
                        when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
                        when(templateEngine.process(eq(EmailChannel.DIGEST_TEMPLATE), any(IContext.class)))
                                        .thenReturn("<html>Digest</html>");

                        StepVerifier.create(emailChannel.sendBatch(postings))
                                        .expectNext(2)
                                        .verifyComplete();

                        verify(mailSender).send(mimeMessage);
                }

                @Test
                @DisplayName("Should report zero delivered on SMTP failure")
                void shouldReturnZeroOnFailure() {
                        when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
                        when(templateEngine.process(eq(EmailChannel.DIGEST_TEMPLATE), any(IContext.class)))
                                        .thenReturn("<html>Digest</html>");
                        doThrow(new MailSendException("SMTP error")).when(mailSender).send(any(MimeMessage.class));

                        StepVerifier.create(emailChannel.sendBatch(List.of(createPosting("1", "Engineer"))))
                                        .expectNext(0)
                                        .verifyComplete();
                }

                @Test
                @DisplayName("Should not send an empty digest")
                void shouldIgnoreEmptyBatch() {
                        StepVerifier.create(emailChannel.sendBatch(List.of()))
                                        .expectNext(0)
                                        .verifyComplete();

                        verifyNoInteractions(mailSender);
                }
        }

        @Nested
        @DisplayName("Send single alert")
        class SendTests {

                @Test
                @DisplayName("Should render the alert template")
                void shouldSendAlert() {
                        when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
                        when(templateEngine.process(eq(EmailChannel.ALERT_TEMPLATE), any(IContext.class)))
                                        .thenReturn("<html>Alert</html>");

                        StepVerifier.create(emailChannel.send(createPosting("1", "Software Engineer")))
                                        .expectNext(true)
                                        .verifyComplete();

                        verify(templateEngine).process(eq(EmailChannel.ALERT_TEMPLATE), any(IContext.class));
                }

                @Test
                @DisplayName("Should return false on SMTP failure")
                void shouldReturnFalseOnFailure() {
                        when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
                        when(templateEngine.process(eq(EmailChannel.ALERT_TEMPLATE), any(IContext.class)))
                                        .thenReturn("<html>Alert</html>");
                        doThrow(new MailSendException("SMTP error")).when(mailSender).send(any(MimeMessage.class));

                        StepVerifier.create(emailChannel.send(createPosting("1", "Software Engineer")))
                                        .expectNext(false)
                                        .verifyComplete();
                }
        }

        @Test
        @DisplayName("Should disable itself without recipient or sender")
        void shouldBeDisabledWithoutCredentials() {
                assertThat(emailChannel.isEnabled()).isTrue();

                config.getEmail().setTo("");
                assertThat(new EmailChannel(mailSender, templateEngine, config, "alerts@example.com").isEnabled())
                                .isFalse();

                config.getEmail().setTo("recipient@example.com");
                assertThat(new EmailChannel(mailSender, templateEngine, config, "").isEnabled()).isFalse();

                config.getEmail().setEnabled(false);
                assertThat(new EmailChannel(mailSender, templateEngine, config, "alerts@example.com").isEnabled())
                                .isFalse();
        }

        @Test
        @DisplayName("Should build a plain-text alternative")
        void shouldBuildPlainText() {
                String text = EmailChannel.plainText(List.of(createPosting("1", "Software Engineer")));

                assertThat(text)
                                .contains("Software Engineer")
                                .contains("Company: Acme")
                                .contains("Location: Remote")
                                .contains("Type: Full-time")
                                .contains("Apply: https://example.com/jobs/1");
        }
}
