package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.config.PriceWatchMailProperties;
import jakarta.mail.BodyPart;
import jakarta.mail.Multipart;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OperatorMailServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T08:30:00Z"), ZoneOffset.UTC);

    @Test
    void apiErrorMailCarriesFailureDetails() throws Exception {
        JavaMailSender mailSender = mock(JavaMailSender.class);
        MimeMessage mimeMessage = new MimeMessage(Session.getInstance(new Properties()));
        when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
        OperatorMailService service = new OperatorMailService(mailSender, mailProperties(), CLOCK);

        service.notifyApiError(new PricingApiErrorMessage(
                Instant.parse("2026-03-02T08:30:00Z"),
                "https://prices.example/api",
                "TRANSIENT: http 503",
                Duration.ofMinutes(12)
        ));

        verify(mailSender).send(mimeMessage);
        assertThat(mimeMessage.getSubject()).isEqualTo("Price Watch API ERROR");
        String content = readContent(mimeMessage.getContent());
        assertThat(content).contains("time=2026-03-02 08:30:00");
        assertThat(content).contains("api=https://prices.example/api");
        assertThat(content).contains("error=TRANSIENT: http 503");
        assertThat(content).contains("failing for: PT12M");
    }

    @Test
    void apiResumeMailCarriesDowntime() throws Exception {
        JavaMailSender mailSender = mock(JavaMailSender.class);
        MimeMessage mimeMessage = new MimeMessage(Session.getInstance(new Properties()));
        when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
        OperatorMailService service = new OperatorMailService(mailSender, mailProperties(), CLOCK);

        service.notifyApiResume(new PricingApiResumeMessage(
                Instant.parse("2026-03-02T08:30:00Z"),
                Instant.parse("2026-03-02T08:00:00Z"),
                Duration.ofMinutes(30),
                "https://prices.example/api"
        ));

        assertThat(mimeMessage.getSubject()).isEqualTo("Price Watch API RESUME");
        String content = readContent(mimeMessage.getContent());
        assertThat(content).contains("resumeTime=2026-03-02 08:30:00");
        assertThat(content).contains("firstFailureTime=2026-03-02 08:00:00");
        assertThat(content).contains("downtime=PT30M");
    }

    @Test
    void nothingIsSentWithoutRecipients() {
        JavaMailSender mailSender = mock(JavaMailSender.class);
        PriceWatchMailProperties properties = mailProperties();
        properties.setRecipients(List.of(" "));
        OperatorMailService service = new OperatorMailService(mailSender, properties, CLOCK);

        service.notifyApiError(new PricingApiErrorMessage(CLOCK.instant(), null, "boom", Duration.ZERO));

        verify(mailSender, never()).send(any(MimeMessage.class));
    }

    private static PriceWatchMailProperties mailProperties() {
        PriceWatchMailProperties properties = new PriceWatchMailProperties();
        properties.setSender("watch@example.com");
        properties.setRecipients(List.of("ops@example.com"));
        return properties;
    }

    private String readContent(Object content) throws Exception {
        if (content == null) {
            return "";
        }
        if (content instanceof String text) {
            return text;
        }
        if (content instanceof Multipart multipart) {
            StringBuilder builder = new StringBuilder();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart part = multipart.getBodyPart(i);
                builder.append(readContent(part.getContent()));
            }
            return builder.toString();
        }
        return content.toString();
    }
}
