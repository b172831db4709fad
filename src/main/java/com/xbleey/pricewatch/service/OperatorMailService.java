package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.config.PriceWatchMailProperties;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Operator e-mails about the pricing service. Owners are never mailed.
 */
@Service
public class OperatorMailService {

    private static final Logger log = LoggerFactory.getLogger(OperatorMailService.class);
    private static final DateTimeFormatter REPORT_TIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final JavaMailSender mailSender;
    private final PriceWatchMailProperties properties;
    private final Clock clock;

    public OperatorMailService(JavaMailSender mailSender, PriceWatchMailProperties properties, Clock clock) {
        this.mailSender = mailSender;
        this.properties = properties;
        this.clock = clock;
    }

    public void notifyApiError(PricingApiErrorMessage message) {
        if (message == null) {
            return;
        }
        EmailTargets targets = resolveEmailTargets();
        if (targets == null) {
            return;
        }
        ZoneId zone = clock.getZone();
        String plain = "Pricing API ERROR" + '\n'
                + "time=" + formatInstant(message.failureTime(), zone) + '\n'
                + "api=" + safeValue(message.apiUrl()) + '\n'
                + "error=" + safeValue(message.errorDetail()) + '\n'
                + "downtime=" + formatDuration(message.downtime()) + '\n';
        String html = "<html><body>"
                + "<h2>Pricing API ERROR</h2>"
                + "<p>time=" + escapeHtml(formatInstant(message.failureTime(), zone)) + "</p>"
                + "<p>api=" + escapeHtml(safeValue(message.apiUrl())) + "</p>"
                + "<p>error=" + escapeHtml(safeValue(message.errorDetail())) + "</p>"
                + "<p><span style=\"color:#d32f2f;font-weight:bold;\">failing for: "
                + escapeHtml(formatDuration(message.downtime())) + "</span></p>"
                + "</body></html>";
        sendEmail(targets, "Price Watch API ERROR", plain, html);
    }

    public void notifyApiResume(PricingApiResumeMessage message) {
        if (message == null) {
            return;
        }
        EmailTargets targets = resolveEmailTargets();
        if (targets == null) {
            return;
        }
        ZoneId zone = clock.getZone();
        String plain = "Pricing API RESUME" + '\n'
                + "resumeTime=" + formatInstant(message.resumeTime(), zone) + '\n'
                + "firstFailureTime=" + formatInstant(message.firstFailureTime(), zone) + '\n'
                + "downtime=" + formatDuration(message.downtime()) + '\n'
                + "api=" + safeValue(message.apiUrl()) + '\n';
        String html = "<html><body>"
                + "<h2>Pricing API RESUME</h2>"
                + "<p>resumeTime=" + escapeHtml(formatInstant(message.resumeTime(), zone)) + "</p>"
                + "<p>firstFailureTime=" + escapeHtml(formatInstant(message.firstFailureTime(), zone)) + "</p>"
                + "<p>downtime=" + escapeHtml(formatDuration(message.downtime())) + "</p>"
                + "<p>api=" + escapeHtml(safeValue(message.apiUrl())) + "</p>"
                + "</body></html>";
        sendEmail(targets, "Price Watch API RESUME", plain, html);
    }

    private EmailTargets resolveEmailTargets() {
        String sender = normalize(properties.getSender());
        List<String> recipients = normalizeRecipients(properties.getRecipients());
        if (sender == null) {
            log.warn("Skip operator email: sender not configured");
            return null;
        }
        if (recipients.isEmpty()) {
            log.debug("Skip operator email: recipients not configured");
            return null;
        }
        return new EmailTargets(sender, recipients);
    }

    private void sendEmail(EmailTargets targets, String subject, String plainText, String html) {
        try {
            MimeMessage mimeMessage = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, StandardCharsets.UTF_8.name());
            helper.setFrom(targets.sender());
            helper.setTo(targets.recipients().toArray(new String[0]));
            helper.setSubject(subject);
            helper.setText(plainText, html);
            mailSender.send(mimeMessage);
        } catch (Exception ex) {
            log.warn("Failed to send operator email", ex);
        }
    }

    private String formatInstant(Instant instant, ZoneId zone) {
        if (instant == null) {
            return "-";
        }
        return REPORT_TIME_FORMATTER.withZone(zone).format(instant);
    }

    private String formatDuration(Duration duration) {
        return duration == null ? "-" : duration.toString();
    }

    private String safeValue(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }

    private String escapeHtml(String value) {
        if (value == null) {
            return "-";
        }
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    private String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private List<String> normalizeRecipients(List<String> recipients) {
        if (recipients == null) {
            return List.of();
        }
        return recipients.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
    }

    private record EmailTargets(String sender, List<String> recipients) {
    }
}
