package com.travelbooking.backend.modules.notification.infrastructure;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.travelbooking.backend.modules.notification.application.NotificationGateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Sends notifications as plain-text mail on the notification executor.
 */
@Component
public class MailNotificationGateway implements NotificationGateway {

    private static final Logger log = LoggerFactory.getLogger(MailNotificationGateway.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_]+)}");

    private final JavaMailSender mailSender;
    private final String fromAddress;

    public MailNotificationGateway(
            JavaMailSender mailSender,
            @Value("${app.mail.from:noreply@travel-booking.app}") String fromAddress
    ) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
    }

    @Override
    @Async("notificationExecutor")
    public void send(String recipientEmail, String subjectTemplate, String bodyTemplate, Map<String, String> templateParams) {
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(fromAddress);
            message.setTo(recipientEmail);
            message.setSubject(render(subjectTemplate, templateParams));
            message.setText(render(bodyTemplate, templateParams));
            mailSender.send(message);
            log.info("Notification mail sent subject='{}'", message.getSubject());
        } catch (RuntimeException ex) {
            log.error("Failed to send notification mail subject='{}': {}", subjectTemplate, ex.getMessage());
        }
    }

    /**
     * Fills {@code ${name}} placeholders in one pass. Inserted values are copied verbatim and never
     * scanned for further placeholders; unknown names stay as they are.
     */
    static String render(String template, Map<String, String> params) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder(template.length());
        while (matcher.find()) {
            String value = params.get(matcher.group(1));
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }
}
