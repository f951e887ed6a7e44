package com.launchpad.notification;

import com.launchpad.bootstrap.WorkerProcess;
import com.launchpad.exception.NotificationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Sends verification codes by email. Runs in the worker only.
 *
 * Configuration required in application.yml:
 * spring.mail.host / port / username / password
 * app.mail.from: sender address
 */
@Component
@WorkerProcess
@Slf4j
@RequiredArgsConstructor
public class MailVerificationNotifier implements VerificationNotifier {

    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final JavaMailSender mailSender;

    @Value("${app.mail.from:no-reply@launchpad.local}")
    private String fromAddress;

    @Value("${app.name:Launchpad}")
    private String appName;

    @Override
    public void deliver(String identifier, String value, LocalDateTime expiresAt) {
        if (!identifier.contains("@")) {
            throw NotificationException.unsupportedIdentifier(identifier);
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(identifier);
        message.setSubject(String.format("Your %s verification code", appName));
        message.setText(String.format(
                "Your verification code is %s.%n%nIt expires at %s. If you did not request it, you can ignore this email.",
                value,
                expiresAt.format(EXPIRY_FORMAT)));

        try {
            mailSender.send(message);
            log.info("Verification code mailed to {}", identifier);
        } catch (MailException e) {
            log.error("Mail delivery failed for {}: {}", identifier, e.getMessage());
            throw NotificationException.deliveryFailed("mail", identifier, e);
        }
    }
}
