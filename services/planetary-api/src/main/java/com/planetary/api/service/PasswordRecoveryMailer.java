package com.planetary.api.service;

import com.planetary.api.exception.MailDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

/**
 * PasswordRecoveryMailer - mails a user their stored password.
 *
 * The transport is whatever {@link JavaMailSender} Spring Boot builds from the
 * spring.mail.* properties (SMTP with STARTTLS in application.yml). A send that
 * the transport rejects surfaces as {@link MailDeliveryException}; nothing is
 * retried.
 */
@Slf4j
@Service
public class PasswordRecoveryMailer {

    static final String SUBJECT = "your planetary API password";

    private final JavaMailSender mailSender;
    private final String sender;

    public PasswordRecoveryMailer(JavaMailSender mailSender,
                                  @Value("${planetary.mail.sender}") String sender) {
        this.mailSender = mailSender;
        this.sender = sender;
    }

    public void sendPasswordRecovery(String email, String password) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(sender);
        message.setTo(email);
        message.setSubject(SUBJECT);
        message.setText("Your planetary API password is " + password);

        try {
            mailSender.send(message);
        } catch (MailException e) {
            throw new MailDeliveryException("Could not send password to " + email, e);
        }
        log.info("Password recovery mail sent to {}", email);
    }
}
