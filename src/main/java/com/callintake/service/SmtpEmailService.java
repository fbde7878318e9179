package com.callintake.service;

import com.callintake.config.AppointmentProperties;
import com.callintake.config.EmailProperties;
import com.callintake.domain.model.AppointmentIntent;
import com.callintake.domain.model.Channel;
import com.callintake.exception.ChannelDeliveryException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

@Slf4j
@Service
@RequiredArgsConstructor
public class SmtpEmailService implements EmailChannel {

    private final JavaMailSender mailSender;
    private final EmailProperties properties;
    private final AppointmentProperties appointmentProperties;

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    public void sendConfirmation(AppointmentIntent intent, String calendarLink) {
        if (!intent.hasEmail()) {
            throw new IllegalArgumentException("Intent has no customer email");
        }
        AppointmentEmailContent content = AppointmentEmailContent.of(
                intent,
                calendarLink,
                appointmentProperties.safeDisplayTimezone(),
                appointmentProperties.safeBusinessName());

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.from());
            helper.setTo(intent.customerEmail());
            helper.setSubject(content.subject());
            helper.setText(content.plainText(), content.html());
            mailSender.send(message);
        } catch (MessagingException e) {
            throw new ChannelDeliveryException(Channel.EMAIL, "Failed to build email: " + e.getMessage(), e);
        } catch (MailException e) {
            throw new ChannelDeliveryException(Channel.EMAIL, "SMTP delivery failed: " + e.getMessage(), e);
        }
        log.info("Email sent. to={}", intent.customerEmail());
    }
}
