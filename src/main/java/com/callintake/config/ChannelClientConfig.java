package com.callintake.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Provider clients, built once at startup. Each carries the channel timeout so no
 * single call can block past it.
 */
@Configuration
public class ChannelClientConfig {

    @Bean
    RestClient googleRestClient(AppointmentProperties properties) {
        return RestClient.builder()
                .requestFactory(requestFactory(properties))
                .build();
    }

    @Bean
    RestClient twilioRestClient(AppointmentProperties properties) {
        return RestClient.builder()
                .requestFactory(requestFactory(properties))
                .build();
    }

    @Bean
    JavaMailSender mailSender(EmailProperties emailProperties, AppointmentProperties properties) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(emailProperties.safeHost());
        sender.setPort(emailProperties.safePort());
        sender.setUsername(emailProperties.safeUsername());
        sender.setPassword(emailProperties.password());
        sender.setDefaultEncoding(StandardCharsets.UTF_8.name());

        String timeoutMs = String.valueOf(properties.channelTimeout().toMillis());
        Properties mail = sender.getJavaMailProperties();
        mail.put("mail.transport.protocol", "smtp");
        mail.put("mail.smtp.auth", "true");
        mail.put("mail.smtp.starttls.enable", String.valueOf(emailProperties.safeStarttls()));
        mail.put("mail.smtp.connectiontimeout", timeoutMs);
        mail.put("mail.smtp.timeout", timeoutMs);
        mail.put("mail.smtp.writetimeout", timeoutMs);
        return sender;
    }

    private SimpleClientHttpRequestFactory requestFactory(AppointmentProperties properties) {
        int timeoutMs = (int) properties.channelTimeout().toMillis();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return factory;
    }
}
