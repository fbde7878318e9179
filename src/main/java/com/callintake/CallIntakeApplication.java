package com.callintake;

import com.callintake.config.AppointmentProperties;
import com.callintake.config.EmailProperties;
import com.callintake.config.GoogleCalendarProperties;
import com.callintake.config.TwilioProperties;
import com.callintake.config.WebhookProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        WebhookProperties.class,
        AppointmentProperties.class,
        GoogleCalendarProperties.class,
        TwilioProperties.class,
        EmailProperties.class
})
public class CallIntakeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallIntakeApplication.class, args);
    }
}
