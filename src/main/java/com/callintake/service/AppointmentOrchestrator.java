package com.callintake.service;

import com.callintake.config.AppointmentProperties;
import com.callintake.domain.model.AppointmentIntent;
import com.callintake.domain.model.AppointmentResult;
import com.callintake.domain.model.CalendarBooking;
import com.callintake.domain.model.Channel;
import com.callintake.domain.model.ChannelOutcome;
import com.callintake.exception.ChannelDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Fans one appointment intent out to the calendar, SMS and email channels.
 *
 * <p>Calendar and SMS start together; email starts once the calendar attempt has
 * finished so that the event link can be embedded. Every channel gets one attempt
 * bounded by the configured channel timeout, and every failure ends up as a
 * {@link ChannelOutcome} rather than an exception.
 */
@Slf4j
@Service
public class AppointmentOrchestrator {

    private final CalendarChannel calendarChannel;
    private final SmsChannel smsChannel;
    private final EmailChannel emailChannel;
    private final Executor channelExecutor;
    private final AppointmentProperties properties;

    public AppointmentOrchestrator(
            CalendarChannel calendarChannel,
            SmsChannel smsChannel,
            EmailChannel emailChannel,
            @Qualifier("channelExecutor") Executor channelExecutor,
            AppointmentProperties properties) {
        this.calendarChannel = calendarChannel;
        this.smsChannel = smsChannel;
        this.emailChannel = emailChannel;
        this.channelExecutor = channelExecutor;
        this.properties = properties;
    }

    public AppointmentResult process(AppointmentIntent intent) {
        log.info("Process appointment. phone={}, scheduledAt={}, hasEmail={}",
                intent.callerPhone(), intent.scheduledAt(), intent.hasEmail());

        CompletableFuture<CalendarAttempt> calendarFuture = attemptCalendar(intent);
        CompletableFuture<ChannelOutcome> smsFuture = attemptSms(intent);
        CompletableFuture<ChannelOutcome> emailFuture = calendarFuture.thenCompose(calendar ->
                attemptEmail(intent, calendar.booking() == null ? null : calendar.booking().eventLink()));

        CompletableFuture.allOf(calendarFuture, smsFuture, emailFuture).join();

        CalendarAttempt calendar = calendarFuture.join();
        AppointmentResult result = new AppointmentResult(
                intent,
                calendar.outcome(),
                smsFuture.join(),
                emailFuture.join(),
                calendar.booking());
        log.info("Appointment processed. calendar={}, sms={}, email={}",
                result.calendar().status(), result.sms().status(), result.email().status());
        return result;
    }

    private CompletableFuture<CalendarAttempt> attemptCalendar(AppointmentIntent intent) {
        if (!calendarChannel.isConfigured()) {
            log.debug("Calendar channel not configured, skipping");
            return CompletableFuture.completedFuture(
                    new CalendarAttempt(ChannelOutcome.skipped("Calendar not configured"), null));
        }
        return submit(Channel.CALENDAR, () -> {
            CalendarBooking booking = calendarChannel.createEvent(intent);
            return new CalendarAttempt(ChannelOutcome.succeeded(booking.eventId()), booking);
        }, error -> new CalendarAttempt(ChannelOutcome.failed(error), null));
    }

    private CompletableFuture<ChannelOutcome> attemptSms(AppointmentIntent intent) {
        if (!smsChannel.isConfigured()) {
            log.debug("SMS channel not configured, skipping");
            return CompletableFuture.completedFuture(ChannelOutcome.skipped("SMS not configured"));
        }
        return submit(Channel.SMS,
                () -> ChannelOutcome.succeeded(smsChannel.sendConfirmation(intent)),
                ChannelOutcome::failed);
    }

    private CompletableFuture<ChannelOutcome> attemptEmail(AppointmentIntent intent, String calendarLink) {
        if (!intent.hasEmail()) {
            return CompletableFuture.completedFuture(ChannelOutcome.skipped("No customer email provided"));
        }
        if (!emailChannel.isConfigured()) {
            log.debug("Email channel not configured, skipping");
            return CompletableFuture.completedFuture(ChannelOutcome.skipped("Email not configured"));
        }
        return submit(Channel.EMAIL, () -> {
            emailChannel.sendConfirmation(intent, calendarLink);
            return ChannelOutcome.succeeded(intent.customerEmail());
        }, ChannelOutcome::failed);
    }

    private <T> CompletableFuture<T> submit(Channel channel, Supplier<T> call, Function<String, T> onFailure) {
        Duration timeout = properties.channelTimeout();
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, channelExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Channel call rejected by executor. channel={}", channel.key());
            return CompletableFuture.completedFuture(onFailure.apply("Channel executor is saturated"));
        }
        return future
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(error -> onFailure.apply(describeFailure(channel, error, timeout)));
    }

    private String describeFailure(Channel channel, Throwable error, Duration timeout) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            log.error("Channel call timed out. channel={}, timeoutMs={}", channel.key(), timeout.toMillis());
            return "Timed out after " + timeout.toMillis() + " ms";
        }
        if (cause instanceof ChannelDeliveryException delivery) {
            log.error("Channel call failed. channel={}, error={}", delivery.getChannel().key(), delivery.getMessage());
            return delivery.getMessage();
        }
        log.error("Channel call failed unexpectedly. channel={}, error={}", channel.key(), cause.getMessage(), cause);
        return "Unexpected error: " + cause.getMessage();
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private record CalendarAttempt(ChannelOutcome outcome, CalendarBooking booking) {
    }
}
