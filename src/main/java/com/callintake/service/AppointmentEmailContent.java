package com.callintake.service;

import com.callintake.domain.model.AppointmentIntent;
import org.springframework.web.util.HtmlUtils;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Field set of the confirmation email. Both the plain-text and the HTML body are
 * rendered from these fields only.
 */
public record AppointmentEmailContent(
        String customerName,
        String date,
        String time,
        String phone,
        String location,
        String summary,
        String calendarLink,
        String businessName
) {
    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ofPattern("EEEE, MMMM dd, yyyy", Locale.US);
    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("hh:mm a z", Locale.US);
    private static final String RULE = "--------------------------------";

    public static AppointmentEmailContent of(AppointmentIntent intent, String calendarLink, ZoneId zoneId, String businessName) {
        ZonedDateTime local = intent.scheduledAt().atZoneSameInstant(zoneId);
        return new AppointmentEmailContent(
                intent.customerName(),
                local.format(DATE_FMT),
                local.format(TIME_FMT),
                intent.callerPhone(),
                intent.hasLocation() ? intent.location() : null,
                intent.summary(),
                calendarLink == null || calendarLink.isBlank() ? null : calendarLink,
                businessName
        );
    }

    public String subject() {
        return "Appointment Confirmation - " + customerName;
    }

    public String plainText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Hello ").append(customerName).append(",\n\n");
        sb.append("This email confirms your appointment with ").append(businessName).append(".\n\n");
        sb.append("Appointment Details:\n").append(RULE).append("\n");
        sb.append("Date: ").append(date).append("\n");
        sb.append("Time: ").append(time).append("\n");
        sb.append("Phone: ").append(phone).append("\n");
        if (location != null) {
            sb.append("Location: ").append(location).append("\n");
        }
        sb.append("\nSummary:\n").append(summary).append("\n\n");
        sb.append(RULE).append("\n\n");
        if (calendarLink != null) {
            sb.append("View in Google Calendar: ").append(calendarLink).append("\n\n");
        }
        sb.append("If you need to reschedule or cancel, please contact us as soon as possible.\n\n");
        sb.append("We look forward to speaking with you!\n\n");
        sb.append("Best regards,\nThe ").append(businessName).append(" Team\n\n");
        sb.append("---\nThis is an automated confirmation. Please do not reply to this email.\n");
        return sb.toString();
    }

    public String html() {
        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n")
                .append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
                .append("<style>\n")
                .append("body { font-family: 'Segoe UI', Tahoma, Geneva, Verdana, sans-serif; line-height: 1.6; color: #333; max-width: 600px; margin: 0 auto; padding: 20px; }\n")
                .append(".header { background: #667eea; color: white; padding: 30px; text-align: center; border-radius: 10px 10px 0 0; }\n")
                .append(".content { background: #ffffff; padding: 30px; border: 1px solid #e0e0e0; border-top: none; }\n")
                .append(".details { background: #f8f9fa; border-left: 4px solid #667eea; padding: 20px; margin: 20px 0; }\n")
                .append(".label { font-weight: bold; color: #667eea; display: inline-block; width: 80px; }\n")
                .append(".summary { background: #fff9e6; border: 1px solid #ffd966; padding: 15px; margin: 20px 0; }\n")
                .append(".button { display: inline-block; background: #667eea; color: white; padding: 12px 30px; text-decoration: none; border-radius: 5px; }\n")
                .append(".footer { background: #f8f9fa; padding: 20px; text-align: center; color: #666; font-size: 12px; }\n")
                .append("</style>\n</head>\n<body>\n");
        sb.append("<div class=\"header\"><h1>Appointment Confirmed</h1></div>\n");
        sb.append("<div class=\"content\">\n");
        sb.append("<p>Hello <strong>").append(escape(customerName)).append("</strong>,</p>\n");
        sb.append("<p>This email confirms your appointment with ").append(escape(businessName)).append(".</p>\n");
        sb.append("<div class=\"details\">\n<h3>Appointment Details</h3>\n");
        appendRow(sb, "Date", date);
        appendRow(sb, "Time", time);
        appendRow(sb, "Phone", phone);
        if (location != null) {
            appendRow(sb, "Location", location);
        }
        sb.append("</div>\n");
        sb.append("<div class=\"summary\">\n<h4>Summary</h4>\n<p>").append(escape(summary)).append("</p>\n</div>\n");
        if (calendarLink != null) {
            sb.append("<div style=\"text-align: center;\"><a href=\"").append(escape(calendarLink))
                    .append("\" class=\"button\">View in Google Calendar</a></div>\n");
        }
        sb.append("<p>If you need to reschedule or cancel, please contact us as soon as possible.</p>\n");
        sb.append("<p>We look forward to speaking with you!</p>\n");
        sb.append("<p><strong>Best regards,</strong><br>The ").append(escape(businessName)).append(" Team</p>\n");
        sb.append("</div>\n");
        sb.append("<div class=\"footer\">This is an automated confirmation. Please do not reply to this email.</div>\n");
        sb.append("</body>\n</html>\n");
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, String label, String value) {
        sb.append("<div><span class=\"label\">").append(label).append(":</span> ")
                .append(escape(value)).append("</div>\n");
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
