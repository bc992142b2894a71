package com.booking.notification.template;

/** A rendered template: email subject and body plus a short SMS text. */
public record NotificationContent(String subject, String body, String sms) {}
