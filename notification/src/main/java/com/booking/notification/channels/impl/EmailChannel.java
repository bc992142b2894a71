package com.booking.notification.channels.impl;

import com.booking.notification.channels.NotificationChannel;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class EmailChannel implements NotificationChannel {
    @Override public String channel() { return "email"; }
    @Override public void send(String to, String subject, String body) {
        // TODO: hand over to an SMTP relay once the mail provider is chosen
        log.info("[EMAIL] To: {}, Subject: {}", to, subject);
    }
}
