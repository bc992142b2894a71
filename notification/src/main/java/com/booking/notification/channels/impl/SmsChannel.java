package com.booking.notification.channels.impl;

import com.booking.notification.channels.NotificationChannel;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SmsChannel implements NotificationChannel {

    static final int MAX_LENGTH = 160;

    @Override public String channel() { return "sms"; }
    @Override public void send(String to, String subject, String body) {
        log.info("[SMS] To: {}, Body: {}", to, body.substring(0, Math.min(MAX_LENGTH, body.length())));
    }
}
