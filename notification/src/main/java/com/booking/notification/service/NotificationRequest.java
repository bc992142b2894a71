package com.booking.notification.service;

import java.util.Map;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/** What to tell whom: recipient user, template and the values it is rendered with. */
@Getter
@Builder
@ToString
public class NotificationRequest {
    private final String recipientId;
    private final String templateId;
    /** Preferred channel; {@code null} uses the configured default. */
    private final String channel;
    @Singular private final Map<String, Object> variables;
}
