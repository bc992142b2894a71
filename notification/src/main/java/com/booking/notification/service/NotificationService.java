package com.booking.notification.service;

import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.booking.notification.channels.NotificationChannel;
import com.booking.notification.template.NotificationContent;
import com.booking.notification.template.engine.TemplateEngine;

import lombok.extern.slf4j.Slf4j;

/**
 * Notification Service: renders a template and delivers it through the requested channel.
 * Strategy pattern for channel selection; unknown channels fall back to the default one.
 */
@Slf4j
@Service
public class NotificationService {

    private final Map<String, NotificationChannel> channels;
    private final String defaultChannel;
    private final String emailDomain;

    public NotificationService(Map<String, NotificationChannel> notificationChannels,
                               @Value("${notification.default-channel:email}") String defaultChannel,
                               @Value("${notification.email-domain:booking.example.com}") String emailDomain) {
        this.channels = notificationChannels;
        this.defaultChannel = defaultChannel;
        this.emailDomain = emailDomain;
        if (!channels.containsKey(defaultChannel)) {
            throw new IllegalStateException("default notification channel is not configured: " + defaultChannel);
        }
    }

    public void send(NotificationRequest request) {
        NotificationContent content = TemplateEngine.render(request.getTemplateId(), request.getVariables());

        String channelKey = request.getChannel() != null && channels.containsKey(request.getChannel())
                ? request.getChannel()
                : defaultChannel;
        NotificationChannel channel = channels.get(channelKey);

        String to = resolveContact(request.getRecipientId(), channelKey);
        String body = "sms".equals(channelKey) ? content.sms() : content.body();

        channel.send(to, content.subject(), body);

        log.info("Notification sent: recipientId={}, channel={}, template={}",
                request.getRecipientId(), channelKey, request.getTemplateId());
    }

    private String resolveContact(String recipientId, String channel) {
        // Contact details live with the identity service; user ids double as mailbox names meanwhile
        return "sms".equals(channel)
                ? "user:" + recipientId
                : recipientId + "@" + emailDomain;
    }
}
