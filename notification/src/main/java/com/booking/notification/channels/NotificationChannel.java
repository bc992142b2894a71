package com.booking.notification.channels;

/** Delivery mechanism for a rendered notification. */
public interface NotificationChannel {

    /** Key the channel is selected by, e.g. {@code email}. */
    String channel();

    void send(String to, String subject, String body);
}
