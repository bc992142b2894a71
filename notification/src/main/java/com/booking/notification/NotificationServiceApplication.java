package com.booking.notification;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Notification Service: entry point
 *
 * Purely reactive: consumes organization and appointment events, no REST API.
 */
@SpringBootApplication(scanBasePackages = {"com.booking.notification", "com.booking.shared.idempotency"})
@EnableKafka
public class NotificationServiceApplication {
    public static void main(String[] args) { SpringApplication.run(NotificationServiceApplication.class, args); }
}
