package com.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Booking Service: entry point
 *
 * Organizations, appointments and their reference data (places, employees, users).
 * State changes leave through the transactional outbox.
 *
 * Port: 8080 (see application.yml)
 */
@SpringBootApplication(scanBasePackages = {
        "com.booking.config",
        "com.booking.organization",
        "com.booking.appointment",
        "com.booking.place",
        "com.booking.employee",
        "com.booking.user",
        "com.booking.shared.paging",
        "com.booking.shared.kafka",
        "com.booking.shared.outbox",
        "com.booking.shared.identifier",
        "com.booking.shared.web"
})
public class BookingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(BookingServiceApplication.class, args);
    }
}
