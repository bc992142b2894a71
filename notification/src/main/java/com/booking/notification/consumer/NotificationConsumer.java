package com.booking.notification.consumer;

import java.nio.charset.StandardCharsets;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import com.booking.notification.service.NotificationRequest;
import com.booking.notification.service.NotificationService;
import com.booking.notification.template.engine.TemplateEngine;
import com.booking.shared.events.EventTypes;
import com.booking.shared.idempotency.IdempotencyService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns organization and appointment events into user notifications.
 *
 * Each record is claimed through {@link IdempotencyService} before it is handled. A failed record
 * releases its claim and rethrows, so the container's error handler can retry it and finally route
 * it to the dead-letter topic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationConsumer {

    static final String GROUP_ID = "notification-service";

    private final NotificationService notificationService;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = EventTypes.TOPIC_ORGANIZATIONS_CREATED, groupId = GROUP_ID)
    public void onOrganizationCreated(ConsumerRecord<String, String> record, Acknowledgment ack) {
        handle(record, ack, event -> NotificationRequest.builder()
                .recipientId(text(event, "createBy"))
                .templateId(TemplateEngine.ORGANIZATION_CREATED)
                .variable("name", text(event, "name"))
                .build());
    }

    @KafkaListener(topics = EventTypes.TOPIC_APPOINTMENTS_SCHEDULED, groupId = GROUP_ID)
    public void onAppointmentScheduled(ConsumerRecord<String, String> record, Acknowledgment ack) {
        handle(record, ack, event -> NotificationRequest.builder()
                .recipientId(text(event, "scheduledBy"))
                .templateId(TemplateEngine.APPOINTMENT_SCHEDULED)
                .variable("title", text(event, "title"))
                .variable("scheduleTime", text(event, "scheduleTime"))
                .build());
    }

    @KafkaListener(topics = EventTypes.TOPIC_APPOINTMENTS_CANCELLED, groupId = GROUP_ID)
    public void onAppointmentCancelled(ConsumerRecord<String, String> record, Acknowledgment ack) {
        handle(record, ack, event -> NotificationRequest.builder()
                .recipientId(text(event, "scheduledBy"))
                .templateId(TemplateEngine.APPOINTMENT_CANCELLED)
                .variable("scheduleTime", text(event, "scheduleTime"))
                .variable("reason", text(event, "reason"))
                .build());
    }

    @KafkaListener(topics = EventTypes.TOPIC_APPOINTMENTS_RESCHEDULED, groupId = GROUP_ID)
    public void onAppointmentRescheduled(ConsumerRecord<String, String> record, Acknowledgment ack) {
        handle(record, ack, event -> NotificationRequest.builder()
                .recipientId(text(event, "scheduledBy"))
                .templateId(TemplateEngine.APPOINTMENT_RESCHEDULED)
                .variable("scheduleTime", text(event, "scheduleTime"))
                .variable("reason", text(event, "reason"))
                .build());
    }

    interface RequestMapper {
        NotificationRequest map(JsonNode event);
    }

    void handle(ConsumerRecord<String, String> record, Acknowledgment ack, RequestMapper mapper) {
        JsonNode event = parse(record);
        String eventId = eventId(record, event);
        if (eventId == null) {
            log.warn("Event without id skipped: topic={}, offset={}", record.topic(), record.offset());
            ack.acknowledge();
            return;
        }
        if (idempotencyService.isDuplicate(eventId, record.topic())) {
            ack.acknowledge();
            return;
        }
        try {
            notificationService.send(mapper.map(event));
            ack.acknowledge();
        } catch (RuntimeException ex) {
            log.error("Notification processing failed: topic={}, eventId={}", record.topic(), eventId, ex);
            idempotencyService.release(eventId, record.topic());
            throw ex;
        }
    }

    private JsonNode parse(ConsumerRecord<String, String> record) {
        try {
            return objectMapper.readTree(record.value());
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Unreadable event on " + record.topic() + " at offset " + record.offset(), ex);
        }
    }

    private static String eventId(ConsumerRecord<String, String> record, JsonNode event) {
        Header header = record.headers().lastHeader("event-id");
        if (header != null) {
            return new String(header.value(), StandardCharsets.UTF_8);
        }
        return text(event, "id");
    }

    private static String text(JsonNode event, String field) {
        JsonNode node = event.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
