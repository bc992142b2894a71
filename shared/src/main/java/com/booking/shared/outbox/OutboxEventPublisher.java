package com.booking.shared.outbox;

import com.booking.shared.error.EventPublishException;
import com.booking.shared.events.DomainEvent;
import com.booking.shared.events.EventPublisher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Outbox-backed {@link EventPublisher}.
 *
 * Must run inside the transaction that saved the aggregate, so the events commit (or roll back)
 * with it. {@link OutboxRelayService} delivers them to Kafka afterwards.
 *
 * Usage:
 * <pre>
 * {@literal @}Transactional
 * public Organization register(RegisterOrganizationCommand cmd) {
 *     Organization organization = Organization.create(id, cmd.getName(), cmd.getActor());
 *     organizationRepository.save(organization);             // aggregate write
 *     eventPublisher.publish(organization.pullEvents());     // outbox rows, same tx
 *     return organization;
 * }
 * </pre>
 */
@Slf4j
@Primary
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "booking.events.delivery", havingValue = "outbox", matchIfMissing = true)
public class OutboxEventPublisher implements EventPublisher {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void publish(List<DomainEvent> events) {
        for (DomainEvent event : events) {
            append(event);
        }
    }

    private void append(DomainEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventPublishException("Cannot serialize event to JSON: " + event.getType(), e);
        }

        OutboxRecord record = OutboxRecord.builder()
                .id(event.getId())
                .aggregateId(event.getKey())
                .aggregateType(event.getSource())
                .subject(event.getSubject())
                .eventType(event.getType())
                .eventTime(event.getTime())
                .topic(event.getTopic())
                .payload(payload)
                .retryCount(0)
                .build();

        outboxRepository.save(record);

        log.debug("Outbox record appended: eventId={}, type={}, key={}",
                event.getId(), event.getType(), event.getKey());
    }
}
