package com.booking.shared.idempotency;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Idempotency Guard: Redis-backed event deduplication.
 *
 * Kafka delivers at least once and the outbox relay may publish a row again after a crash between
 * send and commit. Consumers call {@link #isDuplicate(String, String)} before handling a record and
 * skip it when the event id was already claimed.
 *
 * Key format:  idempotency:{topic}:{eventId}
 * TTL:         24 hours
 *
 * Redis SET NX is atomic, so two consumers racing on the same event cannot both claim it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private static final String KEY_PREFIX = "idempotency:";
    private static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private final StringRedisTemplate redisTemplate;

    /**
     * Claims the event for processing.
     *
     * @return true if the event was already claimed (duplicate), false if this caller owns it now
     */
    public boolean isDuplicate(String eventId, String topic) {
        Boolean claimed = redisTemplate.opsForValue().setIfAbsent(key(eventId, topic), "1", DEFAULT_TTL);

        if (Boolean.FALSE.equals(claimed)) {
            log.debug("Duplicate event detected and skipped: eventId={}, topic={}", eventId, topic);
            return true;
        }
        return false;
    }

    /**
     * Drops a claim so a later redelivery is processed again. Called when handling failed.
     */
    public void release(String eventId, String topic) {
        redisTemplate.delete(key(eventId, topic));
    }

    private static String key(String eventId, String topic) {
        return KEY_PREFIX + topic + ":" + eventId;
    }
}
