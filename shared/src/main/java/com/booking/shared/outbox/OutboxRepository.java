package com.booking.shared.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface OutboxRepository extends JpaRepository<OutboxRecord, String> {

    /**
     * Unpublished records eligible for relay, oldest first.
     * SKIP LOCKED lets several relay instances work on disjoint batches without blocking each other.
     */
    @Query(value = """
        SELECT * FROM outbox
        WHERE published_at IS NULL
          AND retry_count < :maxRetries
          AND (next_retry_at IS NULL OR next_retry_at <= :now)
        ORDER BY created_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxRecord> findUnpublishedForRelay(@Param("now") Instant now,
                                               @Param("maxRetries") int maxRetries,
                                               @Param("limit") int limit);

    @Query("SELECT COUNT(o) FROM OutboxRecord o WHERE o.publishedAt IS NULL AND o.retryCount < :maxRetries")
    long countUnpublished(@Param("maxRetries") int maxRetries);

    List<OutboxRecord> findByAggregateIdOrderByCreatedAtAsc(String aggregateId);
}
