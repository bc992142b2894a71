package com.booking.shared.audit;

import java.time.Instant;

/**
 * Read-only view of the {@link Auditable} an aggregate embeds.
 * Aggregates implement it by forwarding to their own Auditable instance.
 */
public interface Audited {

    Instant getCreateTime();

    String getCreateBy();

    Instant getLastUpdateTime();

    String getLastUpdateBy();

    long getVersion();

    boolean isDeleted();

    boolean isNew();

    long getStoredVersion();
}
