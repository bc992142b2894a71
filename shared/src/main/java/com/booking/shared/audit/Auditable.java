package com.booking.shared.audit;

import lombok.Builder;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Creation, update and deletion metadata plus the optimistic-concurrency version of an aggregate.
 *
 * Owned by exactly one aggregate, which embeds it by value and forwards the read accessors
 * through {@link Audited}. Only the owning aggregate calls {@link #recordUpdate(String)} and
 * {@link #recordDelete(String)}.
 *
 * The version starts at 0 and grows by one per recorded revision. {@code storedVersion} is the
 * version the row carries in the store ({@code null} for an aggregate never persisted); write
 * repositories use it as the compare-and-swap predicate of their update path and call
 * {@link #markPersisted()} once a write succeeded.
 */
public final class Auditable {

    private final Instant createTime;
    private final String createBy;
    private Instant lastUpdateTime;
    private String lastUpdateBy;
    private long version;
    private boolean deleted;
    private Long storedVersion;

    private Auditable(Instant createTime, String createBy, Instant lastUpdateTime, String lastUpdateBy,
                      long version, boolean deleted, Long storedVersion) {
        this.createTime = Objects.requireNonNull(createTime, "createTime");
        this.createBy = Objects.requireNonNull(createBy, "createBy");
        this.lastUpdateTime = lastUpdateTime;
        this.lastUpdateBy = lastUpdateBy;
        this.version = version;
        this.deleted = deleted;
        this.storedVersion = storedVersion;
    }

    /**
     * Metadata of a brand-new aggregate: version 0, created and last updated now by {@code actor}.
     */
    public static Auditable create(String actor) {
        Instant now = now();
        return new Auditable(now, actor, now, actor, 0L, false, null);
    }

    /**
     * Rebuilds the metadata of an aggregate read back from a store. The given version becomes
     * the stored version expected by the next conditional write.
     */
    @Builder(builderMethodName = "restore", buildMethodName = "build")
    private static Auditable restored(Instant createTime, String createBy, Instant lastUpdateTime,
                                      String lastUpdateBy, long version, boolean deleted) {
        if (version < 0) {
            throw new IllegalArgumentException("version must not be negative: " + version);
        }
        return new Auditable(createTime, createBy,
                lastUpdateTime != null ? lastUpdateTime : createTime,
                lastUpdateBy != null ? lastUpdateBy : createBy,
                version, deleted, version);
    }

    public void recordUpdate(String actor) {
        Instant now = now();
        // clock skew between hosts must not break lastUpdateTime >= createTime
        this.lastUpdateTime = now.isBefore(createTime) ? createTime : now;
        this.lastUpdateBy = Objects.requireNonNull(actor, "actor");
        this.version++;
    }

    public void recordDelete(String actor) {
        recordUpdate(actor);
        this.deleted = true;
    }

    /** The current version is now the stored one; the next save takes the update path against it. */
    public void markPersisted() {
        this.storedVersion = version;
    }

    // stores keep microseconds; truncating keeps in-memory and reloaded timestamps equal
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    public Instant getCreateTime() {
        return createTime;
    }

    public String getCreateBy() {
        return createBy;
    }

    public Instant getLastUpdateTime() {
        return lastUpdateTime;
    }

    public String getLastUpdateBy() {
        return lastUpdateBy;
    }

    public long getVersion() {
        return version;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /** {@code true} until the aggregate has been written to or read back from a store. */
    public boolean isNew() {
        return storedVersion == null;
    }

    /** Version the stored row must still carry for a conditional update to apply. */
    public long getStoredVersion() {
        if (storedVersion == null) {
            throw new IllegalStateException("aggregate was never persisted");
        }
        return storedVersion;
    }

    @Override
    public String toString() {
        return String.format("Auditable{createBy=%s, lastUpdateBy=%s, version=%d, deleted=%s}",
                createBy, lastUpdateBy, version, deleted);
    }
}
