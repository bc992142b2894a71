package com.booking.organization.repository;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Organization JPA row. The optimistic-concurrency version lives in {@code row_version} and is
 * maintained by the aggregate, not by Hibernate, so updates go through a conditional JPQL statement.
 */
@Entity
@Table(name = "organizations", indexes = {
    @Index(name = "idx_organizations_name", columnList = "name"),
    @Index(name = "idx_organizations_create_time", columnList = "create_time, id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationRecord implements Persistable<String> {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", nullable = false, length = 256)
    private String name;

    @Column(name = "create_time", nullable = false, updatable = false)
    private Instant createTime;

    @Column(name = "create_by", nullable = false, updatable = false, length = 128)
    private String createBy;

    @Column(name = "last_update_time", nullable = false)
    private Instant lastUpdateTime;

    @Column(name = "last_update_by", nullable = false, length = 128)
    private String lastUpdateBy;

    @Column(name = "row_version", nullable = false)
    private long rowVersion;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @PostLoad
    @PostPersist
    void markStored() {
        newRecord = false;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }
}
