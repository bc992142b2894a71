package com.booking.organization.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface OrganizationJpaRepository
        extends JpaRepository<OrganizationRecord, String>, JpaSpecificationExecutor<OrganizationRecord> {

    boolean existsByNameAndDeletedFalse(String name);

    /**
     * Compare-and-swap write: applies only while the row still carries {@code storedVersion}.
     *
     * @return rows updated, 0 on a version mismatch or a missing row
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE OrganizationRecord o
           SET o.name = :name,
               o.lastUpdateTime = :lastUpdateTime,
               o.lastUpdateBy = :lastUpdateBy,
               o.rowVersion = :version,
               o.deleted = :deleted
         WHERE o.id = :id
           AND o.rowVersion = :storedVersion
        """)
    int updateIfVersion(@Param("id") String id,
                        @Param("storedVersion") long storedVersion,
                        @Param("name") String name,
                        @Param("lastUpdateTime") Instant lastUpdateTime,
                        @Param("lastUpdateBy") String lastUpdateBy,
                        @Param("version") long version,
                        @Param("deleted") boolean deleted);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM OrganizationRecord o WHERE o.id = :id AND o.rowVersion = :storedVersion")
    int deleteIfVersion(@Param("id") String id, @Param("storedVersion") long storedVersion);
}
