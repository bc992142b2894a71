package com.booking.organization.repository;

import com.booking.organization.domain.Organization;
import com.booking.organization.domain.OrganizationReadRepository;
import com.booking.organization.domain.OrganizationRepository;
import com.booking.shared.audit.Auditable;
import com.booking.shared.error.ConflictException;
import com.booking.shared.paging.Cursor;
import com.booking.shared.paging.CursorPaginator;
import com.booking.shared.paging.Page;
import com.booking.shared.paging.PageQuery;
import com.booking.shared.paging.jpa.SpecificationCursorSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;

/**
 * Relational store of organizations. Serves both the write and the read contract from the same
 * database; a replica-backed read side would implement {@link OrganizationReadRepository} on its own.
 */
@Slf4j
@Repository
public class JpaOrganizationRepository implements OrganizationRepository, OrganizationReadRepository {

    private static final String RESOURCE = "organization";

    private final OrganizationJpaRepository jpa;
    private final CursorPaginator paginator;
    private final SpecificationCursorSource<OrganizationRecord> cursorSource;
    private final boolean hardDelete;

    public JpaOrganizationRepository(OrganizationJpaRepository jpa,
                                     CursorPaginator paginator,
                                     @Value("${booking.persistence.hard-delete:false}") boolean hardDelete) {
        this.jpa = jpa;
        this.paginator = paginator;
        this.hardDelete = hardDelete;
        this.cursorSource = new SpecificationCursorSource<>(jpa,
                Map.of(FIELD_CREATE_TIME, "createTime"),
                r -> new Cursor(r.getCreateTime().toString(), r.getId()));
    }

    @Override
    public void save(Organization organization) {
        if (organization.isNew()) {
            insert(organization);
            return;
        }
        int updated = jpa.updateIfVersion(organization.getId(), organization.getStoredVersion(),
                organization.getName(), organization.getLastUpdateTime(), organization.getLastUpdateBy(),
                organization.getVersion(), organization.isDeleted());
        if (updated == 0) {
            throw new ConflictException(RESOURCE, organization.getId(), organization.getStoredVersion());
        }
        organization.markPersisted();
        log.debug("Organization updated: organizationId={}, version={}", organization.getId(), organization.getVersion());
    }

    private void insert(Organization organization) {
        if (jpa.existsById(organization.getId())) {
            throw new ConflictException(RESOURCE, organization.getId(), 0L);
        }
        try {
            jpa.saveAndFlush(toRecord(organization));
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(RESOURCE, organization.getId(), e);
        }
        organization.markPersisted();
        log.debug("Organization inserted: organizationId={}", organization.getId());
    }

    @Override
    public Optional<Organization> findByKey(String id) {
        return jpa.findById(id).map(JpaOrganizationRepository::toEntity);
    }

    @Override
    public void delete(Organization organization) {
        if (!hardDelete) {
            save(organization);
            return;
        }
        int deleted = jpa.deleteIfVersion(organization.getId(), organization.getStoredVersion());
        if (deleted == 0) {
            throw new ConflictException(RESOURCE, organization.getId(), organization.getStoredVersion());
        }
    }

    @Override
    public void deleteByKey(String id) {
        jpa.deleteById(id);
    }

    @Override
    public boolean existsByName(String name) {
        return jpa.existsByNameAndDeletedFalse(name);
    }

    @Override
    public Page<Organization> findAll(PageQuery query) {
        return paginator.paginate(query, cursorSource).map(JpaOrganizationRepository::toEntity);
    }

    static OrganizationRecord toRecord(Organization organization) {
        return OrganizationRecord.builder()
                .id(organization.getId())
                .name(organization.getName())
                .createTime(organization.getCreateTime())
                .createBy(organization.getCreateBy())
                .lastUpdateTime(organization.getLastUpdateTime())
                .lastUpdateBy(organization.getLastUpdateBy())
                .rowVersion(organization.getVersion())
                .deleted(organization.isDeleted())
                .build();
    }

    static Organization toEntity(OrganizationRecord record) {
        return Organization.restore(record.getId(), record.getName(), Auditable.restore()
                .createTime(record.getCreateTime())
                .createBy(record.getCreateBy())
                .lastUpdateTime(record.getLastUpdateTime())
                .lastUpdateBy(record.getLastUpdateBy())
                .version(record.getRowVersion())
                .deleted(record.isDeleted())
                .build());
    }
}
