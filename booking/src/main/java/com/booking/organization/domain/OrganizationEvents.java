package com.booking.organization.domain;

import com.booking.shared.events.DomainEvent;
import com.booking.shared.events.EventTypes;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Getter;

import java.time.Instant;

/**
 * Organization event payloads. Keyed by organization id so all events of one organization stay ordered.
 */
public final class OrganizationEvents {

    private OrganizationEvents() {}

    @Getter
    public static class OrganizationCreated extends DomainEvent {
        private final String organizationId;
        private final String name;
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        private final Instant createTime;
        private final String createBy;

        OrganizationCreated(Organization src) {
            super(EventTypes.ORGANIZATION_CREATED, EventTypes.SOURCE_ORGANIZATIONS, src.getId(), src.getId(),
                    src.getCreateTime());
            this.organizationId = src.getId();
            this.name = src.getName();
            this.createTime = src.getCreateTime();
            this.createBy = src.getCreateBy();
        }
    }

    @Getter
    public static class OrganizationUpdated extends DomainEvent {
        private final String organizationId;
        private final String name;
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        private final Instant updateTime;
        private final String updateBy;
        private final long version;

        OrganizationUpdated(Organization src) {
            super(EventTypes.ORGANIZATION_UPDATED, EventTypes.SOURCE_ORGANIZATIONS, src.getId(), src.getId(),
                    src.getLastUpdateTime());
            this.organizationId = src.getId();
            this.name = src.getName();
            this.updateTime = src.getLastUpdateTime();
            this.updateBy = src.getLastUpdateBy();
            this.version = src.getVersion();
        }
    }

    @Getter
    public static class OrganizationDeleted extends DomainEvent {
        private final String organizationId;
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        private final Instant deleteTime;
        private final String deleteBy;

        OrganizationDeleted(Organization src) {
            super(EventTypes.ORGANIZATION_DELETED, EventTypes.SOURCE_ORGANIZATIONS, src.getId(), src.getId(),
                    src.getLastUpdateTime());
            this.organizationId = src.getId();
            this.deleteTime = src.getLastUpdateTime();
            this.deleteBy = src.getLastUpdateBy();
        }
    }
}
