package com.booking.organization.domain;

import com.booking.shared.audit.Auditable;
import com.booking.shared.audit.Audited;
import com.booking.shared.events.DomainEvent;
import com.booking.shared.events.EventBuffer;
import com.booking.shared.events.EventSource;
import com.booking.organization.domain.OrganizationEvents.OrganizationCreated;
import com.booking.organization.domain.OrganizationEvents.OrganizationDeleted;
import com.booking.organization.domain.OrganizationEvents.OrganizationUpdated;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A logical grouping of resources such as employees and places.
 *
 * State only changes through {@link #update(String, UpdateOrganization)} and {@link #delete(String)};
 * every change advances the audit metadata and buffers one event. Name uniqueness is checked by
 * {@code OrganizationManager} against the store, not here.
 */
public final class Organization implements Audited, EventSource {

    private final String id;
    private String name;
    private final Auditable audit;
    private final EventBuffer events = new EventBuffer();

    private Organization(String id, String name, Auditable audit) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.audit = audit;
    }

    public static Organization create(String id, String name, String actor) {
        Organization organization = new Organization(id, name, Auditable.create(actor));
        organization.events.register(new OrganizationCreated(organization));
        return organization;
    }

    /** Rebuilds a stored organization. No event is raised. */
    public static Organization restore(String id, String name, Auditable audit) {
        return new Organization(id, name, audit);
    }

    /**
     * @return false, without touching version or events, when the update carries no field
     */
    public boolean update(String actor, UpdateOrganization update) {
        if (update == null || update.isEmpty()) {
            return false;
        }
        if (update.getName() != null) {
            this.name = update.getName();
        }
        audit.recordUpdate(actor);
        events.register(new OrganizationUpdated(this));
        return true;
    }

    public void delete(String actor) {
        audit.recordDelete(actor);
        events.register(new OrganizationDeleted(this));
    }

    @Override
    public List<DomainEvent> pullEvents() {
        return events.pull();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public Instant getCreateTime() {
        return audit.getCreateTime();
    }

    @Override
    public String getCreateBy() {
        return audit.getCreateBy();
    }

    @Override
    public Instant getLastUpdateTime() {
        return audit.getLastUpdateTime();
    }

    @Override
    public String getLastUpdateBy() {
        return audit.getLastUpdateBy();
    }

    @Override
    public long getVersion() {
        return audit.getVersion();
    }

    @Override
    public boolean isDeleted() {
        return audit.isDeleted();
    }

    @Override
    public boolean isNew() {
        return audit.isNew();
    }

    @Override
    public long getStoredVersion() {
        return audit.getStoredVersion();
    }

    /** Called by the write repository after the organization was stored. */
    public void markPersisted() {
        audit.markPersisted();
    }

    @Override
    public String toString() {
        return "Organization{id=" + id + ", name=" + name + ", " + audit + "}";
    }
}
