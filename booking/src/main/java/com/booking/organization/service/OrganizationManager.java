package com.booking.organization.service;

import com.booking.organization.domain.Organization;
import com.booking.organization.domain.OrganizationRepository;
import com.booking.organization.domain.UpdateOrganization;
import com.booking.shared.error.ResourceAlreadyExistsException;
import com.booking.shared.error.ResourceNotFoundException;
import com.booking.shared.events.EventPublisher;
import com.booking.shared.identifier.IdFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Organization Manager: administrative write side: register, modify, delete.
 *
 * Reads and writes go through the transactional {@link OrganizationRepository} only. Each operation
 * saves the aggregate and then publishes the events it drained, inside one transaction:
 *  - outbox delivery: events commit or roll back with the aggregate
 *  - direct delivery: a publish failure rolls the write back, a crash after commit loses nothing
 *    already sent but may leave a committed change without its event
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrganizationManager {

    static final String RESOURCE = "organization";

    private final OrganizationRepository organizationRepository;
    private final EventPublisher eventPublisher;
    private final IdFactory idFactory;

    @Transactional
    public Organization register(RegisterOrganizationCommand cmd) {
        requireUniqueName(cmd.getName());

        Organization organization = Organization.create(idFactory.newId(), cmd.getName(), cmd.getActor());
        organizationRepository.save(organization);
        eventPublisher.publish(organization.pullEvents());

        log.info("Organization registered: organizationId={}, name={}, actor={}",
                organization.getId(), organization.getName(), cmd.getActor());
        return organization;
    }

    /**
     * Applies the update to the stored organization. An update without fields changes nothing and
     * returns the organization as stored.
     */
    @Transactional
    public Organization modifyById(String id, String actor, UpdateOrganization update) {
        Organization organization = getById(id);
        if (update.isEmpty()) {
            return organization;
        }
        if (update.getName() != null && !update.getName().equals(organization.getName())) {
            requireUniqueName(update.getName());
        }

        organization.update(actor, update);
        organizationRepository.save(organization);
        eventPublisher.publish(organization.pullEvents());

        log.info("Organization modified: organizationId={}, version={}, actor={}",
                id, organization.getVersion(), actor);
        return organization;
    }

    /**
     * Deletes the organization; a missing organization is not an error.
     */
    @Transactional
    public void deleteById(String id, String actor) {
        Optional<Organization> found = organizationRepository.findByKey(id);
        if (found.isEmpty() || found.get().isDeleted()) {
            log.debug("Organization delete skipped, not found: organizationId={}", id);
            return;
        }

        Organization organization = found.get();
        organization.delete(actor);
        organizationRepository.delete(organization);
        eventPublisher.publish(organization.pullEvents());

        log.info("Organization deleted: organizationId={}, actor={}", id, actor);
    }

    private Organization getById(String id) {
        return organizationRepository.findByKey(id)
                .filter(o -> !o.isDeleted())
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id));
    }

    private void requireUniqueName(String name) {
        if (organizationRepository.existsByName(name)) {
            throw new ResourceAlreadyExistsException(RESOURCE, "name", name);
        }
    }
}
