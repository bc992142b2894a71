package com.booking.organization.domain;

import java.util.Optional;

/**
 * Strongly consistent store of organizations, used by every write path.
 */
public interface OrganizationRepository {

    /**
     * Inserts a new organization or applies a conditional update guarded by its stored version.
     *
     * @throws com.booking.shared.error.ConflictException when the row changed since it was loaded,
     *                                                    or an insert collides with an existing id
     */
    void save(Organization organization);

    Optional<Organization> findByKey(String id);

    /** Persists the deletion recorded on the aggregate; soft or physical depending on configuration. */
    void delete(Organization organization);

    /** Physically removes the row regardless of its version. */
    void deleteByKey(String id);

    boolean existsByName(String name);
}
