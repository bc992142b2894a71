package com.booking.organization.service;

import com.booking.organization.domain.Organization;
import com.booking.organization.domain.OrganizationReadRepository;
import com.booking.shared.error.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-side lookup of a single organization. Not for use by write paths: the read store may lag.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrganizationFetcher {

    private final OrganizationReadRepository readRepository;

    public Organization getById(String id) {
        return readRepository.findByKey(id)
                .filter(o -> !o.isDeleted())
                .orElseThrow(() -> new ResourceNotFoundException(OrganizationManager.RESOURCE, id));
    }
}
