package com.booking.organization.service;

import com.booking.organization.domain.Organization;
import com.booking.organization.domain.OrganizationReadRepository;
import com.booking.shared.paging.Page;
import com.booking.shared.paging.PageQuery;
import com.booking.shared.paging.Sorting;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lists organizations oldest first, skipping deleted ones.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrganizationLister {

    private final OrganizationReadRepository readRepository;

    public Page<Organization> list(Integer pageSize, String pageToken) {
        return readRepository.findAll(PageQuery.builder()
                .sorting(Sorting.asc(OrganizationReadRepository.FIELD_CREATE_TIME))
                .pageSize(pageSize)
                .pageToken(pageToken)
                .build());
    }
}
