package com.booking.organization.domain;

import com.booking.shared.paging.Page;
import com.booking.shared.paging.PageQuery;

import java.util.Optional;

/**
 * Query side of the organization store. May lag behind {@link OrganizationRepository}.
 */
public interface OrganizationReadRepository {

    String FIELD_CREATE_TIME = "create_time";

    Optional<Organization> findByKey(String id);

    Page<Organization> findAll(PageQuery query);
}
