package com.booking.appointment.domain;

import com.booking.shared.paging.Filter;
import com.booking.shared.paging.Page;
import com.booking.shared.paging.PageQuery;
import com.booking.shared.paging.Sorting;

import java.util.Optional;

/**
 * Query side of the appointment store. Listings sort by {@link #FIELD_SCHEDULE_TIME}; the other
 * fields are filterable.
 */
public interface AppointmentReadRepository {

    String FIELD_SCHEDULE_TIME = "schedule_time";
    String FIELD_SCHEDULED_BY = "scheduled_by";
    String FIELD_PLACE_ID = "place_id";
    String FIELD_TARGETED_TO = "targeted_to";
    String FIELD_STATUS = "status";

    Optional<Appointment> findByKey(String id);

    Page<Appointment> findAll(PageQuery query);

    /** Appointments booked by {@code userId}, most recent schedule time first, deleted ones skipped. */
    default Page<Appointment> findAllByUser(String userId, Integer pageSize, String pageToken) {
        return findAll(PageQuery.builder()
                .filter(Filter.equal(FIELD_SCHEDULED_BY, userId))
                .sorting(Sorting.desc(FIELD_SCHEDULE_TIME))
                .pageSize(pageSize)
                .pageToken(pageToken)
                .build());
    }

    /** Appointments at {@code placeId}, most recent schedule time first, deleted ones skipped. */
    default Page<Appointment> findAllByPlace(String placeId, Integer pageSize, String pageToken) {
        return findAll(PageQuery.builder()
                .filter(Filter.equal(FIELD_PLACE_ID, placeId))
                .sorting(Sorting.desc(FIELD_SCHEDULE_TIME))
                .pageSize(pageSize)
                .pageToken(pageToken)
                .build());
    }
}
