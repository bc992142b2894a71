package com.booking.appointment.service;

import com.booking.appointment.domain.Appointment;
import com.booking.appointment.domain.AppointmentErrors;
import com.booking.appointment.domain.AppointmentReadRepository;
import com.booking.employee.domain.Employee;
import com.booking.employee.service.EmployeeFetcher;
import com.booking.place.domain.Place;
import com.booking.place.service.PlaceFetcher;
import com.booking.shared.paging.Page;
import com.booking.user.domain.User;
import com.booking.user.service.UserFetcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of appointments, enriched with the referenced place, employee and user.
 *
 * Single lookups fail when a reference is missing. Listings resolve references with one batch
 * query per kind and leave unknown ones {@code null}.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AppointmentFetcher {

    private final AppointmentReadRepository readRepository;
    private final PlaceFetcher placeFetcher;
    private final EmployeeFetcher employeeFetcher;
    private final UserFetcher userFetcher;

    public AppointmentView getByKey(String id) {
        Appointment appointment = readRepository.findByKey(id)
                .filter(a -> !a.isDeleted())
                .orElseThrow(() -> AppointmentErrors.notFound(id));

        return AppointmentView.builder()
                .appointment(appointment)
                .place(placeFetcher.getByKey(appointment.getPlaceId()))
                .scheduledBy(userFetcher.getByKey(appointment.getScheduledBy()))
                .targetedTo(appointment.getTargetedTo() != null
                        ? employeeFetcher.getByKey(appointment.getTargetedTo())
                        : null)
                .build();
    }

    /** The user's appointments with place and employee resolved; the user itself is left out. */
    public Page<AppointmentView> listByUser(String userId, Integer pageSize, String pageToken) {
        Page<Appointment> page = readRepository.findAllByUser(userId, pageSize, pageToken);
        Map<String, Place> places = index(placeFetcher.listByKeys(collect(page, Appointment::getPlaceId)), Place::getId);
        Map<String, Employee> employees = index(
                employeeFetcher.listByKeys(collect(page, Appointment::getTargetedTo)), Employee::getId);

        return page.map(a -> AppointmentView.builder()
                .appointment(a)
                .place(places.get(a.getPlaceId()))
                .targetedTo(lookup(employees, a.getTargetedTo()))
                .build());
    }

    /** The place's appointments with employee and booking user resolved; the place itself is left out. */
    public Page<AppointmentView> listByPlace(String placeId, Integer pageSize, String pageToken) {
        Page<Appointment> page = readRepository.findAllByPlace(placeId, pageSize, pageToken);
        Map<String, User> users = index(userFetcher.listByKeys(collect(page, Appointment::getScheduledBy)), User::getId);
        Map<String, Employee> employees = index(
                employeeFetcher.listByKeys(collect(page, Appointment::getTargetedTo)), Employee::getId);

        return page.map(a -> AppointmentView.builder()
                .appointment(a)
                .scheduledBy(users.get(a.getScheduledBy()))
                .targetedTo(lookup(employees, a.getTargetedTo()))
                .build());
    }

    private static Set<String> collect(Page<Appointment> page, Function<Appointment, String> key) {
        return page.getItems().stream().map(key).filter(Objects::nonNull).collect(Collectors.toSet());
    }

    private static <T> Map<String, T> index(List<T> items, Function<T, String> key) {
        return items.stream().collect(Collectors.toMap(key, Function.identity(), (a, b) -> a));
    }

    private static <T> T lookup(Map<String, T> index, String key) {
        return key == null ? null : index.get(key);
    }
}
