package com.booking.place.service;

import com.booking.place.domain.Place;
import com.booking.place.repository.PlaceRepository;
import com.booking.shared.error.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PlaceFetcher {

    public static final String RESOURCE = "place";

    private final PlaceRepository placeRepository;

    public Place getByKey(String id) {
        return placeRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id));
    }

    /** Places found among {@code ids}; unknown ids are skipped. */
    public List<Place> listByKeys(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return placeRepository.findAllById(ids);
    }
}
