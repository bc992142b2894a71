package com.booking.user.service;

import com.booking.shared.error.ResourceNotFoundException;
import com.booking.user.domain.User;
import com.booking.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserFetcher {

    public static final String RESOURCE = "user";

    private final UserRepository userRepository;

    public User getByKey(String id) {
        return userRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id));
    }

    public List<User> listByKeys(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return userRepository.findAllById(ids);
    }
}
