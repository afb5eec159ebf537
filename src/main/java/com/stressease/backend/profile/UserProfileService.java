package com.stressease.backend.profile;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class UserProfileService {

    private final UserProfileRepository repository;

    /**
     * Profile lookup for prompt personalization. A missing profile or a
     * datastore failure yields empty: a chat must still open without one.
     */
    public Optional<UserProfile> findProfile(String userId) {
        try {
            return repository.findById(userId);
        } catch (DataAccessException e) {
            log.warn("Could not load profile for user={}, continuing without personalization: {}",
                    userId, e.getMessage());
            return Optional.empty();
        }
    }
}
