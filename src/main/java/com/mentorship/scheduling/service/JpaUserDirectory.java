package com.mentorship.scheduling.service;

import com.mentorship.scheduling.port.UserDirectory;
import com.mentorship.scheduling.port.UserProfile;
import com.mentorship.scheduling.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaUserDirectory implements UserDirectory {

    private final UserAccountRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<UserProfile> getUser(Long id) {
        if (id == null) return Optional.empty();
        return repository.findById(id)
                .map(u -> new UserProfile(u.getId(), u.getDisplayName(), u.getEmail(), u.getPushToken(),
                        u.getTimezone(), u.getRole()));
    }
}
