package com.flagship.property_settlement.directory;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class JpaUserDirectory implements UserDirectory {

    private final DirectoryUserRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<DirectoryUser> findById(UUID userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return repository.findById(userId).map(DirectoryUserEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DirectoryUser> findAdmins() {
        return repository.findByRole(UserRole.ADMIN).stream()
                .map(DirectoryUserEntity::toDomain)
                .toList();
    }
}
