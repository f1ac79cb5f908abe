package com.flagship.property_settlement.directory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DirectoryUserRepository extends JpaRepository<DirectoryUserEntity, UUID> {

    List<DirectoryUserEntity> findByRole(UserRole role);
}
