package com.flagship.property_settlement.directory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves marketplace users (agents, sellers, buyers, admins) by id.
 */
public interface UserDirectory {

    Optional<DirectoryUser> findById(UUID userId);

    List<DirectoryUser> findAdmins();
}
