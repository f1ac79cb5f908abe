package com.flagship.property_settlement.directory;

import lombok.Value;

import java.util.UUID;

@Value
public class DirectoryUser {
    UUID id;
    String name;
    String email;
    UserRole role;
    String bankAccountNumber;

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isAgent() {
        return role == UserRole.AGENT;
    }
}
