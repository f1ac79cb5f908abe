package com.flagship.property_settlement.directory;

public enum UserRole {
    SELLER,
    BUYER,
    AGENT,
    ADMIN
}
