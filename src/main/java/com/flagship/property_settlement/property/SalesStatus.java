package com.flagship.property_settlement.property;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Sales pipeline status of a property.
 *
 * A property with no sales status yet is represented by {@code null}.
 * Canonical progression: null -> any, CONTRACT_EXCHANGED -> UNCONDITIONAL / SETTLED,
 * UNCONDITIONAL -> SETTLED. SETTLED is the end of the pipeline.
 */
public enum SalesStatus {

    CONTRACT_EXCHANGED("contract-exchanged", "Contract Exchanged"),

    UNCONDITIONAL("unconditional", "Unconditional"),

    SETTLED("settled", "Settled");

    private final String wireValue;
    private final String displayName;

    SalesStatus(String wireValue, String displayName) {
        this.wireValue = wireValue;
        this.displayName = displayName;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parses a status from its wire value ("contract-exchanged") or enum name
     * ("CONTRACT_EXCHANGED").
     */
    public static Optional<SalesStatus> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equalsIgnoreCase(trimmed) || s.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }

    /**
     * Display name for a possibly-null status.
     */
    public static String displayNameOf(SalesStatus status) {
        return status == null ? "Not Set" : status.displayName;
    }
}
