package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.property.SalesStatus;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Canonical sales pipeline moves.
 */
public final class SalesStatusProgression {

    private static final Map<SalesStatus, Set<SalesStatus>> CANONICAL = Map.of(
        SalesStatus.CONTRACT_EXCHANGED, EnumSet.of(SalesStatus.UNCONDITIONAL, SalesStatus.SETTLED),
        SalesStatus.UNCONDITIONAL, EnumSet.of(SalesStatus.SETTLED),
        SalesStatus.SETTLED, EnumSet.noneOf(SalesStatus.class)
    );

    private SalesStatusProgression() {
    }

    /**
     * A property with no status may move anywhere; re-requesting the current status
     * is always canonical.
     */
    public static boolean isCanonical(SalesStatus from, SalesStatus to) {
        if (to == null) {
            return false;
        }
        if (from == null || from == to) {
            return true;
        }
        return CANONICAL.get(from).contains(to);
    }
}
