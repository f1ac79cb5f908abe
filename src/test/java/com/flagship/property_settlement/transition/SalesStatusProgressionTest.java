package com.flagship.property_settlement.transition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.flagship.property_settlement.property.SalesStatus.CONTRACT_EXCHANGED;
import static com.flagship.property_settlement.property.SalesStatus.SETTLED;
import static com.flagship.property_settlement.property.SalesStatus.UNCONDITIONAL;
import static org.junit.jupiter.api.Assertions.*;

class SalesStatusProgressionTest {

    @Test
    @DisplayName("A property with no status may move to any status")
    void testFromNull() {
        assertTrue(SalesStatusProgression.isCanonical(null, CONTRACT_EXCHANGED));
        assertTrue(SalesStatusProgression.isCanonical(null, UNCONDITIONAL));
        assertTrue(SalesStatusProgression.isCanonical(null, SETTLED));
    }

    @Test
    @DisplayName("Forward moves are canonical")
    void testForward() {
        assertTrue(SalesStatusProgression.isCanonical(CONTRACT_EXCHANGED, UNCONDITIONAL));
        assertTrue(SalesStatusProgression.isCanonical(CONTRACT_EXCHANGED, SETTLED));
        assertTrue(SalesStatusProgression.isCanonical(UNCONDITIONAL, SETTLED));
    }

    @Test
    @DisplayName("Backward moves are not canonical")
    void testBackward() {
        assertFalse(SalesStatusProgression.isCanonical(UNCONDITIONAL, CONTRACT_EXCHANGED));
        assertFalse(SalesStatusProgression.isCanonical(SETTLED, UNCONDITIONAL));
        assertFalse(SalesStatusProgression.isCanonical(SETTLED, CONTRACT_EXCHANGED));
    }

    @Test
    @DisplayName("Re-requesting the current status is canonical")
    void testSameStatus() {
        assertTrue(SalesStatusProgression.isCanonical(SETTLED, SETTLED));
        assertTrue(SalesStatusProgression.isCanonical(UNCONDITIONAL, UNCONDITIONAL));
    }
}
