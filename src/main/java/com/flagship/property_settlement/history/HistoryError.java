package com.flagship.property_settlement.history;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class HistoryError {

    @Column(name = "error", nullable = false, columnDefinition = "TEXT")
    private String error;

    @Column(name = "occurred_at", nullable = false)
    private Instant timestamp;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;
}
