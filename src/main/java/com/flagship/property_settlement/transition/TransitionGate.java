package com.flagship.property_settlement.transition;

import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.exception.ForbiddenOperationException;
import com.flagship.property_settlement.exception.RequestValidationException;
import com.flagship.property_settlement.history.SettlementDetails;
import com.flagship.property_settlement.property.ListingStatus;
import com.flagship.property_settlement.property.PropertyEntity;
import com.flagship.property_settlement.property.PropertyNotFoundException;
import com.flagship.property_settlement.property.PropertyPersistenceService;
import com.flagship.property_settlement.property.PropertySnapshot;
import com.flagship.property_settlement.property.SalesStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks a transition request before anything is written.
 *
 * Order matters and mirrors the status codes a client sees: request fields (400),
 * property lookup (404), deleted property and seller/owner mismatch (400),
 * caller role and assignment (403), listing state (400), progression (409 when strict).
 */
@Component
@Slf4j
public class TransitionGate {

    static final int MAX_REASON_LENGTH = 500;
    static final BigDecimal MAX_COMMISSION_RATE = new BigDecimal("100");

    private final PropertyPersistenceService propertyService;
    private final Clock clock;
    private final boolean strictProgression;

    public TransitionGate(PropertyPersistenceService propertyService, Clock clock,
                          @Value("${sales.transition.strict-progression:false}") boolean strictProgression) {
        this.propertyService = propertyService;
        this.clock = clock;
        this.strictProgression = strictProgression;
    }

    public AdmittedTransition admit(TransitionCommand command, DirectoryUser actor) {
        SalesStatus target = validateRequest(command);

        PropertyEntity property = propertyService.findByIdOrSlug(command.getPropertyIdOrSlug())
                .orElseThrow(() -> new PropertyNotFoundException(command.getPropertyIdOrSlug()));

        if (property.isDeleted()) {
            throw new RequestValidationException("property", "Cannot update status of deleted property");
        }
        if (command.getSellerId() != null && !command.getSellerId().equals(property.getOwnerId())) {
            throw new RequestValidationException("sellerId", "Seller ID does not match the property owner");
        }

        authorize(property, actor);

        if (property.getStatus() == ListingStatus.SOLD && target != SalesStatus.SETTLED) {
            throw new RequestValidationException("status", "Cannot change status of sold property unless settling");
        }

        checkProgression(property.getSalesStatus(), target, property);

        SettlementDetails details = command.getSettlementDetails() == null
                ? null
                : command.getSettlementDetails().sanitized();
        String reason = command.getChangeReason() == null ? "" : command.getChangeReason().trim();

        return new AdmittedTransition(PropertySnapshot.of(property), target, reason, details,
                command.getSellerId(), command.getBuyerId());
    }

    /**
     * Field checks that need no database access.
     */
    SalesStatus validateRequest(TransitionCommand command) {
        Map<String, String> errors = new LinkedHashMap<>();

        SalesStatus target = null;
        if (command.getStatus() == null || command.getStatus().isBlank()) {
            errors.put("status", "Status is required");
        } else {
            target = SalesStatus.parse(command.getStatus()).orElse(null);
            if (target == null) {
                errors.put("status", "Invalid status. Must be one of: contract-exchanged, unconditional, settled");
            }
        }

        if (command.getChangeReason() != null && command.getChangeReason().trim().length() > MAX_REASON_LENGTH) {
            errors.put("changeReason", "Change reason cannot exceed 500 characters");
        }

        SettlementDetails details = command.getSettlementDetails();
        if (details != null) {
            LocalDate horizon = LocalDate.now(clock).plusYears(1);
            if (details.getSettlementDate() != null && details.getSettlementDate().isAfter(horizon)) {
                errors.put("settlementDetails.settlementDate", "Settlement date cannot be more than 1 year in the future");
            }
            BigDecimal rate = details.getCommissionRate();
            if (rate != null && (rate.signum() < 0 || rate.compareTo(MAX_COMMISSION_RATE) > 0)) {
                errors.put("settlementDetails.commissionRate", "Commission rate must be between 0 and 100");
            }
        }

        if (!errors.isEmpty()) {
            throw new RequestValidationException("Validation failed", errors);
        }
        return target;
    }

    private void authorize(PropertyEntity property, DirectoryUser actor) {
        if (actor.isAdmin()) {
            return;
        }
        if (!actor.isAgent()) {
            throw new ForbiddenOperationException("Access denied. Only agents can update property sales status",
                    Map.of("role", String.valueOf(actor.getRole())));
        }
        if (!property.isActiveAgent(actor.getId())) {
            throw new ForbiddenOperationException("Access denied. You are not assigned to this property",
                    Map.of("propertyId", property.getId().toString()));
        }
    }

    private void checkProgression(SalesStatus from, SalesStatus to, PropertyEntity property) {
        if (SalesStatusProgression.isCanonical(from, to)) {
            return;
        }
        if (strictProgression) {
            throw new ProgressionViolationException(from, to);
        }
        log.warn("Unusual status progression: {} -> {} for property {}",
                SalesStatus.displayNameOf(from), SalesStatus.displayNameOf(to), property.getId());
    }
}
