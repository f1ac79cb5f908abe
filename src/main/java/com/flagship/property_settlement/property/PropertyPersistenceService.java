package com.flagship.property_settlement.property;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence operations on properties used by the sales workflow.
 *
 * Each write runs in its own transaction: the property update is the first of the
 * independent writes that make up a status transition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PropertyPersistenceService {

    private final PropertyRepository propertyRepository;

    /**
     * Resolves a property by UUID or, failing that, by slug.
     */
    @Transactional(readOnly = true)
    public Optional<PropertyEntity> findByIdOrSlug(String idOrSlug) {
        if (idOrSlug == null || idOrSlug.isBlank()) {
            return Optional.empty();
        }
        return parseUuid(idOrSlug)
                .flatMap(propertyRepository::findById)
                .or(() -> propertyRepository.findBySlug(idOrSlug));
    }

    @Transactional(readOnly = true)
    public PropertySnapshot requireSnapshot(UUID propertyId) {
        return propertyRepository.findById(propertyId)
                .map(PropertySnapshot::of)
                .orElseThrow(() -> new PropertyNotFoundException(propertyId.toString()));
    }

    /**
     * Persists a new sales status (and SOLD/settlement date for SETTLED).
     *
     * @return snapshot of the property after the write
     */
    @Transactional
    public PropertySnapshot applySalesStatus(UUID propertyId, SalesStatus status,
                                             UUID modifiedBy, LocalDate settlementDate) {
        PropertyEntity entity = propertyRepository.findById(propertyId)
                .orElseThrow(() -> new PropertyNotFoundException(propertyId.toString()));
        entity.applySalesStatus(status, modifiedBy, settlementDate);
        PropertyEntity saved = propertyRepository.saveAndFlush(entity);
        log.debug("Applied sales status {} to property {}", status, propertyId);
        return PropertySnapshot.of(saved);
    }

    @Transactional
    public PropertyEntity save(PropertyEntity entity) {
        return propertyRepository.save(entity);
    }

    private static Optional<UUID> parseUuid(String value) {
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
