package com.flagship.property_settlement.invoice;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Assigns sequential invoice numbers per calendar year from the
 * {@code invoice_counters} table.
 *
 * The counter row is created lazily and incremented with an atomic
 * INSERT ... ON CONFLICT DO UPDATE ... RETURNING, so two concurrent callers
 * serialize on the row lock and never share a number. The call joins the
 * invoice insert transaction: a rolled-back insert also rolls back its number.
 */
@Service
public class InvoiceNumberService {

    static final String FORMAT = "INV-%d-%06d";

    @PersistenceContext
    private EntityManager entityManager;

    @Transactional
    public String assignNumber(int year) {
        Object result = entityManager
                .createNativeQuery(
                    "INSERT INTO invoice_counters (counter_year, next_number)"
                        + " VALUES (:year, 2)"
                        + " ON CONFLICT (counter_year)"
                        + " DO UPDATE SET next_number = invoice_counters.next_number + 1"
                        + " RETURNING next_number - 1")
                .setParameter("year", year)
                .getSingleResult();

        long number = ((Number) result).longValue();
        return String.format(FORMAT, year, number);
    }
}
