package org.safeshipper.engine.domain.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Lifecycle of anything carrying an expiry date (licences, certificates, medicals).
 * Always computed against the evaluation date, never stored.
 */
public enum ExpiryState {
    VALID,
    EXPIRING_SOON,
    EXPIRED;

    /**
     * Resolve the state of an expiry date.
     *
     * @param expiryDate the expiry date, null means no expiry
     * @param today the evaluation date
     * @param warningDays days before expiry at which the state becomes EXPIRING_SOON
     */
    public static ExpiryState of(LocalDate expiryDate, LocalDate today, int warningDays) {
        if (expiryDate == null) {
            return VALID;
        }
        long daysUntilExpiry = ChronoUnit.DAYS.between(today, expiryDate);
        if (daysUntilExpiry < 0) {
            return EXPIRED;
        }
        if (daysUntilExpiry <= warningDays) {
            return EXPIRING_SOON;
        }
        return VALID;
    }
}
