package org.safeshipper.engine.domain.model;

/**
 * Classification of one required equipment type on a vehicle.
 */
public enum EquipmentStatus {
    COMPLIANT,
    MISSING,
    EXPIRED,
    INSPECTION_OVERDUE
}
