package org.safeshipper.engine.domain.model;

/**
 * What a shipment was validated against.
 */
public enum SubjectType {
    VEHICLE,
    DRIVER,
    ASSIGNMENT
}
