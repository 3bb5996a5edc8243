package org.safeshipper.engine.domain.model;

/**
 * Highest kind of work a driver is currently qualified for.
 */
public enum QualificationLevel {
    /** No usable licence, or a blocking issue for the requested load. */
    INSUFFICIENT,
    /** General freight only. */
    BASIC,
    /** Qualified for every hazard class of the shipment. */
    DANGEROUS_GOODS
}
