package org.safeshipper.engine.domain.model;

/**
 * Segregation levels between two hazard classes, from least to most restrictive.
 */
public enum SegregationLevel {
    COMPATIBLE(0, "No segregation required"),
    AWAY_FROM(3, "Keep at least 3 m apart on the same vehicle"),
    SEPARATED_FROM(6, "Separate compartment or at least 6 m apart"),
    CONDITIONAL(0, "Special conditions apply, manual review required"),
    PROHIBITED(0, "Must not be loaded on the same vehicle");

    private final int minimumDistanceMetres;
    private final String method;

    SegregationLevel(int minimumDistanceMetres, String method) {
        this.minimumDistanceMetres = minimumDistanceMetres;
        this.method = method;
    }

    public int getMinimumDistanceMetres() {
        return minimumDistanceMetres;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Levels that can be satisfied by physical separation on one vehicle.
     */
    public boolean requiresSeparation() {
        return this == AWAY_FROM || this == SEPARATED_FROM;
    }
}
