package org.safeshipper.engine.reference;

/**
 * Minimum fire extinguisher provision for a vehicle mass category.
 */
public final class FireExtinguisherRequirement {

    private final Double maxVehicleMassKg;
    private final double totalCapacityKg;
    private final int minimumUnits;
    private final Double largestUnitKg;
    private final String regulatoryReference;

    /**
     * @param maxVehicleMassKg upper bound of the category, null for the open-ended top category
     * @param largestUnitKg minimum size of the largest unit, null when not regulated
     */
    public FireExtinguisherRequirement(Double maxVehicleMassKg, double totalCapacityKg, int minimumUnits,
                                       Double largestUnitKg, String regulatoryReference) {
        this.maxVehicleMassKg = maxVehicleMassKg;
        this.totalCapacityKg = totalCapacityKg;
        this.minimumUnits = minimumUnits;
        this.largestUnitKg = largestUnitKg;
        this.regulatoryReference = regulatoryReference;
    }

    public Double getMaxVehicleMassKg() {
        return maxVehicleMassKg;
    }

    public double getTotalCapacityKg() {
        return totalCapacityKg;
    }

    public int getMinimumUnits() {
        return minimumUnits;
    }

    public Double getLargestUnitKg() {
        return largestUnitKg;
    }

    public String getRegulatoryReference() {
        return regulatoryReference;
    }

    public boolean appliesTo(double vehicleMassKg) {
        return maxVehicleMassKg == null || vehicleMassKg <= maxVehicleMassKg;
    }
}
