package org.safeshipper.engine.domain.service;

import org.safeshipper.engine.domain.model.DriverSnapshot;
import org.safeshipper.engine.domain.model.RankedCandidate;
import org.safeshipper.engine.domain.model.ShipmentSnapshot;
import org.safeshipper.engine.domain.model.ValidationResult;
import org.safeshipper.engine.domain.model.VehicleSnapshot;

import java.util.List;

/**
 * Entry point of the compliance engine.
 *
 * Every call is a pure function of its arguments and the reference data. A call that cannot
 * reach a verdict throws {@link org.safeshipper.engine.domain.ValidationSystemException}
 * instead of returning a result.
 */
public interface ValidationOrchestrator {

    /**
     * Validate a vehicle for a shipment: segregation, equipment, transport restrictions and capacity.
     *
     * @param strictMode when true, warnings block the assignment (CONDITIONAL)
     */
    ValidationResult validateVehicle(ShipmentSnapshot shipment, VehicleSnapshot vehicle, boolean strictMode);

    /**
     * Validate a driver for a shipment: segregation, licences, certificates and medical.
     */
    ValidationResult validateDriver(ShipmentSnapshot shipment, DriverSnapshot driver, boolean strictMode);

    /**
     * Validate a vehicle and a driver together, producing a single verdict for the pair.
     */
    ValidationResult validateAssignment(ShipmentSnapshot shipment, VehicleSnapshot vehicle,
                                        DriverSnapshot driver, boolean strictMode);

    /**
     * Validate every vehicle independently and return the compatible ones, best first.
     *
     * @param includeWarnings when false, candidates with warnings are dropped
     */
    List<RankedCandidate> rankVehicles(ShipmentSnapshot shipment, List<VehicleSnapshot> vehicles,
                                       boolean includeWarnings);

    /**
     * Validate every driver independently and return the compatible ones, best first.
     */
    List<RankedCandidate> rankDrivers(ShipmentSnapshot shipment, List<DriverSnapshot> drivers,
                                      boolean includeWarnings);
}
