package org.safeshipper.engine.domain.service;

import org.safeshipper.engine.domain.model.EquipmentComplianceResult;
import org.safeshipper.engine.domain.model.EquipmentFinding;
import org.safeshipper.engine.domain.model.EquipmentStatus;
import org.safeshipper.engine.domain.model.ExpiryState;
import org.safeshipper.engine.domain.model.VehicleEquipmentRecord;
import org.safeshipper.engine.domain.model.VehicleSnapshot;
import org.safeshipper.engine.reference.EquipmentRequirement;
import org.safeshipper.engine.reference.EquipmentRequirementMap;
import org.safeshipper.engine.reference.FireExtinguisherRequirement;
import org.safeshipper.engine.reference.HazardClassTable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Classifies each required equipment type of a vehicle as COMPLIANT, MISSING, EXPIRED or INSPECTION_OVERDUE.
 *
 * For dangerous goods every non-compliant requirement is a critical issue. For general freight the
 * same findings are reported as warnings. When the installed fire extinguishers declare their capacity,
 * the total is also compared with the requirement for the vehicle's mass category.
 */
public final class VehicleEquipmentComplianceChecker {

    private static final Logger LOG = Logger.getLogger(VehicleEquipmentComplianceChecker.class.getName());

    public static final String FIRE_EXTINGUISHER = "FIRE_EXTINGUISHER";

    // compliant first, then the record that stays valid longest
    private static final Comparator<VehicleEquipmentRecord> LATEST_EXPIRY_FIRST = Comparator
            .comparing(VehicleEquipmentRecord::getExpiryDate, Comparator.nullsFirst(Comparator.<LocalDate>reverseOrder()))
            .thenComparing(VehicleEquipmentRecord::getSerialNumber, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final EquipmentRequirementMap requirements;
    private final List<FireExtinguisherRequirement> extinguisherRequirements;
    private final int expiryWarningDays;

    public VehicleEquipmentComplianceChecker(EquipmentRequirementMap requirements,
                                             List<FireExtinguisherRequirement> extinguisherRequirements,
                                             int expiryWarningDays) {
        this.requirements = Objects.requireNonNull(requirements, "requirements must not be null");
        List<FireExtinguisherRequirement> sorted = new ArrayList<>(
                Objects.requireNonNull(extinguisherRequirements, "extinguisherRequirements must not be null"));
        // open-ended category (no mass limit) sorts last
        sorted.sort(Comparator.comparing(FireExtinguisherRequirement::getMaxVehicleMassKg,
                Comparator.nullsLast(Comparator.<Double>naturalOrder())));
        this.extinguisherRequirements = Collections.unmodifiableList(sorted);
        this.expiryWarningDays = expiryWarningDays;
    }

    /**
     * Check a vehicle for a dangerous-goods load with the given ADR classes.
     */
    public EquipmentComplianceResult check(Set<String> adrClasses, VehicleSnapshot vehicle, LocalDate today) {
        Objects.requireNonNull(adrClasses, "adrClasses must not be null");
        return evaluate(requirements.requirementsFor(adrClasses), vehicle, today, true);
    }

    /**
     * Check a vehicle for general freight: universal requirements only, findings reported as warnings.
     */
    public EquipmentComplianceResult checkGeneralFreight(VehicleSnapshot vehicle, LocalDate today) {
        return evaluate(requirements.requirementsFor(Collections.singleton(HazardClassTable.ALL_CLASSES)),
                vehicle, today, false);
    }

    private EquipmentComplianceResult evaluate(List<EquipmentRequirement> required, VehicleSnapshot vehicle,
                                               LocalDate today, boolean dangerousGoods) {
        Objects.requireNonNull(vehicle, "vehicle must not be null");
        Objects.requireNonNull(today, "today must not be null");

        List<EquipmentFinding> findings = new ArrayList<>();
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (EquipmentRequirement requirement : required) {
            VehicleEquipmentRecord best = bestRecord(vehicle, requirement.getEquipmentTypeId(), today);
            EquipmentStatus status = classify(best, today);
            findings.add(new EquipmentFinding(requirement.getEquipmentTypeId(), requirement.getName(),
                    requirement.getAdrClass(), requirement.getMinimumStandard(), status,
                    best != null ? best.getSerialNumber() : null,
                    best != null ? best.getExpiryDate() : null,
                    best != null ? best.getNextInspectionDate() : null));

            String name = requirement.getName();
            switch (status) {
                case MISSING:
                    issues.add("Missing required equipment: " + name);
                    break;
                case EXPIRED:
                    issues.add("Expired equipment: " + name + " (expired " + best.getExpiryDate() + ")");
                    break;
                case INSPECTION_OVERDUE:
                    issues.add("Inspection overdue: " + name + " (due " + best.getNextInspectionDate() + ")");
                    break;
                default:
                    if (ExpiryState.of(best.getExpiryDate(), today, expiryWarningDays) == ExpiryState.EXPIRING_SOON) {
                        warnings.add("Equipment expiring soon: " + name + " (expires " + best.getExpiryDate() + ")");
                    }
                    break;
            }
        }

        Double margin = null;
        if (dangerousGoods) {
            margin = checkExtinguisherCapacity(vehicle, today, warnings);
        }

        List<String> critical = dangerousGoods ? issues : Collections.emptyList();
        if (!dangerousGoods) {
            warnings.addAll(0, issues);
        }
        EquipmentComplianceResult result = new EquipmentComplianceResult(findings, critical, warnings, margin);
        LOG.fine(() -> "Equipment check for " + vehicle.getLabel() + ": " + result);
        return result;
    }

    private VehicleEquipmentRecord bestRecord(VehicleSnapshot vehicle, String equipmentTypeId, LocalDate today) {
        VehicleEquipmentRecord bestCompliant = null;
        VehicleEquipmentRecord bestOther = null;
        for (VehicleEquipmentRecord record : vehicle.getEquipment()) {
            if (!record.isActive() || !equipmentTypeId.equals(record.getEquipmentTypeId())) {
                continue;
            }
            if (record.isCompliant(today)) {
                bestCompliant = better(bestCompliant, record);
            } else {
                bestOther = better(bestOther, record);
            }
        }
        return bestCompliant != null ? bestCompliant : bestOther;
    }

    private static VehicleEquipmentRecord better(VehicleEquipmentRecord current, VehicleEquipmentRecord candidate) {
        if (current == null) {
            return candidate;
        }
        return LATEST_EXPIRY_FIRST.compare(candidate, current) < 0 ? candidate : current;
    }

    private static EquipmentStatus classify(VehicleEquipmentRecord record, LocalDate today) {
        if (record == null) {
            return EquipmentStatus.MISSING;
        }
        if (record.isExpired(today)) {
            return EquipmentStatus.EXPIRED;
        }
        if (record.isInspectionOverdue(today)) {
            return EquipmentStatus.INSPECTION_OVERDUE;
        }
        return EquipmentStatus.COMPLIANT;
    }

    /**
     * Compares declared extinguisher capacity with the mass category requirement.
     * Returns the surplus in percent, or null when nothing was declared or the vehicle falls short.
     */
    private Double checkExtinguisherCapacity(VehicleSnapshot vehicle, LocalDate today, List<String> warnings) {
        if (!vehicle.hasCapacity()) {
            return null;
        }
        double totalCapacity = 0.0;
        double largestUnit = 0.0;
        int units = 0;
        boolean declared = false;
        for (VehicleEquipmentRecord record : vehicle.getEquipment()) {
            if (!FIRE_EXTINGUISHER.equals(record.getEquipmentTypeId()) || !record.isCompliant(today)) {
                continue;
            }
            units++;
            if (record.getCapacityKg() != null) {
                declared = true;
                totalCapacity += record.getCapacityKg();
                largestUnit = Math.max(largestUnit, record.getCapacityKg());
            }
        }
        if (!declared) {
            return null;
        }

        FireExtinguisherRequirement requirement = requirementFor(vehicle.getCapacityKg());
        if (requirement == null) {
            return null;
        }

        if (units < requirement.getMinimumUnits()) {
            warnings.add(String.format("Fire extinguishers: %d installed, %d required for this vehicle category",
                    units, requirement.getMinimumUnits()));
            return null;
        }
        if (totalCapacity < requirement.getTotalCapacityKg()) {
            warnings.add(String.format("Fire extinguisher capacity %.1f kg below the %.1f kg required",
                    totalCapacity, requirement.getTotalCapacityKg()));
            return null;
        }
        if (requirement.getLargestUnitKg() != null && largestUnit < requirement.getLargestUnitKg()) {
            warnings.add(String.format("Largest fire extinguisher is %.1f kg, at least one of %.1f kg required",
                    largestUnit, requirement.getLargestUnitKg()));
            return null;
        }
        return (totalCapacity - requirement.getTotalCapacityKg()) * 100.0 / requirement.getTotalCapacityKg();
    }

    private FireExtinguisherRequirement requirementFor(double vehicleMassKg) {
        for (FireExtinguisherRequirement requirement : extinguisherRequirements) {
            if (requirement.appliesTo(vehicleMassKg)) {
                return requirement;
            }
        }
        return null;
    }
}
