package org.safeshipper.engine.domain.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Outcome of one equipment requirement against a vehicle's records.
 */
public final class EquipmentFinding {

    private final String equipmentTypeId;
    private final String name;
    private final String adrClass;
    private final String minimumStandard;
    private final EquipmentStatus status;
    private final String serialNumber;
    private final LocalDate expiryDate;
    private final LocalDate nextInspectionDate;

    public EquipmentFinding(String equipmentTypeId, String name, String adrClass, String minimumStandard,
                            EquipmentStatus status, String serialNumber,
                            LocalDate expiryDate, LocalDate nextInspectionDate) {
        this.equipmentTypeId = Objects.requireNonNull(equipmentTypeId, "equipmentTypeId must not be null");
        this.name = name != null ? name : equipmentTypeId;
        this.adrClass = adrClass;
        this.minimumStandard = minimumStandard;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.serialNumber = serialNumber;
        this.expiryDate = expiryDate;
        this.nextInspectionDate = nextInspectionDate;
    }

    public String getEquipmentTypeId() {
        return equipmentTypeId;
    }

    public String getName() {
        return name;
    }

    public String getAdrClass() {
        return adrClass;
    }

    public String getMinimumStandard() {
        return minimumStandard;
    }

    public EquipmentStatus getStatus() {
        return status;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public LocalDate getExpiryDate() {
        return expiryDate;
    }

    public LocalDate getNextInspectionDate() {
        return nextInspectionDate;
    }

    public boolean isCompliant() {
        return status == EquipmentStatus.COMPLIANT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EquipmentFinding)) {
            return false;
        }
        EquipmentFinding that = (EquipmentFinding) o;
        return equipmentTypeId.equals(that.equipmentTypeId)
                && name.equals(that.name)
                && Objects.equals(adrClass, that.adrClass)
                && Objects.equals(minimumStandard, that.minimumStandard)
                && status == that.status
                && Objects.equals(serialNumber, that.serialNumber)
                && Objects.equals(expiryDate, that.expiryDate)
                && Objects.equals(nextInspectionDate, that.nextInspectionDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(equipmentTypeId, name, adrClass, minimumStandard, status,
                serialNumber, expiryDate, nextInspectionDate);
    }

    @Override
    public String toString() {
        return name + ": " + status;
    }
}
