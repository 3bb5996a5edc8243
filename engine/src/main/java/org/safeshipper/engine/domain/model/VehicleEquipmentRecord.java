package org.safeshipper.engine.domain.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One piece of safety equipment fitted to a vehicle.
 */
public final class VehicleEquipmentRecord {

    /**
     * Installation status of the record.
     */
    public enum Status {
        ACTIVE,
        INACTIVE
    }

    private final String equipmentTypeId;
    private final Status status;
    private final LocalDate expiryDate;
    private final LocalDate nextInspectionDate;
    private final String serialNumber;
    private final Double capacityKg;

    private VehicleEquipmentRecord(Builder builder) {
        this.equipmentTypeId = Objects.requireNonNull(builder.equipmentTypeId, "equipmentTypeId must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.expiryDate = builder.expiryDate;
        this.nextInspectionDate = builder.nextInspectionDate;
        this.serialNumber = builder.serialNumber;
        this.capacityKg = builder.capacityKg;
    }

    public String getEquipmentTypeId() {
        return equipmentTypeId;
    }

    public Status getStatus() {
        return status;
    }

    public LocalDate getExpiryDate() {
        return expiryDate;
    }

    public LocalDate getNextInspectionDate() {
        return nextInspectionDate;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    /**
     * Extinguishing agent capacity, only recorded for fire extinguishers.
     */
    public Double getCapacityKg() {
        return capacityKg;
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    public boolean isExpired(LocalDate today) {
        return expiryDate != null && expiryDate.isBefore(today);
    }

    public boolean isInspectionOverdue(LocalDate today) {
        return nextInspectionDate != null && nextInspectionDate.isBefore(today);
    }

    public boolean isCompliant(LocalDate today) {
        return isActive() && !isExpired(today) && !isInspectionOverdue(today);
    }

    @Override
    public String toString() {
        return String.format("VehicleEquipmentRecord{type='%s', serial='%s', status=%s, expiry=%s}",
                equipmentTypeId, serialNumber, status, expiryDate);
    }

    public static Builder builder(String equipmentTypeId) {
        return new Builder().equipmentTypeId(equipmentTypeId);
    }

    /**
     * Builder for VehicleEquipmentRecord.
     */
    public static final class Builder {
        private String equipmentTypeId;
        private Status status = Status.ACTIVE;
        private LocalDate expiryDate;
        private LocalDate nextInspectionDate;
        private String serialNumber;
        private Double capacityKg;

        public Builder equipmentTypeId(String equipmentTypeId) {
            this.equipmentTypeId = equipmentTypeId;
            return this;
        }

        public Builder status(Status status) {
            this.status = status;
            return this;
        }

        public Builder expiryDate(LocalDate expiryDate) {
            this.expiryDate = expiryDate;
            return this;
        }

        public Builder nextInspectionDate(LocalDate nextInspectionDate) {
            this.nextInspectionDate = nextInspectionDate;
            return this;
        }

        public Builder serialNumber(String serialNumber) {
            this.serialNumber = serialNumber;
            return this;
        }

        public Builder capacityKg(Double capacityKg) {
            this.capacityKg = capacityKg;
            return this;
        }

        public VehicleEquipmentRecord build() {
            return new VehicleEquipmentRecord(this);
        }
    }
}
