package org.safeshipper.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only view of a candidate vehicle.
 */
public final class VehicleSnapshot {

    private final String id;
    private final String registration;
    private final String vehicleType;
    private final Double capacityKg;
    private final Double volumeCapacityL;
    private final Set<String> authorizations;
    private final List<VehicleEquipmentRecord> equipment;

    private VehicleSnapshot(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.registration = builder.registration;
        this.vehicleType = builder.vehicleType;
        this.capacityKg = builder.capacityKg;
        this.volumeCapacityL = builder.volumeCapacityL;
        this.authorizations = Collections.unmodifiableSet(new TreeSet<>(builder.authorizations));
        this.equipment = Collections.unmodifiableList(new ArrayList<>(builder.equipment));
    }

    public String getId() {
        return id;
    }

    public String getRegistration() {
        return registration;
    }

    /**
     * Body type such as SEMI, RIGID or VAN; null when unknown.
     */
    public String getVehicleType() {
        return vehicleType;
    }

    public Double getCapacityKg() {
        return capacityKg;
    }

    public Double getVolumeCapacityL() {
        return volumeCapacityL;
    }

    public Set<String> getAuthorizations() {
        return authorizations;
    }

    public List<VehicleEquipmentRecord> getEquipment() {
        return equipment;
    }

    public boolean hasCapacity() {
        return capacityKg != null && capacityKg > 0;
    }

    public boolean hasAuthorization(String authorization) {
        return authorizations.contains(authorization);
    }

    /**
     * Registration if known, otherwise the id.
     */
    public String getLabel() {
        return registration != null ? registration : id;
    }

    @Override
    public String toString() {
        return String.format("VehicleSnapshot{id='%s', registration='%s', capacityKg=%s, equipment=%d}",
                id, registration, capacityKg, equipment.size());
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    /**
     * Builder for VehicleSnapshot.
     */
    public static final class Builder {
        private String id;
        private String registration;
        private String vehicleType;
        private Double capacityKg;
        private Double volumeCapacityL;
        private Set<String> authorizations = new TreeSet<>();
        private List<VehicleEquipmentRecord> equipment = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder registration(String registration) {
            this.registration = registration;
            return this;
        }

        public Builder vehicleType(String vehicleType) {
            this.vehicleType = vehicleType;
            return this;
        }

        public Builder capacityKg(Double capacityKg) {
            this.capacityKg = capacityKg;
            return this;
        }

        public Builder volumeCapacityL(Double volumeCapacityL) {
            this.volumeCapacityL = volumeCapacityL;
            return this;
        }

        public Builder authorizations(Set<String> authorizations) {
            this.authorizations = authorizations != null ? new TreeSet<>(authorizations) : new TreeSet<>();
            return this;
        }

        public Builder equipment(List<VehicleEquipmentRecord> equipment) {
            this.equipment = equipment != null ? new ArrayList<>(equipment) : new ArrayList<>();
            return this;
        }

        public Builder addEquipment(VehicleEquipmentRecord record) {
            this.equipment.add(Objects.requireNonNull(record, "record must not be null"));
            return this;
        }

        public VehicleSnapshot build() {
            return new VehicleSnapshot(this);
        }
    }
}
