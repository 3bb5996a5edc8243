package org.safeshipper.engine.reference;

import java.util.Objects;

/**
 * Safety equipment a vehicle must carry for an ADR class, or for every load when the class is ALL_CLASSES.
 */
public final class EquipmentRequirement {

    private final String adrClass;
    private final String equipmentTypeId;
    private final String name;
    private final String minimumStandard;

    public EquipmentRequirement(String adrClass, String equipmentTypeId, String name, String minimumStandard) {
        this.adrClass = Objects.requireNonNull(adrClass, "adrClass must not be null");
        this.equipmentTypeId = Objects.requireNonNull(equipmentTypeId, "equipmentTypeId must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.minimumStandard = minimumStandard;
    }

    public String getAdrClass() {
        return adrClass;
    }

    public String getEquipmentTypeId() {
        return equipmentTypeId;
    }

    public String getName() {
        return name;
    }

    public String getMinimumStandard() {
        return minimumStandard;
    }

    public boolean isUniversal() {
        return HazardClassTable.ALL_CLASSES.equals(adrClass);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EquipmentRequirement)) {
            return false;
        }
        EquipmentRequirement other = (EquipmentRequirement) o;
        return adrClass.equals(other.adrClass)
                && equipmentTypeId.equals(other.equipmentTypeId)
                && name.equals(other.name)
                && Objects.equals(minimumStandard, other.minimumStandard);
    }

    @Override
    public int hashCode() {
        return Objects.hash(adrClass, equipmentTypeId, name, minimumStandard);
    }

    @Override
    public String toString() {
        return String.format("EquipmentRequirement{class=%s, type=%s, standard=%s}", adrClass, equipmentTypeId, minimumStandard);
    }
}
