package org.safeshipper.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one shipment line item.
 * Hazard class and UN number are only meaningful when the item is flagged as a dangerous good.
 */
public final class DgItem {

    private final String itemId;
    private final String description;
    private final boolean dangerousGood;
    private final String unNumber;
    private final String hazardClass;
    private final List<String> subsidiaryHazardClasses;
    private final String packingGroup;
    private final int quantity;
    private final Double weightKg;
    private final Double volumeL;
    private final boolean limitedQuantity;
    private final boolean exceptedQuantity;

    private DgItem(Builder builder) {
        this.itemId = Objects.requireNonNull(builder.itemId, "itemId must not be null");
        this.description = builder.description;
        this.dangerousGood = builder.dangerousGood;
        this.unNumber = builder.unNumber;
        this.hazardClass = builder.hazardClass;
        this.subsidiaryHazardClasses = Collections.unmodifiableList(new ArrayList<>(builder.subsidiaryHazardClasses));
        this.packingGroup = builder.packingGroup;
        if (builder.quantity < 0) {
            throw new IllegalArgumentException("quantity must not be negative");
        }
        this.quantity = builder.quantity;
        this.weightKg = builder.weightKg;
        this.volumeL = builder.volumeL;
        this.limitedQuantity = builder.limitedQuantity;
        this.exceptedQuantity = builder.exceptedQuantity;
    }

    public String getItemId() {
        return itemId;
    }

    public String getDescription() {
        return description;
    }

    public boolean isDangerousGood() {
        return dangerousGood;
    }

    public String getUnNumber() {
        return unNumber;
    }

    public String getHazardClass() {
        return hazardClass;
    }

    public List<String> getSubsidiaryHazardClasses() {
        return subsidiaryHazardClasses;
    }

    public String getPackingGroup() {
        return packingGroup;
    }

    public int getQuantity() {
        return quantity;
    }

    public Double getWeightKg() {
        return weightKg;
    }

    public Double getVolumeL() {
        return volumeL;
    }

    public boolean isLimitedQuantity() {
        return limitedQuantity;
    }

    public boolean isExceptedQuantity() {
        return exceptedQuantity;
    }

    public boolean hasHazardClass() {
        return hazardClass != null && !hazardClass.trim().isEmpty();
    }

    public boolean hasUnNumber() {
        return unNumber != null && !unNumber.trim().isEmpty();
    }

    /**
     * Line weight (unit weight times quantity), zero when the weight is unknown.
     */
    public double getLineWeightKg() {
        return weightKg != null ? weightKg * quantity : 0.0;
    }

    /**
     * Line volume (unit volume times quantity), zero when the volume is unknown.
     */
    public double getLineVolumeL() {
        return volumeL != null ? volumeL * quantity : 0.0;
    }

    @Override
    public String toString() {
        return dangerousGood
                ? String.format("DgItem{id='%s', un='%s', class='%s', qty=%d}", itemId, unNumber, hazardClass, quantity)
                : String.format("DgItem{id='%s', general, qty=%d}", itemId, quantity);
    }

    public static Builder builder(String itemId) {
        return new Builder().itemId(itemId);
    }

    /**
     * Builder for DgItem.
     */
    public static final class Builder {
        private String itemId;
        private String description;
        private boolean dangerousGood;
        private String unNumber;
        private String hazardClass;
        private List<String> subsidiaryHazardClasses = new ArrayList<>();
        private String packingGroup;
        private int quantity = 1;
        private Double weightKg;
        private Double volumeL;
        private boolean limitedQuantity;
        private boolean exceptedQuantity;

        public Builder itemId(String itemId) {
            this.itemId = itemId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder dangerousGood(boolean dangerousGood) {
            this.dangerousGood = dangerousGood;
            return this;
        }

        /**
         * Marks the item as a dangerous good with the given UN number and primary class.
         */
        public Builder dangerousGood(String unNumber, String hazardClass) {
            this.dangerousGood = true;
            this.unNumber = unNumber;
            this.hazardClass = hazardClass;
            return this;
        }

        public Builder unNumber(String unNumber) {
            this.unNumber = unNumber;
            return this;
        }

        public Builder hazardClass(String hazardClass) {
            this.hazardClass = hazardClass;
            return this;
        }

        public Builder subsidiaryHazardClasses(List<String> subsidiaryHazardClasses) {
            this.subsidiaryHazardClasses = subsidiaryHazardClasses != null
                    ? new ArrayList<>(subsidiaryHazardClasses)
                    : new ArrayList<>();
            return this;
        }

        public Builder packingGroup(String packingGroup) {
            this.packingGroup = packingGroup;
            return this;
        }

        public Builder quantity(int quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder weightKg(Double weightKg) {
            this.weightKg = weightKg;
            return this;
        }

        public Builder volumeL(Double volumeL) {
            this.volumeL = volumeL;
            return this;
        }

        public Builder limitedQuantity(boolean limitedQuantity) {
            this.limitedQuantity = limitedQuantity;
            return this;
        }

        public Builder exceptedQuantity(boolean exceptedQuantity) {
            this.exceptedQuantity = exceptedQuantity;
            return this;
        }

        public DgItem build() {
            return new DgItem(this);
        }
    }
}
