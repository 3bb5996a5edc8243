package org.safeshipper.engine.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Compact dangerous-goods profile of a shipment. Derived fresh on every validation call.
 */
public final class DgProfile {

    private final SortedSet<String> hazardClasses;
    private final SortedSet<String> adrClasses;
    private final SortedSet<String> unNumbers;
    private final SortedSet<String> packingGroups;
    private final List<DgEntry> entries;
    private final double dangerousGoodsWeightKg;
    private final double dangerousGoodsVolumeL;
    private final double totalWeightKg;
    private final double totalVolumeL;
    private final String highestRiskClass;
    private final int dangerousItemCount;
    private final int limitedQuantityCount;
    private final int exceptedQuantityCount;
    private final List<String> integrityIssues;
    private final List<String> referenceGaps;

    private DgProfile(Builder builder) {
        this.hazardClasses = Collections.unmodifiableSortedSet(new TreeSet<>(builder.hazardClasses));
        this.adrClasses = Collections.unmodifiableSortedSet(new TreeSet<>(builder.adrClasses));
        this.unNumbers = Collections.unmodifiableSortedSet(new TreeSet<>(builder.unNumbers));
        this.packingGroups = Collections.unmodifiableSortedSet(new TreeSet<>(builder.packingGroups));
        List<DgEntry> sortedEntries = new ArrayList<>(new TreeSet<>(builder.entries));
        this.entries = Collections.unmodifiableList(sortedEntries);
        this.dangerousGoodsWeightKg = builder.dangerousGoodsWeightKg;
        this.dangerousGoodsVolumeL = builder.dangerousGoodsVolumeL;
        this.totalWeightKg = builder.totalWeightKg;
        this.totalVolumeL = builder.totalVolumeL;
        this.highestRiskClass = builder.highestRiskClass;
        this.dangerousItemCount = builder.dangerousItemCount;
        this.limitedQuantityCount = builder.limitedQuantityCount;
        this.exceptedQuantityCount = builder.exceptedQuantityCount;
        this.integrityIssues = sortedCopy(builder.integrityIssues);
        this.referenceGaps = sortedCopy(builder.referenceGaps);
    }

    private static List<String> sortedCopy(Collection<String> values) {
        List<String> copy = new ArrayList<>(values);
        Collections.sort(copy);
        return Collections.unmodifiableList(copy);
    }

    public SortedSet<String> getHazardClasses() {
        return hazardClasses;
    }

    public SortedSet<String> getAdrClasses() {
        return adrClasses;
    }

    public SortedSet<String> getUnNumbers() {
        return unNumbers;
    }

    public SortedSet<String> getPackingGroups() {
        return packingGroups;
    }

    public List<DgEntry> getEntries() {
        return entries;
    }

    public double getDangerousGoodsWeightKg() {
        return dangerousGoodsWeightKg;
    }

    public double getDangerousGoodsVolumeL() {
        return dangerousGoodsVolumeL;
    }

    /**
     * Weight of the whole shipment, dangerous and general items together.
     */
    public double getTotalWeightKg() {
        return totalWeightKg;
    }

    public double getTotalVolumeL() {
        return totalVolumeL;
    }

    /**
     * Hazard class with the highest risk rank, null when the shipment carries no dangerous goods.
     */
    public String getHighestRiskClass() {
        return highestRiskClass;
    }

    public int getDangerousItemCount() {
        return dangerousItemCount;
    }

    public int getLimitedQuantityCount() {
        return limitedQuantityCount;
    }

    public int getExceptedQuantityCount() {
        return exceptedQuantityCount;
    }

    /**
     * Dangerous-goods items missing mandatory data.
     */
    public List<String> getIntegrityIssues() {
        return integrityIssues;
    }

    /**
     * Observed hazard classes the reference data does not know.
     */
    public List<String> getReferenceGaps() {
        return referenceGaps;
    }

    public boolean containsDangerousGoods() {
        return dangerousItemCount > 0;
    }

    /**
     * Main hazard classes ("2" for "2.1"), used for driver qualification.
     */
    public SortedSet<String> getMainHazardClasses() {
        TreeSet<String> main = new TreeSet<>();
        for (String hazardClass : hazardClasses) {
            int dot = hazardClass.indexOf('.');
            main.add(dot > 0 ? hazardClass.substring(0, dot) : hazardClass);
        }
        return Collections.unmodifiableSortedSet(main);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DgProfile)) {
            return false;
        }
        DgProfile other = (DgProfile) o;
        return Double.compare(dangerousGoodsWeightKg, other.dangerousGoodsWeightKg) == 0
                && Double.compare(dangerousGoodsVolumeL, other.dangerousGoodsVolumeL) == 0
                && Double.compare(totalWeightKg, other.totalWeightKg) == 0
                && Double.compare(totalVolumeL, other.totalVolumeL) == 0
                && dangerousItemCount == other.dangerousItemCount
                && limitedQuantityCount == other.limitedQuantityCount
                && exceptedQuantityCount == other.exceptedQuantityCount
                && hazardClasses.equals(other.hazardClasses)
                && adrClasses.equals(other.adrClasses)
                && unNumbers.equals(other.unNumbers)
                && packingGroups.equals(other.packingGroups)
                && entries.equals(other.entries)
                && Objects.equals(highestRiskClass, other.highestRiskClass)
                && integrityIssues.equals(other.integrityIssues)
                && referenceGaps.equals(other.referenceGaps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hazardClasses, adrClasses, unNumbers, entries, totalWeightKg, highestRiskClass);
    }

    @Override
    public String toString() {
        return String.format("DgProfile{classes=%s, adr=%s, un=%s, dgWeight=%.1fkg, totalWeight=%.1fkg, highestRisk=%s}",
                hazardClasses, adrClasses, unNumbers, dangerousGoodsWeightKg, totalWeightKg, highestRiskClass);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for DgProfile.
     */
    public static final class Builder {
        private final SortedSet<String> hazardClasses = new TreeSet<>();
        private final SortedSet<String> adrClasses = new TreeSet<>();
        private final SortedSet<String> unNumbers = new TreeSet<>();
        private final SortedSet<String> packingGroups = new TreeSet<>();
        private final List<DgEntry> entries = new ArrayList<>();
        private final List<String> integrityIssues = new ArrayList<>();
        private final List<String> referenceGaps = new ArrayList<>();
        private double dangerousGoodsWeightKg;
        private double dangerousGoodsVolumeL;
        private double totalWeightKg;
        private double totalVolumeL;
        private String highestRiskClass;
        private int dangerousItemCount;
        private int limitedQuantityCount;
        private int exceptedQuantityCount;

        public Builder addHazardClass(String hazardClass) {
            this.hazardClasses.add(hazardClass);
            return this;
        }

        public Builder addAdrClass(String adrClass) {
            this.adrClasses.add(adrClass);
            return this;
        }

        public Builder addUnNumber(String unNumber) {
            this.unNumbers.add(unNumber);
            return this;
        }

        public Builder addPackingGroup(String packingGroup) {
            this.packingGroups.add(packingGroup);
            return this;
        }

        public Builder addEntry(DgEntry entry) {
            this.entries.add(entry);
            return this;
        }

        public Builder addIntegrityIssue(String issue) {
            this.integrityIssues.add(issue);
            return this;
        }

        public Builder addReferenceGap(String gap) {
            if (!this.referenceGaps.contains(gap)) {
                this.referenceGaps.add(gap);
            }
            return this;
        }

        public Builder dangerousGoodsWeightKg(double dangerousGoodsWeightKg) {
            this.dangerousGoodsWeightKg = dangerousGoodsWeightKg;
            return this;
        }

        public Builder dangerousGoodsVolumeL(double dangerousGoodsVolumeL) {
            this.dangerousGoodsVolumeL = dangerousGoodsVolumeL;
            return this;
        }

        public Builder totalWeightKg(double totalWeightKg) {
            this.totalWeightKg = totalWeightKg;
            return this;
        }

        public Builder totalVolumeL(double totalVolumeL) {
            this.totalVolumeL = totalVolumeL;
            return this;
        }

        public Builder highestRiskClass(String highestRiskClass) {
            this.highestRiskClass = highestRiskClass;
            return this;
        }

        public Builder dangerousItemCount(int dangerousItemCount) {
            this.dangerousItemCount = dangerousItemCount;
            return this;
        }

        public Builder limitedQuantityCount(int limitedQuantityCount) {
            this.limitedQuantityCount = limitedQuantityCount;
            return this;
        }

        public Builder exceptedQuantityCount(int exceptedQuantityCount) {
            this.exceptedQuantityCount = exceptedQuantityCount;
            return this;
        }

        public DgProfile build() {
            return new DgProfile(this);
        }
    }
}
