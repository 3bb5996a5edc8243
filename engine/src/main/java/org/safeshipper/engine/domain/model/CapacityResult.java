package org.safeshipper.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Weight and volume utilisation of a vehicle for one shipment.
 * Utilisation figures are null when the vehicle does not declare the matching capacity.
 */
public final class CapacityResult {

    private final Double capacityKg;
    private final double loadKg;
    private final Double utilizationPercent;
    private final double excessKg;
    private final Double volumeCapacityL;
    private final double loadVolumeL;
    private final Double volumeUtilizationPercent;
    private final List<String> criticalIssues;
    private final List<String> warnings;

    private CapacityResult(Builder builder) {
        this.capacityKg = builder.capacityKg;
        this.loadKg = builder.loadKg;
        this.utilizationPercent = builder.utilizationPercent;
        this.excessKg = builder.excessKg;
        this.volumeCapacityL = builder.volumeCapacityL;
        this.loadVolumeL = builder.loadVolumeL;
        this.volumeUtilizationPercent = builder.volumeUtilizationPercent;
        this.criticalIssues = Collections.unmodifiableList(new ArrayList<>(builder.criticalIssues));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
    }

    public Double getCapacityKg() {
        return capacityKg;
    }

    public double getLoadKg() {
        return loadKg;
    }

    public Double getUtilizationPercent() {
        return utilizationPercent;
    }

    public double getExcessKg() {
        return excessKg;
    }

    public Double getVolumeCapacityL() {
        return volumeCapacityL;
    }

    public double getLoadVolumeL() {
        return loadVolumeL;
    }

    public Double getVolumeUtilizationPercent() {
        return volumeUtilizationPercent;
    }

    public List<String> getCriticalIssues() {
        return criticalIssues;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean isCapacityKnown() {
        return utilizationPercent != null;
    }

    public boolean isOverloaded() {
        return excessKg > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CapacityResult)) {
            return false;
        }
        CapacityResult that = (CapacityResult) o;
        return Double.compare(loadKg, that.loadKg) == 0
                && Double.compare(excessKg, that.excessKg) == 0
                && Double.compare(loadVolumeL, that.loadVolumeL) == 0
                && Objects.equals(capacityKg, that.capacityKg)
                && Objects.equals(utilizationPercent, that.utilizationPercent)
                && Objects.equals(volumeCapacityL, that.volumeCapacityL)
                && Objects.equals(volumeUtilizationPercent, that.volumeUtilizationPercent)
                && criticalIssues.equals(that.criticalIssues)
                && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacityKg, loadKg, utilizationPercent, excessKg, volumeCapacityL,
                loadVolumeL, volumeUtilizationPercent, criticalIssues, warnings);
    }

    @Override
    public String toString() {
        return String.format("CapacityResult{load=%.2fkg, capacity=%s, utilization=%s}",
                loadKg, capacityKg, utilizationPercent);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Double capacityKg;
        private double loadKg;
        private Double utilizationPercent;
        private double excessKg;
        private Double volumeCapacityL;
        private double loadVolumeL;
        private Double volumeUtilizationPercent;
        private final List<String> criticalIssues = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        public Builder capacityKg(Double capacityKg) {
            this.capacityKg = capacityKg;
            return this;
        }

        public Builder loadKg(double loadKg) {
            this.loadKg = loadKg;
            return this;
        }

        public Builder utilizationPercent(Double utilizationPercent) {
            this.utilizationPercent = utilizationPercent;
            return this;
        }

        public Builder excessKg(double excessKg) {
            this.excessKg = excessKg;
            return this;
        }

        public Builder volumeCapacityL(Double volumeCapacityL) {
            this.volumeCapacityL = volumeCapacityL;
            return this;
        }

        public Builder loadVolumeL(double loadVolumeL) {
            this.loadVolumeL = loadVolumeL;
            return this;
        }

        public Builder volumeUtilizationPercent(Double volumeUtilizationPercent) {
            this.volumeUtilizationPercent = volumeUtilizationPercent;
            return this;
        }

        public Builder addCriticalIssue(String issue) {
            this.criticalIssues.add(Objects.requireNonNull(issue, "issue must not be null"));
            return this;
        }

        public Builder addWarning(String warning) {
            this.warnings.add(Objects.requireNonNull(warning, "warning must not be null"));
            return this;
        }

        public CapacityResult build() {
            return new CapacityResult(this);
        }
    }
}
