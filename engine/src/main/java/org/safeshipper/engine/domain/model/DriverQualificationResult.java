package org.safeshipper.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Driver-scoped verdict: qualification per required hazard class plus the issues found.
 */
public final class DriverQualificationResult {

    private final String driverId;
    private final List<String> criticalIssues;
    private final List<String> warnings;
    private final Map<String, Boolean> qualifiedClasses;
    private final double compliancePercentage;
    private final QualificationLevel qualificationLevel;

    private DriverQualificationResult(Builder builder) {
        this.driverId = Objects.requireNonNull(builder.driverId, "driverId must not be null");
        this.criticalIssues = Collections.unmodifiableList(new ArrayList<>(builder.criticalIssues));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
        this.qualifiedClasses = Collections.unmodifiableMap(new TreeMap<>(builder.qualifiedClasses));
        this.compliancePercentage = builder.compliancePercentage;
        this.qualificationLevel = Objects.requireNonNull(builder.qualificationLevel, "qualificationLevel must not be null");
    }

    public String getDriverId() {
        return driverId;
    }

    /**
     * True when nothing blocks the driver; warnings do not count.
     */
    public boolean isOverallQualified() {
        return criticalIssues.isEmpty();
    }

    public List<String> getCriticalIssues() {
        return criticalIssues;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Required main hazard class to whether the driver holds a usable certificate for it.
     */
    public Map<String, Boolean> getQualifiedClasses() {
        return qualifiedClasses;
    }

    public double getCompliancePercentage() {
        return compliancePercentage;
    }

    public QualificationLevel getQualificationLevel() {
        return qualificationLevel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DriverQualificationResult)) {
            return false;
        }
        DriverQualificationResult that = (DriverQualificationResult) o;
        return Double.compare(compliancePercentage, that.compliancePercentage) == 0
                && driverId.equals(that.driverId)
                && criticalIssues.equals(that.criticalIssues)
                && warnings.equals(that.warnings)
                && qualifiedClasses.equals(that.qualifiedClasses)
                && qualificationLevel == that.qualificationLevel;
    }

    @Override
    public int hashCode() {
        return Objects.hash(driverId, criticalIssues, warnings, qualifiedClasses, compliancePercentage, qualificationLevel);
    }

    @Override
    public String toString() {
        return "DriverQualificationResult{driver=" + driverId
                + ", qualified=" + isOverallQualified()
                + ", level=" + qualificationLevel
                + ", classes=" + qualifiedClasses
                + ", compliance=" + compliancePercentage + '}';
    }

    public static Builder builder(String driverId) {
        return new Builder(driverId);
    }

    public static final class Builder {
        private final String driverId;
        private final List<String> criticalIssues = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final Map<String, Boolean> qualifiedClasses = new TreeMap<>();
        private double compliancePercentage;
        private QualificationLevel qualificationLevel = QualificationLevel.INSUFFICIENT;

        private Builder(String driverId) {
            this.driverId = driverId;
        }

        public Builder addCriticalIssue(String issue) {
            this.criticalIssues.add(Objects.requireNonNull(issue, "issue must not be null"));
            return this;
        }

        public Builder addWarning(String warning) {
            this.warnings.add(Objects.requireNonNull(warning, "warning must not be null"));
            return this;
        }

        public Builder qualifiedClass(String hazardClass, boolean qualified) {
            this.qualifiedClasses.put(hazardClass, qualified);
            return this;
        }

        public Builder compliancePercentage(double compliancePercentage) {
            this.compliancePercentage = compliancePercentage;
            return this;
        }

        public Builder qualificationLevel(QualificationLevel qualificationLevel) {
            this.qualificationLevel = qualificationLevel;
            return this;
        }

        public boolean hasCriticalIssues() {
            return !criticalIssues.isEmpty();
        }

        public DriverQualificationResult build() {
            return new DriverQualificationResult(this);
        }
    }
}
