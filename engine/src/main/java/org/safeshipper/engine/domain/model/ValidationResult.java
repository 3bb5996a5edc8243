package org.safeshipper.engine.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The verdict of one validation call. Built once and never mutated afterwards.
 * Two results with the same content are equal, which makes repeated calls comparable.
 */
public final class ValidationResult {

    private final String shipmentId;
    private final SubjectType subjectType;
    private final String subjectId;
    private final ValidationType validationType;
    private final CompatibilityLevel compatibilityLevel;
    private final List<String> criticalIssues;
    private final List<String> warnings;
    private final List<String> missingEquipment;
    private final List<String> expiredEquipment;
    private final List<EquipmentFinding> equipmentFindings;
    private final Double equipmentCompliancePercentage;
    private final List<SegregationRequirement> segregationRequirements;
    private final CapacityResult capacity;
    private final DriverQualificationResult driverQualification;
    private final double score;
    private final List<String> recommendations;
    private final boolean manualReviewRequired;
    private final Instant evaluatedAt;

    private ValidationResult(Builder builder) {
        this.shipmentId = Objects.requireNonNull(builder.shipmentId, "shipmentId must not be null");
        this.subjectType = Objects.requireNonNull(builder.subjectType, "subjectType must not be null");
        this.subjectId = Objects.requireNonNull(builder.subjectId, "subjectId must not be null");
        this.validationType = Objects.requireNonNull(builder.validationType, "validationType must not be null");
        this.compatibilityLevel = Objects.requireNonNull(builder.compatibilityLevel, "compatibilityLevel must not be null");
        this.criticalIssues = copy(builder.criticalIssues);
        this.warnings = copy(builder.warnings);
        this.missingEquipment = copy(builder.missingEquipment);
        this.expiredEquipment = copy(builder.expiredEquipment);
        this.equipmentFindings = copy(builder.equipmentFindings);
        this.equipmentCompliancePercentage = builder.equipmentCompliancePercentage;
        this.segregationRequirements = copy(builder.segregationRequirements);
        this.capacity = builder.capacity;
        this.driverQualification = builder.driverQualification;
        this.score = builder.score;
        this.recommendations = copy(builder.recommendations);
        this.manualReviewRequired = builder.manualReviewRequired;
        this.evaluatedAt = Objects.requireNonNull(builder.evaluatedAt, "evaluatedAt must not be null");
    }

    private static <T> List<T> copy(List<T> values) {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    public String getShipmentId() {
        return shipmentId;
    }

    public SubjectType getSubjectType() {
        return subjectType;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public ValidationType getValidationType() {
        return validationType;
    }

    public boolean isCompatible() {
        return compatibilityLevel.isCompatible();
    }

    public CompatibilityLevel getCompatibilityLevel() {
        return compatibilityLevel;
    }

    public ValidationState getState() {
        return ValidationState.terminalFor(compatibilityLevel);
    }

    public List<String> getCriticalIssues() {
        return criticalIssues;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<String> getMissingEquipment() {
        return missingEquipment;
    }

    public List<String> getExpiredEquipment() {
        return expiredEquipment;
    }

    public List<EquipmentFinding> getEquipmentFindings() {
        return equipmentFindings;
    }

    /**
     * Null when no equipment check ran (driver-only validation).
     */
    public Double getEquipmentCompliancePercentage() {
        return equipmentCompliancePercentage;
    }

    public List<SegregationRequirement> getSegregationRequirements() {
        return segregationRequirements;
    }

    public CapacityResult getCapacity() {
        return capacity;
    }

    public DriverQualificationResult getDriverQualification() {
        return driverQualification;
    }

    public double getScore() {
        return score;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public boolean isManualReviewRequired() {
        return manualReviewRequired;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValidationResult)) {
            return false;
        }
        ValidationResult that = (ValidationResult) o;
        return Double.compare(score, that.score) == 0
                && manualReviewRequired == that.manualReviewRequired
                && shipmentId.equals(that.shipmentId)
                && subjectType == that.subjectType
                && subjectId.equals(that.subjectId)
                && validationType == that.validationType
                && compatibilityLevel == that.compatibilityLevel
                && criticalIssues.equals(that.criticalIssues)
                && warnings.equals(that.warnings)
                && missingEquipment.equals(that.missingEquipment)
                && expiredEquipment.equals(that.expiredEquipment)
                && equipmentFindings.equals(that.equipmentFindings)
                && Objects.equals(equipmentCompliancePercentage, that.equipmentCompliancePercentage)
                && segregationRequirements.equals(that.segregationRequirements)
                && Objects.equals(capacity, that.capacity)
                && Objects.equals(driverQualification, that.driverQualification)
                && recommendations.equals(that.recommendations)
                && evaluatedAt.equals(that.evaluatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shipmentId, subjectType, subjectId, validationType, compatibilityLevel,
                criticalIssues, warnings, missingEquipment, expiredEquipment, equipmentFindings,
                equipmentCompliancePercentage, segregationRequirements, capacity, driverQualification,
                score, recommendations, manualReviewRequired, evaluatedAt);
    }

    @Override
    public String toString() {
        return String.format("ValidationResult{shipment=%s, %s=%s, level=%s, score=%.1f, critical=%d, warnings=%d}",
                shipmentId, subjectType, subjectId, compatibilityLevel, score,
                criticalIssues.size(), warnings.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String shipmentId;
        private SubjectType subjectType;
        private String subjectId;
        private ValidationType validationType;
        private CompatibilityLevel compatibilityLevel;
        private final List<String> criticalIssues = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> missingEquipment = new ArrayList<>();
        private final List<String> expiredEquipment = new ArrayList<>();
        private final List<EquipmentFinding> equipmentFindings = new ArrayList<>();
        private Double equipmentCompliancePercentage;
        private final List<SegregationRequirement> segregationRequirements = new ArrayList<>();
        private CapacityResult capacity;
        private DriverQualificationResult driverQualification;
        private double score;
        private final List<String> recommendations = new ArrayList<>();
        private boolean manualReviewRequired;
        private Instant evaluatedAt;

        public Builder shipmentId(String shipmentId) {
            this.shipmentId = shipmentId;
            return this;
        }

        public Builder subject(SubjectType subjectType, String subjectId) {
            this.subjectType = subjectType;
            this.subjectId = subjectId;
            return this;
        }

        public Builder validationType(ValidationType validationType) {
            this.validationType = validationType;
            return this;
        }

        public Builder compatibilityLevel(CompatibilityLevel compatibilityLevel) {
            this.compatibilityLevel = compatibilityLevel;
            return this;
        }

        public Builder addCriticalIssues(Collection<String> issues) {
            this.criticalIssues.addAll(issues);
            return this;
        }

        public Builder addWarnings(Collection<String> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public Builder addMissingEquipment(Collection<String> names) {
            this.missingEquipment.addAll(names);
            return this;
        }

        public Builder addExpiredEquipment(Collection<String> names) {
            this.expiredEquipment.addAll(names);
            return this;
        }

        public Builder addEquipmentFindings(Collection<EquipmentFinding> findings) {
            this.equipmentFindings.addAll(findings);
            return this;
        }

        public Builder equipmentCompliancePercentage(Double equipmentCompliancePercentage) {
            this.equipmentCompliancePercentage = equipmentCompliancePercentage;
            return this;
        }

        public Builder addSegregationRequirements(Collection<SegregationRequirement> requirements) {
            this.segregationRequirements.addAll(requirements);
            return this;
        }

        public Builder capacity(CapacityResult capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder driverQualification(DriverQualificationResult driverQualification) {
            this.driverQualification = driverQualification;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder addRecommendations(Collection<String> recommendations) {
            this.recommendations.addAll(recommendations);
            return this;
        }

        public Builder manualReviewRequired(boolean manualReviewRequired) {
            this.manualReviewRequired = manualReviewRequired;
            return this;
        }

        public Builder evaluatedAt(Instant evaluatedAt) {
            this.evaluatedAt = evaluatedAt;
            return this;
        }

        public ValidationResult build() {
            return new ValidationResult(this);
        }
    }
}
