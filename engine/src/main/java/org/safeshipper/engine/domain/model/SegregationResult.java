package org.safeshipper.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Segregation verdict for the dangerous goods of one shipment.
 * Conflicts are prohibited combinations; requirements are combinations allowed with separation.
 */
public final class SegregationResult {

    private final List<String> conflicts;
    private final List<SegregationRequirement> requirements;
    private final List<String> warnings;
    private final boolean manualReviewRequired;

    public SegregationResult(List<String> conflicts, List<SegregationRequirement> requirements,
                             List<String> warnings, boolean manualReviewRequired) {
        this.conflicts = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(conflicts, "conflicts must not be null")));
        this.requirements = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(requirements, "requirements must not be null")));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(warnings, "warnings must not be null")));
        this.manualReviewRequired = manualReviewRequired;
    }

    public static SegregationResult compatible() {
        return new SegregationResult(Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), false);
    }

    public boolean isCompatible() {
        return conflicts.isEmpty();
    }

    public List<String> getConflicts() {
        return conflicts;
    }

    public List<SegregationRequirement> getRequirements() {
        return requirements;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean isManualReviewRequired() {
        return manualReviewRequired;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SegregationResult)) {
            return false;
        }
        SegregationResult that = (SegregationResult) o;
        return manualReviewRequired == that.manualReviewRequired
                && conflicts.equals(that.conflicts)
                && requirements.equals(that.requirements)
                && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conflicts, requirements, warnings, manualReviewRequired);
    }

    @Override
    public String toString() {
        return "SegregationResult{compatible=" + isCompatible()
                + ", conflicts=" + conflicts
                + ", requirements=" + requirements.size()
                + ", manualReview=" + manualReviewRequired + '}';
    }
}
