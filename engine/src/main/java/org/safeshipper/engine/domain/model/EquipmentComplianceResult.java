package org.safeshipper.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Itemised equipment compliance of one vehicle for a set of ADR classes.
 */
public final class EquipmentComplianceResult {

    private final List<EquipmentFinding> findings;
    private final List<String> criticalIssues;
    private final List<String> warnings;
    private final Double extinguisherMarginPercent;

    public EquipmentComplianceResult(List<EquipmentFinding> findings, List<String> criticalIssues,
                                     List<String> warnings, Double extinguisherMarginPercent) {
        this.findings = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(findings, "findings must not be null")));
        this.criticalIssues = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(criticalIssues, "criticalIssues must not be null")));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(warnings, "warnings must not be null")));
        this.extinguisherMarginPercent = extinguisherMarginPercent;
    }

    public List<EquipmentFinding> getFindings() {
        return findings;
    }

    public List<String> getCriticalIssues() {
        return criticalIssues;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Percentage by which installed extinguisher capacity exceeds the requirement,
     * null when capacity was not declared or fell short.
     */
    public Double getExtinguisherMarginPercent() {
        return extinguisherMarginPercent;
    }

    public int getRequiredCount() {
        return findings.size();
    }

    public int getCompliantCount() {
        int count = 0;
        for (EquipmentFinding finding : findings) {
            if (finding.isCompliant()) {
                count++;
            }
        }
        return count;
    }

    /**
     * compliant / required x 100, or 100 when nothing is required.
     */
    public double getCompliancePercentage() {
        if (findings.isEmpty()) {
            return 100.0;
        }
        return getCompliantCount() * 100.0 / findings.size();
    }

    public List<String> getMissingEquipment() {
        return namesWithStatus(EquipmentStatus.MISSING);
    }

    public List<String> getExpiredEquipment() {
        return namesWithStatus(EquipmentStatus.EXPIRED);
    }

    public List<String> getInspectionOverdueEquipment() {
        return namesWithStatus(EquipmentStatus.INSPECTION_OVERDUE);
    }

    public boolean isCompliant() {
        return criticalIssues.isEmpty();
    }

    private List<String> namesWithStatus(EquipmentStatus status) {
        List<String> names = new ArrayList<>();
        for (EquipmentFinding finding : findings) {
            if (finding.getStatus() == status) {
                names.add(finding.getName());
            }
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public String toString() {
        return String.format("EquipmentComplianceResult{%d/%d compliant, critical=%d, warnings=%d}",
                getCompliantCount(), getRequiredCount(), criticalIssues.size(), warnings.size());
    }
}
