package org.safeshipper.engine.domain.model;

/**
 * Counts a compatibility score is computed from.
 */
public final class ScoreInputs {

    private final int criticalIssues;
    private final int warnings;
    private final int missingEquipment;
    private final int expiredEquipment;
    private final Double equipmentMarginPercent;

    public ScoreInputs(int criticalIssues, int warnings, int missingEquipment, int expiredEquipment,
                       Double equipmentMarginPercent) {
        if (criticalIssues < 0 || warnings < 0 || missingEquipment < 0 || expiredEquipment < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        this.criticalIssues = criticalIssues;
        this.warnings = warnings;
        this.missingEquipment = missingEquipment;
        this.expiredEquipment = expiredEquipment;
        this.equipmentMarginPercent = equipmentMarginPercent;
    }

    public int getCriticalIssues() {
        return criticalIssues;
    }

    public int getWarnings() {
        return warnings;
    }

    public int getMissingEquipment() {
        return missingEquipment;
    }

    public int getExpiredEquipment() {
        return expiredEquipment;
    }

    /**
     * Headroom above the minimum equipment requirement in percent, null when not known.
     */
    public Double getEquipmentMarginPercent() {
        return equipmentMarginPercent;
    }

    @Override
    public String toString() {
        return String.format("ScoreInputs{critical=%d, warnings=%d, missing=%d, expired=%d, margin=%s}",
                criticalIssues, warnings, missingEquipment, expiredEquipment, equipmentMarginPercent);
    }
}
