package org.safeshipper.engine.domain.service;

import org.safeshipper.engine.domain.model.ScoreInputs;
import org.safeshipper.engine.domain.model.ScoringPolicy;

import java.util.logging.Logger;

/**
 * Deduction-based scoring.
 *
 * Score formula (higher = better):
 *   score = 100
 *         - critical_deduction * critical_issues
 *         - warning_deduction * warnings
 *         - missing_deduction * missing_equipment
 *         - expired_deduction * expired_equipment
 *         + min(margin_cap, margin_factor * margin_percent)
 *   clamped to [0, 100]
 */
public final class CompatibilityScorerImpl implements CompatibilityScorer {

    private static final Logger LOG = Logger.getLogger(CompatibilityScorerImpl.class.getName());

    private static final double MAX_SCORE = 100.0;
    private static final double MIN_SCORE = 0.0;

    @Override
    public double score(ScoreInputs inputs, ScoringPolicy policy) {
        double score = MAX_SCORE;
        score -= calculateIssueDeduction(inputs, policy);
        score -= calculateEquipmentDeduction(inputs, policy);
        score += calculateMarginBonus(inputs, policy);

        final double clamped = Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
        LOG.fine(() -> String.format("Scored %s: %.2f", inputs, clamped));
        return clamped;
    }

    private double calculateIssueDeduction(ScoreInputs inputs, ScoringPolicy policy) {
        return policy.getCriticalDeduction() * inputs.getCriticalIssues()
                + policy.getWarningDeduction() * inputs.getWarnings();
    }

    /**
     * Missing and expired equipment are deducted on top of the critical issues they also raise.
     */
    private double calculateEquipmentDeduction(ScoreInputs inputs, ScoringPolicy policy) {
        return policy.getMissingEquipmentDeduction() * inputs.getMissingEquipment()
                + policy.getExpiredEquipmentDeduction() * inputs.getExpiredEquipment();
    }

    private double calculateMarginBonus(ScoreInputs inputs, ScoringPolicy policy) {
        Double margin = inputs.getEquipmentMarginPercent();
        if (margin == null || margin <= 0) {
            return 0.0;
        }
        return Math.min(policy.getMarginBonusCap(), policy.getMarginBonusFactor() * margin);
    }
}
