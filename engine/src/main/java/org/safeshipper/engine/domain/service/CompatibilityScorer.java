package org.safeshipper.engine.domain.service;

import org.safeshipper.engine.domain.model.ScoreInputs;
import org.safeshipper.engine.domain.model.ScoringPolicy;

/**
 * Service for turning validation findings into a 0-100 compatibility score.
 */
public interface CompatibilityScorer {

    /**
     * Calculate the score for a validation outcome.
     * Higher score = better candidate.
     *
     * @param inputs issue and equipment counts of the outcome
     * @param policy deductions and bonus limits
     * @return score clamped to [0, 100]
     */
    double score(ScoreInputs inputs, ScoringPolicy policy);
}
