package org.safeshipper.engine.domain.model;

import java.util.Objects;

/**
 * A vehicle or driver candidate together with its validation verdict.
 * Natural order is best first: higher score, then candidate id.
 */
public final class RankedCandidate implements Comparable<RankedCandidate> {

    private final String candidateId;
    private final String label;
    private final ValidationResult result;

    public RankedCandidate(String candidateId, String label, ValidationResult result) {
        this.candidateId = Objects.requireNonNull(candidateId, "candidateId must not be null");
        this.label = label != null ? label : candidateId;
        this.result = Objects.requireNonNull(result, "result must not be null");
    }

    public String getCandidateId() {
        return candidateId;
    }

    public String getLabel() {
        return label;
    }

    public ValidationResult getResult() {
        return result;
    }

    public double getScore() {
        return result.getScore();
    }

    public CompatibilityLevel getCompatibilityLevel() {
        return result.getCompatibilityLevel();
    }

    @Override
    public int compareTo(RankedCandidate other) {
        int byScore = Double.compare(other.getScore(), getScore());
        return byScore != 0 ? byScore : candidateId.compareTo(other.candidateId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RankedCandidate)) {
            return false;
        }
        RankedCandidate that = (RankedCandidate) o;
        return candidateId.equals(that.candidateId) && label.equals(that.label) && result.equals(that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidateId, label, result);
    }

    @Override
    public String toString() {
        return String.format("RankedCandidate{%s, score=%.1f, level=%s}", label, getScore(), getCompatibilityLevel());
    }
}
