package org.safeshipper.engine.domain.model;

/**
 * Coarse verdict of a validation run.
 */
public enum CompatibilityLevel {
    FULL(true),
    COMPATIBLE_WITH_WARNINGS(true),
    CONDITIONAL(false),
    INCOMPATIBLE(false);

    private final boolean compatible;

    CompatibilityLevel(boolean compatible) {
        this.compatible = compatible;
    }

    /**
     * Whether an assignment at this level may go ahead.
     */
    public boolean isCompatible() {
        return compatible;
    }

    /**
     * Derive the level from issue counts.
     * Critical issues always block; warnings block only in strict mode.
     */
    public static CompatibilityLevel from(boolean hasCriticalIssues, boolean hasWarnings, boolean strictMode) {
        if (hasCriticalIssues) {
            return INCOMPATIBLE;
        }
        if (hasWarnings) {
            return strictMode ? CONDITIONAL : COMPATIBLE_WITH_WARNINGS;
        }
        return FULL;
    }
}
