package org.safeshipper.engine.domain.model;

/**
 * States a single validation run moves through.
 * NOT_EVALUATED -> EVALUATING -> one of the terminal verdict states.
 */
public enum ValidationState {
    NOT_EVALUATED,
    EVALUATING,
    FULL,
    COMPATIBLE_WITH_WARNINGS,
    CONDITIONAL,
    INCOMPATIBLE;

    public boolean isTerminal() {
        return this != NOT_EVALUATED && this != EVALUATING;
    }

    public static ValidationState terminalFor(CompatibilityLevel level) {
        switch (level) {
            case FULL:
                return FULL;
            case COMPATIBLE_WITH_WARNINGS:
                return COMPATIBLE_WITH_WARNINGS;
            case CONDITIONAL:
                return CONDITIONAL;
            default:
                return INCOMPATIBLE;
        }
    }
}
