package org.safeshipper.engine.reference;

import org.safeshipper.engine.domain.model.SegregationLevel;

import java.util.Objects;

/**
 * Class-to-class segregation rule. The pair is stored in canonical order so a rule
 * reads the same whichever side it is looked up from.
 */
public final class SegregationRule {

    private final String firstClass;
    private final String secondClass;
    private final SegregationLevel level;
    private final String notes;

    public SegregationRule(String classA, String classB, SegregationLevel level, String notes) {
        Objects.requireNonNull(classA, "classA must not be null");
        Objects.requireNonNull(classB, "classB must not be null");
        if (classA.compareTo(classB) <= 0) {
            this.firstClass = classA;
            this.secondClass = classB;
        } else {
            this.firstClass = classB;
            this.secondClass = classA;
        }
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.notes = notes;
    }

    static String pairKey(String classA, String classB) {
        return classA.compareTo(classB) <= 0 ? classA + "|" + classB : classB + "|" + classA;
    }

    String key() {
        return pairKey(firstClass, secondClass);
    }

    public String getFirstClass() {
        return firstClass;
    }

    public String getSecondClass() {
        return secondClass;
    }

    public SegregationLevel getLevel() {
        return level;
    }

    public String getNotes() {
        return notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SegregationRule)) {
            return false;
        }
        SegregationRule other = (SegregationRule) o;
        return firstClass.equals(other.firstClass)
                && secondClass.equals(other.secondClass)
                && level == other.level
                && Objects.equals(notes, other.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(firstClass, secondClass, level, notes);
    }

    @Override
    public String toString() {
        return String.format("SegregationRule{%s vs %s: %s}", firstClass, secondClass, level);
    }
}
