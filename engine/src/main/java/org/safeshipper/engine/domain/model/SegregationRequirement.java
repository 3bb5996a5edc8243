package org.safeshipper.engine.domain.model;

import java.util.Objects;

/**
 * Physical separation needed between two dangerous goods loaded on one vehicle.
 */
public final class SegregationRequirement {

    private final String firstUnNumber;
    private final String firstClass;
    private final String secondUnNumber;
    private final String secondClass;
    private final SegregationLevel level;
    private final String notes;

    public SegregationRequirement(String firstUnNumber, String firstClass,
                                  String secondUnNumber, String secondClass,
                                  SegregationLevel level, String notes) {
        this.firstUnNumber = firstUnNumber;
        this.firstClass = Objects.requireNonNull(firstClass, "firstClass must not be null");
        this.secondUnNumber = secondUnNumber;
        this.secondClass = Objects.requireNonNull(secondClass, "secondClass must not be null");
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.notes = notes;
    }

    public String getFirstUnNumber() {
        return firstUnNumber;
    }

    public String getFirstClass() {
        return firstClass;
    }

    public String getSecondUnNumber() {
        return secondUnNumber;
    }

    public String getSecondClass() {
        return secondClass;
    }

    public SegregationLevel getLevel() {
        return level;
    }

    public int getMinimumDistanceMetres() {
        return level.getMinimumDistanceMetres();
    }

    public String getMethod() {
        return level.getMethod();
    }

    public String getNotes() {
        return notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SegregationRequirement)) {
            return false;
        }
        SegregationRequirement that = (SegregationRequirement) o;
        return Objects.equals(firstUnNumber, that.firstUnNumber)
                && firstClass.equals(that.firstClass)
                && Objects.equals(secondUnNumber, that.secondUnNumber)
                && secondClass.equals(that.secondClass)
                && level == that.level
                && Objects.equals(notes, that.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(firstUnNumber, firstClass, secondUnNumber, secondClass, level, notes);
    }

    @Override
    public String toString() {
        return String.format("%s (Class %s) / %s (Class %s): %s", firstUnNumber, firstClass,
                secondUnNumber, secondClass, level.getMethod());
    }
}
