package org.safeshipper.engine.domain.model;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A distinct dangerous good present in a shipment: UN number plus its primary and subsidiary classes.
 */
public final class DgEntry implements Comparable<DgEntry> {

    private final String unNumber;
    private final String primaryClass;
    private final SortedSet<String> subsidiaryClasses;

    public DgEntry(String unNumber, String primaryClass, Iterable<String> subsidiaryClasses) {
        this.unNumber = Objects.requireNonNull(unNumber, "unNumber must not be null");
        this.primaryClass = Objects.requireNonNull(primaryClass, "primaryClass must not be null");
        TreeSet<String> subsidiaries = new TreeSet<>();
        if (subsidiaryClasses != null) {
            for (String subsidiary : subsidiaryClasses) {
                if (subsidiary != null && !subsidiary.trim().isEmpty() && !subsidiary.equals(primaryClass)) {
                    subsidiaries.add(subsidiary.trim());
                }
            }
        }
        this.subsidiaryClasses = Collections.unmodifiableSortedSet(subsidiaries);
    }

    public String getUnNumber() {
        return unNumber;
    }

    public String getPrimaryClass() {
        return primaryClass;
    }

    public SortedSet<String> getSubsidiaryClasses() {
        return subsidiaryClasses;
    }

    /**
     * Primary class followed by subsidiary classes, as used for segregation.
     */
    public SortedSet<String> getAllClasses() {
        TreeSet<String> all = new TreeSet<>(subsidiaryClasses);
        all.add(primaryClass);
        return Collections.unmodifiableSortedSet(all);
    }

    @Override
    public int compareTo(DgEntry other) {
        int byUn = unNumber.compareTo(other.unNumber);
        if (byUn != 0) {
            return byUn;
        }
        int byClass = primaryClass.compareTo(other.primaryClass);
        if (byClass != 0) {
            return byClass;
        }
        // consistent with equals: entries differing only in subsidiaries are distinct
        return String.join("/", subsidiaryClasses).compareTo(String.join("/", other.subsidiaryClasses));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DgEntry)) {
            return false;
        }
        DgEntry other = (DgEntry) o;
        return unNumber.equals(other.unNumber)
                && primaryClass.equals(other.primaryClass)
                && subsidiaryClasses.equals(other.subsidiaryClasses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unNumber, primaryClass, subsidiaryClasses);
    }

    @Override
    public String toString() {
        return subsidiaryClasses.isEmpty()
                ? String.format("%s (Class %s)", unNumber, primaryClass)
                : String.format("%s (Class %s, subsidiary %s)", unNumber, primaryClass, String.join("/", subsidiaryClasses));
    }
}
