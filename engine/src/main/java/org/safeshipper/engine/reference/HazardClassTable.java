package org.safeshipper.engine.reference;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Hazard class reference: ADR class designation and risk rank per hazard class code.
 */
public final class HazardClassTable {

    /** Placeholder ADR class for general freight and for classes with no known mapping. */
    public static final String ALL_CLASSES = "ALL_CLASSES";

    /** Risk rank for classes missing from the table. */
    public static final int UNKNOWN_RISK_RANK = 1;

    private final Map<String, Entry> entries;

    public HazardClassTable(Map<String, Entry> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        this.entries = Collections.unmodifiableMap(new HashMap<>(entries));
    }

    /**
     * Normalises a hazard class code: trims it and drops a class 1 compatibility group letter ("1.4S" becomes "1.4").
     */
    public static String normalize(String hazardClass) {
        if (hazardClass == null) {
            return null;
        }
        String code = hazardClass.trim().toUpperCase();
        if (code.startsWith("CLASS_")) {
            code = code.substring("CLASS_".length()).replace('_', '.');
        }
        if (code.startsWith("1.") && code.length() > 3 && Character.isLetter(code.charAt(code.length() - 1))) {
            code = code.substring(0, code.length() - 1);
        }
        return code;
    }

    public boolean isKnown(String hazardClass) {
        return entries.containsKey(normalize(hazardClass));
    }

    public Optional<String> adrClassFor(String hazardClass) {
        Entry entry = entries.get(normalize(hazardClass));
        return entry != null ? Optional.of(entry.getAdrClass()) : Optional.empty();
    }

    public int riskRankOf(String hazardClass) {
        Entry entry = entries.get(normalize(hazardClass));
        return entry != null ? entry.getRiskRank() : UNKNOWN_RISK_RANK;
    }

    public Set<String> getKnownClasses() {
        return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
    }

    public int size() {
        return entries.size();
    }

    /**
     * One row of the table.
     */
    public static final class Entry {
        private final String code;
        private final String adrClass;
        private final int riskRank;
        private final String label;

        public Entry(String code, String adrClass, int riskRank, String label) {
            this.code = Objects.requireNonNull(code, "code must not be null");
            this.adrClass = Objects.requireNonNull(adrClass, "adrClass must not be null");
            this.riskRank = riskRank;
            this.label = label;
        }

        public String getCode() {
            return code;
        }

        public String getAdrClass() {
            return adrClass;
        }

        public int getRiskRank() {
            return riskRank;
        }

        public String getLabel() {
            return label;
        }
    }
}
