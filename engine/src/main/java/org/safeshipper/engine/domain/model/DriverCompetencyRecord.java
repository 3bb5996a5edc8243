package org.safeshipper.engine.domain.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Competency facts recorded for a driver (experience, medical fitness, restrictions).
 */
public final class DriverCompetencyRecord {

    private static final DriverCompetencyRecord EMPTY = new DriverCompetencyRecord(null, null, null);

    private final Double yearsExperience;
    private final LocalDate medicalCertificateExpiry;
    private final Set<String> restrictions;

    public DriverCompetencyRecord(Double yearsExperience, LocalDate medicalCertificateExpiry, Set<String> restrictions) {
        this.yearsExperience = yearsExperience;
        this.medicalCertificateExpiry = medicalCertificateExpiry;
        this.restrictions = restrictions != null
                ? Collections.unmodifiableSet(new TreeSet<>(restrictions))
                : Collections.emptySet();
    }

    public static DriverCompetencyRecord empty() {
        return EMPTY;
    }

    public Double getYearsExperience() {
        return yearsExperience;
    }

    public LocalDate getMedicalCertificateExpiry() {
        return medicalCertificateExpiry;
    }

    /**
     * Restriction codes such as NO_CLASS_7.
     */
    public Set<String> getRestrictions() {
        return restrictions;
    }

    public boolean isRestrictedFrom(String mainClass) {
        return restrictions.contains("NO_CLASS_" + mainClass);
    }
}
