package org.safeshipper.engine.domain.model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derived competency aggregate for a driver, rebuilt on every validation.
 * Compliance percentage is the pass rate over four checks: licence, basic ADG
 * certificate, medical certificate and minimum experience.
 */
public final class DriverCompetencyProfile {

    public static final int TOTAL_CHECKS = 4;

    private final Set<String> qualifiedClasses;
    private final boolean licenseCheckPassed;
    private final boolean baseCertificateCheckPassed;
    private final boolean medicalCheckPassed;
    private final boolean experienceCheckPassed;

    public DriverCompetencyProfile(Set<String> qualifiedClasses,
                                   boolean licenseCheckPassed,
                                   boolean baseCertificateCheckPassed,
                                   boolean medicalCheckPassed,
                                   boolean experienceCheckPassed) {
        this.qualifiedClasses = qualifiedClasses != null
                ? Collections.unmodifiableSet(new TreeSet<>(qualifiedClasses))
                : Collections.emptySet();
        this.licenseCheckPassed = licenseCheckPassed;
        this.baseCertificateCheckPassed = baseCertificateCheckPassed;
        this.medicalCheckPassed = medicalCheckPassed;
        this.experienceCheckPassed = experienceCheckPassed;
    }

    public Set<String> getQualifiedClasses() {
        return qualifiedClasses;
    }

    public boolean isLicenseCheckPassed() {
        return licenseCheckPassed;
    }

    public boolean isBaseCertificateCheckPassed() {
        return baseCertificateCheckPassed;
    }

    public boolean isMedicalCheckPassed() {
        return medicalCheckPassed;
    }

    public boolean isExperienceCheckPassed() {
        return experienceCheckPassed;
    }

    public int getPassedChecks() {
        int passed = 0;
        if (licenseCheckPassed) {
            passed++;
        }
        if (baseCertificateCheckPassed) {
            passed++;
        }
        if (medicalCheckPassed) {
            passed++;
        }
        if (experienceCheckPassed) {
            passed++;
        }
        return passed;
    }

    public double getCompliancePercentage() {
        return getPassedChecks() * 100.0 / TOTAL_CHECKS;
    }

    @Override
    public String toString() {
        return String.format("DriverCompetencyProfile{classes=%s, compliance=%.1f%%}",
                qualifiedClasses, getCompliancePercentage());
    }
}
