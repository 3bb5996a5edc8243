package org.safeshipper.engine.domain.service;

import org.safeshipper.engine.domain.model.CertificateType;
import org.safeshipper.engine.domain.model.DgProfile;
import org.safeshipper.engine.domain.model.DriverCertificate;
import org.safeshipper.engine.domain.model.DriverCompetencyProfile;
import org.safeshipper.engine.domain.model.DriverCompetencyRecord;
import org.safeshipper.engine.domain.model.DriverLicense;
import org.safeshipper.engine.domain.model.DriverQualificationResult;
import org.safeshipper.engine.domain.model.DriverSnapshot;
import org.safeshipper.engine.domain.model.ExpiryState;
import org.safeshipper.engine.domain.model.QualificationLevel;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Decides whether a driver may carry a shipment.
 *
 * General freight only needs a usable licence. Dangerous goods additionally need, for every
 * main hazard class of the shipment, a usable certificate covering that class (or "ALL"),
 * no restriction against the class and a current medical certificate.
 */
public final class DriverQualificationValidator {

    private static final Logger LOG = Logger.getLogger(DriverQualificationValidator.class.getName());

    private static final double MINIMUM_EXPERIENCE_YEARS = 1.0;

    private final int expiryWarningDays;

    public DriverQualificationValidator(int expiryWarningDays) {
        if (expiryWarningDays < 0) {
            throw new IllegalArgumentException("expiryWarningDays must not be negative");
        }
        this.expiryWarningDays = expiryWarningDays;
    }

    public DriverQualificationResult validate(DriverSnapshot driver, DgProfile profile, LocalDate today) {
        Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(today, "today must not be null");

        DriverCompetencyProfile competency = buildCompetencyProfile(driver, today);
        DriverQualificationResult.Builder result = DriverQualificationResult.builder(driver.getId())
                .compliancePercentage(competency.getCompliancePercentage());

        checkLicenses(driver, today, profile.containsDangerousGoods(), result);

        if (!profile.containsDangerousGoods()) {
            result.qualificationLevel(result.hasCriticalIssues() ? QualificationLevel.INSUFFICIENT : QualificationLevel.BASIC);
            return logged(driver, result.build());
        }

        for (String hazardClass : profile.getMainHazardClasses()) {
            result.qualifiedClass(hazardClass, checkClass(driver, hazardClass, today, result));
        }
        checkMedical(driver.getCompetency(), today, result);

        result.qualificationLevel(result.hasCriticalIssues()
                ? QualificationLevel.INSUFFICIENT
                : QualificationLevel.DANGEROUS_GOODS);
        return logged(driver, result.build());
    }

    /**
     * Derive the competency aggregate from the driver's documents as of today.
     */
    public DriverCompetencyProfile buildCompetencyProfile(DriverSnapshot driver, LocalDate today) {
        Set<String> classes = new TreeSet<>();
        boolean baseCertificate = false;
        for (DriverCertificate certificate : driver.getCertificates()) {
            if (!certificate.isUsable(today)) {
                continue;
            }
            if (certificate.getCertificateType() == CertificateType.BASIC_ADG) {
                baseCertificate = true;
                classes.addAll(certificate.getHazardClassesCovered());
            } else if (certificate.qualifiesForClasses()) {
                classes.addAll(certificate.getHazardClassesCovered());
            }
        }

        boolean license = false;
        for (DriverLicense driverLicense : driver.getLicenses()) {
            if (driverLicense.isSuitableForDangerousGoods(today)) {
                license = true;
                break;
            }
        }

        DriverCompetencyRecord record = driver.getCompetency();
        boolean medical = record.getMedicalCertificateExpiry() != null
                && !record.getMedicalCertificateExpiry().isBefore(today);
        boolean experience = record.getYearsExperience() != null
                && record.getYearsExperience() >= MINIMUM_EXPERIENCE_YEARS;

        return new DriverCompetencyProfile(classes, license, baseCertificate, medical, experience);
    }

    private void checkLicenses(DriverSnapshot driver, LocalDate today, boolean dangerousGoods,
                               DriverQualificationResult.Builder result) {
        List<DriverLicense> active = new ArrayList<>();
        for (DriverLicense driverLicense : driver.getLicenses()) {
            if (driverLicense.isActive(today)) {
                active.add(driverLicense);
            }
        }
        if (active.isEmpty()) {
            result.addCriticalIssue("Driver " + driver.getLabel() + " has no valid driver licence");
            return;
        }

        boolean commercial = false;
        boolean fullyValid = false;
        for (DriverLicense driverLicense : active) {
            commercial |= driverLicense.getLicenseClass().isCommercial();
            fullyValid |= driverLicense.state(today, expiryWarningDays) == ExpiryState.VALID;
        }
        if (!commercial) {
            result.addWarning(dangerousGoods
                    ? "Licence class C is not suitable for dangerous goods transport; a heavy vehicle class is required"
                    : "Only a class C licence held; upgrade to a commercial licence class recommended");
        }
        if (!fullyValid) {
            for (DriverLicense driverLicense : active) {
                result.addWarning("Licence " + driverLicense.getLicenseNumber() + " expires on "
                        + driverLicense.getExpiryDate());
            }
        }
    }

    /**
     * Returns whether the driver is qualified for one main hazard class, recording issues on the way.
     */
    private boolean checkClass(DriverSnapshot driver, String hazardClass, LocalDate today,
                               DriverQualificationResult.Builder result) {
        if (driver.getCompetency().isRestrictedFrom(hazardClass)) {
            result.addCriticalIssue("Driver is restricted from carrying Class " + hazardClass
                    + " (NO_CLASS_" + hazardClass + ")");
            return false;
        }

        DriverCertificate latestExpiring = null;
        DriverCertificate lastExpired = null;
        boolean valid = false;
        for (DriverCertificate certificate : driver.getCertificates()) {
            if (certificate.isRevoked() || !certificate.qualifiesForClasses() || !certificate.covers(hazardClass)) {
                continue;
            }
            ExpiryState state = certificate.state(today, expiryWarningDays);
            if (state == ExpiryState.VALID) {
                valid = true;
            } else if (state == ExpiryState.EXPIRING_SOON) {
                if (latestExpiring == null || certificate.getExpiryDate().isAfter(latestExpiring.getExpiryDate())) {
                    latestExpiring = certificate;
                }
            } else if (lastExpired == null || certificate.getExpiryDate().isAfter(lastExpired.getExpiryDate())) {
                lastExpired = certificate;
            }
        }

        if (valid) {
            return true;
        }
        if (latestExpiring != null) {
            result.addWarning("Dangerous goods certificate " + latestExpiring.getCertificateNumber()
                    + " for Class " + hazardClass + " expires on " + latestExpiring.getExpiryDate());
            return true;
        }
        if (lastExpired != null) {
            result.addCriticalIssue("Dangerous goods certificate " + lastExpired.getCertificateNumber()
                    + " for Class " + hazardClass + " expired on " + lastExpired.getExpiryDate());
        } else {
            result.addCriticalIssue("No valid dangerous goods certificate for Class " + hazardClass);
        }
        return false;
    }

    private void checkMedical(DriverCompetencyRecord record, LocalDate today, DriverQualificationResult.Builder result) {
        LocalDate expiry = record.getMedicalCertificateExpiry();
        if (expiry == null) {
            return;
        }
        ExpiryState state = ExpiryState.of(expiry, today, expiryWarningDays);
        if (state == ExpiryState.EXPIRED) {
            result.addCriticalIssue("Medical certificate expired on " + expiry);
        } else if (state == ExpiryState.EXPIRING_SOON) {
            result.addWarning("Medical certificate expires on " + expiry);
        }
    }

    private static DriverQualificationResult logged(DriverSnapshot driver, DriverQualificationResult result) {
        LOG.fine(() -> "Driver qualification for " + driver.getLabel() + ": " + result);
        return result;
    }
}
