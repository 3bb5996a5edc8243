package org.safeshipper.engine.domain.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Dangerous-goods training certificate.
 */
public final class DriverCertificate {

    public static final String ALL_CLASSES = "ALL";

    private final String certificateNumber;
    private final CertificateType certificateType;
    private final Set<String> hazardClassesCovered;
    private final LocalDate expiryDate;
    private final boolean revoked;

    public DriverCertificate(String certificateNumber, CertificateType certificateType,
                             Set<String> hazardClassesCovered, LocalDate expiryDate, boolean revoked) {
        this.certificateNumber = Objects.requireNonNull(certificateNumber, "certificateNumber must not be null");
        this.certificateType = Objects.requireNonNull(certificateType, "certificateType must not be null");
        this.hazardClassesCovered = hazardClassesCovered != null
                ? Collections.unmodifiableSet(new TreeSet<>(hazardClassesCovered))
                : Collections.emptySet();
        this.expiryDate = Objects.requireNonNull(expiryDate, "expiryDate must not be null");
        this.revoked = revoked;
    }

    public DriverCertificate(String certificateNumber, CertificateType certificateType,
                             Set<String> hazardClassesCovered, LocalDate expiryDate) {
        this(certificateNumber, certificateType, hazardClassesCovered, expiryDate, false);
    }

    public String getCertificateNumber() {
        return certificateNumber;
    }

    public CertificateType getCertificateType() {
        return certificateType;
    }

    public Set<String> getHazardClassesCovered() {
        return hazardClassesCovered;
    }

    public LocalDate getExpiryDate() {
        return expiryDate;
    }

    public boolean isRevoked() {
        return revoked;
    }

    public ExpiryState state(LocalDate today, int warningDays) {
        return ExpiryState.of(expiryDate, today, warningDays);
    }

    public boolean isUsable(LocalDate today) {
        return !revoked && !expiryDate.isBefore(today);
    }

    /**
     * Only class-specific training qualifies a driver to carry a class.
     */
    public boolean qualifiesForClasses() {
        return certificateType == CertificateType.CLASS_SPECIFIC;
    }

    /**
     * Whether the certificate covers a main hazard class ("3", "CLASS_3" or "class_3").
     */
    public boolean covers(String hazardClass) {
        if (hazardClass == null || hazardClassesCovered.isEmpty()) {
            return false;
        }
        String classCode = hazardClass.replace("CLASS_", "").replace("class_", "");
        return hazardClassesCovered.contains(classCode) || hazardClassesCovered.contains(ALL_CLASSES);
    }

    @Override
    public String toString() {
        return String.format("DriverCertificate{number='%s', type=%s, classes=%s, expiry=%s}",
                certificateNumber, certificateType, hazardClassesCovered, expiryDate);
    }
}
