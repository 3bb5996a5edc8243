package org.safeshipper.engine.domain.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Driver licence held by a driver. Its lifecycle state is derived from the expiry date on read.
 */
public final class DriverLicense {

    private final String licenseNumber;
    private final LicenseClass licenseClass;
    private final LocalDate issueDate;
    private final LocalDate expiryDate;
    private final boolean suspended;

    public DriverLicense(String licenseNumber, LicenseClass licenseClass,
                         LocalDate issueDate, LocalDate expiryDate, boolean suspended) {
        this.licenseNumber = Objects.requireNonNull(licenseNumber, "licenseNumber must not be null");
        this.licenseClass = Objects.requireNonNull(licenseClass, "licenseClass must not be null");
        this.issueDate = issueDate;
        this.expiryDate = Objects.requireNonNull(expiryDate, "expiryDate must not be null");
        this.suspended = suspended;
    }

    public DriverLicense(String licenseNumber, LicenseClass licenseClass, LocalDate issueDate, LocalDate expiryDate) {
        this(licenseNumber, licenseClass, issueDate, expiryDate, false);
    }

    public String getLicenseNumber() {
        return licenseNumber;
    }

    public LicenseClass getLicenseClass() {
        return licenseClass;
    }

    public LocalDate getIssueDate() {
        return issueDate;
    }

    public LocalDate getExpiryDate() {
        return expiryDate;
    }

    public boolean isSuspended() {
        return suspended;
    }

    public ExpiryState state(LocalDate today, int warningDays) {
        return ExpiryState.of(expiryDate, today, warningDays);
    }

    /**
     * Active means not suspended and not past its expiry date.
     */
    public boolean isActive(LocalDate today) {
        return !suspended && !expiryDate.isBefore(today);
    }

    public boolean isSuitableForDangerousGoods(LocalDate today) {
        return isActive(today) && licenseClass.isCommercial();
    }

    @Override
    public String toString() {
        return String.format("DriverLicense{number='%s', class=%s, expiry=%s}", licenseNumber, licenseClass, expiryDate);
    }
}
