package org.safeshipper.engine.domain.model;

public enum CertificateType {
    BASIC_ADG("Basic ADG Training"),
    CLASS_SPECIFIC("Class-Specific Training"),
    LOAD_RESTRAINT("Load Restraint"),
    SECURITY_AWARENESS("Security Awareness"),
    EMERGENCY_RESPONSE("Emergency Response"),
    VEHICLE_MAINTENANCE("Vehicle Maintenance for DG");

    private final String displayName;

    CertificateType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
