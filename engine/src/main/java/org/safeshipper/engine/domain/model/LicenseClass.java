package org.safeshipper.engine.domain.model;

/**
 * Heavy vehicle licence classes.
 */
public enum LicenseClass {
    C("Car"),
    LR("Light Rigid"),
    MR("Medium Rigid"),
    HR("Heavy Rigid"),
    HC("Heavy Combination"),
    MC("Multi-Combination");

    private final String label;

    LicenseClass(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Commercial classes are accepted for freight and for dangerous goods.
     */
    public boolean isCommercial() {
        return this != C;
    }
}
