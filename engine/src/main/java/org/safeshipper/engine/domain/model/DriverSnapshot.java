package org.safeshipper.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of a candidate driver.
 */
public final class DriverSnapshot {

    private final String id;
    private final String name;
    private final List<DriverLicense> licenses;
    private final List<DriverCertificate> certificates;
    private final DriverCompetencyRecord competency;

    private DriverSnapshot(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = builder.name;
        this.licenses = Collections.unmodifiableList(new ArrayList<>(builder.licenses));
        this.certificates = Collections.unmodifiableList(new ArrayList<>(builder.certificates));
        this.competency = builder.competency != null ? builder.competency : DriverCompetencyRecord.empty();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<DriverLicense> getLicenses() {
        return licenses;
    }

    public List<DriverCertificate> getCertificates() {
        return certificates;
    }

    public DriverCompetencyRecord getCompetency() {
        return competency;
    }

    public String getLabel() {
        return name != null ? name : id;
    }

    @Override
    public String toString() {
        return String.format("DriverSnapshot{id='%s', licenses=%d, certificates=%d}",
                id, licenses.size(), certificates.size());
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    /**
     * Builder for DriverSnapshot.
     */
    public static final class Builder {
        private String id;
        private String name;
        private List<DriverLicense> licenses = new ArrayList<>();
        private List<DriverCertificate> certificates = new ArrayList<>();
        private DriverCompetencyRecord competency;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder licenses(List<DriverLicense> licenses) {
            this.licenses = licenses != null ? new ArrayList<>(licenses) : new ArrayList<>();
            return this;
        }

        public Builder addLicense(DriverLicense license) {
            this.licenses.add(Objects.requireNonNull(license, "license must not be null"));
            return this;
        }

        public Builder certificates(List<DriverCertificate> certificates) {
            this.certificates = certificates != null ? new ArrayList<>(certificates) : new ArrayList<>();
            return this;
        }

        public Builder addCertificate(DriverCertificate certificate) {
            this.certificates.add(Objects.requireNonNull(certificate, "certificate must not be null"));
            return this;
        }

        public Builder competency(DriverCompetencyRecord competency) {
            this.competency = competency;
            return this;
        }

        public DriverSnapshot build() {
            return new DriverSnapshot(this);
        }
    }
}
