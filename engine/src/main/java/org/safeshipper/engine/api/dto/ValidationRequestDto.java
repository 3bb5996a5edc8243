package org.safeshipper.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.safeshipper.engine.domain.model.CertificateType;
import org.safeshipper.engine.domain.model.DgItem;
import org.safeshipper.engine.domain.model.DriverCertificate;
import org.safeshipper.engine.domain.model.DriverCompetencyRecord;
import org.safeshipper.engine.domain.model.DriverLicense;
import org.safeshipper.engine.domain.model.DriverSnapshot;
import org.safeshipper.engine.domain.model.LicenseClass;
import org.safeshipper.engine.domain.model.ShipmentSnapshot;
import org.safeshipper.engine.domain.model.VehicleEquipmentRecord;
import org.safeshipper.engine.domain.model.VehicleSnapshot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * Validation request read by the command line entry point.
 * Snapshots are converted to domain objects with the toSnapshot() methods.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ValidationRequestDto {

    /**
     * What the request asks for.
     */
    public enum Mode {
        VEHICLE,
        DRIVER,
        ASSIGNMENT,
        RANK_VEHICLES,
        RANK_DRIVERS
    }

    @JsonProperty("mode")
    private Mode mode;

    @JsonProperty("strict_mode")
    private boolean strictMode;

    @JsonProperty("include_warnings")
    private boolean includeWarnings = true;

    @JsonProperty("shipment")
    private ShipmentDto shipment;

    @JsonProperty("vehicle")
    private VehicleDto vehicle;

    @JsonProperty("driver")
    private DriverDto driver;

    @JsonProperty("vehicles")
    private List<VehicleDto> vehicles;

    @JsonProperty("drivers")
    private List<DriverDto> drivers;

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    public void setStrictMode(boolean strictMode) {
        this.strictMode = strictMode;
    }

    public boolean isIncludeWarnings() {
        return includeWarnings;
    }

    public void setIncludeWarnings(boolean includeWarnings) {
        this.includeWarnings = includeWarnings;
    }

    public ShipmentDto getShipment() {
        return shipment;
    }

    public void setShipment(ShipmentDto shipment) {
        this.shipment = shipment;
    }

    public VehicleDto getVehicle() {
        return vehicle;
    }

    public void setVehicle(VehicleDto vehicle) {
        this.vehicle = vehicle;
    }

    public DriverDto getDriver() {
        return driver;
    }

    public void setDriver(DriverDto driver) {
        this.driver = driver;
    }

    public List<VehicleDto> getVehicles() {
        return vehicles;
    }

    public void setVehicles(List<VehicleDto> vehicles) {
        this.vehicles = vehicles;
    }

    public List<DriverDto> getDrivers() {
        return drivers;
    }

    public void setDrivers(List<DriverDto> drivers) {
        this.drivers = drivers;
    }

    public List<VehicleSnapshot> toVehicleSnapshots() {
        List<VehicleSnapshot> result = new ArrayList<>();
        if (vehicles != null) {
            for (VehicleDto dto : vehicles) {
                result.add(dto.toSnapshot());
            }
        }
        return result;
    }

    public List<DriverSnapshot> toDriverSnapshots() {
        List<DriverSnapshot> result = new ArrayList<>();
        if (drivers != null) {
            for (DriverDto dto : drivers) {
                result.add(dto.toSnapshot());
            }
        }
        return result;
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values != null ? values : Collections.emptyList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ShipmentDto {
        @JsonProperty("id")
        private String id;

        @JsonProperty("tracking_ref")
        private String trackingRef;

        @JsonProperty("items")
        private List<ItemDto> items;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getTrackingRef() {
            return trackingRef;
        }

        public void setTrackingRef(String trackingRef) {
            this.trackingRef = trackingRef;
        }

        public List<ItemDto> getItems() {
            return items;
        }

        public void setItems(List<ItemDto> items) {
            this.items = items;
        }

        public ShipmentSnapshot toSnapshot() {
            List<DgItem> snapshotItems = new ArrayList<>();
            for (ItemDto item : orEmpty(items)) {
                snapshotItems.add(item.toSnapshot());
            }
            return new ShipmentSnapshot(id, trackingRef, snapshotItems);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ItemDto {
        @JsonProperty("item_id")
        private String itemId;

        @JsonProperty("description")
        private String description;

        @JsonProperty("dangerous_good")
        private boolean dangerousGood;

        @JsonProperty("un_number")
        private String unNumber;

        @JsonProperty("hazard_class")
        private String hazardClass;

        @JsonProperty("subsidiary_hazard_classes")
        private List<String> subsidiaryHazardClasses;

        @JsonProperty("packing_group")
        private String packingGroup;

        @JsonProperty("quantity")
        private int quantity = 1;

        @JsonProperty("weight_kg")
        private Double weightKg;

        @JsonProperty("volume_l")
        private Double volumeL;

        @JsonProperty("limited_quantity")
        private boolean limitedQuantity;

        @JsonProperty("excepted_quantity")
        private boolean exceptedQuantity;

        public String getItemId() {
            return itemId;
        }

        public void setItemId(String itemId) {
            this.itemId = itemId;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public boolean isDangerousGood() {
            return dangerousGood;
        }

        public void setDangerousGood(boolean dangerousGood) {
            this.dangerousGood = dangerousGood;
        }

        public String getUnNumber() {
            return unNumber;
        }

        public void setUnNumber(String unNumber) {
            this.unNumber = unNumber;
        }

        public String getHazardClass() {
            return hazardClass;
        }

        public void setHazardClass(String hazardClass) {
            this.hazardClass = hazardClass;
        }

        public List<String> getSubsidiaryHazardClasses() {
            return subsidiaryHazardClasses;
        }

        public void setSubsidiaryHazardClasses(List<String> subsidiaryHazardClasses) {
            this.subsidiaryHazardClasses = subsidiaryHazardClasses;
        }

        public String getPackingGroup() {
            return packingGroup;
        }

        public void setPackingGroup(String packingGroup) {
            this.packingGroup = packingGroup;
        }

        public int getQuantity() {
            return quantity;
        }

        public void setQuantity(int quantity) {
            this.quantity = quantity;
        }

        public Double getWeightKg() {
            return weightKg;
        }

        public void setWeightKg(Double weightKg) {
            this.weightKg = weightKg;
        }

        public Double getVolumeL() {
            return volumeL;
        }

        public void setVolumeL(Double volumeL) {
            this.volumeL = volumeL;
        }

        public boolean isLimitedQuantity() {
            return limitedQuantity;
        }

        public void setLimitedQuantity(boolean limitedQuantity) {
            this.limitedQuantity = limitedQuantity;
        }

        public boolean isExceptedQuantity() {
            return exceptedQuantity;
        }

        public void setExceptedQuantity(boolean exceptedQuantity) {
            this.exceptedQuantity = exceptedQuantity;
        }

        public DgItem toSnapshot() {
            return DgItem.builder(itemId)
                    .description(description)
                    .dangerousGood(dangerousGood)
                    .unNumber(unNumber)
                    .hazardClass(hazardClass)
                    .subsidiaryHazardClasses(subsidiaryHazardClasses)
                    .packingGroup(packingGroup)
                    .quantity(quantity)
                    .weightKg(weightKg)
                    .volumeL(volumeL)
                    .limitedQuantity(limitedQuantity)
                    .exceptedQuantity(exceptedQuantity)
                    .build();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class VehicleDto {
        @JsonProperty("id")
        private String id;

        @JsonProperty("registration")
        private String registration;

        @JsonProperty("vehicle_type")
        private String vehicleType;

        @JsonProperty("capacity_kg")
        private Double capacityKg;

        @JsonProperty("volume_capacity_l")
        private Double volumeCapacityL;

        @JsonProperty("authorizations")
        private List<String> authorizations;

        @JsonProperty("equipment")
        private List<EquipmentDto> equipment;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getRegistration() {
            return registration;
        }

        public void setRegistration(String registration) {
            this.registration = registration;
        }

        public String getVehicleType() {
            return vehicleType;
        }

        public void setVehicleType(String vehicleType) {
            this.vehicleType = vehicleType;
        }

        public Double getCapacityKg() {
            return capacityKg;
        }

        public void setCapacityKg(Double capacityKg) {
            this.capacityKg = capacityKg;
        }

        public Double getVolumeCapacityL() {
            return volumeCapacityL;
        }

        public void setVolumeCapacityL(Double volumeCapacityL) {
            this.volumeCapacityL = volumeCapacityL;
        }

        public List<String> getAuthorizations() {
            return authorizations;
        }

        public void setAuthorizations(List<String> authorizations) {
            this.authorizations = authorizations;
        }

        public List<EquipmentDto> getEquipment() {
            return equipment;
        }

        public void setEquipment(List<EquipmentDto> equipment) {
            this.equipment = equipment;
        }

        public VehicleSnapshot toSnapshot() {
            VehicleSnapshot.Builder builder = VehicleSnapshot.builder(id)
                    .registration(registration)
                    .vehicleType(vehicleType)
                    .capacityKg(capacityKg)
                    .volumeCapacityL(volumeCapacityL)
                    .authorizations(new HashSet<>(orEmpty(authorizations)));
            for (EquipmentDto record : orEmpty(equipment)) {
                builder.addEquipment(record.toSnapshot());
            }
            return builder.build();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EquipmentDto {
        @JsonProperty("equipment_type_id")
        private String equipmentTypeId;

        @JsonProperty("status")
        private String status;

        @JsonProperty("expiry_date")
        private LocalDate expiryDate;

        @JsonProperty("next_inspection_date")
        private LocalDate nextInspectionDate;

        @JsonProperty("serial_number")
        private String serialNumber;

        @JsonProperty("capacity_kg")
        private Double capacityKg;

        public String getEquipmentTypeId() {
            return equipmentTypeId;
        }

        public void setEquipmentTypeId(String equipmentTypeId) {
            this.equipmentTypeId = equipmentTypeId;
        }

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public LocalDate getExpiryDate() {
            return expiryDate;
        }

        public void setExpiryDate(LocalDate expiryDate) {
            this.expiryDate = expiryDate;
        }

        public LocalDate getNextInspectionDate() {
            return nextInspectionDate;
        }

        public void setNextInspectionDate(LocalDate nextInspectionDate) {
            this.nextInspectionDate = nextInspectionDate;
        }

        public String getSerialNumber() {
            return serialNumber;
        }

        public void setSerialNumber(String serialNumber) {
            this.serialNumber = serialNumber;
        }

        public Double getCapacityKg() {
            return capacityKg;
        }

        public void setCapacityKg(Double capacityKg) {
            this.capacityKg = capacityKg;
        }

        public VehicleEquipmentRecord toSnapshot() {
            VehicleEquipmentRecord.Status recordStatus = status != null
                    ? VehicleEquipmentRecord.Status.valueOf(status.trim().toUpperCase())
                    : VehicleEquipmentRecord.Status.ACTIVE;
            return VehicleEquipmentRecord.builder(equipmentTypeId)
                    .status(recordStatus)
                    .expiryDate(expiryDate)
                    .nextInspectionDate(nextInspectionDate)
                    .serialNumber(serialNumber)
                    .capacityKg(capacityKg)
                    .build();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DriverDto {
        @JsonProperty("id")
        private String id;

        @JsonProperty("name")
        private String name;

        @JsonProperty("licenses")
        private List<LicenseDto> licenses;

        @JsonProperty("certificates")
        private List<CertificateDto> certificates;

        @JsonProperty("competency")
        private CompetencyDto competency;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<LicenseDto> getLicenses() {
            return licenses;
        }

        public void setLicenses(List<LicenseDto> licenses) {
            this.licenses = licenses;
        }

        public List<CertificateDto> getCertificates() {
            return certificates;
        }

        public void setCertificates(List<CertificateDto> certificates) {
            this.certificates = certificates;
        }

        public CompetencyDto getCompetency() {
            return competency;
        }

        public void setCompetency(CompetencyDto competency) {
            this.competency = competency;
        }

        public DriverSnapshot toSnapshot() {
            DriverSnapshot.Builder builder = DriverSnapshot.builder(id).name(name);
            for (LicenseDto license : orEmpty(licenses)) {
                builder.addLicense(license.toSnapshot());
            }
            for (CertificateDto certificate : orEmpty(certificates)) {
                builder.addCertificate(certificate.toSnapshot());
            }
            if (competency != null) {
                builder.competency(competency.toSnapshot());
            }
            return builder.build();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class LicenseDto {
        @JsonProperty("license_number")
        private String licenseNumber;

        @JsonProperty("license_class")
        private String licenseClass;

        @JsonProperty("issue_date")
        private LocalDate issueDate;

        @JsonProperty("expiry_date")
        private LocalDate expiryDate;

        @JsonProperty("suspended")
        private boolean suspended;

        public String getLicenseNumber() {
            return licenseNumber;
        }

        public void setLicenseNumber(String licenseNumber) {
            this.licenseNumber = licenseNumber;
        }

        public String getLicenseClass() {
            return licenseClass;
        }

        public void setLicenseClass(String licenseClass) {
            this.licenseClass = licenseClass;
        }

        public LocalDate getIssueDate() {
            return issueDate;
        }

        public void setIssueDate(LocalDate issueDate) {
            this.issueDate = issueDate;
        }

        public LocalDate getExpiryDate() {
            return expiryDate;
        }

        public void setExpiryDate(LocalDate expiryDate) {
            this.expiryDate = expiryDate;
        }

        public boolean isSuspended() {
            return suspended;
        }

        public void setSuspended(boolean suspended) {
            this.suspended = suspended;
        }

        public DriverLicense toSnapshot() {
            return new DriverLicense(licenseNumber, LicenseClass.valueOf(licenseClass.trim().toUpperCase()),
                    issueDate, expiryDate, suspended);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CertificateDto {
        @JsonProperty("certificate_number")
        private String certificateNumber;

        @JsonProperty("certificate_type")
        private String certificateType;

        @JsonProperty("hazard_classes_covered")
        private List<String> hazardClassesCovered;

        @JsonProperty("expiry_date")
        private LocalDate expiryDate;

        @JsonProperty("revoked")
        private boolean revoked;

        public String getCertificateNumber() {
            return certificateNumber;
        }

        public void setCertificateNumber(String certificateNumber) {
            this.certificateNumber = certificateNumber;
        }

        public String getCertificateType() {
            return certificateType;
        }

        public void setCertificateType(String certificateType) {
            this.certificateType = certificateType;
        }

        public List<String> getHazardClassesCovered() {
            return hazardClassesCovered;
        }

        public void setHazardClassesCovered(List<String> hazardClassesCovered) {
            this.hazardClassesCovered = hazardClassesCovered;
        }

        public LocalDate getExpiryDate() {
            return expiryDate;
        }

        public void setExpiryDate(LocalDate expiryDate) {
            this.expiryDate = expiryDate;
        }

        public boolean isRevoked() {
            return revoked;
        }

        public void setRevoked(boolean revoked) {
            this.revoked = revoked;
        }

        public DriverCertificate toSnapshot() {
            return new DriverCertificate(certificateNumber,
                    CertificateType.valueOf(certificateType.trim().toUpperCase()),
                    new HashSet<>(orEmpty(hazardClassesCovered)), expiryDate, revoked);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CompetencyDto {
        @JsonProperty("years_experience")
        private Double yearsExperience;

        @JsonProperty("medical_certificate_expiry")
        private LocalDate medicalCertificateExpiry;

        @JsonProperty("restrictions")
        private List<String> restrictions;

        public Double getYearsExperience() {
            return yearsExperience;
        }

        public void setYearsExperience(Double yearsExperience) {
            this.yearsExperience = yearsExperience;
        }

        public LocalDate getMedicalCertificateExpiry() {
            return medicalCertificateExpiry;
        }

        public void setMedicalCertificateExpiry(LocalDate medicalCertificateExpiry) {
            this.medicalCertificateExpiry = medicalCertificateExpiry;
        }

        public List<String> getRestrictions() {
            return restrictions;
        }

        public void setRestrictions(List<String> restrictions) {
            this.restrictions = restrictions;
        }

        public DriverCompetencyRecord toSnapshot() {
            return new DriverCompetencyRecord(yearsExperience, medicalCertificateExpiry,
                    new HashSet<>(orEmpty(restrictions)));
        }
    }
}
