package org.safeshipper.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reference data document, read from the classpath or from GET v1/compliance/reference-data.
 * Contains every static table the engine needs at startup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ReferenceDataDto {

    @JsonProperty("version")
    private String version;

    @JsonProperty("config")
    private List<ConfigItemDto> config;

    @JsonProperty("hazard_classes")
    private List<HazardClassDto> hazardClasses;

    @JsonProperty("segregation_rules")
    private List<SegregationRuleDto> segregationRules;

    @JsonProperty("equipment_requirements")
    private List<EquipmentRequirementDto> equipmentRequirements;

    @JsonProperty("fire_extinguisher_requirements")
    private List<FireExtinguisherRequirementDto> fireExtinguisherRequirements;

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public List<ConfigItemDto> getConfig() {
        return config;
    }

    public void setConfig(List<ConfigItemDto> config) {
        this.config = config;
    }

    public List<HazardClassDto> getHazardClasses() {
        return hazardClasses;
    }

    public void setHazardClasses(List<HazardClassDto> hazardClasses) {
        this.hazardClasses = hazardClasses;
    }

    public List<SegregationRuleDto> getSegregationRules() {
        return segregationRules;
    }

    public void setSegregationRules(List<SegregationRuleDto> segregationRules) {
        this.segregationRules = segregationRules;
    }

    public List<EquipmentRequirementDto> getEquipmentRequirements() {
        return equipmentRequirements;
    }

    public void setEquipmentRequirements(List<EquipmentRequirementDto> equipmentRequirements) {
        this.equipmentRequirements = equipmentRequirements;
    }

    public List<FireExtinguisherRequirementDto> getFireExtinguisherRequirements() {
        return fireExtinguisherRequirements;
    }

    public void setFireExtinguisherRequirements(List<FireExtinguisherRequirementDto> fireExtinguisherRequirements) {
        this.fireExtinguisherRequirements = fireExtinguisherRequirements;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConfigItemDto {
        @JsonProperty("key")
        private String key;

        @JsonProperty("value")
        private double value;

        @JsonProperty("description")
        private String description;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public double getValue() {
            return value;
        }

        public void setValue(double value) {
            this.value = value;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class HazardClassDto {
        @JsonProperty("code")
        private String code;

        @JsonProperty("adr_class")
        private String adrClass;

        @JsonProperty("risk_rank")
        private int riskRank;

        @JsonProperty("label")
        private String label;

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public String getAdrClass() {
            return adrClass;
        }

        public void setAdrClass(String adrClass) {
            this.adrClass = adrClass;
        }

        public int getRiskRank() {
            return riskRank;
        }

        public void setRiskRank(int riskRank) {
            this.riskRank = riskRank;
        }

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SegregationRuleDto {
        @JsonProperty("class_a")
        private String classA;

        @JsonProperty("class_b")
        private String classB;

        @JsonProperty("level")
        private String level;

        @JsonProperty("notes")
        private String notes;

        public String getClassA() {
            return classA;
        }

        public void setClassA(String classA) {
            this.classA = classA;
        }

        public String getClassB() {
            return classB;
        }

        public void setClassB(String classB) {
            this.classB = classB;
        }

        public String getLevel() {
            return level;
        }

        public void setLevel(String level) {
            this.level = level;
        }

        public String getNotes() {
            return notes;
        }

        public void setNotes(String notes) {
            this.notes = notes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EquipmentRequirementDto {
        @JsonProperty("adr_class")
        private String adrClass;

        @JsonProperty("equipment_type_id")
        private String equipmentTypeId;

        @JsonProperty("name")
        private String name;

        @JsonProperty("minimum_standard")
        private String minimumStandard;

        public String getAdrClass() {
            return adrClass;
        }

        public void setAdrClass(String adrClass) {
            this.adrClass = adrClass;
        }

        public String getEquipmentTypeId() {
            return equipmentTypeId;
        }

        public void setEquipmentTypeId(String equipmentTypeId) {
            this.equipmentTypeId = equipmentTypeId;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getMinimumStandard() {
            return minimumStandard;
        }

        public void setMinimumStandard(String minimumStandard) {
            this.minimumStandard = minimumStandard;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FireExtinguisherRequirementDto {
        @JsonProperty("max_vehicle_mass_kg")
        private Double maxVehicleMassKg;

        @JsonProperty("total_capacity_kg")
        private double totalCapacityKg;

        @JsonProperty("minimum_units")
        private int minimumUnits;

        @JsonProperty("largest_unit_kg")
        private Double largestUnitKg;

        @JsonProperty("regulatory_reference")
        private String regulatoryReference;

        public Double getMaxVehicleMassKg() {
            return maxVehicleMassKg;
        }

        public void setMaxVehicleMassKg(Double maxVehicleMassKg) {
            this.maxVehicleMassKg = maxVehicleMassKg;
        }

        public double getTotalCapacityKg() {
            return totalCapacityKg;
        }

        public void setTotalCapacityKg(double totalCapacityKg) {
            this.totalCapacityKg = totalCapacityKg;
        }

        public int getMinimumUnits() {
            return minimumUnits;
        }

        public void setMinimumUnits(int minimumUnits) {
            this.minimumUnits = minimumUnits;
        }

        public Double getLargestUnitKg() {
            return largestUnitKg;
        }

        public void setLargestUnitKg(Double largestUnitKg) {
            this.largestUnitKg = largestUnitKg;
        }

        public String getRegulatoryReference() {
            return regulatoryReference;
        }

        public void setRegulatoryReference(String regulatoryReference) {
            this.regulatoryReference = regulatoryReference;
        }
    }
}
