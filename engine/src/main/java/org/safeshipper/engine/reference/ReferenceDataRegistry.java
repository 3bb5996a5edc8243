package org.safeshipper.engine.reference;

import org.safeshipper.engine.api.dto.ReferenceDataDto;
import org.safeshipper.engine.domain.model.ScoringPolicy;
import org.safeshipper.engine.domain.model.SegregationLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Immutable bundle of every reference table, loaded once at startup and shared by all validators.
 */
public final class ReferenceDataRegistry {

    private static final Logger LOG = Logger.getLogger(ReferenceDataRegistry.class.getName());

    private final String version;
    private final HazardClassTable hazardClasses;
    private final SegregationRuleSet segregationRules;
    private final EquipmentRequirementMap equipmentRequirements;
    private final List<FireExtinguisherRequirement> fireExtinguisherRequirements;
    private final ScoringPolicy scoringPolicy;

    public ReferenceDataRegistry(String version,
                                 HazardClassTable hazardClasses,
                                 SegregationRuleSet segregationRules,
                                 EquipmentRequirementMap equipmentRequirements,
                                 List<FireExtinguisherRequirement> fireExtinguisherRequirements,
                                 ScoringPolicy scoringPolicy) {
        this.version = version;
        this.hazardClasses = Objects.requireNonNull(hazardClasses, "hazardClasses must not be null");
        this.segregationRules = Objects.requireNonNull(segregationRules, "segregationRules must not be null");
        this.equipmentRequirements = Objects.requireNonNull(equipmentRequirements, "equipmentRequirements must not be null");
        this.fireExtinguisherRequirements = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(fireExtinguisherRequirements, "fireExtinguisherRequirements must not be null")));
        this.scoringPolicy = Objects.requireNonNull(scoringPolicy, "scoringPolicy must not be null");
    }

    /**
     * Build the registry from a reference data document.
     *
     * @throws ReferenceDataException when a mandatory table is absent or inconsistent
     */
    public static ReferenceDataRegistry fromDto(ReferenceDataDto data) {
        if (data == null) {
            throw new ReferenceDataException("Reference data document is empty");
        }
        if (data.getHazardClasses() == null || data.getHazardClasses().isEmpty()) {
            throw new ReferenceDataException("Reference data has no hazard_classes table");
        }
        if (data.getEquipmentRequirements() == null || data.getEquipmentRequirements().isEmpty()) {
            throw new ReferenceDataException("Reference data has no equipment_requirements table");
        }

        Map<String, HazardClassTable.Entry> entries = new HashMap<>();
        for (ReferenceDataDto.HazardClassDto dto : data.getHazardClasses()) {
            String code = HazardClassTable.normalize(dto.getCode());
            if (code == null || code.isEmpty() || dto.getAdrClass() == null) {
                throw new ReferenceDataException("Hazard class entry without code or adr_class");
            }
            entries.put(code, new HazardClassTable.Entry(code, dto.getAdrClass(), dto.getRiskRank(), dto.getLabel()));
        }
        HazardClassTable hazardTable = new HazardClassTable(entries);

        List<SegregationRule> rules = new ArrayList<>();
        if (data.getSegregationRules() != null) {
            for (ReferenceDataDto.SegregationRuleDto dto : data.getSegregationRules()) {
                rules.add(new SegregationRule(
                        HazardClassTable.normalize(dto.getClassA()),
                        HazardClassTable.normalize(dto.getClassB()),
                        parseLevel(dto.getLevel()),
                        dto.getNotes()));
            }
        }
        SegregationRuleSet ruleSet = new SegregationRuleSet(hazardTable.getKnownClasses(), rules);

        List<EquipmentRequirement> requirements = new ArrayList<>();
        for (ReferenceDataDto.EquipmentRequirementDto dto : data.getEquipmentRequirements()) {
            requirements.add(new EquipmentRequirement(dto.getAdrClass(), dto.getEquipmentTypeId(),
                    dto.getName(), dto.getMinimumStandard()));
        }
        EquipmentRequirementMap requirementMap = new EquipmentRequirementMap(requirements);

        List<FireExtinguisherRequirement> extinguishers = new ArrayList<>();
        if (data.getFireExtinguisherRequirements() != null) {
            for (ReferenceDataDto.FireExtinguisherRequirementDto dto : data.getFireExtinguisherRequirements()) {
                extinguishers.add(new FireExtinguisherRequirement(dto.getMaxVehicleMassKg(), dto.getTotalCapacityKg(),
                        dto.getMinimumUnits(), dto.getLargestUnitKg(), dto.getRegulatoryReference()));
            }
        }

        Map<String, Double> configMap = new HashMap<>();
        if (data.getConfig() != null) {
            for (ReferenceDataDto.ConfigItemDto item : data.getConfig()) {
                configMap.put(item.getKey(), item.getValue());
            }
        }
        ScoringPolicy policy = ScoringPolicy.fromMap(configMap);

        ReferenceDataRegistry registry = new ReferenceDataRegistry(data.getVersion(), hazardTable, ruleSet,
                requirementMap, extinguishers, policy);
        LOG.info(() -> String.format(
                "Loaded reference data %s: %d hazard classes, %d segregation rules, %d equipment requirements, %d config values",
                data.getVersion(), hazardTable.size(), ruleSet.size(), requirements.size(), configMap.size()));
        return registry;
    }

    private static SegregationLevel parseLevel(String level) {
        if (level == null) {
            throw new ReferenceDataException("Segregation rule without level");
        }
        try {
            return SegregationLevel.valueOf(level.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ReferenceDataException("Unknown segregation level: " + level, e);
        }
    }

    public String getVersion() {
        return version;
    }

    public HazardClassTable getHazardClasses() {
        return hazardClasses;
    }

    public SegregationRuleSet getSegregationRules() {
        return segregationRules;
    }

    public EquipmentRequirementMap getEquipmentRequirements() {
        return equipmentRequirements;
    }

    public List<FireExtinguisherRequirement> getFireExtinguisherRequirements() {
        return fireExtinguisherRequirements;
    }

    public ScoringPolicy getScoringPolicy() {
        return scoringPolicy;
    }
}
