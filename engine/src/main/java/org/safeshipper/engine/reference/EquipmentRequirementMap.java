package org.safeshipper.engine.reference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Required safety equipment per ADR class. Universal requirements apply to every class,
 * including the ALL_CLASSES placeholder used for general freight.
 */
public final class EquipmentRequirementMap {

    private final List<EquipmentRequirement> universal;
    private final Map<String, List<EquipmentRequirement>> byClass;

    public EquipmentRequirementMap(Collection<EquipmentRequirement> requirements) {
        List<EquipmentRequirement> universalRequirements = new ArrayList<>();
        Map<String, List<EquipmentRequirement>> classRequirements = new TreeMap<>();
        for (EquipmentRequirement requirement : requirements) {
            if (requirement.isUniversal()) {
                universalRequirements.add(requirement);
            } else {
                classRequirements.computeIfAbsent(requirement.getAdrClass(), k -> new ArrayList<>()).add(requirement);
            }
        }
        if (universalRequirements.isEmpty()) {
            throw new ReferenceDataException("Equipment requirements must define at least one "
                    + HazardClassTable.ALL_CLASSES + " entry");
        }
        this.universal = Collections.unmodifiableList(universalRequirements);
        Map<String, List<EquipmentRequirement>> frozen = new TreeMap<>();
        classRequirements.forEach((adrClass, list) -> frozen.put(adrClass, Collections.unmodifiableList(list)));
        this.byClass = Collections.unmodifiableMap(frozen);
    }

    /**
     * Requirements for a set of ADR classes: universal ones first, then class-specific ones
     * in class order. Each equipment type appears once.
     */
    public List<EquipmentRequirement> requirementsFor(Collection<String> adrClasses) {
        Map<String, EquipmentRequirement> byType = new LinkedHashMap<>();
        for (EquipmentRequirement requirement : universal) {
            byType.putIfAbsent(requirement.getEquipmentTypeId(), requirement);
        }
        for (String adrClass : new TreeSet<>(adrClasses)) {
            for (EquipmentRequirement requirement : byClass.getOrDefault(adrClass, Collections.emptyList())) {
                byType.putIfAbsent(requirement.getEquipmentTypeId(), requirement);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(byType.values()));
    }

    public List<EquipmentRequirement> getUniversalRequirements() {
        return universal;
    }
}
