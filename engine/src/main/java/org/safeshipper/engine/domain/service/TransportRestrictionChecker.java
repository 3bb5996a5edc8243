package org.safeshipper.engine.domain.service;

import org.safeshipper.engine.domain.model.VehicleSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Vehicle-level restrictions for particular ADR classes: explosives only on heavy vehicles,
 * radioactive material only on vehicles holding the matching authorisation.
 */
public final class TransportRestrictionChecker {

    public static final String EXPLOSIVES = "CLASS_1";
    public static final String RADIOACTIVE = "CLASS_7";
    public static final String RADIOACTIVE_AUTHORIZATION = "RADIOACTIVE";

    private static final Set<String> EXPLOSIVES_VEHICLE_TYPES =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList("SEMI", "RIGID")));

    public Result check(Set<String> adrClasses, VehicleSnapshot vehicle) {
        Objects.requireNonNull(adrClasses, "adrClasses must not be null");
        Objects.requireNonNull(vehicle, "vehicle must not be null");

        List<String> critical = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (adrClasses.contains(EXPLOSIVES)) {
            String type = vehicle.getVehicleType();
            if (type == null || type.trim().isEmpty()) {
                warnings.add("Vehicle type of " + vehicle.getLabel()
                        + " unknown; Class 1 explosives need a semi-trailer or rigid truck");
            } else if (!EXPLOSIVES_VEHICLE_TYPES.contains(type.trim().toUpperCase())) {
                critical.add("Class 1 explosives require a semi-trailer or rigid truck, vehicle "
                        + vehicle.getLabel() + " is a " + type.trim());
            }
        }
        if (adrClasses.contains(RADIOACTIVE) && !vehicle.hasAuthorization(RADIOACTIVE_AUTHORIZATION)) {
            critical.add("Vehicle " + vehicle.getLabel() + " is not authorised for Class 7 radioactive material");
        }
        return new Result(critical, warnings);
    }

    /**
     * Issues raised by the restriction check.
     */
    public static final class Result {
        private final List<String> criticalIssues;
        private final List<String> warnings;

        Result(List<String> criticalIssues, List<String> warnings) {
            this.criticalIssues = Collections.unmodifiableList(criticalIssues);
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public List<String> getCriticalIssues() {
            return criticalIssues;
        }

        public List<String> getWarnings() {
            return warnings;
        }
    }
}
