package org.safeshipper.engine.domain.service;

import org.safeshipper.engine.domain.model.CapacityResult;
import org.safeshipper.engine.domain.model.DgProfile;
import org.safeshipper.engine.domain.model.ScoringPolicy;
import org.safeshipper.engine.domain.model.VehicleSnapshot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Weight and volume utilisation of a vehicle for a shipment.
 *
 * Thresholds are compared exactly (load x 100 against capacity x threshold) so that a load of
 * exactly 90 % warns, exactly 100 % passes and anything above 100 % is an overload.
 */
public final class CapacityValidator {

    private static final Logger LOG = Logger.getLogger(CapacityValidator.class.getName());

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal warningPercent;
    private final BigDecimal limitPercent;

    public CapacityValidator(ScoringPolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        this.warningPercent = BigDecimal.valueOf(policy.getUtilizationWarningPercent());
        this.limitPercent = BigDecimal.valueOf(policy.getUtilizationLimitPercent());
    }

    public CapacityResult validate(VehicleSnapshot vehicle, DgProfile profile) {
        Objects.requireNonNull(vehicle, "vehicle must not be null");
        Objects.requireNonNull(profile, "profile must not be null");

        double loadKg = profile.getTotalWeightKg();
        CapacityResult.Builder result = CapacityResult.builder()
                .capacityKg(vehicle.getCapacityKg())
                .loadKg(loadKg)
                .volumeCapacityL(vehicle.getVolumeCapacityL())
                .loadVolumeL(profile.getTotalVolumeL());

        if (!vehicle.hasCapacity()) {
            result.addWarning("Vehicle " + vehicle.getLabel()
                    + " has no declared weight capacity; capacity unknown, verify load manually");
        } else {
            BigDecimal load = BigDecimal.valueOf(loadKg);
            BigDecimal capacity = BigDecimal.valueOf(vehicle.getCapacityKg());
            result.utilizationPercent(percent(load, capacity));

            BigDecimal scaledLoad = load.multiply(HUNDRED);
            if (scaledLoad.compareTo(capacity.multiply(limitPercent)) > 0) {
                BigDecimal allowed = capacity.multiply(limitPercent).divide(HUNDRED);
                BigDecimal excess = load.subtract(allowed);
                result.excessKg(excess.doubleValue());
                result.addCriticalIssue(String.format("Vehicle overloaded: %s kg exceeds capacity of %s kg by %s kg",
                        plain(load), plain(allowed), plain(excess)));
            } else if (scaledLoad.compareTo(capacity.multiply(warningPercent)) >= 0) {
                result.addWarning(String.format("High weight utilisation: %s%% of %s kg capacity",
                        plain(percent(load, capacity)), plain(capacity)));
            }
        }

        Double volumeCapacity = vehicle.getVolumeCapacityL();
        if (volumeCapacity != null && volumeCapacity > 0 && profile.getTotalVolumeL() > 0) {
            BigDecimal volume = BigDecimal.valueOf(profile.getTotalVolumeL());
            BigDecimal capacity = BigDecimal.valueOf(volumeCapacity);
            result.volumeUtilizationPercent(percent(volume, capacity));

            BigDecimal scaledVolume = volume.multiply(HUNDRED);
            if (scaledVolume.compareTo(capacity.multiply(limitPercent)) > 0) {
                result.addCriticalIssue(String.format("Volume exceeded: %s L loaded, vehicle holds %s L",
                        plain(volume), plain(capacity)));
            } else if (scaledVolume.compareTo(capacity.multiply(warningPercent)) >= 0) {
                result.addWarning(String.format("High volume utilisation: %s%% of %s L capacity",
                        plain(percent(volume, capacity)), plain(capacity)));
            }
        }

        CapacityResult built = result.build();
        LOG.fine(() -> "Capacity check for " + vehicle.getLabel() + ": " + built);
        return built;
    }

    private static Double percent(BigDecimal value, BigDecimal capacity) {
        return value.multiply(HUNDRED).divide(capacity, 2, RoundingMode.HALF_UP).doubleValue();
    }

    private static String plain(Number value) {
        return BigDecimal.valueOf(value.doubleValue()).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
