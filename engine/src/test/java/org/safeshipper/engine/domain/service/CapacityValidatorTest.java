package org.safeshipper.engine.domain.service;

import org.junit.jupiter.api.Test;
import org.safeshipper.engine.TestData;
import org.safeshipper.engine.domain.model.CapacityResult;
import org.safeshipper.engine.domain.model.DgProfile;
import org.safeshipper.engine.domain.model.ScoringPolicy;
import org.safeshipper.engine.domain.model.VehicleSnapshot;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class CapacityValidatorTest {

    private final CapacityValidator validator = new CapacityValidator(ScoringPolicy.defaults());

    private static DgProfile load(double weightKg) {
        return DgProfile.builder().totalWeightKg(weightKg).build();
    }

    @Test
    void shouldComputeUtilisation() {
        CapacityResult result = validator.validate(TestData.vehicle("V1").build(), load(100.0));

        assertThat(result.getUtilizationPercent()).isEqualTo(2.0);
        assertThat(result.getCriticalIssues()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();
        assertThat(result.isOverloaded()).isFalse();
    }

    @Test
    void shouldStayQuietJustBelowWarningThreshold() {
        CapacityResult result = validator.validate(TestData.vehicle("V1").build(), load(4499.5));

        assertThat(result.getUtilizationPercent()).isEqualTo(89.99);
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void shouldWarnAtExactlyWarningThreshold() {
        CapacityResult result = validator.validate(TestData.vehicle("V1").build(), load(4500.0));

        assertThat(result.getWarnings()).containsExactly("High weight utilisation: 90.00% of 5000.00 kg capacity");
        assertThat(result.getCriticalIssues()).isEmpty();
    }

    @Test
    void shouldAcceptLoadAtExactlyFullCapacity() {
        CapacityResult result = validator.validate(TestData.vehicle("V1").build(), load(5000.0));

        assertThat(result.getUtilizationPercent()).isEqualTo(100.0);
        assertThat(result.getCriticalIssues()).isEmpty();
        assertThat(result.isOverloaded()).isFalse();
    }

    @Test
    void shouldRejectLoadJustAboveCapacity() {
        CapacityResult result = validator.validate(TestData.vehicle("V1").build(), load(5000.5));

        assertThat(result.isOverloaded()).isTrue();
        assertThat(result.getExcessKg()).isEqualTo(0.5);
        assertThat(result.getCriticalIssues())
                .containsExactly("Vehicle overloaded: 5000.50 kg exceeds capacity of 5000.00 kg by 0.50 kg");
    }

    @Test
    void shouldUseConfiguredThresholds() {
        CapacityValidator lenient = new CapacityValidator(ScoringPolicy.fromMap(
                Collections.singletonMap(ScoringPolicy.UTILIZATION_LIMIT_PERCENT, 110.0)));

        CapacityResult result = lenient.validate(TestData.vehicle("V1").build(), load(5400.0));

        assertThat(result.getCriticalIssues()).isEmpty();
        assertThat(result.getWarnings()).hasSize(1);
    }

    @Test
    void shouldWarnWhenCapacityUnknown() {
        VehicleSnapshot vehicle = VehicleSnapshot.builder("V9").build();

        CapacityResult result = validator.validate(vehicle, load(100.0));

        assertThat(result.isCapacityKnown()).isFalse();
        assertThat(result.getUtilizationPercent()).isNull();
        assertThat(result.getWarnings()).containsExactly(
                "Vehicle V9 has no declared weight capacity; capacity unknown, verify load manually");
    }

    @Test
    void shouldRejectExcessVolume() {
        VehicleSnapshot vehicle = TestData.vehicle("V1").volumeCapacityL(1000.0).build();
        DgProfile profile = DgProfile.builder().totalWeightKg(100.0).totalVolumeL(1200.0).build();

        CapacityResult result = validator.validate(vehicle, profile);

        assertThat(result.getVolumeUtilizationPercent()).isEqualTo(120.0);
        assertThat(result.getCriticalIssues())
                .containsExactly("Volume exceeded: 1200.00 L loaded, vehicle holds 1000.00 L");
    }
}
