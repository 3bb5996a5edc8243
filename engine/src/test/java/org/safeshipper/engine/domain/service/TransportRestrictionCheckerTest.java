package org.safeshipper.engine.domain.service;

import org.junit.jupiter.api.Test;
import org.safeshipper.engine.TestData;
import org.safeshipper.engine.domain.model.VehicleSnapshot;

import java.util.Collections;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TransportRestrictionCheckerTest {

    private static final Set<String> EXPLOSIVES = Collections.singleton(TransportRestrictionChecker.EXPLOSIVES);
    private static final Set<String> RADIOACTIVE = Collections.singleton(TransportRestrictionChecker.RADIOACTIVE);

    private final TransportRestrictionChecker checker = new TransportRestrictionChecker();

    @Test
    void shouldAllowExplosivesOnRigidTruck() {
        TransportRestrictionChecker.Result result = checker.check(EXPLOSIVES, TestData.vehicle("V1").build());

        assertThat(result.getCriticalIssues()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void shouldRejectExplosivesOnVan() {
        VehicleSnapshot van = TestData.vehicle("V1").vehicleType("van").build();

        assertThat(checker.check(EXPLOSIVES, van).getCriticalIssues()).containsExactly(
                "Class 1 explosives require a semi-trailer or rigid truck, vehicle REG-V1 is a van");
    }

    @Test
    void shouldWarnWhenVehicleTypeUnknown() {
        VehicleSnapshot vehicle = TestData.vehicle("V1").vehicleType(null).build();

        TransportRestrictionChecker.Result result = checker.check(EXPLOSIVES, vehicle);

        assertThat(result.getCriticalIssues()).isEmpty();
        assertThat(result.getWarnings()).hasSize(1);
    }

    @Test
    void shouldRequireRadioactiveAuthorisation() {
        assertThat(checker.check(RADIOACTIVE, TestData.vehicle("V1").build()).getCriticalIssues())
                .containsExactly("Vehicle REG-V1 is not authorised for Class 7 radioactive material");

        VehicleSnapshot authorised = TestData.vehicle("V2")
                .authorizations(Collections.singleton(TransportRestrictionChecker.RADIOACTIVE_AUTHORIZATION))
                .build();
        assertThat(checker.check(RADIOACTIVE, authorised).getCriticalIssues()).isEmpty();
    }

    @Test
    void shouldIgnoreOtherClasses() {
        VehicleSnapshot van = TestData.vehicle("V1").vehicleType("VAN").build();

        assertThat(checker.check(Collections.singleton("CLASS_3"), van).getCriticalIssues()).isEmpty();
    }
}
