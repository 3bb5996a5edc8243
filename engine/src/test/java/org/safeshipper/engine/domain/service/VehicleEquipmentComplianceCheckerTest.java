package org.safeshipper.engine.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.safeshipper.engine.TestData;
import org.safeshipper.engine.domain.model.EquipmentComplianceResult;
import org.safeshipper.engine.domain.model.EquipmentFinding;
import org.safeshipper.engine.domain.model.EquipmentStatus;
import org.safeshipper.engine.domain.model.VehicleEquipmentRecord;
import org.safeshipper.engine.domain.model.VehicleSnapshot;
import org.safeshipper.engine.reference.ReferenceDataRegistry;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.safeshipper.engine.TestData.TODAY;

class VehicleEquipmentComplianceCheckerTest {

    private static final Set<String> FLAMMABLE = Collections.singleton("CLASS_3");

    private VehicleEquipmentComplianceChecker checker;

    @BeforeEach
    void setUp() {
        ReferenceDataRegistry registry = TestData.registry();
        checker = new VehicleEquipmentComplianceChecker(registry.getEquipmentRequirements(),
                registry.getFireExtinguisherRequirements(), 30);
    }

    private static VehicleEquipmentRecord extinguisher(String serial, double capacityKg) {
        return VehicleEquipmentRecord.builder(VehicleEquipmentComplianceChecker.FIRE_EXTINGUISHER)
                .serialNumber(serial)
                .expiryDate(TODAY.plusYears(1))
                .capacityKg(capacityKg)
                .build();
    }

    @Nested
    @DisplayName("dangerous goods")
    class DangerousGoods {

        @Test
        void shouldPassFullyEquippedVehicle() {
            EquipmentComplianceResult result = checker.check(FLAMMABLE, TestData.equippedVehicle("V1").build(), TODAY);

            assertThat(result.isCompliant()).isTrue();
            assertThat(result.getCompliancePercentage()).isEqualTo(100.0);
            assertThat(result.getCriticalIssues()).isEmpty();
            assertThat(result.getWarnings()).isEmpty();
            assertThat(result.getExtinguisherMarginPercent()).isNull();
        }

        @Test
        void shouldReportMissingEquipmentAsCritical() {
            VehicleSnapshot vehicle = TestData.vehicle("V1")
                    .addEquipment(TestData.equipment("FIRE_EXTINGUISHER"))
                    .build();

            EquipmentComplianceResult result = checker.check(FLAMMABLE, vehicle, TODAY);

            assertThat(result.isCompliant()).isFalse();
            assertThat(result.getMissingEquipment()).containsExactly("First Aid Kit");
            assertThat(result.getCriticalIssues()).containsExactly("Missing required equipment: First Aid Kit");
            assertThat(result.getCompliancePercentage()).isEqualTo(50.0);
        }

        @Test
        void shouldReportExpiredEquipment() {
            VehicleSnapshot vehicle = TestData.vehicle("V1")
                    .addEquipment(VehicleEquipmentRecord.builder("FIRE_EXTINGUISHER")
                            .serialNumber("FE-9")
                            .expiryDate(TODAY.minusDays(1))
                            .build())
                    .addEquipment(TestData.equipment("FIRST_AID_KIT"))
                    .build();

            EquipmentComplianceResult result = checker.check(FLAMMABLE, vehicle, TODAY);

            assertThat(result.getExpiredEquipment()).containsExactly("Fire Extinguisher");
            assertThat(result.getCriticalIssues())
                    .containsExactly("Expired equipment: Fire Extinguisher (expired 2026-10-18)");
            assertThat(result.getFindings().get(0).getSerialNumber()).isEqualTo("FE-9");
        }

        @Test
        void shouldAcceptEquipmentExpiringToday() {
            VehicleSnapshot vehicle = TestData.vehicle("V1")
                    .addEquipment(VehicleEquipmentRecord.builder("FIRE_EXTINGUISHER").expiryDate(TODAY).build())
                    .addEquipment(TestData.equipment("FIRST_AID_KIT"))
                    .build();

            EquipmentComplianceResult result = checker.check(FLAMMABLE, vehicle, TODAY);

            assertThat(result.isCompliant()).isTrue();
            assertThat(result.getWarnings())
                    .containsExactly("Equipment expiring soon: Fire Extinguisher (expires 2026-10-19)");
        }

        @Test
        void shouldReportOverdueInspection() {
            VehicleSnapshot vehicle = TestData.equippedVehicle("V1")
                    .addEquipment(VehicleEquipmentRecord.builder("EYE_WASH")
                            .nextInspectionDate(TODAY.minusDays(3))
                            .build())
                    .addEquipment(TestData.equipment("SPILL_KIT"))
                    .build();

            EquipmentComplianceResult result = checker.check(Collections.singleton("CLASS_8"), vehicle, TODAY);

            assertThat(result.getRequiredCount()).isEqualTo(4);
            assertThat(result.getInspectionOverdueEquipment()).containsExactly("Eye Wash Station");
            assertThat(result.getCriticalIssues())
                    .containsExactly("Inspection overdue: Eye Wash Station (due 2026-10-16)");
            assertThat(result.getCompliancePercentage()).isEqualTo(75.0);
        }

        @Test
        void shouldTreatInactiveEquipmentAsMissing() {
            VehicleSnapshot vehicle = TestData.vehicle("V1")
                    .addEquipment(TestData.equipment("FIRE_EXTINGUISHER"))
                    .addEquipment(VehicleEquipmentRecord.builder("FIRST_AID_KIT")
                            .status(VehicleEquipmentRecord.Status.INACTIVE)
                            .build())
                    .build();

            assertThat(checker.check(FLAMMABLE, vehicle, TODAY).getMissingEquipment())
                    .containsExactly("First Aid Kit");
        }

        @Test
        void shouldPreferCompliantRecordWhenSeveralAreInstalled() {
            VehicleSnapshot vehicle = TestData.vehicle("V1")
                    .addEquipment(VehicleEquipmentRecord.builder("FIRE_EXTINGUISHER")
                            .serialNumber("OLD")
                            .expiryDate(TODAY.minusMonths(2))
                            .build())
                    .addEquipment(VehicleEquipmentRecord.builder("FIRE_EXTINGUISHER")
                            .serialNumber("NEW")
                            .expiryDate(TODAY.plusYears(2))
                            .build())
                    .addEquipment(TestData.equipment("FIRST_AID_KIT"))
                    .build();

            EquipmentComplianceResult result = checker.check(FLAMMABLE, vehicle, TODAY);

            EquipmentFinding extinguisher = result.getFindings().get(0);
            assertThat(extinguisher.getStatus()).isEqualTo(EquipmentStatus.COMPLIANT);
            assertThat(extinguisher.getSerialNumber()).isEqualTo("NEW");
        }

        @Test
        void shouldListEachEquipmentTypeOnceForSeveralClasses() {
            Set<String> classes = new TreeSet<>();
            classes.add("CLASS_3");
            classes.add("CLASS_8");
            classes.add("CLASS_7");

            EquipmentComplianceResult result = checker.check(classes, TestData.equippedVehicle("V1").build(), TODAY);

            assertThat(result.getFindings())
                    .extracting(EquipmentFinding::getEquipmentTypeId)
                    .containsExactly("FIRE_EXTINGUISHER", "FIRST_AID_KIT", "RADIATION_DETECTOR", "SPILL_KIT", "EYE_WASH");
        }
    }

    @Nested
    @DisplayName("fire extinguisher capacity")
    class ExtinguisherCapacity {

        @Test
        void shouldReportMarginAboveRequiredCapacity() {
            VehicleSnapshot vehicle = TestData.vehicle("V1")
                    .addEquipment(extinguisher("FE-1", 3.0))
                    .addEquipment(extinguisher("FE-2", 3.0))
                    .addEquipment(TestData.equipment("FIRST_AID_KIT"))
                    .build();

            EquipmentComplianceResult result = checker.check(FLAMMABLE, vehicle, TODAY);

            // 5000 kg vehicle: 4 kg in at least 2 units
            assertThat(result.getExtinguisherMarginPercent()).isCloseTo(50.0, within(1e-9));
            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        void shouldWarnWhenTooFewUnits() {
            VehicleSnapshot vehicle = TestData.vehicle("V1")
                    .addEquipment(extinguisher("FE-1", 6.0))
                    .addEquipment(TestData.equipment("FIRST_AID_KIT"))
                    .build();

            EquipmentComplianceResult result = checker.check(FLAMMABLE, vehicle, TODAY);

            assertThat(result.getExtinguisherMarginPercent()).isNull();
            assertThat(result.getWarnings())
                    .containsExactly("Fire extinguishers: 1 installed, 2 required for this vehicle category");
            assertThat(result.isCompliant()).isTrue();
        }

        @Test
        void shouldWarnWhenTotalCapacityFallsShort() {
            VehicleSnapshot vehicle = TestData.vehicle("V1")
                    .addEquipment(extinguisher("FE-1", 1.5))
                    .addEquipment(extinguisher("FE-2", 1.5))
                    .addEquipment(TestData.equipment("FIRST_AID_KIT"))
                    .build();

            EquipmentComplianceResult result = checker.check(FLAMMABLE, vehicle, TODAY);

            assertThat(result.getExtinguisherMarginPercent()).isNull();
            assertThat(result.getWarnings()).singleElement().asString()
                    .startsWith("Fire extinguisher capacity")
                    .contains("below the");
        }

        @Test
        void shouldRequireLargeUnitForHeavyVehicle() {
            VehicleSnapshot vehicle = TestData.vehicle("V1")
                    .capacityKg(20000.0)
                    .addEquipment(extinguisher("FE-1", 3.0))
                    .addEquipment(extinguisher("FE-2", 3.0))
                    .addEquipment(extinguisher("FE-3", 3.0))
                    .addEquipment(TestData.equipment("FIRST_AID_KIT"))
                    .build();

            EquipmentComplianceResult result = checker.check(FLAMMABLE, vehicle, TODAY);

            assertThat(result.getExtinguisherMarginPercent()).isNull();
            assertThat(result.getWarnings()).singleElement().asString()
                    .startsWith("Largest fire extinguisher is");
        }
    }

    @Nested
    @DisplayName("general freight")
    class GeneralFreight {

        @Test
        void shouldReportMissingEquipmentAsWarning() {
            VehicleSnapshot vehicle = TestData.vehicle("V1")
                    .addEquipment(TestData.equipment("FIRE_EXTINGUISHER"))
                    .build();

            EquipmentComplianceResult result = checker.checkGeneralFreight(vehicle, TODAY);

            assertThat(result.getCriticalIssues()).isEmpty();
            assertThat(result.isCompliant()).isTrue();
            assertThat(result.getWarnings()).containsExactly("Missing required equipment: First Aid Kit");
            assertThat(result.getMissingEquipment()).containsExactly("First Aid Kit");
        }

        @Test
        void shouldNotCheckExtinguisherCapacity() {
            VehicleSnapshot vehicle = TestData.vehicle("V1")
                    .addEquipment(extinguisher("FE-1", 6.0))
                    .addEquipment(TestData.equipment("FIRST_AID_KIT"))
                    .build();

            EquipmentComplianceResult result = checker.checkGeneralFreight(vehicle, TODAY);

            assertThat(result.getWarnings()).isEmpty();
            assertThat(result.getExtinguisherMarginPercent()).isNull();
        }
    }
}
