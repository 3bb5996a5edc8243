package org.safeshipper.engine.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.safeshipper.engine.TestData;
import org.safeshipper.engine.domain.model.DgEntry;
import org.safeshipper.engine.domain.model.DgItem;
import org.safeshipper.engine.domain.model.DgProfile;
import org.safeshipper.engine.reference.HazardClassTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DangerousGoodsAggregatorTest {

    private DangerousGoodsAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new DangerousGoodsAggregator(TestData.registry().getHazardClasses());
    }

    @Nested
    @DisplayName("totals")
    class Totals {

        @Test
        void shouldSumDangerousAndTotalWeightSeparately() {
            List<DgItem> items = Arrays.asList(
                    TestData.dangerousItem("1", "UN1203", "3", 100.0),
                    DgItem.builder("2").weightKg(25.0).quantity(2).volumeL(10.0).build());

            DgProfile profile = aggregator.aggregate(items);

            assertThat(profile.getDangerousGoodsWeightKg()).isEqualTo(100.0);
            assertThat(profile.getTotalWeightKg()).isEqualTo(150.0);
            assertThat(profile.getTotalVolumeL()).isEqualTo(20.0);
            assertThat(profile.getDangerousItemCount()).isEqualTo(1);
        }

        @Test
        void shouldCountLimitedAndExceptedQuantities() {
            List<DgItem> items = Arrays.asList(
                    DgItem.builder("1").dangerousGood("UN1263", "3").limitedQuantity(true).weightKg(5.0).build(),
                    DgItem.builder("2").dangerousGood("UN1760", "8").exceptedQuantity(true).weightKg(1.0).build());

            DgProfile profile = aggregator.aggregate(items);

            assertThat(profile.getLimitedQuantityCount()).isEqualTo(1);
            assertThat(profile.getExceptedQuantityCount()).isEqualTo(1);
        }

        @Test
        void shouldKeepDecimalSumsExact() {
            List<DgItem> items = Arrays.asList(
                    TestData.dangerousItem("1", "UN1203", "3", 0.1),
                    TestData.dangerousItem("2", "UN1203", "3", 0.2));

            assertThat(aggregator.aggregate(items).getTotalWeightKg()).isCloseTo(0.3, within(1e-12));
        }

        @Test
        void shouldReturnEmptyProfileForNoItems() {
            DgProfile profile = aggregator.aggregate(Collections.<DgItem>emptyList());

            assertThat(profile.containsDangerousGoods()).isFalse();
            assertThat(profile.getHighestRiskClass()).isNull();
            assertThat(profile.getTotalWeightKg()).isZero();
        }
    }

    @Nested
    @DisplayName("classes")
    class Classes {

        @Test
        void shouldMapPrimaryAndSubsidiaryClassesToAdrClasses() {
            DgItem item = DgItem.builder("1")
                    .dangerousGood("UN1992", "3")
                    .subsidiaryHazardClasses(Collections.singletonList("6.1"))
                    .packingGroup("II")
                    .weightKg(40.0)
                    .build();

            DgProfile profile = aggregator.aggregate(Collections.singletonList(item));

            assertThat(profile.getHazardClasses()).containsExactly("3");
            assertThat(profile.getAdrClasses()).containsExactly("CLASS_3", "CLASS_6_1");
            assertThat(profile.getPackingGroups()).containsExactly("II");
            assertThat(profile.getEntries()).containsExactly(
                    new DgEntry("UN1992", "3", Collections.singletonList("6.1")));
        }

        @Test
        void shouldStripCompatibilityGroupLetter() {
            DgProfile profile = aggregator.aggregate(Collections.singletonList(
                    TestData.dangerousItem("1", "UN0336", "1.4G", 10.0)));

            assertThat(profile.getHazardClasses()).containsExactly("1.4");
            assertThat(profile.getMainHazardClasses()).containsExactly("1");
        }

        @Test
        void shouldPickHighestRiskClass() {
            List<DgItem> items = Arrays.asList(
                    TestData.dangerousItem("1", "UN1203", "3", 10.0),
                    TestData.dangerousItem("2", "UN0081", "1.1", 10.0),
                    TestData.dangerousItem("3", "UN3082", "9", 10.0));

            assertThat(aggregator.aggregate(items).getHighestRiskClass()).isEqualTo("1.1");
        }

        @Test
        void shouldBreakRiskTiesByLowestClassCode() {
            List<DgItem> items = Arrays.asList(
                    TestData.dangerousItem("1", "UN2814", "6.2", 1.0),
                    TestData.dangerousItem("2", "UN2915", "7", 1.0));

            assertThat(aggregator.aggregate(items).getHighestRiskClass()).isEqualTo("6.2");
        }

        @Test
        void shouldProduceSameProfileRegardlessOfItemOrder() {
            List<DgItem> items = new ArrayList<>(Arrays.asList(
                    TestData.dangerousItem("1", "UN1203", "3", 12.5),
                    TestData.dangerousItem("2", "UN1760", "8", 7.25),
                    TestData.generalItem("3", 3.0),
                    TestData.dangerousItem("4", "UN2814", "6.2", 1.0),
                    TestData.dangerousItem("5", "UN2915", "7", 2.0)));
            DgProfile forward = aggregator.aggregate(items);

            Collections.reverse(items);
            DgProfile reversed = aggregator.aggregate(items);

            assertThat(reversed).isEqualTo(forward);
        }

        @Test
        void shouldKeepEntriesThatDifferOnlyInSubsidiaryClasses() {
            DgItem plain = TestData.dangerousItem("1", "UN1000", "9", 5.0);
            DgItem oxidizing = DgItem.builder("2")
                    .dangerousGood("UN1000", "9")
                    .subsidiaryHazardClasses(Collections.singletonList("5.1"))
                    .weightKg(5.0)
                    .build();
            DgItem flammable = TestData.dangerousItem("3", "UN1203", "3", 20.0);

            DgProfile plainFirst = aggregator.aggregate(Arrays.asList(plain, oxidizing, flammable));
            DgProfile oxidizingFirst = aggregator.aggregate(Arrays.asList(oxidizing, plain, flammable));

            assertThat(oxidizingFirst).isEqualTo(plainFirst);
            assertThat(plainFirst.getEntries()).containsExactly(
                    new DgEntry("UN1000", "9", Collections.<String>emptyList()),
                    new DgEntry("UN1000", "9", Collections.singletonList("5.1")),
                    new DgEntry("UN1203", "3", Collections.<String>emptyList()));
        }
    }

    @Nested
    @DisplayName("data problems")
    class DataProblems {

        @Test
        void shouldReportMissingUnNumber() {
            DgItem item = DgItem.builder("A7").dangerousGood(true).hazardClass("3").weightKg(5.0).build();

            DgProfile profile = aggregator.aggregate(Collections.singletonList(item));

            assertThat(profile.getIntegrityIssues())
                    .containsExactly("Item A7 is flagged as dangerous goods but has no UN number");
            assertThat(profile.getHazardClasses()).containsExactly("3");
            assertThat(profile.getEntries()).isEmpty();
        }

        @Test
        void shouldReportMissingHazardClass() {
            DgItem item = DgItem.builder("B2").dangerousGood(true).unNumber("UN1203").weightKg(5.0).build();

            DgProfile profile = aggregator.aggregate(Collections.singletonList(item));

            assertThat(profile.getIntegrityIssues())
                    .containsExactly("Item B2 is flagged as dangerous goods but has no hazard class");
            assertThat(profile.getHazardClasses()).isEmpty();
        }

        @Test
        void shouldFlagUnmappedClassAndRequireAllClassEquipment() {
            DgProfile profile = aggregator.aggregate(Collections.singletonList(
                    TestData.dangerousItem("1", "UN9999", "11", 5.0)));

            assertThat(profile.getAdrClasses()).containsExactly(HazardClassTable.ALL_CLASSES);
            assertThat(profile.getReferenceGaps())
                    .containsExactly("Hazard class 11 has no ADR class mapping; manual review required");
        }
    }
}
