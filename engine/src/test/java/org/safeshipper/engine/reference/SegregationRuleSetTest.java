package org.safeshipper.engine.reference;

import org.junit.jupiter.api.Test;
import org.safeshipper.engine.domain.model.SegregationLevel;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SegregationRuleSetTest {

    private static final List<String> CLASSES = Arrays.asList("1", "1.1", "3", "5.1", "8", "9");

    private final SegregationRuleSet rules = new SegregationRuleSet(CLASSES, Arrays.asList(
            new SegregationRule("1", "3", SegregationLevel.PROHIBITED, "No explosives with flammables"),
            new SegregationRule("1.1", "9", SegregationLevel.AWAY_FROM, null),
            new SegregationRule("1", "9", SegregationLevel.SEPARATED_FROM, null),
            new SegregationRule("5.1", "3", SegregationLevel.PROHIBITED, null)));

    @Test
    void shouldLookUpSymmetrically() {
        for (String a : CLASSES) {
            for (String b : CLASSES) {
                assertThat(rules.lookup(a, b)).isEqualTo(rules.lookup(b, a));
            }
        }
    }

    @Test
    void shouldApplyMainClassRuleToDivision() {
        assertThat(rules.lookup("1.1", "3"))
                .hasValueSatisfying(rule -> assertThat(rule.getLevel()).isEqualTo(SegregationLevel.PROHIBITED));
    }

    @Test
    void shouldPreferDivisionRuleOverMainClassRule() {
        assertThat(rules.lookup("9", "1.1"))
                .hasValueSatisfying(rule -> assertThat(rule.getLevel()).isEqualTo(SegregationLevel.AWAY_FROM));
        assertThat(rules.lookup("9", "1"))
                .hasValueSatisfying(rule -> assertThat(rule.getLevel()).isEqualTo(SegregationLevel.SEPARATED_FROM));
    }

    @Test
    void shouldResolveUnlistedDivisionToMainClass() {
        assertThat(rules.resolve("1.4")).isEqualTo("1");
        assertThat(rules.lookup("1.4", "3"))
                .hasValueSatisfying(rule -> assertThat(rule.getLevel()).isEqualTo(SegregationLevel.PROHIBITED));
    }

    @Test
    void shouldTreatKnownPairWithoutRuleAsCompatible() {
        assertThat(rules.lookup("3", "8"))
                .hasValueSatisfying(rule -> assertThat(rule.getLevel()).isEqualTo(SegregationLevel.COMPATIBLE));
    }

    @Test
    void shouldReturnEmptyForUnknownClass() {
        assertThat(rules.lookup("3", "11")).isEmpty();
        assertThat(rules.isKnown("11")).isFalse();
    }

    @Test
    void shouldRejectRuleForUnknownClass() {
        List<SegregationRule> bad = Collections.singletonList(
                new SegregationRule("3", "4.2", SegregationLevel.SEPARATED_FROM, null));

        assertThatThrownBy(() -> new SegregationRuleSet(CLASSES, bad))
                .isInstanceOf(ReferenceDataException.class)
                .hasMessageContaining("unknown class");
    }

    @Test
    void shouldRejectContradictingRulesForSamePair() {
        List<SegregationRule> contradicting = Arrays.asList(
                new SegregationRule("3", "8", SegregationLevel.AWAY_FROM, null),
                new SegregationRule("8", "3", SegregationLevel.PROHIBITED, null));

        assertThatThrownBy(() -> new SegregationRuleSet(CLASSES, contradicting))
                .isInstanceOf(ReferenceDataException.class)
                .hasMessage("Conflicting segregation rules for pair 3/8");
    }
}
