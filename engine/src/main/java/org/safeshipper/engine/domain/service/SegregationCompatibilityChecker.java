package org.safeshipper.engine.domain.service;

import org.safeshipper.engine.domain.model.DgEntry;
import org.safeshipper.engine.domain.model.DgProfile;
import org.safeshipper.engine.domain.model.SegregationLevel;
import org.safeshipper.engine.domain.model.SegregationRequirement;
import org.safeshipper.engine.domain.model.SegregationResult;
import org.safeshipper.engine.reference.SegregationRule;
import org.safeshipper.engine.reference.SegregationRuleSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Checks that no two dangerous goods of a shipment form a prohibited combination.
 *
 * Every pair of entries is checked over all their primary and subsidiary classes.
 * A class the rule set does not know is never treated as compatible: it is reported
 * as a warning that requires manual review.
 */
public final class SegregationCompatibilityChecker {

    private static final Logger LOG = Logger.getLogger(SegregationCompatibilityChecker.class.getName());

    private final SegregationRuleSet rules;

    public SegregationCompatibilityChecker(SegregationRuleSet rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    public SegregationResult check(DgProfile profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        return check(profile.getEntries());
    }

    public SegregationResult check(Collection<DgEntry> dangerousGoods) {
        Objects.requireNonNull(dangerousGoods, "dangerousGoods must not be null");
        List<DgEntry> entries = new ArrayList<>(new TreeSet<>(dangerousGoods));

        Set<String> unNumbers = new TreeSet<>();
        for (DgEntry entry : entries) {
            unNumbers.add(entry.getUnNumber());
        }
        if (unNumbers.size() < 2) {
            return SegregationResult.compatible();
        }

        Set<String> conflicts = new TreeSet<>();
        Set<String> warnings = new TreeSet<>();
        Set<SegregationRequirement> requirements = new LinkedHashSet<>();
        boolean manualReview = false;

        for (int i = 0; i < entries.size(); i++) {
            for (int j = i + 1; j < entries.size(); j++) {
                DgEntry first = entries.get(i);
                DgEntry second = entries.get(j);
                if (first.getUnNumber().equals(second.getUnNumber())) {
                    continue;
                }
                for (String classA : first.getAllClasses()) {
                    for (String classB : second.getAllClasses()) {
                        Optional<SegregationRule> rule = rules.lookup(classA, classB);
                        if (!rule.isPresent()) {
                            manualReview = true;
                            warnings.add(gapWarning(classA, classB));
                            continue;
                        }
                        manualReview |= apply(rule.get(), first.getUnNumber(), classA, second.getUnNumber(), classB,
                                conflicts, warnings, requirements);
                    }
                }
            }
        }

        SegregationResult result = new SegregationResult(new ArrayList<>(conflicts), new ArrayList<>(requirements),
                new ArrayList<>(warnings), manualReview);
        if (!result.isCompatible()) {
            LOG.fine(() -> "Segregation conflicts for " + unNumbers + ": " + result.getConflicts());
        }
        return result;
    }

    /**
     * Records the consequence of one rule. Returns true when the rule calls for manual review.
     */
    private boolean apply(SegregationRule rule, String unA, String classA, String unB, String classB,
                          Set<String> conflicts, Set<String> warnings, Set<SegregationRequirement> requirements) {
        SegregationLevel level = rule.getLevel();
        if (level == SegregationLevel.COMPATIBLE) {
            return false;
        }

        // canonical order so that {A,B} and {B,A} read the same
        String left = describe(unA, classA);
        String right = describe(unB, classB);
        boolean swap = left.compareTo(right) > 0;
        String firstUn = swap ? unB : unA;
        String firstClass = swap ? classB : classA;
        String secondUn = swap ? unA : unB;
        String secondClass = swap ? classA : classB;
        String pair = describe(firstUn, firstClass) + " and " + describe(secondUn, secondClass);
        String notes = rule.getNotes() != null ? " (" + rule.getNotes() + ")" : "";

        switch (level) {
            case PROHIBITED:
                conflicts.add(pair + " must not be transported together" + notes);
                return false;
            case AWAY_FROM:
            case SEPARATED_FROM:
                requirements.add(new SegregationRequirement(firstUn, firstClass, secondUn, secondClass,
                        level, rule.getNotes()));
                warnings.add(pair + " require segregation: " + level.getMethod());
                return false;
            case CONDITIONAL:
                warnings.add(pair + " may only travel together under special conditions" + notes
                        + "; manual review required");
                return true;
            default:
                return false;
        }
    }

    private String gapWarning(String classA, String classB) {
        String unknown = rules.isKnown(classA) ? classB : classA;
        return "No segregation data for hazard class " + unknown + "; manual review required";
    }

    private static String describe(String unNumber, String hazardClass) {
        return unNumber + " (Class " + hazardClass + ")";
    }
}
