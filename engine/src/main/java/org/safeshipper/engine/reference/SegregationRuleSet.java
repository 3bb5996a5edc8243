package org.safeshipper.engine.reference;

import org.safeshipper.engine.domain.model.SegregationLevel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only segregation table over a closed set of hazard classes.
 * Pairs of known classes without an explicit rule are compatible; a lookup involving a class
 * outside the table returns empty so callers can flag the gap for manual review.
 */
public final class SegregationRuleSet {

    private final Set<String> knownClasses;
    private final Map<String, SegregationRule> rules;

    public SegregationRuleSet(Collection<String> knownClasses, Collection<SegregationRule> rules) {
        this.knownClasses = Collections.unmodifiableSet(new TreeSet<>(knownClasses));
        Map<String, SegregationRule> byPair = new HashMap<>();
        for (SegregationRule rule : rules) {
            if (!this.knownClasses.contains(rule.getFirstClass()) || !this.knownClasses.contains(rule.getSecondClass())) {
                throw new ReferenceDataException("Segregation rule references unknown class: " + rule);
            }
            SegregationRule previous = byPair.put(rule.key(), rule);
            if (previous != null && !previous.equals(rule)) {
                throw new ReferenceDataException("Conflicting segregation rules for pair "
                        + rule.getFirstClass() + "/" + rule.getSecondClass());
            }
        }
        this.rules = Collections.unmodifiableMap(byPair);
    }

    /**
     * Maps an observed hazard class onto a class of the table, falling back to its main class
     * ("1.1" resolves to "1" when only "1" is listed). Returns null when neither is known.
     */
    public String resolve(String hazardClass) {
        String code = HazardClassTable.normalize(hazardClass);
        if (code == null) {
            return null;
        }
        if (knownClasses.contains(code)) {
            return code;
        }
        int dot = code.indexOf('.');
        if (dot > 0) {
            String mainClass = code.substring(0, dot);
            if (knownClasses.contains(mainClass)) {
                return mainClass;
            }
        }
        return null;
    }

    public boolean isKnown(String hazardClass) {
        return resolve(hazardClass) != null;
    }

    /**
     * Symmetric lookup: lookup(a, b) and lookup(b, a) always return the same rule.
     * The most specific rule wins; a rule written for a main class ("1") also covers
     * its divisions ("1.1") unless the division has a rule of its own.
     */
    public Optional<SegregationRule> lookup(String classA, String classB) {
        String first = resolve(classA);
        String second = resolve(classB);
        if (first == null || second == null) {
            return Optional.empty();
        }
        SegregationRule best = null;
        int bestSpecificity = -1;
        List<String> firstCandidates = candidates(first);
        List<String> secondCandidates = candidates(second);
        for (int i = 0; i < firstCandidates.size(); i++) {
            for (int j = 0; j < secondCandidates.size(); j++) {
                SegregationRule rule = rules.get(SegregationRule.pairKey(firstCandidates.get(i), secondCandidates.get(j)));
                if (rule == null) {
                    continue;
                }
                // 2 = both codes exact; ties go to the stricter level
                int specificity = 2 - i - j;
                if (specificity > bestSpecificity
                        || (specificity == bestSpecificity && rule.getLevel().compareTo(best.getLevel()) > 0)) {
                    best = rule;
                    bestSpecificity = specificity;
                }
            }
        }
        if (best != null) {
            return Optional.of(best);
        }
        return Optional.of(new SegregationRule(first, second, SegregationLevel.COMPATIBLE, null));
    }

    private List<String> candidates(String code) {
        List<String> result = new ArrayList<>(2);
        result.add(code);
        int dot = code.indexOf('.');
        if (dot > 0) {
            result.add(code.substring(0, dot));
        }
        return result;
    }

    public Set<String> getKnownClasses() {
        return knownClasses;
    }

    public int size() {
        return rules.size();
    }
}
