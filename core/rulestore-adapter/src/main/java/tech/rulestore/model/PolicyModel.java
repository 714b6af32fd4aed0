package tech.rulestore.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory rule set of the access-control engine.
 *
 * Rules are grouped by section ("p", "g") and then by policy type
 * ("p", "p2", "g", "g2", ...). Each bucket keeps its rules in insertion order.
 * Buckets are created on first use.
 */
public class PolicyModel {

    public static final String POLICY_SECTION = "p";
    public static final String GROUPING_SECTION = "g";

    private final Map<String, Map<String, List<List<String>>>> sections = new LinkedHashMap<>();

    /**
     * Append a rule tuple to the bucket of the given section and policy type.
     */
    public void addRule(String section, String pType, List<String> rule) {
        sections.computeIfAbsent(section, s -> new LinkedHashMap<>())
            .computeIfAbsent(pType, t -> new ArrayList<>())
            .add(List.copyOf(rule));
    }

    /**
     * Append a stored rule to the bucket its policy type belongs to.
     */
    public void addRule(PolicyRule rule) {
        addRule(rule.section(), rule.pType(), rule.values());
    }

    /**
     * All buckets of a section, keyed by policy type. Empty if the section has no rules.
     */
    public Map<String, List<List<String>>> section(String section) {
        Map<String, List<List<String>>> buckets = sections.get(section);
        return buckets == null ? Map.of() : Collections.unmodifiableMap(buckets);
    }

    /**
     * Rules of one policy type. Empty if none have been added.
     */
    public List<List<String>> rules(String section, String pType) {
        List<List<String>> rules = section(section).get(pType);
        return rules == null ? List.of() : Collections.unmodifiableList(rules);
    }

    public boolean hasRule(String section, String pType, List<String> rule) {
        return rules(section, pType).contains(rule);
    }

    public int size() {
        return sections.values().stream()
            .flatMap(buckets -> buckets.values().stream())
            .mapToInt(List::size)
            .sum();
    }

    public void clear() {
        sections.clear();
    }
}
