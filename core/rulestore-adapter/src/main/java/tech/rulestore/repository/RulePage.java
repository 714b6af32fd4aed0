package tech.rulestore.repository;

import tech.rulestore.model.PolicyRule;

import java.util.List;

/**
 * One page of rules read from the store.
 *
 * @param rules             the rules on this page
 * @param continuationToken opaque token to fetch the next page, null when this is the last page
 */
public record RulePage(List<PolicyRule> rules, String continuationToken) {

    public RulePage {
        rules = List.copyOf(rules);
    }

    public static RulePage last(List<PolicyRule> rules) {
        return new RulePage(rules, null);
    }

    public boolean hasMore() {
        return continuationToken != null;
    }
}
