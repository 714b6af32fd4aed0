package tech.rulestore.adapter;

import tech.rulestore.model.PolicyModel;

import java.util.List;

/**
 * Persistence contract the access-control engine uses to load and store its rules.
 *
 * The engine calls {@link #loadPolicy} at startup, {@link #savePolicy} to
 * persist its whole rule set, and the add/remove operations as single rules change.
 */
public interface PolicyAdapter {

    /**
     * Load every stored rule into the model.
     *
     * @param model the engine's rule model, rules are appended to it
     */
    void loadPolicy(PolicyModel model);

    /**
     * Replace all stored rules with the rules of the model's "p" and "g" sections.
     *
     * @param model the engine's rule model
     * @throws FilteredPolicySaveException if the adapter holds a filtered rule set
     */
    void savePolicy(PolicyModel model);

    /**
     * Store one rule.
     *
     * @param sec   section of the rule ("p" or "g")
     * @param pType policy type of the rule
     * @param rule  the rule tuple
     */
    void addPolicy(String sec, String pType, List<String> rule);

    /**
     * Delete stored rules of the given type whose leading fields equal the tuple.
     *
     * @param sec   section of the rule ("p" or "g")
     * @param pType policy type of the rule
     * @param rule  the rule tuple
     */
    void removePolicy(String sec, String pType, List<String> rule);

    /**
     * Delete stored rules of the given type whose fields, starting at
     * {@code fieldIndex}, equal the given values. Empty values match any field value.
     *
     * @param sec         section of the rules ("p" or "g")
     * @param pType       policy type of the rules
     * @param fieldIndex  position of the first value, 0 for v0
     * @param fieldValues values to match
     */
    void removeFilteredPolicy(String sec, String pType, int fieldIndex, String... fieldValues);
}
