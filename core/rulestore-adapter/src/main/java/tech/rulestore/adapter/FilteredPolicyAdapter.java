package tech.rulestore.adapter;

import tech.rulestore.model.PolicyModel;

/**
 * Adapter that can load a subset of the stored rules.
 *
 * An engine using a filtered adapter does not load all rules on its own.
 * It calls {@link #loadFilteredPolicy} itself.
 */
public interface FilteredPolicyAdapter extends PolicyAdapter {

    /**
     * Load the stored rules matching the filter into the model.
     *
     * @param model  the engine's rule model
     * @param filter store-specific filter, or null to load every rule
     */
    void loadFilteredPolicy(PolicyModel model, Object filter);

    /**
     * @return true if the rules last loaded are a filtered subset of the store
     */
    boolean isFiltered();
}
