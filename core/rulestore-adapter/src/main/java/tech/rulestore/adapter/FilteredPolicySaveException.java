package tech.rulestore.adapter;

/**
 * Thrown when a full save is attempted while the adapter holds a filtered rule set.
 * Saving it would delete every stored rule outside the filter.
 */
public class FilteredPolicySaveException extends RuleStoreException {

    public FilteredPolicySaveException() {
        super("cannot save a filtered policy");
    }
}
