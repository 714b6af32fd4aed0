package tech.rulestore.adapter;

/**
 * The adapter could not connect to the store or provision its database and collection.
 * No adapter exists when this is thrown.
 */
public class RuleStoreInitializationException extends RuleStoreException {

    public RuleStoreInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
