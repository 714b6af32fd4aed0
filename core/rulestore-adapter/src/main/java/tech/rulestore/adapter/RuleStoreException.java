package tech.rulestore.adapter;

/**
 * Base class for errors raised by the rule store adapter itself.
 *
 * Errors from the document store client are not wrapped in this type;
 * they reach the caller as thrown by the client.
 */
public class RuleStoreException extends RuntimeException {

    public RuleStoreException(String message) {
        super(message);
    }

    public RuleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
