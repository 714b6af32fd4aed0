package tech.rulestore.repository;

import org.bson.conversions.Bson;
import tech.rulestore.model.PolicyRule;

/**
 * Document store holding the rule collection.
 *
 * Every call is blocking and maps to one or a few store round trips.
 * Store errors are thrown as they come from the client and are never retried.
 */
public interface RuleRepository extends AutoCloseable {

    /**
     * Make sure the database and the rule collection exist, creating them if
     * absent. The collection is partitioned by policy type.
     */
    void initialize();

    /**
     * Drop the rule collection and provision it again, empty.
     */
    void recreate();

    /**
     * Read one page of rules.
     *
     * @param filter            selector to apply, null to read every rule
     * @param partitionKey      partition to scope the read to, null to read across all partitions
     * @param continuationToken token from the previous page, null for the first page
     * @return the page, with a continuation token while more pages remain
     */
    RulePage findPage(Bson filter, String partitionKey, String continuationToken);

    /**
     * Store a rule in the partition of its policy type.
     *
     * @return the stored rule, carrying its assigned id
     */
    PolicyRule insert(PolicyRule rule);

    /**
     * Delete a stored rule by id, within the partition of its own policy type.
     *
     * @return false if no stored rule had that id, e.g. because it was already deleted
     */
    boolean delete(PolicyRule rule);

    @Override
    void close();
}
