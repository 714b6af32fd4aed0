package tech.rulestore.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the rule store adapter.
 */
@ConfigMapping(prefix = "rule-store")
public interface RuleStoreConfig {

    /**
     * MongoDB connection string, e.g. mongodb://localhost:27017
     * or a Cosmos DB for MongoDB connection string.
     */
    String connectionString();

    /**
     * Database name.
     */
    @WithDefault(RuleStoreOptions.DEFAULT_DATABASE)
    String database();

    /**
     * Collection holding the rules.
     */
    @WithDefault(RuleStoreOptions.DEFAULT_COLLECTION)
    String collection();

    /**
     * Rules fetched per page when loading.
     */
    @WithDefault("100")
    int pageSize();

    /**
     * Shard the rule collection on the policy type when creating it.
     */
    @WithDefault("false")
    boolean sharded();

    /**
     * Start in filtered mode. The engine then has to load a rule subset itself,
     * and full saves are refused until an unfiltered load.
     */
    @WithDefault("false")
    boolean filtered();
}
