package tech.rulestore.config;

/**
 * Settings applied when a rule store adapter is constructed.
 *
 * Start from {@link #defaults()} and override what differs:
 * <pre>
 * RuleStoreOptions.defaults().withDatabase("authz").withCollection("rules")
 * </pre>
 */
public record RuleStoreOptions(
    /**
     * Database holding the rule collection.
     */
    String databaseName,

    /**
     * Collection holding one document per rule.
     */
    String collectionName,

    /**
     * Number of rules fetched per page when reading.
     */
    int pageSize,

    /**
     * Shard the collection on a hashed policy type key when creating it.
     * Needs a sharded cluster or Cosmos DB; a plain replica set only gets an index.
     */
    boolean sharded
) {

    public static final String DEFAULT_DATABASE = "casbin";
    public static final String DEFAULT_COLLECTION = "casbin_rule";
    public static final int DEFAULT_PAGE_SIZE = 100;

    public RuleStoreOptions {
        if (databaseName == null || databaseName.isBlank()) {
            throw new IllegalArgumentException("Database name must not be blank");
        }
        if (collectionName == null || collectionName.isBlank()) {
            throw new IllegalArgumentException("Collection name must not be blank");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
    }

    public static RuleStoreOptions defaults() {
        return new RuleStoreOptions(DEFAULT_DATABASE, DEFAULT_COLLECTION, DEFAULT_PAGE_SIZE, false);
    }

    /**
     * Options taken from the {@code rule-store.*} configuration.
     */
    public static RuleStoreOptions from(RuleStoreConfig config) {
        return new RuleStoreOptions(config.database(), config.collection(), config.pageSize(), config.sharded());
    }

    public RuleStoreOptions withDatabase(String database) {
        return new RuleStoreOptions(database, collectionName, pageSize, sharded);
    }

    public RuleStoreOptions withCollection(String collection) {
        return new RuleStoreOptions(databaseName, collection, pageSize, sharded);
    }

    public RuleStoreOptions withPageSize(int size) {
        return new RuleStoreOptions(databaseName, collectionName, size, sharded);
    }

    public RuleStoreOptions withSharded(boolean shard) {
        return new RuleStoreOptions(databaseName, collectionName, pageSize, shard);
    }
}
