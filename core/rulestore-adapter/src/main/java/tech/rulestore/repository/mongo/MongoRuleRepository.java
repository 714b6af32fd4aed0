package tech.rulestore.repository.mongo;

import com.mongodb.MongoCommandException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.result.DeleteResult;
import org.bson.BsonDocument;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.jboss.logging.Logger;
import tech.rulestore.config.RuleStoreOptions;
import tech.rulestore.model.PolicyRule;
import tech.rulestore.repository.RulePage;
import tech.rulestore.repository.RuleRepository;

import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB implementation of RuleRepository.
 *
 * Works against MongoDB and against Azure Cosmos DB through its MongoDB API.
 * The collection is partitioned by {@code pType}: sharded on a hashed key when
 * {@link RuleStoreOptions#sharded()} is set, otherwise indexed on it.
 *
 * Paging is keyset based. Pages are sorted by {@code _id} and the continuation
 * token is the id of the last document on the page, so rules deleted between
 * pages never shift the next page. Ids keep their BSON type through
 * {@link RuleIds}, which lets collections with client-assigned ids page and
 * delete correctly.
 */
public class MongoRuleRepository implements RuleRepository {

    private static final Logger LOG = Logger.getLogger(MongoRuleRepository.class);

    static final String ID = "_id";
    static final String PTYPE = "pType";

    /** Server error code when a collection already exists */
    private static final int NAMESPACE_EXISTS = 48;

    private final MongoClient mongoClient;
    private final RuleStoreOptions options;

    public MongoRuleRepository(MongoClient mongoClient, RuleStoreOptions options) {
        this.mongoClient = mongoClient;
        this.options = options;
    }

    @Override
    public void initialize() {
        ensureDatabase();
        ensureCollection();
    }

    @Override
    public void recreate() {
        LOG.infof("Dropping rule collection %s", namespace());
        getCollection().drop();
        createCollection(getDatabase());
    }

    @Override
    public RulePage findPage(Bson filter, String partitionKey, String continuationToken) {
        List<Bson> clauses = new ArrayList<>();
        if (filter != null) {
            clauses.add(filter);
        }
        if (partitionKey != null) {
            clauses.add(Filters.eq(PTYPE, partitionKey));
        }
        if (continuationToken != null) {
            clauses.add(RuleIds.after(RuleIds.decode(continuationToken)));
        }

        Bson query = switch (clauses.size()) {
            case 0 -> new BsonDocument();
            case 1 -> clauses.get(0);
            default -> Filters.and(clauses);
        };

        List<BsonDocument> documents = getCollection()
            .find(query)
            .sort(Sorts.ascending(ID))
            .limit(options.pageSize())
            .into(new ArrayList<>());

        List<PolicyRule> rules = new ArrayList<>(documents.size());
        for (BsonDocument document : documents) {
            try {
                rules.add(toRule(document));
            } catch (IllegalArgumentException e) {
                LOG.warnf("Skipping document %s in %s: %s",
                    RuleIds.encode(document.get(ID)), namespace(), e.getMessage());
            }
        }

        // A short page is the last one. Skipped documents still count towards the page.
        String nextToken = documents.size() < options.pageSize()
            ? null
            : RuleIds.encode(documents.get(documents.size() - 1).get(ID));

        LOG.debugf("Read %d rules from %s (more: %s)", rules.size(), namespace(), (Object) (nextToken != null));
        return new RulePage(rules, nextToken);
    }

    @Override
    public PolicyRule insert(PolicyRule rule) {
        ObjectId id = new ObjectId();
        getCollection().insertOne(toDocument(rule, id));
        return rule.withId(RuleIds.encode(new BsonObjectId(id)));
    }

    @Override
    public boolean delete(PolicyRule rule) {
        if (rule.id() == null) {
            throw new IllegalArgumentException("Cannot delete a rule that has no id: " + rule);
        }
        DeleteResult result = getCollection().deleteOne(Filters.and(
            Filters.eq(ID, RuleIds.decode(rule.id())),
            Filters.eq(PTYPE, rule.partitionKey())
        ));
        if (!result.wasAcknowledged()) {
            // Unacknowledged writes carry no count
            return true;
        }
        if (result.getDeletedCount() == 0) {
            LOG.warnf("Rule %s was not found in %s, nothing deleted", rule.id(), namespace());
            return false;
        }
        return true;
    }

    @Override
    public void close() {
        mongoClient.close();
    }

    private void ensureDatabase() {
        List<String> databases = mongoClient.listDatabaseNames().into(new ArrayList<>());
        if (!databases.contains(options.databaseName())) {
            // MongoDB creates the database together with its first collection
            LOG.infof("Database %s not found, creating it", options.databaseName());
        }
    }

    private void ensureCollection() {
        MongoDatabase database = getDatabase();
        List<String> collections = database.listCollectionNames().into(new ArrayList<>());
        if (collections.contains(options.collectionName())) {
            LOG.debugf("Rule collection %s exists", namespace());
            return;
        }
        LOG.infof("Rule collection %s not found, creating it", namespace());
        createCollection(database);
    }

    private void createCollection(MongoDatabase database) {
        try {
            database.createCollection(options.collectionName());
        } catch (MongoCommandException e) {
            if (e.getErrorCode() != NAMESPACE_EXISTS) {
                throw e;
            }
            // Someone else created it first and partitions it
            LOG.debugf("Rule collection %s was created concurrently", namespace());
            return;
        }
        partition();
    }

    private void partition() {
        if (options.sharded()) {
            LOG.infof("Sharding %s on hashed %s", namespace(), PTYPE);
            mongoClient.getDatabase("admin").runCommand(
                new Document("shardCollection", namespace())
                    .append("key", new Document(PTYPE, "hashed")));
        } else {
            getCollection().createIndex(Indexes.ascending(PTYPE));
        }
    }

    private MongoDatabase getDatabase() {
        return mongoClient.getDatabase(options.databaseName());
    }

    private MongoCollection<BsonDocument> getCollection() {
        return getDatabase().getCollection(options.collectionName(), BsonDocument.class);
    }

    private String namespace() {
        return options.databaseName() + "." + options.collectionName();
    }

    static BsonDocument toDocument(PolicyRule rule, ObjectId id) {
        BsonDocument document = new BsonDocument(ID, new BsonObjectId(id))
            .append(PTYPE, new BsonString(rule.pType()));
        for (int i = 0; i < PolicyRule.MAX_FIELDS; i++) {
            String value = rule.field(i);
            if (value != null) {
                document.append("v" + i, new BsonString(value));
            }
        }
        return document;
    }

    /**
     * @throws IllegalArgumentException if pType or a value field holds something other than a string
     */
    static PolicyRule toRule(BsonDocument document) {
        String pType = stringField(document, PTYPE);
        return new PolicyRule(
            RuleIds.encode(document.get(ID)),
            pType != null ? pType : "",
            stringField(document, "v0"),
            stringField(document, "v1"),
            stringField(document, "v2"),
            stringField(document, "v3"),
            stringField(document, "v4"),
            stringField(document, "v5")
        );
    }

    private static String stringField(BsonDocument document, String field) {
        BsonValue value = document.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isString()) {
            throw new IllegalArgumentException(
                "Field " + field + " holds a " + value.getBsonType() + " instead of a string");
        }
        return value.asString().getValue();
    }
}
